package com.project.image.threshold.service;

import com.project.image.threshold.DTOs.ImageSnapshot;
import com.project.image.threshold.DTOs.PixelBuffer;
import com.project.image.threshold.exceptions.NoImageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole owner of the source image. The lock is held only to swap or read the reference,
 * never while a compute pass runs, so loading a new image does not wait for the worker.
 * Buffers are immutable, so the reference handed out by {@link #snapshot()} stays consistent.
 */
@Component
public class ImageStore {
    private static final Logger log = LoggerFactory.getLogger(ImageStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final ResultCache cache;

    private PixelBuffer buffer;
    private long sourceVersion;

    public ImageStore(ResultCache cache) {
        this.cache = cache;
    }

    /** Replaces the image, bumps the source version and drops every cached render. */
    public long setImage(PixelBuffer image) {
        if (image == null) {
            throw new IllegalArgumentException("Image must not be null");
        }
        long version;
        lock.lock();
        try {
            buffer = image;
            version = ++sourceVersion;
            // inside the lock so no snapshot of the new version can meet a stale cache entry
            cache.invalidateAll();
        } finally {
            lock.unlock();
        }
        log.info("Image {} stored as source version {}", image, version);
        return version;
    }

    public ImageSnapshot snapshot() {
        lock.lock();
        try {
            if (buffer == null) {
                throw new NoImageException("No image loaded");
            }
            return new ImageSnapshot(buffer, sourceVersion);
        } finally {
            lock.unlock();
        }
    }

    public long currentVersion() {
        lock.lock();
        try {
            return sourceVersion;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasImage() {
        lock.lock();
        try {
            return buffer != null;
        } finally {
            lock.unlock();
        }
    }

    /** Drops the image. The version counter keeps counting so old results stay recognisably stale. */
    public void clear() {
        lock.lock();
        try {
            buffer = null;
            sourceVersion++;
            cache.invalidateAll();
        } finally {
            lock.unlock();
        }
    }
}
