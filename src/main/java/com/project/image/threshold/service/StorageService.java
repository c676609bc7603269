package com.project.image.threshold.service;

import com.project.image.threshold.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path rootDir;

    public StorageService(@Value("${app.output.dir:outputs}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using output directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create output directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    /** Writes an encoded result under a timestamped name with the given extension. */
    public StoredFile storeResultImage(byte[] encoded, String extension) {
        if (encoded == null || encoded.length == 0) {
            throw new StorageException("Nothing to store");
        }
        String safeExtension = extension == null ? "png" : extension.replaceAll("[^a-zA-Z0-9]", "");
        if (safeExtension.isEmpty()) {
            safeExtension = "png";
        }
        String filename = STAMP.format(LocalDateTime.now()) + "_threshold." + safeExtension;
        Path target = rootDir.resolve(filename);
        try {
            Files.write(target, encoded);
            log.info("Stored result image {}", target);
            return new StoredFile(target, filename, "outputs/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store result image", e);
        }
    }

    public Path rootDir() {
        return rootDir;
    }
}
