package com.project.image.threshold.controller;

import com.project.image.threshold.DTOs.ThresholdStatus;
import com.project.image.threshold.DTOs.ThresholdValue;
import com.project.image.threshold.service.ImageCodec;
import com.project.image.threshold.service.StorageService;
import com.project.image.threshold.service.ThresholdPresenter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Controller
@Validated
public class ThresholdController {
    private static final Logger log = LoggerFactory.getLogger(ThresholdController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/tiff"
    );
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024; // 10MB

    private final ThresholdPresenter presenter;

    public ThresholdController(ThresholdPresenter presenter) {
        this.presenter = presenter;
    }

    @GetMapping("/threshold")
    public String showEditor(Model model) {
        model.addAttribute("minThreshold", ThresholdValue.MIN);
        model.addAttribute("maxThreshold", ThresholdValue.MAX);
        model.addAttribute("status", presenter.status());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        return "threshold";
    }

    @PostMapping(value = "/threshold/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseBody
    public ThresholdStatus uploadImage(@RequestParam("file") @NotNull MultipartFile file) throws IOException {
        validateUploadedFile(file);
        log.info("Loading file: {} ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);
        try (var inputStream = file.getInputStream()) {
            return presenter.load(inputStream);
        }
    }

    @PostMapping("/threshold/value")
    @ResponseBody
    public ThresholdStatus requestThreshold(
            @RequestParam("value")
            @Min(value = ThresholdValue.MIN, message = "Threshold must be at least 1")
            @Max(value = ThresholdValue.MAX, message = "Threshold must be at most 255")
            int value) {
        return presenter.requestThreshold(value);
    }

    @GetMapping("/threshold/status")
    @ResponseBody
    public ThresholdStatus status() {
        return presenter.status();
    }

    @GetMapping("/threshold/preview")
    public ResponseEntity<byte[]> preview(@RequestParam(name = "width", defaultValue = "600") int width,
                                          @RequestParam(name = "height", defaultValue = "400") int height) {
        byte[] png = presenter.renderPreview(width, height);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .contentType(MediaType.IMAGE_PNG)
                .body(png);
    }

    @PostMapping("/threshold/save")
    @ResponseBody
    public Map<String, String> save(@RequestParam(name = "format", defaultValue = "png") String format) {
        StorageService.StoredFile stored = presenter.save(format);
        ImageCodec.Format chosen = ImageCodec.Format.fromName(format);
        return Map.of(
                "path", "/" + stored.relativeWebPath(),
                "filename", stored.filename(),
                "format", chosen.name().toLowerCase()
        );
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file type: " + contentType +
                            ". Supported types: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }
        // on top of spring.servlet.multipart.max-file-size
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("The file is too large. Maximum size: 10MB");
        }
    }
}
