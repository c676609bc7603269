package com.project.image.threshold.DTOs;

public record ErrorResponse(String error, String message) {}
