package com.auscomply.api.error;

public record ErrorResponse(String code, String message) {}
