package com.spantagger.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
