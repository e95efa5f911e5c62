package com.maildraft.interfaces.api.dto;

public record ErrorResponse(String code, String message, String correlationId) {}
