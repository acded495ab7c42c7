package com.healthauth.api.error;

/**
 * Error body returned by every endpoint. {@code code} carries the rejection kind verbatim.
 */
public record ErrorResponse(String code, String message) {}
