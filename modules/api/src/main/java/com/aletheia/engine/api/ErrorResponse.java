package com.aletheia.engine.api;

/**
 * Body of every error response: a short machine-readable code plus the exception message.
 */
public record ErrorResponse(String error, String message) {
}
