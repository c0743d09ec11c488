package com.adkstream.app.web;

/**
 * JSON error body for the REST endpoints.
 */
public record ErrorResponse(String error) {
}
