package io.conformanceapi.core;

/**
 * Request for {@code GET /}. Carries no fields.
 */
public record GetApiInfoRequest() {}
