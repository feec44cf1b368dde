package dev.whispr.api;

import java.util.UUID;

/**
 * The authenticated user a request is made for, as asserted by the upstream gateway.
 *
 * @param id the viewer's user id
 */
public record Viewer(UUID id) {}
