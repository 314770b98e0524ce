package com.warden.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/confirmations/{id}/response.
 *
 * @param approved true to approve, false to deny; required
 * @param resolver identity of the approver; nullable; defaults to "user"
 */
public record ConfirmationResponseRequest(Boolean approved, String resolver) {}
