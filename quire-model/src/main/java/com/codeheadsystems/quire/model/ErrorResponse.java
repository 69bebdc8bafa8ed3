package com.codeheadsystems.quire.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every non-2xx response.
 *
 * @param error   stable machine-readable code, e.g. {@code InvalidCredentials}
 * @param message generic human-readable text with no internal detail
 */
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message) {
}
