package com.codeheadsystems.quire.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity behind a session token.
 * <p>
 * Used by: {@code GET /api/whoami}
 *
 * @param identity    the normalized login identifier
 * @param displayName the display name
 */
public record WhoAmIResponse(
    @JsonProperty("identity") String identity,
    @JsonProperty("displayName") String displayName) {
}
