package com.codeheadsystems.quire.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a newly registered account. Never carries the credential hash.
 * <p>
 * Used by: {@code POST /api/register}
 *
 * @param accountId   server-assigned account identifier
 * @param identity    the normalized login identifier
 * @param displayName the display name
 */
public record AccountResponse(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("identity") String identity,
    @JsonProperty("displayName") String displayName) {
}
