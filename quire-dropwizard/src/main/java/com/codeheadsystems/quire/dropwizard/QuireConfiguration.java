package com.codeheadsystems.quire.dropwizard;

import com.codeheadsystems.quire.server.resource.SessionCookies;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for the Quire auth API.
 * <p>
 * For production, use {@code storageType: file} with a {@code storageDirectory} on durable
 * storage, list the front-end's exact origin(s) in {@code allowedOrigins}, and keep
 * {@code sessionCookieSecure} enabled. The in-memory store is for dev/test only: every account
 * is lost on restart.
 */
public class QuireConfiguration extends Configuration {

  /**
   * Credential store backend.
   */
  @NotNull
  private StorageType storageType = StorageType.MEMORY;

  /**
   * Root directory of the file store. Ignored for {@code memory}.
   */
  private String storageDirectory = "data";

  /**
   * Upper bound on a credential store write, waiting for earlier writes included. Past it the
   * request fails with 503.
   */
  @Min(1)
  private long storageTimeoutMillis = 2000;

  /**
   * Session lifetime in seconds.
   */
  @Min(1)
  private long sessionTtlSeconds = 3600;

  /**
   * When true, each successful validation pushes expiry to now + ttl.
   */
  private boolean slidingSessions = false;

  /**
   * How often expired and revoked sessions are purged. 0 disables the sweeper.
   */
  @Min(0)
  private long sessionSweepIntervalSeconds = 60;

  /**
   * Argon2id memory cost in kibibytes.
   */
  @Min(8)
  private int argon2MemoryKib = 65536;

  /**
   * Argon2id iteration count.
   */
  @Min(1)
  private int argon2Iterations = 3;

  /**
   * Argon2id parallelism.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * Shortest credential accepted at registration.
   */
  @Min(1)
  @Max(1024)
  private int minimumCredentialLength = 8;

  /**
   * Origins allowed to receive credentialed cross-origin responses. Exact match, no wildcards.
   */
  @NotNull
  private List<String> allowedOrigins = new ArrayList<>();

  /**
   * When true, login sets the session cookie, logout clears it, and requests may present it.
   */
  private boolean sessionCookieEnabled = true;

  @NotEmpty
  private String sessionCookieName = SessionCookies.DEFAULT_COOKIE_NAME;

  /**
   * Adds the {@code Secure} attribute. Only disable for plain-HTTP local development.
   */
  private boolean sessionCookieSecure = true;

  /**
   * Requests with a {@code Content-Length} above this are rejected with 413 before the body is
   * read.
   */
  @Min(1)
  private long maxRequestBodyBytes = 16384;

  @JsonProperty
  public StorageType getStorageType() {
    return storageType;
  }

  @JsonProperty
  public void setStorageType(StorageType storageType) {
    this.storageType = storageType;
  }

  @JsonProperty
  public String getStorageDirectory() {
    return storageDirectory;
  }

  @JsonProperty
  public void setStorageDirectory(String storageDirectory) {
    this.storageDirectory = storageDirectory;
  }

  @JsonProperty
  public long getStorageTimeoutMillis() {
    return storageTimeoutMillis;
  }

  @JsonProperty
  public void setStorageTimeoutMillis(long storageTimeoutMillis) {
    this.storageTimeoutMillis = storageTimeoutMillis;
  }

  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  @JsonProperty
  public boolean isSlidingSessions() {
    return slidingSessions;
  }

  @JsonProperty
  public void setSlidingSessions(boolean slidingSessions) {
    this.slidingSessions = slidingSessions;
  }

  @JsonProperty
  public long getSessionSweepIntervalSeconds() {
    return sessionSweepIntervalSeconds;
  }

  @JsonProperty
  public void setSessionSweepIntervalSeconds(long sessionSweepIntervalSeconds) {
    this.sessionSweepIntervalSeconds = sessionSweepIntervalSeconds;
  }

  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  @JsonProperty
  public int getMinimumCredentialLength() {
    return minimumCredentialLength;
  }

  @JsonProperty
  public void setMinimumCredentialLength(int minimumCredentialLength) {
    this.minimumCredentialLength = minimumCredentialLength;
  }

  @JsonProperty
  public List<String> getAllowedOrigins() {
    return allowedOrigins;
  }

  @JsonProperty
  public void setAllowedOrigins(List<String> allowedOrigins) {
    this.allowedOrigins = allowedOrigins;
  }

  @JsonProperty
  public boolean isSessionCookieEnabled() {
    return sessionCookieEnabled;
  }

  @JsonProperty
  public void setSessionCookieEnabled(boolean sessionCookieEnabled) {
    this.sessionCookieEnabled = sessionCookieEnabled;
  }

  @JsonProperty
  public String getSessionCookieName() {
    return sessionCookieName;
  }

  @JsonProperty
  public void setSessionCookieName(String sessionCookieName) {
    this.sessionCookieName = sessionCookieName;
  }

  @JsonProperty
  public boolean isSessionCookieSecure() {
    return sessionCookieSecure;
  }

  @JsonProperty
  public void setSessionCookieSecure(boolean sessionCookieSecure) {
    this.sessionCookieSecure = sessionCookieSecure;
  }

  @JsonProperty
  public long getMaxRequestBodyBytes() {
    return maxRequestBodyBytes;
  }

  @JsonProperty
  public void setMaxRequestBodyBytes(long maxRequestBodyBytes) {
    this.maxRequestBodyBytes = maxRequestBodyBytes;
  }
}
