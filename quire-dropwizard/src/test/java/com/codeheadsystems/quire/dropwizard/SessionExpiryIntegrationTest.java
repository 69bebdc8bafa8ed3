package com.codeheadsystems.quire.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.quire.model.LoginRequest;
import com.codeheadsystems.quire.model.LoginResponse;
import com.codeheadsystems.quire.model.RegisterRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Session lifetime as seen over HTTP, with the bundle running on a hand-driven clock.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class SessionExpiryIntegrationTest {

  static final MutableClock CLOCK = new MutableClock(Instant.now());

  /** Test application whose bundle reads time from {@link #CLOCK}. */
  public static class ClockedApplication extends Application<QuireConfiguration> {
    @Override
    public void initialize(Bootstrap<QuireConfiguration> bootstrap) {
      bootstrap.addBundle(new QuireBundle<>(null, null, CLOCK));
    }

    @Override
    public void run(QuireConfiguration configuration, Environment environment) {
      // Everything is registered by the bundle
    }
  }

  static final DropwizardAppExtension<QuireConfiguration> APP =
      new DropwizardAppExtension<>(
          ClockedApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private final HttpClient httpClient = HttpClient.newBuilder()
      .version(HttpClient.Version.HTTP_1_1).build();

  private String baseUrl() {
    return "http://localhost:" + APP.getLocalPort();
  }

  private HttpResponse<String> post(String path, Object body) throws Exception {
    ObjectMapper mapper = APP.getObjectMapper();
    return httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
            .build(),
        HttpResponse.BodyHandlers.ofString());
  }

  private int whoamiStatus(String token) throws Exception {
    return httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + "/api/whoami"))
            .header("Authorization", "Bearer " + token)
            .GET()
            .build(),
        HttpResponse.BodyHandlers.ofString()).statusCode();
  }

  @Test
  void token_expiresAfterConfiguredTtl() throws Exception {
    post("/api/register", new RegisterRequest("clock@example.com", "correct-horse-battery", "Clock"));
    HttpResponse<String> login = post("/api/login", new LoginRequest("clock@example.com", "correct-horse-battery"));
    LoginResponse session = APP.getObjectMapper().readValue(login.body(), LoginResponse.class);

    assertThat(session.expiresAtInstant()).isEqualTo(CLOCK.instant().plus(Duration.ofSeconds(1800)));
    assertThat(whoamiStatus(session.token())).isEqualTo(200);

    CLOCK.advance(Duration.ofSeconds(1799));
    assertThat(whoamiStatus(session.token())).isEqualTo(200);

    CLOCK.advance(Duration.ofSeconds(1));
    assertThat(whoamiStatus(session.token())).isEqualTo(401);
  }
}
