package com.codeheadsystems.quire.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(DropwizardExtensionsSupport.class)
class CorsIntegrationTest {

  static final DropwizardAppExtension<QuireConfiguration> APP =
      new DropwizardAppExtension<>(
          QuireApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String ALLOWED = "https://app.quire.example";

  private final HttpClient httpClient = HttpClient.newBuilder()
      .version(HttpClient.Version.HTTP_1_1).build();

  private HttpResponse<String> send(String method, String path, String origin) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create("http://localhost:" + APP.getLocalPort() + path))
        .method(method, HttpRequest.BodyPublishers.noBody());
    if (origin != null) {
      builder.header("Origin", origin);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  @Test
  void allowedOrigin_isEchoedWithCredentials() throws Exception {
    HttpResponse<String> response = send("GET", "/api/whoami", ALLOWED);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).hasValue(ALLOWED);
    assertThat(response.headers().firstValue("Access-Control-Allow-Credentials")).hasValue("true");
    assertThat(response.headers().allValues("Vary")).anySatisfy(v -> assertThat(v).contains("Origin"));
  }

  @Test
  void unknownOrigin_getsNoAllowOrigin() throws Exception {
    HttpResponse<String> response = send("GET", "/api/whoami", "https://evil.example");

    assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).isEmpty();
    assertThat(response.headers().firstValue("Access-Control-Allow-Credentials")).isEmpty();
    assertThat(response.headers().firstValue("Access-Control-Allow-Methods")).hasValue("POST, GET, OPTIONS");
  }

  @Test
  void originDifferingOnlyInScheme_isRejected() throws Exception {
    HttpResponse<String> response = send("GET", "/api/whoami", "http://app.quire.example");

    assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).isEmpty();
  }

  @Test
  void preflight_onApiPath_returns204WithPolicyHeaders() throws Exception {
    HttpResponse<String> response = send("OPTIONS", "/api/login", ALLOWED);

    assertThat(response.statusCode()).isEqualTo(204);
    assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).hasValue(ALLOWED);
    assertThat(response.headers().firstValue("Access-Control-Allow-Methods")).hasValue("POST, GET, OPTIONS");
    assertThat(response.headers().firstValue("Access-Control-Allow-Headers"))
        .hasValue("Content-Type, Authorization");
  }

  @Test
  void preflight_onUnknownPath_returns204() throws Exception {
    HttpResponse<String> response = send("OPTIONS", "/no/such/route", null);

    assertThat(response.statusCode()).isEqualTo(204);
    assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).isEmpty();
  }
}
