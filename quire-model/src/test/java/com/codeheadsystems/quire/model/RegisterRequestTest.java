package com.codeheadsystems.quire.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class RegisterRequestTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void toString_doesNotContainCredential() {
    RegisterRequest req = new RegisterRequest("alice@example.com", "hunter2-hunter2", "Alice");
    assertThat(req.toString())
        .contains("alice@example.com")
        .contains("Alice")
        .doesNotContain("hunter2");
  }

  @Test
  void deserialize_readsAllFields() throws Exception {
    String json = "{\"identity\":\"a@b.co\",\"credential\":\"secret-value\",\"displayName\":\"A\"}";
    RegisterRequest req = mapper.readValue(json, RegisterRequest.class);

    assertThat(req.identity()).isEqualTo("a@b.co");
    assertThat(req.credential()).isEqualTo("secret-value");
    assertThat(req.displayName()).isEqualTo("A");
  }

  @Test
  void deserialize_missingFields_areNull() throws Exception {
    RegisterRequest req = mapper.readValue("{\"identity\":\"a@b.co\"}", RegisterRequest.class);
    assertThat(req.credential()).isNull();
    assertThat(req.displayName()).isNull();
  }
}
