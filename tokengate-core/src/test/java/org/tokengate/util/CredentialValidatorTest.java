package org.tokengate.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vertx.core.buffer.Buffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.tokengate.bean.ClientCredentials;

class CredentialValidatorTest {

  @Test
  void valid() {
    ClientCredentials c = CredentialValidator.validate(
        Buffer.buffer("{\"client_id\":\"svc\",\"client_secret\":\"s3cret\",\"extra\":true}"));
    assertThat(c.getClientId()).isEqualTo("svc");
    assertThat(c.getClientSecret()).isEqualTo("s3cret");
  }

  @ParameterizedTest
  @ValueSource(strings = { "", "not json", "[1,2]", "\"str\"", "null", "{\"client_id\":" })
  void malformed(String body) {
    assertThatThrownBy(() -> CredentialValidator.validate(Buffer.buffer(body)))
        .isInstanceOfSatisfying(TokenError.class,
            e -> assertThat(e.getKind()).isEqualTo(TokenError.Kind.MALFORMED_REQUEST))
        .hasMessage("Invalid request format");
  }

  @Test
  void nullBody() {
    assertThatThrownBy(() -> CredentialValidator.validate(null))
        .isInstanceOfSatisfying(TokenError.class,
            e -> assertThat(e.getKind()).isEqualTo(TokenError.Kind.MALFORMED_REQUEST));
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "{}",
      "{\"client_id\":\"svc\"}",
      "{\"client_secret\":\"s3cret\"}",
      "{\"client_id\":\"\",\"client_secret\":\"s3cret\"}",
      "{\"client_id\":\"svc\",\"client_secret\":\"\"}",
      "{\"client_id\":null,\"client_secret\":\"s3cret\"}"
  })
  void missingCredential(String body) {
    assertThatThrownBy(() -> CredentialValidator.validate(Buffer.buffer(body)))
        .isInstanceOfSatisfying(TokenError.class,
            e -> assertThat(e.getKind()).isEqualTo(TokenError.Kind.MISSING_CREDENTIAL))
        .hasMessage("Client ID and Client Secret are required");
  }
}
