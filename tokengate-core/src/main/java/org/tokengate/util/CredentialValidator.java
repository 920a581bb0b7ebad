package org.tokengate.util;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import org.tokengate.bean.ClientCredentials;

public class CredentialValidator {

  static final String INVALID_FORMAT = "Invalid request format";
  static final String CREDENTIALS_REQUIRED = "Client ID and Client Secret are required";

  private CredentialValidator() {
    throw new IllegalStateException("CredentialValidator");
  }

  /**
   * Decode and check the body of a token request.
   *
   * @param body request body; may be null
   * @return credentials with non-empty client ID and secret
   * @throws TokenError MALFORMED_REQUEST or MISSING_CREDENTIAL
   */
  public static ClientCredentials validate(Buffer body) {
    ClientCredentials credentials;
    try {
      credentials = body == null ? null : Json.decodeValue(body, ClientCredentials.class);
    } catch (DecodeException e) {
      throw new TokenError(TokenError.Kind.MALFORMED_REQUEST, INVALID_FORMAT);
    }
    if (credentials == null) {
      throw new TokenError(TokenError.Kind.MALFORMED_REQUEST, INVALID_FORMAT);
    }
    if (isEmpty(credentials.getClientId()) || isEmpty(credentials.getClientSecret())) {
      throw new TokenError(TokenError.Kind.MISSING_CREDENTIAL, CREDENTIALS_REQUIRED);
    }
    return credentials;
  }

  private static boolean isEmpty(String s) {
    return s == null || s.isEmpty();
  }
}
