package org.tokengate.util;

import org.tokengate.common.ErrorType;

/**
 * Failure while serving a token request. The kind decides the HTTP status.
 */
public class TokenError extends RuntimeException {

  private static final long serialVersionUID = 4416209127561829440L;

  public enum Kind {
    /** Body is not a JSON object. */
    MALFORMED_REQUEST(ErrorType.USER),
    /** Client ID or secret missing or empty. */
    MISSING_CREDENTIAL(ErrorType.USER),
    /** No reply from a worker in time. */
    UPSTREAM_TIMEOUT(ErrorType.TIMEOUT),
    /** No worker or the event bus failed. */
    UPSTREAM_UNAVAILABLE(ErrorType.INTERNAL),
    /** Reply could not be understood. */
    UPSTREAM_SERIALIZATION(ErrorType.INTERNAL),
    /** Worker or identity provider refused the credentials. */
    UPSTREAM_REJECTED(ErrorType.USER);

    private final ErrorType errorType;

    Kind(ErrorType errorType) {
      this.errorType = errorType;
    }

    public ErrorType getErrorType() {
      return errorType;
    }
  }

  private final Kind kind;

  public TokenError(Kind kind, String message) {
    super(message, null, false, false);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public ErrorType getErrorType() {
    return kind.getErrorType();
  }

  /**
   * Kind of a failure cause.
   * @param t cause
   * @return kind; null if t is not a TokenError
   */
  public static Kind getKind(Throwable t) {
    return t instanceof TokenError ? ((TokenError) t).getKind() : null;
  }

  /**
   * Error type of a failure cause.
   * @param t cause
   * @return error type; INTERNAL if t is not a TokenError
   */
  public static ErrorType getType(Throwable t) {
    return t instanceof TokenError ? ((TokenError) t).getErrorType() : ErrorType.INTERNAL;
  }
}
