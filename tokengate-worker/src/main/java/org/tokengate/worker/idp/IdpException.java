package org.tokengate.worker.idp;

/**
 * Exception without stacktrace from {@link IdpClient}.
 */
public class IdpException extends RuntimeException {

  private static final long serialVersionUID = -1758512346610387205L;

  public IdpException(String msg) {
    super(msg, null, false, false);
  }
}
