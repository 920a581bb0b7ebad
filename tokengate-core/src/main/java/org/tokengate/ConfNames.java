package org.tokengate;

import org.tokengate.common.Config;

/**
 * Configuration variable names used for {@code java -Dname=value tokengate.jar}
 * or used as key in the JSON file given with {@code -conf}.
 *
 * @see Config
 */
public final class ConfNames {

  public static final String PORT = "port";
  public static final String HTTP_PORT = "http.port";
  public static final String REQUEST_TIMEOUT_MS = "request_timeout_ms";
  public static final String CACHE_TTL_MS = "cache_ttl_ms";
  public static final String CACHE_SWEEP_INTERVAL_MS = "cache_sweep_interval_ms";
  public static final String TOKEN_SUBJECT = "token_subject";
  public static final String LOGLEVEL = "loglevel";
  public static final String LOGLEVEL_ENV = "TOKENGATE_LOGLEVEL";
  public static final String MODE = "mode";

  private ConfNames() {
    throw new UnsupportedOperationException("Cannot instantiate utility class.");
  }
}
