package org.tokengate;

import io.vertx.core.json.JsonObject;
import org.tokengate.common.Config;
import org.tokengate.util.TokenCache;

/**
 * Settings of the gateway verticle.
 */
public class GatewayOptions {

  public static final int DEFAULT_PORT = 8080;
  public static final long DEFAULT_REQUEST_TIMEOUT = 5000L;
  // 55 minutes, a little shorter than the usual one hour token lifetime
  public static final long DEFAULT_CACHE_TTL = 55 * 60 * 1000L;
  public static final String DEFAULT_TOKEN_SUBJECT = "token.request";

  private int port = DEFAULT_PORT;
  private long requestTimeout = DEFAULT_REQUEST_TIMEOUT;
  private long cacheTtl = DEFAULT_CACHE_TTL;
  private long cacheSweepInterval = TokenCache.DEFAULT_SWEEP_INTERVAL;
  private String tokenSubject = DEFAULT_TOKEN_SUBJECT;
  private String logLevel;

  /**
   * Read options from system properties, JSON config, environment and defaults,
   * in that order.
   * @param config verticle configuration
   * @return options
   * @throws IllegalArgumentException for durations that are not positive
   */
  public static GatewayOptions fromConfig(JsonObject config) {
    GatewayOptions options = new GatewayOptions();
    options.setPort(Integer.parseInt(Config.getSysConf(ConfNames.HTTP_PORT, ConfNames.PORT,
        Integer.toString(DEFAULT_PORT), config)));
    options.setRequestTimeout(Config.getSysConfLong(ConfNames.REQUEST_TIMEOUT_MS,
        DEFAULT_REQUEST_TIMEOUT, config));
    options.setCacheTtl(Config.getSysConfLong(ConfNames.CACHE_TTL_MS,
        DEFAULT_CACHE_TTL, config));
    options.setCacheSweepInterval(Config.getSysConfLong(ConfNames.CACHE_SWEEP_INTERVAL_MS,
        TokenCache.DEFAULT_SWEEP_INTERVAL, config));
    options.setTokenSubject(Config.getSysConf(ConfNames.TOKEN_SUBJECT,
        DEFAULT_TOKEN_SUBJECT, config));
    options.setLogLevel(Config.getSysConf(ConfNames.LOGLEVEL,
        Config.getEnv(ConfNames.LOGLEVEL_ENV, null), config));
    return options;
  }

  private static long positive(String name, long value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
    return value;
  }

  public int getPort() {
    return port;
  }

  public GatewayOptions setPort(int port) {
    this.port = port;
    return this;
  }

  public long getRequestTimeout() {
    return requestTimeout;
  }

  public GatewayOptions setRequestTimeout(long requestTimeout) {
    this.requestTimeout = positive(ConfNames.REQUEST_TIMEOUT_MS, requestTimeout);
    return this;
  }

  public long getCacheTtl() {
    return cacheTtl;
  }

  public GatewayOptions setCacheTtl(long cacheTtl) {
    this.cacheTtl = positive(ConfNames.CACHE_TTL_MS, cacheTtl);
    return this;
  }

  public long getCacheSweepInterval() {
    return cacheSweepInterval;
  }

  public GatewayOptions setCacheSweepInterval(long cacheSweepInterval) {
    this.cacheSweepInterval = positive(ConfNames.CACHE_SWEEP_INTERVAL_MS, cacheSweepInterval);
    return this;
  }

  public String getTokenSubject() {
    return tokenSubject;
  }

  public GatewayOptions setTokenSubject(String tokenSubject) {
    this.tokenSubject = tokenSubject;
    return this;
  }

  public String getLogLevel() {
    return logLevel;
  }

  public GatewayOptions setLogLevel(String logLevel) {
    this.logLevel = logLevel;
    return this;
  }
}
