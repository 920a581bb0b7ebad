package org.tokengate.worker;

import io.vertx.core.json.JsonObject;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.function.Supplier;
import org.tokengate.common.Config;
import org.tokengate.worker.idp.IdpClientOptions;

/**
 * Settings of the worker verticle. Each value is looked up as system
 * property, then verticle config, then environment variable, then default.
 */
public class WorkerOptions {

  public static final String TOKEN_SUBJECT = "token_subject";
  public static final String WORKER_NAME = "worker_name";
  public static final String IDP_URL = "idp_url";
  public static final String IDP_TOKEN_PATH = "idp_token_path";
  public static final String IDP_TIMEOUT_MS = "idp_timeout_ms";
  public static final String IDP_SCOPE = "idp_scope";
  public static final String IDP_SIMULATE = "idp_simulate";
  public static final String LOGLEVEL = "loglevel";

  public static final String DEFAULT_TOKEN_SUBJECT = "token.request";
  public static final String DEFAULT_SCOPE = "openid profile";

  private String tokenSubject = DEFAULT_TOKEN_SUBJECT;
  private String workerName;
  private String scope = DEFAULT_SCOPE;
  private String logLevel;
  private final IdpClientOptions idpClientOptions = new IdpClientOptions();

  /**
   * Read options.
   * @param config verticle configuration
   * @return options
   */
  public static WorkerOptions fromConfig(JsonObject config) {
    return fromConfig(config, WorkerOptions::hostName);
  }

  // host name is only looked up when no worker name is configured
  static WorkerOptions fromConfig(JsonObject config, Supplier<String> hostName) {
    WorkerOptions options = new WorkerOptions();
    options.tokenSubject = Config.getSysConf(TOKEN_SUBJECT, DEFAULT_TOKEN_SUBJECT, config);
    String workerName = Config.getSysConf(WORKER_NAME, Config.getEnv("POD_NAME", null), config);
    options.workerName = workerName != null ? workerName : hostName.get();
    options.scope = Config.getSysConf(IDP_SCOPE, DEFAULT_SCOPE, config);
    options.logLevel = Config.getSysConf(LOGLEVEL, Config.getEnv("TOKENGATE_LOGLEVEL", null),
        config);
    options.idpClientOptions
        .url(Config.getSysConf(IDP_URL,
            Config.getEnv("IDP_URL", IdpClientOptions.DEFAULT_URL), config))
        .tokenPath(Config.getSysConf(IDP_TOKEN_PATH,
            Config.getEnv("IDP_TOKEN_PATH", IdpClientOptions.DEFAULT_TOKEN_PATH), config))
        .timeout(Config.getSysConfLong(IDP_TIMEOUT_MS, IdpClientOptions.DEFAULT_TIMEOUT, config))
        .simulate(Config.getSysConfBoolean(IDP_SIMULATE, false, config));
    return options;
  }

  static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "token-worker";
    }
  }

  public String getTokenSubject() {
    return tokenSubject;
  }

  public String getWorkerName() {
    return workerName;
  }

  public String getScope() {
    return scope;
  }

  public String getLogLevel() {
    return logLevel;
  }

  public IdpClientOptions getIdpClientOptions() {
    return idpClientOptions;
  }
}
