package org.tokengate.worker.idp;

import io.vertx.ext.web.client.WebClient;

/**
 * Options for {@link IdpClient}.
 */
public class IdpClientOptions {

  public static final String DEFAULT_URL = "https://idp.example.com";
  public static final String DEFAULT_TOKEN_PATH = "/realms/phoenix/protocol/openid-connect/token";
  public static final long DEFAULT_TIMEOUT = 10000L;

  private String url = DEFAULT_URL;
  private String tokenPath = DEFAULT_TOKEN_PATH;
  private long timeout = DEFAULT_TIMEOUT;
  private boolean simulate;
  private WebClient webClient;

  public IdpClientOptions url(String url) {
    this.url = url;
    return this;
  }

  public String getUrl() {
    return url;
  }

  public IdpClientOptions tokenPath(String tokenPath) {
    this.tokenPath = tokenPath;
    return this;
  }

  public String getTokenPath() {
    return tokenPath;
  }

  /**
   * Set request timeout.
   * @param timeout milliseconds
   * @return this
   */
  public IdpClientOptions timeout(long timeout) {
    this.timeout = timeout;
    return this;
  }

  public long getTimeout() {
    return timeout;
  }

  /**
   * Return fake tokens without contacting the identity provider.
   * @param simulate true for fake tokens
   * @return this
   */
  public IdpClientOptions simulate(boolean simulate) {
    this.simulate = simulate;
    return this;
  }

  public boolean isSimulate() {
    return simulate;
  }

  public IdpClientOptions webClient(WebClient webClient) {
    this.webClient = webClient;
    return this;
  }

  public WebClient getWebClient() {
    return webClient;
  }
}
