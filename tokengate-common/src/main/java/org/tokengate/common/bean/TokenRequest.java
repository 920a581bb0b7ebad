package org.tokengate.common.bean;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

/**
 * Token request sent from gateway to worker. One per bridge call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenRequest {
  @JsonProperty("request_id")
  private String requestId;

  @JsonProperty("client_id")
  private String clientId;

  @JsonProperty("client_secret")
  private String clientSecret;

  private String timestamp;

  /**
   * Create request with a fresh random request ID and current time.
   * @param clientId client ID
   * @param clientSecret client secret
   * @return new request
   */
  public static TokenRequest create(String clientId, String clientSecret) {
    TokenRequest request = new TokenRequest();
    request.setRequestId(UUID.randomUUID().toString());
    request.setClientId(clientId);
    request.setClientSecret(clientSecret);
    request.setTimestamp(Instant.now().toString());
    return request;
  }

  public String getRequestId() {
    return requestId;
  }

  public void setRequestId(String requestId) {
    this.requestId = requestId;
  }

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public String getClientSecret() {
    return clientSecret;
  }

  public void setClientSecret(String clientSecret) {
    this.clientSecret = clientSecret;
  }

  public String getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(String timestamp) {
    this.timestamp = timestamp;
  }
}
