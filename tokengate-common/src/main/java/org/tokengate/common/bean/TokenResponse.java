package org.tokengate.common.bean;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Reply from worker to gateway. A non-empty {@code error} means failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenResponse {
  @JsonProperty("request_id")
  private String requestId;

  @JsonProperty("access_token")
  private String accessToken;

  @JsonProperty("token_type")
  private String tokenType;

  @JsonProperty("expires_in")
  private Integer expiresIn;

  private String scope;

  private String error;

  private String timestamp;

  /**
   * Successful reply.
   */
  public static TokenResponse success(String requestId, String accessToken, String tokenType,
      String scope, Integer expiresIn) {
    TokenResponse response = new TokenResponse();
    response.setRequestId(requestId);
    response.setAccessToken(accessToken);
    response.setTokenType(tokenType);
    response.setScope(scope);
    response.setExpiresIn(expiresIn);
    response.setTimestamp(Instant.now().toString());
    return response;
  }

  /**
   * Failed reply.
   * @param requestId ID of request; empty if the request could not be decoded
   * @param error reason, passed on to the HTTP client
   */
  public static TokenResponse failure(String requestId, String error) {
    TokenResponse response = new TokenResponse();
    response.setRequestId(requestId);
    response.setError(error);
    response.setTimestamp(Instant.now().toString());
    return response;
  }

  @JsonIgnore
  public boolean isFailure() {
    return error != null && !error.isEmpty();
  }

  public String getRequestId() {
    return requestId;
  }

  public void setRequestId(String requestId) {
    this.requestId = requestId;
  }

  public String getAccessToken() {
    return accessToken;
  }

  public void setAccessToken(String accessToken) {
    this.accessToken = accessToken;
  }

  public String getTokenType() {
    return tokenType;
  }

  public void setTokenType(String tokenType) {
    this.tokenType = tokenType;
  }

  public Integer getExpiresIn() {
    return expiresIn;
  }

  public void setExpiresIn(Integer expiresIn) {
    this.expiresIn = expiresIn;
  }

  public String getScope() {
    return scope;
  }

  public void setScope(String scope) {
    this.scope = scope;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public String getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(String timestamp) {
    this.timestamp = timestamp;
  }
}
