package org.tokengate.common;

import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.apache.logging.log4j.Logger;

/**
 * Response helpers for route handlers. Every response outside 2xx is logged
 * with the method and path of the request. Nothing is written to a response
 * that is already closed.
 */
public class HttpResponse {

  private static final Logger logger = GatewayLogger.get();

  static final String TEXT_PLAIN = "text/plain";
  static final String APPLICATION_JSON = "application/json";

  private HttpResponse() {
    throw new IllegalStateException("HttpResponse");
  }

  /**
   * Plain text error with the message of the cause as body.
   */
  public static void responseError(RoutingContext ctx, ErrorType t, Throwable cause) {
    responseError(ctx, ErrorType.httpCode(t), cause.getMessage(), cause);
  }

  public static void responseError(RoutingContext ctx, ErrorType t, String message) {
    responseError(ctx, ErrorType.httpCode(t), message, null);
  }

  public static void responseError(RoutingContext ctx, int code, String message) {
    responseError(ctx, code, message, null);
  }

  /**
   * Plain text error.
   * @param ctx routing context
   * @param code status; replaced by 500 when not a valid status code
   * @param message body; "(null)" when null
   * @param cause logged with stack trace when not null
   */
  public static void responseError(RoutingContext ctx, int code, String message,
      Throwable cause) {
    String body = message == null ? "(null)" : message;
    end(ctx, code, TEXT_PLAIN, body, body, cause);
  }

  /**
   * JSON error with body <code>{"error": message}</code>.
   * @param ctx routing context
   * @param t error type giving the status
   * @param message error message for the client
   */
  public static void responseJsonError(RoutingContext ctx, ErrorType t, String message) {
    String text = message == null ? "(null)" : message;
    end(ctx, ErrorType.httpCode(t), APPLICATION_JSON,
        new JsonObject().put("error", text).encode(), text, null);
  }

  /**
   * Set status and text/plain content type; the caller ends the response.
   */
  public static HttpServerResponse responseText(RoutingContext ctx, int code) {
    return head(ctx.response(), code, TEXT_PLAIN);
  }

  /**
   * Set status and application/json content type; the caller ends the response.
   */
  public static HttpServerResponse responseJson(RoutingContext ctx, int code) {
    return head(ctx.response(), code, APPLICATION_JSON);
  }

  /**
   * Complete text/plain response; a closed response is left alone.
   */
  public static void responseText(RoutingContext ctx, int code, String body) {
    end(ctx, code, TEXT_PLAIN, body, body, null);
  }

  /**
   * Complete application/json response; a closed response is left alone.
   */
  public static void responseJson(RoutingContext ctx, int code, String body) {
    end(ctx, code, APPLICATION_JSON, body, body, null);
  }

  private static void end(RoutingContext ctx, int code, String contentType, String body,
      String logText, Throwable cause) {
    if (code < 200 || code > 299) {
      logFailure(ctx, code, logText, cause);
    }
    HttpServerResponse res = head(ctx.response(), code, contentType);
    if (!res.closed()) {
      res.end(body);
    }
  }

  private static HttpServerResponse head(HttpServerResponse res, int code, String contentType) {
    if (!res.closed()) {
      res.setStatusCode(sanitizeStatusCode(code)).putHeader("Content-Type", contentType);
    }
    return res;
  }

  private static void logFailure(RoutingContext ctx, int code, String text, Throwable cause) {
    String method = String.valueOf(ctx.request().method());
    String path = ctx.request().path();
    if (cause == null) {
      logger.error("{} {} failed with {}: {}", method, path, code, text);
    } else {
      logger.error("{} {} failed with {}: {}", method, path, code, text, cause);
    }
  }

  // RFC 9110 section 15: three digit status codes only
  static int sanitizeStatusCode(int code) {
    return code >= 100 && code <= 999 ? code : 500;
  }
}
