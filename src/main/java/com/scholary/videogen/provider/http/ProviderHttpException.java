package com.scholary.videogen.provider.http;

/**
 * A provider HTTP exchange failed.
 *
 * <p>{@code statusCode} is the HTTP status of a non-2xx response, or {@code 0} when no response
 * was received.
 */
public class ProviderHttpException extends RuntimeException {

  private final int statusCode;
  private final String responseBody;

  public ProviderHttpException(int statusCode, String responseBody) {
    super(String.format("HTTP error: %d, %s", statusCode, responseBody));
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public ProviderHttpException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
    this.responseBody = null;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
