package net.haproxy.dataplane.abstractions.exceptions;

import net.haproxy.dataplane.abstractions.data.ApiError;

import org.apache.http.HttpRequest;

/**
 * Non-2xx answer from the Data Plane API.
 */
public class HttpOperationException extends RuntimeException {
  private HttpRequest webRequest;
  private final int statusCode;
  private final String responseBody;
  private final ApiError apiError;

  public HttpOperationException(String message, Throwable cause, HttpRequest webRequest, int statusCode, String responseBody, ApiError apiError) {
    super(message, cause);
    this.webRequest = webRequest;
    this.statusCode = statusCode;
    this.responseBody = responseBody;
    this.apiError = apiError;
  }

  /**
   * @return the webRequest
   */
  public HttpRequest getWebRequest() {
    return webRequest;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /**
   * @return raw response body, may be empty
   */
  public String getResponseBody() {
    return responseBody;
  }

  /**
   * @return error parsed from the body, or null when the body was not a JSON error object
   */
  public ApiError getApiError() {
    return apiError;
  }

}
