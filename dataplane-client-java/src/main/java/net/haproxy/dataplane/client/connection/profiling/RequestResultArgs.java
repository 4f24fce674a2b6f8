package net.haproxy.dataplane.client.connection.profiling;

import java.util.Date;

import net.haproxy.dataplane.abstractions.data.HttpMethods;

/**
 * Outcome of a single Data Plane API request, handed to {@link RequestListener}s. Bodies are already sanitized.
 */
public class RequestResultArgs {

  private final Date at;
  private final HttpMethods method;
  private final String url;
  private final RequestStatus status;
  private final int httpResult;
  private final long durationMilliseconds;
  private final String postedData;
  private final String result;

  public RequestResultArgs(HttpMethods method, String url, RequestStatus status, int httpResult,
    long durationMilliseconds, String postedData, String result) {
    this.at = new Date();
    this.method = method;
    this.url = url;
    this.status = status;
    this.httpResult = httpResult;
    this.durationMilliseconds = durationMilliseconds;
    this.postedData = postedData;
    this.result = result;
  }

  /**
   * When the request completed
   */
  public Date getAt() {
    return at;
  }

  public HttpMethods getMethod() {
    return method;
  }

  /**
   * @return path and query string, without the server part
   */
  public String getUrl() {
    return url;
  }

  public RequestStatus getStatus() {
    return status;
  }

  /**
   * @return the HTTP status code, 0 when no response was received
   */
  public int getHttpResult() {
    return httpResult;
  }

  public long getDurationMilliseconds() {
    return durationMilliseconds;
  }

  public String getPostedData() {
    return postedData;
  }

  public String getResult() {
    return result;
  }

  @Override
  public String toString() {
    return method + " " + url + " -> " + (status == RequestStatus.COMPLETED ? String.valueOf(httpResult) : status.name())
      + " (" + durationMilliseconds + " ms)";
  }

}
