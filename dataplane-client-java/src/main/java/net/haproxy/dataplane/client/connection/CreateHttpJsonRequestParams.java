package net.haproxy.dataplane.client.connection;

import net.haproxy.dataplane.abstractions.connection.OperationCredentials;
import net.haproxy.dataplane.abstractions.data.HttpMethods;
import net.haproxy.dataplane.client.utils.CancellationTokenSource.CancellationToken;


public class CreateHttpJsonRequestParams {

  private final String url;
  private final HttpMethods method;
  private final OperationCredentials credentials;
  private final int timeoutMillis;
  private CancellationToken cancellationToken;

  public CreateHttpJsonRequestParams(String url, HttpMethods method, OperationCredentials credentials, int timeoutMillis) {
    super();
    this.url = url;
    this.method = method;
    this.credentials = credentials;
    this.timeoutMillis = timeoutMillis;
  }

  public String getUrl() {
    return url;
  }

  public HttpMethods getMethod() {
    return method;
  }

  public OperationCredentials getCredentials() {
    return credentials;
  }

  /**
   * @return connect and socket timeout, 0 means infinite
   */
  public int getTimeoutMillis() {
    return timeoutMillis;
  }

  public CancellationToken getCancellationToken() {
    return cancellationToken;
  }

  public CreateHttpJsonRequestParams withCancellationToken(CancellationToken cancellationToken) {
    this.cancellationToken = cancellationToken;
    return this;
  }

}
