package net.haproxy.dataplane.client.connection.implementation;

import java.security.GeneralSecurityException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.net.ssl.SSLContext;

import net.haproxy.dataplane.abstractions.exceptions.ServerClientException;
import net.haproxy.dataplane.client.connection.CreateHttpJsonRequestParams;
import net.haproxy.dataplane.client.connection.profiling.RequestListener;
import net.haproxy.dataplane.client.connection.profiling.RequestResultArgs;

import org.apache.http.config.Registry;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.config.SocketConfig;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.conn.ssl.TrustAllStrategy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.client.StandardHttpRequestRetryHandler;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.ssl.SSLContextBuilder;


/**
 * Creates the HTTP Json Requests to the Data Plane API
 * and owns the pooled http client they share.
 */
public class HttpJsonRequestFactory implements AutoCloseable {

  private CloseableHttpClient httpClient;

  private final List<RequestListener> requestListeners = new CopyOnWriteArrayList<>();

  private volatile boolean disposed;

  public HttpJsonRequestFactory(int maxConnectionsPerRoute, boolean insecure) {
    super();

    PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager(createSocketFactoryRegistry(insecure));
    cm.setDefaultMaxPerRoute(maxConnectionsPerRoute);
    // retries belong to the transaction layer, never to the transport
    this.httpClient = HttpClients.custom().setConnectionManager(cm).setRetryHandler(new StandardHttpRequestRetryHandler(0, false))
      .setDefaultSocketConfig(SocketConfig.custom().setTcpNoDelay(true).build()).
      build();
  }

  private static Registry<ConnectionSocketFactory> createSocketFactoryRegistry(boolean insecure) {
    SSLConnectionSocketFactory sslSocketFactory;
    if (insecure) {
      try {
        SSLContext sslContext = SSLContextBuilder.create().loadTrustMaterial(TrustAllStrategy.INSTANCE).build();
        sslSocketFactory = new SSLConnectionSocketFactory(sslContext, NoopHostnameVerifier.INSTANCE);
      } catch (GeneralSecurityException e) {
        throw new ServerClientException("Unable to create SSL context which skips certificate verification", e);
      }
    } else {
      sslSocketFactory = SSLConnectionSocketFactory.getSocketFactory();
    }
    return RegistryBuilder.<ConnectionSocketFactory> create()
      .register("http", PlainConnectionSocketFactory.getSocketFactory())
      .register("https", sslSocketFactory)
      .build();
  }

  public void addRequestListener(RequestListener listener) {
    requestListeners.add(listener);
  }

  public void removeRequestListener(RequestListener listener) {
    requestListeners.remove(listener);
  }

  /**
   * @return the httpClient
   */
  public CloseableHttpClient getHttpClient() {
    return httpClient;
  }

  public HttpJsonRequest createHttpJsonRequest(CreateHttpJsonRequestParams createHttpJsonRequestParams) {
    if (disposed) {
      throw new IllegalStateException("Object was disposed!");
    }
    return new HttpJsonRequest(createHttpJsonRequestParams, this);
  }

  void notifyRequestCompleted(RequestResultArgs requestResult) {
    for (RequestListener listener : requestListeners) {
      listener.requestCompleted(requestResult);
    }
  }

  public boolean isDisposed() {
    return disposed;
  }

  @Override
  public void close() throws Exception {
    if (disposed) {
      return ;
    }
    disposed = true;
    httpClient.close();
  }

}
