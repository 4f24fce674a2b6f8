package net.haproxy.dataplane.client.connection.implementation;

import java.io.IOException;
import java.net.URI;

import net.haproxy.dataplane.abstractions.data.ApiError;
import net.haproxy.dataplane.abstractions.data.Constants;
import net.haproxy.dataplane.abstractions.data.HttpMethods;
import net.haproxy.dataplane.abstractions.exceptions.HttpOperationException;
import net.haproxy.dataplane.abstractions.exceptions.OperationCancelledException;
import net.haproxy.dataplane.abstractions.exceptions.ServerClientException;
import net.haproxy.dataplane.abstractions.extensions.JsonExtensions;
import net.haproxy.dataplane.abstractions.logging.ILog;
import net.haproxy.dataplane.abstractions.logging.LogManager;
import net.haproxy.dataplane.abstractions.util.Sanitizer;
import net.haproxy.dataplane.client.connection.CreateHttpJsonRequestParams;
import net.haproxy.dataplane.client.connection.profiling.RequestResultArgs;
import net.haproxy.dataplane.client.connection.profiling.RequestStatus;
import net.haproxy.dataplane.client.utils.CancellationTokenSource.CancellationToken;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.time.StopWatch;
import org.apache.http.Consts;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpEntityEnclosingRequestBase;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.codehaus.jackson.JsonNode;

/**
 * Single authenticated JSON exchange with the Data Plane API.
 */
public class HttpJsonRequest {

  private static final ILog log = LogManager.getCurrentClassLogger();

  private final String url;
  private final HttpMethods method;

  private final HttpRequestBase webRequest;
  private final HttpJsonRequestFactory factory;
  private final CancellationToken cancellationToken;
  private final StopWatch sp;
  private final CloseableHttpClient httpClient;
  private String postedData;

  private int responseStatusCode;

  public HttpJsonRequest(CreateHttpJsonRequestParams requestParams, HttpJsonRequestFactory factory) {
    sp = new StopWatch();
    sp.start();

    this.url = requestParams.getUrl();
    this.factory = factory;
    this.method = requestParams.getMethod();
    this.cancellationToken = requestParams.getCancellationToken();
    this.httpClient = factory.getHttpClient();
    this.webRequest = method.createRequest(url);

    if (requestParams.getTimeoutMillis() > 0) {
      webRequest.setConfig(RequestConfig.custom()
        .setConnectTimeout(requestParams.getTimeoutMillis())
        .setConnectionRequestTimeout(requestParams.getTimeoutMillis())
        .setSocketTimeout(requestParams.getTimeoutMillis())
        .build());
    }
    if (requestParams.getCredentials() != null) {
      webRequest.addHeader(HttpHeaders.AUTHORIZATION, requestParams.getCredentials().toBasicAuthorizationHeader());
    }
    webRequest.addHeader(HttpHeaders.CONTENT_TYPE, ContentType.APPLICATION_JSON.getMimeType());
    webRequest.addHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
    webRequest.addHeader(HttpHeaders.USER_AGENT, Constants.CLIENT_USER_AGENT);
  }

  public HttpMethods getMethod() {
    return method;
  }

  public String getUrl() {
    return url;
  }

  /**
   * @return the responseStatusCode, 0 until a response was received
   */
  public int getResponseStatusCode() {
    return responseStatusCode;
  }

  HttpRequestBase getWebRequest() {
    return webRequest;
  }

  public void write(String data) {
    if (!method.hasBody()) {
      throw new IllegalArgumentException(method + " " + url + " can not carry a body");
    }
    postedData = data;
    ((HttpEntityEnclosingRequestBase) webRequest).setEntity(new StringEntity(data, ContentType.APPLICATION_JSON));
  }

  public void executeRequest() {
    readResponseString();
  }

  /**
   * @return decoded body, null when the response had no body
   */
  public JsonNode readResponseJson() {
    return JsonExtensions.parseTree(readResponseString());
  }

  public String readResponseString() {
    if (cancellationToken != null) {
      cancellationToken.throwIfCancellationRequested();
      cancellationToken.register(webRequest);
    }
    String body;
    try (CloseableHttpResponse httpResponse = httpClient.execute(webRequest)) {
      responseStatusCode = httpResponse.getStatusLine().getStatusCode();
      body = httpResponse.getEntity() != null ? EntityUtils.toString(httpResponse.getEntity(), Consts.UTF_8) : "";
    } catch (IOException e) {
      sp.stop();
      if (cancellationToken != null && cancellationToken.isCancellationRequested()) {
        logRequest(RequestStatus.CANCELLED, null);
        throw new OperationCancelledException(method + " " + getPathAndQuery(webRequest.getURI()) + " was cancelled", e);
      }
      logRequest(RequestStatus.FAILED_TO_CONNECT, null);
      throw new ServerClientException(method + " " + getPathAndQuery(webRequest.getURI()) + " failed: " + e.getMessage(), e);
    } finally {
      if (cancellationToken != null) {
        cancellationToken.unregister(webRequest);
      }
    }
    sp.stop();
    logRequest(RequestStatus.COMPLETED, body);

    if (responseStatusCode >= 300) {
      ApiError apiError = parseApiError(body);
      String detail = apiError != null && apiError.getMessage() != null ? apiError.getMessage() : StringUtils.abbreviate(body, 500);
      throw new HttpOperationException("Invalid status code:" + responseStatusCode + " for " + method + " "
        + getPathAndQuery(webRequest.getURI()) + ": " + Sanitizer.sanitize(detail), null, webRequest, responseStatusCode, body, apiError);
    }
    return body;
  }

  private void logRequest(RequestStatus status, String result) {
    if (log.isDebugEnabled()) {
      log.debug("%s %s -> %d in %d ms, request: %s, response: %s", method, getPathAndQuery(webRequest.getURI()), responseStatusCode,
        sp.getTime(), StringUtils.defaultString(postedData, "<none>"), StringUtils.defaultString(result, "<none>"));
    }

    RequestResultArgs args = new RequestResultArgs(method, getPathAndQuery(webRequest.getURI()), status, responseStatusCode,
      sp.getTime(), Sanitizer.sanitize(postedData), Sanitizer.sanitize(result));
    factory.notifyRequestCompleted(args);
  }

  private static ApiError parseApiError(String body) {
    if (StringUtils.isBlank(body) || !body.trim().startsWith("{")) {
      return null;
    }
    try {
      JsonNode node = JsonExtensions.getDefaultObjectMapper().readTree(body);
      if (node == null || !(node.has("message") || node.has("code"))) {
        return null;
      }
      return JsonExtensions.getDefaultObjectMapper().readValue(node, ApiError.class);
    } catch (IOException e) {
      log.debug("Error response is not a JSON error object: %s", e.getMessage());
      return null;
    }
  }

  private static String getPathAndQuery(URI src) {
    return src.getPath() + ((src.getQuery() != null) ? "?" + src.getQuery() : "");
  }

}
