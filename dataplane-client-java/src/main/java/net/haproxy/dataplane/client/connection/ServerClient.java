package net.haproxy.dataplane.client.connection;

import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import net.haproxy.dataplane.abstractions.connection.OperationCredentials;
import net.haproxy.dataplane.abstractions.data.AclPayload;
import net.haproxy.dataplane.abstractions.data.ApiVersion;
import net.haproxy.dataplane.abstractions.data.BackendPayload;
import net.haproxy.dataplane.abstractions.data.Constants;
import net.haproxy.dataplane.abstractions.data.EntityType;
import net.haproxy.dataplane.abstractions.data.FrontendPayload;
import net.haproxy.dataplane.abstractions.data.GlobalPayload;
import net.haproxy.dataplane.abstractions.data.HttpMethods;
import net.haproxy.dataplane.abstractions.data.IndexedPayload;
import net.haproxy.dataplane.abstractions.data.ParentRef;
import net.haproxy.dataplane.abstractions.data.ServerPayload;
import net.haproxy.dataplane.abstractions.data.TransactionInfo;
import net.haproxy.dataplane.abstractions.exceptions.HttpOperationException;
import net.haproxy.dataplane.abstractions.exceptions.ServerClientException;
import net.haproxy.dataplane.abstractions.extensions.JsonExtensions;
import net.haproxy.dataplane.abstractions.logging.ILog;
import net.haproxy.dataplane.abstractions.logging.LogManager;
import net.haproxy.dataplane.client.connection.implementation.HttpJsonRequest;
import net.haproxy.dataplane.client.connection.implementation.HttpJsonRequestFactory;
import net.haproxy.dataplane.client.document.DataPlaneConvention;
import net.haproxy.dataplane.client.utils.CancellationTokenSource.CancellationToken;

import org.apache.commons.lang.StringUtils;
import org.apache.http.HttpStatus;
import org.apache.http.client.utils.URIBuilder;
import org.codehaus.jackson.JsonNode;

import com.google.common.base.Preconditions;

/**
 * Access to the configuration endpoints of a single Data Plane API.
 * Request paths and response layouts follow the configured {@link ApiVersion}.
 */
public class ServerClient implements IConfigurationCommands {

  private static final ILog log = LogManager.getCurrentClassLogger();

  private final String url;
  private final DataPlaneConvention convention;
  private final OperationCredentials credentials;
  private final HttpJsonRequestFactory jsonRequestFactory;
  private final CancellationToken cancellationToken;

  public ServerClient(String url, DataPlaneConvention convention, OperationCredentials credentials, HttpJsonRequestFactory jsonRequestFactory) {
    this(url, convention, credentials, jsonRequestFactory, null);
  }

  private ServerClient(String url, DataPlaneConvention convention, OperationCredentials credentials,
    HttpJsonRequestFactory jsonRequestFactory, CancellationToken cancellationToken) {
    Preconditions.checkArgument(StringUtils.isNotBlank(url), "url can not be blank");
    this.url = StringUtils.removeEnd(url.trim(), "/");
    this.convention = convention;
    this.credentials = credentials;
    this.jsonRequestFactory = jsonRequestFactory;
    this.cancellationToken = cancellationToken;
  }

  @Override
  public IConfigurationCommands withCancellation(CancellationToken token) {
    if (token == cancellationToken) {
      return this;
    }
    return new ServerClient(url, convention, credentials, jsonRequestFactory, token);
  }

  public String getUrl() {
    return url;
  }

  @Override
  public ApiVersion getApiVersion() {
    return convention.getApiVersion();
  }

  String createUrl(String path, Map<String, String> query) {
    try {
      URIBuilder builder = new URIBuilder(url + "/" + getApiVersion().getPathSegment() + path);
      if (query != null) {
        for (Map.Entry<String, String> param : query.entrySet()) {
          builder.addParameter(param.getKey(), param.getValue());
        }
      }
      return builder.build().toString();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid request url for path " + path, e);
    }
  }

  private JsonNode execute(HttpMethods method, String path, Map<String, String> query, Object body) {
    CreateHttpJsonRequestParams params = new CreateHttpJsonRequestParams(createUrl(path, query), method, credentials,
      convention.getRequestTimeoutMillis()).withCancellationToken(cancellationToken);
    HttpJsonRequest request = jsonRequestFactory.createHttpJsonRequest(params);
    if (body != null) {
      request.write(JsonExtensions.toJson(body));
    }
    return request.readResponseJson();
  }

  private static Map<String, String> withTransaction(Map<String, String> query, String transactionId) {
    Preconditions.checkArgument(StringUtils.isNotBlank(transactionId), "transactionId can not be blank");
    query.put(Constants.TRANSACTION_ID_PARAM, transactionId);
    return query;
  }

  @Override
  public long getConfigurationVersion() {
    JsonNode node = execute(HttpMethods.GET, Constants.CONFIGURATION_VERSION_PATH, null, null);
    if (node != null && node.isObject()) {
      if (node.has("version")) {
        node = node.get("version");
      } else if (node.has(Constants.DATA_ENVELOPE_FIELD)) {
        node = node.get(Constants.DATA_ENVELOPE_FIELD);
      }
    }
    if (node != null && node.isIntegralNumber()) {
      return node.getLongValue();
    }
    if (node != null && node.isTextual()) {
      try {
        return Long.parseLong(node.getTextValue().trim());
      } catch (NumberFormatException e) {
        throw new ServerClientException("Configuration version is not a number: " + node.getTextValue(), e);
      }
    }
    throw new ServerClientException("Unexpected configuration version response: " + node);
  }

  @Override
  public TransactionInfo createTransaction(long version) {
    Map<String, String> query = Collections.singletonMap(Constants.VERSION_PARAM, String.valueOf(version));
    JsonNode node = getApiVersion().getResponseShape().unwrap(execute(HttpMethods.POST, Constants.TRANSACTIONS_PATH, query, null));
    if (node == null || !node.isObject()) {
      throw new ServerClientException("Unexpected transaction response: " + node);
    }
    TransactionInfo transaction = JsonExtensions.fromTree(node, TransactionInfo.class);
    if (StringUtils.isBlank(transaction.getId())) {
      throw new ServerClientException("Transaction response has no id: " + node);
    }
    return transaction;
  }

  @Override
  public TransactionInfo commitTransaction(String transactionId) {
    JsonNode node = getApiVersion().getResponseShape().unwrap(execute(HttpMethods.PUT, transactionPath(transactionId), null, null));
    if (node == null || !node.isObject()) {
      return null;
    }
    return JsonExtensions.fromTree(node, TransactionInfo.class);
  }

  @Override
  public void deleteTransaction(String transactionId) {
    execute(HttpMethods.DELETE, transactionPath(transactionId), null, null);
  }

  private static String transactionPath(String transactionId) {
    Preconditions.checkArgument(StringUtils.isNotBlank(transactionId), "transactionId can not be blank");
    return Constants.TRANSACTIONS_PATH + "/" + transactionId;
  }

  @Override
  public <T> List<T> getAll(EntityType type, ParentRef parent, Class<T> clazz) {
    ApiVersion version = getApiVersion();
    JsonNode node;
    try {
      node = execute(HttpMethods.GET, type.buildPath(version, parent, null), type.buildParentQuery(version, parent), null);
    } catch (HttpOperationException e) {
      if (e.getStatusCode() == HttpStatus.SC_NOT_FOUND) {
        log.debug("No %s found for %s", type, parent);
        return new ArrayList<>();
      }
      if (e.getStatusCode() == HttpStatus.SC_UNPROCESSABLE_ENTITY && type.isEmptyOnUnprocessable()) {
        log.debug("No %s defined yet for %s", type, parent);
        return new ArrayList<>();
      }
      throw e;
    }
    JsonNode payload = version.getResponseShape().unwrap(node);
    List<T> result = new ArrayList<>();
    if (payload == null || payload.isNull()) {
      return result;
    }
    if (!payload.isArray()) {
      throw new ServerClientException("Expected a list of " + type + " but got: " + payload);
    }
    for (JsonNode item : payload) {
      result.add(JsonExtensions.fromTree(item, clazz));
    }
    return result;
  }

  @Override
  public <T> T get(EntityType type, ParentRef parent, String key, Class<T> clazz) {
    ApiVersion version = getApiVersion();
    JsonNode node;
    try {
      node = execute(HttpMethods.GET, type.buildPath(version, parent, key), type.buildParentQuery(version, parent), null);
    } catch (HttpOperationException e) {
      if (e.getStatusCode() == HttpStatus.SC_NOT_FOUND) {
        return null;
      }
      throw e;
    }
    JsonNode payload = version.getResponseShape().unwrap(node);
    if (payload == null || payload.isNull()) {
      return null;
    }
    if (!payload.isObject()) {
      throw new ServerClientException("Expected a single " + type + " but got: " + payload);
    }
    return JsonExtensions.fromTree(payload, clazz);
  }

  @Override
  public void create(EntityType type, ParentRef parent, Object payload, String transactionId) {
    Preconditions.checkNotNull(payload, "payload");
    ApiVersion version = getApiVersion();
    // v3 places indexed entities through the item path
    String key = type.isIndexed() && version.usesNestedPaths() ? indexOf(payload) : null;
    execute(HttpMethods.POST, type.buildPath(version, parent, key),
      withTransaction(type.buildParentQuery(version, parent), transactionId), payload);
  }

  @Override
  public void update(EntityType type, ParentRef parent, String key, Object payload, String transactionId) {
    Preconditions.checkNotNull(payload, "payload");
    ApiVersion version = getApiVersion();
    execute(HttpMethods.PUT, type.buildPath(version, parent, key),
      withTransaction(type.buildParentQuery(version, parent), transactionId), payload);
  }

  @Override
  public void delete(EntityType type, ParentRef parent, String key, String transactionId) {
    Preconditions.checkArgument(StringUtils.isNotEmpty(key), "key can not be empty");
    ApiVersion version = getApiVersion();
    execute(HttpMethods.DELETE, type.buildPath(version, parent, key),
      withTransaction(type.buildParentQuery(version, parent), transactionId), null);
  }

  /**
   * v3 replaces the list with a single request. v2 has no such endpoint, items are created one by one
   * and the parent's list is expected to be empty.
   */
  @Override
  public void replaceAll(EntityType type, ParentRef parent, List<?> payloads, String transactionId) {
    Preconditions.checkArgument(type.isIndexed(), "%s is not an indexed entity", type);
    ApiVersion version = getApiVersion();
    if (version.usesNestedPaths()) {
      execute(HttpMethods.PUT, type.buildPath(version, parent, null),
        withTransaction(type.buildParentQuery(version, parent), transactionId), payloads);
      return;
    }
    for (Object payload : payloads) {
      create(type, parent, payload, transactionId);
    }
  }

  private static String indexOf(Object payload) {
    if (!(payload instanceof IndexedPayload) || ((IndexedPayload) payload).getIndex() == null) {
      throw new IllegalArgumentException("Indexed entity requires an index: " + payload);
    }
    return String.valueOf(((IndexedPayload) payload).getIndex());
  }

  @Override
  public BackendPayload getBackend(String name) {
    return get(EntityType.BACKEND, null, name, BackendPayload.class);
  }

  @Override
  public void createBackend(BackendPayload backend, String transactionId) {
    create(EntityType.BACKEND, null, backend, transactionId);
  }

  @Override
  public void updateBackend(BackendPayload backend, String transactionId) {
    update(EntityType.BACKEND, null, backend.getName(), backend, transactionId);
  }

  @Override
  public void deleteBackend(String name, String transactionId) {
    delete(EntityType.BACKEND, null, name, transactionId);
  }

  @Override
  public FrontendPayload getFrontend(String name) {
    return get(EntityType.FRONTEND, null, name, FrontendPayload.class);
  }

  @Override
  public void createFrontend(FrontendPayload frontend, String transactionId) {
    create(EntityType.FRONTEND, null, frontend, transactionId);
  }

  @Override
  public void updateFrontend(FrontendPayload frontend, String transactionId) {
    update(EntityType.FRONTEND, null, frontend.getName(), frontend, transactionId);
  }

  @Override
  public void deleteFrontend(String name, String transactionId) {
    delete(EntityType.FRONTEND, null, name, transactionId);
  }

  @Override
  public List<ServerPayload> getServers(ParentRef parent) {
    return getAll(EntityType.SERVER, parent, ServerPayload.class);
  }

  @Override
  public ServerPayload getServer(ParentRef parent, String name) {
    return get(EntityType.SERVER, parent, name, ServerPayload.class);
  }

  @Override
  public void createServer(ParentRef parent, ServerPayload server, String transactionId) {
    create(EntityType.SERVER, parent, server, transactionId);
  }

  @Override
  public void updateServer(ParentRef parent, ServerPayload server, String transactionId) {
    update(EntityType.SERVER, parent, server.getName(), server, transactionId);
  }

  @Override
  public void deleteServer(ParentRef parent, String name, String transactionId) {
    delete(EntityType.SERVER, parent, name, transactionId);
  }

  @Override
  public List<AclPayload> getAcls(ParentRef parent) {
    return getAll(EntityType.ACL, parent, AclPayload.class);
  }

  @Override
  public void createAcl(ParentRef parent, AclPayload acl, String transactionId) {
    create(EntityType.ACL, parent, acl, transactionId);
  }

  @Override
  public void updateAcl(ParentRef parent, AclPayload acl, String transactionId) {
    update(EntityType.ACL, parent, indexOf(acl), acl, transactionId);
  }

  @Override
  public void deleteAcl(ParentRef parent, int index, String transactionId) {
    delete(EntityType.ACL, parent, String.valueOf(index), transactionId);
  }

  @Override
  public GlobalPayload getGlobal() {
    return get(EntityType.GLOBAL, null, null, GlobalPayload.class);
  }

  @Override
  public void updateGlobal(GlobalPayload global, String transactionId) {
    update(EntityType.GLOBAL, null, null, global, transactionId);
  }

}
