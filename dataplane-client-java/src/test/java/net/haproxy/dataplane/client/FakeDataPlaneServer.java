package net.haproxy.dataplane.client;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import net.haproxy.dataplane.abstractions.extensions.JsonExtensions;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpException;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.bootstrap.HttpServer;
import org.apache.http.impl.bootstrap.ServerBootstrap;
import org.apache.http.protocol.HttpContext;
import org.apache.http.protocol.HttpRequestHandler;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.type.TypeReference;

/**
 * In memory stand-in for the HAProxy Data Plane API: versioned configuration, transactions that stage
 * edits and apply them atomically on commit, both response layouts, and injectable failures.
 */
public class FakeDataPlaneServer implements HttpRequestHandler, AutoCloseable {

  public static final String USERNAME = "admin";
  public static final String PASSWORD = "s3cr3t";

  private static final String CONFIGURATION_PREFIX = "/services/haproxy/configuration";
  private static final String TRANSACTIONS_PREFIX = "/services/haproxy/transactions";

  private static final ObjectMapper mapper = JsonExtensions.createDefaultJsonSerializer();

  private HttpServer server;

  private long version = 1;
  private Map<String, List<Map<String, Object>>> committed = new LinkedHashMap<>();
  private Map<String, Object> committedGlobal = new LinkedHashMap<>();
  private final Map<String, Transaction> transactions = new LinkedHashMap<>();

  private final List<String> journal = new ArrayList<>();
  private final List<String> requestUris = new ArrayList<>();
  private final List<String> transactionIds = new ArrayList<>();
  private final List<InjectedResponse> injectedResponses = new ArrayList<>();
  private final List<RequestHook> hooks = new ArrayList<>();

  private static class Transaction {
    private final String id;
    private final long version;
    private final Map<String, List<Map<String, Object>>> staged;
    private Map<String, Object> stagedGlobal;
    private String status = "in_progress";

    Transaction(String id, long version, Map<String, List<Map<String, Object>>> staged, Map<String, Object> stagedGlobal) {
      this.id = id;
      this.version = version;
      this.staged = staged;
      this.stagedGlobal = stagedGlobal;
    }
  }

  private static class InjectedResponse {
    private final String method;
    private final String pathSuffix;
    private int remaining;
    private final int status;
    private final String body;

    InjectedResponse(String method, String pathSuffix, int remaining, int status, String body) {
      this.method = method;
      this.pathSuffix = pathSuffix;
      this.remaining = remaining;
      this.status = status;
      this.body = body;
    }
  }

  private static class RequestHook {
    private final String method;
    private final String pathSuffix;
    private int remaining;
    private final Runnable action;

    RequestHook(String method, String pathSuffix, int remaining, Runnable action) {
      this.method = method;
      this.pathSuffix = pathSuffix;
      this.remaining = remaining;
      this.action = action;
    }
  }

  private static class Reply {
    private final int status;
    private final Object body;

    Reply(int status, Object body) {
      this.status = status;
      this.body = body;
    }
  }

  public FakeDataPlaneServer start() throws IOException {
    server = ServerBootstrap.bootstrap()
      .setListenerPort(0)
      .setServerInfo("FakeDataPlane/1.0")
      .registerHandler("*", this)
      .create();
    server.start();
    return this;
  }

  public String getUrl() {
    return "http://localhost:" + server.getLocalPort();
  }

  @Override
  public void close() {
    if (server != null) {
      server.shutdown(1, TimeUnit.SECONDS);
    }
  }

  /**
   * The next <code>times</code> requests matching method and path suffix fail with a Data Plane style error body.
   */
  public synchronized void failNext(String method, String pathSuffix, int times, int status, String message) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", status);
    error.put("message", message);
    injectedResponses.add(new InjectedResponse(method, pathSuffix, times, status, toJson(error)));
  }

  /**
   * The next <code>times</code> requests matching method and path suffix get the given raw response.
   */
  public synchronized void respondNext(String method, String pathSuffix, int times, int status, String rawBody) {
    injectedResponses.add(new InjectedResponse(method, pathSuffix, times, status, rawBody));
  }

  /**
   * Runs action before handling the next <code>times</code> requests matching method and path suffix.
   */
  public synchronized void onRequest(String method, String pathSuffix, int times, Runnable action) {
    hooks.add(new RequestHook(method, pathSuffix, times, action));
  }

  /**
   * Simulates another writer committing a change, which makes open transactions outdated.
   */
  public synchronized void bumpVersion() {
    version++;
  }

  public synchronized long getVersion() {
    return version;
  }

  /**
   * Mutations, begins, commits and rollbacks in arrival order, e.g. "POST backends/b1/servers".
   */
  public synchronized List<String> getJournal() {
    return new ArrayList<>(journal);
  }

  public synchronized List<String> getRequestUris() {
    return new ArrayList<>(requestUris);
  }

  public synchronized List<String> getTransactionIds() {
    return new ArrayList<>(transactionIds);
  }

  public synchronized int countJournal(String prefix) {
    int count = 0;
    for (String entry : journal) {
      if (entry.startsWith(prefix)) {
        count++;
      }
    }
    return count;
  }

  public synchronized int getOpenTransactionCount() {
    return transactions.size();
  }

  /**
   * Committed entities of a collection, addressed v3 style, e.g. "frontends/fe1/acls".
   */
  public synchronized List<Map<String, Object>> getCommitted(String collection) {
    List<Map<String, Object>> items = committed.get(collection);
    return items != null ? new ArrayList<>(items) : new ArrayList<Map<String, Object>>();
  }

  public synchronized int countCommittedEntities() {
    int count = 0;
    for (List<Map<String, Object>> items : committed.values()) {
      count += items.size();
    }
    return count;
  }

  public synchronized void clearJournal() {
    journal.clear();
    requestUris.clear();
    transactionIds.clear();
  }

  @Override
  public void handle(HttpRequest request, HttpResponse response, HttpContext context) throws HttpException, IOException {
    String method = request.getRequestLine().getMethod();
    URI uri = URI.create(request.getRequestLine().getUri());
    String body = null;
    if (request instanceof HttpEntityEnclosingRequest && ((HttpEntityEnclosingRequest) request).getEntity() != null) {
      try (InputStream content = ((HttpEntityEnclosingRequest) request).getEntity().getContent()) {
        body = IOUtils.toString(content, StandardCharsets.UTF_8);
      }
    }

    runHooks(method, uri.getPath());

    Reply reply;
    synchronized (this) {
      requestUris.add(method + " " + request.getRequestLine().getUri());
      reply = dispatch(request, method, uri, body);
    }
    response.setStatusCode(reply.status);
    if (reply.body != null) {
      String text = reply.body instanceof String ? (String) reply.body : toJson(reply.body);
      response.setEntity(new StringEntity(text, ContentType.APPLICATION_JSON));
    }
  }

  private void runHooks(String method, String path) {
    List<Runnable> toRun = new ArrayList<>();
    synchronized (this) {
      Iterator<RequestHook> iterator = hooks.iterator();
      while (iterator.hasNext()) {
        RequestHook hook = iterator.next();
        if (hook.method.equals(method) && path.endsWith(hook.pathSuffix)) {
          toRun.add(hook.action);
          if (--hook.remaining <= 0) {
            iterator.remove();
          }
        }
      }
    }
    for (Runnable action : toRun) {
      action.run();
    }
  }

  private Reply dispatch(HttpRequest request, String method, URI uri, String body) {
    if (!isAuthorized(request)) {
      return error(401, "invalid credentials");
    }
    String path = uri.getPath();
    String[] versionAndPath = StringUtils.split(path, "/", 2);
    if (versionAndPath.length < 2 || !versionAndPath[0].matches("v[23]")) {
      return error(404, "unknown API version");
    }
    boolean wrapped = "v2".equals(versionAndPath[0]);
    String logicalPath = "/" + versionAndPath[1];

    Reply injected = takeInjected(method, logicalPath);
    if (injected != null) {
      return injected;
    }

    Map<String, String> query = new HashMap<>();
    for (NameValuePair pair : URLEncodedUtils.parse(uri, StandardCharsets.UTF_8)) {
      query.put(pair.getName(), pair.getValue());
    }

    if (logicalPath.startsWith(TRANSACTIONS_PREFIX)) {
      return handleTransaction(method, StringUtils.removeStart(logicalPath, TRANSACTIONS_PREFIX), query);
    }
    if (logicalPath.equals(CONFIGURATION_PREFIX + "/version")) {
      return new Reply(200, version);
    }
    if (logicalPath.startsWith(CONFIGURATION_PREFIX + "/")) {
      Reply reply = handleConfiguration(method, StringUtils.removeStart(logicalPath, CONFIGURATION_PREFIX + "/"), query, body);
      if (wrapped && reply.status < 300 && reply.body != null) {
        return new Reply(reply.status, Collections.singletonMap("data", reply.body));
      }
      return reply;
    }
    return error(404, "unknown path " + path);
  }

  private boolean isAuthorized(HttpRequest request) {
    String expected = "Basic " + Base64.encodeBase64String((USERNAME + ":" + PASSWORD).getBytes(StandardCharsets.UTF_8));
    return request.getFirstHeader(HttpHeaders.AUTHORIZATION) != null
      && expected.equals(request.getFirstHeader(HttpHeaders.AUTHORIZATION).getValue());
  }

  private Reply takeInjected(String method, String path) {
    Iterator<InjectedResponse> iterator = injectedResponses.iterator();
    while (iterator.hasNext()) {
      InjectedResponse injected = iterator.next();
      if (injected.method.equals(method) && path.endsWith(injected.pathSuffix)) {
        if (--injected.remaining <= 0) {
          iterator.remove();
        }
        return new Reply(injected.status, injected.body);
      }
    }
    return null;
  }

  private Reply handleTransaction(String method, String rest, Map<String, String> query) {
    String id = StringUtils.removeStart(rest, "/");
    switch (method) {
      case "POST": {
        if (!query.containsKey("version")) {
          return error(400, "version or transaction not specified");
        }
        long requested = Long.parseLong(query.get("version"));
        if (requested != version) {
          return error(409, "version mismatch: requested " + requested + ", current " + version);
        }
        Transaction transaction = new Transaction(UUID.randomUUID().toString(), version, deepCopy(committed), new LinkedHashMap<>(committedGlobal));
        transactions.put(transaction.id, transaction);
        transactionIds.add(transaction.id);
        journal.add("BEGIN " + transaction.id);
        return new Reply(201, describe(transaction));
      }
      case "PUT": {
        Transaction transaction = transactions.get(id);
        if (transaction == null) {
          return error(400, "transaction does not exist: " + id);
        }
        if (transaction.version != version) {
          transaction.status = "failed";
          return error(406, "transaction " + id + " is outdated and cannot be committed");
        }
        committed = transaction.staged;
        committedGlobal = transaction.stagedGlobal;
        version++;
        transactions.remove(id);
        transaction.status = "success";
        journal.add("COMMIT " + id);
        return new Reply(202, describe(transaction));
      }
      case "DELETE": {
        if (transactions.remove(id) == null) {
          return error(400, "transaction does not exist: " + id);
        }
        journal.add("ROLLBACK " + id);
        return new Reply(204, null);
      }
      default:
        return error(405, "method not allowed");
    }
  }

  private Reply handleConfiguration(String method, String rest, Map<String, String> query, String body) {
    List<String> segments = new ArrayList<>(Arrays.asList(StringUtils.split(rest, "/")));
    String transactionId = query.get("transaction_id");
    Transaction transaction = null;
    if (transactionId != null) {
      transaction = transactions.get(transactionId);
      if (transaction == null) {
        return error(400, "transaction does not exist: " + transactionId);
      }
    } else if (!"GET".equals(method)) {
      return error(400, "version or transaction not specified");
    }

    if (segments.size() == 1 && "global".equals(segments.get(0))) {
      return handleGlobal(method, transaction, body);
    }

    List<String> parent = legacyParent(query);
    if (parent != null) {
      segments.addAll(0, parent);
    }

    Map<String, List<Map<String, Object>>> state = transaction != null ? transaction.staged : committed;
    boolean item = segments.size() % 2 == 0;
    String key = item ? segments.remove(segments.size() - 1) : null;
    String collection = StringUtils.join(segments, "/");
    if (!"GET".equals(method)) {
      journal.add(method + " " + collection + (key != null ? "/" + key : ""));
    }

    if (segments.size() >= 3 && findByKey(state.get(segments.get(0)), segments.get(1)) < 0) {
      return error(404, "missing object: " + segments.get(0) + " " + segments.get(1) + " does not exist");
    }
    List<Map<String, Object>> items = state.get(collection);
    if (items == null) {
      items = new ArrayList<>();
      state.put(collection, items);
    }

    switch (method) {
      case "GET":
        if (key == null) {
          return new Reply(200, items);
        }
        int found = findByKey(items, key);
        return found >= 0 ? new Reply(200, items.get(found)) : error(404, "missing object: " + collection + "/" + key);
      case "POST":
        return create(items, collection, key, readMap(body));
      case "PUT":
        if (key == null) {
          items.clear();
          items.addAll(readList(body));
          reindex(items);
          return new Reply(202, items);
        }
        int existing = findByKey(items, key);
        if (existing < 0) {
          return error(404, "missing object: " + collection + "/" + key);
        }
        Map<String, Object> replacement = readMap(body);
        items.set(existing, replacement);
        reindex(items);
        return new Reply(202, replacement);
      case "DELETE":
        int toDelete = findByKey(items, key);
        if (toDelete < 0) {
          return error(404, "missing object: " + collection + "/" + key);
        }
        Map<String, Object> removed = items.remove(toDelete);
        reindex(items);
        if (segments.size() == 1) {
          removeChildren(state, collection + "/" + removed.get("name") + "/");
        }
        return new Reply(204, null);
      default:
        return error(405, "method not allowed");
    }
  }

  private Reply create(List<Map<String, Object>> items, String collection, String key, Map<String, Object> payload) {
    boolean indexed = payload.containsKey("index") && !payload.containsKey("name");
    if (indexed) {
      int position = key != null ? Integer.parseInt(key) : ((Number) payload.get("index")).intValue();
      items.add(Math.max(0, Math.min(position, items.size())), payload);
      reindex(items);
      return new Reply(201, payload);
    }
    Object name = payload.get("name");
    if (name == null) {
      return error(422, "validation error: name is required");
    }
    if (findByKey(items, name.toString()) >= 0) {
      return error(409, "object " + collection + "/" + name + " already exists");
    }
    items.add(payload);
    return new Reply(201, payload);
  }

  private Reply handleGlobal(String method, Transaction transaction, String body) {
    if ("GET".equals(method)) {
      return new Reply(200, transaction != null ? transaction.stagedGlobal : committedGlobal);
    }
    if (!"PUT".equals(method)) {
      return error(405, "method not allowed");
    }
    journal.add("PUT global");
    transaction.stagedGlobal = readMap(body);
    return new Reply(202, transaction.stagedGlobal);
  }

  private static List<String> legacyParent(Map<String, String> query) {
    if (query.containsKey("parent_type")) {
      String type = query.get("parent_type");
      return Arrays.asList("peers".equals(type) ? "peers" : type + "s", query.get("parent_name"));
    }
    if (query.containsKey("backend")) {
      return Arrays.asList("backends", query.get("backend"));
    }
    if (query.containsKey("resolver")) {
      return Arrays.asList("resolvers", query.get("resolver"));
    }
    if (query.containsKey("peers")) {
      return Arrays.asList("peers", query.get("peers"));
    }
    return null;
  }

  private static int findByKey(List<Map<String, Object>> items, String key) {
    if (items == null) {
      return -1;
    }
    if (StringUtils.isNumeric(key)) {
      int position = Integer.parseInt(key);
      return position < items.size() && !items.get(position).containsKey("name") ? position : -1;
    }
    for (int i = 0; i < items.size(); i++) {
      if (key.equals(items.get(i).get("name"))) {
        return i;
      }
    }
    return -1;
  }

  private static void reindex(List<Map<String, Object>> items) {
    for (int i = 0; i < items.size(); i++) {
      if (items.get(i).containsKey("index")) {
        items.get(i).put("index", i);
      }
    }
  }

  private static void removeChildren(Map<String, List<Map<String, Object>>> state, String prefix) {
    Iterator<String> iterator = state.keySet().iterator();
    while (iterator.hasNext()) {
      if (iterator.next().startsWith(prefix)) {
        iterator.remove();
      }
    }
  }

  private static Map<String, Object> describe(Transaction transaction) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("_version", transaction.version);
    result.put("id", transaction.id);
    result.put("status", transaction.status);
    return result;
  }

  private static Map<String, List<Map<String, Object>>> deepCopy(Map<String, List<Map<String, Object>>> source) {
    Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<Map<String, Object>>> entry : source.entrySet()) {
      List<Map<String, Object>> items = new ArrayList<>();
      for (Map<String, Object> item : entry.getValue()) {
        items.add(new LinkedHashMap<>(item));
      }
      copy.put(entry.getKey(), items);
    }
    return copy;
  }

  private static Reply error(int status, String message) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", status);
    error.put("message", message);
    return new Reply(status, error);
  }

  private static Map<String, Object> readMap(String body) {
    try {
      return mapper.readValue(body, new TypeReference<LinkedHashMap<String, Object>>() {});
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid JSON object: " + body, e);
    }
  }

  private static List<Map<String, Object>> readList(String body) {
    try {
      return mapper.readValue(body, new TypeReference<ArrayList<LinkedHashMap<String, Object>>>() {});
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid JSON array: " + body, e);
    }
  }

  private static String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }
}
