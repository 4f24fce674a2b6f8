package net.haproxy.dataplane.client;

import net.haproxy.dataplane.abstractions.connection.OperationCredentials;
import net.haproxy.dataplane.abstractions.data.ConnectionStringParser;
import net.haproxy.dataplane.abstractions.data.DataPlaneConnectionStringOptions;
import net.haproxy.dataplane.abstractions.logging.ILog;
import net.haproxy.dataplane.abstractions.logging.LogManager;
import net.haproxy.dataplane.client.bundle.BundleOperations;
import net.haproxy.dataplane.client.connection.IConfigurationCommands;
import net.haproxy.dataplane.client.connection.ServerClient;
import net.haproxy.dataplane.client.connection.implementation.HttpJsonRequestFactory;
import net.haproxy.dataplane.client.document.DataPlaneConvention;
import net.haproxy.dataplane.client.transaction.RetryPolicy;
import net.haproxy.dataplane.client.transaction.RetryableErrorClassifier;
import net.haproxy.dataplane.client.transaction.Sleeper;
import net.haproxy.dataplane.client.transaction.TransactionManager;
import net.haproxy.dataplane.client.transaction.TransactionRetryExecutor;

import org.apache.commons.lang.StringUtils;

/**
 * Entry point of the client. Holds the connection settings and the HTTP connection pool
 * shared by everything obtained from it. Close it when done.
 */
public class DataPlaneStore implements AutoCloseable {

  private static final ILog log = LogManager.getCurrentClassLogger();

  private String url;
  private String username;
  private String password;
  private DataPlaneConvention conventions = new DataPlaneConvention();
  private Sleeper sleeper = Sleeper.THREAD_SLEEPER;
  private final RetryableErrorClassifier classifier = new RetryableErrorClassifier();

  private HttpJsonRequestFactory jsonRequestFactory;
  private ServerClient serverClient;
  private volatile boolean initialized;
  private volatile boolean disposed;

  public DataPlaneStore() {
    super();
  }

  public DataPlaneStore(String url, String username, String password) {
    this();
    setUrl(url);
    this.username = username;
    this.password = password;
  }

  /**
   *  Set store settings based on a given connection string.
   *  Ex. Url=https://lb:5555;Username=admin;Password=secret;ApiVersion=v3
   * @param connString
   */
  public void parseConnectionString(String connString) {
    ConnectionStringParser parser = ConnectionStringParser.fromConnectionString(connString);
    parser.parse();
    setConnectionStringSettings(parser.getConnectionStringOptions());
  }

  protected void setConnectionStringSettings(DataPlaneConnectionStringOptions options) {
    if (StringUtils.isNotEmpty(options.getUrl())) {
      setUrl(options.getUrl());
    }
    if (options.getUsername() != null) {
      username = options.getUsername();
      password = options.getPassword();
    }
    if (options.getApiVersion() != null) {
      conventions.setApiVersion(options.getApiVersion());
    }
    if (options.getInsecure() != null) {
      conventions.setInsecure(options.getInsecure());
    }
    if (options.getMaxAttempts() != null) {
      conventions.setMaxAttempts(options.getMaxAttempts());
    }
    if (options.getRetryDelayMillis() != null) {
      conventions.setRetryDelayMillis(options.getRetryDelayMillis());
    }
    if (options.getTimeoutMillis() != null) {
      conventions.setRequestTimeoutMillis(options.getTimeoutMillis());
    }
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public DataPlaneConvention getConventions() {
    return conventions;
  }

  public void setConventions(DataPlaneConvention conventions) {
    this.conventions = conventions;
  }

  /**
   * Replaces how the store waits between attempts.
   */
  public void setSleeper(Sleeper sleeper) {
    this.sleeper = sleeper;
  }

  public DataPlaneStore initialize() {
    if (initialized) {
      return this;
    }
    assertValidConfiguration();

    jsonRequestFactory = new HttpJsonRequestFactory(conventions.getMaxConnectionsPerRoute(), conventions.isInsecure());
    serverClient = new ServerClient(url, conventions, new OperationCredentials(username, password), jsonRequestFactory);
    if (conventions.isInsecure()) {
      log.warn("TLS certificate verification is disabled for %s", url);
    }
    log.info("Data Plane API client initialized for %s (API %s)", url, conventions.getApiVersion());
    initialized = true;
    return this;
  }

  private void assertValidConfiguration() {
    if (StringUtils.isBlank(url)) {
      throw new IllegalArgumentException("Data Plane API URL cannot be empty");
    }
    if (StringUtils.isBlank(username) || password == null) {
      throw new IllegalArgumentException("Username and password must both be set");
    }
  }

  public HttpJsonRequestFactory getJsonRequestFactory() {
    assertInitialized();
    return jsonRequestFactory;
  }

  public IConfigurationCommands getConfigurationCommands() {
    assertInitialized();
    return serverClient;
  }

  /**
   * Transactions for callers that drive begin, commit and rollback on their own.
   */
  public TransactionManager openTransactionManager() {
    return new TransactionManager(getConfigurationCommands());
  }

  /**
   * Runs arbitrary work in a transaction with the store's retry policy.
   */
  public TransactionRetryExecutor openRetryExecutor() {
    return new TransactionRetryExecutor(openTransactionManager(), classifier, RetryPolicy.fromConvention(conventions), sleeper);
  }

  public BundleOperations bundles() {
    return new BundleOperations(getConfigurationCommands(), classifier, RetryPolicy.fromConvention(conventions), sleeper);
  }

  private void assertInitialized() {
    if (disposed) {
      throw new IllegalStateException("The store was already closed");
    }
    if (!initialized) {
      throw new IllegalStateException("You cannot access the Data Plane API commands before initializing the store. "
        + "Did you forget calling initialize()?");
    }
  }

  @Override
  public void close() throws Exception {
    if (disposed) {
      return;
    }
    disposed = true;
    if (jsonRequestFactory != null) {
      jsonRequestFactory.close();
    }
  }
}
