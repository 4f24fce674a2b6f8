package net.haproxy.dataplane.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import net.haproxy.dataplane.client.transaction.TransactionalWork;
import net.haproxy.dataplane.abstractions.data.ApiVersion;
import net.haproxy.dataplane.abstractions.data.BackendPayload;
import net.haproxy.dataplane.client.connection.implementation.HttpJsonRequestFactory;
import net.haproxy.dataplane.client.transaction.TransactionRetryExecutor;

import org.junit.Test;


public class DataPlaneStoreTest extends DataPlaneAwareTests {

  @Test
  public void testConnectionStringSettings() throws Exception {
    try (DataPlaneStore store = new DataPlaneStore()) {
      store.parseConnectionString("Url=" + server.getUrl() + "/;Username=admin;Password=s3cr3t;ApiVersion=v2;MaxAttempts=4;RetryDelay=50;Timeout=1000");
      assertEquals(server.getUrl(), store.getUrl());
      assertEquals("admin", store.getUsername());
      assertEquals(ApiVersion.V2, store.getConventions().getApiVersion());
      assertEquals(4, store.getConventions().getMaxAttempts());
      assertEquals(50L, store.getConventions().getRetryDelayMillis());
      assertEquals(1000, store.getConventions().getRequestTimeoutMillis());
      assertFalse(store.getConventions().isInsecure());

      store.initialize();
      assertEquals(1L, store.getConfigurationCommands().getConfigurationVersion());
      assertEquals(4, store.openRetryExecutor().getRetryPolicy().getMaxAttempts());
    }
  }

  @Test
  public void testDefaults() throws Exception {
    try (DataPlaneStore store = new DataPlaneStore(server.getUrl(), "admin", "s3cr3t")) {
      assertEquals(ApiVersion.V3, store.getConventions().getApiVersion());
      assertEquals(10, store.getConventions().getMaxAttempts());
      assertEquals(2000L, store.getConventions().getRetryDelayMillis());
      assertEquals(30000, store.getConventions().getRequestTimeoutMillis());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUrlIsRequired() {
    new DataPlaneStore(null, "admin", "s3cr3t").initialize();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCredentialsAreRequired() {
    new DataPlaneStore(server.getUrl(), null, null).initialize();
  }

  @Test(expected = IllegalStateException.class)
  public void testCommandsBeforeInitialize() {
    new DataPlaneStore(server.getUrl(), "admin", "s3cr3t").getConfigurationCommands();
  }

  @Test
  public void testClosedStore() throws Exception {
    DataPlaneStore store = createStore();
    HttpJsonRequestFactory requestFactory = store.getJsonRequestFactory();
    store.close();
    assertTrue(requestFactory.isDisposed());
    try {
      store.getConfigurationCommands();
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testRetryExecutorRunsArbitraryWork() throws Exception {
    try (DataPlaneStore store = createStore()) {
      final TransactionRetryExecutor executor = store.openRetryExecutor();
      String name = executor.execute("Create backend", new TransactionalWork<String>() {
        @Override
        public String run(String transactionId) {
          store.getConfigurationCommands().createBackend(new BackendPayload("api", "http"), transactionId);
          return "api";
        }
      });
      assertNotNull(store.getConfigurationCommands().getBackend(name));
      assertEquals(1, server.countJournal("COMMIT"));
    }
  }
}
