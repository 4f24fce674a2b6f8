package net.haproxy.dataplane.client.bundle;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import net.haproxy.dataplane.abstractions.data.AclPayload;
import net.haproxy.dataplane.abstractions.data.BackendPayload;
import net.haproxy.dataplane.abstractions.data.FrontendPayload;
import net.haproxy.dataplane.abstractions.data.ParentRef;
import net.haproxy.dataplane.abstractions.data.ServerPayload;
import net.haproxy.dataplane.abstractions.exceptions.BundleOperationException;
import net.haproxy.dataplane.abstractions.exceptions.HttpOperationException;
import net.haproxy.dataplane.abstractions.exceptions.OperationCancelledException;
import net.haproxy.dataplane.abstractions.exceptions.RetriesExhaustedException;
import net.haproxy.dataplane.client.DataPlaneAwareTests;
import net.haproxy.dataplane.client.DataPlaneStore;
import net.haproxy.dataplane.client.utils.CancellationTokenSource;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;


public class BundleOperationsTest extends DataPlaneAwareTests {

  private DataPlaneStore store;

  @Before
  public void openStore() {
    store = createStore();
  }

  @After
  public void closeStore() throws Exception {
    store.close();
  }

  private static ResourceBundle webBundle() {
    ParentRef backend = ParentRef.backend("b1");
    ParentRef frontend = ParentRef.frontend("fe1");
    return new ResourceBundle()
      .setBackend(new BackendPayload("b1", "http"))
      .addServer(backend, new ServerPayload("web1", "10.0.0.1", 8080L))
      .addServer(backend, new ServerPayload("web2", "10.0.0.2", 8080L))
      .setFrontend(new FrontendPayload("fe1", "b1", "http"))
      .addAcl(frontend, new AclPayload("is_api", 0, "path_beg", "/api"))
      .addAcl(frontend, new AclPayload("is_static", 1, "path_beg", "/static"))
      .addAcl(frontend, new AclPayload("is_admin", 2, "path_beg", "/admin"));
  }

  private static List<String> descriptions(List<BundleStep> steps) {
    List<String> result = new ArrayList<>();
    for (BundleStep step : steps) {
      result.add(step.getDescription());
    }
    return result;
  }

  @Test
  public void testCreateStepOrder() {
    assertEquals(Arrays.asList(
      "Backend b1 creation",
      "Server 1 (web1) creation",
      "Server 2 (web2) creation",
      "Frontend fe1 creation",
      "ACL 1 (is_api) creation",
      "ACL 2 (is_static) creation",
      "ACL 3 (is_admin) creation"), descriptions(store.bundles().createSteps(webBundle())));
  }

  @Test
  public void testDeleteStepOrder() {
    ResourceBundle bundle = new ResourceBundle()
      .setBackend(new BackendPayload("b1", "http"))
      .addServer(ParentRef.backend("b1"), new ServerPayload("web1", "10.0.0.1", 8080L))
      .addServer(ParentRef.backend("b1"), new ServerPayload("web2", "10.0.0.2", 8080L))
      .setFrontend(new FrontendPayload("fe1", "b1", "http"))
      .addAcl(ParentRef.frontend("fe1"), new AclPayload("low", 0, "src", "10.0.0.0/8"))
      .addAcl(ParentRef.frontend("fe1"), new AclPayload("high", 4, "src", "10.1.0.0/16"))
      .addAcl(ParentRef.frontend("fe1"), new AclPayload("mid", 2, "src", "10.2.0.0/16"));
    assertEquals(Arrays.asList(
      "ACL 2 (high) deletion",
      "ACL 3 (mid) deletion",
      "ACL 1 (low) deletion",
      "Frontend fe1 deletion",
      "Server 2 (web2) deletion",
      "Server 1 (web1) deletion",
      "Backend b1 deletion"), descriptions(store.bundles().deleteSteps(bundle)));
  }

  @Test
  public void testCreateRunsInOneTransaction() {
    store.bundles().create(webBundle());

    assertEquals(Arrays.asList(
      "BEGIN " + server.getTransactionIds().get(0),
      "POST backends",
      "POST backends/b1/servers",
      "POST backends/b1/servers",
      "POST frontends",
      "POST frontends/fe1/acls/0",
      "POST frontends/fe1/acls/1",
      "POST frontends/fe1/acls/2",
      "COMMIT " + server.getTransactionIds().get(0)), server.getJournal());
    assertEquals(2L, server.getVersion());
    assertEquals(3, server.getCommitted("frontends/fe1/acls").size());
    assertTrue(sleeper.getDelays().isEmpty());
  }

  @Test
  public void testFatalFailureLeavesNothingBehind() {
    server.failNext("POST", "frontends/fe1/acls/1", 1, 400, "invalid ACL criterion: path_bgn");
    try {
      store.bundles().create(webBundle());
      fail();
    } catch (BundleOperationException e) {
      assertEquals("ACL 2 (is_static) creation", e.getStep());
      assertTrue(e.getCause() instanceof HttpOperationException);
      assertEquals(400, ((HttpOperationException) e.getCause()).getStatusCode());
    }
    assertEquals(0, server.countCommittedEntities());
    assertEquals(1, server.countJournal("BEGIN"));
    assertEquals(1, server.countJournal("ROLLBACK"));
    assertEquals(0, server.countJournal("COMMIT"));
    assertEquals(0, server.getOpenTransactionCount());
    assertEquals(1L, server.getVersion());
    assertTrue(sleeper.getDelays().isEmpty());
  }

  @Test
  public void testRetriesOnVersionMismatch() {
    server.failNext("POST", "backends/b1/servers", 3, 409, "version mismatch");
    store.bundles().create(webBundle());

    assertEquals(4, server.getTransactionIds().size());
    assertEquals(4, server.countJournal("BEGIN"));
    assertEquals(3, server.countJournal("ROLLBACK"));
    assertEquals(1, server.countJournal("COMMIT"));
    assertEquals(Arrays.asList(2000L, 2000L, 2000L), sleeper.getDelays());
    assertEquals(2, server.getCommitted("backends/b1/servers").size());
    assertEquals(3, server.getCommitted("frontends/fe1/acls").size());
  }

  @Test
  public void testRetriesWhenAnotherWriterCommitsFirst() {
    server.onRequest("POST", "/configuration/frontends", 1, new Runnable() {
      @Override
      public void run() {
        server.bumpVersion();
      }
    });
    store.bundles().create(webBundle());

    assertEquals(2, server.countJournal("BEGIN"));
    assertEquals(1, server.countJournal("ROLLBACK"));
    assertEquals(1, server.countJournal("COMMIT"));
    assertEquals(1, sleeper.getDelays().size());
    assertEquals(1, server.getCommitted("frontends").size());
  }

  @Test
  public void testEntityNamesDoNotMakeFailuresRetryable() {
    ParentRef frontend = ParentRef.frontend("outdated_clients");
    ResourceBundle bundle = new ResourceBundle()
      .setBackend(new BackendPayload("transaction_log", "http"))
      .setFrontend(new FrontendPayload("outdated_clients", "transaction_log", "http"))
      .addAcl(frontend, new AclPayload("is_api", 0, "path_beg", "/api"))
      .addAcl(frontend, new AclPayload("is_static", 1, "path_bgn", "/static"));
    server.failNext("POST", "frontends/outdated_clients/acls/1", 100, 400, "invalid ACL criterion: path_bgn");
    try {
      store.bundles().create(bundle);
      fail();
    } catch (BundleOperationException e) {
      assertEquals("ACL 2 (is_static) creation", e.getStep());
      assertTrue(e.getMessage().contains("transaction_id="));
    }
    assertEquals(1, server.countJournal("BEGIN"));
    assertEquals(1, server.countJournal("ROLLBACK"));
    assertTrue(sleeper.getDelays().isEmpty());
    assertEquals(0, server.countCommittedEntities());
  }

  @Test
  public void testGivesUpAfterConfiguredAttempts() {
    store.getConventions().setMaxAttempts(3);
    server.failNext("POST", "/configuration/backends", 100, 406, "transaction 7 is outdated and cannot be committed");
    try {
      store.bundles().create(webBundle());
      fail();
    } catch (RetriesExhaustedException e) {
      assertEquals(3, e.getAttempts());
      assertTrue(e.getCause() instanceof BundleOperationException);
    }
    assertEquals(3, server.countJournal("ROLLBACK"));
    assertEquals(2, sleeper.getDelays().size());
    assertEquals(0, server.countCommittedEntities());
  }

  @Test
  public void testUpdate() {
    store.bundles().create(webBundle());
    ResourceBundle changed = new ResourceBundle()
      .setBackend(new BackendPayload("b1", "tcp"))
      .addServer(ParentRef.backend("b1"), new ServerPayload("web1", "10.0.0.11", 9090L))
      .addAcl(ParentRef.frontend("fe1"), new AclPayload("is_api", 0, "path_beg", "/api/v2"));
    store.bundles().update(changed);

    ResourceBundle current = store.bundles().read(changed);
    assertEquals("tcp", current.getBackend().getMode());
    assertEquals("10.0.0.11", current.getServers().get(0).getPayload().getAddress());
    assertEquals("/api/v2", current.getAcls().get(0).getPayload().getValue());
    assertEquals(3, current.getAcls().size());
  }

  @Test
  public void testDeleteSkipsMissingAcls() {
    store.bundles().create(webBundle());
    ResourceBundle bundle = webBundle().addAcl(ParentRef.frontend("fe1"), new AclPayload("gone", 7, "src", "127.0.0.1"));
    store.bundles().delete(bundle);

    assertEquals(0, server.countCommittedEntities());
    assertEquals(2, server.countJournal("COMMIT"));
    assertTrue(server.getJournal().contains("DELETE frontends/fe1/acls/7"));
    assertTrue(sleeper.getDelays().isEmpty());
  }

  @Test
  public void testDeleteAbortsOnOtherFailures() {
    store.bundles().create(webBundle());
    server.failNext("DELETE", "/configuration/frontends/fe1", 1, 500, "cannot remove frontend");
    try {
      store.bundles().delete(webBundle());
      fail();
    } catch (BundleOperationException e) {
      assertEquals("Frontend fe1 deletion", e.getStep());
    }
    assertEquals(3, server.getCommitted("frontends/fe1/acls").size());
    assertEquals(1, server.getCommitted("frontends").size());
  }

  @Test
  public void testReadReturnsCommittedState() {
    ResourceBundle bundle = webBundle();
    store.bundles().create(bundle);

    ResourceBundle current = store.bundles().read(bundle);
    assertNotNull(current.getBackend());
    assertEquals("b1", current.getBackend().getName());
    assertEquals(2, current.getServers().size());
    assertEquals("web2", current.getServers().get(1).getPayload().getName());
    assertEquals("b1", current.getFrontend().getDefaultBackend());
    assertEquals(3, current.getAcls().size());
    assertEquals("is_admin", current.getAcls().get(2).getPayload().getAclName());
  }

  @Test
  public void testReadOfMissingBundle() {
    ResourceBundle current = store.bundles().read(webBundle());
    assertNull(current.getBackend());
    assertNull(current.getFrontend());
    assertTrue(current.getServers().isEmpty());
    assertTrue(current.getAcls().isEmpty());
  }

  @Test
  public void testCancelledOperationIsNotWrapped() {
    CancellationTokenSource source = new CancellationTokenSource();
    source.cancel();
    try {
      store.bundles().create(webBundle(), source.getToken());
      fail();
    } catch (OperationCancelledException e) {
      // expected
    }
    assertEquals(0, server.countJournal("BEGIN"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyBundle() {
    store.bundles().create(new ResourceBundle());
  }
}
