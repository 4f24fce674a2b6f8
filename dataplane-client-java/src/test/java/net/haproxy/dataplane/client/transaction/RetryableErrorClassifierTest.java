package net.haproxy.dataplane.client.transaction;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.Arrays;

import net.haproxy.dataplane.abstractions.data.ApiError;
import net.haproxy.dataplane.abstractions.exceptions.BundleOperationException;
import net.haproxy.dataplane.abstractions.exceptions.HttpOperationException;
import net.haproxy.dataplane.abstractions.exceptions.OperationCancelledException;
import net.haproxy.dataplane.abstractions.exceptions.ServerClientException;

import org.junit.Test;


public class RetryableErrorClassifierTest {

  private final RetryableErrorClassifier classifier = new RetryableErrorClassifier();

  static HttpOperationException apiError(int status, String message) {
    String body = "{\"code\":" + status + ",\"message\":\"" + message + "\"}";
    return new HttpOperationException("Invalid status code:" + status, null, null, status, body, new ApiError(status, message));
  }

  @Test
  public void testRetryableSignatures() {
    assertEquals(ErrorRule.TRANSACTION_OUTDATED, classifier.findMatchingRule(apiError(406, "Transaction 42 is outdated and cannot be committed")));
    assertEquals(ErrorRule.TRANSACTION_DOES_NOT_EXIST, classifier.findMatchingRule(apiError(400, "transaction does not exist: 42")));
    assertEquals(ErrorRule.VERSION_MISMATCH, classifier.findMatchingRule(apiError(409, "Version Mismatch")));
    assertEquals(ErrorRule.VERSION_OR_TRANSACTION_NOT_SPECIFIED, classifier.findMatchingRule(apiError(400, "version or transaction not specified")));
    assertEquals(ErrorRule.TRANSIENT_DEFAULTS_VALIDATION,
      classifier.findMatchingRule(apiError(400, "validation error: unknown keyword in defaults section")));
  }

  @Test
  public void testFatalErrors() {
    assertFalse(classifier.isRetryable(apiError(400, "invalid server address")));
    assertFalse(classifier.isRetryable(apiError(409, "object backend b1 already exists")));
    assertFalse(classifier.isRetryable(apiError(422, "validation error: missing name")));
    assertFalse(classifier.isRetryable(new ServerClientException("Connection refused")));
    assertFalse(classifier.isRetryable(null));
  }

  @Test
  public void testPartialSignatureIsNotEnough() {
    assertFalse(classifier.isRetryable(apiError(400, "transaction failed")));
    assertFalse(classifier.isRetryable(apiError(406, "outdated transaction")));
    assertFalse(classifier.isRetryable(apiError(400, "defaults section is fine")));
  }

  @Test
  public void testLooksThroughWrappers() {
    BundleOperationException wrapped = new BundleOperationException("Server 1 (web1) creation", apiError(409, "version mismatch"));
    assertTrue(classifier.isRetryable(wrapped));
  }

  @Test
  public void testMatchesPlainMessageWithoutApiError() {
    assertTrue(classifier.isRetryable(new ServerClientException("transaction 7 is outdated and cannot be committed")));
  }

  @Test
  public void testClientBuiltMessagesAreIgnored() {
    HttpOperationException invalidAcl = new HttpOperationException(
      "Invalid status code:400 for POST /v3/services/haproxy/configuration/frontends/outdated_clients/acls/1?transaction_id=tx1: invalid ACL criterion",
      null, null, 400, "{\"code\":400,\"message\":\"invalid ACL criterion\"}", new ApiError(400, "invalid ACL criterion"));
    assertFalse(classifier.isRetryable(invalidAcl));
    assertFalse(classifier.isRetryable(new BundleOperationException("Frontend outdated_clients of transaction_log creation", invalidAcl)));
    assertFalse(classifier.isRetryable(new ServerClientException("POST /v3/services/haproxy/configuration/backends/version_mismatch?transaction_id=tx1 failed",
      new IOException("Connection reset"))));
  }

  @Test
  public void testCancellationIsNeverRetried() {
    OperationCancelledException cancelled = new OperationCancelledException("version mismatch while cancelled");
    assertNull(classifier.findMatchingRule(cancelled));
    assertTrue(RetryableErrorClassifier.isCancellation(new BundleOperationException("step", cancelled)));
  }

  @Test
  public void testCustomRuleSet() {
    RetryableErrorClassifier onlyMismatch = new RetryableErrorClassifier(Arrays.asList(ErrorRule.VERSION_MISMATCH));
    assertTrue(onlyMismatch.isRetryable(apiError(409, "version mismatch")));
    assertFalse(onlyMismatch.isRetryable(apiError(406, "transaction is outdated")));
  }

  @Test
  public void testMissingObject() {
    assertTrue(classifier.isMissingObject(apiError(404, "not here")));
    assertTrue(classifier.isMissingObject(apiError(400, "missing object: acl 3")));
    assertTrue(classifier.isMissingObject(new BundleOperationException("ACL 1 deletion", apiError(400, "object does not exist"))));
    assertFalse(classifier.isMissingObject(apiError(400, "transaction does not exist")));
    assertFalse(classifier.isMissingObject(apiError(404, "transaction does not exist: tx1")));
    assertFalse(classifier.isMissingObject(new BundleOperationException("ACL 1 (missing object) deletion", apiError(500, "internal error"))));
    assertFalse(classifier.isMissingObject(apiError(500, "internal error")));
  }
}
