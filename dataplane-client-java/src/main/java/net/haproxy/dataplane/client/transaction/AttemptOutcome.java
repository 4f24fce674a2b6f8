package net.haproxy.dataplane.client.transaction;

/**
 * States a transactional operation passes through while it is retried.
 */
public enum AttemptOutcome {
  ATTEMPTING,
  SUCCEEDED,
  FAILED_RETRYABLE,
  FAILED_FATAL,
  RETRIES_EXHAUSTED;
}
