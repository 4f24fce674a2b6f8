package net.haproxy.dataplane.client.transaction;

import net.haproxy.dataplane.abstractions.data.TransactionInfo;
import net.haproxy.dataplane.abstractions.exceptions.OperationCancelledException;
import net.haproxy.dataplane.abstractions.exceptions.RetriesExhaustedException;
import net.haproxy.dataplane.abstractions.logging.ILog;
import net.haproxy.dataplane.abstractions.logging.LogManager;
import net.haproxy.dataplane.client.utils.CancellationTokenSource.CancellationToken;

import com.google.common.base.Preconditions;

/**
 * Runs work inside a transaction and repeats the whole begin, work, commit cycle with a fresh
 * transaction while it fails for reasons the {@link RetryableErrorClassifier} considers transient.
 */
public class TransactionRetryExecutor {

  private static final ILog log = LogManager.getCurrentClassLogger();

  private final TransactionManager transactionManager;
  private final RetryableErrorClassifier classifier;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public TransactionRetryExecutor(TransactionManager transactionManager, RetryableErrorClassifier classifier, RetryPolicy retryPolicy) {
    this(transactionManager, classifier, retryPolicy, Sleeper.THREAD_SLEEPER);
  }

  public TransactionRetryExecutor(TransactionManager transactionManager, RetryableErrorClassifier classifier, RetryPolicy retryPolicy, Sleeper sleeper) {
    this.transactionManager = Preconditions.checkNotNull(transactionManager, "transactionManager");
    this.classifier = Preconditions.checkNotNull(classifier, "classifier");
    this.retryPolicy = Preconditions.checkNotNull(retryPolicy, "retryPolicy");
    this.sleeper = Preconditions.checkNotNull(sleeper, "sleeper");
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public <T> T execute(String operation, TransactionalWork<T> work) {
    return execute(operation, work, null);
  }

  /**
   * @param operation name used in logs and errors
   * @param work receives the id of the transaction of the current attempt
   * @param token may be null
   * @throws RetriesExhaustedException when every attempt failed with a retryable error
   */
  public <T> T execute(String operation, TransactionalWork<T> work, CancellationToken token) {
    int attempt = 1;
    while (true) {
      if (token != null) {
        token.throwIfCancellationRequested();
      }
      transition(operation, attempt, AttemptOutcome.ATTEMPTING, null);
      TransactionInfo transaction = null;
      try {
        transaction = transactionManager.begin();
        T result = work.run(transaction.getId());
        transactionManager.commit(transaction.getId());
        transition(operation, attempt, AttemptOutcome.SUCCEEDED, null);
        return result;
      } catch (RuntimeException e) {
        if (transaction != null) {
          transactionManager.rollbackAfterFailure(transaction.getId(), e);
        }
        if (!classifier.isRetryable(e)) {
          transition(operation, attempt, AttemptOutcome.FAILED_FATAL, e);
          throw e;
        }
        if (attempt >= retryPolicy.getMaxAttempts()) {
          transition(operation, attempt, AttemptOutcome.RETRIES_EXHAUSTED, e);
          throw new RetriesExhaustedException(operation, attempt, e);
        }
        transition(operation, attempt, AttemptOutcome.FAILED_RETRYABLE, e);
      }
      waitBeforeRetry(token);
      attempt++;
    }
  }

  private void waitBeforeRetry(CancellationToken token) {
    try {
      sleeper.sleep(retryPolicy.getDelayMillis(), token);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("Interrupted while waiting before the next attempt", e);
    }
    if (token != null) {
      token.throwIfCancellationRequested();
    }
  }

  private void transition(String operation, int attempt, AttemptOutcome outcome, Throwable error) {
    switch (outcome) {
      case ATTEMPTING:
      case SUCCEEDED:
        log.debug("%s: attempt %d of %d %s", operation, attempt, retryPolicy.getMaxAttempts(), outcome);
        break;
      case FAILED_RETRYABLE:
        log.warn("%s: attempt %d of %d failed with a retryable error (%s), retrying in %d ms: %s", operation, attempt,
          retryPolicy.getMaxAttempts(), classifier.findMatchingRule(error), retryPolicy.getDelayMillis(), error.getMessage());
        break;
      case FAILED_FATAL:
        log.debug("%s: attempt %d failed with a non retryable error: %s", operation, attempt, error.getMessage());
        break;
      case RETRIES_EXHAUSTED:
        log.warn("%s: giving up after %d attempts: %s", operation, attempt, error.getMessage());
        break;
    }
  }
}
