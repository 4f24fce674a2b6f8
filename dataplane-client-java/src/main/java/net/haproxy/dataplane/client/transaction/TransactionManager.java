package net.haproxy.dataplane.client.transaction;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import net.haproxy.dataplane.abstractions.data.TransactionInfo;
import net.haproxy.dataplane.abstractions.logging.ILog;
import net.haproxy.dataplane.abstractions.logging.LogManager;
import net.haproxy.dataplane.client.connection.IConfigurationCommands;

import com.google.common.base.Preconditions;

/**
 * Begins, commits and rolls back Data Plane API transactions.
 * A transaction that was committed or rolled back through this manager can not be ended a second time.
 */
public class TransactionManager {

  private static final ILog log = LogManager.getCurrentClassLogger();

  private final IConfigurationCommands commands;

  private final Set<String> terminated = Collections.newSetFromMap(new ConcurrentHashMap<String, Boolean>());

  public TransactionManager(IConfigurationCommands commands) {
    this.commands = Preconditions.checkNotNull(commands, "commands");
  }

  public IConfigurationCommands getCommands() {
    return commands;
  }

  /**
   * Opens a transaction against the current configuration version.
   */
  public TransactionInfo begin() {
    long version = commands.getConfigurationVersion();
    TransactionInfo transaction = commands.createTransaction(version);
    log.debug("Started transaction %s at configuration version %d", transaction.getId(), version);
    return transaction;
  }

  public void commit(String transactionId) {
    ensureNotTerminated(transactionId);
    TransactionInfo result = commands.commitTransaction(transactionId);
    terminated.add(transactionId);
    log.debug("Committed transaction %s%s", transactionId, result != null ? ", status: " + result.getStatus() : "");
  }

  /**
   * Rollback is issued without the cancellation token, so a cancelled operation still cleans up its transaction.
   */
  public void rollback(String transactionId) {
    ensureNotTerminated(transactionId);
    commands.withCancellation(null).deleteTransaction(transactionId);
    terminated.add(transactionId);
    log.debug("Rolled back transaction %s", transactionId);
  }

  public boolean isTerminated(String transactionId) {
    return terminated.contains(transactionId);
  }

  /**
   * Runs work inside a new transaction and commits it. When work or commit fails the transaction
   * is rolled back and the original failure is rethrown. A failed rollback is only logged.
   */
  public <T> T runInTransaction(TransactionalWork<T> work) {
    TransactionInfo transaction = begin();
    try {
      T result = work.run(transaction.getId());
      commit(transaction.getId());
      return result;
    } catch (RuntimeException e) {
      rollbackAfterFailure(transaction.getId(), e);
      throw e;
    }
  }

  /**
   * Best effort rollback of a transaction whose work failed with primaryError.
   */
  public void rollbackAfterFailure(String transactionId, Throwable primaryError) {
    if (isTerminated(transactionId)) {
      return;
    }
    try {
      rollback(transactionId);
    } catch (RuntimeException rollbackError) {
      log.warnException("Rollback of transaction " + transactionId + " failed while handling: " + primaryError.getMessage(), rollbackError);
    }
  }

  private void ensureNotTerminated(String transactionId) {
    Preconditions.checkArgument(transactionId != null, "transactionId can not be null");
    if (terminated.contains(transactionId)) {
      throw new IllegalStateException("Transaction " + transactionId + " was already committed or rolled back");
    }
  }
}
