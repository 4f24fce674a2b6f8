package net.haproxy.dataplane.client.bundle;

import net.haproxy.dataplane.abstractions.exceptions.BundleOperationException;
import net.haproxy.dataplane.abstractions.exceptions.OperationCancelledException;
import net.haproxy.dataplane.client.connection.IConfigurationCommands;

/**
 * One resource operation of a bundle, run inside the bundle's transaction.
 */
public abstract class BundleStep {

  private final String description;

  protected BundleStep(String description) {
    this.description = description;
  }

  /**
   * e.g. "ACL 2 (is_api) creation"
   */
  public String getDescription() {
    return description;
  }

  protected abstract void execute(IConfigurationCommands commands, String transactionId);

  /**
   * @throws BundleOperationException naming this step, with the original failure as cause
   */
  public void run(IConfigurationCommands commands, String transactionId) {
    try {
      execute(commands, transactionId);
    } catch (OperationCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new BundleOperationException(description, e);
    }
  }

  @Override
  public String toString() {
    return description;
  }
}
