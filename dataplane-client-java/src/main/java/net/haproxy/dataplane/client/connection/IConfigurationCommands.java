package net.haproxy.dataplane.client.connection;

import java.util.List;

import net.haproxy.dataplane.abstractions.data.AclPayload;
import net.haproxy.dataplane.abstractions.data.ApiVersion;
import net.haproxy.dataplane.abstractions.data.BackendPayload;
import net.haproxy.dataplane.abstractions.data.EntityType;
import net.haproxy.dataplane.abstractions.data.FrontendPayload;
import net.haproxy.dataplane.abstractions.data.GlobalPayload;
import net.haproxy.dataplane.abstractions.data.ParentRef;
import net.haproxy.dataplane.abstractions.data.ServerPayload;
import net.haproxy.dataplane.abstractions.data.TransactionInfo;
import net.haproxy.dataplane.client.utils.CancellationTokenSource.CancellationToken;

/**
 * Commands of the HAProxy Data Plane API configuration endpoints.
 * Reads see the committed configuration. Mutations are staged in the given transaction.
 */
public interface IConfigurationCommands {

  public ApiVersion getApiVersion();

  /**
   * Returns commands bound to the given cancellation token, or unbound ones when token is null.
   */
  public IConfigurationCommands withCancellation(CancellationToken token);

  /**
   * @return current version of the committed configuration
   */
  public long getConfigurationVersion();

  /**
   * Opens a transaction against the given configuration version.
   */
  public TransactionInfo createTransaction(long version);

  /**
   * Applies all edits staged in the transaction.
   * @return transaction state reported by the API, null when it reported nothing
   */
  public TransactionInfo commitTransaction(String transactionId);

  /**
   * Discards all edits staged in the transaction.
   */
  public void deleteTransaction(String transactionId);

  /**
   * Reads a collection. A missing collection is an empty list.
   */
  public <T> List<T> getAll(EntityType type, ParentRef parent, Class<T> clazz);

  /**
   * Reads a single entity.
   * @return entity or null when it does not exist
   */
  public <T> T get(EntityType type, ParentRef parent, String key, Class<T> clazz);

  public void create(EntityType type, ParentRef parent, Object payload, String transactionId);

  public void update(EntityType type, ParentRef parent, String key, Object payload, String transactionId);

  public void delete(EntityType type, ParentRef parent, String key, String transactionId);

  /**
   * Replaces the whole list of indexed entities of the parent.
   */
  public void replaceAll(EntityType type, ParentRef parent, List<?> payloads, String transactionId);

  public BackendPayload getBackend(String name);

  public void createBackend(BackendPayload backend, String transactionId);

  public void updateBackend(BackendPayload backend, String transactionId);

  public void deleteBackend(String name, String transactionId);

  public FrontendPayload getFrontend(String name);

  public void createFrontend(FrontendPayload frontend, String transactionId);

  public void updateFrontend(FrontendPayload frontend, String transactionId);

  public void deleteFrontend(String name, String transactionId);

  public List<ServerPayload> getServers(ParentRef parent);

  public ServerPayload getServer(ParentRef parent, String name);

  public void createServer(ParentRef parent, ServerPayload server, String transactionId);

  public void updateServer(ParentRef parent, ServerPayload server, String transactionId);

  public void deleteServer(ParentRef parent, String name, String transactionId);

  public List<AclPayload> getAcls(ParentRef parent);

  public void createAcl(ParentRef parent, AclPayload acl, String transactionId);

  public void updateAcl(ParentRef parent, AclPayload acl, String transactionId);

  public void deleteAcl(ParentRef parent, int index, String transactionId);

  public GlobalPayload getGlobal();

  public void updateGlobal(GlobalPayload global, String transactionId);
}
