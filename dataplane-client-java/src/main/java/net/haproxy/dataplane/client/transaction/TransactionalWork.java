package net.haproxy.dataplane.client.transaction;

/**
 * Configuration changes made inside one Data Plane transaction. Every mutation issued from
 * {@link #run(String)} must carry the given transaction id.
 *
 * @param <T> result handed back once the transaction committed
 */
public interface TransactionalWork<T> {
  public T run(String transactionId);
}
