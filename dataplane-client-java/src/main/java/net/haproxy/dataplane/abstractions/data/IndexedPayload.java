package net.haproxy.dataplane.abstractions.data;

/**
 * Entity addressed by its position in the parent's list (ACLs, rules, checks).
 */
public interface IndexedPayload {
  Integer getIndex();
}
