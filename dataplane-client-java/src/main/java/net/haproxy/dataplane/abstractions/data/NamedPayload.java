package net.haproxy.dataplane.abstractions.data;

public interface NamedPayload {
  String getName();
}
