package net.haproxy.dataplane.abstractions.logging;

public interface ILogManager {
  public ILog getLogger(String name);
}
