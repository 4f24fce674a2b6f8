package net.haproxy.dataplane.abstractions.logging.providers;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import net.haproxy.dataplane.abstractions.logging.ILog;
import net.haproxy.dataplane.abstractions.logging.ILogManager;

import org.apache.commons.logging.LogFactory;

/**
 * Default log manager: sanitizing wrappers over commons-logging, one per logger name.
 */
public class CommonsLoggingProvider implements ILogManager {

  private final ConcurrentMap<String, ILog> loggers = new ConcurrentHashMap<>();

  @Override
  public ILog getLogger(String name) {
    ILog logger = loggers.get(name);
    if (logger == null) {
      ILog created = new CommonsLoggingLogWrapper(LogFactory.getLog(name));
      logger = loggers.putIfAbsent(name, created);
      if (logger == null) {
        logger = created;
      }
    }
    return logger;
  }

}
