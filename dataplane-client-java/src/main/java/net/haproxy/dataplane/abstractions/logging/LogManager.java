package net.haproxy.dataplane.abstractions.logging;

import net.haproxy.dataplane.abstractions.logging.providers.CommonsLoggingProvider;

/**
 * Entry point for client loggers. Defaults to commons-logging until another {@link ILogManager} is installed.
 */
public class LogManager {

  private static volatile ILogManager currentLogManager = new CommonsLoggingProvider();

  /**
   * @return logger named after the calling class
   */
  public static ILog getCurrentClassLogger() {
    return getLogger(Thread.currentThread().getStackTrace()[2].getClassName());
  }

  public static ILog getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  public static ILog getLogger(String name) {
    return currentLogManager.getLogger(name);
  }

  /**
   * Only loggers obtained afterwards use the new manager; static loggers created earlier keep theirs.
   */
  public static void setCurrentLogManager(ILogManager logManager) {
    if (logManager == null) {
      throw new IllegalArgumentException("Log manager can not be null");
    }
    currentLogManager = logManager;
  }

}
