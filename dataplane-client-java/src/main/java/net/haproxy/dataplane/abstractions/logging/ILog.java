package net.haproxy.dataplane.abstractions.logging;

/**
 * Client diagnostics. Messages taking arguments are {@link String#format} patterns and are only
 * formatted when the level is enabled.
 */
public interface ILog {
  public boolean isDebugEnabled();

  public void debug(String msg);

  public void debug(String format, Object... args);

  public void info(String msg);

  public void info(String format, Object... args);

  public void warn(String msg);

  public void warn(String format, Object... args);

  /**
   * Logs a secondary failure, e.g. a rollback that failed while an earlier error is being reported.
   */
  public void warnException(String msg, Throwable e);
}
