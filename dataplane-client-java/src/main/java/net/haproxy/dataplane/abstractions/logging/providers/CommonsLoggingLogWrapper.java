package net.haproxy.dataplane.abstractions.logging.providers;

import net.haproxy.dataplane.abstractions.logging.ILog;
import net.haproxy.dataplane.abstractions.util.Sanitizer;

import org.apache.commons.logging.Log;

/**
 * Every message passes through {@link Sanitizer} before it reaches the underlying log,
 * so request and response bodies can be logged as they are.
 */
public class CommonsLoggingLogWrapper implements ILog {

  private final Log log;

  public CommonsLoggingLogWrapper(Log log) {
    this.log = log;
  }

  @Override
  public boolean isDebugEnabled() {
    return log.isDebugEnabled();
  }

  @Override
  public void debug(String msg) {
    if (log.isDebugEnabled()) {
      log.debug(Sanitizer.sanitize(msg));
    }
  }

  @Override
  public void debug(String format, Object... args) {
    if (log.isDebugEnabled()) {
      log.debug(Sanitizer.sanitize(String.format(format, args)));
    }
  }

  @Override
  public void info(String msg) {
    if (log.isInfoEnabled()) {
      log.info(Sanitizer.sanitize(msg));
    }
  }

  @Override
  public void info(String format, Object... args) {
    if (log.isInfoEnabled()) {
      log.info(Sanitizer.sanitize(String.format(format, args)));
    }
  }

  @Override
  public void warn(String msg) {
    if (log.isWarnEnabled()) {
      log.warn(Sanitizer.sanitize(msg));
    }
  }

  @Override
  public void warn(String format, Object... args) {
    if (log.isWarnEnabled()) {
      log.warn(Sanitizer.sanitize(String.format(format, args)));
    }
  }

  @Override
  public void warnException(String msg, Throwable e) {
    if (log.isWarnEnabled()) {
      // the throwable's own message may echo a request body
      log.warn(Sanitizer.sanitize(msg + ": " + e), e.getCause());
    }
  }

}
