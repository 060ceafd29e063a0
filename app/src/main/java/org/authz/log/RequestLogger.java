package org.authz.log;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;

/**
 * A logger bound to a single request.
 *
 * <p>Every message is prefixed with the request id. Instances are immutable; {@link #named(Logger)}
 * returns a new instance for the same request instead of changing this one, so a request logger
 * can be handed to shared components without affecting other requests.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RequestLogger {
  private static final String PREFIX = "request_id={} ";

  private final Logger logger;
  private final String requestId;

  public static RequestLogger of(Logger logger, String requestId) {
    return new RequestLogger(logger, requestId == null ? "" : requestId);
  }

  // Same request, different logger category.
  public RequestLogger named(Logger other) {
    return new RequestLogger(other, requestId);
  }

  public void debug(String format, Object... args) {
    if (logger.isDebugEnabled()) {
      logger.debug(PREFIX + format, withRequestId(args));
    }
  }

  public void info(String format, Object... args) {
    if (logger.isInfoEnabled()) {
      logger.info(PREFIX + format, withRequestId(args));
    }
  }

  public void warn(String format, Object... args) {
    logger.warn(PREFIX + format, withRequestId(args));
  }

  // A trailing Throwable argument is logged with its stack trace.
  public void error(String format, Object... args) {
    logger.error(PREFIX + format, withRequestId(args));
  }

  private Object[] withRequestId(Object[] args) {
    Object[] all = new Object[args.length + 1];
    all[0] = requestId;
    System.arraycopy(args, 0, all, 1, args.length);
    return all;
  }
}
