package org.devolia.secretfs.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J logger that attributes every line to a mountpoint.
 *
 * <p>Messages are prefixed with {@code [mountpoint]}. Debug output additionally requires the
 * {@link LogConfig#isDebug() debug flag}, so a mount can be made verbose without touching the
 * logging backend configuration of the whole process.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class CacheLogger {

  private static final String PREFIX = "[{}] ";

  private final Logger logger;
  private final LogConfig config;

  /**
   * Constructor.
   *
   * @param owner the class whose logger is wrapped
   * @param config the logging options
   */
  public CacheLogger(Class<?> owner, LogConfig config) {
    this(LoggerFactory.getLogger(owner), config);
  }

  CacheLogger(Logger logger, LogConfig config) {
    this.logger = logger;
    this.config = config;
  }

  public boolean isDebugEnabled() {
    return config.isDebug() && logger.isDebugEnabled();
  }

  public void debug(String format, Object... args) {
    if (isDebugEnabled()) {
      logger.debug(PREFIX + format, withMountpoint(args));
    }
  }

  public void info(String format, Object... args) {
    logger.info(PREFIX + format, withMountpoint(args));
  }

  public void warn(String format, Object... args) {
    logger.warn(PREFIX + format, withMountpoint(args));
  }

  /**
   * Masks secret names for safe logging.
   *
   * @param secretName the secret name to mask
   * @return masked secret name for logging
   */
  public static String mask(String secretName) {
    if (secretName == null || secretName.length() <= 3) {
      return "***";
    }
    return secretName.substring(0, 2) + "***" + secretName.substring(secretName.length() - 1);
  }

  private Object[] withMountpoint(Object[] args) {
    Object[] all = new Object[args.length + 1];
    all[0] = config.getMountpoint();
    System.arraycopy(args, 0, all, 1, args.length);
    return all;
  }
}
