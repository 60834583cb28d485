package org.devolia.secretfs.log;

/**
 * Logging options for one mounted cache.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class LogConfig {

  /** Label used when no mountpoint is configured. */
  public static final String UNKNOWN_MOUNTPOINT = "unknown";

  private final boolean debug;
  private final String mountpoint;

  /**
   * Constructor with configuration values.
   *
   * @param debug whether debug-level messages are emitted
   * @param mountpoint mountpoint used to attribute log lines and metrics
   */
  public LogConfig(boolean debug, String mountpoint) {
    this.debug = debug;
    this.mountpoint =
        mountpoint == null || mountpoint.isBlank() ? UNKNOWN_MOUNTPOINT : mountpoint.trim();
  }

  public boolean isDebug() {
    return debug;
  }

  public String getMountpoint() {
    return mountpoint;
  }

  @Override
  public String toString() {
    return "LogConfig{debug=" + debug + ", mountpoint=" + mountpoint + "}";
  }
}
