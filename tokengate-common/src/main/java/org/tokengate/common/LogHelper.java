package org.tokengate.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

// S4792: Configuring loggers is security-sensitive
@java.lang.SuppressWarnings({"squid:S4792"})
public class LogHelper {
  private LogHelper() {}

  public static String getRootLogLevel() {
    return LogManager.getRootLogger().getLevel().toString();
  }

  /**
   * Set log level for root logger and all children.
   * @param name log level name; unknown names give DEBUG
   */
  public static void setRootLogLevel(String name) {
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.toLevel(name));
  }
}
