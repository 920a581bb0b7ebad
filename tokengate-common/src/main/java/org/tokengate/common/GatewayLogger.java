package org.tokengate.common;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class GatewayLogger {

  private GatewayLogger() {
    throw new IllegalStateException("GatewayLogger");
  }

  public static Logger get() {
    return get("tokengate");
  }

  public static Logger get(Class<?> cl) {
    return LogManager.getLogger(cl);
  }

  public static Logger get(String name) {
    return LogManager.getLogger(name);
  }

}
