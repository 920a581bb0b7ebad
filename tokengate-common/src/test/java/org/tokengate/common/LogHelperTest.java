package org.tokengate.common;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LogHelperTest {
  @Test
  void setAndRestore() {
    String lev1 = LogHelper.getRootLogLevel();
    LogHelper.setRootLogLevel("DEBUG");
    assertEquals("DEBUG", LogHelper.getRootLogLevel());
    LogHelper.setRootLogLevel(lev1);
    assertEquals(lev1, LogHelper.getRootLogLevel());
  }
}
