package org.tokengate.common;

import io.vertx.core.json.JsonObject;

/**
 * Configuration lookup. A non-empty Java system property wins over the
 * JSON configuration of the verticle, which wins over the supplied default.
 * Environment variables are consulted through {@link #getEnv} when building
 * that default.
 */
public class Config {

  private Config() {
    throw new IllegalStateException("Config");
  }

  private static String sysProp(String key) {
    final String v = System.getProperty(key);
    return v == null || v.isEmpty() ? null : v;
  }

  /**
   * Returns string config value.
   * @param key property key (JSON key)
   * @param def default value (may be null)
   * @param conf JSON object configuration
   * @return property value (possibly null)
   */
  public static String getSysConf(String key, String def, JsonObject conf) {
    final String v = sysProp(key);
    return v != null ? v : conf.getString(key, def);
  }

  /**
   * Returns string config value for a key with an alias.
   * Order: key1 property, key2 property, key1 in JSON, key2 in JSON, def.
   * @param key1 property key (JSON key)
   * @param key2 alias property key (JSON key)
   * @param def default value (may be null)
   * @param conf JSON object configuration
   * @return property value (possibly null)
   */
  public static String getSysConf(String key1, String key2, String def, JsonObject conf) {
    String v = sysProp(key1);
    if (v == null) {
      v = sysProp(key2);
    }
    return v != null ? v : conf.getString(key1, conf.getString(key2, def));
  }

  /**
   * Returns boolean config value. A property that is not "true" is false.
   * @throws ClassCastException for a JSON value that is not a boolean
   */
  public static Boolean getSysConfBoolean(String key, Boolean def, JsonObject conf) {
    final String v = sysProp(key);
    return v != null ? Boolean.valueOf(v) : conf.getBoolean(key, def);
  }

  /**
   * Returns integer config value.
   * @throws NumberFormatException for a property that is not a number
   */
  public static Integer getSysConfInteger(String key, Integer def, JsonObject conf) {
    final String v = sysProp(key);
    return v != null ? Integer.valueOf(v) : conf.getInteger(key, def);
  }

  /**
   * Returns long config value, mostly durations in milliseconds.
   * @throws NumberFormatException for a property that is not a number
   */
  public static Long getSysConfLong(String key, Long def, JsonObject conf) {
    final String v = sysProp(key);
    return v != null ? Long.valueOf(v) : conf.getLong(key, def);
  }

  /**
   * Returns environment variable, or def when unset or empty.
   * @param name environment variable name
   * @param def default value (may be null)
   * @return value (possibly null)
   */
  public static String getEnv(String name, String def) {
    final String v = System.getenv(name);
    return v == null || v.isEmpty() ? def : v;
  }
}
