package at.tugraz.iaik.cfgrecovery.analysis.cfg;

/**
 * How the code following a call site is scheduled.
 */
public enum ReturnPolicy {
  /**
   * Every callee is assumed to return, the continuation is scheduled right away.
   */
  ASSUME_RETURNING("assume"),
  /**
   * The continuation waits until one of the callees is known to return.
   */
  DEFER_UNTIL_RETURNING("defer");

  private final String configValue;

  ReturnPolicy(String configValue) {
    this.configValue = configValue;
  }

  public String getConfigValue() {
    return configValue;
  }

  public static ReturnPolicy fromConfigValue(String value) {
    for (ReturnPolicy policy : values()) {
      if (policy.configValue.equalsIgnoreCase(value.trim()))
        return policy;
    }

    throw new IllegalArgumentException("Unknown return policy: " + value);
  }
}
