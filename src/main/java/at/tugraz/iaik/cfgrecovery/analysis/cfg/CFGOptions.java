package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.utils.config.ConfigHandler;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigKeys;

/**
 * Settings of a single CFG recovery run.
 */
public class CFGOptions {
  private boolean seedAllMethods = true;
  private boolean makeFunctions = true;
  private int maxIterations = 0;
  private int progressInterval = 1000;
  private ReturnPolicy returnPolicy = ReturnPolicy.ASSUME_RETURNING;

  public static CFGOptions fromConfig(ConfigHandler config) {
    CFGOptions options = new CFGOptions();
    options.setSeedAllMethods(config.getBooleanConfigValue(ConfigKeys.CFG_SEED_ALL_METHODS));
    options.setMakeFunctions(config.getBooleanConfigValue(ConfigKeys.CFG_MAKE_FUNCTIONS));
    options.setMaxIterations(config.getIntConfigValue(ConfigKeys.CFG_MAX_ITERATIONS));
    options.setProgressInterval(config.getIntConfigValue(ConfigKeys.CFG_PROGRESS_INTERVAL));
    options.setReturnPolicy(ReturnPolicy.fromConfigValue(config.getConfigValue(ConfigKeys.CFG_RETURN_POLICY)));

    return options;
  }

  public boolean isSeedAllMethods() {
    return seedAllMethods;
  }

  public CFGOptions setSeedAllMethods(boolean seedAllMethods) {
    this.seedAllMethods = seedAllMethods;
    return this;
  }

  public boolean isMakeFunctions() {
    return makeFunctions;
  }

  public CFGOptions setMakeFunctions(boolean makeFunctions) {
    this.makeFunctions = makeFunctions;
    return this;
  }

  /**
   * @return the maximum amount of processed jobs, 0 for no limit
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  public CFGOptions setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
    return this;
  }

  public int getProgressInterval() {
    return progressInterval;
  }

  public CFGOptions setProgressInterval(int progressInterval) {
    this.progressInterval = progressInterval;
    return this;
  }

  public ReturnPolicy getReturnPolicy() {
    return returnPolicy;
  }

  public CFGOptions setReturnPolicy(ReturnPolicy returnPolicy) {
    this.returnPolicy = returnPolicy;
    return this;
  }

  @Override
  public String toString() {
    return "CFGOptions [seedAllMethods=" + seedAllMethods + ", makeFunctions=" + makeFunctions +
        ", maxIterations=" + maxIterations + ", returnPolicy=" + returnPolicy + "]";
  }
}
