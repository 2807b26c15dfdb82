package at.tugraz.iaik.cfgrecovery.utils.config;

public enum ConfigKeys {
  /**
   * Whether to write the function table of every program as XML report.
   */
  ANALYSIS_DO_REPORT("analysis.report.enable", true),
  /**
   * The folder where created reports and graphs are located.
   */
  ANALYSIS_REPORT_FOLDER("analysis.report.folder", "reports"),
  /**
   * The path to the report template, either a file or a classpath resource.
   */
  ANALYSIS_REPORT_TEMPLATE("analysis.report.template", "report.stg"),
  /**
   * Whether to export the recovered CFG as a Graphviz graph.
   */
  ANALYSIS_CFGGRAPH_CREATE("analysis.cfggraph.create", false),
  /**
   * The path to the Graphviz dot executable.
   */
  ANALYSIS_CFGGRAPH_DOTEXECUTABLE("analysis.cfggraph.dotexecutable", "/usr/bin/dot"),
  /**
   * The output format used by Graphviz dot. "dot" keeps the plain graph file.
   */
  ANALYSIS_CFGGRAPH_OUTPUTFORMAT("analysis.cfggraph.outputformat", "dot"),
  /**
   * Whether to partition the recovered graph into functions.
   */
  CFG_MAKE_FUNCTIONS("cfg.functions.make", true),
  /**
   * Maximum amount of worklist jobs to process, 0 means unlimited.
   */
  CFG_MAX_ITERATIONS("cfg.maxiterations", 0),
  /**
   * Log the progress every n processed jobs.
   */
  CFG_PROGRESS_INTERVAL("cfg.progress.interval", 1000),
  /**
   * How to schedule the code after a call site: "assume" (every callee returns) or "defer".
   */
  CFG_RETURN_POLICY("cfg.returnpolicy", "assume"),
  /**
   * Seed the worklist with every method that has a body, not only the entry method.
   */
  CFG_SEED_ALL_METHODS("cfg.seed.allmethods", true),
  /**
   * The directory from which all other paths are considered relative.
   * Is set at runtime.
   */
  DIRECTORY_HOME("directory.home"),
  /**
   * A directory from which .jir listings are loaded for mass investigation.
   */
  DIRECTORY_PROGRAMS("directory.programs", "programs"),
  /**
   * Whether to enable concurrent processing of multiple programs.
   */
  MULTITHREADING_ENABLED("multithreading.enable", false),
  /**
   * If enabled, the amount of threads to use. The default value is the
   * number of available processor cores.
   */
  MULTITHREADING_THREADS("multithreading.threads");

  private final String name;
  private String defaultString;
  private boolean defaultBoolean;
  private int defaultInteger;

  ConfigKeys(String name) {
    this.name = name;
  }

  ConfigKeys(String name, String defaultValue) {
    this.name = name;
    this.defaultString = defaultValue;
  }

  ConfigKeys(String name, boolean defaultValue) {
    this.name = name;
    this.defaultBoolean = defaultValue;
    this.defaultString = String.valueOf(defaultValue);
  }

  ConfigKeys(String name, int defaultValue) {
    this.name = name;
    this.defaultInteger = defaultValue;
    this.defaultString = String.valueOf(defaultValue);
  }

  public String getDefaultString() {
    return defaultString;
  }

  public boolean getDefaultBoolean() {
    return defaultBoolean;
  }

  public int getDefaultInteger() {
    return defaultInteger;
  }

  public String toString() {
    return name;
  }
}
