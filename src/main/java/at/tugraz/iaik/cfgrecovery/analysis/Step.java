package at.tugraz.iaik.cfgrecovery.analysis;

import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * One stage of the analysis of a program listing. Disabled steps and steps whose input is missing
 * are passed over without stopping the following steps.
 */
public abstract class Step {
  protected Logger LOGGER = LoggerFactory.getLogger(getClass());
  protected String name = "Abstract Step";
  protected boolean enabled;

  public final boolean process(Analysis analysis) throws AnalysisException {
    if (!this.enabled)
      return true;

    if (!isApplicable(analysis)) {
      LOGGER.debug("Skipping " + this.name + ", its input is not available");
      return true;
    }

    LOGGER.debug("Start Analysis Step: " + this.name);
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      return doProcessing(analysis);
    } finally {
      long millis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
      analysis.addStepDuration(this.name, millis);
      LOGGER.debug("Stop Analysis Step: " + this.name + " (" + millis + " ms)");
    }
  }

  /**
   * This is where the main activity happens.
   *
   * @return true if the processing of further steps should proceed
   */
  protected abstract boolean doProcessing(Analysis analysis) throws AnalysisException;

  /**
   * @return false if the data this step works on, e.g. the parsed program or the recovered CFG, is missing
   */
  protected boolean isApplicable(Analysis analysis) {
    return true;
  }

  public String getName() {
    return name;
  }

  public boolean isEnabled() {
    return enabled;
  }
}
