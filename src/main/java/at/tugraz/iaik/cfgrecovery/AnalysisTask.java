package at.tugraz.iaik.cfgrecovery;

import at.tugraz.iaik.cfgrecovery.analysis.Analysis;
import at.tugraz.iaik.cfgrecovery.analysis.AnalysisException;
import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGRecovery;
import at.tugraz.iaik.cfgrecovery.analysis.cfg.EmptyProgramException;
import at.tugraz.iaik.cfgrecovery.analysis.cfg.MissingEntryPointException;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.TimeUnit;

/**
 * Recovers the CFG of one program listing and keeps the outcome for the statistics.
 */
public class AnalysisTask implements Runnable {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisTask.class);

  private final Analysis analysis;
  private Throwable criticalException = null;
  private boolean hasNonCriticalExceptions = false;
  private long durationMillis = 0;

  public AnalysisTask(File programFile) {
    analysis = new Analysis(programFile);
  }

  @Override
  public void run() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      analysis.performAnalysis();
    } catch (AnalysisException | OutOfMemoryError e) {
      criticalException = e;
    } finally {
      durationMillis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
    }

    // Only the first exception is kept
    if (criticalException == null && !analysis.getCriticalExceptions().isEmpty())
      criticalException = analysis.getCriticalExceptions().get(0);
    hasNonCriticalExceptions = !analysis.getNonCriticalExceptions().isEmpty();

    if (isRecovered()) {
      LOGGER.info(analysis.getProgramName() + ": " + getNodeCount() + " nodes, " + getFunctionCount() +
          " functions, " + getUnavailableBlockCount() + " unavailable blocks in " + durationMillis + " ms" +
          (isBudgetExhausted() ? " (iteration budget exhausted)" : ""));
    }
  }

  private CFGRecovery getCfg() {
    return analysis.getCfgRecovery();
  }

  /**
   * @return true if a CFG was recovered completely, possibly cut short by the iteration budget
   */
  public boolean isRecovered() {
    return getCfg() != null && getCfg().isCompleted();
  }

  public int getNodeCount() {
    return isRecovered() ? getCfg().getGraph().nodeCount() : 0;
  }

  public int getEdgeCount() {
    return isRecovered() ? getCfg().getGraph().edgeCount() : 0;
  }

  public int getFunctionCount() {
    return isRecovered() ? getCfg().getFunctions().size() : 0;
  }

  public int getUnavailableBlockCount() {
    return isRecovered() ? getCfg().getUnavailableBlocks().size() : 0;
  }

  public boolean isBudgetExhausted() {
    return isRecovered() && getCfg().isBudgetExhausted();
  }

  /**
   * @return true if the program had no usable entry point
   */
  public boolean hasNoEntry() {
    return criticalException instanceof MissingEntryPointException || criticalException instanceof EmptyProgramException;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  public boolean hasNonCriticalExceptions() {
    return hasNonCriticalExceptions;
  }

  public boolean hasCriticalException() {
    return criticalException != null;
  }

  public Throwable getCriticalException() {
    return criticalException;
  }

  public Analysis getAnalysis() {
    return analysis;
  }
}
