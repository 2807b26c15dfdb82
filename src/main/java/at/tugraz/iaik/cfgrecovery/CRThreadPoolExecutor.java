package at.tugraz.iaik.cfgrecovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Collection;
import java.util.concurrent.*;

/**
 * Runs one {@link AnalysisTask} per program listing and sums up the recovered CFGs.
 */
public class CRThreadPoolExecutor extends ThreadPoolExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(CRThreadPoolExecutor.class);
  private final int programCount;
  private int started = 0;
  private int skipped = 0;
  private int failed = 0;
  private int withWarnings = 0;

  private int recovered = 0;
  private int withoutEntry = 0;
  private int budgetExhausted = 0;
  private long nodes = 0;
  private long edges = 0;
  private long functions = 0;
  private long unavailableBlocks = 0;
  private long durationMillis = 0;

  public CRThreadPoolExecutor(Collection<File> programs, int corePoolSize, int maximumPoolSize, long keepAliveTime,
                              TimeUnit unit) {
    super(corePoolSize, maximumPoolSize, keepAliveTime, unit, new ArrayBlockingQueue<Runnable>(Math.max(1, programs.size())));

    programCount = programs.size();
    for (File program : programs) {
      AnalysisTask task = new AnalysisTask(program);
      this.submit(task, task);
    }
  }

  @Override
  protected synchronized void beforeExecute(Thread t, Runnable r) {
    started++;
    LOGGER.info("Recovering CFG " + started + " of " + programCount);
    super.beforeExecute(t, r);
  }

  @Override
  protected void afterExecute(Runnable r, Throwable t) {
    super.afterExecute(r, t);

    if (t != null) {
      LOGGER.error("Analysis task terminated unexpectedly.", t);
      synchronized (this) {
        failed++;
      }
      return;
    }

    if (!(r instanceof FutureTask<?>))
      return;

    try {
      @SuppressWarnings("unchecked")
      AnalysisTask task = ((FutureTask<AnalysisTask>) r).get();
      record(task);
    } catch (CancellationException e) {
      LOGGER.warn("CFG recovery cancelled.");
      synchronized (this) {
        skipped++;
      }
    } catch (InterruptedException e) {
      LOGGER.warn("CFG recovery interrupted.");
      synchronized (this) {
        skipped++;
      }
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      LOGGER.error("CFG recovery failed with exception!", e.getCause());
      synchronized (this) {
        failed++;
      }
    }
  }

  private synchronized void record(AnalysisTask task) {
    durationMillis += task.getDurationMillis();
    if (task.hasNonCriticalExceptions())
      withWarnings++;

    if (task.hasCriticalException()) {
      failed++;
      if (task.hasNoEntry())
        withoutEntry++;
      LOGGER.error("CFG recovery of '" + task.getAnalysis().getProgramName() + "' failed!", task.getCriticalException());
    }

    if (!task.isRecovered())
      return;

    recovered++;
    nodes += task.getNodeCount();
    edges += task.getEdgeCount();
    functions += task.getFunctionCount();
    unavailableBlocks += task.getUnavailableBlockCount();
    if (task.isBudgetExhausted())
      budgetExhausted++;
  }

  public synchronized void printStats() {
    String stats = "\n\nCFG Recovery Results:";
    stats += "\n- Program listings: " + programCount;
    stats += "\n- Recovered CFGs: " + recovered;
    if (budgetExhausted > 0)
      stats += " (" + budgetExhausted + " cut short by the iteration budget)";
    stats += "\n- Nodes: " + nodes + ", edges: " + edges + ", functions: " + functions;
    stats += "\n- Unavailable blocks: " + unavailableBlocks;
    stats += "\n- Failed programs: " + failed;
    if (withoutEntry > 0)
      stats += " (" + withoutEntry + " without entry point)";
    if (skipped > 0)
      stats += "\n- Skipped programs: " + skipped;
    stats += "\n- Programs with warnings: " + withWarnings;
    stats += "\n- Total analysis time: " + durationMillis + " ms";

    LOGGER.info(stats);
  }

  public synchronized int getRecoveredCount() {
    return recovered;
  }

  public synchronized int getFailedCount() {
    return failed;
  }

  public synchronized int getWithoutEntryCount() {
    return withoutEntry;
  }

  public synchronized int getBudgetExhaustedCount() {
    return budgetExhausted;
  }

  public synchronized long getNodeCount() {
    return nodes;
  }

  public synchronized long getFunctionCount() {
    return functions;
  }

  public synchronized long getUnavailableBlockCount() {
    return unavailableBlocks;
  }
}
