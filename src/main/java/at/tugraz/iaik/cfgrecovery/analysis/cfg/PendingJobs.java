package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.analysis.functions.Function;
import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionManager;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * The worklist. Jobs are processed in FIFO order; fake-return jobs may be held back depending on the
 * {@link ReturnPolicy}.
 */
public class PendingJobs {
  private static final Logger LOGGER = LoggerFactory.getLogger(PendingJobs.class);

  private final Deque<CFGJob> jobs = new ArrayDeque<>();
  private final List<CFGJob> deferred = new ArrayList<>();
  private final ReturnPolicy policy;
  private final FunctionManager functions;

  public PendingJobs(ReturnPolicy policy, FunctionManager functions) {
    this.policy = policy;
    this.functions = functions;
  }

  public void add(CFGJob job) {
    if (policy == ReturnPolicy.DEFER_UNTIL_RETURNING && job.getJumpKind() == JumpKind.FAKE_RETURN &&
        !anyCalleeReturning(job)) {
      LOGGER.debug(" -> Defer {}", job);
      deferred.add(job);
      return;
    }

    jobs.add(job);
  }

  /**
   * @return the next job or null if no job is ready
   */
  public CFGJob pop() {
    return jobs.poll();
  }

  public boolean isEmpty() {
    return jobs.isEmpty();
  }

  public boolean hasDeferred() {
    return !deferred.isEmpty();
  }

  public int size() {
    return jobs.size();
  }

  public int deferredCount() {
    return deferred.size();
  }

  /**
   * Release the deferred jobs waiting for the given function.
   */
  public void functionReturned(Address function) {
    if (deferred.isEmpty())
      return;

    Iterator<CFGJob> it = deferred.iterator();
    while (it.hasNext()) {
      CFGJob job = it.next();
      if (job.getCalleeAddresses().contains(function)) {
        LOGGER.debug(" -> {} returns, release {}", function, job);
        jobs.add(job);
        it.remove();
      }
    }
  }

  /**
   * Called once no job is ready. Deferred jobs are scheduled unless all of their callees are known
   * not to return; those are dropped.
   *
   * @return the amount of scheduled jobs
   */
  public int releaseDeferred() {
    int released = 0;
    for (CFGJob job : deferred) {
      if (allCalleesNonReturning(job)) {
        LOGGER.debug(" -> Drop {}, no callee returns", job);
        continue;
      }

      jobs.add(job);
      released++;
    }
    deferred.clear();

    return released;
  }

  private boolean anyCalleeReturning(CFGJob job) {
    for (Address callee : job.getCalleeAddresses()) {
      Function function = functions.get(callee);
      if (function != null && function.isReturning())
        return true;
    }

    return false;
  }

  private boolean allCalleesNonReturning(CFGJob job) {
    if (job.getCalleeAddresses().isEmpty())
      return false;

    for (Address callee : job.getCalleeAddresses()) {
      Function function = functions.get(callee);
      if (function == null || function.getReturning() != Function.Returning.NON_RETURNING)
        return false;
    }

    return true;
  }
}
