package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionEdge;
import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionManager;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class PendingJobsTest {
  private static final MethodDescriptor CALLER = MethodDescriptor.parse("t.Caller.run()");
  private static final Address CALLEE = Address.entryOf(MethodDescriptor.parse("t.Callee.run()"));
  private static final Address OTHER_CALLEE = Address.entryOf(MethodDescriptor.parse("t.Other.run()"));

  private FunctionManager functions;

  @Before
  public void setUp() {
    functions = new FunctionManager();
  }

  private static CFGJob fakeReturn(int stmtIdx, Address... callees) {
    return new CFGJob(new Address(CALLER, 0, stmtIdx), Address.entryOf(CALLER), JumpKind.FAKE_RETURN, null,
        stmtIdx - 1, ImmutableList.<FunctionEdge>of(), ImmutableList.copyOf(callees));
  }

  @Test
  public void jobsArePoppedInInsertionOrder() {
    PendingJobs jobs = new PendingJobs(ReturnPolicy.ASSUME_RETURNING, functions);
    CFGJob first = new CFGJob(CALLEE, CALLEE);
    CFGJob second = fakeReturn(1, CALLEE);
    jobs.add(first);
    jobs.add(second);

    assertSame(first, jobs.pop());
    assertSame(second, jobs.pop());
    assertNull(jobs.pop());
    assertTrue(jobs.isEmpty());
  }

  @Test
  public void continuationWaitsForReturningCallee() {
    PendingJobs jobs = new PendingJobs(ReturnPolicy.DEFER_UNTIL_RETURNING, functions);
    CFGJob job = fakeReturn(1, CALLEE, OTHER_CALLEE);
    jobs.add(job);

    assertTrue(jobs.isEmpty());
    assertEquals(1, jobs.deferredCount());

    functions.markReturning(OTHER_CALLEE);
    jobs.functionReturned(OTHER_CALLEE);

    assertSame(job, jobs.pop());
    assertFalse(jobs.hasDeferred());
  }

  @Test
  public void continuationOfKnownReturningCalleeIsScheduled() {
    PendingJobs jobs = new PendingJobs(ReturnPolicy.DEFER_UNTIL_RETURNING, functions);
    functions.markReturning(CALLEE);
    jobs.add(fakeReturn(1, CALLEE));

    assertEquals(1, jobs.size());
    assertEquals(0, jobs.deferredCount());
  }

  @Test
  public void releaseDropsContinuationsOfNonReturningCallees() {
    PendingJobs jobs = new PendingJobs(ReturnPolicy.DEFER_UNTIL_RETURNING, functions);
    CFGJob unknown = fakeReturn(1, CALLEE);
    CFGJob noReturn = fakeReturn(2, OTHER_CALLEE);
    jobs.add(unknown);
    jobs.add(noReturn);
    functions.markNonReturning(OTHER_CALLEE);

    assertEquals(1, jobs.releaseDeferred());
    assertSame(unknown, jobs.pop());
    assertNull(jobs.pop());
    assertFalse(jobs.hasDeferred());
  }

  @Test
  public void otherJobsAreNeverDeferred() {
    PendingJobs jobs = new PendingJobs(ReturnPolicy.DEFER_UNTIL_RETURNING, functions);
    jobs.add(new CFGJob(CALLEE, CALLEE));

    assertEquals(1, jobs.size());
  }
}
