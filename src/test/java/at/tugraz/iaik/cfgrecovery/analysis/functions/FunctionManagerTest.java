package at.tugraz.iaik.cfgrecovery.analysis.functions;

import at.tugraz.iaik.cfgrecovery.analysis.cfg.JumpKind;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import org.junit.Before;
import org.junit.Test;

import java.util.SortedMap;

import static org.junit.Assert.*;

public class FunctionManagerTest {
  private static final Address CALLER = Address.entryOf(MethodDescriptor.parse("t.A.caller()"));
  private static final Address CALLEE = Address.entryOf(MethodDescriptor.parse("t.A.callee()"));
  private static final Address EXTERNAL = Address.entryOf(MethodDescriptor.parse("lib.X.call()"));

  private FunctionManager functions;

  @Before
  public void setUp() {
    functions = new FunctionManager();
  }

  @Test
  public void returningIsNotDowngraded() {
    functions.markReturning(CALLEE);
    functions.markNonReturning(CALLEE);

    assertEquals(Function.Returning.RETURNING, functions.get(CALLEE).getReturning());
  }

  @Test
  public void onlyCallsCreateTheDestination() {
    functions.addTransitionEdge(new FunctionEdge(CALLER, CALLEE, CALLER, CALLEE, JumpKind.CALL, 0, true));
    functions.addTransitionEdge(new FunctionEdge(CALLER, EXTERNAL, CALLER, EXTERNAL,
        JumpKind.UNRESOLVED_EXTERNAL_CALL, 1, true));

    assertTrue(functions.contains(CALLEE));
    assertFalse(functions.contains(EXTERNAL));
    assertEquals(2, functions.get(CALLER).getCallTargets().size());
  }

  @Test
  public void snapshotIsDetached() {
    functions.getOrCreate(CALLER).addNode(CALLER);
    SortedMap<Address, Function> snapshot = functions.snapshot();

    functions.get(CALLER).addNode(CALLEE);
    functions.clear();

    assertEquals(0, functions.size());
    assertEquals(1, snapshot.get(CALLER).getNodes().size());
  }
}
