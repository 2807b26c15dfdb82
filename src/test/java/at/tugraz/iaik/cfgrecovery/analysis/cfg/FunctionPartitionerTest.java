package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.analysis.functions.Function;
import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionEdge;
import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionManager;
import at.tugraz.iaik.cfgrecovery.application.Program;
import at.tugraz.iaik.cfgrecovery.application.ProgramParser;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.BasicBlock;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class FunctionPartitionerTest {
  private CFGGraph graph;
  private FunctionManager functions;

  @Before
  public void setUp() {
    graph = new CFGGraph();
    functions = new FunctionManager();
  }

  private static Address addr(String method, int stmtIdx) {
    return new Address(MethodDescriptor.parse("t." + method + "()"), stmtIdx, stmtIdx);
  }

  private CFGNode node(Address address) {
    return graph.addNode(new CFGNode(address, 1, address, (BasicBlock) null));
  }

  private void edge(Address src, Address dst, JumpKind kind) {
    graph.addEdge(node(src), node(dst), kind, Successor.DEFAULT_EXIT);
  }

  @Test
  public void unreachedChunkBecomesOrphanFunction() {
    Address a = addr("A", 0);
    Address b = addr("A", 1);
    Address c = addr("C", 0);
    Address d = addr("C", 1);
    edge(a, b, JumpKind.FALLTHROUGH);
    edge(c, d, JumpKind.BRANCH);

    new FunctionPartitioner(graph, functions).makeFunctions(a);

    assertEquals(2, functions.size());
    assertFalse(functions.get(a).isOrphan());
    assertTrue(functions.get(c).isOrphan());
    assertTrue(functions.get(a).containsNode(b));
    assertTrue(functions.get(c).containsNode(d));
    assertEquals(c, graph.getNode(d).getFunctionAddress());

    // A second run keeps the chunk where it is
    new FunctionPartitioner(graph, functions).makeFunctions(a);

    assertEquals(2, functions.size());
    assertTrue(functions.get(c).isOrphan());
    assertTrue(functions.get(c).containsNode(d));
  }

  @Test
  public void smallerSeedClaimsSharedNode() {
    Address e = addr("E", 0);
    Address f = addr("F", 0);
    Address g = addr("G", 0);
    Address x = addr("X", 0);
    edge(e, f, JumpKind.CALL);
    edge(e, g, JumpKind.CALL);
    edge(g, x, JumpKind.BRANCH);
    edge(f, x, JumpKind.BRANCH);

    new FunctionPartitioner(graph, functions).makeFunctions(e);

    assertEquals(3, functions.size());
    assertTrue(functions.get(f).containsNode(x));
    assertFalse(functions.get(g).containsNode(x));
    assertEquals(f, graph.getNode(x).getFunctionAddress());

    FunctionEdge outside = functions.get(g).getTransitions().iterator().next();
    assertTrue(outside.isOutside());
    assertEquals(f, outside.getDstFunction());

    assertTrue(functions.get(e).getCallTargets().contains(f));
    assertTrue(functions.get(e).getCallTargets().contains(g));
  }

  @Test
  public void seedOrderWinsOverDistance() {
    Address e = addr("E", 0);
    Address f = addr("F", 0);
    Address f1 = addr("F", 1);
    Address g = addr("G", 0);
    Address x = addr("X", 0);
    edge(e, f, JumpKind.CALL);
    edge(e, g, JumpKind.CALL);
    edge(f, f1, JumpKind.BRANCH);
    edge(f1, x, JumpKind.BRANCH);
    edge(g, x, JumpKind.BRANCH);

    new FunctionPartitioner(graph, functions).makeFunctions(e);

    assertEquals(f, graph.getNode(x).getFunctionAddress());
    assertTrue(functions.get(f).containsNode(f1));
    assertTrue(functions.get(f).containsNode(x));
    assertEquals(1, functions.get(g).getNodes().size());

    FunctionEdge outside = functions.get(g).getTransitions().iterator().next();
    assertTrue(outside.isOutside());
    assertEquals(x, outside.getDstAddress());
  }

  @Test
  public void knownEntryIsNotSwallowed() {
    Address a = addr("A", 0);
    Address y = addr("Y", 0);
    edge(a, y, JumpKind.FALLTHROUGH);
    functions.getOrCreate(y).setReturning(Function.Returning.NON_RETURNING);

    new FunctionPartitioner(graph, functions).makeFunctions(a);

    assertEquals(2, functions.size());
    assertFalse(functions.get(a).containsNode(y));
    assertEquals(Function.Returning.NON_RETURNING, functions.get(y).getReturning());
    assertTrue(functions.get(a).getTransitions().iterator().next().isOutside());
  }

  @Test
  public void staleFunctionsAreDropped() {
    Address a = addr("A", 0);
    node(a);
    functions.getOrCreate(addr("Gone", 0));

    new FunctionPartitioner(graph, functions).makeFunctions(a);

    assertEquals(1, functions.size());
    assertNull(functions.get(addr("Gone", 0)));
  }

  @Test
  public void returnNodesMarkFunctionReturning() {
    Address a = addr("A", 0);
    Address b = addr("A", 1);
    edge(a, b, JumpKind.BRANCH);
    graph.getNode(b).setHasReturn(true);

    new FunctionPartitioner(graph, functions).makeFunctions(a);

    assertTrue(functions.get(a).isReturning());
    assertTrue(functions.get(a).getReturnSites().contains(b));
  }

  @Test
  public void everyNodeBelongsToExactlyOneFunction() throws Exception {
    CFGRecovery cfg = recoverShapes();

    Map<Address, Integer> owners = new HashMap<>();
    for (Function function : cfg.getFunctions()) {
      for (Address node : function.getNodes()) {
        Integer count = owners.get(node);
        owners.put(node, (count == null) ? 1 : count + 1);
      }
    }

    assertEquals(cfg.getGraph().nodeCount(), owners.size());
    for (CFGNode node : cfg.getGraph().getNodes()) {
      assertEquals(Integer.valueOf(1), owners.get(node.getAddress()));
      assertTrue(cfg.getFunctions().get(node.getFunctionAddress()).containsNode(node.getAddress()));
    }

    // main, three area implementations, unused() and the exit stub
    assertEquals(6, cfg.getFunctions().size());
  }

  @Test
  public void partitioningIsIdempotent() throws Exception {
    CFGRecovery cfg = recoverShapes();
    Map<Address, Address> before = assignment(cfg.getGraph());

    new FunctionPartitioner(cfg.getGraph(), cfg.getFunctions()).makeFunctions(cfg.getEntry());

    assertEquals(before, assignment(cfg.getGraph()));
    assertEquals(6, cfg.getFunctions().size());
  }

  private CFGRecovery recoverShapes() throws Exception {
    Program program = ProgramParser.parse(new File(getClass().getResource("/programs/shapes.jir").toURI()));
    CFGRecovery cfg = new CFGRecovery(program, new CFGOptions());
    cfg.analyze();
    return cfg;
  }

  private static Map<Address, Address> assignment(CFGGraph graph) {
    Map<Address, Address> result = new HashMap<>();
    for (CFGNode node : graph.getNodes())
      result.put(node.getAddress(), node.getFunctionAddress());

    return result;
  }
}
