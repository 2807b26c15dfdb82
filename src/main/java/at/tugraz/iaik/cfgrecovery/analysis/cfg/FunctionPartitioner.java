package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.analysis.functions.Function;
import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionEdge;
import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionManager;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Rebuilds the function table from a finished graph, so that every node belongs to exactly one function.
 *
 * <p>Stage 1 walks breadth-first from all call targets, the entry and the entries of already known
 * functions, following everything but call edges. Stage 2 roots a function at every node stage 1
 * did not reach. Seeds are processed in ascending address order.
 */
public class FunctionPartitioner {
  private static final Logger LOGGER = LoggerFactory.getLogger(FunctionPartitioner.class);

  private final CFGGraph graph;
  private final FunctionManager functions;

  private SortedMap<Address, Function> knownFunctions;
  private final Map<Address, Address> blockToFunction = new HashMap<>();
  private final Set<Address> functionEntries = new HashSet<>();

  public FunctionPartitioner(CFGGraph graph, FunctionManager functions) {
    this.graph = graph;
    this.functions = functions;
  }

  public void makeFunctions(Address entry) {
    knownFunctions = functions.snapshot();
    functions.clear();
    blockToFunction.clear();
    functionEntries.clear();
    functionEntries.addAll(knownFunctions.keySet());

    // Stage 1
    SortedSet<Address> seeds = new TreeSet<>();
    for (CFGEdge edge : graph.getEdges()) {
      if (edge.getKind().isCall())
        seeds.add(edge.getDst().getAddress());
    }
    if (entry != null && graph.hasNode(entry))
      seeds.add(entry);
    for (Function known : knownFunctions.values()) {
      if (!known.isOrphan() && graph.hasNode(known.getAddress()))
        seeds.add(known.getAddress());
    }
    functionEntries.addAll(seeds);

    // One walk per seed, earlier seeds claim contested nodes
    Set<Address> traversed = new HashSet<>();
    for (Address seed : seeds)
      traverse(Collections.singleton(seed), traversed);
    LOGGER.debug("Stage 1: {} seeds, {} of {} nodes reached", seeds.size(), traversed.size(), graph.nodeCount());

    // Stage 2, every chunk nothing calls becomes a function of its own
    SortedSet<Address> secondarySeeds = new TreeSet<>();
    for (Address known : knownFunctions.keySet()) {
      if (graph.hasNode(known) && !blockToFunction.containsKey(known))
        secondarySeeds.add(known);
    }
    for (CFGNode node : graph.getNodes()) {
      if (!traversed.contains(node.getAddress()))
        secondarySeeds.add(node.getAddress());
    }

    for (Address seed : secondarySeeds) {
      boolean newRoot = !blockToFunction.containsKey(seed);
      traverse(Collections.singleton(seed), new HashSet<Address>());

      if (newRoot) {
        LOGGER.debug("Orphan chunk at {}", seed);
        functions.get(seed).setOrphan(true);
      }
    }

    carryUnresolvedCalls();
    cleanup();
  }

  /**
   * Calls to targets that could not be lifted have no graph edge. Keep them on the function now
   * owning the call site.
   */
  private void carryUnresolvedCalls() {
    for (Function known : knownFunctions.values()) {
      for (FunctionEdge edge : known.getTransitions()) {
        if (edge.getKind() != JumpKind.UNRESOLVED_EXTERNAL_CALL)
          continue;

        Address owner = blockToFunction.get(edge.getSrcAddress());
        if (owner != null)
          functions.addTransitionEdge(edge.withSrcFunction(owner));
      }
    }
  }

  private void traverse(Collection<Address> starts, Set<Address> traversed) {
    Deque<Address> queue = new ArrayDeque<>(starts);
    Set<Address> queued = new HashSet<>(starts);

    while (!queue.isEmpty()) {
      Address addr = queue.poll();
      queued.remove(addr);
      if (!traversed.add(addr))
        continue;

      CFGNode node = graph.getNode(addr);
      if (node.hasReturn())
        handleReturn(node);

      List<CFGEdge> outEdges = graph.getSortedOutEdges(node);
      if (outEdges.isEmpty()) {
        addrToFunction(addr).addNode(addr);
        continue;
      }

      for (CFGEdge edge : outEdges) {
        handleEdge(edge);

        Address dst = edge.getDst().getAddress();
        if (!edge.getKind().isCall() && !traversed.contains(dst) && queued.add(dst))
          queue.add(dst);
      }
    }
  }

  private void handleReturn(CFGNode node) {
    Function function = addrToFunction(node.getAddress());
    function.addNode(node.getAddress());
    function.addReturnSite(node.getAddress());
    function.setReturning(Function.Returning.RETURNING);
  }

  private void handleEdge(CFGEdge edge) {
    Address src = edge.getSrc().getAddress();
    Address dst = edge.getDst().getAddress();

    Function srcFunction = addrToFunction(src);
    srcFunction.addNode(src);

    if (edge.getKind().isCall()) {
      Function dstFunction = addrToFunction(dst);
      functions.addTransitionEdge(new FunctionEdge(srcFunction.getAddress(), dstFunction.getAddress(), src, dst,
          edge.getKind(), edge.getStmtIdx(), true));
      return;
    }

    Address claimedBy = blockToFunction.get(dst);
    boolean outside;
    Address dstFunction;
    if (claimedBy != null) {
      outside = !claimedBy.equals(srcFunction.getAddress());
      dstFunction = claimedBy;
    } else if (functionEntries.contains(dst) && !dst.equals(srcFunction.getAddress())) {
      outside = true;
      dstFunction = dst;
    } else {
      blockToFunction.put(dst, srcFunction.getAddress());
      srcFunction.addNode(dst);
      outside = false;
      dstFunction = srcFunction.getAddress();
    }

    functions.addTransitionEdge(new FunctionEdge(srcFunction.getAddress(), dstFunction, src, dst,
        edge.getKind(), edge.getStmtIdx(), outside));
  }

  /**
   * @return the function the address belongs to, a new function rooted at it if it is unclaimed
   */
  private Function addrToFunction(Address addr) {
    Address owner = blockToFunction.get(addr);
    if (owner != null)
      return functions.getOrCreate(owner);

    Function function = functions.getOrCreate(addr);
    function.addNode(addr);
    blockToFunction.put(addr, addr);

    Function known = knownFunctions.get(addr);
    if (known != null && known.getReturning() != Function.Returning.UNKNOWN &&
        function.getReturning() == Function.Returning.UNKNOWN)
      function.setReturning(known.getReturning());

    return function;
  }

  private void cleanup() {
    List<Address> invalid = new ArrayList<>();
    for (Function function : functions) {
      if (!function.containsNode(function.getStartpoint()) || !graph.hasNode(function.getStartpoint()))
        invalid.add(function.getAddress());
    }

    for (Address addr : invalid) {
      LOGGER.debug("Remove function {} without entry node", addr);
      functions.remove(addr);
    }

    for (CFGNode node : graph.getNodes()) {
      Address owner = blockToFunction.get(node.getAddress());
      if (owner != null)
        node.setFunctionAddress(owner);
    }
  }
}
