package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.analysis.AnalysisException;
import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionEdge;
import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionManager;
import at.tugraz.iaik.cfgrecovery.application.Program;
import at.tugraz.iaik.cfgrecovery.application.hierarchy.ClassHierarchy;
import at.tugraz.iaik.cfgrecovery.application.hierarchy.DispatchResolver;
import at.tugraz.iaik.cfgrecovery.application.hooks.Hook;
import at.tugraz.iaik.cfgrecovery.application.hooks.HookTable;
import at.tugraz.iaik.cfgrecovery.application.lifting.BlockLifter;
import at.tugraz.iaik.cfgrecovery.application.lifting.BlockUnavailableException;
import at.tugraz.iaik.cfgrecovery.application.lifting.ProgramBlockLifter;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.BasicBlock;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Recovers the whole-program CFG of a program with a worklist traversal, starting at the entry
 * method, and partitions the result into functions afterwards.
 *
 * <p>One instance holds the state of one run: the graph, the function table and the worklist.
 */
public class CFGRecovery {
  private static final Logger LOGGER = LoggerFactory.getLogger(CFGRecovery.class);

  private final Program program;
  private final BlockLifter lifter;
  private final SuccessorResolver successorResolver;
  private final HookTable hooks;
  private final CFGOptions options;

  private final CFGGraph graph = new CFGGraph();
  private final FunctionManager functions = new FunctionManager();
  private final PendingJobs pendingJobs;
  private final Set<Address> unavailableBlocks = new TreeSet<>();

  private Address entry = null;
  private int iterations = 0;
  private boolean budgetExhausted = false;
  private boolean analyzed = false;
  private boolean completed = false;

  public CFGRecovery(Program program, CFGOptions options) {
    this(program, new ProgramBlockLifter(program), new ClassHierarchy(program), options);
  }

  public CFGRecovery(Program program, BlockLifter lifter, DispatchResolver dispatchResolver, CFGOptions options) {
    this.program = program;
    this.lifter = lifter;
    this.successorResolver = new SuccessorResolver(new InvokeResolver(program, dispatchResolver));
    this.hooks = program.getHooks();
    this.options = options;
    this.pendingJobs = new PendingJobs(options.getReturnPolicy(), functions);
  }

  /**
   * Run the traversal until no job is left, then build the functions.
   *
   * @throws MissingEntryPointException if the declared entry method does not exist
   * @throws EmptyProgramException if the program contains no method at all
   */
  public void analyze() throws AnalysisException {
    if (analyzed)
      throw new IllegalStateException("CFG of " + program.getProgramName() + " was already recovered");
    analyzed = true;

    LOGGER.debug("Recovering CFG of {} with {}", program.getProgramName(), options);
    preAnalysis();
    mainLoop();
    postAnalysis();
    completed = true;
  }

  private void preAnalysis() throws AnalysisException {
    Method entryMethod = selectEntryMethod();
    entry = Address.entryOf(entryMethod.getDescriptor());
    LOGGER.info("Entry point of {}: {}", program.getProgramName(), entryMethod);

    if (entryMethod.hasBody() || hooks.isHooked(entry))
      pendingJobs.add(new CFGJob(entry, entry));
    else
      LOGGER.warn("Entry method {} has no body", entryMethod);

    if (options.isSeedAllMethods()) {
      for (Method method : program.getAllMethods()) {
        Address addr = Address.entryOf(method.getDescriptor());
        if (method.hasBody() && !addr.equals(entry))
          pendingJobs.add(new CFGJob(addr, addr));
      }
    }
  }

  private Method selectEntryMethod() throws AnalysisException {
    if (program.getEntry() != null) {
      Method method = program.getMethod(program.getEntry());
      if (method == null)
        throw new MissingEntryPointException("Entry method " + program.getEntry() + " is not part of " +
            program.getProgramName());

      return method;
    }

    if (program.getMethodCount() == 0)
      throw new EmptyProgramException("Program " + program.getProgramName() + " contains no methods");

    List<Method> mainMethods = program.getMainMethods();
    if (!mainMethods.isEmpty())
      return mainMethods.get(0);

    Method first = program.getAllMethods().get(0);
    LOGGER.warn("No entry and no main method declared in {}, starting at {}", program.getProgramName(), first);
    return first;
  }

  private void mainLoop() {
    int progressInterval = Math.max(1, options.getProgressInterval());

    while (true) {
      if (pendingJobs.isEmpty() && pendingJobs.releaseDeferred() == 0)
        break;

      if (options.getMaxIterations() > 0 && iterations >= options.getMaxIterations()) {
        LOGGER.warn("Iteration budget of {} exhausted for {}, {} jobs left", options.getMaxIterations(),
            program.getProgramName(), pendingJobs.size() + pendingJobs.deferredCount());
        budgetExhausted = true;
        break;
      }

      CFGJob job = pendingJobs.pop();
      iterations++;

      for (CFGJob newJob : scanJob(job))
        pendingJobs.add(newJob);

      if (iterations % progressInterval == 0)
        logProgress();
    }
  }

  private void logProgress() {
    int methodCount = Math.max(1, program.getMethodCount());
    int percentage = Math.min(100, functions.size() * 100 / methodCount);
    LOGGER.info("Progress {}%: {} jobs processed, {} nodes, {} pending", percentage, iterations,
        graph.nodeCount(), pendingJobs.size());
  }

  private void postAnalysis() {
    if (options.isMakeFunctions())
      new FunctionPartitioner(graph, functions).makeFunctions(entry);

    LOGGER.info("Recovered {} nodes, {} edges and {} functions for {} in {} iterations", graph.nodeCount(),
        graph.edgeCount(), functions.size(), program.getProgramName(), iterations);
  }

  /**
   * Process a single job.
   *
   * @return the jobs for all successors of a newly expanded node
   */
  List<CFGJob> scanJob(CFGJob job) {
    LOGGER.debug("Scan {}", job);

    Optional<Hook> hook = hooks.getHook(job.getAddress());
    if (hook.isPresent())
      return scanProcedure(job, hook.get());

    return scanBlock(job);
  }

  private List<CFGJob> scanProcedure(CFGJob job, Hook hook) {
    Address addr = job.getAddress();

    CFGNode node = graph.getNode(addr);
    if (node == null)
      node = new CFGNode(addr, hook.getLength(), job.getFunctionAddress(), hook.getName());

    applyFunctionEdges(job, false);
    node = graph.addNode(node);
    addIncomingEdge(job, node);
    functions.getOrCreate(node.getFunctionAddress()).addNode(addr);

    if (!graph.markTraversed(addr))
      return ImmutableList.of();

    Address function = node.getFunctionAddress();
    if (hook.isReturning()) {
      node.setHasReturn(true);
      functions.markReturning(function);
      functions.addReturnSite(function, addr);
      pendingJobs.functionReturned(function);
    } else {
      functions.markNonReturning(function);
    }

    return ImmutableList.of();
  }

  private List<CFGJob> scanBlock(CFGJob job) {
    Address addr = job.getAddress();

    CFGNode node = graph.getNode(addr);
    if (node == null) {
      BasicBlock bb;
      try {
        bb = lifter.lift(addr);
      } catch (BlockUnavailableException e) {
        LOGGER.debug(e.getMessage());
        unavailableBlocks.add(addr);
        applyFunctionEdges(job, true);
        return ImmutableList.of();
      }

      node = new CFGNode(addr, SuccessorResolver.getNodeSize(addr, bb), job.getFunctionAddress(), bb);
    }

    applyFunctionEdges(job, false);
    node = graph.addNode(node);
    addIncomingEdge(job, node);
    functions.getOrCreate(node.getFunctionAddress()).addNode(addr);

    // Shared by several predecessors, expand only once
    if (!graph.markTraversed(addr))
      return ImmutableList.of();

    BasicBlock bb = node.getBlock();
    node.clearBlock();

    return createJobs(node, successorResolver.getSuccessors(addr, bb));
  }

  private List<CFGJob> createJobs(CFGNode node, List<Successor> successors) {
    Address function = node.getFunctionAddress();
    List<CFGJob> jobs = new ArrayList<>();

    for (Successor successor : successors) {
      Address target = successor.getTarget();

      switch (successor.getKind()) {
        case RETURN:
          node.setHasReturn(true);
          functions.markReturning(function);
          functions.addReturnSite(function, node.getAddress());
          pendingJobs.functionReturned(function);
          break;

        case FALLTHROUGH:
        case BRANCH:
        case FAKE_RETURN: {
          CFGNode existing = graph.getNode(target);
          Address targetFunction = (existing != null && graph.isTraversed(target)) ?
              existing.getFunctionAddress() : function;
          boolean outside = !targetFunction.equals(function);

          FunctionEdge edge = new FunctionEdge(function, targetFunction, node.getAddress(), target,
              successor.getKind(), successor.getStmtIdx(), outside);
          List<Address> callees = (successor.getKind() == JumpKind.FAKE_RETURN) ?
              getCalleesAt(successors, successor.getStmtIdx()) : ImmutableList.<Address>of();

          jobs.add(new CFGJob(target, targetFunction, successor.getKind(), node, successor.getStmtIdx(),
              ImmutableList.of(edge), callees));
          break;
        }

        case CALL:
        case SYSCALL: {
          FunctionEdge edge = new FunctionEdge(function, target, node.getAddress(), target,
              successor.getKind(), successor.getStmtIdx(), true);
          jobs.add(new CFGJob(target, target, successor.getKind(), node, successor.getStmtIdx(),
              ImmutableList.of(edge), ImmutableList.<Address>of()));
          break;
        }

        default:
          LOGGER.warn("Unexpected successor {}", successor);
          break;
      }
    }

    return jobs;
  }

  private static List<Address> getCalleesAt(List<Successor> successors, int stmtIdx) {
    List<Address> callees = new ArrayList<>();
    for (Successor successor : successors) {
      if (successor.getKind().isCall() && successor.getStmtIdx() == stmtIdx)
        callees.add(successor.getTarget());
    }

    return callees;
  }

  /**
   * Record the function-level transitions of a job. Calls to targets which could not be lifted are
   * recorded as unresolved external calls.
   */
  private void applyFunctionEdges(CFGJob job, boolean unavailable) {
    for (FunctionEdge edge : job.getFunctionEdges()) {
      if (unavailable) {
        if (edge.getKind().isCall())
          functions.addTransitionEdge(edge.withKind(JumpKind.UNRESOLVED_EXTERNAL_CALL));
        continue;
      }

      functions.addTransitionEdge(edge);
    }
  }

  private void addIncomingEdge(CFGJob job, CFGNode node) {
    if (job.getSrcNode() != null)
      graph.addEdge(job.getSrcNode(), node, job.getJumpKind(), job.getSrcStmtIdx());
  }

  public Program getProgram() {
    return program;
  }

  public CFGGraph getGraph() {
    return graph;
  }

  public FunctionManager getFunctions() {
    return functions;
  }

  /**
   * @return the entry address, null before the analysis ran
   */
  public Address getEntry() {
    return entry;
  }

  public CFGOptions getOptions() {
    return options;
  }

  public int getIterations() {
    return iterations;
  }

  /**
   * @return the addresses for which no block could be lifted
   */
  public Set<Address> getUnavailableBlocks() {
    return Collections.unmodifiableSet(unavailableBlocks);
  }

  /**
   * @return true once the traversal and the partitioning finished
   */
  public boolean isCompleted() {
    return completed;
  }

  public boolean isBudgetExhausted() {
    return budgetExhausted;
  }
}
