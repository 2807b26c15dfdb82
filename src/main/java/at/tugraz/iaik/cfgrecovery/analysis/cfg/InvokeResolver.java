package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.application.Program;
import at.tugraz.iaik.cfgrecovery.application.hierarchy.DispatchResolver;
import at.tugraz.iaik.cfgrecovery.application.hooks.Hook;
import at.tugraz.iaik.cfgrecovery.application.hooks.HookTable;
import at.tugraz.iaik.cfgrecovery.application.instructions.InvokeExpr;
import at.tugraz.iaik.cfgrecovery.application.instructions.Statement;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a call site into call edges, one per dispatch candidate.
 */
public class InvokeResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(InvokeResolver.class);

  private final Program program;
  private final DispatchResolver dispatchResolver;
  private final HookTable hooks;

  public InvokeResolver(Program program, DispatchResolver dispatchResolver) {
    this.program = program;
    this.dispatchResolver = dispatchResolver;
    this.hooks = program.getHooks();
  }

  /**
   * @param source the node containing the call site
   * @param stmt an invoke statement or an assignment from an invocation
   * @return the call edges, empty if no implementation could be determined
   */
  public List<Successor> resolve(Address source, Statement stmt) {
    InvokeExpr invoke = stmt.getInvokeExpr();
    Method callee = program.resolveMethod(invoke.getMethod());

    // Not part of the image: an opaque library or native call
    if (callee == null) {
      LOGGER.debug("External call to {} at {}", invoke.getMethod(), source);
      return ImmutableList.of(callTo(source, stmt, invoke.getMethod()));
    }

    Method caller = program.getMethod(source.getMethod());
    List<Successor> calls = new ArrayList<>();
    for (MethodDescriptor candidate : dispatchResolver.resolveInvoke(invoke, callee, caller))
      calls.add(callTo(source, stmt, candidate));

    return calls;
  }

  private Successor callTo(Address source, Statement stmt, MethodDescriptor target) {
    Address targetAddr = Address.entryOf(target);
    Optional<Hook> hook = hooks.getHook(targetAddr);
    JumpKind kind = (hook.isPresent() && hook.get().isSyscall()) ? JumpKind.SYSCALL : JumpKind.CALL;

    return new Successor(kind, stmt.getId(), source, targetAddr);
  }
}
