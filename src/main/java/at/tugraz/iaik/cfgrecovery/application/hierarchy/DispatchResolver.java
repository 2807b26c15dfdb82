package at.tugraz.iaik.cfgrecovery.application.hierarchy;

import at.tugraz.iaik.cfgrecovery.application.instructions.InvokeExpr;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;

import java.util.List;

/**
 * Maps the statically declared callee of a call site to the methods that may run at runtime.
 */
public interface DispatchResolver {
  /**
   * @param invoke the invocation at the call site
   * @param callee the declared callee, already resolved within the program
   * @param caller the method containing the call site
   * @return the candidates in a deterministic order, possibly empty
   */
  List<MethodDescriptor> resolveInvoke(InvokeExpr invoke, Method callee, Method caller);
}
