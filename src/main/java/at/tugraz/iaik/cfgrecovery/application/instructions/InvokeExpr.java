package at.tugraz.iaik.cfgrecovery.application.instructions;

import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;

import java.util.Objects;

public class InvokeExpr {
  private final InvokeType type;
  private final MethodDescriptor method;
  private final String baseType;

  public InvokeExpr(InvokeType type, MethodDescriptor method) {
    this(type, method, method.getClassName());
  }

  public InvokeExpr(InvokeType type, MethodDescriptor method, String baseType) {
    this.type = Objects.requireNonNull(type);
    this.method = Objects.requireNonNull(method);
    this.baseType = Objects.requireNonNull(baseType);
  }

  public InvokeType getType() {
    return type;
  }

  /**
   * @return the statically declared callee
   */
  public MethodDescriptor getMethod() {
    return method;
  }

  /**
   * @return the static type of the receiver, used as root for virtual dispatch
   */
  public String getBaseType() {
    return baseType;
  }

  @Override
  public String toString() {
    return type.name().toLowerCase() + " " + method;
  }
}
