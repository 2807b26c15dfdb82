package at.tugraz.iaik.cfgrecovery.analysis.functions;

import at.tugraz.iaik.cfgrecovery.analysis.cfg.JumpKind;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import com.google.common.base.Objects;

/**
 * A control transfer as seen from the function level: inside a function, into another function
 * (outside) or a call.
 */
public class FunctionEdge {
  private final Address srcFunction;
  private final Address dstFunction;
  private final Address srcAddress;
  private final Address dstAddress;
  private final JumpKind kind;
  private final int stmtIdx;
  private final boolean outside;

  public FunctionEdge(Address srcFunction, Address dstFunction, Address srcAddress, Address dstAddress,
                      JumpKind kind, int stmtIdx, boolean outside) {
    this.srcFunction = srcFunction;
    this.dstFunction = dstFunction;
    this.srcAddress = srcAddress;
    this.dstAddress = dstAddress;
    this.kind = kind;
    this.stmtIdx = stmtIdx;
    this.outside = outside;
  }

  /**
   * @return the same transition with a different jump kind
   */
  public FunctionEdge withKind(JumpKind otherKind) {
    return new FunctionEdge(srcFunction, dstFunction, srcAddress, dstAddress, otherKind, stmtIdx, outside);
  }

  public FunctionEdge withSrcFunction(Address otherSrcFunction) {
    return new FunctionEdge(otherSrcFunction, dstFunction, srcAddress, dstAddress, kind, stmtIdx, outside);
  }

  public Address getSrcFunction() {
    return srcFunction;
  }

  public Address getDstFunction() {
    return dstFunction;
  }

  public Address getSrcAddress() {
    return srcAddress;
  }

  public Address getDstAddress() {
    return dstAddress;
  }

  public JumpKind getKind() {
    return kind;
  }

  public int getStmtIdx() {
    return stmtIdx;
  }

  public boolean isOutside() {
    return outside;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(srcFunction, dstFunction, srcAddress, dstAddress, kind, stmtIdx, outside);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof FunctionEdge))
      return false;

    FunctionEdge other = (FunctionEdge) obj;
    return kind == other.kind && stmtIdx == other.stmtIdx && outside == other.outside &&
        Objects.equal(srcFunction, other.srcFunction) && Objects.equal(dstFunction, other.dstFunction) &&
        Objects.equal(srcAddress, other.srcAddress) && Objects.equal(dstAddress, other.dstAddress);
  }

  @Override
  public String toString() {
    return srcAddress + " -" + kind + (outside ? "(outside)" : "") + "-> " + dstAddress;
  }
}
