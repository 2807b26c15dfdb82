package at.tugraz.iaik.cfgrecovery.application.methods;

import com.google.common.collect.ComparisonChain;

import java.util.Objects;

/**
 * A precise point in the program: method, block index within the method and method-global statement id.
 * Two addresses are equal iff all three components match.
 */
public final class Address implements Comparable<Address> {
  private final MethodDescriptor method;
  private final int blockIdx;
  private final int stmtIdx;

  public Address(MethodDescriptor method, int blockIdx, int stmtIdx) {
    this.method = Objects.requireNonNull(method);
    this.blockIdx = blockIdx;
    this.stmtIdx = stmtIdx;
  }

  /**
   * The zero-offset address of a method, i.e. its first statement in its first block.
   * Also used as synthetic target for methods without a body in the program image.
   */
  public static Address entryOf(MethodDescriptor method) {
    return new Address(method, 0, 0);
  }

  public MethodDescriptor getMethod() {
    return method;
  }

  public int getBlockIdx() {
    return blockIdx;
  }

  public int getStmtIdx() {
    return stmtIdx;
  }

  public boolean isMethodEntry() {
    return blockIdx == 0 && stmtIdx == 0;
  }

  @Override
  public int compareTo(Address other) {
    return ComparisonChain.start()
        .compare(method, other.method)
        .compare(blockIdx, other.blockIdx)
        .compare(stmtIdx, other.stmtIdx)
        .result();
  }

  @Override
  public int hashCode() {
    return Objects.hash(method, blockIdx, stmtIdx);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;

    if (obj == null || getClass() != obj.getClass())
      return false;

    final Address other = (Address) obj;

    return blockIdx == other.blockIdx && stmtIdx == other.stmtIdx && method.equals(other.method);
  }

  @Override
  public String toString() {
    return "<" + method + "+" + blockIdx + "[" + stmtIdx + "]>";
  }
}
