package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import com.google.common.base.Objects;

/**
 * One outgoing control transfer of a node.
 */
public class Successor {
  /**
   * Statement index of edges which leave a node at its end rather than at a specific statement.
   */
  public static final int DEFAULT_EXIT = -1;

  private final JumpKind kind;
  private final int stmtIdx;
  private final Address source;
  private final Address target;

  public Successor(JumpKind kind, int stmtIdx, Address source, Address target) {
    this.kind = kind;
    this.stmtIdx = stmtIdx;
    this.source = source;
    this.target = target;
  }

  public JumpKind getKind() {
    return kind;
  }

  public int getStmtIdx() {
    return stmtIdx;
  }

  public Address getSource() {
    return source;
  }

  /**
   * @return the target address, null for returns
   */
  public Address getTarget() {
    return target;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, stmtIdx, source, target);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Successor))
      return false;

    Successor other = (Successor) obj;
    return kind == other.kind && stmtIdx == other.stmtIdx && Objects.equal(source, other.source) &&
        Objects.equal(target, other.target);
  }

  @Override
  public String toString() {
    return kind + "@" + stmtIdx + " " + source + " -> " + target;
  }
}
