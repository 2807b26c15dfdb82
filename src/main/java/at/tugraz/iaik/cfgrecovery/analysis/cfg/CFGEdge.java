package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;

/**
 * A typed edge of the recovered CFG. Two edges between the same nodes are distinct if they differ
 * in kind or source statement.
 */
public class CFGEdge implements Comparable<CFGEdge> {
  private final CFGNode src;
  private final CFGNode dst;
  private final JumpKind kind;
  private final int stmtIdx;

  public CFGEdge(CFGNode src, CFGNode dst, JumpKind kind, int stmtIdx) {
    this.src = src;
    this.dst = dst;
    this.kind = kind;
    this.stmtIdx = stmtIdx;
  }

  public CFGNode getSrc() {
    return src;
  }

  public CFGNode getDst() {
    return dst;
  }

  public JumpKind getKind() {
    return kind;
  }

  /**
   * @return the statement the edge leaves from, {@link Successor#DEFAULT_EXIT} for fallthroughs
   */
  public int getStmtIdx() {
    return stmtIdx;
  }

  @Override
  public int compareTo(CFGEdge other) {
    return ComparisonChain.start()
        .compare(src, other.src)
        .compare(dst, other.dst)
        .compare(kind, other.kind)
        .compare(stmtIdx, other.stmtIdx)
        .result();
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(src, dst, kind, stmtIdx);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof CFGEdge))
      return false;

    CFGEdge other = (CFGEdge) obj;
    return kind == other.kind && stmtIdx == other.stmtIdx && src.equals(other.src) && dst.equals(other.dst);
  }

  @Override
  public String toString() {
    return src.getAddress() + " -" + kind + "@" + stmtIdx + "-> " + dst.getAddress();
  }
}
