package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.application.instructions.Statement;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.BasicBlock;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the outgoing edges of a node by scanning the statements of its block.
 */
public class SuccessorResolver {
  private final InvokeResolver invokeResolver;

  public SuccessorResolver(InvokeResolver invokeResolver) {
    this.invokeResolver = invokeResolver;
  }

  /**
   * Scan the block from the statement of the given address to its end.
   *
   * <p>Conditional branches add an edge and the scan goes on. Gotos, switches, returns and throws
   * stop the scan. A call site with at least one call edge adds a fake-return edge to the following
   * statement and stops the scan. Only if the scan did not stop, the node falls through to the next
   * statement, provided that statement lies before the last statement of the method.
   *
   * @param addr the start of the node
   * @param bb the block containing the address
   * @return the successors in statement order
   */
  public List<Successor> getSuccessors(Address addr, BasicBlock bb) {
    Method method = bb.getMethod();
    List<Successor> successors = new ArrayList<>();
    boolean stopped = false;

    scan:
    for (Statement stmt : bb.getStatementsFrom(addr.getStmtIdx())) {
      switch (stmt.getType()) {
        case IF:
          successors.add(branchTo(addr, method, stmt, stmt.getTargets().get(0)));
          break;

        case GOTO:
          successors.add(branchTo(addr, method, stmt, stmt.getTargets().get(0)));
          stopped = true;
          break scan;

        case SWITCH:
          for (int target : stmt.getTargets())
            successors.add(branchTo(addr, method, stmt, target));
          stopped = true;
          break scan;

        case INVOKE:
        case ASSIGN:
          if (!stmt.containsInvoke())
            break;

          List<Successor> calls = invokeResolver.resolve(addr, stmt);
          if (calls.isEmpty())
            break;

          successors.addAll(calls);
          Address returnSite = method.getAddressOf(stmt.getId() + 1);
          if (returnSite != null)
            successors.add(new Successor(JumpKind.FAKE_RETURN, stmt.getId(), addr, returnSite));
          stopped = true;
          break scan;

        case RETURN:
          successors.add(new Successor(JumpKind.RETURN, stmt.getId(), addr, null));
          stopped = true;
          break scan;

        case THROW:
          stopped = true;
          break scan;

        case PLAIN:
        default:
          break;
      }
    }

    if (!stopped) {
      int nextStmtId = bb.getLabel() + bb.size();
      if (nextStmtId < method.getLastStatementId()) {
        successors.add(new Successor(JumpKind.FALLTHROUGH, Successor.DEFAULT_EXIT, addr,
            method.getAddressOf(nextStmtId)));
      }
    }

    return successors;
  }

  private static Successor branchTo(Address addr, Method method, Statement stmt, int targetStmtId) {
    return new Successor(JumpKind.BRANCH, stmt.getId(), addr, method.getAddressOf(targetStmtId));
  }

  /**
   * The node size counts the statements from the start address up to and including the first
   * statement that leaves the node.
   */
  public static int getNodeSize(Address addr, BasicBlock bb) {
    int size = 0;
    for (Statement stmt : bb.getStatementsFrom(addr.getStmtIdx())) {
      size++;
      if (stmt.endsNode())
        break;
    }

    return size;
  }
}
