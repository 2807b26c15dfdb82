package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.analysis.functions.FunctionEdge;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A pending address together with the edge which led to it.
 */
public class CFGJob {
  private final Address address;
  private final Address functionAddress;
  private final JumpKind jumpKind;
  private final CFGNode srcNode;
  private final int srcStmtIdx;
  private final List<FunctionEdge> functionEdges;
  private final List<Address> calleeAddresses;

  /**
   * A job without predecessor, used to seed the worklist.
   */
  public CFGJob(Address address, Address functionAddress) {
    this(address, functionAddress, JumpKind.CALL, null, Successor.DEFAULT_EXIT,
        ImmutableList.<FunctionEdge>of(), ImmutableList.<Address>of());
  }

  public CFGJob(Address address, Address functionAddress, JumpKind jumpKind, CFGNode srcNode, int srcStmtIdx,
                List<FunctionEdge> functionEdges, List<Address> calleeAddresses) {
    this.address = address;
    this.functionAddress = functionAddress;
    this.jumpKind = jumpKind;
    this.srcNode = srcNode;
    this.srcStmtIdx = srcStmtIdx;
    this.functionEdges = ImmutableList.copyOf(functionEdges);
    this.calleeAddresses = ImmutableList.copyOf(calleeAddresses);
  }

  public Address getAddress() {
    return address;
  }

  public Address getFunctionAddress() {
    return functionAddress;
  }

  public JumpKind getJumpKind() {
    return jumpKind;
  }

  /**
   * @return the node the job was created from, null for seeds
   */
  public CFGNode getSrcNode() {
    return srcNode;
  }

  public int getSrcStmtIdx() {
    return srcStmtIdx;
  }

  public List<FunctionEdge> getFunctionEdges() {
    return functionEdges;
  }

  /**
   * @return for fake-return jobs the functions called at the call site
   */
  public List<Address> getCalleeAddresses() {
    return calleeAddresses;
  }

  @Override
  public String toString() {
    return "CFGJob [" + jumpKind + " -> " + address + ", function=" + functionAddress + "]";
  }
}
