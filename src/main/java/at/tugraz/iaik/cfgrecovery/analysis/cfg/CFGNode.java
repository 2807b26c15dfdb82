package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.BasicBlock;

/**
 * A vertex of the recovered CFG. Nodes are identified by their address alone.
 */
public class CFGNode implements Comparable<CFGNode> {
  private final Address address;
  private final int size;
  private final String name;
  private final boolean hooked;
  private Address functionAddress;
  private BasicBlock block;
  private boolean hasReturn = false;

  public CFGNode(Address address, int size, Address functionAddress, BasicBlock block) {
    this.address = address;
    this.size = size;
    this.functionAddress = functionAddress;
    this.block = block;
    this.name = null;
    this.hooked = false;
  }

  /**
   * Create a stub node for a hooked address.
   */
  public CFGNode(Address address, int size, Address functionAddress, String hookName) {
    this.address = address;
    this.size = size;
    this.functionAddress = functionAddress;
    this.block = null;
    this.name = hookName;
    this.hooked = true;
  }

  public Address getAddress() {
    return address;
  }

  /**
   * @return the number of statements covered by this node
   */
  public int getSize() {
    return size;
  }

  public Address getFunctionAddress() {
    return functionAddress;
  }

  public void setFunctionAddress(Address functionAddress) {
    this.functionAddress = functionAddress;
  }

  /**
   * @return the lifted block, or null once the node has been expanded
   */
  public BasicBlock getBlock() {
    return block;
  }

  public void clearBlock() {
    block = null;
  }

  /**
   * @return the hook name for stub nodes, otherwise null
   */
  public String getName() {
    return name;
  }

  public boolean isHooked() {
    return hooked;
  }

  public boolean hasReturn() {
    return hasReturn;
  }

  public void setHasReturn(boolean hasReturn) {
    this.hasReturn = hasReturn;
  }

  @Override
  public int compareTo(CFGNode other) {
    return address.compareTo(other.address);
  }

  @Override
  public int hashCode() {
    return address.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof CFGNode))
      return false;

    return address.equals(((CFGNode) obj).address);
  }

  @Override
  public String toString() {
    return (name != null) ? "<CFGNode " + name + " " + address + ">" : "<CFGNode " + address + " [" + size + "]>";
  }
}
