package at.tugraz.iaik.cfgrecovery.analysis.functions;

import at.tugraz.iaik.cfgrecovery.application.methods.Address;

import java.util.*;

public class Function implements Comparable<Function> {
  public enum Returning {
    UNKNOWN, RETURNING, NON_RETURNING
  }

  private final Address address;
  private Returning returning = Returning.UNKNOWN;
  private final Set<Address> nodes = new LinkedHashSet<>();
  private final Set<Address> returnSites = new LinkedHashSet<>();
  private final Set<FunctionEdge> transitions = new LinkedHashSet<>();
  private boolean orphan = false;

  public Function(Address address) {
    this.address = address;
  }

  public Address getAddress() {
    return address;
  }

  /**
   * @return the entry address, which is also the function identifier
   */
  public Address getStartpoint() {
    return address;
  }

  public String getName() {
    if (address.isMethodEntry())
      return address.getMethod().toString();

    return address.getMethod() + "+" + address.getStmtIdx();
  }

  public Returning getReturning() {
    return returning;
  }

  public void setReturning(Returning returning) {
    this.returning = returning;
  }

  public boolean isReturning() {
    return returning == Returning.RETURNING;
  }

  public Set<Address> getNodes() {
    return Collections.unmodifiableSet(nodes);
  }

  public void addNode(Address node) {
    nodes.add(node);
  }

  public boolean containsNode(Address node) {
    return nodes.contains(node);
  }

  public Set<Address> getReturnSites() {
    return Collections.unmodifiableSet(returnSites);
  }

  public void addReturnSite(Address returnSite) {
    returnSites.add(returnSite);
  }

  public Set<FunctionEdge> getTransitions() {
    return Collections.unmodifiableSet(transitions);
  }

  public void addTransition(FunctionEdge edge) {
    transitions.add(edge);
  }

  /**
   * @return the called function addresses, including unresolved external ones, in ascending order
   */
  public SortedSet<Address> getCallTargets() {
    SortedSet<Address> targets = new TreeSet<>();
    for (FunctionEdge edge : transitions) {
      if (edge.getKind().isCall())
        targets.add(edge.getDstFunction());
    }

    return targets;
  }

  /**
   * An orphan chunk is a function that could only be rooted at a node no call or entry reaches.
   */
  public boolean isOrphan() {
    return orphan;
  }

  public void setOrphan(boolean orphan) {
    this.orphan = orphan;
  }

  /**
   * Copy the function including its nodes and transitions.
   */
  public Function copy() {
    Function copy = new Function(address);
    copy.returning = returning;
    copy.nodes.addAll(nodes);
    copy.returnSites.addAll(returnSites);
    copy.transitions.addAll(transitions);
    copy.orphan = orphan;

    return copy;
  }

  @Override
  public int compareTo(Function other) {
    return address.compareTo(other.address);
  }

  @Override
  public String toString() {
    return "Function [" + getName() + ", " + returning + ", " + nodes.size() + " nodes]";
  }
}
