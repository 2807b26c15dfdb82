package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.MutableNetwork;
import com.google.common.graph.Network;
import com.google.common.graph.NetworkBuilder;

import java.util.*;

/**
 * The node table and the directed multigraph of the recovered CFG. Holds at most one node per address.
 */
public class CFGGraph {
  private final MutableNetwork<CFGNode, CFGEdge> network = NetworkBuilder.directed()
      .allowsParallelEdges(true)
      .allowsSelfLoops(true)
      .build();
  private final Map<Address, CFGNode> nodes = new LinkedHashMap<>();
  private final Set<Address> traversed = new HashSet<>();

  /**
   * Register a node unless a node with the same address exists.
   *
   * @return the node stored for the address
   */
  public CFGNode addNode(CFGNode node) {
    CFGNode existing = nodes.putIfAbsent(node.getAddress(), node);
    if (existing != null)
      return existing;

    network.addNode(node);
    return node;
  }

  /**
   * @return the node for the address or null
   */
  public CFGNode getNode(Address address) {
    return nodes.get(address);
  }

  public boolean hasNode(Address address) {
    return nodes.containsKey(address);
  }

  /**
   * Add an edge between two registered nodes.
   *
   * @return false if an equal edge already exists
   */
  public boolean addEdge(CFGNode src, CFGNode dst, JumpKind kind, int stmtIdx) {
    return network.addEdge(nodes.get(src.getAddress()), nodes.get(dst.getAddress()),
        new CFGEdge(src, dst, kind, stmtIdx));
  }

  /**
   * @return true if the address was not traversed before
   */
  public boolean markTraversed(Address address) {
    return traversed.add(address);
  }

  public boolean isTraversed(Address address) {
    return traversed.contains(address);
  }

  public Set<Address> getTraversed() {
    return Collections.unmodifiableSet(traversed);
  }

  /**
   * @return all nodes in insertion order
   */
  public Collection<CFGNode> getNodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public Set<CFGEdge> getEdges() {
    return ImmutableSet.copyOf(network.edges());
  }

  public Set<CFGEdge> getOutEdges(CFGNode node) {
    return network.outEdges(node);
  }

  public Set<CFGEdge> getInEdges(CFGNode node) {
    return network.inEdges(node);
  }

  /**
   * @return the outgoing edges ordered by destination, kind and statement
   */
  public List<CFGEdge> getSortedOutEdges(CFGNode node) {
    List<CFGEdge> edges = new ArrayList<>(network.outEdges(node));
    Collections.sort(edges);
    return edges;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return network.edges().size();
  }

  /**
   * @return the underlying multigraph, for graph algorithms over the CFG
   */
  public Network<CFGNode, CFGEdge> asNetwork() {
    return network;
  }
}
