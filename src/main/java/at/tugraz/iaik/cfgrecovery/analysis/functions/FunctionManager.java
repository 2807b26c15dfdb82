package at.tugraz.iaik.cfgrecovery.analysis.functions;

import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import com.google.common.collect.ImmutableSortedMap;

import java.util.*;

/**
 * The knowledge base of discovered functions, ordered by entry address.
 */
public class FunctionManager implements Iterable<Function> {
  private final SortedMap<Address, Function> functions = new TreeMap<>();

  public Function getOrCreate(Address address) {
    Function function = functions.get(address);
    if (function == null) {
      function = new Function(address);
      functions.put(address, function);
    }

    return function;
  }

  /**
   * @return the function or null
   */
  public Function get(Address address) {
    return functions.get(address);
  }

  public boolean contains(Address address) {
    return functions.containsKey(address);
  }

  public void markReturning(Address function) {
    getOrCreate(function).setReturning(Function.Returning.RETURNING);
  }

  /**
   * Mark a function as never returning, unless it is already known to return.
   */
  public void markNonReturning(Address function) {
    Function f = getOrCreate(function);
    if (f.getReturning() != Function.Returning.RETURNING)
      f.setReturning(Function.Returning.NON_RETURNING);
  }

  public void addReturnSite(Address function, Address returnSite) {
    getOrCreate(function).addReturnSite(returnSite);
  }

  /**
   * Record a transition on its source function. Calls also register the called function.
   */
  public void addTransitionEdge(FunctionEdge edge) {
    getOrCreate(edge.getSrcFunction()).addTransition(edge);

    switch (edge.getKind()) {
      case CALL:
      case SYSCALL:
        getOrCreate(edge.getDstFunction());
        break;
      default:
        break;
    }
  }

  public Function remove(Address address) {
    return functions.remove(address);
  }

  public void clear() {
    functions.clear();
  }

  /**
   * @return a deep copy of all functions, unaffected by later changes
   */
  public SortedMap<Address, Function> snapshot() {
    ImmutableSortedMap.Builder<Address, Function> copy = ImmutableSortedMap.naturalOrder();
    for (Function function : functions.values())
      copy.put(function.getAddress(), function.copy());

    return copy.build();
  }

  public Collection<Function> getFunctions() {
    return Collections.unmodifiableCollection(functions.values());
  }

  public int size() {
    return functions.size();
  }

  @Override
  public Iterator<Function> iterator() {
    return getFunctions().iterator();
  }
}
