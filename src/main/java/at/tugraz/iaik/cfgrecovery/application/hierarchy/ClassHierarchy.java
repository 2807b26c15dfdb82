package at.tugraz.iaik.cfgrecovery.application.hierarchy;

import at.tugraz.iaik.cfgrecovery.application.Program;
import at.tugraz.iaik.cfgrecovery.application.ProgramClass;
import at.tugraz.iaik.cfgrecovery.application.instructions.InvokeExpr;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Class hierarchy analysis over a program image. Every concrete subtype of the receiver type
 * contributes the implementation it would dispatch to.
 */
public class ClassHierarchy implements DispatchResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClassHierarchy.class);

  private final Program program;
  private final Map<List<Object>, List<MethodDescriptor>> cache = new HashMap<>();

  public ClassHierarchy(Program program) {
    this.program = program;
  }

  @Override
  public List<MethodDescriptor> resolveInvoke(InvokeExpr invoke, Method callee, Method caller) {
    List<Object> key = ImmutableList.of(invoke.getType(), invoke.getBaseType(), callee.getDescriptor());
    List<MethodDescriptor> candidates = cache.get(key);
    if (candidates == null) {
      candidates = resolve(invoke, callee);
      cache.put(key, candidates);

      if (candidates.isEmpty())
        LOGGER.debug("No implementation of {} reachable in {}", callee, caller);
    }

    return candidates;
  }

  private List<MethodDescriptor> resolve(InvokeExpr invoke, Method callee) {
    switch (invoke.getType()) {
      case STATIC:
        return ImmutableList.of(callee.getDescriptor());

      case SPECIAL:
        if (callee.isPrivate() || callee.isConstructor())
          return ImmutableList.of(callee.getDescriptor());

        Method target = resolveConcreteDispatch(callee.getDescriptor(), callee.getProgramClass().getName());
        return (target == null) ? ImmutableList.<MethodDescriptor>of() : ImmutableList.of(target.getDescriptor());

      case VIRTUAL:
      case INTERFACE:
      case DYNAMIC:
      default:
        return resolveAbstractDispatch(invoke.getBaseType(), callee);
    }
  }

  /**
   * Collect the implementations of all concrete classes which are subtypes of the base type.
   */
  public List<MethodDescriptor> resolveAbstractDispatch(String baseType, Method callee) {
    if (baseType == null || !program.containsClass(baseType))
      baseType = callee.getProgramClass().getName();

    Set<MethodDescriptor> targets = new LinkedHashSet<>();
    for (ProgramClass pc : program.getAllClasses()) {
      if (!pc.isConcrete() || !isSubtype(pc.getName(), baseType))
        continue;

      Method target = resolveConcreteDispatch(callee.getDescriptor(), pc.getName());
      if (target != null)
        targets.add(target.getDescriptor());
    }

    return ImmutableList.copyOf(targets);
  }

  /**
   * Find the implementation an object of the given class runs: the first concrete declaration walking
   * up the superclass chain, then default implementations in its interfaces.
   *
   * @return the implementing method or null
   */
  public Method resolveConcreteDispatch(MethodDescriptor method, String className) {
    for (ProgramClass pc : getSuperClassChain(className)) {
      Method declared = pc.getDeclaredMethod(method);
      if (declared != null && declared.isConcrete())
        return declared;
    }

    for (String interfaceName : getAllSuperTypes(className)) {
      ProgramClass pc = program.getProgramClass(interfaceName);
      if (pc == null || !pc.isInterface())
        continue;

      Method declared = pc.getDeclaredMethod(method);
      if (declared != null && declared.isConcrete() && declared.hasBody())
        return declared;
    }

    return null;
  }

  public boolean isSubtype(String className, String baseType) {
    return getAllSuperTypes(className).contains(baseType);
  }

  /**
   * @return the class itself, its superclasses and all transitively implemented interfaces
   */
  public Set<String> getAllSuperTypes(String className) {
    Set<String> superTypes = new LinkedHashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    queue.add(className);

    while (!queue.isEmpty()) {
      String current = queue.poll();
      if (!superTypes.add(current))
        continue;

      ProgramClass pc = program.getProgramClass(current);
      if (pc == null)
        continue;

      if (pc.getSuperClass() != null)
        queue.add(pc.getSuperClass());
      queue.addAll(pc.getImplementedInterfaces());
    }

    return superTypes;
  }

  private List<ProgramClass> getSuperClassChain(String className) {
    List<ProgramClass> chain = new ArrayList<>();
    Set<String> visited = new HashSet<>();

    String current = className;
    while (current != null && visited.add(current)) {
      ProgramClass pc = program.getProgramClass(current);
      if (pc == null)
        break;

      chain.add(pc);
      current = pc.getSuperClass();
    }

    return chain;
  }
}
