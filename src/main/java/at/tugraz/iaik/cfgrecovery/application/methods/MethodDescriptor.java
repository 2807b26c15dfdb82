package at.tugraz.iaik.cfgrecovery.application.methods;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.List;
import java.util.Objects;

/**
 * Identifies a method independent of its body: declaring class, method name and parameter types.
 */
public final class MethodDescriptor implements Comparable<MethodDescriptor> {
  private static final Ordering<Iterable<String>> PARAMS_ORDERING = Ordering.<String>natural().lexicographical();

  private final String className;
  private final String name;
  private final ImmutableList<String> params;

  public MethodDescriptor(String className, String name, List<String> params) {
    this.className = Objects.requireNonNull(className);
    this.name = Objects.requireNonNull(name);
    this.params = ImmutableList.copyOf(params);
  }

  /**
   * Parses a descriptor of the form {@code pkg.Cls.name(type, type)}.
   *
   * @param descriptor the textual descriptor
   * @return the parsed descriptor
   * @throws IllegalArgumentException if the text is not a method descriptor
   */
  public static MethodDescriptor parse(String descriptor) {
    String s = descriptor.trim();
    int paramStart = s.indexOf('(');
    int paramEnd = s.lastIndexOf(')');
    if (paramStart <= 0 || paramEnd < paramStart)
      throw new IllegalArgumentException("Not a method descriptor: " + descriptor);

    String qualifiedName = s.substring(0, paramStart).trim();
    int nameStart = qualifiedName.lastIndexOf('.');
    if (nameStart <= 0 || nameStart == qualifiedName.length() - 1)
      throw new IllegalArgumentException("Method descriptor lacks a class name: " + descriptor);

    List<String> params = Splitter.on(',').trimResults().omitEmptyStrings()
        .splitToList(s.substring(paramStart + 1, paramEnd));

    return new MethodDescriptor(qualifiedName.substring(0, nameStart), qualifiedName.substring(nameStart + 1), params);
  }

  public String getClassName() {
    return className;
  }

  public String getName() {
    return name;
  }

  public List<String> getParams() {
    return params;
  }

  /**
   * @return true if both descriptors share name and parameter types, ignoring the declaring class
   */
  public boolean hasSameSubSignature(MethodDescriptor other) {
    return name.equals(other.name) && params.equals(other.params);
  }

  public MethodDescriptor withClassName(String otherClassName) {
    return new MethodDescriptor(otherClassName, name, params);
  }

  @Override
  public int compareTo(MethodDescriptor other) {
    return ComparisonChain.start()
        .compare(className, other.className)
        .compare(name, other.name)
        .compare(params, other.params, PARAMS_ORDERING)
        .result();
  }

  @Override
  public int hashCode() {
    return Objects.hash(className, name, params);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;

    if (obj == null || getClass() != obj.getClass())
      return false;

    final MethodDescriptor other = (MethodDescriptor) obj;

    return className.equals(other.className) && name.equals(other.name) && params.equals(other.params);
  }

  @Override
  public String toString() {
    return className + '.' + name + '(' + Joiner.on(", ").join(params) + ')';
  }
}
