/* SAAF: A static analyzer for APK files.
 * Copyright (C) 2013  syssec.rub.de
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package at.tugraz.iaik.cfgrecovery.application;

import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import com.google.common.collect.ImmutableList;

import java.util.*;

public class ProgramClass {
  private final String name;
  private final Program program;
  private final boolean isInterface;
  private final boolean isAbstract;
  private String superClass = null;
  private final Set<String> implementedInterfaces = new LinkedHashSet<>();
  private final List<Method> methodList = new ArrayList<>();

  public ProgramClass(String name, Program program, boolean isInterface, boolean isAbstract) {
    this.name = name;
    this.program = program;
    this.isInterface = isInterface;
    this.isAbstract = isAbstract;
  }

  public String getName() {
    return name;
  }

  public Program getProgram() {
    return program;
  }

  public boolean isInterface() {
    return isInterface;
  }

  public boolean isAbstract() {
    return isAbstract;
  }

  /**
   * @return true if instances of this class can exist at runtime
   */
  public boolean isConcrete() {
    return !isInterface && !isAbstract;
  }

  public String getSuperClass() {
    return superClass;
  }

  public void setSuperClass(String superClass) {
    this.superClass = superClass;
  }

  public Set<String> getImplementedInterfaces() {
    return Collections.unmodifiableSet(implementedInterfaces);
  }

  public void addImplementedInterface(String interfaceName) {
    implementedInterfaces.add(interfaceName);
  }

  public List<Method> getMethods() {
    return ImmutableList.copyOf(methodList);
  }

  public void addMethod(Method method) {
    methodList.add(method);
  }

  /**
   * Look up a method declared in this very class.
   *
   * @return the method with the same name and parameter types or null
   */
  public Method getDeclaredMethod(MethodDescriptor descriptor) {
    for (Method method : methodList) {
      if (method.getDescriptor().hasSameSubSignature(descriptor))
        return method;
    }

    return null;
  }

  @Override
  public String toString() {
    return "ProgramClass [name=" + name + "]";
  }
}
