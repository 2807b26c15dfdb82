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

import at.tugraz.iaik.cfgrecovery.application.hooks.HookTable;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import com.google.common.collect.ImmutableList;

import java.io.File;
import java.util.*;

/**
 * The program image: all classes with their methods, an optional designated entry method and
 * the addresses that are modelled by hooks instead of real code.
 */
public class Program {
  private static final String MAIN_METHOD_NAME = "main";
  private static final List<String> MAIN_METHOD_PARAMS = ImmutableList.of("java.lang.String[]");

  private final String programName;
  private final File programFile;
  private final Map<String, ProgramClass> classMap = new LinkedHashMap<>();
  private final HookTable hooks = new HookTable();
  private MethodDescriptor entry = null;

  public Program(String programName, File programFile) {
    this.programName = programName;
    this.programFile = programFile;
  }

  public void addClass(ProgramClass programClass) {
    classMap.put(programClass.getName(), programClass);
  }

  public boolean containsClass(String className) {
    return classMap.containsKey(className);
  }

  /**
   * @return the class or null if it is not part of the program image
   */
  public ProgramClass getProgramClass(String className) {
    return classMap.get(className);
  }

  public List<ProgramClass> getAllClasses() {
    return ImmutableList.copyOf(classMap.values());
  }

  public List<Method> getAllMethods() {
    List<Method> methods = new ArrayList<>();
    for (ProgramClass pc : classMap.values())
      methods.addAll(pc.getMethods());

    return methods;
  }

  public int getMethodCount() {
    int count = 0;
    for (ProgramClass pc : classMap.values())
      count += pc.getMethods().size();

    return count;
  }

  /**
   * Look up a method exactly as declared.
   *
   * @return the method or null if the declaring class does not declare it
   */
  public Method getMethod(MethodDescriptor descriptor) {
    ProgramClass pc = classMap.get(descriptor.getClassName());
    return (pc == null) ? null : pc.getDeclaredMethod(descriptor);
  }

  /**
   * Look up a method, also checking the super classes recursively if the named class
   * does not declare it.
   *
   * @return the first declaration found or null if the method is not part of the program image
   */
  public Method resolveMethod(MethodDescriptor descriptor) {
    Set<String> visited = new HashSet<>();
    String className = descriptor.getClassName();

    while (className != null && visited.add(className)) {
      ProgramClass pc = classMap.get(className);
      if (pc == null)
        return null;

      Method method = pc.getDeclaredMethod(descriptor);
      if (method != null)
        return method;

      className = pc.getSuperClass();
    }

    return null;
  }

  /**
   * @return all {@code static main(java.lang.String[])} methods in declaration order
   */
  public List<Method> getMainMethods() {
    List<Method> mainMethods = new ArrayList<>();
    for (Method method : getAllMethods()) {
      if (method.isStatic() && MAIN_METHOD_NAME.equals(method.getName()) &&
          MAIN_METHOD_PARAMS.equals(method.getParams()))
        mainMethods.add(method);
    }

    return mainMethods;
  }

  public MethodDescriptor getEntry() {
    return entry;
  }

  public void setEntry(MethodDescriptor entry) {
    this.entry = entry;
  }

  public HookTable getHooks() {
    return hooks;
  }

  public String getProgramName() {
    return programName;
  }

  public File getProgramFile() {
    return programFile;
  }

  @Override
  public String toString() {
    return "Program [programName=" + programName + "]";
  }
}
