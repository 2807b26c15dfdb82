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
package at.tugraz.iaik.cfgrecovery.application.methods;

import at.tugraz.iaik.cfgrecovery.application.ProgramClass;
import at.tugraz.iaik.cfgrecovery.application.instructions.Statement;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.*;

public class Method implements Comparable<Method> {
  private static final String CONSTRUCTOR_NAME = "<init>";
  private static final String STATIC_CONSTRUCTOR_NAME = "<clinit>";

  private final MethodDescriptor descriptor;
  private final ProgramClass programClass;
  private final Set<String> modifiers;
  private final String returnType;
  private final ImmutableList<Statement> statements;
  private ImmutableList<BasicBlock> bbList = ImmutableList.of();
  private final NavigableMap<Integer, BasicBlock> blocksByLabel = new TreeMap<>();

  public Method(MethodDescriptor descriptor, ProgramClass programClass, Collection<String> modifiers,
                String returnType, List<Statement> statements) {
    this.descriptor = descriptor;
    this.programClass = programClass;
    this.modifiers = ImmutableSet.copyOf(modifiers);
    this.returnType = returnType;
    this.statements = ImmutableList.copyOf(statements);

    generateBBs();
  }

  private void generateBBs() {
    if (statements.isEmpty())
      return;

    SortedSet<Integer> leaders = findLeaders();
    List<BasicBlock> blocks = new ArrayList<>();
    List<Statement> current = new ArrayList<>();

    for (Statement stmt : statements) {
      if (leaders.contains(stmt.getId()) && !current.isEmpty()) {
        blocks.add(new BasicBlock(this, blocks.size(), current));
        current = new ArrayList<>();
      }
      current.add(stmt);
    }
    blocks.add(new BasicBlock(this, blocks.size(), current));

    bbList = ImmutableList.copyOf(blocks);
    for (BasicBlock bb : bbList)
      blocksByLabel.put(bb.getLabel(), bb);
  }

  /**
   * A leader starts a BB: the first statement, every jump target and every statement following
   * a jump, switch, return or throw. Invocations do not end a BB.
   */
  private SortedSet<Integer> findLeaders() {
    SortedSet<Integer> leaders = new TreeSet<>();
    leaders.add(statements.get(0).getId());

    for (Statement stmt : statements) {
      switch (stmt.getType()) {
        case IF:
        case GOTO:
        case SWITCH:
          leaders.addAll(stmt.getTargets());
          leaders.add(stmt.getId() + 1);
          break;
        case RETURN:
        case THROW:
          leaders.add(stmt.getId() + 1);
          break;
        default:
          break;
      }
    }

    return leaders;
  }

  public MethodDescriptor getDescriptor() {
    return descriptor;
  }

  public ProgramClass getProgramClass() {
    return programClass;
  }

  public String getName() {
    return descriptor.getName();
  }

  public List<String> getParams() {
    return descriptor.getParams();
  }

  public String getReturnType() {
    return returnType;
  }

  public Set<String> getModifiers() {
    return modifiers;
  }

  public boolean isStatic() {
    return modifiers.contains("static");
  }

  public boolean isPrivate() {
    return modifiers.contains("private");
  }

  public boolean isAbstract() {
    return modifiers.contains("abstract");
  }

  public boolean isNative() {
    return modifiers.contains("native");
  }

  public boolean isConstructor() {
    return CONSTRUCTOR_NAME.equals(getName()) || STATIC_CONSTRUCTOR_NAME.equals(getName());
  }

  public boolean isConcrete() {
    return !isAbstract() && !isNative();
  }

  public boolean hasBody() {
    return !bbList.isEmpty();
  }

  public List<Statement> getStatements() {
    return statements;
  }

  public List<BasicBlock> getBasicBlocks() {
    return bbList;
  }

  public BasicBlock getFirstBasicBlock() {
    return bbList.isEmpty() ? null : bbList.get(0);
  }

  /**
   * @return the BB with the given index or null
   */
  public BasicBlock getBlock(int blockIdx) {
    if (blockIdx < 0 || blockIdx >= bbList.size())
      return null;

    return bbList.get(blockIdx);
  }

  /**
   * @return the BB starting with the given statement id or null
   */
  public BasicBlock getBlockByLabel(int label) {
    return blocksByLabel.get(label);
  }

  /**
   * @return the BB containing the given statement id or null
   */
  public BasicBlock getBlockContaining(int stmtId) {
    Map.Entry<Integer, BasicBlock> entry = blocksByLabel.floorEntry(stmtId);
    if (entry == null || !entry.getValue().containsStatement(stmtId))
      return null;

    return entry.getValue();
  }

  /**
   * @return the address of the given statement id, or null if the method has no such statement
   */
  public Address getAddressOf(int stmtId) {
    BasicBlock bb = getBlockContaining(stmtId);
    return (bb == null) ? null : new Address(descriptor, bb.getIndex(), stmtId);
  }

  /**
   * @return the id of the last statement of the last BB, -1 for methods without a body
   */
  public int getLastStatementId() {
    if (bbList.isEmpty())
      return -1;

    BasicBlock last = bbList.get(bbList.size() - 1);
    return last.getLabel() + last.size() - 1;
  }

  @Override
  public int compareTo(Method other) {
    return descriptor.compareTo(other.descriptor);
  }

  @Override
  public String toString() {
    return descriptor.toString();
  }
}
