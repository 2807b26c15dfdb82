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

import at.tugraz.iaik.cfgrecovery.application.instructions.Statement;
import com.google.common.collect.ImmutableList;

import java.util.List;

public class BasicBlock {
  private final Method method;
  private final int index;
  private final ImmutableList<Statement> statements;

  /**
   * A BasicBlock.
   *
   * @param method the method where this BB belongs to
   * @param index the position of this BB within the method
   * @param statements for this BB, never empty
   */
  public BasicBlock(Method method, int index, List<Statement> statements) {
    if (statements.isEmpty())
      throw new IllegalArgumentException("A basic block needs at least one statement");

    this.method = method;
    this.index = index;
    this.statements = ImmutableList.copyOf(statements);
  }

  public Method getMethod() {
    return method;
  }

  public int getIndex() {
    return index;
  }

  /**
   * Get the label of this BB, which is the id of its first statement.
   *
   * @return the label of this BB
   */
  public int getLabel() {
    return statements.get(0).getId();
  }

  public List<Statement> getStatements() {
    return statements;
  }

  public int size() {
    return statements.size();
  }

  public boolean containsStatement(int stmtId) {
    return stmtId >= getLabel() && stmtId < getLabel() + statements.size();
  }

  /**
   * Get all statements from the given statement id up to the end of the block.
   *
   * @param stmtId a statement id within this block
   * @return the tail of the statement list
   */
  public List<Statement> getStatementsFrom(int stmtId) {
    if (!containsStatement(stmtId))
      throw new IndexOutOfBoundsException("Statement " + stmtId + " is not part of block " + index);

    return statements.subList(stmtId - getLabel(), statements.size());
  }

  public Address getAddress() {
    return new Address(method.getDescriptor(), index, getLabel());
  }

  @Override
  public String toString() {
    StringBuilder bb = new StringBuilder();
    for (Statement stmt : statements) {
      bb.append(stmt);
      bb.append("\n");
    }

    return bb.toString();
  }
}
