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
package at.tugraz.iaik.cfgrecovery.application.instructions;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One statement of a method body. The id is unique within the method and gives the program order.
 */
public class Statement {
  private final int id;
  private final StatementType type;
  private final String line;
  private final int lineNr;
  private final InvokeExpr invokeExpr;
  private final List<String> targetLabels;

  // Resolved once the labels of the whole method are known
  private List<Integer> targets = ImmutableList.of();

  public Statement(int id, StatementType type, String line, int lineNr, InvokeExpr invokeExpr,
                   List<String> targetLabels) {
    this.id = id;
    this.type = type;
    this.line = line;
    this.lineNr = lineNr;
    this.invokeExpr = invokeExpr;
    this.targetLabels = ImmutableList.copyOf(targetLabels);
  }

  public int getId() {
    return id;
  }

  public StatementType getType() {
    return type;
  }

  /**
   * Get the invocation of this statement. For assignments this is the right-hand side, if it is an invocation.
   *
   * @return the invocation or null
   */
  public InvokeExpr getInvokeExpr() {
    return invokeExpr;
  }

  public boolean containsInvoke() {
    return invokeExpr != null;
  }

  /**
   * @return true if control does not continue with the next statement of this node after this statement
   */
  public boolean endsNode() {
    switch (type) {
      case GOTO:
      case SWITCH:
      case RETURN:
      case THROW:
        return true;
      case INVOKE:
      case ASSIGN:
        return containsInvoke();
      default:
        return false;
    }
  }

  /**
   * Branch targets as labels, in listing order. For switches the default label is the last one.
   */
  public List<String> getTargetLabels() {
    return targetLabels;
  }

  /**
   * Branch targets as statement ids, in the same order as {@link #getTargetLabels()}.
   */
  public List<Integer> getTargets() {
    return targets;
  }

  public void setTargets(List<Integer> targets) {
    this.targets = ImmutableList.copyOf(targets);
  }

  public String getLine() {
    return line;
  }

  public int getLineNr() {
    return lineNr;
  }

  @Override
  public String toString() {
    return id + ": " + line;
  }
}
