package at.tugraz.iaik.cfgrecovery.application;

import at.tugraz.iaik.cfgrecovery.application.hooks.Hook;
import at.tugraz.iaik.cfgrecovery.application.instructions.InvokeType;
import at.tugraz.iaik.cfgrecovery.application.instructions.Statement;
import at.tugraz.iaik.cfgrecovery.application.instructions.StatementType;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.BasicBlock;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class ProgramParserTest {
  private static final MethodDescriptor MAIN = MethodDescriptor.parse("app.Main.main(java.lang.String[])");

  private Program program;

  @Before
  public void setUp() throws Exception {
    program = ProgramParser.parse(new File(getClass().getResource("/programs/shapes.jir").toURI()));
  }

  @Test
  public void parsesClassesAndMethods() {
    assertEquals("shapes", program.getProgramName());
    assertEquals(5, program.getAllClasses().size());
    assertEquals(6, program.getMethodCount());
    assertEquals(MAIN, program.getEntry());

    ProgramClass shape = program.getProgramClass("app.Shape");
    assertTrue(shape.isAbstract());
    assertFalse(shape.isConcrete());
    assertEquals("java.lang.Object", shape.getSuperClass());
    assertEquals("app.Shape", program.getProgramClass("app.Circle").getSuperClass());

    Method area = program.getMethod(MethodDescriptor.parse("app.Shape.area()"));
    assertTrue(area.isAbstract());
    assertFalse(area.hasBody());
    assertEquals("int", area.getReturnType());
  }

  @Test
  public void splitsBasicBlocks() {
    Method main = program.getMethod(MAIN);
    List<BasicBlock> blocks = main.getBasicBlocks();

    assertEquals(4, blocks.size());
    assertEquals(0, blocks.get(0).getLabel());
    assertEquals(2, blocks.get(1).getLabel());
    assertEquals(6, blocks.get(2).getLabel());
    assertEquals(7, blocks.get(3).getLabel());
    assertEquals(4, blocks.get(1).size());
    assertEquals(8, main.getLastStatementId());

    assertEquals(new Address(MAIN, 1, 4), main.getAddressOf(4));
    assertNull(main.getAddressOf(9));
    assertSame(blocks.get(3), main.getBlockContaining(8));
  }

  @Test
  public void classifiesStatements() {
    List<Statement> statements = program.getMethod(MAIN).getStatements();

    assertEquals(StatementType.ASSIGN, statements.get(0).getType());
    assertFalse(statements.get(0).containsInvoke());

    assertEquals(StatementType.IF, statements.get(1).getType());
    assertEquals(Arrays.asList(6), statements.get(1).getTargets());

    Statement call = statements.get(3);
    assertEquals(StatementType.ASSIGN, call.getType());
    assertEquals(InvokeType.VIRTUAL, call.getInvokeExpr().getType());
    assertEquals(MethodDescriptor.parse("app.Shape.area()"), call.getInvokeExpr().getMethod());
    assertTrue(call.endsNode());

    assertEquals(StatementType.INVOKE, statements.get(4).getType());
    assertEquals(StatementType.GOTO, statements.get(5).getType());
    assertEquals(Arrays.asList(7), statements.get(5).getTargets());
    assertEquals(StatementType.RETURN, statements.get(8).getType());
  }

  @Test
  public void readsHooks() {
    MethodDescriptor exit = MethodDescriptor.parse("java.lang.System.exit(int)");
    Hook hook = program.getHooks().getHook(Address.entryOf(exit)).get();

    assertEquals(1, program.getHooks().size());
    assertEquals(exit.toString(), hook.getName());
    assertEquals(1, hook.getLength());
    assertFalse(hook.isReturning());
    assertTrue(hook.isSyscall());
  }

  @Test
  public void parsesSwitchWithDefaultLast() throws Exception {
    Program p = ProgramParser.parse("switch", Arrays.asList(
        ".class a.B",
        ".method static m(int) void",
        "  switch i One Two default Other",
        "One:",
        "  return",
        "Two:",
        "  return",
        "Other:",
        "  throw e",
        ".end method",
        ".end class"));

    Method m = p.getMethod(MethodDescriptor.parse("a.B.m(int)"));
    Statement stmt = m.getStatements().get(0);
    assertEquals(StatementType.SWITCH, stmt.getType());
    assertEquals(Arrays.asList(1, 2, 3), stmt.getTargets());
    assertEquals(StatementType.THROW, m.getStatements().get(3).getType());
    assertEquals(4, m.getBasicBlocks().size());
  }

  @Test
  public void mainMethodIsFoundWithoutEntryDirective() throws Exception {
    Program p = ProgramParser.parse("noentry", Arrays.asList(
        ".class a.Helper",
        ".method static help() void",
        "  return",
        ".end method",
        ".end class",
        ".class a.App",
        ".method public static main(java.lang.String[]) void",
        "  return",
        ".end method",
        ".end class"));

    assertNull(p.getEntry());
    assertEquals(1, p.getMainMethods().size());
    assertEquals("a.App", p.getMainMethods().get(0).getProgramClass().getName());
  }

  @Test
  public void resolvesInheritedMethods() {
    assertNull(program.getMethod(MethodDescriptor.parse("app.Circle.toString()")));
    assertNull(program.resolveMethod(MethodDescriptor.parse("app.Circle.toString()")));

    Method area = program.resolveMethod(MethodDescriptor.parse("app.Circle.area()"));
    assertEquals("app.Circle", area.getProgramClass().getName());
  }

  @Test
  public void rejectsUnknownLabel() {
    assertSyntaxError(4, Arrays.asList(
        ".class a.B",
        ".method m() void",
        "  x = 1",
        "  goto Nowhere",
        ".end method",
        ".end class"));
  }

  @Test
  public void rejectsLabelAtMethodEnd() {
    assertSyntaxError(4, Arrays.asList(
        ".class a.B",
        ".method m() void",
        "  return",
        "End:",
        ".end method",
        ".end class"));
  }

  @Test
  public void rejectsUnknownInvokeKind() {
    assertSyntaxError(3, Arrays.asList(
        ".class a.B",
        ".method m() void",
        "  invoke magic a.B.m()",
        ".end method",
        ".end class"));
  }

  @Test
  public void rejectsDuplicateClass() {
    assertSyntaxError(3, Arrays.asList(
        ".class a.B",
        ".end class",
        ".class a.B",
        ".end class"));
  }

  @Test
  public void rejectsUnterminatedMethod() {
    assertSyntaxError(2, Arrays.asList(
        ".class a.B",
        ".method m() void",
        "  return"));
  }

  @Test
  public void rejectsStatementOutsideMethod() {
    assertSyntaxError(2, Arrays.asList(
        ".class a.B",
        "  return",
        ".end class"));
  }

  private static void assertSyntaxError(int expectedLine, List<String> lines) {
    try {
      ProgramParser.parse("broken", lines);
      fail("Expected a syntax error");
    } catch (ProgramSyntaxException e) {
      assertEquals(expectedLine, e.getLineNr());
    }
  }
}
