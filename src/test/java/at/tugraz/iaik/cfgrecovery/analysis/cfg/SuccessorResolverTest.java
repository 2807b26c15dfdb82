package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.application.Program;
import at.tugraz.iaik.cfgrecovery.application.ProgramParser;
import at.tugraz.iaik.cfgrecovery.application.hierarchy.ClassHierarchy;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.BasicBlock;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;
import at.tugraz.iaik.cfgrecovery.application.methods.MethodDescriptor;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class SuccessorResolverTest {
  private static final MethodDescriptor MAIN = MethodDescriptor.parse("app.Main.main(java.lang.String[])");

  private Program program;
  private SuccessorResolver resolver;

  @Before
  public void setUp() throws Exception {
    program = ProgramParser.parse(new File(getClass().getResource("/programs/shapes.jir").toURI()));
    resolver = newResolver(program);
  }

  private static SuccessorResolver newResolver(Program program) {
    return new SuccessorResolver(new InvokeResolver(program, new ClassHierarchy(program)));
  }

  @Test
  public void conditionalBranchAlsoFallsThrough() {
    List<Successor> successors = successorsOf(program, MAIN, 0);

    assertEquals(2, successors.size());
    assertEquals(new Successor(JumpKind.BRANCH, 1, new Address(MAIN, 0, 0), new Address(MAIN, 2, 6)),
        successors.get(0));
    assertEquals(new Successor(JumpKind.FALLTHROUGH, Successor.DEFAULT_EXIT, new Address(MAIN, 0, 0),
        new Address(MAIN, 1, 2)), successors.get(1));
  }

  @Test
  public void virtualCallFansOutToEveryOverride() {
    List<Successor> successors = successorsOf(program, MAIN, 1);

    List<Address> callTargets = new ArrayList<>();
    for (Successor successor : successors) {
      assertNotEquals(JumpKind.FALLTHROUGH, successor.getKind());
      if (successor.getKind() == JumpKind.CALL) {
        assertEquals(3, successor.getStmtIdx());
        callTargets.add(successor.getTarget());
      }
    }

    assertEquals(Arrays.asList(
        Address.entryOf(MethodDescriptor.parse("app.Circle.area()")),
        Address.entryOf(MethodDescriptor.parse("app.Square.area()")),
        Address.entryOf(MethodDescriptor.parse("app.Triangle.area()"))), callTargets);

    // The code after the call site is reached through a fake return, not a fallthrough
    Successor last = successors.get(successors.size() - 1);
    assertEquals(JumpKind.FAKE_RETURN, last.getKind());
    assertEquals(new Address(MAIN, 1, 4), last.getTarget());
    assertEquals(4, successors.size());
  }

  @Test
  public void callOutsideTheProgramTargetsSyntheticEntry() {
    List<Successor> successors = resolver.getSuccessors(new Address(MAIN, 1, 4), block(program, MAIN, 1));

    assertEquals(2, successors.size());
    assertEquals(JumpKind.CALL, successors.get(0).getKind());
    assertEquals(Address.entryOf(MethodDescriptor.parse("java.io.PrintStream.println(int)")),
        successors.get(0).getTarget());
    assertEquals(JumpKind.FAKE_RETURN, successors.get(1).getKind());
  }

  @Test
  public void gotoStopsTheScan() {
    List<Successor> successors = resolver.getSuccessors(new Address(MAIN, 1, 5), block(program, MAIN, 1));

    assertEquals(1, successors.size());
    assertEquals(JumpKind.BRANCH, successors.get(0).getKind());
    assertEquals(new Address(MAIN, 3, 7), successors.get(0).getTarget());
  }

  @Test
  public void callToSyscallHook() {
    List<Successor> successors = successorsOf(program, MAIN, 2);

    assertEquals(2, successors.size());
    assertEquals(JumpKind.SYSCALL, successors.get(0).getKind());
    assertEquals(JumpKind.FAKE_RETURN, successors.get(1).getKind());
    assertEquals(new Address(MAIN, 3, 7), successors.get(1).getTarget());
  }

  @Test
  public void returnHasNoTarget() {
    List<Successor> successors = successorsOf(program, MAIN, 3);

    assertEquals(1, successors.size());
    assertEquals(JumpKind.RETURN, successors.get(0).getKind());
    assertEquals(8, successors.get(0).getStmtIdx());
    assertNull(successors.get(0).getTarget());
  }

  @Test
  public void callWithoutCandidatesContinuesTheScan() throws Exception {
    Program p = ProgramParser.parse("nocandidates", Arrays.asList(
        ".class interface a.Task",
        ".method public abstract run() void",
        ".end method",
        ".end class",
        ".class a.Main",
        ".method static main() void",
        "  invoke interface a.Task.run() t",
        "  x = 1",
        "  if x goto End",
        "  y = 2",
        "  z = 3",
        "End:",
        "  w = 4",
        "  return",
        ".end method",
        ".end class"));
    MethodDescriptor main = MethodDescriptor.parse("a.Main.main()");

    List<Successor> successors = successorsOf(p, main, 0);

    assertEquals(2, successors.size());
    assertEquals(JumpKind.BRANCH, successors.get(0).getKind());
    assertEquals(2, successors.get(0).getStmtIdx());
    assertEquals(JumpKind.FALLTHROUGH, successors.get(1).getKind());
    assertEquals(new Address(main, 1, 3), successors.get(1).getTarget());
  }

  @Test
  public void assignmentFromCallActsAsCall() throws Exception {
    Program p = ProgramParser.parse("assign", Arrays.asList(
        ".class a.Main",
        ".method static main() void",
        "  x = invoke static a.Main.value() ",
        "  y = x",
        "  return",
        ".end method",
        ".method static value() int",
        "  return 1",
        ".end method",
        ".end class"));
    MethodDescriptor main = MethodDescriptor.parse("a.Main.main()");

    List<Successor> successors = successorsOf(p, main, 0);

    assertEquals(2, successors.size());
    assertEquals(new Successor(JumpKind.CALL, 0, new Address(main, 0, 0),
        Address.entryOf(MethodDescriptor.parse("a.Main.value()"))), successors.get(0));
    assertEquals(new Successor(JumpKind.FAKE_RETURN, 0, new Address(main, 0, 0), new Address(main, 0, 1)),
        successors.get(1));
    assertEquals(1, SuccessorResolver.getNodeSize(new Address(main, 0, 0), block(p, main, 0)));
    assertEquals(2, SuccessorResolver.getNodeSize(new Address(main, 0, 1), block(p, main, 0)));
  }

  @Test
  public void lastBlockOfMethodDoesNotFallThrough() throws Exception {
    Program p = ProgramParser.parse("tail", Arrays.asList(
        ".class a.Main",
        ".method static main() void",
        "  if c goto Tail",
        "  x = 1",
        "Tail:",
        "  y = 2",
        "  z = 3",
        ".end method",
        ".end class"));
    MethodDescriptor main = MethodDescriptor.parse("a.Main.main()");

    assertEquals(1, successorsOf(p, main, 1).size());
    assertTrue(successorsOf(p, main, 2).isEmpty());
  }

  @Test
  public void switchBranchesToEveryCaseAndStops() throws Exception {
    Program p = ProgramParser.parse("switch", Arrays.asList(
        ".class a.Main",
        ".method static m(int) void",
        "  switch i One Two default Other",
        "One:",
        "  x = 1",
        "  return",
        "Two:",
        "  y = 2",
        "  return",
        "Other:",
        "  z = 3",
        "  return",
        ".end method",
        ".end class"));
    MethodDescriptor m = MethodDescriptor.parse("a.Main.m(int)");
    Address start = new Address(m, 0, 0);

    List<Successor> successors = successorsOf(p, m, 0);

    assertEquals(Arrays.asList(
        new Successor(JumpKind.BRANCH, 0, start, new Address(m, 1, 1)),
        new Successor(JumpKind.BRANCH, 0, start, new Address(m, 2, 3)),
        new Successor(JumpKind.BRANCH, 0, start, new Address(m, 3, 5))), successors);
  }

  @Test
  public void throwEndsTheNodeWithoutSuccessor() throws Exception {
    Program p = ProgramParser.parse("throw", Arrays.asList(
        ".class a.Main",
        ".method static m() void",
        "  if c goto Done",
        "  x = 1",
        "  throw x",
        "  y = 2",
        "Done:",
        "  w = 3",
        "  return",
        ".end method",
        ".end class"));
    MethodDescriptor m = MethodDescriptor.parse("a.Main.m()");

    assertTrue(successorsOf(p, m, 1).isEmpty());
    assertEquals(2, SuccessorResolver.getNodeSize(new Address(m, 1, 1), block(p, m, 1)));

    // The block behind the throw still falls through as usual
    List<Successor> behind = successorsOf(p, m, 2);
    assertEquals(1, behind.size());
    assertEquals(JumpKind.FALLTHROUGH, behind.get(0).getKind());
    assertEquals(new Address(m, 3, 4), behind.get(0).getTarget());
  }

  private List<Successor> successorsOf(Program p, MethodDescriptor method, int blockIdx) {
    BasicBlock bb = block(p, method, blockIdx);
    return newResolver(p).getSuccessors(bb.getAddress(), bb);
  }

  private static BasicBlock block(Program p, MethodDescriptor method, int blockIdx) {
    Method m = p.getMethod(method);
    return m.getBlock(blockIdx);
  }
}
