package at.tugraz.iaik.cfgrecovery.analysis.cfg;

public enum JumpKind {
  FALLTHROUGH("fallthrough"),
  BRANCH("branch"),
  CALL("call"),
  SYSCALL("syscall"),
  RETURN("return"),
  /**
   * Continuation after a call site, leading to the statement following the call.
   */
  FAKE_RETURN("fake-return"),
  /**
   * A call whose target could not be lifted. Only used for function transitions.
   */
  UNRESOLVED_EXTERNAL_CALL("unresolved-external-call");

  private final String label;

  JumpKind(String label) {
    this.label = label;
  }

  public boolean isCall() {
    return this == CALL || this == SYSCALL || this == UNRESOLVED_EXTERNAL_CALL;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
