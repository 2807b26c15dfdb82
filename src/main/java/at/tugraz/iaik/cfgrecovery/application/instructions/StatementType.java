package at.tugraz.iaik.cfgrecovery.application.instructions;

public enum StatementType {
  IF,       // conditional two-way jump
  GOTO,     // unconditional jump
  SWITCH,   // multi-way jump with a default target
  INVOKE,   // invocation without assignment
  ASSIGN,   // assignment, possibly with an invocation on the right-hand side
  RETURN,
  THROW,
  PLAIN     // anything that does not transfer control
}
