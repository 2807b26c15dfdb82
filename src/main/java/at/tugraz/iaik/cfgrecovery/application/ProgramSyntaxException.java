package at.tugraz.iaik.cfgrecovery.application;

public class ProgramSyntaxException extends Exception {
  private static final long serialVersionUID = 4177630196018203731L;

  private final int lineNr;

  public ProgramSyntaxException(String message, int lineNr) {
    super("line " + lineNr + ": " + message);
    this.lineNr = lineNr;
  }

  public int getLineNr() {
    return lineNr;
  }
}
