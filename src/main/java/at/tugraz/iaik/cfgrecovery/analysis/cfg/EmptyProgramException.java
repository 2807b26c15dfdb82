package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.analysis.AnalysisException;

public class EmptyProgramException extends AnalysisException {
  private static final long serialVersionUID = -2548301797346312297L;

  public EmptyProgramException(String message) {
    super(message);
  }
}
