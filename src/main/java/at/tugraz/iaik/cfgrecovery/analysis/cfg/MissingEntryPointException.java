package at.tugraz.iaik.cfgrecovery.analysis.cfg;

import at.tugraz.iaik.cfgrecovery.analysis.AnalysisException;

public class MissingEntryPointException extends AnalysisException {
  private static final long serialVersionUID = 3380615270529014522L;

  public MissingEntryPointException(String message) {
    super(message);
  }
}
