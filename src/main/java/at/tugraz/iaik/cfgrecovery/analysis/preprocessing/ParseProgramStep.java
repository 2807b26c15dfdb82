package at.tugraz.iaik.cfgrecovery.analysis.preprocessing;

import at.tugraz.iaik.cfgrecovery.analysis.Analysis;
import at.tugraz.iaik.cfgrecovery.analysis.AnalysisException;
import at.tugraz.iaik.cfgrecovery.analysis.Step;
import at.tugraz.iaik.cfgrecovery.application.Program;
import at.tugraz.iaik.cfgrecovery.application.ProgramParser;
import at.tugraz.iaik.cfgrecovery.application.ProgramSyntaxException;

import java.io.IOException;

// Parses the .jir listing into an object-model
public class ParseProgramStep extends Step {
  public ParseProgramStep(boolean enabled) {
    this.name = "Parse program";
    this.enabled = enabled;
  }

  @Override
  public boolean doProcessing(Analysis analysis) throws AnalysisException {
    Program program;
    try {
      program = ProgramParser.parse(analysis.getProgramFile());
    } catch (IOException e) {
      throw new AnalysisException("Could not read " + analysis.getProgramFile(), e);
    } catch (ProgramSyntaxException e) {
      throw new AnalysisException("Parsing error in " + analysis.getProgramFile().getName() + ": " + e.getMessage(), e);
    }

    LOGGER.info("Parsed " + program.getAllClasses().size() + " classes, " + program.getMethodCount() +
        " methods and " + program.getHooks().size() + " hooks");
    analysis.setProgram(program);

    return true;
  }
}
