package at.tugraz.iaik.cfgrecovery.analysis.preprocessing;

import at.tugraz.iaik.cfgrecovery.analysis.Analysis;
import at.tugraz.iaik.cfgrecovery.analysis.AnalysisException;
import at.tugraz.iaik.cfgrecovery.analysis.Step;
import at.tugraz.iaik.cfgrecovery.application.ProgramParser;
import org.apache.commons.io.FilenameUtils;

import java.io.File;

// Performs sanity checks on a given file before analysis
public class FileCheckStep extends Step {
  public FileCheckStep(boolean enabled) {
    this.name = "Check program listing";
    this.enabled = enabled;
  }

  @Override
  public boolean doProcessing(Analysis analysis) throws AnalysisException {
    return isProgramListing(analysis.getProgramFile());
  }

  private boolean isProgramListing(File file) {
    if (!file.isFile()) {
      LOGGER.info("Not a file: " + file + ". Aborting.");
      return false;
    }

    if (!file.canRead()) {
      LOGGER.info("File not readable. Aborting.");
      return false;
    }

    if (file.length() == 0) {
      LOGGER.info("File is empty. Aborting.");
      return false;
    }

    if (!FilenameUtils.isExtension(file.getName(), ProgramParser.PROGRAM_FILE_EXTENSION)) {
      LOGGER.info("Not a ." + ProgramParser.PROGRAM_FILE_EXTENSION + " listing: " + file.getName() + ". Aborting.");
      return false;
    }

    return true;
  }
}
