package at.tugraz.iaik.cfgrecovery.analysis;

import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGRecovery;
import at.tugraz.iaik.cfgrecovery.analysis.preprocessing.FileCheckStep;
import at.tugraz.iaik.cfgrecovery.analysis.preprocessing.ParseProgramStep;
import at.tugraz.iaik.cfgrecovery.application.Program;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigHandler;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigKeys;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stringtemplate.v4.ST;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Analysis {
  private static final Logger LOGGER = LoggerFactory.getLogger(Analysis.class);

  private final List<Step> preprocessingSteps = buildPreprocessingSteps();
  private final List<Step> analysisSteps = buildAnalysisSteps();

  private final File programFile;
  private final String programName;
  private Program program = null;
  private CFGRecovery cfgRecovery = null;
  private final List<AnalysisException> criticalExceptions = new ArrayList<>();
  private final List<AnalysisException> nonCriticalExceptions = new ArrayList<>();
  private final AnalysisReport report = new AnalysisReport();
  private final Map<String, Long> stepDurations = new LinkedHashMap<>();

  public Analysis(File programFile) {
    this.programFile = programFile;
    this.programName = FilenameUtils.getBaseName(programFile.getName());
  }

  private static List<Step> buildPreprocessingSteps() {
    List<Step> processingSteps = new ArrayList<>();
    processingSteps.add(new FileCheckStep(true));
    processingSteps.add(new ParseProgramStep(true));

    return processingSteps;
  }

  private static List<Step> buildAnalysisSteps() {
    ConfigHandler conf = ConfigHandler.getInstance();

    List<Step> analysisSteps = new ArrayList<>();
    analysisSteps.add(new CFGRecoveryStep(true));
    analysisSteps.add(new FunctionReportStep(conf.getBooleanConfigValue(ConfigKeys.ANALYSIS_DO_REPORT)));
    analysisSteps.add(new CFGGraphStep(conf.getBooleanConfigValue(ConfigKeys.ANALYSIS_CFGGRAPH_CREATE)));

    return analysisSteps;
  }

  public void performAnalysis() throws AnalysisException {
    LOGGER.debug("Preparing analysis of program " + programName);
    report.add("program", programName);

    try {
      boolean stepsSkipped = false;
      for (Step step : preprocessingSteps) {
        // Abort all subsequent steps, if one does not return successfully (= true)
        if (!step.process(this)) {
          stepsSkipped = true;
          break;
        }
      }

      if (stepsSkipped) {
        LOGGER.info("Further analysis steps for " + programName + " are skipped.");
      } else {
        for (Step step : analysisSteps) {
          if (!step.process(this))
            break;
        }
      }

    } catch (AnalysisException | RuntimeException e) {
      handleCaughtException(e);
    } finally {
      reportStepDurations();
      try {
        report.writeReport(programName);
      } catch (IOException e) {
        LOGGER.warn("Could not write report for " + programName, e);
        addNonCriticalException(e);
      }
    }

    LOGGER.info("Analysis for program " + programName + " completed");
  }

  private void reportStepDurations() {
    for (Map.Entry<String, Long> step : stepDurations.entrySet()) {
      ST stepReport = report.getTemplate("step");
      stepReport.add("name", step.getKey());
      stepReport.add("millis", step.getValue());
      report.add("steps", stepReport.render());
    }
  }

  private void handleCaughtException(Exception e) {
    LOGGER.error("Analysis for " + programName + " failed!", e);
    this.addCriticalException(e);
  }

  public File getProgramFile() {
    return programFile;
  }

  public String getProgramName() {
    return programName;
  }

  /**
   * @return the parsed program, null before parsing
   */
  public Program getProgram() {
    return program;
  }

  public void setProgram(Program program) {
    this.program = program;
  }

  /**
   * @return the CFG recovery run, null if it did not run
   */
  public CFGRecovery getCfgRecovery() {
    return cfgRecovery;
  }

  public void setCfgRecovery(CFGRecovery cfgRecovery) {
    this.cfgRecovery = cfgRecovery;
  }

  public List<AnalysisException> getCriticalExceptions() {
    return criticalExceptions;
  }

  public void addCriticalException(Exception e) {
    criticalExceptions.add((e instanceof AnalysisException) ? (AnalysisException) e :
        new AnalysisException(e.getMessage(), e));
  }

  public List<AnalysisException> getNonCriticalExceptions() {
    return nonCriticalExceptions;
  }

  public void addNonCriticalException(Exception e) {
    nonCriticalExceptions.add(new AnalysisException(e.getMessage(), e));
  }

  void addStepDuration(String stepName, long millis) {
    stepDurations.put(stepName, millis);
  }

  /**
   * @return the run time of every processed step in milliseconds, in processing order
   */
  public Map<String, Long> getStepDurations() {
    return Collections.unmodifiableMap(stepDurations);
  }

  public AnalysisReport getReport() {
    return report;
  }
}
