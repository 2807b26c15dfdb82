package at.tugraz.iaik.cfgrecovery.analysis;

import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGRecovery;
import at.tugraz.iaik.cfgrecovery.analysis.functions.Function;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import org.stringtemplate.v4.ST;

// Adds the recovered function table to the report
public class FunctionReportStep extends Step {
  public FunctionReportStep(boolean enabled) {
    this.name = "Function Report";
    this.enabled = enabled;
  }

  @Override
  protected boolean isApplicable(Analysis analysis) {
    return analysis.getCfgRecovery() != null && analysis.getCfgRecovery().isCompleted();
  }

  @Override
  public boolean doProcessing(Analysis analysis) throws AnalysisException {
    CFGRecovery cfg = analysis.getCfgRecovery();

    ST functionsReport = analysis.getReport().getTemplate("functions");
    functionsReport.add("count", cfg.getFunctions().size());

    for (Function function : cfg.getFunctions()) {
      ST functionReport = analysis.getReport().getTemplate("function");
      functionReport.add("entry", function.getAddress().toString());
      functionReport.add("name", function.getName());
      functionReport.add("returning", function.getReturning().name());
      functionReport.add("blocks", function.getNodes().size());
      functionReport.add("orphan", function.isOrphan());

      for (Address target : function.getCallTargets())
        functionReport.add("callTargets", target.toString());

      functionsReport.add("functions", functionReport.render());
    }

    analysis.getReport().add("functions", functionsReport.render());

    return true;
  }
}
