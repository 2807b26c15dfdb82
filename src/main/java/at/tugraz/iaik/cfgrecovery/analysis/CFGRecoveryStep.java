package at.tugraz.iaik.cfgrecovery.analysis;

import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGOptions;
import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGRecovery;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigHandler;
import org.stringtemplate.v4.ST;

// Recovers the CFG and the functions of the parsed program
public class CFGRecoveryStep extends Step {
  public CFGRecoveryStep(boolean enabled) {
    this.name = "CFG Recovery";
    this.enabled = enabled;
  }

  @Override
  protected boolean isApplicable(Analysis analysis) {
    return analysis.getProgram() != null;
  }

  @Override
  public boolean doProcessing(Analysis analysis) throws AnalysisException {
    CFGRecovery cfg = new CFGRecovery(analysis.getProgram(), CFGOptions.fromConfig(ConfigHandler.getInstance()));
    analysis.setCfgRecovery(cfg);
    cfg.analyze();

    if (!cfg.getUnavailableBlocks().isEmpty())
      LOGGER.info(cfg.getUnavailableBlocks().size() + " addresses could not be lifted");

    ST cfgReport = analysis.getReport().getTemplate("cfgRecovery");
    cfgReport.addAggr("info.{entry, nodes, edges, functions, iterations, unavailable, budgetExhausted}",
        String.valueOf(cfg.getEntry()), cfg.getGraph().nodeCount(), cfg.getGraph().edgeCount(),
        cfg.getFunctions().size(), cfg.getIterations(), cfg.getUnavailableBlocks().size(), cfg.isBudgetExhausted());
    analysis.getReport().add("cfgRecovery", cfgReport.render());

    return true;
  }
}
