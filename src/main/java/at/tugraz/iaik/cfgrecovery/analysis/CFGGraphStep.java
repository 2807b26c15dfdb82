package at.tugraz.iaik.cfgrecovery.analysis;

import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGEdge;
import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGGraph;
import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGNode;
import at.tugraz.iaik.cfgrecovery.analysis.cfg.CFGRecovery;
import at.tugraz.iaik.cfgrecovery.analysis.cfg.JumpKind;
import at.tugraz.iaik.cfgrecovery.analysis.functions.Function;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigHandler;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigKeys;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Export the recovered CFG as Graphviz graph, one cluster per function
public class CFGGraphStep extends Step {
  private static final String DOT_FORMAT = "dot";

  public CFGGraphStep(boolean enabled) {
    this.name = "CFG Graph";
    this.enabled = enabled;
  }

  @Override
  protected boolean isApplicable(Analysis analysis) {
    return analysis.getCfgRecovery() != null && analysis.getCfgRecovery().isCompleted();
  }

  @Override
  public boolean doProcessing(Analysis analysis) throws AnalysisException {
    CFGRecovery cfg = analysis.getCfgRecovery();

    ConfigHandler conf = ConfigHandler.getInstance();
    String outputFormat = conf.getConfigValue(ConfigKeys.ANALYSIS_CFGGRAPH_OUTPUTFORMAT);
    File dotFile = new File(conf.getConfigValue(ConfigKeys.ANALYSIS_REPORT_FOLDER) + File.separator +
        analysis.getProgramName() + "." + DOT_FORMAT);

    try {
      FileUtils.writeStringToFile(dotFile, generateDotGraph(cfg, analysis.getProgramName()), StandardCharsets.UTF_8, false);
      if (DOT_FORMAT.equals(outputFormat))
        return true;

      ProcessBuilder builder = new ProcessBuilder(conf.getConfigValue(ConfigKeys.ANALYSIS_CFGGRAPH_DOTEXECUTABLE),
          "-T" + outputFormat, dotFile.getAbsolutePath(),
          "-o" + dotFile.getParent() + File.separator + analysis.getProgramName() + "." + outputFormat);
      builder.redirectErrorStream(true);
      Process process = builder.start();

      // Drain the output, dot blocks once the pipe is full
      String output = IOUtils.toString(process.getInputStream(), StandardCharsets.UTF_8);
      int exitCode = process.waitFor();
      if (!output.isEmpty())
        LOGGER.debug("dot output for " + dotFile + ": " + output);

      if (exitCode != 0)
        LOGGER.warn("dot exited with code " + exitCode + " for " + dotFile);
      else
        FileUtils.deleteQuietly(dotFile);
    } catch (IOException e) {
      LOGGER.warn("Could not create the CFG graph of " + analysis.getProgramName(), e);
      analysis.addNonCriticalException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      analysis.addNonCriticalException(e);
    }

    return true;
  }

  public static String generateDotGraph(CFGRecovery cfg, String graphLabel) {
    CFGGraph graph = cfg.getGraph();
    StringBuilder dot = new StringBuilder();
    dot.append("digraph G {\n");
    dot.append("compound=true;\n");
    dot.append("label=\"").append(escapeString(graphLabel)).append("\";\n");
    dot.append("node [shape=box];\n");

    int cluster = 0;
    for (Function function : cfg.getFunctions()) {
      dot.append("\tsubgraph \"cluster_").append(cluster++).append("\" {\n");
      dot.append("\tcolor=").append(function.isOrphan() ? "indianred" : "skyblue").append(";\n");
      dot.append("\tlabel=\"").append(escapeString(function.getName())).append("\";\n");
      for (Address node : function.getNodes())
        dot.append("\t\"").append(escapeString(node.toString())).append("\";\n");
      dot.append("\t}\n");
    }

    List<CFGEdge> edges = new ArrayList<>(graph.getEdges());
    Collections.sort(edges);
    for (CFGEdge edge : edges) {
      dot.append("\"").append(escapeString(edge.getSrc().getAddress().toString())).append("\" -> \"")
          .append(escapeString(edge.getDst().getAddress().toString())).append("\" [");
      if (edge.getKind() == JumpKind.CALL || edge.getKind() == JumpKind.SYSCALL)
        dot.append("color=indianred, ");
      else if (edge.getKind() == JumpKind.FAKE_RETURN)
        dot.append("style=dashed, ");
      dot.append("label=\"").append(edge.getKind()).append("\"];\n");
    }

    // Nodes not assigned to any function, e.g. without a partitioning pass
    for (CFGNode node : graph.getNodes()) {
      if (graph.getOutEdges(node).isEmpty() && graph.getInEdges(node).isEmpty() &&
          cfg.getFunctions().get(node.getFunctionAddress()) == null)
        dot.append("\"").append(escapeString(node.getAddress().toString())).append("\";\n");
    }

    dot.append("}\n");
    return dot.toString();
  }

  private static String escapeString(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
