package at.tugraz.iaik.cfgrecovery.analysis;

import at.tugraz.iaik.cfgrecovery.utils.config.ConfigHandler;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigKeys;
import com.google.common.xml.XmlEscapers;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stringtemplate.v4.AttributeRenderer;
import org.stringtemplate.v4.ST;
import org.stringtemplate.v4.STGroup;
import org.stringtemplate.v4.STGroupFile;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public class AnalysisReport {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisReport.class);

  private final STGroup group;
  private final ST report;

  AnalysisReport() {
    group = new STGroupFile(ConfigHandler.getInstance().getConfigValue(ConfigKeys.ANALYSIS_REPORT_TEMPLATE), '$', '$');
    group.registerRenderer(String.class, new XmlEscapeStringRenderer());
    report = group.getInstanceOf("report");
  }

  public ST getTemplate(String name) {
    return group.getInstanceOf(name);
  }

  public void add(String sectionName, Object sectionContent) {
    report.add(sectionName, sectionContent);
  }

  /**
   * Write the report to {@code <report folder>/<reportFileName>.xml}.
   *
   * @return the written file or null if reporting is disabled
   */
  public File writeReport(String reportFileName) throws IOException {
    if (!ConfigHandler.getInstance().getBooleanConfigValue(ConfigKeys.ANALYSIS_DO_REPORT))
      return null;

    File reportFile = new File(ConfigHandler.getInstance().getConfigValue(ConfigKeys.ANALYSIS_REPORT_FOLDER) +
        File.separator + reportFileName + ".xml");
    FileUtils.writeStringToFile(reportFile, report.render(), StandardCharsets.UTF_8, false);
    LOGGER.debug("Report written to " + reportFile);

    return reportFile;
  }

  @Override
  public String toString() {
    return report.render();
  }

  public static class XmlEscapeStringRenderer implements AttributeRenderer<String> {
    @Override
    public String toString(String value, String formatString, Locale locale) {
      return (formatString == null) ? value : XmlEscapers.xmlAttributeEscaper().escape(value);
    }
  }
}
