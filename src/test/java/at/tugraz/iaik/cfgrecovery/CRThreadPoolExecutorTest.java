package at.tugraz.iaik.cfgrecovery;

import at.tugraz.iaik.cfgrecovery.utils.config.ConfigHandler;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigKeys;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class CRThreadPoolExecutorTest {
  private static final List<ConfigKeys> CHANGED_KEYS = Arrays.asList(ConfigKeys.ANALYSIS_DO_REPORT,
      ConfigKeys.ANALYSIS_CFGGRAPH_CREATE, ConfigKeys.CFG_MAX_ITERATIONS);

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final Map<ConfigKeys, String> previousValues = new EnumMap<>(ConfigKeys.class);

  @Before
  public void setUp() {
    ConfigHandler conf = ConfigHandler.getInstance();
    for (ConfigKeys key : CHANGED_KEYS)
      previousValues.put(key, conf.getConfigValue(key));

    conf.setConfigValue(ConfigKeys.ANALYSIS_DO_REPORT, "false");
    conf.setConfigValue(ConfigKeys.ANALYSIS_CFGGRAPH_CREATE, "false");
  }

  @After
  public void tearDown() {
    ConfigHandler conf = ConfigHandler.getInstance();
    for (Map.Entry<ConfigKeys, String> entry : previousValues.entrySet())
      conf.setConfigValue(entry.getKey(), entry.getValue());
  }

  private File shapes() throws Exception {
    File target = new File(folder.getRoot(), "shapes.jir");
    FileUtils.copyFile(new File(getClass().getResource("/programs/shapes.jir").toURI()), target);
    return target;
  }

  private File listing(String name, String... lines) throws Exception {
    File file = folder.newFile(name);
    FileUtils.writeLines(file, StandardCharsets.UTF_8.name(), Arrays.asList(lines));
    return file;
  }

  private static CRThreadPoolExecutor runAll(List<File> programs) throws InterruptedException {
    CRThreadPoolExecutor executor = new CRThreadPoolExecutor(programs, 2, 2, 5, TimeUnit.SECONDS);
    executor.shutdown();
    assertTrue(executor.awaitTermination(1, TimeUnit.MINUTES));
    executor.printStats();
    return executor;
  }

  @Test
  public void sumsUpRecoveredGraphs() throws Exception {
    File noEntry = listing("noentry.jir",
        ".entry a.Missing.main()",
        ".class a.B",
        ".method static m() void",
        "  return",
        ".end method",
        ".end class");
    File broken = listing("broken.jir",
        ".class a.B",
        ".method m() void",
        "  goto Nowhere",
        ".end method",
        ".end class");

    CRThreadPoolExecutor executor = runAll(Arrays.asList(shapes(), noEntry, broken));

    assertEquals(1, executor.getRecoveredCount());
    assertEquals(2, executor.getFailedCount());
    assertEquals(1, executor.getWithoutEntryCount());
    assertEquals(11, executor.getNodeCount());
    assertEquals(6, executor.getFunctionCount());
    assertEquals(1, executor.getUnavailableBlockCount());
    assertEquals(0, executor.getBudgetExhaustedCount());
  }

  @Test
  public void countsRunsCutShortByTheBudget() throws Exception {
    ConfigHandler.getInstance().setConfigValue(ConfigKeys.CFG_MAX_ITERATIONS, "3");

    CRThreadPoolExecutor executor = runAll(Arrays.asList(shapes()));

    assertEquals(1, executor.getRecoveredCount());
    assertEquals(1, executor.getBudgetExhaustedCount());
    assertEquals(0, executor.getFailedCount());
    assertTrue(executor.getNodeCount() <= 3);
  }
}
