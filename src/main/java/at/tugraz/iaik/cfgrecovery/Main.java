package at.tugraz.iaik.cfgrecovery;

import at.tugraz.iaik.cfgrecovery.application.ProgramParser;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigHandler;
import at.tugraz.iaik.cfgrecovery.utils.config.ConfigKeys;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Collection;
import java.util.LinkedList;
import java.util.concurrent.TimeUnit;

public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);
  private static ConfigHandler conf = null;

  public static void main(String[] args) {
    try {
      conf = ConfigHandler.getInstance();
      prepare();

      // You can specify one listing/directory but you do not have to
      File programPath = null;
      if (args.length == 1)
        programPath = new File(args[0]);
      else if (args.length > 1) {
        System.out.println("Usage: java -jar cfgrecovery.jar [file/directory]");
        System.exit(0);
      }

      // Collect one or multiple .jir files for further analysis
      LinkedList<File> programs = collectPrograms(programPath);
      if (programs.isEmpty()) {
        LOGGER.error("Found no program listings to analyze!");
        System.exit(-1);
      }

      startAnalysis(programs);

    } catch (Exception e) {
      LOGGER.error(e.getMessage(), e);
    }
  }

  static LinkedList<File> collectPrograms(File path) {
    LinkedList<File> programs = new LinkedList<File>();

    // If no path is given, take the configured programs directory
    if (path == null)
      path = new File(conf.getConfigValue(ConfigKeys.DIRECTORY_PROGRAMS));

    if (!path.exists()) {
      LOGGER.error("File or directory does not exist: " + path);
      return programs;
    }

    // Fetch listings recursively
    if (path.isDirectory()) {
      Collection<File> fc = FileUtils.listFiles(path, new String[]{ProgramParser.PROGRAM_FILE_EXTENSION}, true);
      programs = new LinkedList<File>(fc);

      LOGGER.info("Read " + programs.size() + " files from directory: " + path);
    } else if (path.isFile()) {
      programs.add(path);
    }

    return programs;
  }

  private static void prepare() {
    // Create reports folder if reporting is enabled
    if (conf.getBooleanConfigValue(ConfigKeys.ANALYSIS_DO_REPORT) ||
        conf.getBooleanConfigValue(ConfigKeys.ANALYSIS_CFGGRAPH_CREATE)) {
      new File(conf.getConfigValue(ConfigKeys.ANALYSIS_REPORT_FOLDER)).mkdirs();
    }
  }

  private static void startAnalysis(LinkedList<File> programs) {
    // Initialize MultiThreading and queue
    int corePoolSize = Runtime.getRuntime().availableProcessors();
    if (corePoolSize > 1) corePoolSize--;
    int numThreads = conf.getIntConfigValue(ConfigKeys.MULTITHREADING_THREADS, corePoolSize);
    if (!conf.getBooleanConfigValue(ConfigKeys.MULTITHREADING_ENABLED))
      numThreads = 1;

    // Create executor and submit jobs
    CRThreadPoolExecutor executor = new CRThreadPoolExecutor(programs, numThreads, numThreads, 5, TimeUnit.SECONDS);
    executor.allowCoreThreadTimeOut(true);

    // Tell the executor to shutdown afterwards
    executor.shutdown();
    boolean b = true;
    try {
      b = executor.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS); // timeout should not occur
    } catch (InterruptedException e) {
      LOGGER.error("Got interrupted while waiting for analyses to finish, this should not happen.", e);
      Thread.currentThread().interrupt();
    }

    if (!b)
      LOGGER.error("Got a timeout while waiting for analyses to finish, this should not happen.");

    executor.printStats();
  }
}
