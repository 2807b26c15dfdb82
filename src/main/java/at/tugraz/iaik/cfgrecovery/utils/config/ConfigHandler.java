package at.tugraz.iaik.cfgrecovery.utils.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.Properties;

public class ConfigHandler {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigHandler.class);
  private static final String CONFIG_RESOURCE = "cfgrecovery.conf";
  private final Properties settings = new Properties();

  private static class ConfigHandlerHolder {
    private static final ConfigHandler INSTANCE = new ConfigHandler();
  }

  public static ConfigHandler getInstance() {
    return ConfigHandlerHolder.INSTANCE;
  }

  private ConfigHandler() {
    try {
      readFromFile();
      validate();
    } catch (Exception e) {
      LOGGER.error(e.getMessage());
    }
  }

  private void readFromFile() throws IOException {
    // Assume that the configuration is in the local directory
    setConfigValue(ConfigKeys.DIRECTORY_HOME, System.getProperty("user.dir"));
    File configFile = new File(getConfigValue(ConfigKeys.DIRECTORY_HOME) + File.separator + "conf" +
        File.separator + CONFIG_RESOURCE);

    if (configFile.isFile()) {
      try (FileInputStream fis = new FileInputStream(configFile)) {
        LOGGER.info("Loading configuration from " + configFile);
        settings.load(fis);
      }
      return;
    }

    // Otherwise fall back to the bundled defaults
    try (InputStream is = ConfigHandler.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
      if (is == null) {
        LOGGER.warn("No configuration found, using built-in defaults.");
        return;
      }

      LOGGER.debug("Loading bundled configuration " + CONFIG_RESOURCE);
      settings.load(is);
    }
  }

  private void validate() {
    boolean foundErrors = false;

    // Check all configuration file directives
    HashSet<Object> keysInConfigFile = new HashSet<Object>(settings.keySet());
    for (Object keyInConfigFile : keysInConfigFile) {
      String entry = (String) keyInConfigFile;
      try {
        // Check all directory listings for existance
        if (entry.startsWith("directory.") && !entry.equals(ConfigKeys.DIRECTORY_HOME.toString())) {
          File f = new File(settings.getProperty(entry));
          if (f.exists() && (!f.isDirectory() || !f.canRead())) {
            LOGGER.error(entry + "=" + settings.getProperty(entry) + ": Not a readable directory!");
            foundErrors = true;
          }
        }
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Problem validating config: " + e.getMessage());
      }
    }

    if (foundErrors) {
      throw new RuntimeException("Found errors in the configuration. Aborting.");
    }
  }

  public String getConfigValue(ConfigKeys key) {
    return this.getConfigValue(key, key.getDefaultString());
  }

  public String getConfigValue(ConfigKeys key, String defaultValue) {
    return settings.getProperty(key.toString(), defaultValue);
  }

  public void setConfigValue(ConfigKeys key, String value) {
    settings.setProperty(key.toString(), String.valueOf(value));
  }

  public int getIntConfigValue(ConfigKeys key) {
    return this.getIntConfigValue(key, key.getDefaultInteger());
  }

  public int getIntConfigValue(ConfigKeys key, int defaultValue) {
    String r = settings.getProperty(key.toString());
    if (r != null)
      return Integer.parseInt(r.trim());

    return defaultValue;
  }

  public boolean getBooleanConfigValue(ConfigKeys key) {
    return this.getBooleanConfigValue(key, key.getDefaultBoolean());
  }

  public boolean getBooleanConfigValue(ConfigKeys key, boolean defaultValue) {
    String r = settings.getProperty(key.toString());
    if (r != null)
      return Boolean.parseBoolean(r.trim());

    return defaultValue;
  }
}
