package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Reads and writes {@link ConverterConfig} as YAML.
 */
public class ConfigStore {
  private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);
  public static final String CONFIG_FILE_NAME = "config.yaml";

  private final File configFile;
  private final ObjectMapper mapper;

  public ConfigStore(File configFolder) {
    this.configFile = new File(configFolder, CONFIG_FILE_NAME);
    this.mapper = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
    mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public File getConfigFile() {
    return configFile;
  }

  /**
   * Loads the config, writing the defaults first if no config file exists yet.
   */
  public ConverterConfig load() throws IOException {
    if (! configFile.exists() || configFile.length() == 0) {
      ConverterConfig defaults = new ConverterConfig();
      save(defaults);
      log.info("Created default config: {}", configFile.getAbsolutePath());

      return defaults;
    }

    return mapper.readValue(configFile, ConverterConfig.class);
  }

  public void save(ConverterConfig config) throws IOException {
    FileUtils.ensureParentExists(configFile);
    mapper.writeValue(configFile, config);
  }
}
