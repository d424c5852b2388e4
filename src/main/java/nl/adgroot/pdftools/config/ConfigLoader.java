package nl.adgroot.pdftools.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigLoader {

  /** Classpath resource holding the bundled defaults. */
  public static final String DEFAULT_RESOURCE = "/pdf-sheet-tools.json";

  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private ConfigLoader() {
    // utility class
  }

  static AppConfig load(Path configPath) throws IOException {
    try (InputStream in = Files.newInputStream(configPath)) {
      return normalize(MAPPER.readValue(in, AppConfig.class));
    }
  }

  /**
   * Reads the bundled defaults. Falls back to the compiled-in values of {@link AppConfig} when the
   * resource is missing from the classpath.
   */
  public static AppConfig loadDefaults() {
    try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        log.debug("{} not on classpath, using built-in defaults", DEFAULT_RESOURCE);
        return new AppConfig();
      }
      return normalize(MAPPER.readValue(in, AppConfig.class));
    } catch (IOException e) {
      throw new IllegalStateException("Could not read " + DEFAULT_RESOURCE, e);
    }
  }

  // sections missing from the JSON come back as null
  private static AppConfig normalize(AppConfig cfg) {
    if (cfg.impose == null) cfg.impose = new AppConfig.ImposeConfig();
    if (cfg.merge == null) cfg.merge = new AppConfig.MergeConfig();
    return cfg;
  }
}
