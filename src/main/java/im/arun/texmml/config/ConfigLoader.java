package im.arun.texmml.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link TexMmlConfig} from YAML and merges per-run overrides on top of it.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final TexMmlConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private TexMmlConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), TexMmlConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled config.yaml", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, TexMmlConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new TexMmlConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new TexMmlConfig();
        }
    }

    public TexMmlConfig load() {
        return load(null);
    }

    public TexMmlConfig load(Map<String, Object> userOptions) {
        TexMmlConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "localization":
                        if (value instanceof String) config.setLocalization((String) value);
                        break;
                    case "encoding":
                        if (value instanceof String) config.setEncoding((String) value);
                        break;
                    case "timeout_seconds":
                    case "timeoutSeconds":
                        config.setTimeoutSeconds(parseInt(value, config.getTimeoutSeconds()));
                        break;
                    case "fail_on_missing_import":
                    case "failOnMissingImport":
                        config.setFailOnMissingImport(parseBoolean(value));
                        break;
                    case "fail_on_missing_bibliography":
                    case "failOnMissingBibliography":
                        config.setFailOnMissingBibliography(parseBoolean(value));
                        break;
                    case "max_macro_expansion_depth":
                    case "maxMacroExpansionDepth":
                        config.setMaxMacroExpansionDepth(parseInt(value, config.getMaxMacroExpansionDepth()));
                        break;
                    case "verify_tree":
                    case "verifyTree":
                        config.setVerifyTree(parseBoolean(value));
                        break;
                    case "json_log_enabled":
                    case "jsonLogEnabled":
                        config.setJsonLogEnabled(parseBoolean(value));
                        break;
                    case "log_directory":
                    case "logDirectory":
                        if (value instanceof String) config.setLogDirectory((String) value);
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (RuntimeException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private int parseInt(Object value, int fallback) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            return Integer.parseInt(((String) value).trim());
        }
        return fallback;
    }

    private TexMmlConfig copyConfig(TexMmlConfig source) {
        TexMmlConfig copy = new TexMmlConfig();
        copy.setLocalization(source.getLocalization());
        copy.setEncoding(source.getEncoding());
        copy.setTimeoutSeconds(source.getTimeoutSeconds());
        copy.setFailOnMissingImport(source.isFailOnMissingImport());
        copy.setFailOnMissingBibliography(source.isFailOnMissingBibliography());
        copy.setMaxMacroExpansionDepth(source.getMaxMacroExpansionDepth());
        copy.setVerifyTree(source.isVerifyTree());
        copy.setJsonLogEnabled(source.isJsonLogEnabled());
        copy.setLogDirectory(source.getLogDirectory());
        return copy;
    }
}
