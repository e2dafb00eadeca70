package im.arun.opndossier.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link WalkerConfig} from {@code opndossier.yaml} and merges per-call
 * overrides on top of it.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "opndossier.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final WalkerConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private WalkerConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading walker configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), WalkerConfig.class);
                }
                logger.warn("Config file {} not found, trying classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, WalkerConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new WalkerConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new WalkerConfig();
        }
    }

    public WalkerConfig load() {
        return load(null);
    }

    public WalkerConfig load(Map<String, Object> userOptions) {
        WalkerConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "max_depth":
                case "maxDepth":
                    Integer depth = parseInteger(value);
                    if (depth != null) {
                        config.setMaxDepth(depth);
                    } else {
                        logger.warn("Ignoring non-numeric value for {}: {}", key, value);
                    }
                    break;
                case "root_title":
                case "rootTitle":
                    if (value instanceof String) config.setRootTitle((String) value);
                    break;
                case "marker_text":
                case "markerText":
                    if (value instanceof String) config.setMarkerText((String) value);
                    break;
                case "identity_field":
                case "identityField":
                    if (value instanceof String) config.setIdentityField((String) value);
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        if (config.getMaxDepth() != config.effectiveMaxDepth()) {
            logger.warn("max_depth {} is outside 1..{}, using {}",
                config.getMaxDepth(), WalkerConfig.MAX_HEADING_LEVEL, config.effectiveMaxDepth());
        }

        return config;
    }

    private Integer parseInteger(Object value) {
        if (value instanceof Number) {
            // Out-of-range or fractional numbers are rejected, not truncated
            try {
                return new BigDecimal(value.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                return null;
            }
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private WalkerConfig copyConfig(WalkerConfig source) {
        WalkerConfig copy = new WalkerConfig();
        copy.setMaxDepth(source.getMaxDepth());
        copy.setRootTitle(source.getRootTitle());
        copy.setMarkerText(source.getMarkerText());
        copy.setIdentityField(source.getIdentityField());
        return copy;
    }
}
