package com.pdqhash.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Resolves {@link HasherConfig}:
 * <ol>
 * <li>the JSON file named by the {@code pdq.config} system property</li>
 * <li>the classpath resource {@code /pdq_config.json}</li>
 * <li>built-in defaults</li>
 * </ol>
 * A source that exists but cannot be read is skipped with a warning. Values
 * that are read but out of range fail validation.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_PROPERTY = "pdq.config";
    public static final String CONFIG_RESOURCE = "/pdq_config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static HasherConfig load() {
        // 1. System property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            File file = new File(sysProp);
            try {
                HasherConfig config = MAPPER.readValue(file, HasherConfig.class);
                logger.info("Loaded hasher config from {}", file.getAbsolutePath());
                return config.validate();
            } catch (IOException e) {
                logger.warn("Failed to read config file {}: {}", file.getAbsolutePath(), e.getMessage());
            }
        }

        // 2. Classpath resource
        try (InputStream is = ConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                HasherConfig config = MAPPER.readValue(is, HasherConfig.class);
                logger.debug("Loaded hasher config from classpath {}", CONFIG_RESOURCE);
                return config.validate();
            }
        } catch (IOException e) {
            logger.warn("Failed to read classpath config {}: {}", CONFIG_RESOURCE, e.getMessage());
        }

        // 3. Default
        logger.debug("No hasher config found, using defaults");
        return HasherConfig.defaults();
    }

    public static HasherConfig load(InputStream jsonStream) throws IOException {
        return MAPPER.readValue(jsonStream, HasherConfig.class).validate();
    }
}
