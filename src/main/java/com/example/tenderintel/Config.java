package com.example.tenderintel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final Properties properties = new Properties();
    private static final String CONFIG_FILE = "application.properties";

    static {
        try (InputStream is = Config.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is == null) {
                throw new IOException("Resource not found: " + CONFIG_FILE);
            }
            properties.load(is);
        } catch (IOException e) {
            logger.error("Error loading config, falling back to defaults: {}", e.getMessage());
        }
    }

    public static boolean getParserVerbose() {
        return Boolean.parseBoolean(properties.getProperty("parser.verbose", "false"));
    }

    public static int getBufferDays() {
        return getInt("deadline.bufferDays", 2);
    }

    public static int getContextWindowBefore() {
        return getInt("deadline.contextWindowBefore", 50);
    }

    public static int getContextWindowAfter() {
        return getInt("deadline.contextWindowAfter", 100);
    }

    public static int getSpecificationMinLength() {
        return getInt("specification.minLength", 5);
    }

    public static int getProjectNameMaxLength() {
        return getInt("project.nameMaxLength", 100);
    }

    private static int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }
}
