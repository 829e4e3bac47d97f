package com.frontline.core.infrastructure;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * External configuration.
 * Reads 'frontline.properties' from the server root, falling back to the copy on
 * the classpath, so tuning values can change without a rebuild.
 */
public class CoreConfig {

    public static final String FILE_NAME = "frontline.properties";

    private final Properties props;

    private CoreConfig(Properties props) {
        this.props = props;
    }

    public static CoreConfig load() {
        return load(Path.of(FILE_NAME));
    }

    public static CoreConfig load(Path path) {
        Properties props = new Properties();

        if (path != null && Files.isRegularFile(path)) {
            try (FileInputStream in = new FileInputStream(path.toFile())) {
                props.load(in);
                System.out.println("[CONFIG] Loaded " + path.toAbsolutePath());
                return new CoreConfig(props);
            } catch (IOException e) {
                System.err.println("[CONFIG] Cannot read " + path + ": " + e.getMessage());
            }
        }

        try (InputStream in = CoreConfig.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                props.load(in);
                System.out.println("[CONFIG] Loaded classpath " + FILE_NAME);
            } else {
                System.out.println("[CONFIG] " + FILE_NAME + " not found. Using DEFAULT values.");
            }
        } catch (IOException e) {
            System.out.println("[CONFIG] " + FILE_NAME + " unreadable. Using DEFAULT values.");
        }
        return new CoreConfig(props);
    }

    public static CoreConfig fromProperties(Properties props) {
        Properties copy = new Properties();
        if (props != null) copy.putAll(props);
        return new CoreConfig(copy);
    }

    public static CoreConfig empty() {
        return new CoreConfig(new Properties());
    }

    public String getString(String key, String defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        return val.trim();
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("[CONFIG] Bad value for " + key + ": " + val + " is not an integer.");
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("[CONFIG] Bad value for " + key + ": " + val + " is not an integer.");
            return defaultValue;
        }
    }

    public Long getOptionalLong(String key) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return null;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("[CONFIG] Bad value for " + key + ": " + val + " is not an integer.");
            return null;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            double d = Double.parseDouble(val.trim());
            if (Double.isNaN(d) || Double.isInfinite(d)) return defaultValue;
            return d;
        } catch (NumberFormatException e) {
            System.err.println("[CONFIG] Bad value for " + key + ": " + val + " is not a number.");
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        return Boolean.parseBoolean(val.trim());
    }
}
