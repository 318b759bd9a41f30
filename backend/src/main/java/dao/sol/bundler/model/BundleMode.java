package dao.sol.bundler.model;

import dao.sol.bundler.exception.ConfigurationException;

import java.util.Locale;

public enum BundleMode {
    SINGLE("single"),
    BATCH("batch"),
    ALL_IN_ONE("all-in-one");

    private final String value;

    BundleMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static BundleMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Bundle mode is required. Must be 'single', 'batch', or 'all-in-one'");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (BundleMode m : values()) {
            if (m.value.equals(v) || m.name().equalsIgnoreCase(v)) return m;
        }
        throw new ConfigurationException("Invalid bundle mode: " + value + ". Must be 'single', 'batch', or 'all-in-one'");
    }
}
