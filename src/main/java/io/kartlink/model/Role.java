package io.kartlink.model;

public enum Role {
    VEHICLE("vehicle"),
    REMOTE("remote");

    private final String configName;

    Role(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Role fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return VEHICLE;
        }
        for (Role value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.configName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + raw);
    }
}
