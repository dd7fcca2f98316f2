package me.bechberger.logveil;

/**
 * Built-in redaction profiles, shipped as {@code /presets/<name>.yaml}.
 */
public enum Preset {
    /**
     * Default preset - secrets, credentials and personal data in any log
     */
    DEFAULT("default", "Secrets, credentials and personal data in any log (recommended)"),

    NGINX("nginx", "nginx access and error logs"),

    DOCKER("docker", "Docker and container logs, including env and label secrets"),

    CLOUDTRAIL("cloudtrail", "AWS CloudTrail events (access keys, account ids, source IPs)"),

    APPLICATION("application", "Web application logs (sessions, CSRF tokens, emails)");

    /** Pseudo profile name that picks a preset per file by its filename patterns */
    public static final String AUTO = "auto";

    private final String name;
    private final String description;

    Preset(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resource path of the preset's YAML definition.
     */
    public String getResourcePath() {
        return "/presets/" + name + ".yaml";
    }

    /**
     * Get preset by name (case-insensitive)
     *
     * @param name The preset name
     * @return The preset, or null if not found
     */
    public static Preset fromName(String name) {
        if (name == null) {
            return null;
        }
        for (Preset preset : values()) {
            if (preset.name.equalsIgnoreCase(name)) {
                return preset;
            }
        }
        return null;
    }

    /**
     * Comma-separated list of all preset names, for messages.
     */
    public static String names() {
        StringBuilder sb = new StringBuilder();
        for (Preset preset : values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(preset.name);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name;
    }
}
