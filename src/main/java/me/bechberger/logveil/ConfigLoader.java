package me.bechberger.logveil;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import me.bechberger.logveil.config.ProfileConfig;
import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.util.GlobMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads and resolves profile configurations with parent inheritance support.
 *
 * Supports:
 * - Loading from preset names (default, nginx, docker, cloudtrail, application)
 * - Loading from YAML or JSON files
 * - Resolving parent profiles recursively
 * - Preventing circular dependencies
 * - Choosing a preset for a file by the presets' filename patterns
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final Map<String, ProfileConfig> loadedConfigs = new HashMap<>();
    private final Set<String> loadingStack = new LinkedHashSet<>();

    /**
     * Load a profile configuration from a preset name or file path.
     * Resolves parent configurations recursively.
     *
     * @param source Preset name or file path; {@code none} gives an empty profile
     * @return Fully resolved configuration
     * @throws ConfigurationException if the configuration cannot be read or is invalid
     */
    public ProfileConfig load(String source) throws IOException {
        if (source == null || source.equals("none")) {
            logger.debug("Loading empty profile (no parent)");
            return new ProfileConfig();
        }

        logger.debug("Loading profile from: {}", source);

        if (loadedConfigs.containsKey(source)) {
            logger.debug("Using cached profile for: {}", source);
            return loadedConfigs.get(source);
        }

        if (loadingStack.contains(source)) {
            String chain = String.join(" -> ", loadingStack);
            throw new ConfigurationException(
                "Circular dependency detected in profile inheritance.\n" +
                "Loading chain: " + chain + " -> " + source + "\n" +
                "Please check your 'parent' fields to ensure no circular references."
            );
        }

        loadingStack.add(source);
        try {
            ProfileConfig config = loadRaw(source);

            String parent = config.getParent();
            if (parent != null && !parent.equals("none")) {
                logger.debug("Resolving parent profile: {}", parent);
                try {
                    config.mergeWith(load(parent));
                } catch (IOException e) {
                    if (e instanceof ConfigurationException && e.getMessage().startsWith("Circular dependency")) {
                        throw e;
                    }
                    throw new ConfigurationException(
                        "Failed to load parent profile: " + parent + "\n" +
                        "Referenced from: " + source + "\n" +
                        "Error: " + e.getMessage(),
                        e
                    );
                }
            }

            loadedConfigs.put(source, config);
            logger.debug("Successfully loaded profile from: {}", source);
            return config;
        } finally {
            loadingStack.remove(source);
        }
    }

    /**
     * Load, apply command line overrides and compile a profile.
     *
     * @param source     Preset name or file path
     * @param cliOptions Overrides, may be null
     */
    public Profile loadProfile(String source, ProfileConfig.CliOptions cliOptions) throws IOException {
        ProfileConfig config = load(source);
        // The override mutates the config, so it must not stay in the cache
        loadedConfigs.remove(source);
        config.applyCliOptions(cliOptions);
        if (config.getName() == null) {
            config.setName(source);
        }
        Profile profile = Profile.compile(config);
        logger.info("Loaded profile '{}': {} pattern rules ({} enabled), {} key paths, entropy {}",
            profile.getName(), profile.getRules().size(), profile.getRules().enabledCount(),
            profile.getKeyPaths().getRules().size(), profile.getEntropy().isEnabled() ? "on" : "off");
        return profile;
    }

    /**
     * Pick the first preset whose filename patterns match the file name, {@link Preset#DEFAULT} otherwise.
     */
    public Preset selectPreset(Path file) throws IOException {
        String fileName = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        for (Preset preset : Preset.values()) {
            if (preset == Preset.DEFAULT) {
                continue;
            }
            List<String> globs = loadPreset(preset).getFilenamePatterns();
            if (GlobMatcher.matches(fileName, globs)) {
                logger.debug("Selected preset '{}' for {}", preset.getName(), fileName);
                return preset;
            }
        }
        return Preset.DEFAULT;
    }

    private ProfileConfig loadRaw(String source) throws IOException {
        Preset preset = Preset.fromName(source);
        if (preset != null) {
            return loadPreset(preset);
        }
        return loadFromFile(new File(source));
    }

    private ProfileConfig loadPreset(Preset preset) throws IOException {
        String presetPath = preset.getResourcePath();
        logger.debug("Loading preset from resource: {}", presetPath);

        try (InputStream is = getClass().getResourceAsStream(presetPath)) {
            if (is == null) {
                throw new ConfigurationException(
                    "Preset not found: " + preset.getName() + "\n" +
                    "Available presets: " + Preset.names() + "\n" +
                    "Please check the preset name or create a custom profile file."
                );
            }
            return yamlMapper.readValue(is, ProfileConfig.class);
        } catch (UnrecognizedPropertyException e) {
            throw new ConfigurationException(
                "Invalid property in preset '" + preset.getName() + "': " + e.getPropertyName() + "\n" +
                "This is likely a bug in the preset definition. Please report this issue."
            );
        } catch (IOException e) {
            if (e instanceof ConfigurationException) {
                throw e;
            }
            throw new ConfigurationException(
                "Failed to parse preset: " + preset.getName() + "\n" +
                "Error: " + e.getMessage(),
                e
            );
        }
    }

    private ProfileConfig loadFromFile(File file) throws IOException {
        logger.debug("Loading profile from file: {}", file.getAbsolutePath());

        if (!file.exists()) {
            throw new ConfigurationException(
                "Profile file not found: " + file.getAbsolutePath() + "\n" +
                "Please check the file path, or use one of the presets: " + Preset.names() + "\n" +
                "You can create a profile with: logveil generate-config -o my-profile.yaml"
            );
        }

        if (!file.canRead()) {
            throw new ConfigurationException(
                "Profile file is not readable: " + file.getAbsolutePath() + "\n" +
                "Please check file permissions."
            );
        }

        if (file.length() == 0) {
            throw new ConfigurationException(
                "Profile file is empty: " + file.getAbsolutePath() + "\n" +
                "Please add profile content or use a preset instead."
            );
        }

        try {
            ProfileConfig config = yamlMapper.readValue(file, ProfileConfig.class);
            if (config == null) {
                throw new ConfigurationException(
                    "Profile file contains no profile: " + file.getAbsolutePath()
                );
            }
            return config;
        } catch (UnrecognizedPropertyException e) {
            String nearbyText = extractNearbyText(file, e.getLocation().getLineNr());
            throw new ConfigurationException(
                "Invalid profile property in file: " + file.getAbsolutePath() + "\n" +
                "Unknown property: '" + e.getPropertyName() + "' at line " + e.getLocation().getLineNr() + "\n" +
                nearbyText +
                "Please run 'logveil generate-schema' for valid properties and check for typos."
            );
        } catch (InvalidFormatException e) {
            throw new ConfigurationException(
                "Invalid value in profile file: " + file.getAbsolutePath() + "\n" +
                "Value '" + e.getValue() + "' at line " + e.getLocation().getLineNr() +
                " is not a valid " + e.getTargetType().getSimpleName() + "\n" +
                extractNearbyText(file, e.getLocation().getLineNr()),
                e
            );
        } catch (JsonParseException e) {
            throw new ConfigurationException(
                "YAML syntax error in file: " + file.getAbsolutePath() + "\n" +
                "Line " + e.getLocation().getLineNr() + ", column " + e.getLocation().getColumnNr() + "\n" +
                "Error: " + e.getOriginalMessage() + "\n" +
                "Common issues:\n" +
                "  - Incorrect indentation (YAML requires consistent spacing)\n" +
                "  - Missing colon after property name\n" +
                "  - Backslashes in double-quoted patterns (use single quotes for regexes)\n" +
                "  - Tabs instead of spaces (use spaces for indentation)"
            );
        } catch (MismatchedInputException e) {
            throw new ConfigurationException(
                "Unexpected structure in profile file: " + file.getAbsolutePath() + "\n" +
                "Error: " + e.getOriginalMessage() + "\n" +
                "Please check that 'patterns' and 'key_paths' are lists and 'entropy' is a mapping.",
                e
            );
        } catch (IOException e) {
            if (e instanceof ConfigurationException) {
                throw e;
            }
            throw new ConfigurationException(
                "Failed to load profile from file: " + file.getAbsolutePath() + "\n" +
                "Error: " + e.getMessage(),
                e
            );
        }
    }

    /**
     * Extract nearby text from file for better error context.
     */
    private String extractNearbyText(File file, int errorLine) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file.toPath());
        } catch (IOException e) {
            logger.debug("Could not read {} for error context: {}", file, e.getMessage());
            return "";
        }
        if (errorLine <= 0 || errorLine > lines.size()) {
            return "";
        }
        int start = Math.max(0, errorLine - 3);
        int end = Math.min(lines.size(), errorLine + 2);
        StringBuilder context = new StringBuilder("\nNear line " + errorLine + ":\n");
        for (int i = start; i < end; i++) {
            String prefix = (i == errorLine - 1) ? ">>> " : "    ";
            context.append(String.format("%s%4d: %s%n", prefix, i + 1, lines.get(i)));
        }
        return context.toString();
    }

    /**
     * Custom exception for configuration errors with helpful messages.
     */
    public static class ConfigurationException extends IOException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Clear the loaded configuration cache.
     */
    public void clearCache() {
        loadedConfigs.clear();
        loadingStack.clear();
    }

    /**
     * Load raw YAML string from a preset or file.
     * Useful for generating configuration templates.
     *
     * @param source Preset name or file path
     * @return Raw YAML string
     */
    public String loadRawYaml(String source) throws IOException {
        Preset preset = Preset.fromName(source);
        if (preset != null) {
            try (InputStream is = getClass().getResourceAsStream(preset.getResourcePath())) {
                if (is == null) {
                    throw new ConfigurationException("Preset not found: " + preset.getName());
                }
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        File file = new File(source);
        if (!file.exists()) {
            throw new ConfigurationException("File not found: " + file.getAbsolutePath());
        }
        return Files.readString(file.toPath());
    }

    /**
     * Names of all presets with their number of pattern rules and key paths, in declaration order.
     */
    public List<PresetSummary> summarizePresets() throws IOException {
        List<PresetSummary> summaries = new ArrayList<>();
        for (Preset preset : Preset.values()) {
            ProfileConfig config = load(preset.getName());
            summaries.add(new PresetSummary(preset, config.getPatterns().size(), config.getKeyPaths().size(),
                config.getFilenamePatterns()));
        }
        return summaries;
    }

    public record PresetSummary(Preset preset, int patternCount, int keyPathCount, List<String> filenamePatterns) {
    }
}
