package ch.ethz.systems.vialbench.core.config;

import ch.ethz.systems.vialbench.core.config.exceptions.PropertyMissingException;
import ch.ethz.systems.vialbench.core.config.exceptions.PropertyNotExistingException;
import ch.ethz.systems.vialbench.core.config.exceptions.PropertyValueInvalidException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Run configuration: a properties file plus any {@code key=value} overrides
 * given on the command line. Typed accessors either fail on a missing key or
 * fall back to a default.
 */
public class VBProperties extends Properties {

    private static final long serialVersionUID = 1L;

    private final String sourceName;

    public VBProperties(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Load properties from a file.
     *
     * @param path  Properties file
     *
     * @return Loaded properties
     *
     * @throws IOException  If the file cannot be read
     */
    public static VBProperties fromFile(Path path) throws IOException {
        VBProperties properties = new VBProperties(path.toString());
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return properties;
    }

    /**
     * Apply overrides of the form {@code key=value}.
     *
     * @param overrides     Override arguments
     */
    public void applyOverrides(String[] overrides) {
        for (String override : overrides) {
            int split = override.indexOf('=');
            if (split <= 0) {
                throw new IllegalArgumentException("Override must be of the form key=value: " + override);
            }
            setProperty(override.substring(0, split).trim(), override.substring(split + 1).trim());
        }
    }

    /**
     * Check that every key set is either a base property or a per-person key of
     * a person listed under {@code people}.
     *
     * @throws PropertyNotExistingException     On the first unknown key
     */
    public void validate() {
        Set<String> allowed = new HashSet<>();
        allowed.addAll(Arrays.asList(BaseAllowedProperties.LOG));
        allowed.addAll(Arrays.asList(BaseAllowedProperties.PROPERTIES_RUN));
        if (containsKey("people")) {
            for (String person : getListProperty("people")) {
                for (String suffix : BaseAllowedProperties.PERSON_SUFFIXES) {
                    allowed.add(BaseAllowedProperties.PERSON_PREFIX + person + suffix);
                }
            }
        }
        for (String key : new TreeSet<>(stringPropertyNames())) {
            if (!allowed.contains(key)) {
                throw new PropertyNotExistingException(key);
            }
        }
    }

    public String getSourceName() {
        return sourceName;
    }

    // =========================================================================
    // STRING
    // =========================================================================

    public String getPropertyOrFail(String key) {
        String value = getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new PropertyMissingException(key);
        }
        return value.trim();
    }

    public String getPropertyWithDefault(String key, String defaultValue) {
        String value = getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * Comma separated list; blank entries are dropped.
     */
    public List<String> getListProperty(String key) {
        List<String> result = new ArrayList<>();
        for (String part : getPropertyOrFail(key).split(",")) {
            if (!part.trim().isEmpty()) {
                result.add(part.trim());
            }
        }
        return result;
    }

    // =========================================================================
    // NUMERIC
    // =========================================================================

    public int getIntegerPropertyOrFail(String key) {
        return parseInteger(key, getPropertyOrFail(key));
    }

    public int getIntegerPropertyWithDefault(String key, int defaultValue) {
        String value = getPropertyWithDefault(key, null);
        return value == null ? defaultValue : parseInteger(key, value);
    }

    public double getDoublePropertyOrFail(String key) {
        return parseDouble(key, getPropertyOrFail(key));
    }

    public double getDoublePropertyWithDefault(String key, double defaultValue) {
        String value = getPropertyWithDefault(key, null);
        return value == null ? defaultValue : parseDouble(key, value);
    }

    public int[] getIntegerListPropertyOrFail(String key) {
        List<String> parts = getListProperty(key);
        int[] result = new int[parts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = parseInteger(key, parts.get(i));
        }
        return result;
    }

    public boolean getBooleanPropertyWithDefault(String key, boolean defaultValue) {
        String value = getPropertyWithDefault(key, null);
        if (value == null) {
            return defaultValue;
        }
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new PropertyValueInvalidException(key, value, "expected true or false");
    }

    /**
     * @return All properties as sorted {@code key=value} lines, for logging the run setup
     */
    public String getAllPropertiesToString() {
        StringBuilder builder = new StringBuilder();
        builder.append("# Loaded from ").append(sourceName).append('\n');
        for (String key : new TreeSet<>(stringPropertyNames())) {
            builder.append(key).append('=').append(getProperty(key)).append('\n');
        }
        return builder.toString();
    }

    private static int parseInteger(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new PropertyValueInvalidException(key, value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new PropertyValueInvalidException(key, value, e);
        }
    }

}
