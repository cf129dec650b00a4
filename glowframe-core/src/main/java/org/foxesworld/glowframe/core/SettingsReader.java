package org.foxesworld.glowframe.core;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Typed access to {@code glowframe.*} settings.
 *
 * <p>Values come from system properties by default. A missing or blank value falls back to the
 * supplied default; a present but malformed value is a configuration error and throws
 * {@link IllegalArgumentException} naming the offending property.</p>
 */
public final class SettingsReader {

    private final Function<String, String> lookup;
    private final String prefix;

    private SettingsReader(Function<String, String> lookup, String prefix) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public static SettingsReader system() {
        return new SettingsReader(System::getProperty, GlowframeVersion.PROPERTY_PREFIX);
    }

    public static SettingsReader of(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        return new SettingsReader(properties::getProperty, GlowframeVersion.PROPERTY_PREFIX);
    }

    public static SettingsReader of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(Objects.requireNonNull(values, "values"));
        return new SettingsReader(copy::get, GlowframeVersion.PROPERTY_PREFIX);
    }

    public String key(String name) {
        return prefix + name;
    }

    /** Raw trimmed value, or null when unset or blank. */
    public String raw(String name) {
        String v = lookup.apply(key(name));
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    public String str(String name, String def) {
        String v = raw(name);
        return v != null ? v : def;
    }

    public boolean bool(String name, boolean def) {
        String v = raw(name);
        if (v == null) return def;
        switch (v.toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on":
                return true;
            case "0", "false", "no", "off":
                return false;
            default:
                throw invalid(name, v, "a boolean (true/false)");
        }
    }

    public int i32(String name, int def, int min) {
        return i32(name, def, min, Integer.MAX_VALUE);
    }

    public int i32(String name, int def, int min, int max) {
        String v = raw(name);
        if (v == null) return def;
        int parsed;
        try {
            parsed = Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw invalid(name, v, "an integer");
        }
        if (parsed < min || parsed > max) {
            throw invalid(name, v, "an integer in [" + min + ", " + max + "]");
        }
        return parsed;
    }

    /** @return parsed value or null when the property is unset */
    public Integer optionalI32(String name, int min) {
        if (raw(name) == null) return null;
        return i32(name, min, min);
    }

    public double f64(String name, double def, double min, double max) {
        String v = raw(name);
        if (v == null) return def;
        double parsed;
        try {
            parsed = Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw invalid(name, v, "a number");
        }
        if (!Double.isFinite(parsed) || parsed < min || parsed > max) {
            throw invalid(name, v, "a finite number in [" + min + ", " + max + "]");
        }
        return parsed;
    }

    /**
     * Parses an enum by its lower-case name. Dashes and underscores are interchangeable,
     * so {@code replay-latest} and {@code replay_latest} both resolve.
     */
    public <E extends Enum<E>> E enumValue(String name, Class<E> type, E def) {
        Objects.requireNonNull(type, "type");
        String v = raw(name);
        if (v == null) return def;
        String normalized = v.toUpperCase(Locale.ROOT).replace('-', '_');
        for (E c : type.getEnumConstants()) {
            if (c.name().equals(normalized)) return c;
        }
        String allowed = Arrays.stream(type.getEnumConstants())
                .map(c -> c.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        throw invalid(name, v, "one of [" + allowed + "]");
    }

    public Set<String> csv(String name, Set<String> defaults) {
        String v = raw(name);
        if (v == null) return defaults;

        HashSet<String> out = new HashSet<>();
        for (String s : v.split(",")) {
            String item = s.trim();
            if (!item.isEmpty()) out.add(item);
        }
        return out.isEmpty() ? defaults : Set.copyOf(out);
    }

    private IllegalArgumentException invalid(String name, String value, String expected) {
        return new IllegalArgumentException(key(name) + " must be " + expected + " (got '" + value + "')");
    }
}
