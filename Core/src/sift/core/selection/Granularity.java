package sift.core.selection;

import java.util.ArrayList;
import java.util.List;

/**
 * The level at which a group names its test targets.
 */
public enum Granularity {
    MODULE("module"),

    CLASS("class"),

    METHOD("method");

    public final String name;

    private Granularity(String name) {
        this.name = name;
    }

    /**
     * Returns the granularity whose configuration name is the given string, or null if there is no such granularity.
     *
     * @param name The configuration name.
     * @return the granularity.
     */
    public static Granularity fromString(String name) {
        for (Granularity granularity : values()) {
            if (granularity.name.equals(name)) {
                return granularity;
            }
        }
        return null;
    }

    /**
     * Returns the configuration names of all granularities.
     */
    public static List<String> legalNames() {
        List<String> names = new ArrayList<>();
        for (Granularity granularity : values()) {
            names.add(granularity.name);
        }
        return names;
    }
}
