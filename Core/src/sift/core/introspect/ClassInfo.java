package sift.core.introspect;

import sift.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The statically discovered shape of one class: its simple name and the methods it declares, each with the first source
 * line it occupies.
 */
public final class ClassInfo {
    public static final int UNKNOWN_LINE = Integer.MAX_VALUE;
    private final String name;
    private final Map<String, Integer> methodLines;

    /**
     * Constructs a new class description.
     *
     * The iteration order of the given map is taken as declaration order wherever two methods share a line, or wherever
     * a method has no line information ({@link #UNKNOWN_LINE}).
     *
     * @param name The simple class name.
     * @param methodLines Each method name mapped to its first line.
     */
    public ClassInfo(String name, Map<String, Integer> methodLines) {
        ObjectChecker.assertNonNull(name, methodLines);
        this.name = name;
        this.methodLines = Collections.unmodifiableMap(new LinkedHashMap<>(methodLines));
    }

    public String getName() {
        return this.name;
    }

    /**
     * Returns every declared method name mapped to the first line it occupies.
     */
    public Map<String, Integer> getMethodLines() {
        return this.methodLines;
    }

    /**
     * Returns the names of the declared methods that start with the given prefix, in declaration order.
     *
     * @param prefix The test method prefix.
     * @return the matching method names.
     */
    public List<String> methodsOf(String prefix) {
        ObjectChecker.assertNonNull(prefix);

        // The sort is stable, so methods on the same (or an unknown) line stay in class-file order.
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(this.methodLines.entrySet());
        entries.sort(Comparator.comparing(Map.Entry::getValue));

        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : entries) {
            if (entry.getKey().startsWith(prefix)) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name + ", num methods: " + this.methodLines.size() + " }";
    }
}
