package sift.core.name;

import sift.core.exception.NameFormatException;
import sift.core.util.ObjectChecker;

/**
 * Splits dotted names into their parts.
 */
public final class NameParser {
    private static final String CLASS_FORMAT = "module.class";
    private static final String METHOD_FORMAT = "module.class.method";

    private NameParser() {}

    /**
     * Parses a name of the form {@code module.class}.
     *
     * @param name The dotted name.
     * @return the parsed name.
     * @throws NameFormatException if the name does not consist of exactly 2 non-empty segments.
     */
    public static ClassName parseClassName(String name) throws NameFormatException {
        String[] parts = split(name, 2, CLASS_FORMAT);
        return new ClassName(parts[0], parts[1]);
    }

    /**
     * Parses a name of the form {@code module.class.method}.
     *
     * @param name The dotted name.
     * @return the parsed name.
     * @throws NameFormatException if the name does not consist of exactly 3 non-empty segments.
     */
    public static MethodName parseMethodName(String name) throws NameFormatException {
        String[] parts = split(name, 3, METHOD_FORMAT);
        return new MethodName(parts[0], parts[1], parts[2]);
    }

    private static String[] split(String name, int arity, String format) throws NameFormatException {
        ObjectChecker.assertNonNull(name);

        // A negative limit keeps trailing empty segments so that "a.b." is rejected.
        String[] parts = name.split("\\.", -1);
        if (parts.length != arity) {
            throw new NameFormatException("'" + name + "' does not comply with: \"" + format + "\".");
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new NameFormatException("'" + name + "' does not comply with: \"" + format + "\" (empty segment).");
            }
        }
        return parts;
    }
}
