package sift.core.type;

import sift.core.util.ObjectChecker;

/**
 * The package that a suite's modules live in.
 *
 * A suite may declare no package at all, in which case its modules are looked up by their bare names. That case is
 * represented by {@link #NONE} rather than by null, so a package literally called "none" is never confused with it.
 */
public final class PackageName {
    public static final PackageName NONE = new PackageName(null);
    private final String name;

    private PackageName(String name) {
        this.name = name;
    }

    /**
     * Returns the package with the given name, or {@link #NONE} if the name is null or empty.
     *
     * @param name The dotted package name.
     * @return the package.
     */
    public static PackageName of(String name) {
        return (name == null || name.isEmpty()) ? NONE : new PackageName(name);
    }

    /**
     * Prefixes this package onto the given dotted name, or returns the name unchanged if there is no package.
     *
     * @param dottedName The name to qualify.
     * @return the qualified name.
     */
    public String qualify(String dottedName) {
        ObjectChecker.assertNonNull(dottedName);
        return (this.name == null) ? dottedName : this.name + "." + dottedName;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PackageName)) {
            return false;
        }
        String otherName = ((PackageName) other).name;
        return (this.name == null) ? otherName == null : this.name.equals(otherName);
    }

    @Override
    public int hashCode() {
        return (this.name == null) ? 0 : this.name.hashCode();
    }

    @Override
    public String toString() {
        return (this.name == null) ? "None" : this.name;
    }
}
