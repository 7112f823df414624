package sift.core.name;

import sift.core.util.ObjectChecker;

/**
 * A class name relative to a package: the module it is declared in and its simple name.
 */
public final class ClassName {
    public final String module;
    public final String className;

    public ClassName(String module, String className) {
        ObjectChecker.assertNonNull(module, className);
        this.module = module;
        this.className = className;
    }

    /**
     * Returns this name in its dotted form, {@code module.class}.
     */
    public String toDottedName() {
        return this.module + "." + this.className;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ClassName)) {
            return false;
        }
        ClassName that = (ClassName) other;
        return this.module.equals(that.module) && this.className.equals(that.className);
    }

    @Override
    public int hashCode() {
        return 31 * this.module.hashCode() + this.className.hashCode();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + toDottedName() + " }";
    }
}
