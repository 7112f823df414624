package sift.core.name;

import sift.core.util.ObjectChecker;

/**
 * A method name relative to a package: its module, its declaring class and its own name.
 */
public final class MethodName {
    public final String module;
    public final String className;
    public final String method;

    public MethodName(String module, String className, String method) {
        ObjectChecker.assertNonNull(module, className, method);
        this.module = module;
        this.className = className;
        this.method = method;
    }

    /**
     * Returns this name in its dotted form, {@code module.class.method}.
     */
    public String toDottedName() {
        return this.module + "." + this.className + "." + this.method;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MethodName)) {
            return false;
        }
        MethodName that = (MethodName) other;
        return this.module.equals(that.module) && this.className.equals(that.className) && this.method.equals(that.method);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * this.module.hashCode() + this.className.hashCode()) + this.method.hashCode();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + toDottedName() + " }";
    }
}
