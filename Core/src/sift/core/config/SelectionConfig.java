package sift.core.config;

/**
 * The settings that every component of a single configuration load shares. They are handed to each component
 * explicitly.
 */
public final class SelectionConfig {
    public static final String DEFAULT_METHOD_PREFIX = "test";
    public final String methodPrefix;
    public final boolean isStrict;
    public final ClassLoader classLoader;

    private SelectionConfig(String methodPrefix, boolean isStrict, ClassLoader classLoader) {
        if (methodPrefix == null) {
            throw new NullPointerException("methodPrefix must be non-null.");
        }
        if (classLoader == null) {
            throw new NullPointerException("classLoader must be non-null.");
        }
        this.methodPrefix = methodPrefix;
        this.isStrict = isStrict;
        this.classLoader = classLoader;
    }

    /**
     * Returns the default settings: the "test" method prefix, strict loading and the current thread's context class
     * loader.
     */
    public static SelectionConfig defaults() {
        return Builder.newBuilder().build();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { method prefix: " + this.methodPrefix
                + ", " + (this.isStrict ? "[strict]" : "[lenient]") + " }";
    }

    public static class Builder {
        private String methodPrefix;
        private Boolean isStrict;
        private ClassLoader classLoader;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder setMethodPrefix(String prefix) {
            if (this.methodPrefix != null) {
                throw new IllegalStateException("method prefix is already set.");
            }
            this.methodPrefix = prefix;
            return this;
        }

        public Builder setWhetherToFailOnAnySuiteError(boolean isStrict) {
            if (this.isStrict != null) {
                throw new IllegalStateException("strictness is already set.");
            }
            this.isStrict = isStrict;
            return this;
        }

        public Builder setClassLoader(ClassLoader classLoader) {
            if (this.classLoader != null) {
                throw new IllegalStateException("class loader is already set.");
            }
            this.classLoader = classLoader;
            return this;
        }

        public SelectionConfig build() {
            String prefix = (this.methodPrefix == null) ? DEFAULT_METHOD_PREFIX : this.methodPrefix;
            boolean strict = (this.isStrict == null) || this.isStrict;
            ClassLoader loader = this.classLoader;
            if (loader == null) {
                loader = Thread.currentThread().getContextClassLoader();
            }
            if (loader == null) {
                loader = SelectionConfig.class.getClassLoader();
            }
            return new SelectionConfig(prefix, strict, loader);
        }
    }
}
