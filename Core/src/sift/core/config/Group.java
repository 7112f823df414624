package sift.core.config;

import sift.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One group of a suite: the targets it selects at its granularity and the classes and methods it excludes from them.
 *
 * The granularity is kept exactly as it was configured and is only validated when the group is resolved, so that a
 * disabled group is never rejected.
 */
public final class Group {
    public final String key;
    public final boolean isDisabled;
    public final String granularity;
    private final List<String> targets;
    private final List<String> exceptClasses;
    private final List<String> exceptMethods;

    private Group(String key, boolean isDisabled, String granularity, List<String> targets, List<String> exceptClasses, List<String> exceptMethods) {
        this.key = key;
        this.isDisabled = isDisabled;
        this.granularity = granularity;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        this.exceptClasses = Collections.unmodifiableList(new ArrayList<>(exceptClasses));
        this.exceptMethods = Collections.unmodifiableList(new ArrayList<>(exceptMethods));
    }

    /**
     * Returns a disabled group. It selects nothing.
     *
     * @param key The group key.
     * @return the group.
     */
    public static Group disabled(String key) {
        ObjectChecker.assertNonNull(key);
        return new Group(key, true, null, Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Returns the module, class or method names this group selects, depending on its granularity.
     */
    public List<String> getTargets() {
        return this.targets;
    }

    /**
     * Returns the {@code module.class} names to exclude.
     */
    public List<String> getExceptClasses() {
        return this.exceptClasses;
    }

    /**
     * Returns the {@code module.class.method} names to exclude.
     */
    public List<String> getExceptMethods() {
        return this.exceptMethods;
    }

    @Override
    public String toString() {
        if (this.isDisabled) {
            return this.getClass().getSimpleName() + " { key: " + this.key + ", [disabled] }";
        }
        return this.getClass().getSimpleName() + " { key: " + this.key
                + ", granularity: " + this.granularity
                + ", targets: " + this.targets
                + ", except classes: " + this.exceptClasses
                + ", except methods: " + this.exceptMethods + " }";
    }

    public static final class Builder {
        private String key;
        private String granularity;
        private List<String> targets;
        private List<String> exceptClasses = Collections.emptyList();
        private List<String> exceptMethods = Collections.emptyList();

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder setKey(String key) {
            if (this.key != null) {
                throw new IllegalStateException("key is already set.");
            }
            this.key = key;
            return this;
        }

        public Builder setGranularity(String granularity) {
            if (this.granularity != null) {
                throw new IllegalStateException("granularity is already set.");
            }
            this.granularity = granularity;
            return this;
        }

        public Builder setTargets(List<String> targets) {
            if (this.targets != null) {
                throw new IllegalStateException("targets are already set.");
            }
            this.targets = targets;
            return this;
        }

        public Builder setExceptClasses(List<String> exceptClasses) {
            this.exceptClasses = exceptClasses;
            return this;
        }

        public Builder setExceptMethods(List<String> exceptMethods) {
            this.exceptMethods = exceptMethods;
            return this;
        }

        public Group build() {
            if (this.key == null) {
                throw new IllegalStateException("Cannot build group: no key was set.");
            }
            if (this.granularity == null) {
                throw new IllegalStateException("Cannot build group: no granularity was set.");
            }
            if (this.targets == null) {
                throw new IllegalStateException("Cannot build group: no targets were set.");
            }
            ObjectChecker.assertNoNullElements(this.targets);
            ObjectChecker.assertNoNullElements(this.exceptClasses);
            ObjectChecker.assertNoNullElements(this.exceptMethods);
            return new Group(this.key, false, this.granularity, this.targets, this.exceptClasses, this.exceptMethods);
        }
    }
}
