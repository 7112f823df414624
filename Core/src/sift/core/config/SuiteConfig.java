package sift.core.config;

import sift.core.type.PackageName;
import sift.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The configuration of a single suite: the package its modules live in, its groups and its concurrency hint.
 */
public final class SuiteConfig {
    public static final int DEFAULT_MAX_WORKERS = 1;
    public final PackageName packageName;
    public final int maxWorkers;
    private final List<Group> groups;

    public SuiteConfig(PackageName packageName, int maxWorkers, List<Group> groups) {
        ObjectChecker.assertNonNull(packageName, groups);
        ObjectChecker.assertPositive(maxWorkers);
        this.packageName = packageName;
        this.maxWorkers = maxWorkers;
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
    }

    public List<Group> getGroups() {
        return this.groups;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { package: " + this.packageName
                + ", max workers: " + this.maxWorkers
                + ", num groups: " + this.groups.size() + " }";
    }
}
