package sift.core.selection;

import sift.core.type.PackageName;
import sift.core.util.ObjectChecker;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A suite whose groups have been resolved into fully qualified test method names, but whose tests are not yet loaded.
 */
public final class ResolvedSuite {
    public final String name;
    public final PackageName packageName;
    public final int maxWorkers;
    private final Set<String> testMethodNames;

    public ResolvedSuite(String name, PackageName packageName, Set<String> testMethodNames, int maxWorkers) {
        ObjectChecker.assertNonNull(name, packageName, testMethodNames);
        ObjectChecker.assertPositive(maxWorkers);
        this.name = name;
        this.packageName = packageName;
        this.testMethodNames = Collections.unmodifiableSet(new LinkedHashSet<>(testMethodNames));
        this.maxWorkers = maxWorkers;
    }

    public Set<String> getTestMethodNames() {
        return this.testMethodNames;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name
                + ", package: " + this.packageName
                + ", num tests: " + this.testMethodNames.size()
                + ", max workers: " + this.maxWorkers + " }";
    }
}
