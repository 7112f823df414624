package sift.core.loader;

import junit.framework.TestSuite;
import sift.core.type.PackageName;
import sift.core.util.ObjectChecker;

/**
 * A suite whose tests are loaded and ready to be handed to a test runner, together with the number of workers the
 * runner may use for it.
 */
public final class LoadedSuite {
    public final PackageName packageName;
    public final TestSuite suite;
    public final int maxWorkers;

    public LoadedSuite(PackageName packageName, TestSuite suite, int maxWorkers) {
        ObjectChecker.assertNonNull(packageName, suite);
        ObjectChecker.assertPositive(maxWorkers);
        this.packageName = packageName;
        this.suite = suite;
        this.maxWorkers = maxWorkers;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.suite.getName()
                + ", package: " + this.packageName
                + ", num tests: " + this.suite.testCount()
                + ", max workers: " + this.maxWorkers + " }";
    }
}
