package sift.client;

import junit.framework.Test;
import junit.framework.TestCase;
import sift.core.loader.LoadedSuite;
import sift.core.type.Result;
import sift.core.util.ObjectChecker;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;

/**
 * The class that is responsible for writing the loaded suites out to the console.
 */
public final class SuiteOutputter {
    private final PrintStream out;

    private SuiteOutputter(PrintStream out) {
        ObjectChecker.assertNonNull(out);
        this.out = out;
    }

    /**
     * Creates a new outputter that writes to the given stream.
     *
     * @param out The stream to write to.
     * @return the new outputter.
     */
    public static SuiteOutputter outputter(PrintStream out) {
        return new SuiteOutputter(out);
    }

    /**
     * Writes out every suite, or the reason it failed to load.
     *
     * @param suites Each suite name mapped to the result of loading it.
     * @return the number of suites that failed to load.
     */
    public int output(Map<String, Result<LoadedSuite>> suites) {
        ObjectChecker.assertNonNull(suites);

        int numFailures = 0;
        this.out.println("===============================================================");
        for (Map.Entry<String, Result<LoadedSuite>> entry : suites.entrySet()) {
            this.out.println("\nSUITE: " + entry.getKey());
            Result<LoadedSuite> result = entry.getValue();
            if (result.isSuccess()) {
                outputSuite(result.getData());
            } else {
                this.out.println("\tFAILED TO LOAD: " + result.getError());
                numFailures++;
            }
        }
        this.out.println("\nSUITES: " + suites.size() + ", failed to load: " + numFailures);
        this.out.println("===============================================================");
        return numFailures;
    }

    private void outputSuite(LoadedSuite loadedSuite) {
        this.out.println("\tPackage: " + loadedSuite.packageName + ", max workers: " + loadedSuite.maxWorkers);
        this.out.println("\tTests: " + loadedSuite.suite.testCount());

        // The order of a loaded suite is not meaningful, sort so that the listing is stable.
        List<String> testNames = new ArrayList<>();
        Enumeration<Test> tests = loadedSuite.suite.tests();
        while (tests.hasMoreElements()) {
            testNames.add(describe(tests.nextElement()));
        }
        Collections.sort(testNames);
        for (String testName : testNames) {
            this.out.println("\t\t" + testName);
        }
    }

    private static String describe(Test test) {
        if (test instanceof TestCase) {
            return test.getClass().getName() + "#" + ((TestCase) test).getName();
        }
        return test.toString();
    }

    @Override
    public String toString() {
        return this.getClass().getName();
    }
}
