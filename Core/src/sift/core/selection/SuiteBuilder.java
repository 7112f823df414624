package sift.core.selection;

import sift.core.config.Group;
import sift.core.config.SuiteConfig;
import sift.core.exception.SelectionException;
import sift.core.util.Logger;
import sift.core.util.ObjectChecker;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves every group of a suite and merges their selections.
 */
public final class SuiteBuilder {
    private static final Logger LOGGER = Logger.forClass(SuiteBuilder.class);
    private final SelectionResolver resolver;

    public SuiteBuilder(SelectionResolver resolver) {
        ObjectChecker.assertNonNull(resolver);
        this.resolver = resolver;
    }

    /**
     * Returns the union of the methods selected by each group of the suite. A method selected by more than one group is
     * held once.
     *
     * An empty suite is not an error, it is only logged as a warning.
     *
     * @param suiteName The name of the suite.
     * @param suiteConfig The suite's configuration.
     * @return the resolved suite.
     * @throws SelectionException if any group fails to resolve.
     */
    public ResolvedSuite build(String suiteName, SuiteConfig suiteConfig) throws SelectionException {
        ObjectChecker.assertNonNull(suiteName, suiteConfig);

        Set<String> testMethodNames = new LinkedHashSet<>();
        for (Group group : suiteConfig.getGroups()) {
            Set<String> selected = this.resolver.resolve(group, suiteConfig.packageName);
            LOGGER.log("Group '" + group.key + "' of suite '" + suiteName + "' selected " + selected.size() + " test(s).");
            testMethodNames.addAll(selected);
        }

        if (testMethodNames.isEmpty()) {
            LOGGER.warn("Test suite '" + suiteName + "' is empty.");
        }
        return new ResolvedSuite(suiteName, suiteConfig.packageName, testMethodNames, suiteConfig.maxWorkers);
    }
}
