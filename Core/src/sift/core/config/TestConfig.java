package sift.core.config;

import sift.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * A whole test-selection configuration: the suites to run, in order, and the configuration of each of them.
 */
public final class TestConfig {
    private final List<String> suiteNames;
    private final Map<String, SuiteConfig> suites;

    public TestConfig(List<String> suiteNames, Map<String, SuiteConfig> suites) {
        ObjectChecker.assertNonNull(suiteNames, suites);
        for (String suiteName : suiteNames) {
            if (!suites.containsKey(suiteName)) {
                throw new IllegalArgumentException("no configuration for suite: " + suiteName);
            }
        }
        // A suite listed more than once is run once, at its first position.
        this.suiteNames = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(suiteNames)));
        this.suites = Collections.unmodifiableMap(new LinkedHashMap<>(suites));
    }

    /**
     * Returns the distinct names of the suites to run, in the order they were first declared.
     */
    public List<String> getSuiteNames() {
        return this.suiteNames;
    }

    public SuiteConfig getSuite(String suiteName) {
        SuiteConfig suite = this.suites.get(suiteName);
        if (suite == null) {
            throw new IllegalArgumentException("no configuration for suite: " + suiteName);
        }
        return suite;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suites to run: " + this.suiteNames + ", num suites declared: " + this.suites.size() + " }";
    }
}
