package sift.core;

import com.google.gson.JsonObject;
import junit.framework.TestSuite;
import sift.core.config.JsonConfigParser;
import sift.core.config.SelectionConfig;
import sift.core.config.TestConfig;
import sift.core.exception.SelectionException;
import sift.core.introspect.BytecodeModuleIntrospector;
import sift.core.introspect.ModuleIntrospector;
import sift.core.loader.CaseLoader;
import sift.core.loader.LoadedSuite;
import sift.core.selection.ResolvedSuite;
import sift.core.selection.SelectionResolver;
import sift.core.selection.SuiteBuilder;
import sift.core.type.Result;
import sift.core.util.Logger;
import sift.core.util.ObjectChecker;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The entry point into test selection: turns a whole configuration into one loaded suite per suite it asks to run.
 *
 * Nothing is executed. Each loaded suite is handed back to the caller together with its package and its max workers
 * hint, for whatever runner the caller uses.
 */
public final class ConfigDriver {
    private static final Logger LOGGER = Logger.forClass(ConfigDriver.class);
    private final SelectionConfig config;
    private final JsonConfigParser parser;
    private final SuiteBuilder suiteBuilder;
    private final CaseLoader caseLoader;

    private ConfigDriver(SelectionConfig config, ModuleIntrospector introspector) {
        ObjectChecker.assertNonNull(config, introspector);
        this.config = config;
        this.parser = new JsonConfigParser();
        this.suiteBuilder = new SuiteBuilder(new SelectionResolver(introspector, config.methodPrefix));
        this.caseLoader = CaseLoader.withClassLoader(config.classLoader);
    }

    /**
     * Constructs a new driver that introspects modules from their class files using the configured class loader.
     *
     * @param config The selection settings.
     * @return the driver.
     */
    public static ConfigDriver withConfig(SelectionConfig config) {
        ObjectChecker.assertNonNull(config);
        return new ConfigDriver(config, BytecodeModuleIntrospector.withClassLoader(config.classLoader));
    }

    /**
     * Constructs a new driver that discovers modules using the given introspector.
     *
     * @param config The selection settings.
     * @param introspector The module introspector.
     * @return the driver.
     */
    public static ConfigDriver withIntrospector(SelectionConfig config, ModuleIntrospector introspector) {
        return new ConfigDriver(config, introspector);
    }

    /**
     * Loads every suite the given deserialized configuration asks to run.
     *
     * @param jsonConfig The configuration.
     * @return each suite name mapped to its loaded suite, in the order the suites are listed.
     * @throws SelectionException if the configuration is malformed or any suite fails to load.
     */
    public Map<String, LoadedSuite> loadSuites(JsonObject jsonConfig) throws SelectionException {
        return loadSuites(this.parser.parse(jsonConfig));
    }

    /**
     * Loads every suite the given configuration asks to run.
     *
     * If this driver is lenient, a suite that fails to load is logged and left out of the returned map.
     *
     * @param testConfig The configuration.
     * @return each suite name mapped to its loaded suite, in the order the suites are listed.
     * @throws SelectionException if this driver is strict and any suite fails to load.
     */
    public Map<String, LoadedSuite> loadSuites(TestConfig testConfig) throws SelectionException {
        ObjectChecker.assertNonNull(testConfig);

        Map<String, LoadedSuite> suites = new LinkedHashMap<>();
        for (String suiteName : testConfig.getSuiteNames()) {
            if (this.config.isStrict) {
                suites.put(suiteName, loadSuite(suiteName, testConfig));
            } else {
                Result<LoadedSuite> result = tryLoadSuite(suiteName, testConfig);
                if (result.isSuccess()) {
                    suites.put(suiteName, result.getData());
                }
            }
        }
        return suites;
    }

    /**
     * Attempts to load every suite the given deserialized configuration asks to run, independently of one another.
     *
     * A suite that fails to load is reported as an error result and does not stop the others from loading. A
     * configuration that cannot be parsed at all still throws.
     *
     * @param jsonConfig The configuration.
     * @return each suite name mapped to the result of loading it, in the order the suites are listed.
     * @throws SelectionException if the configuration is malformed.
     */
    public Map<String, Result<LoadedSuite>> loadSuitesLeniently(JsonObject jsonConfig) throws SelectionException {
        TestConfig testConfig = this.parser.parse(jsonConfig);

        Map<String, Result<LoadedSuite>> results = new LinkedHashMap<>();
        for (String suiteName : testConfig.getSuiteNames()) {
            results.put(suiteName, tryLoadSuite(suiteName, testConfig));
        }
        return results;
    }

    private Result<LoadedSuite> tryLoadSuite(String suiteName, TestConfig testConfig) {
        try {
            return Result.successful(loadSuite(suiteName, testConfig));
        } catch (SelectionException e) {
            LOGGER.warn("Failed to load test suite '" + suiteName + "': " + e.getMessage());
            return Result.failedWith(e);
        }
    }

    private LoadedSuite loadSuite(String suiteName, TestConfig testConfig) throws SelectionException {
        ResolvedSuite resolvedSuite = this.suiteBuilder.build(suiteName, testConfig.getSuite(suiteName));

        TestSuite suite = this.caseLoader.loadMany(resolvedSuite.getTestMethodNames());
        suite.setName(suiteName);

        LoadedSuite loadedSuite = new LoadedSuite(resolvedSuite.packageName, suite, resolvedSuite.maxWorkers);
        LOGGER.log("Created test suite '" + suiteName + "' successfully from package " + resolvedSuite.packageName + ".");
        LOGGER.log("Created test suite: " + loadedSuite);
        return loadedSuite;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { config: " + this.config + " }";
    }
}
