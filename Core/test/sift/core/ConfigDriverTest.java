package sift.core;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import junit.framework.TestCase;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;
import sift.core.config.SelectionConfig;
import sift.core.exception.ExclusionNotFoundException;
import sift.core.exception.ModuleNotFoundException;
import sift.core.exception.SelectionException;
import sift.core.exception.ValidationException;
import sift.core.helper.AssertHelper;
import sift.core.loader.LoadedSuite;
import sift.core.type.PackageName;
import sift.core.type.Result;
import sift.core.util.Logger;

import java.util.Arrays;
import java.util.Enumeration;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;

public class ConfigDriverTest {
    private static final SelectionConfig STRICT = SelectionConfig.Builder.newBuilder()
            .setClassLoader(ConfigDriverTest.class.getClassLoader())
            .build();
    private static final SelectionConfig LENIENT = SelectionConfig.Builder.newBuilder()
            .setClassLoader(ConfigDriverTest.class.getClassLoader())
            .setWhetherToFailOnAnySuiteError(false)
            .build();

    @BeforeClass
    public static void silenceLoggers() {
        Logger.globalDisable();
    }

    @Test
    public void testModuleGroupWithExclusions() throws SelectionException {
        Map<String, LoadedSuite> suites = ConfigDriver.withConfig(STRICT).loadSuites(json("{"
                + "\"test\": {\"suites\": [\"S\"]},"
                + "\"suites\": {\"S\": {\"package\": \"sift.fixture\", \"max_workers\": 4, \"groups\": {"
                + "  \"g\": {\"granularity\": \"module\", \"modules\": [\"SampleModule\"],"
                + "        \"except_classes\": [\"SampleModule.Mixed\"], \"except_methods\": [\"SampleModule.Basic.testB\"]}}}}}"));

        LoadedSuite suite = suites.get("S");
        Assert.assertEquals(PackageName.of("sift.fixture"), suite.packageName);
        Assert.assertEquals(4, suite.maxWorkers);
        Assert.assertEquals("S", suite.suite.getName());
        // NotACase.testSomething is resolved but filtered out when loading.
        Assert.assertEquals(setOf("sift.fixture.SampleModule$Basic#testA"), namesOf(suite));
    }

    @Test
    public void testClassGroup() throws SelectionException {
        Map<String, LoadedSuite> suites = ConfigDriver.withConfig(STRICT).loadSuites(json("{"
                + "\"test\": {\"suites\": [\"S\"]},"
                + "\"suites\": {\"S\": {\"package\": \"sift.fixture\", \"groups\": {"
                + "  \"g\": {\"granularity\": \"class\", \"classes\": [\"SampleModule.Basic\", \"SampleModule.NoTests\"]}}}}}"));

        LoadedSuite suite = suites.get("S");
        Assert.assertEquals(1, suite.maxWorkers);
        Assert.assertEquals(setOf("sift.fixture.SampleModule$Basic#testA", "sift.fixture.SampleModule$Basic#testB"), namesOf(suite));
    }

    @Test
    public void testGroupsAreUnitedAndDisabledGroupsIgnored() throws SelectionException {
        Map<String, LoadedSuite> suites = ConfigDriver.withConfig(STRICT).loadSuites(json("{"
                + "\"test\": {\"suites\": [\"S\"]},"
                + "\"suites\": {\"S\": {\"package\": \"sift.fixture\", \"groups\": {"
                + "  \"a\": {\"granularity\": \"class\", \"classes\": [\"SampleModule.Basic\"]},"
                + "  \"b\": {\"granularity\": \"method\", \"methods\": [\"SampleModule.Basic.testA\", \"OtherModule.Extra.testOne\"]},"
                + "  \"c\": {\"disable\": true, \"granularity\": \"module\", \"modules\": [\"NoSuchModule\"]}}}}}"));

        Assert.assertEquals(setOf(
                "sift.fixture.OtherModule$Extra#testOne",
                "sift.fixture.SampleModule$Basic#testA",
                "sift.fixture.SampleModule$Basic#testB"), namesOf(suites.get("S")));
    }

    @Test
    public void testSuitesComeBackInListedOrder() throws SelectionException {
        Map<String, LoadedSuite> suites = ConfigDriver.withConfig(STRICT).loadSuites(json("{"
                + "\"test\": {\"suites\": [\"Second\", \"First\"]},"
                + "\"suites\": {"
                + "  \"First\": {\"package\": \"sift.fixture\", \"groups\": {\"g\": {\"granularity\": \"module\", \"modules\": [\"OtherModule\"]}}},"
                + "  \"Second\": {\"package\": \"sift.fixture\", \"groups\": {}}}}"));

        Assert.assertEquals(Arrays.asList("Second", "First"), Arrays.asList(suites.keySet().toArray(new String[0])));
        Assert.assertEquals(0, suites.get("Second").suite.testCount());
        Assert.assertEquals(5, suites.get("First").suite.testCount());
    }

    @Test
    public void testSuiteListedTwiceIsLoadedOnce() throws SelectionException {
        Map<String, Result<LoadedSuite>> results = ConfigDriver.withConfig(LENIENT).loadSuitesLeniently(json("{"
                + "\"test\": {\"suites\": [\"A\", \"B\", \"A\"]},"
                + "\"suites\": {"
                + "  \"A\": {\"package\": \"sift.fixture\", \"groups\": {\"g\": {\"granularity\": \"class\", \"classes\": [\"OtherModule.Extra\"]}}},"
                + "  \"B\": {\"package\": \"sift.fixture\", \"groups\": {}}}}"));

        Assert.assertEquals(Arrays.asList("A", "B"), Arrays.asList(results.keySet().toArray(new String[0])));
        Assert.assertEquals(2, results.get("A").getData().suite.testCount());
    }

    @Test
    public void testStrictLoadFailsOnMissingExclusion() {
        ExclusionNotFoundException e = AssertHelper.assertThrows(ExclusionNotFoundException.class, () -> ConfigDriver.withConfig(STRICT).loadSuites(json("{"
                + "\"test\": {\"suites\": [\"S\"]},"
                + "\"suites\": {\"S\": {\"package\": \"sift.fixture\", \"groups\": {"
                + "  \"g\": {\"granularity\": \"module\", \"modules\": [\"SampleModule\"], \"except_methods\": [\"SampleModule.Basic.testMissing\"]}}}}}")));
        assertThat(e.getMessage(), containsString("'testMissing' not found in 'Basic'"));
    }

    @Test
    public void testStrictLoadFailsOnMissingModule() {
        AssertHelper.assertThrows(ModuleNotFoundException.class, () -> ConfigDriver.withConfig(STRICT).loadSuites(json("{"
                + "\"test\": {\"suites\": [\"S\"]},"
                + "\"suites\": {\"S\": {\"package\": \"sift.fixture\", \"groups\": {"
                + "  \"g\": {\"granularity\": \"module\", \"modules\": [\"NoSuchModule\"]}}}}}")));
    }

    @Test
    public void testStrictLoadFailsOnUnknownGranularity() {
        AssertHelper.assertThrows(ValidationException.class, () -> ConfigDriver.withConfig(STRICT).loadSuites(json("{"
                + "\"test\": {\"suites\": [\"S\"]},"
                + "\"suites\": {\"S\": {\"groups\": {\"g\": {\"granularity\": \"package\"}}}}}")));
    }

    @Test
    public void testLenientLoadKeepsTheOtherSuites() throws SelectionException {
        JsonObject config = json("{"
                + "\"test\": {\"suites\": [\"Broken\", \"Fine\"]},"
                + "\"suites\": {"
                + "  \"Broken\": {\"package\": \"sift.fixture\", \"groups\": {\"g\": {\"granularity\": \"module\", \"modules\": [\"NoSuchModule\"]}}},"
                + "  \"Fine\": {\"package\": \"sift.fixture\", \"groups\": {\"g\": {\"granularity\": \"class\", \"classes\": [\"OtherModule.Extra\"]}}}}}");

        Map<String, Result<LoadedSuite>> results = ConfigDriver.withConfig(LENIENT).loadSuitesLeniently(config);
        Assert.assertFalse(results.get("Broken").isSuccess());
        assertThat(results.get("Broken").getError(), startsWith("ModuleNotFoundException: "));
        Assert.assertTrue(results.get("Fine").isSuccess());
        Assert.assertEquals(2, results.get("Fine").getData().suite.testCount());

        Map<String, LoadedSuite> suites = ConfigDriver.withConfig(LENIENT).loadSuites(config);
        Assert.assertEquals(1, suites.size());
        Assert.assertTrue(suites.containsKey("Fine"));
    }

    @Test
    public void testMethodPrefixIsConfigurable() throws SelectionException {
        SelectionConfig config = SelectionConfig.Builder.newBuilder()
                .setClassLoader(getClass().getClassLoader())
                .setMethodPrefix("testA")
                .build();

        Map<String, LoadedSuite> suites = ConfigDriver.withConfig(config).loadSuites(json("{"
                + "\"test\": {\"suites\": [\"S\"]},"
                + "\"suites\": {\"S\": {\"package\": \"sift.fixture\", \"groups\": {"
                + "  \"g\": {\"granularity\": \"module\", \"modules\": [\"SampleModule\", \"OtherModule\"]}}}}}"));

        Assert.assertEquals(setOf("sift.fixture.OtherModule$Ordered#testAlpha", "sift.fixture.SampleModule$Basic#testA"), namesOf(suites.get("S")));
    }

    private static JsonObject json(String text) {
        return JsonParser.parseString(text).getAsJsonObject();
    }

    private static Set<String> namesOf(LoadedSuite loadedSuite) {
        Set<String> names = new TreeSet<>();
        Enumeration<junit.framework.Test> tests = loadedSuite.suite.tests();
        while (tests.hasMoreElements()) {
            TestCase testCase = (TestCase) tests.nextElement();
            names.add(testCase.getClass().getName() + "#" + testCase.getName());
        }
        return names;
    }

    private static Set<String> setOf(String... names) {
        return new TreeSet<>(Arrays.asList(names));
    }
}
