package sift.client;

import junit.framework.TestCase;
import junit.framework.TestSuite;
import org.junit.Assert;
import org.junit.Test;
import sift.core.loader.LoadedSuite;
import sift.core.type.PackageName;
import sift.core.type.Result;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.lessThan;

public class SuiteOutputterTest {

    @Test
    public void testOutputsLoadedAndFailedSuites() {
        TestSuite suite = new TestSuite("Loaded");
        suite.addTest(new ListedCase("testZeta"));
        suite.addTest(new ListedCase("testAlpha"));

        Map<String, Result<LoadedSuite>> suites = new LinkedHashMap<>();
        suites.put("Loaded", Result.successful(new LoadedSuite(PackageName.of("my.pkg"), suite, 3)));
        suites.put("Broken", Result.error("ModuleNotFoundException: No module named 'nope'."));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int numFailures = SuiteOutputter.outputter(new PrintStream(bytes, true)).output(suites);
        String output = new String(bytes.toByteArray(), StandardCharsets.UTF_8);

        Assert.assertEquals(1, numFailures);
        assertThat(output, containsString("SUITE: Loaded"));
        assertThat(output, containsString("\tPackage: my.pkg, max workers: 3"));
        assertThat(output, containsString("\tTests: 2"));
        assertThat(output, containsString("SUITE: Broken"));
        assertThat(output, containsString("\tFAILED TO LOAD: ModuleNotFoundException: No module named 'nope'."));
        assertThat(output, containsString("SUITES: 2, failed to load: 1"));

        // Cases are listed sorted, not in suite order.
        String caseName = ListedCase.class.getName();
        assertThat(output.indexOf(caseName + "#testAlpha"), lessThan(output.indexOf(caseName + "#testZeta")));
    }

    @Test
    public void testSuiteWithoutPackage() {
        Map<String, Result<LoadedSuite>> suites = new LinkedHashMap<>();
        suites.put("Empty", Result.successful(new LoadedSuite(PackageName.NONE, new TestSuite("Empty"), 1)));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int numFailures = SuiteOutputter.outputter(new PrintStream(bytes, true)).output(suites);
        String output = new String(bytes.toByteArray(), StandardCharsets.UTF_8);

        Assert.assertEquals(0, numFailures);
        assertThat(output, containsString("\tPackage: None, max workers: 1"));
        assertThat(output, containsString("\tTests: 0"));
        assertThat(output, containsString("SUITES: 1, failed to load: 0"));
    }

    public static class ListedCase extends TestCase {

        public ListedCase(String name) {
            super(name);
        }

        public void testAlpha() {
        }

        public void testZeta() {
        }
    }
}
