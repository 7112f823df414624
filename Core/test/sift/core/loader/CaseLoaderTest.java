package sift.core.loader;

import junit.framework.TestCase;
import junit.framework.TestResult;
import junit.framework.TestSuite;
import org.junit.Assert;
import org.junit.Test;
import sift.core.exception.CaseInstantiationException;
import sift.core.exception.NotATestMethodException;
import sift.core.exception.SelectionException;
import sift.core.exception.UnresolvableNameException;
import sift.core.helper.AssertHelper;
import sift.fixture.OdditiesModule;
import sift.fixture.SampleModule;
import sift.fixture.StandaloneCase;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

public class CaseLoaderTest {
    private final CaseLoader loader = CaseLoader.withClassLoader(getClass().getClassLoader());

    @Test
    public void testLoadEnclosedTestMethod() throws SelectionException {
        TestCase testCase = this.loader.loadOne("sift.fixture.SampleModule.Basic.testA");

        Assert.assertNotNull(testCase);
        Assert.assertEquals(SampleModule.Basic.class, testCase.getClass());
        Assert.assertEquals("testA", testCase.getName());
    }

    @Test
    public void testLoadedCaseIsRunnable() throws SelectionException {
        TestCase testCase = this.loader.loadOne("sift.fixture.SampleModule.Basic.testB");

        TestResult result = new TestResult();
        testCase.run(result);
        Assert.assertEquals(1, result.runCount());
        Assert.assertTrue(result.wasSuccessful());
    }

    @Test
    public void testLoadTopLevelTestMethod() throws SelectionException {
        TestCase testCase = this.loader.loadOne("sift.fixture.StandaloneCase.testAlone");

        Assert.assertEquals(StandaloneCase.class, testCase.getClass());
        Assert.assertEquals("testAlone", testCase.getName());
    }

    @Test
    public void testLoadThroughStringConstructor() throws SelectionException {
        TestCase testCase = this.loader.loadOne("sift.fixture.OdditiesModule.NamedCase.testNamed");

        Assert.assertEquals(OdditiesModule.NamedCase.class, testCase.getClass());
        Assert.assertEquals("testNamed", testCase.getName());
    }

    @Test
    public void testStaticMethodIsFilteredOut() throws SelectionException {
        Assert.assertNull(this.loader.loadOne("sift.fixture.SampleModule.Mixed.testStatic"));
        Assert.assertNotNull(this.loader.loadOne("sift.fixture.SampleModule.Mixed.testInstance"));
    }

    @Test
    public void testOwnerThatIsNotATestCaseIsFilteredOut() throws SelectionException {
        Assert.assertNull(this.loader.loadOne("sift.fixture.SampleModule.NotACase.testSomething"));
    }

    @Test
    public void testIneligibleTestCaseClassesAreFilteredOut() throws SelectionException {
        Assert.assertNull(this.loader.loadOne("sift.fixture.OdditiesModule.AbstractCase.testAbstractOwner"));
        Assert.assertNull(this.loader.loadOne("sift.fixture.OdditiesModule.PackagePrivateCase.testHidden"));
        Assert.assertNull(this.loader.loadOne("sift.fixture.OdditiesModule.InnerCase.testInner"));
    }

    @Test
    public void testNameWithNoLoadablePrefix() {
        UnresolvableNameException e = AssertHelper.assertThrows(UnresolvableNameException.class, () -> this.loader.loadOne("no.such.Module.Cls.testX"));
        assertThat(e.getMessage(), containsString("no prefix of it is a loadable class"));
    }

    @Test
    public void testMissingMemberClass() {
        UnresolvableNameException e = AssertHelper.assertThrows(UnresolvableNameException.class, () -> this.loader.loadOne("sift.fixture.SampleModule.Missing.testA"));
        assertThat(e.getMessage(), containsString("no member class 'Missing'"));
    }

    @Test
    public void testMissingMethod() {
        UnresolvableNameException e = AssertHelper.assertThrows(UnresolvableNameException.class, () -> this.loader.loadOne("sift.fixture.SampleModule.Basic.testMissing"));
        assertThat(e.getMessage(), containsString("no member 'testMissing'"));
    }

    @Test
    public void testNamesThatAreNotMethods() {
        AssertHelper.assertThrows(NotATestMethodException.class, () -> this.loader.loadOne("sift.fixture.OdditiesModule.Oddities.Inner"));
        AssertHelper.assertThrows(NotATestMethodException.class, () -> this.loader.loadOne("sift.fixture.OdditiesModule.Oddities.testField"));
        AssertHelper.assertThrows(NotATestMethodException.class, () -> this.loader.loadOne("sift.fixture.OdditiesModule.Oddities.testWithArgument"));
        AssertHelper.assertThrows(NotATestMethodException.class, () -> this.loader.loadOne("sift.fixture.StandaloneCase"));
    }

    @Test
    public void testFailingConstructor() {
        CaseInstantiationException e = AssertHelper.assertThrows(CaseInstantiationException.class, () -> this.loader.loadOne("sift.fixture.OdditiesModule.ExplodingCase.testBoom"));
        Assert.assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    public void testInheritedMethod() throws SelectionException {
        // TestCase itself declares toString, which is a no-argument instance method.
        TestCase testCase = this.loader.loadOne("sift.fixture.SampleModule.Basic.toString");
        Assert.assertEquals("toString", testCase.getName());
    }

    @Test
    public void testLoadMany() throws SelectionException {
        TestSuite suite = this.loader.loadMany(Arrays.asList(
                "sift.fixture.SampleModule.Basic.testA",
                "sift.fixture.SampleModule.Basic.testB",
                "sift.fixture.SampleModule.Mixed.testStatic",
                "sift.fixture.SampleModule.Mixed.testInstance",
                "sift.fixture.SampleModule.NotACase.testSomething"));

        Assert.assertEquals(3, suite.testCount());
    }

    @Test
    public void testLoadManyFailsOnUnresolvableName() {
        AssertHelper.assertThrows(UnresolvableNameException.class, () -> this.loader.loadMany(Arrays.asList(
                "sift.fixture.SampleModule.Basic.testA",
                "sift.fixture.SampleModule.Basic.testMissing")));
    }
}
