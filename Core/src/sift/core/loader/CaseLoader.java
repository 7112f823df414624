package sift.core.loader;

import junit.framework.TestCase;
import junit.framework.TestSuite;
import sift.core.exception.CaseInstantiationException;
import sift.core.exception.NotATestMethodException;
import sift.core.exception.SelectionException;
import sift.core.exception.UnresolvableNameException;
import sift.core.util.Logger;
import sift.core.util.ObjectChecker;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collection;

/**
 * A class that turns fully qualified test method names into runnable JUnit test cases.
 *
 * A name such as {@code pkg.Module.Cls.testX} is resolved by loading the longest dotted prefix of it that is a class
 * ({@code pkg.Module}), then walking the remaining segments through member classes ({@code Cls}) down to the method
 * ({@code testX}). Classes are loaded without being initialized; initialization happens when a case is constructed.
 */
public final class CaseLoader {
    private static final Logger LOGGER = Logger.forClass(CaseLoader.class);
    private final ClassLoader classLoader;

    private CaseLoader(ClassLoader classLoader) {
        ObjectChecker.assertNonNull(classLoader);
        this.classLoader = classLoader;
    }

    /**
     * Constructs a new case loader that loads test classes through the given class loader.
     *
     * @param classLoader The class loader.
     * @return the case loader.
     */
    public static CaseLoader withClassLoader(ClassLoader classLoader) {
        return new CaseLoader(classLoader);
    }

    /**
     * Loads every one of the given names into a single suite. Names that resolve to something other than an instance
     * test method of a {@link TestCase} class are left out.
     *
     * The order of the tests in the returned suite is not meaningful.
     *
     * @param names The fully qualified test method names.
     * @return the suite of loaded cases.
     * @throws SelectionException if any name cannot be resolved.
     */
    public TestSuite loadMany(Collection<String> names) throws SelectionException {
        ObjectChecker.assertNoNullElements(names);

        TestSuite suite = new TestSuite();
        for (String name : names) {
            TestCase testCase = loadOne(name);
            if (testCase != null) {
                suite.addTest(testCase);
            }
        }
        LOGGER.log("Loaded " + suite.testCount() + " test(s) out of " + names.size() + " name(s).");
        return suite;
    }

    /**
     * Loads the named test method as a runnable case.
     *
     * Returns null if the method is static or if the class declaring it is not a public, concrete {@link TestCase}
     * subclass with a test constructor.
     *
     * @param fullyQualifiedName The fully qualified test method name.
     * @return the case, or null if the name does not denote an eligible test.
     * @throws UnresolvableNameException if no prefix of the name is a class, or a remaining segment is not a member.
     * @throws NotATestMethodException if the name denotes something other than a method without parameters.
     * @throws CaseInstantiationException if constructing the case fails.
     */
    public TestCase loadOne(String fullyQualifiedName) throws SelectionException {
        ObjectChecker.assertNonNull(fullyQualifiedName);

        String[] parts = fullyQualifiedName.split("\\.", -1);
        int numClassParts = parts.length;
        Class<?> owner = null;
        Throwable lastFailure = null;
        while (numClassParts > 0) {
            try {
                owner = Class.forName(String.join(".", Arrays.copyOfRange(parts, 0, numClassParts)), false, this.classLoader);
                break;
            } catch (ClassNotFoundException | NoClassDefFoundError e) {
                lastFailure = e;
                numClassParts--;
            }
        }
        if (owner == null) {
            throw new UnresolvableNameException("Cannot load '" + fullyQualifiedName + "': no prefix of it is a loadable class.", lastFailure);
        }
        if (numClassParts == parts.length) {
            throw new NotATestMethodException("'" + fullyQualifiedName + "' is a class, not a test method.");
        }

        // Every segment between the loaded class and the method must be a member class.
        for (int i = numClassParts; i < parts.length - 1; i++) {
            Class<?> memberClass = findMemberClass(owner, parts[i]);
            if (memberClass == null) {
                throw new UnresolvableNameException("Cannot load '" + fullyQualifiedName + "': " + owner.getName() + " has no member class '" + parts[i] + "'.");
            }
            owner = memberClass;
        }

        String methodName = parts[parts.length - 1];
        Method method = findTestMethod(owner, fullyQualifiedName, methodName);

        if (!isTestCaseClass(owner)) {
            LOGGER.log("Skipping " + fullyQualifiedName + ": " + owner.getName() + " is not a test case class.");
            return null;
        }
        if (Modifier.isStatic(method.getModifiers())) {
            LOGGER.log("Skipping " + fullyQualifiedName + ": static methods are not test methods.");
            return null;
        }
        return instantiate(owner, methodName, fullyQualifiedName);
    }

    private static Method findTestMethod(Class<?> owner, String fullyQualifiedName, String methodName) throws SelectionException {
        if (findMemberClass(owner, methodName) != null) {
            throw new NotATestMethodException("'" + fullyQualifiedName + "' is a class, not a test method.");
        }

        boolean hasParameterizedOverload = false;
        for (Class<?> current = owner; current != null; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (!method.getName().equals(methodName) || method.isSynthetic() || method.isBridge()) {
                    continue;
                }
                if (method.getParameterCount() == 0) {
                    return method;
                }
                hasParameterizedOverload = true;
            }
        }

        if (hasParameterizedOverload) {
            throw new NotATestMethodException("'" + fullyQualifiedName + "' takes parameters and cannot be run as a test method.");
        }
        if (hasField(owner, methodName)) {
            throw new NotATestMethodException("'" + fullyQualifiedName + "' is a field, not a test method.");
        }
        throw new UnresolvableNameException("Cannot load '" + fullyQualifiedName + "': " + owner.getName() + " has no member '" + methodName + "'.");
    }

    private static Class<?> findMemberClass(Class<?> owner, String simpleName) {
        for (Class<?> current = owner; current != null; current = current.getSuperclass()) {
            for (Class<?> memberClass : current.getDeclaredClasses()) {
                if (memberClass.getSimpleName().equals(simpleName)) {
                    return memberClass;
                }
            }
        }
        return null;
    }

    private static boolean hasField(Class<?> owner, String name) {
        for (Class<?> current = owner; current != null; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isTestCaseClass(Class<?> testClass) {
        if (!TestCase.class.isAssignableFrom(testClass)
                || !Modifier.isPublic(testClass.getModifiers())
                || Modifier.isAbstract(testClass.getModifiers())) {
            return false;
        }
        try {
            TestSuite.getTestConstructor(testClass);
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static TestCase instantiate(Class<?> testClass, String methodName, String fullyQualifiedName) throws CaseInstantiationException {
        try {
            Constructor<?> constructor = TestSuite.getTestConstructor(testClass);
            TestCase testCase;
            if (constructor.getParameterCount() == 0) {
                testCase = (TestCase) constructor.newInstance();
                testCase.setName(methodName);
            } else {
                testCase = (TestCase) constructor.newInstance(methodName);
            }
            return testCase;
        } catch (InvocationTargetException e) {
            throw new CaseInstantiationException("Cannot instantiate '" + fullyQualifiedName + "': constructor threw " + e.getCause(), e.getCause());
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException | ExceptionInInitializerError e) {
            throw new CaseInstantiationException("Cannot instantiate '" + fullyQualifiedName + "': " + e, e);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class loader: " + this.classLoader + " }";
    }
}
