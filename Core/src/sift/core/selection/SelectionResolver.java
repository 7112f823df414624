package sift.core.selection;

import sift.core.config.Group;
import sift.core.exception.ExclusionNotFoundException;
import sift.core.exception.ModuleNotFoundException;
import sift.core.exception.NameFormatException;
import sift.core.exception.SelectionException;
import sift.core.exception.UnreachableException;
import sift.core.exception.ValidationException;
import sift.core.introspect.ModuleIntrospector;
import sift.core.name.ClassName;
import sift.core.name.MethodName;
import sift.core.name.NameParser;
import sift.core.tree.NameTree;
import sift.core.type.PackageName;
import sift.core.type.Result;
import sift.core.util.Logger;
import sift.core.util.ObjectChecker;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves a single group into the fully qualified names of the test methods it selects.
 *
 * Module and class groups are resolved by introspecting their modules into a fresh {@link NameTree}, removing the
 * group's exclusions from it and flattening what is left. Method groups name their methods directly.
 */
public final class SelectionResolver {
    private static final Logger LOGGER = Logger.forClass(SelectionResolver.class);
    private final ModuleIntrospector introspector;
    private final String methodPrefix;

    public SelectionResolver(ModuleIntrospector introspector, String methodPrefix) {
        ObjectChecker.assertNonNull(introspector, methodPrefix);
        this.introspector = introspector;
        this.methodPrefix = methodPrefix;
    }

    /**
     * Returns the fully qualified names of the test methods selected by the given group.
     *
     * A disabled group selects nothing and is not validated in any way.
     *
     * @param group The group to resolve.
     * @param packageName The package of the suite the group belongs to.
     * @return the selected method names.
     * @throws ValidationException if the group's granularity is not module, class or method.
     * @throws NameFormatException if a target or exclusion is not a well-formed dotted name.
     * @throws ModuleNotFoundException if a module cannot be located.
     * @throws ExclusionNotFoundException if an exclusion names something that was not selected.
     */
    public Set<String> resolve(Group group, PackageName packageName) throws SelectionException {
        ObjectChecker.assertNonNull(group, packageName);

        if (group.isDisabled) {
            LOGGER.log("Skipping disabled group '" + group.key + "'.");
            return Collections.emptySet();
        }

        Granularity granularity = Granularity.fromString(group.granularity);
        if (granularity == null) {
            throw new ValidationException("Granularity of group '" + group.key + "' must be in " + Granularity.legalNames() + " but was: '" + group.granularity + "'.");
        }

        switch (granularity) {
            case MODULE:
                return resolveModules(group, packageName);
            case CLASS:
                return resolveClasses(group, packageName);
            case METHOD:
                return resolveMethods(group, packageName);
            default:
                throw new UnreachableException(granularity);
        }
    }

    private Set<String> resolveModules(Group group, PackageName packageName) throws SelectionException {
        Set<String> moduleNames = new LinkedHashSet<>(group.getTargets());
        NameTree tree = NameTree.fromModules(this.introspector, this.methodPrefix, packageName, moduleNames, Collections.emptySet());

        excludeClasses(tree, group.getExceptClasses());
        excludeMethods(tree, group.getExceptMethods());
        return tree.flatten(packageName);
    }

    private Set<String> resolveClasses(Group group, PackageName packageName) throws SelectionException {
        Set<String> classNames = new LinkedHashSet<>(group.getTargets());
        Set<String> moduleNames = new LinkedHashSet<>();
        for (String className : classNames) {
            moduleNames.add(NameParser.parseClassName(className).module);
        }

        if (!group.getExceptClasses().isEmpty()) {
            LOGGER.warn("Ignoring " + group.getExceptClasses().size() + " excluded class(es) of class group '" + group.key + "': only the listed classes are selected.");
        }

        NameTree tree = NameTree.fromModules(this.introspector, this.methodPrefix, packageName, moduleNames, classNames);
        excludeMethods(tree, group.getExceptMethods());
        return tree.flatten(packageName);
    }

    private Set<String> resolveMethods(Group group, PackageName packageName) throws SelectionException {
        if (!group.getExceptClasses().isEmpty() || !group.getExceptMethods().isEmpty()) {
            LOGGER.warn("Ignoring exclusions of method group '" + group.key + "': only the listed methods are selected.");
        }

        Set<String> methodNames = new LinkedHashSet<>();
        for (String methodName : new LinkedHashSet<>(group.getTargets())) {
            NameParser.parseMethodName(methodName);
            methodNames.add(packageName.qualify(methodName));
        }
        return methodNames;
    }

    private static void excludeClasses(NameTree tree, List<String> exceptClasses) throws NameFormatException, ExclusionNotFoundException {
        for (String exceptClass : new LinkedHashSet<>(exceptClasses)) {
            ClassName className = NameParser.parseClassName(exceptClass);
            throwIfError(tree.deleteClass(className.module, className.className));
        }
    }

    private static void excludeMethods(NameTree tree, List<String> exceptMethods) throws NameFormatException, ExclusionNotFoundException {
        for (String exceptMethod : new LinkedHashSet<>(exceptMethods)) {
            MethodName methodName = NameParser.parseMethodName(exceptMethod);
            throwIfError(tree.deleteMethod(methodName.module, methodName.className, methodName.method));
        }
    }

    private static void throwIfError(Result<String> result) throws ExclusionNotFoundException {
        if (!result.isSuccess()) {
            throw new ExclusionNotFoundException(result.getError());
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { method prefix: " + this.methodPrefix + " }";
    }
}
