package sift.core.tree;

import sift.core.exception.ModuleNotFoundException;
import sift.core.introspect.ClassInfo;
import sift.core.introspect.ModuleInfo;
import sift.core.introspect.ModuleIntrospector;
import sift.core.type.PackageName;
import sift.core.type.Result;
import sift.core.util.Logger;
import sift.core.util.ObjectChecker;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A mutable index of discovered test names, three levels deep: module, class and method.
 *
 * A tree looks like:
 *
 *   mod1
 *     Cls1: testA, testB
 *     Cls2: testC
 *   mod2
 *     ...
 *
 * No module without classes and no class without methods is ever held: empty branches are never inserted and are pruned
 * as soon as a deletion empties them.
 *
 * A tree is owned by a single resolution pass and is not thread-safe.
 */
public final class NameTree {
    private static final Logger LOGGER = Logger.forClass(NameTree.class);
    private static final int METHOD_DEPTH = 3;
    private final Node root = new Node();

    private NameTree() {}

    /**
     * Returns a new, empty tree.
     */
    public static NameTree empty() {
        return new NameTree();
    }

    /**
     * Builds a new tree out of the given modules.
     *
     * Each module is introspected and every class it declares contributes its methods that start with the method
     * prefix. If a non-empty class filter is given, only classes whose {@code module.class} name is in the filter are
     * included. A class left with no matching methods is skipped.
     *
     * @param introspector The introspector that discovers the contents of each module.
     * @param methodPrefix The prefix a method name must start with to be a test.
     * @param packageName The package the modules live in.
     * @param moduleNames The modules to include.
     * @param filterClasses The {@code module.class} names to restrict the tree to, or an empty set for no restriction.
     * @return the tree.
     * @throws ModuleNotFoundException if any module cannot be located.
     */
    public static NameTree fromModules(ModuleIntrospector introspector, String methodPrefix, PackageName packageName, Set<String> moduleNames, Set<String> filterClasses) throws ModuleNotFoundException {
        ObjectChecker.assertNonNull(introspector, methodPrefix, packageName, moduleNames, filterClasses);

        NameTree tree = new NameTree();
        for (String moduleName : moduleNames) {
            ModuleInfo moduleInfo = introspector.introspect(packageName, moduleName);
            for (ClassInfo classInfo : moduleInfo.getClasses().values()) {
                if (!filterClasses.isEmpty() && !filterClasses.contains(moduleName + "." + classInfo.getName())) {
                    continue;
                }
                tree.insert(moduleName, classInfo.getName(), classInfo.methodsOf(methodPrefix));
            }
        }
        LOGGER.log("Built name tree from " + moduleNames.size() + " module(s) holding " + tree.size() + " method(s).");
        return tree;
    }

    /**
     * Inserts the given methods under the given module and class, creating either on demand.
     *
     * Nothing is inserted if there are no methods.
     *
     * @param module The module name.
     * @param className The class name.
     * @param methodNames The method names.
     */
    public void insert(String module, String className, Collection<String> methodNames) {
        ObjectChecker.assertNonNull(module, className);
        ObjectChecker.assertNoNullElements(methodNames);

        if (methodNames.isEmpty()) {
            return;
        }
        Node classNode = this.root.getOrCreateChild(module).getOrCreateChild(className);
        for (String methodName : methodNames) {
            classNode.getOrCreateChild(methodName);
        }
    }

    /**
     * Deletes the given class, and its module too if that leaves the module empty.
     *
     * Returns a successful result holding the deleted {@code module.class} name, or an error result naming the exact
     * identifier that was missing.
     *
     * @param module The module name.
     * @param className The class name.
     * @return the result of the deletion.
     */
    public Result<String> deleteClass(String module, String className) {
        ObjectChecker.assertNonNull(module, className);
        String longName = module + "." + className;

        Node moduleNode = this.root.children.get(module);
        if (moduleNode == null) {
            return Result.error("Cannot exclude '" + longName + "': '" + module + "' not found in modules list.");
        }
        if (moduleNode.children.remove(className) == null) {
            return Result.error("Cannot exclude '" + longName + "': '" + className + "' not found in '" + module + "'.");
        }
        this.root.pruneIfEmpty(module);
        return Result.successful(longName);
    }

    /**
     * Deletes the given method, then its class and its module if either is left empty.
     *
     * Returns a successful result holding the deleted {@code module.class.method} name, or an error result naming the
     * exact identifier that was missing.
     *
     * @param module The module name.
     * @param className The class name.
     * @param methodName The method name.
     * @return the result of the deletion.
     */
    public Result<String> deleteMethod(String module, String className, String methodName) {
        ObjectChecker.assertNonNull(module, className, methodName);
        String longName = module + "." + className + "." + methodName;

        Node moduleNode = this.root.children.get(module);
        if (moduleNode == null) {
            return Result.error("Cannot exclude '" + longName + "': '" + module + "' not found in modules list.");
        }
        Node classNode = moduleNode.children.get(className);
        if (classNode == null) {
            return Result.error("Cannot exclude '" + longName + "': '" + className + "' not found in '" + module + "'.");
        }
        if (classNode.children.remove(methodName) == null) {
            return Result.error("Cannot exclude '" + longName + "': '" + methodName + "' not found in '" + className + "'.");
        }
        moduleNode.pruneIfEmpty(className);
        this.root.pruneIfEmpty(module);
        return Result.successful(longName);
    }

    /**
     * Returns the fully qualified name of every method in the tree, {@code package.module.class.method} or
     * {@code module.class.method} if there is no package.
     *
     * @param packageName The package to prefix each name with.
     * @return the method names.
     */
    public Set<String> flatten(PackageName packageName) {
        ObjectChecker.assertNonNull(packageName);

        Set<String> dottedNames = new LinkedHashSet<>();
        for (Map.Entry<String, Node> module : this.root.children.entrySet()) {
            collectDottedNames(module.getValue(), packageName.qualify(module.getKey()), 1, dottedNames);
        }
        return dottedNames;
    }

    /**
     * Returns true if the tree holds the given method.
     */
    public boolean contains(String module, String className, String methodName) {
        Node moduleNode = this.root.children.get(module);
        Node classNode = (moduleNode == null) ? null : moduleNode.children.get(className);
        return (classNode != null) && classNode.children.containsKey(methodName);
    }

    /**
     * Returns true if the tree holds the given class.
     */
    public boolean contains(String module, String className) {
        Node moduleNode = this.root.children.get(module);
        return (moduleNode != null) && moduleNode.children.containsKey(className);
    }

    public boolean isEmpty() {
        return this.root.children.isEmpty();
    }

    /**
     * Returns the number of methods in the tree.
     */
    public int size() {
        int size = 0;
        for (Node moduleNode : this.root.children.values()) {
            for (Node classNode : moduleNode.children.values()) {
                size += classNode.children.size();
            }
        }
        return size;
    }

    private static void collectDottedNames(Node node, String prefix, int depth, Set<String> dottedNames) {
        if (depth == METHOD_DEPTH) {
            dottedNames.add(prefix);
            return;
        }
        for (Map.Entry<String, Node> child : node.children.entrySet()) {
            collectDottedNames(child.getValue(), prefix + "." + child.getKey(), depth + 1, dottedNames);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { modules: " + this.root.children.keySet() + ", num methods: " + size() + " }";
    }

    private static final class Node {
        private final Map<String, Node> children = new LinkedHashMap<>();

        private Node getOrCreateChild(String name) {
            return this.children.computeIfAbsent(name, k -> new Node());
        }

        private void pruneIfEmpty(String name) {
            Node child = this.children.get(name);
            if (child != null && child.children.isEmpty()) {
                this.children.remove(name);
            }
        }
    }
}
