package sift.core.introspect;

import sift.core.util.ObjectChecker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The statically discovered classes of a single module.
 */
public final class ModuleInfo {
    private final String qualifiedName;
    private final Map<String, ClassInfo> classes = new LinkedHashMap<>();

    public ModuleInfo(String qualifiedName, Collection<ClassInfo> classes) {
        ObjectChecker.assertNonNull(qualifiedName, classes);
        this.qualifiedName = qualifiedName;
        for (ClassInfo classInfo : classes) {
            this.classes.put(classInfo.getName(), classInfo);
        }
    }

    /**
     * Returns the fully qualified name the module was found under.
     */
    public String getQualifiedName() {
        return this.qualifiedName;
    }

    /**
     * Returns the module's classes keyed by simple name.
     */
    public Map<String, ClassInfo> getClasses() {
        return Collections.unmodifiableMap(this.classes);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { module: " + this.qualifiedName + ", classes: " + this.classes.keySet() + " }";
    }
}
