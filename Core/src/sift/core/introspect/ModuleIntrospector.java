package sift.core.introspect;

import sift.core.exception.ModuleNotFoundException;
import sift.core.type.PackageName;

/**
 * Discovers the classes of a module, and the methods of each class, without running any of the module's code.
 *
 * The structure of a module is implementation-specific.
 */
public interface ModuleIntrospector {

    /**
     * Returns the classes declared by the module {@code packageName.module}, or by {@code module} if there is no package.
     *
     * @param packageName The package the module lives in.
     * @param module The module name.
     * @return the module's contents.
     * @throws ModuleNotFoundException if the module cannot be located.
     */
    public ModuleInfo introspect(PackageName packageName, String module) throws ModuleNotFoundException;
}
