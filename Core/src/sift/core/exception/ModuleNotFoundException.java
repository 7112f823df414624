package sift.core.exception;

/**
 * Thrown when a module named by the configuration cannot be located.
 */
public final class ModuleNotFoundException extends SelectionException {
    private final String moduleName;

    public ModuleNotFoundException(String moduleName, String message) {
        super(message);
        this.moduleName = moduleName;
    }

    public ModuleNotFoundException(String moduleName, String message, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
    }

    /**
     * Returns the fully qualified name of the module that could not be found.
     */
    public String getModuleName() {
        return this.moduleName;
    }
}
