package sift.core.util;

/**
 * A simple logging utility whose regular messages can be enabled or disabled globally.
 *
 * Regular messages go to stdout, warnings go to stderr. Warnings are always emitted: disabling the loggers silences
 * progress messages, not the problems an operator has to act on.
 */
public final class Logger {
    private static boolean globalEnabled = true;
    private final String className;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getName());
    }

    /**
     * Globally disables the regular messages of all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables the regular messages of all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    /**
     * Logs the specified message to stdout if logging is enabled.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (globalEnabled) {
            System.out.println(this.className + ": " + message);
        }
    }

    /**
     * Logs the specified warning to stderr.
     *
     * @param message The warning to log.
     */
    public void warn(String message) {
        System.err.println(this.className + ": [WARN] " + message);
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled (global): " + globalEnabled + " }";
    }
}
