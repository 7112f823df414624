package sift.client;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import sift.core.ConfigDriver;
import sift.core.config.SelectionConfig;
import sift.core.exception.SelectionException;
import sift.core.loader.LoadedSuite;
import sift.core.type.Result;
import sift.core.util.Logger;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single-use client that resolves and loads the suites of a test-selection configuration, lists them, and exits.
 * No test is run.
 */
public final class StandaloneClient {
    private static final Logger LOGGER = Logger.forClass(StandaloneClient.class);

    /**
     * We expect to be given the following arguments:
     *
     * args[0] = CONFIG
     * args[1..K] = each of the K dependencies
     *
     * The CONFIG argument is a path to a JSON test-selection configuration file.
     *
     * The K dependencies are each paths to either a directory of compiled .class files or a .jar file. They hold the test
     * modules named by the configuration. If none are given the client's own class path is used.
     *
     * The following system properties are optional: enable_logger (default false), method_prefix (default "test") and
     * strict (default true). When not strict, a suite that fails to load is listed as such and the others still load.
     *
     * @param args The program arguments.
     */
    public static void main(String[] args) {
        try {
            if (args == null || args.length < 1) {
                System.err.println(usage());
                System.exit(1);
            }

            if (!Boolean.parseBoolean(System.getProperty("enable_logger", "false"))) {
                Logger.globalDisable();
            }
            logArguments(args);

            SelectionConfig.Builder builder = SelectionConfig.Builder.newBuilder()
                    .setWhetherToFailOnAnySuiteError(Boolean.parseBoolean(System.getProperty("strict", "true")));
            String methodPrefix = System.getProperty("method_prefix");
            if (methodPrefix != null) {
                builder.setMethodPrefix(methodPrefix);
            }
            if (args.length > 1) {
                builder.setClassLoader(createClassLoader(args));
            }
            SelectionConfig config = builder.build();
            LOGGER.log("Selection config: " + config);

            JsonElement jsonConfig = JsonParser.parseString(new String(Files.readAllBytes(Paths.get(args[0])), StandardCharsets.UTF_8));
            if (!jsonConfig.isJsonObject()) {
                System.err.println("Config is not a JSON object: " + args[0]);
                System.exit(1);
            }

            ConfigDriver driver = ConfigDriver.withConfig(config);
            Map<String, Result<LoadedSuite>> suites;
            if (config.isStrict) {
                suites = new LinkedHashMap<>();
                for (Map.Entry<String, LoadedSuite> entry : driver.loadSuites(jsonConfig.getAsJsonObject()).entrySet()) {
                    suites.put(entry.getKey(), Result.successful(entry.getValue()));
                }
            } else {
                suites = driver.loadSuitesLeniently(jsonConfig.getAsJsonObject());
            }

            int numFailures = SuiteOutputter.outputter(System.out).output(suites);
            System.exit(numFailures == 0 ? 0 : 1);

        } catch (SelectionException e) {
            System.err.println("Failed to load test suites: " + e.getMessage());
            System.exit(1);
        } catch (IOException | JsonParseException e) {
            System.err.println("Failed to read config: " + e.getMessage());
            System.exit(1);
        } finally {
            LOGGER.log("Exiting.");
        }
    }

    private static ClassLoader createClassLoader(String[] args) throws MalformedURLException {
        int numDependencies = args.length - 1;
        LOGGER.log("Number of given dependencies: " + numDependencies);

        URL[] dependencyUrls = new URL[numDependencies];
        for (int i = 0; i < numDependencies; i++) {
            dependencyUrls[i] = new File(args[1 + i]).toURI().toURL();
        }
        return new URLClassLoader(dependencyUrls, StandaloneClient.class.getClassLoader());
    }

    private static void logArguments(String[] args) {
        LOGGER.log("ARGS ------------------------------------------------");
        for (String a : args) {
            LOGGER.log(a);
        }
        LOGGER.log("ARGS ------------------------------------------------\n");
    }

    private static String usage() {
        return StandaloneClient.class.getName()
                + " <config> [[dependency]...]"
                + "\n\tconfig: a path to the JSON test-selection configuration."
                + "\n\tdependency: a path to a .jar file or a directory of .class files holding the test modules.";
    }
}
