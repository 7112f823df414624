package sift.core.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import sift.core.exception.ParseException;
import sift.core.selection.Granularity;
import sift.core.type.PackageName;
import sift.core.util.Logger;
import sift.core.util.ObjectChecker;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A class that is used to parse a test-selection configuration that has been deserialized into JSON.
 *
 * The expected structure is:
 *
 * <pre>
 * { "test": { "suites": [ suite name, ... ] },
 *   "suites": { suite name: { "package": ..., "max_workers": ..., "groups": { group key: { "granularity": ...,
 *       "modules" | "classes" | "methods": [...], "except_classes": [...], "except_methods": [...], "disable": ... } } } } }
 * </pre>
 *
 * Only the suites listed under {@code test.suites} are parsed.
 */
public final class JsonConfigParser {
    private static final Logger LOGGER = Logger.forClass(JsonConfigParser.class);
    private static final String TEST_KEY = "test";
    private static final String SUITES_KEY = "suites";
    private static final String PACKAGE_KEY = "package";
    private static final String MAX_WORKERS_KEY = "max_workers";
    private static final String GROUPS_KEY = "groups";
    private static final String GRANULARITY_KEY = "granularity";
    private static final String MODULES_KEY = "modules";
    private static final String CLASSES_KEY = "classes";
    private static final String METHODS_KEY = "methods";
    private static final String EXCEPT_CLASSES_KEY = "except_classes";
    private static final String EXCEPT_METHODS_KEY = "except_methods";
    private static final String DISABLE_KEY = "disable";

    /**
     * Parses the given JSON text.
     *
     * @param config The configuration as JSON text.
     * @return the parsed configuration.
     * @throws ParseException if the text is not JSON or the configuration is not structured as expected.
     */
    public TestConfig parse(String config) throws ParseException {
        ObjectChecker.assertNonNull(config);

        JsonElement parsedConfig;
        try {
            parsedConfig = JsonParser.parseString(config);
        } catch (JsonParseException e) {
            throw new ParseException(createParseFailureMessage("malformed JSON: " + e.getMessage()));
        }
        if (!parsedConfig.isJsonObject()) {
            throw new ParseException(createParseFailureMessage("configuration is not a JSON object"));
        }
        return parse(parsedConfig.getAsJsonObject());
    }

    /**
     * Parses the given configuration.
     *
     * @param config The deserialized configuration.
     * @return the parsed configuration.
     * @throws ParseException if the configuration is not structured as expected.
     */
    public TestConfig parse(JsonObject config) throws ParseException {
        ObjectChecker.assertNonNull(config);

        List<String> suiteNames = parseAsStringList(parseAsJsonObject(config, TEST_KEY), SUITES_KEY);
        JsonObject suitesJson = parseAsJsonObject(config, SUITES_KEY);

        Map<String, SuiteConfig> suites = new LinkedHashMap<>();
        for (String suiteName : suiteNames) {
            if (!suitesJson.has(suiteName)) {
                throw new ParseException(createParseFailureMessage("unknown suite '" + suiteName + "' in " + TEST_KEY + "." + SUITES_KEY));
            }
            if (!suites.containsKey(suiteName)) {
                suites.put(suiteName, parseSuite(suiteName, parseAsJsonObject(suitesJson, suiteName)));
            }
        }

        TestConfig testConfig = new TestConfig(suiteNames, suites);
        LOGGER.log("Parsed test config successfully: " + testConfig);
        return testConfig;
    }

    private static SuiteConfig parseSuite(String suiteName, JsonObject suiteJson) throws ParseException {
        PackageName packageName = PackageName.NONE;
        if (suiteJson.has(PACKAGE_KEY) && !suiteJson.get(PACKAGE_KEY).isJsonNull()) {
            packageName = PackageName.of(parseAsString(suiteJson, PACKAGE_KEY));
        }

        int maxWorkers = SuiteConfig.DEFAULT_MAX_WORKERS;
        if (suiteJson.has(MAX_WORKERS_KEY)) {
            maxWorkers = parseAsInt(suiteJson, MAX_WORKERS_KEY);
            if (maxWorkers < 1) {
                throw new ParseException(createParseFailureMessage("expected " + MAX_WORKERS_KEY + " of suite '" + suiteName + "' to be at least 1 but was: " + maxWorkers));
            }
        }

        List<Group> groups = new ArrayList<>();
        JsonObject groupsJson = parseAsJsonObject(suiteJson, GROUPS_KEY);
        for (Map.Entry<String, JsonElement> groupEntry : groupsJson.entrySet()) {
            if (!groupEntry.getValue().isJsonObject()) {
                throw new ParseException(createParseFailureMessage("expected group '" + groupEntry.getKey() + "' to be a JSON Object"));
            }
            groups.add(parseGroup(groupEntry.getKey(), groupEntry.getValue().getAsJsonObject()));
        }
        return new SuiteConfig(packageName, maxWorkers, groups);
    }

    private static Group parseGroup(String key, JsonObject groupJson) throws ParseException {
        if (groupJson.has(DISABLE_KEY) && parseAsBoolean(groupJson, DISABLE_KEY)) {
            return Group.disabled(key);
        }

        String granularity = parseAsString(groupJson, GRANULARITY_KEY);
        Group.Builder builder = Group.Builder.newBuilder()
                .setKey(key)
                .setGranularity(granularity);

        // An unknown granularity has no target key, the resolver is the one to reject it.
        String targetsKey = targetsKeyFor(Granularity.fromString(granularity));
        builder.setTargets(targetsKey == null ? new ArrayList<>() : parseAsStringList(groupJson, targetsKey));

        if (groupJson.has(EXCEPT_CLASSES_KEY)) {
            builder.setExceptClasses(parseAsStringList(groupJson, EXCEPT_CLASSES_KEY));
        }
        if (groupJson.has(EXCEPT_METHODS_KEY)) {
            builder.setExceptMethods(parseAsStringList(groupJson, EXCEPT_METHODS_KEY));
        }
        return builder.build();
    }

    private static String targetsKeyFor(Granularity granularity) {
        if (granularity == Granularity.MODULE) {
            return MODULES_KEY;
        } else if (granularity == Granularity.CLASS) {
            return CLASSES_KEY;
        } else if (granularity == Granularity.METHOD) {
            return METHODS_KEY;
        } else {
            return null;
        }
    }

    private static String createParseFailureMessage(String cause) {
        return "Failed to parse test config: " + cause;
    }

    private static boolean parseAsBoolean(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be a Boolean"));
        }
        return element.getAsBoolean();
    }

    private static int parseAsInt(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonPrimitive() || element.getAsJsonPrimitive().isBoolean()) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be an Integer"));
        }
        try {
            // Fractions truncate toward zero, values outside the int range are rejected rather than wrapped.
            return element.getAsBigDecimal().setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be an Integer but was: " + element.getAsString()));
        }
    }

    private static String parseAsString(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be a String"));
        }
        return element.getAsString();
    }

    private static List<String> parseAsStringList(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonArray()) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be a JSON Array"));
        }
        JsonArray array = element.getAsJsonArray();
        List<String> strings = new ArrayList<>(array.size());
        for (JsonElement item : array) {
            if (!item.isJsonPrimitive() || !item.getAsJsonPrimitive().isString()) {
                throw new ParseException(createParseFailureMessage("expected every element of " + attribute + " to be a String"));
            }
            strings.add(item.getAsString());
        }
        return strings;
    }

    private static JsonObject parseAsJsonObject(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonObject()) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be a JSON Object"));
        }
        return element.getAsJsonObject();
    }

    private static JsonElement getElementFromAttribute(JsonObject json, String attribute) throws ParseException {
        if (!json.has(attribute)) {
            throw new ParseException(createParseFailureMessage("missing " + attribute));
        }
        return json.get(attribute);
    }
}
