package warehouse.bridge.dispatch;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.mcp.base.MCPTool;

/**
 * Checks tool arguments against the tool's input schema.
 * Understands the subset of JSON Schema the tool definitions use: object properties,
 * <code>required</code>, <code>additionalProperties: false</code>, the primitive types,
 * <code>enum</code>, <code>minimum</code>/<code>maximum</code> and array <code>items</code>.
 */
public final class ParameterValidator {

    private ParameterValidator() {
    }

    /**
     * @throws ToolInvocationException with kind ValidationError naming the first offending argument
     */
    public static void validate(MCPTool tool, JsonObject arguments) {
        validateObject(tool.getInputSchema(), arguments, "");
    }

    private static void validateObject(JsonObject schema, JsonObject value, String path) {
        JsonObject properties = schema.getJsonObject("properties", new JsonObject());
        JsonArray required = schema.getJsonArray("required", new JsonArray());

        for (int i = 0; i < required.size(); i++) {
            String name = required.getString(i);
            Object argument = value.getValue(name);
            if (argument == null) {
                throw ToolInvocationException.validation("Missing required argument '" + path + name + "'");
            }
            if (argument instanceof String && ((String) argument).trim().isEmpty()) {
                throw ToolInvocationException.validation("Argument '" + path + name + "' must not be empty");
            }
        }

        boolean closed = Boolean.FALSE.equals(schema.getValue("additionalProperties"));
        for (String name : value.fieldNames()) {
            JsonObject property = properties.getJsonObject(name);
            if (property == null) {
                if (closed) {
                    throw ToolInvocationException.validation("Unknown argument '" + path + name + "'");
                }
                continue;
            }
            Object argument = value.getValue(name);
            if (argument != null) {
                validateValue(property, argument, path + name);
            }
        }
    }

    private static void validateValue(JsonObject schema, Object value, String path) {
        String type = schema.getString("type");
        if (type != null) {
            switch (type) {
                case "string":
                    require(value instanceof String, path, "a string");
                    break;
                case "integer":
                    require(isInteger(value), path, "an integer");
                    break;
                case "number":
                    require(value instanceof Number, path, "a number");
                    break;
                case "boolean":
                    require(value instanceof Boolean, path, "true or false");
                    break;
                case "object":
                    require(value instanceof JsonObject, path, "an object");
                    if (schema.containsKey("properties")) {
                        validateObject(schema, (JsonObject) value, path + ".");
                    }
                    break;
                case "array":
                    require(value instanceof JsonArray, path, "an array");
                    JsonObject items = schema.getJsonObject("items");
                    if (items != null) {
                        JsonArray array = (JsonArray) value;
                        for (int i = 0; i < array.size(); i++) {
                            Object item = array.getValue(i);
                            if (item == null) {
                                throw ToolInvocationException.validation("Argument '" + path + "[" + i + "]' must not be null");
                            }
                            validateValue(items, item, path + "[" + i + "]");
                        }
                    }
                    break;
                default:
                    break;
            }
        }

        JsonArray allowed = schema.getJsonArray("enum");
        if (allowed != null && !allowed.contains(value)) {
            throw ToolInvocationException.validation("Argument '" + path + "' must be one of " + allowed.encode()
                + ", got: " + value);
        }

        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            Number minimum = schema.getNumber("minimum");
            Number maximum = schema.getNumber("maximum");
            if (minimum != null && number < minimum.doubleValue()) {
                throw ToolInvocationException.validation("Argument '" + path + "' must be at least " + minimum
                    + ", got: " + value);
            }
            if (maximum != null && number > maximum.doubleValue()) {
                throw ToolInvocationException.validation("Argument '" + path + "' must be at most " + maximum
                    + ", got: " + value);
            }
        }
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static void require(boolean condition, String path, String expected) {
        if (!condition) {
            throw ToolInvocationException.validation("Argument '" + path + "' must be " + expected);
        }
    }

    /**
     * Integer argument value, or <code>fallback</code> when absent. Call after {@link #validate}.
     */
    public static int intArgument(JsonObject arguments, String name, int fallback) {
        Object value = arguments.getValue(name);
        if (!(value instanceof Number)) {
            return fallback;
        }
        long number = ((Number) value).longValue();
        if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            throw ToolInvocationException.validation("Argument '" + name + "' is out of range: " + value);
        }
        return (int) number;
    }

    public static boolean booleanArgument(JsonObject arguments, String name) {
        return Boolean.TRUE.equals(arguments.getValue(name));
    }
}
