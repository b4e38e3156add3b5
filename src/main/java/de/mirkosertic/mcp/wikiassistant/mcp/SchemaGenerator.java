package de.mirkosertic.mcp.wikiassistant.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Generates JSON Schema from Java record classes for MCP tool definitions.
 * <p>
 * Components annotated with {@link Nullable} are optional, everything else is required.
 * Enum components are rendered as lowercase string enums, matching how the tools parse them.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    /**
     * Generate a JsonSchema from a record class.
     *
     * @param recordClass the request record of a tool
     * @return a JsonSchema suitable for MCP tool inputSchema
     */
    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Generate an empty schema for tools that take no parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    // @Nullable is a type-use annotation, it sits on the component's type
    private static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();

        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
            if (description.examples().length > 0) {
                schema.put("examples", List.of(description.examples()));
            }
        }

        final Type type = component.getGenericType();
        if (type instanceof Class<?> clazz) {
            addTypeSchema(schema, clazz);
        } else if (type instanceof ParameterizedType paramType) {
            addParameterizedTypeSchema(schema, paramType);
        } else {
            schema.put("type", "string");
        }
        return schema;
    }

    private static void addTypeSchema(final Map<String, Object> schema, final Class<?> clazz) {
        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isEnum()) {
            schema.put("type", "string");
            final List<String> enumValues = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                enumValues.add(((Enum<?>) constant).name().toLowerCase(Locale.ROOT));
            }
            schema.put("enum", enumValues);
        } else if (clazz.isRecord()) {
            schema.put("type", "object");
            final Map<String, Object> nestedProperties = new LinkedHashMap<>();
            for (final RecordComponent component : clazz.getRecordComponents()) {
                nestedProperties.put(component.getName(), propertySchema(component));
            }
            schema.put("properties", nestedProperties);
        } else {
            schema.put("type", "object");
        }
    }

    private static void addParameterizedTypeSchema(final Map<String, Object> schema,
            final ParameterizedType paramType) {
        if (!(paramType.getRawType() instanceof Class<?> rawClass)) {
            schema.put("type", "object");
            return;
        }
        if (List.class.isAssignableFrom(rawClass) || Set.class.isAssignableFrom(rawClass)) {
            schema.put("type", "array");
            final Type[] typeArgs = paramType.getActualTypeArguments();
            final Map<String, Object> itemSchema = new LinkedHashMap<>();
            if (typeArgs.length > 0 && typeArgs[0] instanceof Class<?> itemClass) {
                addTypeSchema(itemSchema, itemClass);
            } else {
                itemSchema.put("type", "object");
            }
            schema.put("items", itemSchema);
        } else if (Map.class.isAssignableFrom(rawClass)) {
            schema.put("type", "object");
            schema.put("additionalProperties", true);
        } else {
            schema.put("type", "object");
        }
    }
}
