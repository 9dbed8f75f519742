package com.deepansh.trader.action;

import com.deepansh.trader.model.WireEnum;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds the JSON schema of an action input record.
 *
 * Mapping:
 * - String → string, integral → integer, floating → number, Boolean → boolean
 * - WireEnum → string with "enum" of wire names
 * - Collection → array (items from the element type)
 * - anything else (Map, nested DTO) → object
 *
 * A component is required when its field carries @NotNull, @NotBlank or @NotEmpty.
 * Record component annotations reach the generated private field, which is where
 * they are read from.
 */
public final class ActionSchemaGenerator {

    private static final Map<Class<?>, Map<String, Object>> CACHE = new ConcurrentHashMap<>();

    private ActionSchemaGenerator() {}

    public static Map<String, Object> schemaFor(Class<?> inputType) {
        return CACHE.computeIfAbsent(inputType, ActionSchemaGenerator::generate);
    }

    private static Map<String, Object> generate(Class<?> inputType) {
        if (!inputType.isRecord()) {
            throw new IllegalArgumentException("Action input must be a record: " + inputType.getName());
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();

        for (RecordComponent component : inputType.getRecordComponents()) {
            Field field = fieldOf(inputType, component.getName());

            Map<String, Object> property = new LinkedHashMap<>(typeSchema(component.getGenericType()));
            ActionParam param = field.getAnnotation(ActionParam.class);
            if (param != null) {
                property.put("description", param.value());
            }
            properties.put(component.getName(), property);

            if (field.isAnnotationPresent(NotNull.class)
                    || field.isAnnotationPresent(NotBlank.class)
                    || field.isAnnotationPresent(NotEmpty.class)) {
                required.add(component.getName());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return Map.copyOf(schema);
    }

    private static Map<String, Object> typeSchema(Type type) {
        Class<?> raw = rawClass(type);

        if (raw == String.class) return Map.of("type", "string");
        if (raw == Integer.class || raw == int.class || raw == Long.class || raw == long.class) {
            return Map.of("type", "integer");
        }
        if (Number.class.isAssignableFrom(raw) || raw == double.class || raw == float.class) {
            return Map.of("type", "number");
        }
        if (raw == Boolean.class || raw == boolean.class) return Map.of("type", "boolean");

        if (raw.isEnum() && WireEnum.class.isAssignableFrom(raw)) {
            List<String> values = Arrays.stream(raw.getEnumConstants())
                    .map(c -> ((WireEnum) c).wireName())
                    .toList();
            return Map.of("type", "string", "enum", values);
        }

        if (Collection.class.isAssignableFrom(raw)) {
            Type element = type instanceof ParameterizedType p
                    ? p.getActualTypeArguments()[0]
                    : Object.class;
            return Map.of("type", "array", "items", typeSchema(element));
        }

        return Map.of("type", "object");
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) return c;
        if (type instanceof ParameterizedType p) return (Class<?>) p.getRawType();
        return Object.class;
    }

    private static Field fieldOf(Class<?> recordType, String name) {
        try {
            return recordType.getDeclaredField(name);
        } catch (NoSuchFieldException e) {
            throw new IllegalStateException("Record component without field: " + name, e);
        }
    }
}
