package me.golemcore.toolexec.validation;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Best-effort coercion of string values to the scalar type their schema
 * declares. A value that cannot be coerced is returned unchanged so the schema
 * check can report the precise mismatch.
 */
@Component
public class TypeCoercer {

    public Object coerce(Object value, Map<String, Object> schema) {
        if (value == null || schema == null || schema.isEmpty()) {
            return value;
        }
        List<String> types = SchemaValidator.declaredTypes(schema);

        if (value instanceof String s && !types.contains("string")) {
            return coerceString(s, types);
        }
        if (value instanceof Map<?, ?> map && (types.isEmpty() || types.contains("object"))) {
            return coerceObject(map, schema);
        }
        if (value instanceof List<?> list && (types.isEmpty() || types.contains("array"))) {
            return coerceArray(list, schema);
        }
        return value;
    }

    private Object coerceString(String raw, List<String> types) {
        String s = raw.trim();
        for (String type : types) {
            Object coerced = switch (type) {
            case "integer" -> toInteger(s);
            case "number" -> toNumber(s);
            case "boolean" -> toBoolean(s);
            default -> null;
            };
            if (coerced != null) {
                return coerced;
            }
        }
        return raw;
    }

    private static Object toInteger(String s) {
        try {
            long parsed = Long.parseLong(s);
            if (parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE) {
                return (int) parsed;
            }
            return parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Object toNumber(String s) {
        try {
            return new BigDecimal(s).doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Object toBoolean(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "false".equals(lower)) {
            return Boolean.valueOf(lower);
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private Object coerceObject(Map<?, ?> map, Map<String, Object> schema) {
        Object properties = schema.get("properties");
        Map<String, Object> propertySchemas = properties instanceof Map<?, ?> p ? (Map<String, Object>) p : Map.of();
        Object additional = schema.get("additionalProperties");
        Map<String, Object> additionalSchema = additional instanceof Map<?, ?> a ? (Map<String, Object>) a : null;

        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, child) -> {
            String name = String.valueOf(key);
            Object childSchema = propertySchemas.get(name);
            if (childSchema instanceof Map<?, ?> cs) {
                result.put(name, coerce(child, (Map<String, Object>) cs));
            } else if (additionalSchema != null) {
                result.put(name, coerce(child, additionalSchema));
            } else {
                result.put(name, child);
            }
        });
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object coerceArray(List<?> list, Map<String, Object> schema) {
        Object items = schema.get("items");
        if (!(items instanceof Map<?, ?> itemSchema)) {
            return list;
        }
        List<Object> result = new ArrayList<>(list.size());
        for (Object item : list) {
            result.add(coerce(item, (Map<String, Object>) itemSchema));
        }
        return result;
    }
}
