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

import me.golemcore.toolexec.domain.model.ValidationError;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates values against the JSON-Schema subset used by tool manifests:
 * {@code type}, {@code properties}, {@code required},
 * {@code additionalProperties}, {@code items}, {@code minItems},
 * {@code maxItems}, {@code enum}, {@code minimum}, {@code maximum},
 * {@code minLength}, {@code maxLength}, {@code pattern} and
 * {@code format: date-time}. Unknown keywords are ignored.
 */
@Component
public class SchemaValidator {

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public List<ValidationError> validate(Object value, Map<String, Object> schema) {
        List<ValidationError> errors = new ArrayList<>();
        if (schema != null && !schema.isEmpty()) {
            validate("$", value, schema, errors);
        }
        return errors;
    }

    static List<String> declaredTypes(Map<String, Object> schema) {
        Object type = schema.get("type");
        if (type instanceof String s) {
            return List.of(s);
        }
        if (type instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    private void validate(String path, Object value, Map<String, Object> schema, List<ValidationError> errors) {
        List<String> types = declaredTypes(schema);
        if (!types.isEmpty() && types.stream().noneMatch(type -> matchesType(value, type))) {
            errors.add(new ValidationError(path, "expected " + String.join("|", types) + " but got " + typeOf(value)));
            return;
        }

        Object allowed = schema.get("enum");
        if (allowed instanceof List<?> options && options.stream().noneMatch(option -> sameValue(option, value))) {
            errors.add(new ValidationError(path, "value not in enum " + options));
        }

        if (value instanceof String s) {
            validateString(path, s, schema, errors);
        } else if (value instanceof Number n) {
            validateNumber(path, n, schema, errors);
        } else if (value instanceof Map<?, ?> map) {
            validateObject(path, (Map<String, Object>) map, schema, errors);
        } else if (value instanceof List<?> list) {
            validateArray(path, list, schema, errors);
        }
    }

    private void validateString(String path, String value, Map<String, Object> schema, List<ValidationError> errors) {
        Integer minLength = intKeyword(schema, "minLength");
        if (minLength != null && value.length() < minLength) {
            errors.add(new ValidationError(path, "length " + value.length() + " is below minLength " + minLength));
        }
        Integer maxLength = intKeyword(schema, "maxLength");
        if (maxLength != null && value.length() > maxLength) {
            errors.add(new ValidationError(path, "length " + value.length() + " exceeds maxLength " + maxLength));
        }
        Object pattern = schema.get("pattern");
        if (pattern instanceof String regex) {
            Pattern compiled = compile(regex);
            if (compiled == null) {
                errors.add(new ValidationError(path, "schema pattern is not a valid regular expression"));
            } else if (!compiled.matcher(value).find()) {
                errors.add(new ValidationError(path, "does not match pattern " + regex));
            }
        }
        if ("date-time".equals(schema.get("format")) && !isDateTime(value)) {
            errors.add(new ValidationError(path, "is not an ISO-8601 date-time"));
        }
    }

    private void validateNumber(String path, Number value, Map<String, Object> schema, List<ValidationError> errors) {
        BigDecimal actual = toDecimal(value);
        Object minimum = schema.get("minimum");
        if (minimum instanceof Number min && actual.compareTo(toDecimal(min)) < 0) {
            errors.add(new ValidationError(path, value + " is below minimum " + min));
        }
        Object maximum = schema.get("maximum");
        if (maximum instanceof Number max && actual.compareTo(toDecimal(max)) > 0) {
            errors.add(new ValidationError(path, value + " exceeds maximum " + max));
        }
    }

    @SuppressWarnings("unchecked")
    private void validateObject(String path, Map<String, Object> value, Map<String, Object> schema,
            List<ValidationError> errors) {
        Object required = schema.get("required");
        if (required instanceof List<?> names) {
            for (Object name : names) {
                if (!value.containsKey(String.valueOf(name))) {
                    errors.add(new ValidationError(path + "." + name, "is required"));
                }
            }
        }

        Object propertiesNode = schema.get("properties");
        Map<String, Object> properties = propertiesNode instanceof Map<?, ?> p
                ? (Map<String, Object>) p
                : Map.of();
        Object additional = schema.get("additionalProperties");

        for (Map.Entry<String, Object> entry : value.entrySet()) {
            String childPath = path + "." + entry.getKey();
            Object childSchema = properties.get(entry.getKey());
            if (childSchema instanceof Map<?, ?> cs) {
                validate(childPath, entry.getValue(), (Map<String, Object>) cs, errors);
            } else if (Boolean.FALSE.equals(additional)) {
                errors.add(new ValidationError(childPath, "additional property not allowed"));
            } else if (additional instanceof Map<?, ?> as) {
                validate(childPath, entry.getValue(), (Map<String, Object>) as, errors);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void validateArray(String path, List<?> value, Map<String, Object> schema, List<ValidationError> errors) {
        Integer minItems = intKeyword(schema, "minItems");
        if (minItems != null && value.size() < minItems) {
            errors.add(new ValidationError(path, value.size() + " items, minItems is " + minItems));
        }
        Integer maxItems = intKeyword(schema, "maxItems");
        if (maxItems != null && value.size() > maxItems) {
            errors.add(new ValidationError(path, value.size() + " items, maxItems is " + maxItems));
        }
        Object items = schema.get("items");
        if (items instanceof Map<?, ?> itemSchema) {
            for (int i = 0; i < value.size(); i++) {
                validate(path + "[" + i + "]", value.get(i), (Map<String, Object>) itemSchema, errors);
            }
        }
    }

    private static boolean matchesType(Object value, String type) {
        return switch (type) {
        case "null" -> value == null;
        case "string" -> value instanceof String;
        case "boolean" -> value instanceof Boolean;
        case "object" -> value instanceof Map;
        case "array" -> value instanceof List;
        case "number" -> value instanceof Number;
        case "integer" -> value instanceof Number n && isIntegral(n);
        default -> true;
        };
    }

    private static boolean isIntegral(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger) {
            return true;
        }
        BigDecimal decimal = toDecimal(n);
        return decimal.stripTrailingZeros().scale() <= 0;
    }

    private static String typeOf(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number n) {
            return isIntegral(n) ? "integer" : "number";
        }
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof List) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }

    private static boolean sameValue(Object expected, Object actual) {
        if (expected instanceof Number e && actual instanceof Number a) {
            return toDecimal(e).compareTo(toDecimal(a)) == 0;
        }
        return Objects.equals(expected, actual);
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return new BigDecimal(n.toString());
    }

    private static Integer intKeyword(Map<String, Object> schema, String keyword) {
        Object value = schema.get(keyword);
        return value instanceof Number n ? n.intValue() : null;
    }

    private static boolean isDateTime(String value) {
        try {
            OffsetDateTime.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private Pattern compile(String regex) {
        Pattern cached = patternCache.get(regex);
        if (cached != null) {
            return cached;
        }
        try {
            Pattern compiled = Pattern.compile(regex);
            patternCache.put(regex, compiled);
            return compiled;
        } catch (PatternSyntaxException e) {
            return null;
        }
    }
}
