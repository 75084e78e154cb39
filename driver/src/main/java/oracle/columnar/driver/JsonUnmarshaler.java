/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import oracle.columnar.driver.util.CheckNull;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

/**
 * The default {@link Unmarshaler}. A row is parsed as JSON into plain Java
 * values: an object becomes a {@code Map<String, Object>} that keeps field
 * order, an array a {@code List<Object>}, and scalars become
 * {@link String}, {@link Boolean}, {@link Integer}, {@link Long},
 * {@link BigInteger}, {@link Double} or null.
 * <p>
 * The parsed value is returned if it is an instance of the requested type.
 * Numbers are converted when {@code Integer}, {@code Long}, {@code Double}
 * or {@code BigDecimal} is requested. Requesting {@code byte[]} or
 * {@code String} for a value of another kind returns the raw row.
 */
public class JsonUnmarshaler implements Unmarshaler {

    private static final JsonFactory factory = new JsonFactory();

    @Override
    public <T> T unmarshal(byte[] data, Class<T> type) {
        CheckNull.requireNonNullIAE(data,
                                    "JsonUnmarshaler: data must be non-null");
        CheckNull.requireNonNullIAE(type,
                                    "JsonUnmarshaler: type must be non-null");

        if (type == byte[].class) {
            return type.cast(data.clone());
        }

        Object value;
        try (JsonParser jp = factory.createParser(data)) {
            JsonToken token = jp.nextToken();
            if (token == null) {
                throw new IllegalArgumentException(
                    "JSON parse failed: no content");
            }
            value = readValue(jp, token);
            if (jp.nextToken() != null) {
                throw new IllegalArgumentException(
                    "JSON parse failed: trailing content after value");
            }
        } catch (IOException ioe) {
            throw new IllegalArgumentException("JSON parse failed: " + ioe, ioe);
        }
        return convert(value, data, type);
    }

    private static <T> T convert(Object value, byte[] data, Class<T> type) {
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (value instanceof Number) {
            Number num = (Number) value;
            if (type == Long.class) {
                return type.cast(num.longValue());
            }
            if (type == Integer.class) {
                return type.cast(num.intValue());
            }
            if (type == Double.class) {
                return type.cast(num.doubleValue());
            }
            if (type == BigDecimal.class) {
                return type.cast(new BigDecimal(num.toString()));
            }
        }
        if (type == String.class) {
            return type.cast(new String(data, StandardCharsets.UTF_8));
        }
        throw new IllegalArgumentException(
            "Cannot unmarshal JSON " + value.getClass().getSimpleName() +
            " into " + type.getName());
    }

    /*
     * Reads the value starting at the current token.
     */
    private static Object readValue(JsonParser jp, JsonToken token)
        throws IOException {

        switch (token) {
        case START_OBJECT: {
            Map<String, Object> map = new LinkedHashMap<>();
            while (jp.nextToken() == JsonToken.FIELD_NAME) {
                String name = jp.currentName();
                map.put(name, readValue(jp, jp.nextToken()));
            }
            return map;
        }
        case START_ARRAY: {
            List<Object> list = new ArrayList<>();
            JsonToken t;
            while ((t = jp.nextToken()) != JsonToken.END_ARRAY) {
                list.add(readValue(jp, t));
            }
            return list;
        }
        case VALUE_STRING:
            return jp.getText();
        case VALUE_NUMBER_INT:
        case VALUE_NUMBER_FLOAT:
            return jp.getNumberValue();
        case VALUE_TRUE:
            return Boolean.TRUE;
        case VALUE_FALSE:
            return Boolean.FALSE;
        case VALUE_NULL:
            return null;
        default:
            throw new IllegalArgumentException(
                "JSON parse failed: unexpected token " + token);
        }
    }
}
