/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.serde;

import static oracle.columnar.driver.util.LogUtil.logFine;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import oracle.columnar.driver.MetadataParseException;
import oracle.columnar.driver.ops.QueryMetadata;
import oracle.columnar.driver.ops.QueryMetrics;
import oracle.columnar.driver.ops.QueryWarning;
import oracle.columnar.driver.util.DurationUtil;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;

/**
 * @hidden
 * Decodes the metadata that follows the rows of a query response:
 * <pre>
 * {
 *   "requestID": "...",
 *   "metrics": {
 *     "elapsedTime": "12.3ms", "executionTime": "11.9ms",
 *     "resultCount": 3, "resultSize": 129, "processedObjects": 3
 *   },
 *   "warnings": [ { "code": 1, "msg": "..." } ]
 * }
 * </pre>
 * Unknown fields are skipped. Missing fields, and fields set to null, take
 * their zero value.
 */
public class MetadataDecoder {

    private static final JsonFactory factory = new JsonFactory();

    private final Logger logger;

    public MetadataDecoder(Logger logger) {
        this.logger = logger;
    }

    /**
     * Decodes the metadata.
     *
     * @param data the metadata as JSON
     *
     * @return the metadata
     *
     * @throws MetadataParseException if the data is not well-formed JSON
     * or a field has an unexpected type
     */
    public QueryMetadata decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new MetadataParseException("no content", null, null);
        }

        try (JsonParser jp = factory.createParser(data)) {
            if (jp.nextToken() != JsonToken.START_OBJECT) {
                throw shapeError(jp, "expected a JSON object");
            }

            String requestId = null;
            QueryMetrics metrics = null;
            List<QueryWarning> warnings = null;

            while (jp.nextToken() == JsonToken.FIELD_NAME) {
                String field = jp.currentName();
                JsonToken token = jp.nextToken();
                switch (field) {
                case "requestID":
                    requestId = readString(jp, token, field);
                    break;
                case "metrics":
                    metrics = readMetrics(jp, token);
                    break;
                case "warnings":
                    warnings = readWarnings(jp, token);
                    break;
                default:
                    jp.skipChildren();
                }
            }
            if (jp.nextToken() != null) {
                throw shapeError(jp, "unexpected content after metadata");
            }
            return new QueryMetadata(requestId, metrics, warnings);
        } catch (JsonProcessingException jpe) {
            throw new MetadataParseException(jpe.getOriginalMessage(),
                                             jpe.getLocation(), jpe);
        } catch (IOException ioe) {
            throw new MetadataParseException(ioe.getMessage(), null, ioe);
        }
    }

    private QueryMetrics readMetrics(JsonParser jp, JsonToken token)
        throws IOException {

        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        if (token != JsonToken.START_OBJECT) {
            throw shapeError(jp, "metrics must be an object");
        }

        Duration elapsedTime = Duration.ZERO;
        Duration executionTime = Duration.ZERO;
        long resultCount = 0;
        long resultSize = 0;
        long processedObjects = 0;

        while (jp.nextToken() == JsonToken.FIELD_NAME) {
            String field = jp.currentName();
            JsonToken t = jp.nextToken();
            switch (field) {
            case "elapsedTime":
                elapsedTime = readDuration(jp, t, field);
                break;
            case "executionTime":
                executionTime = readDuration(jp, t, field);
                break;
            case "resultCount":
                resultCount = readLong(jp, t, field);
                break;
            case "resultSize":
                resultSize = readLong(jp, t, field);
                break;
            case "processedObjects":
                processedObjects = readLong(jp, t, field);
                break;
            default:
                jp.skipChildren();
            }
        }
        return new QueryMetrics(elapsedTime, executionTime, resultCount,
                                resultSize, processedObjects);
    }

    private List<QueryWarning> readWarnings(JsonParser jp, JsonToken token)
        throws IOException {

        List<QueryWarning> warnings = new ArrayList<>();
        if (token == JsonToken.VALUE_NULL) {
            return warnings;
        }
        if (token != JsonToken.START_ARRAY) {
            throw shapeError(jp, "warnings must be an array");
        }

        JsonToken t;
        while ((t = jp.nextToken()) != JsonToken.END_ARRAY) {
            if (t != JsonToken.START_OBJECT) {
                throw shapeError(jp, "a warning must be an object");
            }
            int code = 0;
            String msg = null;
            while (jp.nextToken() == JsonToken.FIELD_NAME) {
                String field = jp.currentName();
                JsonToken ft = jp.nextToken();
                if ("code".equals(field)) {
                    code = readInt(jp, ft, field);
                } else if ("msg".equals(field)) {
                    msg = readString(jp, ft, field);
                } else {
                    jp.skipChildren();
                }
            }
            warnings.add(new QueryWarning(code, msg));
        }
        return warnings;
    }

    /*
     * The service reports durations as strings. One that cannot be parsed
     * is logged and treated as zero rather than failing the result.
     */
    private Duration readDuration(JsonParser jp, JsonToken token, String field)
        throws IOException {

        String value = readString(jp, token, field);
        if (value == null || value.isEmpty()) {
            return Duration.ZERO;
        }
        try {
            return DurationUtil.parse(value);
        } catch (IllegalArgumentException iae) {
            logFine(logger, "Failed to parse query metrics " + field + ": " +
                    iae.getMessage());
            return Duration.ZERO;
        }
    }

    private static String readString(JsonParser jp,
                                     JsonToken token,
                                     String field) throws IOException {
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        if (token != JsonToken.VALUE_STRING) {
            throw shapeError(jp, field + " must be a string");
        }
        return jp.getText();
    }

    private static long readLong(JsonParser jp,
                                 JsonToken token,
                                 String field) throws IOException {
        if (token == JsonToken.VALUE_NULL) {
            return 0;
        }
        if (token != JsonToken.VALUE_NUMBER_INT) {
            throw shapeError(jp, field + " must be an integer");
        }
        return jp.getLongValue();
    }

    private static int readInt(JsonParser jp,
                               JsonToken token,
                               String field) throws IOException {
        long value = readLong(jp, token, field);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException ae) {
            throw shapeError(jp, field + " out of range: " + value);
        }
    }

    private static MetadataParseException shapeError(JsonParser jp,
                                                     String msg) {
        return new MetadataParseException(msg, jp.currentLocation(), null);
    }
}
