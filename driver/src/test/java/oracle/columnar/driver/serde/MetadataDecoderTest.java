/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.serde;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.logging.Logger;

import oracle.columnar.driver.ErrorCause;
import oracle.columnar.driver.MetadataParseException;
import oracle.columnar.driver.ops.QueryMetadata;
import oracle.columnar.driver.ops.QueryMetrics;

import org.junit.Test;

public class MetadataDecoderTest {

    private final MetadataDecoder decoder =
        new MetadataDecoder(Logger.getLogger(getClass().getName()));

    @Test
    public void testFullMetadata() {
        String json =
            "{\"requestID\": \"94c7f89f-924e-4ec9-b3a5-4a4b7a1d1f8e\"," +
            " \"signature\": {\"*\": \"*\"}," +
            " \"status\": \"success\"," +
            " \"metrics\": {\"elapsedTime\": \"14.928ms\"," +
            "   \"executionTime\": \"12.5ms\", \"resultCount\": 3," +
            "   \"resultSize\": 129, \"processedObjects\": 31," +
            "   \"bufferCacheHitRatio\": \"100.00%\"}," +
            " \"warnings\": [{\"code\": 1, \"msg\": \"first\"}," +
            "   {\"code\": 24, \"msg\": \"second\", \"extra\": [1, 2]}]}";

        QueryMetadata meta = decode(json);
        assertEquals("94c7f89f-924e-4ec9-b3a5-4a4b7a1d1f8e",
                     meta.getRequestId());

        QueryMetrics metrics = meta.getMetrics();
        assertEquals(Duration.ofNanos(14_928_000), metrics.getElapsedTime());
        assertEquals(Duration.ofNanos(12_500_000), metrics.getExecutionTime());
        assertEquals(3, metrics.getResultCount());
        assertEquals(129, metrics.getResultSize());
        assertEquals(31, metrics.getProcessedObjects());

        assertEquals(2, meta.getWarnings().size());
        assertEquals(1, meta.getWarnings().get(0).getCode());
        assertEquals("first", meta.getWarnings().get(0).getMessage());
        assertEquals(24, meta.getWarnings().get(1).getCode());
        assertEquals("second", meta.getWarnings().get(1).getMessage());
    }

    @Test
    public void testMissingFieldsDefault() {
        QueryMetadata meta = decode("{}");
        assertEquals("", meta.getRequestId());
        assertNotNull(meta.getMetrics());
        assertEquals(Duration.ZERO, meta.getMetrics().getElapsedTime());
        assertEquals(Duration.ZERO, meta.getMetrics().getExecutionTime());
        assertEquals(0, meta.getMetrics().getResultCount());
        assertEquals(0, meta.getMetrics().getResultSize());
        assertEquals(0, meta.getMetrics().getProcessedObjects());
        assertTrue(meta.getWarnings().isEmpty());

        meta = decode("{\"metrics\": {\"resultCount\": 5}, " +
                      "\"warnings\": null, \"requestID\": null}");
        assertEquals(5, meta.getMetrics().getResultCount());
        assertEquals(0, meta.getMetrics().getResultSize());
        assertTrue(meta.getWarnings().isEmpty());
        assertEquals("", meta.getRequestId());
    }

    @Test
    public void testUnparsableDurationIsZero() {
        QueryMetadata meta = decode(
            "{\"metrics\": {\"elapsedTime\": \"soon\", \"resultCount\": 1}}");
        assertEquals(Duration.ZERO, meta.getMetrics().getElapsedTime());
        assertEquals(1, meta.getMetrics().getResultCount());
    }

    @Test
    public void testMalformedJson() {
        MetadataParseException mpe = expectParseError("{\"requestID\": ");
        assertEquals(ErrorCause.METADATA_PARSE, mpe.getErrorCause());
        assertNotNull(mpe.getCause());

        expectParseError("not json");
        expectParseError("{\"requestID\": \"x\"} trailing");
        expectParseError("");
    }

    @Test
    public void testWrongShape() {
        expectParseError("[1, 2]");
        expectParseError("\"metadata\"");
        expectParseError("{\"metrics\": []}");
        expectParseError("{\"metrics\": {\"resultCount\": \"three\"}}");
        expectParseError("{\"metrics\": {\"resultCount\": 1.5}}");
        expectParseError("{\"warnings\": {\"code\": 1}}");
        expectParseError("{\"warnings\": [1]}");
        expectParseError("{\"requestID\": 7}");
        expectParseError("{\"warnings\": [{\"code\": 4294967297}]}");
        expectParseError("{\"warnings\": [{\"code\": -2147483649}]}");

        MetadataParseException mpe =
            expectParseError("{\n\"metrics\": {\"elapsedTime\": 12}}");
        assertEquals(2, mpe.getLine());
        assertTrue(mpe.getMessage().contains("elapsedTime"));
    }

    @Test
    public void testWarningCodeRange() {
        QueryMetadata meta = decode(
            "{\"warnings\": [{\"code\": 2147483647, \"msg\": \"max\"}]}");
        assertEquals(Integer.MAX_VALUE, meta.getWarnings().get(0).getCode());

        MetadataParseException mpe = expectParseError(
            "{\"warnings\": [{\"code\": 2147483648, \"msg\": \"big\"}]}");
        assertTrue(mpe.getMessage().contains("code out of range"));
    }

    @Test
    public void testNullInput() {
        try {
            decoder.decode(null);
            fail("null metadata should have failed");
        } catch (MetadataParseException expected) {
            // expect a failure
        }
    }

    private QueryMetadata decode(String json) {
        return decoder.decode(json.getBytes(StandardCharsets.UTF_8));
    }

    private MetadataParseException expectParseError(String json) {
        try {
            decode(json);
            fail("Metadata " + json + " should have failed");
            return null;
        } catch (MetadataParseException mpe) {
            return mpe;
        }
    }
}
