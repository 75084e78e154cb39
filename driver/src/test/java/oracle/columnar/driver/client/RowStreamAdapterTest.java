/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.client;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.logging.Logger;

import oracle.columnar.driver.ColumnarErrorDesc;
import oracle.columnar.driver.ColumnarException;
import oracle.columnar.driver.MetadataParseException;
import oracle.columnar.driver.QueryException;
import oracle.columnar.driver.RequestCanceledException;
import oracle.columnar.driver.RequestContext;
import oracle.columnar.driver.RequestDeadlineExceededException;
import oracle.columnar.driver.RequestTimeoutException;
import oracle.columnar.driver.client.RowStreamAdapter.State;
import oracle.columnar.driver.ops.QueryMetadata;
import oracle.columnar.driver.serde.MetadataDecoder;
import oracle.columnar.driver.transport.InMemoryRowStream;
import oracle.columnar.driver.transport.RowStream;
import oracle.columnar.driver.transport.TransportException;
import oracle.columnar.driver.transport.TransportTimeoutException;

import org.junit.Test;

public class RowStreamAdapterTest {

    private static final String STMT = "SELECT * FROM orders";

    private final Logger logger = Logger.getLogger(getClass().getName());

    @Test
    public void testReadAllRows() {
        InMemoryRowStream stream = InMemoryRowStream.of("{\"a\":1}",
                                                        "{\"a\":2}");
        RowStreamAdapter adapter = adapter(RequestContext.create(), stream);

        assertArrayEquals(bytes("{\"a\":1}"), adapter.nextRow());
        assertArrayEquals(bytes("{\"a\":2}"), adapter.nextRow());
        assertEquals(State.OPEN, adapter.getState());
        assertNull(adapter.nextRow());
        assertEquals(State.EXHAUSTED, adapter.getState());

        /* exhaustion is sticky */
        for (int i = 0; i < 3; i++) {
            assertNull(adapter.nextRow());
        }
        assertNull(adapter.err());
        assertEquals(2, stream.getRowsRead());
    }

    @Test
    public void testEmptyResult() {
        RowStreamAdapter adapter = adapter(null, InMemoryRowStream.of());
        assertNull(adapter.nextRow());
        assertEquals(State.EXHAUSTED, adapter.getState());
        assertNull(adapter.err());
        assertEquals("req-1", adapter.metaData().getRequestId());
    }

    @Test
    public void testStreamErrorDeferred() {
        TransportException te = new TransportException(
            null, STMT, "ep", 500, false,
            Collections.singletonList(
                new ColumnarErrorDesc(24045, "syntax error", false)));
        InMemoryRowStream stream =
            InMemoryRowStream.of("{\"a\":1}").failAfterRows(te);
        RowStreamAdapter adapter = adapter(RequestContext.create(), stream);

        assertNotNull(adapter.nextRow());
        assertNull(adapter.nextRow());
        assertEquals(State.ERRORED, adapter.getState());

        RuntimeException err = adapter.err();
        assertTrue(err instanceof QueryException);
        assertEquals(24045, ((QueryException) err).getCode());
        /* translated once */
        assertSame(err, adapter.err());

        assertNull(adapter.nextRow());
        assertSame(err, adapter.err());
    }

    @Test
    public void testThrowingStreamDeferred() {
        TransportException te = new TransportException(
            new TransportTimeoutException("read timed out"), STMT, "ep", 0,
            false, null);
        RowStream stream = new InMemoryRowStream() {
            @Override
            public byte[] nextRow() {
                throw te;
            }
        };
        RowStreamAdapter adapter = adapter(RequestContext.create(), stream);

        assertNull(adapter.nextRow());
        assertEquals(State.ERRORED, adapter.getState());
        assertTrue(adapter.err() instanceof RequestTimeoutException);
    }

    @Test
    public void testCancelledContext() {
        RequestContext ctx = RequestContext.create();
        InMemoryRowStream stream = InMemoryRowStream.of("{\"a\":1}",
                                                        "{\"a\":2}");
        RowStreamAdapter adapter = adapter(ctx, stream);

        assertNotNull(adapter.nextRow());
        ctx.cancel();
        assertNull(adapter.nextRow());
        assertEquals(State.ERRORED, adapter.getState());
        assertEquals(1, stream.getRowsRead());

        RuntimeException err = adapter.err();
        assertTrue(err instanceof RequestCanceledException);
        assertEquals(STMT, ((ColumnarException) err).getStatement());

        /* metadata after an errored read comes from the stream */
        assertEquals("req-1", adapter.metaData().getRequestId());
    }

    @Test
    public void testDeadlinePassed() {
        RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(-1));
        RowStreamAdapter adapter = adapter(ctx, InMemoryRowStream.of("{}"));
        assertNull(adapter.nextRow());
        assertTrue(adapter.err() instanceof RequestDeadlineExceededException);
    }

    @Test
    public void testMetadataWithEndedContextWhileOpen() {
        RequestContext ctx = RequestContext.create();
        InMemoryRowStream stream = InMemoryRowStream.of("{\"a\":1}");
        RowStreamAdapter adapter = adapter(ctx, stream);
        ctx.cancel();
        try {
            adapter.metaData();
            fail("metadata of a cancelled query should fail");
        } catch (RequestCanceledException expected) {
            assertEquals(0, stream.getMetadataCount());
        }
    }

    @Test
    public void testMetadataCachedAfterClose() {
        InMemoryRowStream stream = InMemoryRowStream.of("{\"a\":1}")
            .withMetadata("{\"requestID\":\"r-42\"," +
                          "\"metrics\":{\"resultCount\":1}}");
        RowStreamAdapter adapter = adapter(RequestContext.create(), stream);
        while (adapter.nextRow() != null) {
            /* drain */
        }
        QueryMetadata meta = adapter.metaData();
        assertEquals("r-42", meta.getRequestId());
        assertEquals(1, meta.getMetrics().getResultCount());

        adapter.close();
        assertSame(meta, adapter.metaData());
        assertEquals(1, stream.getMetadataCount());
    }

    @Test
    public void testMetadataErrors() {
        InMemoryRowStream stream = InMemoryRowStream.of()
            .failMetadata(new TransportException(
                new IOException("connection reset"), STMT, "ep", 0, false,
                null));
        RowStreamAdapter adapter = adapter(RequestContext.create(), stream);
        assertNull(adapter.nextRow());
        try {
            adapter.metaData();
            fail("metadata should have failed");
        } catch (ColumnarException ce) {
            assertEquals(ColumnarException.class, ce.getClass());
            assertEquals(STMT, ce.getStatement());
        }

        adapter = adapter(RequestContext.create(),
                          InMemoryRowStream.of().withMetadata("{not json"));
        assertNull(adapter.nextRow());
        try {
            adapter.metaData();
            fail("metadata should have failed");
        } catch (MetadataParseException expected) {
            // expect a failure
        }
    }

    @Test
    public void testMetadataFailureRepeatable() {
        InMemoryRowStream stream =
            InMemoryRowStream.of().withMetadata("{\"requestID\": 7}");
        RowStreamAdapter adapter = adapter(RequestContext.create(), stream);
        assertNull(adapter.nextRow());
        MetadataParseException first = expectMetadataFailure(
            adapter, MetadataParseException.class);
        adapter.close();
        assertSame(first,
                   expectMetadataFailure(adapter,
                                         MetadataParseException.class));
        assertEquals(1, stream.getMetadataCount());

        stream = InMemoryRowStream.of().failMetadata(new TransportException(
            new TransportTimeoutException("slow"), STMT, "ep", 0, false,
            null));
        adapter = adapter(RequestContext.create(), stream);
        assertNull(adapter.nextRow());
        RequestTimeoutException rte = expectMetadataFailure(
            adapter, RequestTimeoutException.class);
        assertSame(rte,
                   expectMetadataFailure(adapter,
                                         RequestTimeoutException.class));
        assertEquals(1, stream.getMetadataCount());
    }

    @Test
    public void testCloseIsIdempotent() {
        InMemoryRowStream stream = InMemoryRowStream.of("{\"a\":1}",
                                                        "{\"a\":2}");
        RowStreamAdapter adapter = adapter(RequestContext.create(), stream);
        assertNotNull(adapter.nextRow());

        adapter.close();
        assertEquals(State.CLOSED, adapter.getState());
        adapter.close();
        adapter.close();
        assertEquals(1, stream.getCloseCount());

        /* no rows are read once closed */
        assertNull(adapter.nextRow());
        assertEquals(1, stream.getRowsRead());
        assertNull(adapter.err());
    }

    @Test
    public void testCloseErrorTranslated() {
        InMemoryRowStream stream = InMemoryRowStream.of()
            .failClose(TransportException.notDispatched(
                new TransportTimeoutException("timed out"), STMT));
        RowStreamAdapter adapter = adapter(RequestContext.create(), stream);
        try {
            adapter.close();
            fail("close should have failed");
        } catch (RequestTimeoutException expected) {
            assertEquals(State.CLOSED, adapter.getState());
        }
        /* the second close does not touch the stream */
        adapter.close();
        assertEquals(1, stream.getCloseCount());
    }

    private static <T extends RuntimeException> T expectMetadataFailure(
        RowStreamAdapter adapter, Class<T> type) {
        try {
            adapter.metaData();
            fail("metadata should have failed");
            return null;
        } catch (RuntimeException re) {
            assertTrue(type.isInstance(re));
            return type.cast(re);
        }
    }

    private RowStreamAdapter adapter(RequestContext ctx, RowStream stream) {
        return new RowStreamAdapter(ctx, stream, STMT,
                                    new ErrorClassifier(logger),
                                    new MetadataDecoder(logger), logger);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
