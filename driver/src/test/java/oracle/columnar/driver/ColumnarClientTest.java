/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import oracle.columnar.driver.ops.QueryMetadata;
import oracle.columnar.driver.ops.QueryOptions;
import oracle.columnar.driver.ops.QueryResult;
import oracle.columnar.driver.ops.QueryResultRow;
import oracle.columnar.driver.transport.InMemoryRowStream;
import oracle.columnar.driver.transport.InMemoryTransport;
import oracle.columnar.driver.transport.TransportException;
import oracle.columnar.driver.transport.TransportTimeoutException;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import reactor.test.StepVerifier;

/**
 * Queries run through the public client API on an in-memory transport
 */
public class ColumnarClientTest {

    private static final String STMT = "SELECT name FROM airports";

    private InMemoryTransport transport;
    private ColumnarClient client;

    @Before
    public void setUp() {
        transport = new InMemoryTransport();
        client = ColumnarClientFactory.createClient(
            new ColumnarConfig().setQueryTimeout(Duration.ofSeconds(75)),
            transport);
    }

    @After
    public void tearDown() {
        client.close();
    }

    @Test
    public void testFactoryArguments() {
        try {
            ColumnarClientFactory.createClient(null, transport);
            fail("null config should have failed");
        } catch (IllegalArgumentException expected) {
            // expect a failure
        }
        try {
            ColumnarClientFactory.createClient(new ColumnarConfig(), null);
            fail("null transport should have failed");
        } catch (IllegalArgumentException expected) {
            // expect a failure
        }
    }

    @Test
    public void testConfigCopiedAtCreation() {
        ColumnarConfig config = new ColumnarConfig()
            .setQueryTimeout(Duration.ofSeconds(20));
        InMemoryTransport other = new InMemoryTransport();
        try (ColumnarClient c =
             ColumnarClientFactory.createClient(config, other)) {
            config.setQueryTimeout(Duration.ofSeconds(90));
            c.query(STMT, null).close();
            assertEquals("20s", other.lastPayload().get("timeout"));
            /* the application's config is not modified */
            assertNull(config.getUnmarshaler());
        }
    }

    @Test
    public void testQueryAndMetadata() {
        transport.respond(InMemoryRowStream.of("{\"name\":\"SFO\"}",
                                               "{\"name\":\"LHR\"}")
            .withMetadata("{\"requestID\":\"r-1\",\"status\":\"success\"," +
                          "\"metrics\":{\"elapsedTime\":\"1.5ms\"," +
                          "\"resultCount\":2}}"));

        List<String> names = new ArrayList<>();
        try (QueryResult result = client.query(STMT, null)) {
            QueryResultRow row;
            while ((row = result.nextRow()) != null) {
                @SuppressWarnings("unchecked")
                Map<String, Object> map = row.contentAs(Map.class);
                names.add((String) map.get("name"));
            }
            assertNull(result.err());

            QueryMetadata meta = result.getMetadata();
            assertEquals("r-1", meta.getRequestId());
            assertEquals(2, meta.getMetrics().getResultCount());
            assertEquals(Duration.ofNanos(1_500_000),
                         meta.getMetrics().getElapsedTime());
        }
        assertEquals(Arrays.asList("SFO", "LHR"), names);
        assertEquals("1m15s", transport.lastPayload().get("timeout"));
    }

    @Test
    public void testDatabaseScope() {
        Scope scope = client.database("travel").scope("inventory");
        assertEquals("inventory", scope.getName());
        assertEquals("travel", scope.getDatabase().getName());

        scope.query(STMT, new QueryOptions().setReadOnly(true)).close();
        Map<String, Object> payload = transport.lastPayload();
        assertEquals("default:`travel`.`inventory`",
                     payload.get("query_context"));
        assertEquals(Boolean.TRUE, payload.get("readonly"));

        client.query(STMT, null).close();
        assertFalse(transport.lastPayload().containsKey("query_context"));
    }

    @Test
    public void testIterator() {
        transport.respond(InMemoryRowStream.of("1", "2", "3"));
        long sum = 0;
        try (QueryResult result = client.query(STMT, null)) {
            for (QueryResultRow row : result) {
                sum += row.contentAs(Long.class);
            }
            Iterator<QueryResultRow> iter = result.iterator();
            assertFalse(iter.hasNext());
            try {
                iter.next();
                fail("exhausted iterator should have failed");
            } catch (NoSuchElementException expected) {
                // expect a failure
            }
        }
        assertEquals(6, sum);
    }

    @Test
    public void testIteratorThrowsStreamError() {
        transport.respond(InMemoryRowStream.of("1").failAfterRows(
            new TransportException(new TransportTimeoutException("slow"),
                                   STMT, "ep", 0, false, null)));
        int rows = 0;
        try (QueryResult result = client.query(STMT, null)) {
            for (QueryResultRow row : result) {
                assertNotNull(row.getContent());
                rows++;
            }
            fail("iteration should have failed");
        } catch (RequestTimeoutException rte) {
            assertEquals(STMT, rte.getStatement());
        }
        assertEquals(1, rows);
    }

    @Test
    public void testRowsFlux() {
        transport.respond(InMemoryRowStream.of("\"a\"", "\"b\""));
        try (QueryResult result = client.query(STMT, null)) {
            StepVerifier.create(
                result.rows().map(row -> row.contentAs(String.class)))
                .expectNext("a")
                .expectNext("b")
                .verifyComplete();
        }

        transport.respond(InMemoryRowStream.of("\"a\"").failAfterRows(
            new TransportException(new TransportTimeoutException("slow"),
                                   STMT, "ep", 0, false, null)));
        try (QueryResult result = client.query(STMT, null)) {
            StepVerifier.create(result.rows())
                .expectNextCount(1)
                .expectError(RequestTimeoutException.class)
                .verify();
        }
    }

    @Test
    public void testQueryAsync() {
        transport.respond(InMemoryRowStream.of("{\"x\":1}"));
        RequestContext ctx = RequestContext.withTimeout(Duration.ofMinutes(5));
        StepVerifier.create(client.queryAsync(ctx, STMT, null)
                                .map(result -> {
                                    try (QueryResult r = result) {
                                        return r.nextRow().contentAs(
                                            Map.class).get("x");
                                    }
                                }))
            .expectNext(1)
            .verifyComplete();
        assertSame(ctx, transport.lastContext());
    }

    @Test
    public void testClose() {
        client.close();
        assertTrue(transport.isClosed());
        client.close();
        try {
            client.query(STMT, null);
            fail("closed client should have failed");
        } catch (IllegalStateException expected) {
            // expect a failure
        }
        try {
            client.database("travel");
            fail("closed client should have failed");
        } catch (IllegalStateException expected) {
            // expect a failure
        }
    }

    @Test
    public void testScopeAfterClose() {
        Database database = client.database("travel");
        Scope scope = database.scope("inventory");
        client.close();

        try {
            scope.query(STMT, null);
            fail("query on a scope of a closed client should have failed");
        } catch (IllegalStateException expected) {
            // expect a failure
        }
        try {
            scope.queryAsync(RequestContext.create(), STMT, null);
            fail("query on a scope of a closed client should have failed");
        } catch (IllegalStateException expected) {
            // expect a failure
        }
        try {
            database.scope("other");
            fail("closed client should have failed");
        } catch (IllegalStateException expected) {
            // expect a failure
        }
        assertEquals(0, transport.getDispatchCount());
    }

    @Test
    public void testNullStatement() {
        try {
            client.query(null, null);
            fail("null statement should have failed");
        } catch (IllegalArgumentException expected) {
            // expect a failure
        }
        try {
            client.database("");
            fail("empty database name should have failed");
        } catch (IllegalArgumentException expected) {
            // expect a failure
        }
        assertEquals(0, transport.getDispatchCount());
    }
}
