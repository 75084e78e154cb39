/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.client;

import static oracle.columnar.driver.util.LogUtil.isFineEnabled;
import static oracle.columnar.driver.util.LogUtil.logFine;
import static oracle.columnar.driver.util.LogUtil.statementForLog;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

import oracle.columnar.driver.RequestContext;
import oracle.columnar.driver.Unmarshaler;
import oracle.columnar.driver.ops.QueryOptions;
import oracle.columnar.driver.ops.QueryResult;
import oracle.columnar.driver.serde.MetadataDecoder;
import oracle.columnar.driver.serde.QueryPayloadBuilder;
import oracle.columnar.driver.transport.ColumnarTransport;
import oracle.columnar.driver.transport.RowStream;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * @hidden
 * Runs queries for one namespace, or for none. It builds the request
 * payload, dispatches it on the transport and wraps the returned stream.
 * It holds only read-only configuration and may be used concurrently.
 */
public class QueryClient {

    /**
     * A database and scope that scope the queries of a client.
     */
    public static class Namespace {
        private final String database;
        private final String scope;

        public Namespace(String database, String scope) {
            this.database = database;
            this.scope = scope;
        }

        public String getDatabase() {
            return database;
        }

        public String getScope() {
            return scope;
        }
    }

    private final ColumnarTransport transport;
    private final Duration defaultQueryTimeout;
    private final Unmarshaler defaultUnmarshaler;
    private final Namespace namespace;
    private final ErrorClassifier classifier;
    private final MetadataDecoder decoder;
    private final Logger logger;

    /**
     * @param transport the transport
     * @param defaultQueryTimeout the timeout used when the request context
     * has no deadline
     * @param defaultUnmarshaler the unmarshaler used when the options do
     * not set one
     * @param namespace the namespace, or null
     * @param logger the logger
     */
    public QueryClient(ColumnarTransport transport,
                       Duration defaultQueryTimeout,
                       Unmarshaler defaultUnmarshaler,
                       Namespace namespace,
                       Logger logger) {
        this.transport = transport;
        this.defaultQueryTimeout = defaultQueryTimeout;
        this.defaultUnmarshaler = defaultUnmarshaler;
        this.namespace = namespace;
        this.logger = logger;
        this.classifier = new ErrorClassifier(logger);
        this.decoder = new MetadataDecoder(logger);
    }

    /**
     * Runs a query.
     *
     * @param ctx the request context, may be null
     * @param statement the statement
     * @param options the options, may be null
     *
     * @return the result, which must be closed
     *
     * @throws oracle.columnar.driver.InvalidArgumentException if an option
     * is not valid; the query is not sent
     * @throws oracle.columnar.driver.ColumnarException if the query fails
     */
    public QueryResult query(RequestContext ctx,
                             String statement,
                             QueryOptions options) {
        String timeout = TimeoutResolver.resolve(ctx, defaultQueryTimeout);
        Map<String, Object> payload =
            QueryPayloadBuilder.build(statement, options, timeout);

        /* added after the raw options so they cannot be replaced */
        if (namespace != null) {
            payload.put(QueryPayloadBuilder.QUERY_CONTEXT,
                        QueryPayloadBuilder.queryContext(
                            namespace.getDatabase(), namespace.getScope()));
        }
        String clientContextId = UUID.randomUUID().toString();
        payload.put(QueryPayloadBuilder.CLIENT_CONTEXT_ID, clientContextId);

        Integer priority = QueryPayloadBuilder.priority(options);
        if (isFineEnabled(logger)) {
            logFine(logger, "Dispatching query " + clientContextId +
                    ", timeout " + timeout + ": " +
                    statementForLog(statement));
        }

        RowStream stream;
        try {
            stream = transport.dispatch(ctx,
                                        Collections.unmodifiableMap(payload),
                                        priority);
        } catch (RuntimeException re) {
            throw classifier.translate(re);
        }
        if (stream == null) {
            throw new IllegalStateException(
                "Transport returned no stream for query " + clientContextId);
        }

        Unmarshaler unmarshaler = defaultUnmarshaler;
        if (options != null && options.getUnmarshaler() != null) {
            unmarshaler = options.getUnmarshaler();
        }
        return new QueryResult(
            new RowStreamAdapter(ctx, stream, statement, classifier, decoder,
                                 logger),
            unmarshaler);
    }

    /**
     * Runs a query on the bounded elastic scheduler.
     *
     * @param ctx the request context, may be null
     * @param statement the statement
     * @param options the options, may be null
     *
     * @return a Mono that emits the result, which must be closed
     */
    public Mono<QueryResult> queryAsync(RequestContext ctx,
                                        String statement,
                                        QueryOptions options) {
        return Mono.fromCallable(() -> query(ctx, statement, options))
                   .subscribeOn(Schedulers.boundedElastic());
    }

    public Namespace getNamespace() {
        return namespace;
    }
}
