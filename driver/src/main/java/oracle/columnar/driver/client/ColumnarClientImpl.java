/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.client;

import static oracle.columnar.driver.util.LogUtil.logFine;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import oracle.columnar.driver.ColumnarClient;
import oracle.columnar.driver.ColumnarConfig;
import oracle.columnar.driver.Database;
import oracle.columnar.driver.RequestContext;
import oracle.columnar.driver.ops.QueryOptions;
import oracle.columnar.driver.ops.QueryResult;
import oracle.columnar.driver.transport.ColumnarTransport;
import oracle.columnar.driver.util.CheckNull;

import reactor.core.publisher.Mono;

/**
 * @hidden
 * The methods in this class require a non-null statement. Options and the
 * request context may be null.
 */
public class ColumnarClientImpl implements ColumnarClient {

    private final ColumnarConfig config;
    private final ColumnarTransport transport;
    private final Logger logger;

    /* runs queries that have no namespace */
    private final QueryClient queryClient;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ColumnarClientImpl(ColumnarConfig config,
                              ColumnarTransport transport) {
        this.config = config;
        this.transport = transport;
        this.logger = getLogger(config);
        this.queryClient = newQueryClient(null);
        logFine(logger, "Columnar client started, query timeout " +
                config.getQueryTimeout());
    }

    /**
     * Returns the logger used for the driver. If no logger is specified
     * create one based on this class name.
     */
    private Logger getLogger(ColumnarConfig cfg) {
        if (cfg.getLogger() != null) {
            return cfg.getLogger();
        }
        return Logger.getLogger(getClass().getName());
    }

    /**
     * Creates a query client for a database and scope.
     *
     * @param database the database name
     * @param scope the scope name
     *
     * @return the query client
     */
    public QueryClient newQueryClient(String database, String scope) {
        return newQueryClient(new QueryClient.Namespace(database, scope));
    }

    private QueryClient newQueryClient(QueryClient.Namespace namespace) {
        return new QueryClient(transport, config.getQueryTimeout(),
                               config.getUnmarshaler(), namespace, logger);
    }

    @Override
    public QueryResult query(RequestContext ctx,
                             String statement,
                             QueryOptions options) {
        checkClient();
        CheckNull.requireNonNullIAE(statement,
                                    "query: statement must be non-null");
        return queryClient.query(ctx, statement, options);
    }

    @Override
    public QueryResult query(String statement, QueryOptions options) {
        return query(RequestContext.create(), statement, options);
    }

    @Override
    public Mono<QueryResult> queryAsync(RequestContext ctx,
                                        String statement,
                                        QueryOptions options) {
        checkClient();
        CheckNull.requireNonNullIAE(statement,
                                    "queryAsync: statement must be non-null");
        return queryClient.queryAsync(ctx, statement, options);
    }

    @Override
    public Database database(String name) {
        checkClient();
        CheckNull.requireNonEmptyIAE(
            name, "database: database name must be non-empty");
        return new Database(this, name);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logFine(logger, "Shutting down columnar client");
            transport.close();
        }
    }

    /**
     * @hidden
     * Throws if the client has been closed.
     *
     * @throws IllegalStateException if the client has been closed
     */
    public void checkClient() {
        if (closed.get()) {
            throw new IllegalStateException("client has been closed");
        }
    }
}
