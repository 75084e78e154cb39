/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.transport;

import java.util.Map;

import oracle.columnar.driver.RequestContext;

/**
 * The transport used by the driver to run queries against the analytics
 * service. A transport owns connections, TLS, credentials, retries and the
 * wire framing; the driver only hands it a fully built request payload.
 * <p>
 * Implementations must be thread-safe: the driver dispatches concurrent
 * queries on the same transport. Dispatch and the returned
 * {@link RowStream} must honor the {@link RequestContext}: once the context
 * is cancelled or its deadline passes, blocked calls must return promptly
 * with a {@link TransportException} whose inner error is a
 * {@link java.util.concurrent.CancellationException} or a
 * {@link oracle.columnar.driver.DeadlineExceededException}.
 */
public interface ColumnarTransport extends AutoCloseable {

    /**
     * Sends a query.
     *
     * @param ctx the context of the request
     * @param payload the request payload, keyed by wire field name. The map
     * is unmodifiable.
     * @param priority the priority hint, or null for the default priority
     *
     * @return the stream of result rows
     *
     * @throws TransportException if the request fails before the result
     * stream is available
     */
    RowStream dispatch(RequestContext ctx,
                       Map<String, Object> payload,
                       Integer priority);

    /**
     * Releases the resources held by the transport.
     */
    @Override
    void close();
}
