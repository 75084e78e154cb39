/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.transport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import oracle.columnar.driver.RequestContext;

/**
 * A transport that records what it is asked to dispatch and answers with
 * queued streams or failures. With nothing queued it returns an empty
 * stream.
 */
public class InMemoryTransport implements ColumnarTransport {

    private final Deque<Object> responses = new ArrayDeque<>();
    private final List<Map<String, Object>> payloads = new ArrayList<>();
    private final List<Integer> priorities = new ArrayList<>();
    private final List<RequestContext> contexts = new ArrayList<>();
    private boolean closed;

    public synchronized InMemoryTransport respond(RowStream stream) {
        responses.add(stream);
        return this;
    }

    public synchronized InMemoryTransport fail(RuntimeException err) {
        responses.add(err);
        return this;
    }

    @Override
    public synchronized RowStream dispatch(RequestContext ctx,
                                           Map<String, Object> payload,
                                           Integer priority) {
        contexts.add(ctx);
        payloads.add(payload);
        priorities.add(priority);

        Object response = responses.poll();
        if (response instanceof RuntimeException) {
            throw (RuntimeException) response;
        }
        if (response == null) {
            return InMemoryRowStream.of();
        }
        return (RowStream) response;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized Map<String, Object> lastPayload() {
        return payloads.get(payloads.size() - 1);
    }

    public synchronized Integer lastPriority() {
        return priorities.get(priorities.size() - 1);
    }

    public synchronized RequestContext lastContext() {
        return contexts.get(contexts.size() - 1);
    }

    public synchronized int getDispatchCount() {
        return payloads.size();
    }
}
