/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.client;

import static oracle.columnar.driver.util.LogUtil.logFine;

import java.util.logging.Logger;

import oracle.columnar.driver.RequestContext;
import oracle.columnar.driver.ops.QueryMetadata;
import oracle.columnar.driver.serde.MetadataDecoder;
import oracle.columnar.driver.transport.RowStream;
import oracle.columnar.driver.transport.TransportException;

/**
 * @hidden
 * Reads the rows and metadata of a query from the {@link RowStream}
 * returned by the transport. Failures are translated by the
 * {@link ErrorClassifier}; a failure while reading rows is deferred and
 * reported by {@link #err}.
 * <p>
 * The adapter is a state machine:
 * <pre>
 * OPEN --rows exhausted--&gt; EXHAUSTED
 * OPEN --stream failed or context ended--&gt; ERRORED
 * any --close--&gt; CLOSED
 * </pre>
 * Rows are only read in the OPEN state. Metadata is complete once the
 * adapter has left the OPEN state through exhaustion or close; requested
 * earlier it may be partial, depending on the transport. Once decoded it
 * is cached and returned by later calls, including after close. The
 * stream is asked for metadata at most once; if reading or decoding it
 * fails, later calls throw the same exception.
 * <p>
 * An adapter has a single reader and is not thread-safe.
 */
public class RowStreamAdapter {

    /**
     * The states of the adapter.
     */
    public enum State {
        OPEN,
        EXHAUSTED,
        CLOSED,
        ERRORED
    }

    private final RequestContext ctx;
    private final RowStream stream;
    private final String statement;
    private final ErrorClassifier classifier;
    private final MetadataDecoder decoder;
    private final Logger logger;

    private State state = State.OPEN;

    /* the first failure seen while reading rows, untranslated */
    private RuntimeException deferredError;
    private RuntimeException translatedError;

    private QueryMetadata metadata;

    /* the failure of the metadata read, thrown again by later calls */
    private RuntimeException metadataError;

    public RowStreamAdapter(RequestContext ctx,
                            RowStream stream,
                            String statement,
                            ErrorClassifier classifier,
                            MetadataDecoder decoder,
                            Logger logger) {
        this.ctx = ctx;
        this.stream = stream;
        this.statement = statement;
        this.classifier = classifier;
        this.decoder = decoder;
        this.logger = logger;
    }

    /**
     * Returns the next row.
     *
     * @return the raw row, or null if there are no more rows, the stream
     * failed or the adapter is closed
     */
    public byte[] nextRow() {
        if (state != State.OPEN) {
            return null;
        }
        if (ctx != null && ctx.isDone()) {
            fail(contextError());
            return null;
        }

        byte[] row;
        try {
            row = stream.nextRow();
        } catch (RuntimeException re) {
            fail(re);
            return null;
        }
        if (row != null) {
            return row;
        }

        RuntimeException err = stream.err();
        if (err != null) {
            fail(err);
        } else {
            state = State.EXHAUSTED;
        }
        return null;
    }

    /**
     * Returns the metadata of the result.
     *
     * @return the metadata
     *
     * @throws oracle.columnar.driver.MetadataParseException if the metadata
     * cannot be decoded
     * @throws RuntimeException the translated transport failure if the
     * metadata cannot be read
     */
    public QueryMetadata metaData() {
        if (metadata != null) {
            return metadata;
        }
        if (metadataError != null) {
            throw metadataError;
        }
        if (state == State.OPEN && ctx != null && ctx.isDone()) {
            throw classifier.translate(contextError());
        }

        byte[] data;
        try {
            data = stream.metaData();
        } catch (RuntimeException re) {
            metadataError = classifier.translate(re);
            throw metadataError;
        }
        try {
            metadata = decoder.decode(data);
        } catch (RuntimeException re) {
            metadataError = re;
            throw re;
        }
        return metadata;
    }

    /**
     * Returns the failure that ended the row stream, if any.
     *
     * @return the translated failure or null
     */
    public RuntimeException err() {
        if (deferredError == null) {
            return null;
        }
        if (translatedError == null) {
            translatedError = classifier.translate(deferredError);
        }
        return translatedError;
    }

    /**
     * Closes the stream. Calls after the first have no effect.
     *
     * @throws RuntimeException the translated transport failure if the
     * stream could not be released cleanly
     */
    public void close() {
        if (state == State.CLOSED) {
            return;
        }
        State prior = state;
        state = State.CLOSED;
        logFine(logger, "Closing query stream in state " + prior);
        try {
            stream.close();
        } catch (RuntimeException re) {
            throw classifier.translate(re);
        }
    }

    public State getState() {
        return state;
    }

    private void fail(RuntimeException err) {
        if (deferredError == null) {
            deferredError = err;
        }
        state = State.ERRORED;
    }

    /*
     * Wraps the signal of an ended context the way a transport reports it.
     */
    private TransportException contextError() {
        try {
            ctx.checkActive();
        } catch (RuntimeException signal) {
            return new TransportException(signal, statement, null, 0, false,
                                          null);
        }
        throw new IllegalStateException("context has not ended");
    }
}
