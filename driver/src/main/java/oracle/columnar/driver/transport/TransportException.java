/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.transport;

import java.util.Collections;
import java.util.List;

import oracle.columnar.driver.ColumnarErrorDesc;

/**
 * Raised by a {@link ColumnarTransport} when a request fails. It describes
 * the failure as seen by the transport: the inner error that caused it,
 * the HTTP status code and the errors reported by the service, if a
 * response was received, and whether the request was sent at all.
 * <p>
 * The driver never passes this exception to applications; it is
 * translated into a {@link oracle.columnar.driver.ColumnarException}.
 */
public class TransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String statement;
    private final String endpoint;
    private final int httpResponseCode;
    private final boolean wasNotDispatched;
    private final List<ColumnarErrorDesc> errors;

    /**
     * @param innerError the error that caused the failure
     * @param statement the statement of the request
     * @param endpoint the endpoint the request was sent to, or null
     * @param httpResponseCode the HTTP status code, 0 if no response
     * @param wasNotDispatched true if the request was never sent
     * @param errors the errors reported by the service, or null
     */
    public TransportException(Throwable innerError,
                              String statement,
                              String endpoint,
                              int httpResponseCode,
                              boolean wasNotDispatched,
                              List<ColumnarErrorDesc> errors) {
        super(innerError == null ? "transport failure" :
              innerError.getMessage(), innerError);
        this.statement = statement;
        this.endpoint = endpoint;
        this.httpResponseCode = httpResponseCode;
        this.wasNotDispatched = wasNotDispatched;
        this.errors = (errors == null ? Collections.emptyList() :
                       Collections.unmodifiableList(errors));
    }

    /**
     * Creates an exception for a request that failed before it was sent.
     *
     * @param innerError the error that caused the failure
     * @param statement the statement of the request
     *
     * @return the exception
     */
    public static TransportException notDispatched(Throwable innerError,
                                                   String statement) {
        return new TransportException(innerError, statement, null, 0,
                                      true, null);
    }

    /**
     * Returns the error that caused the failure.
     *
     * @return the inner error, or null
     */
    public Throwable getInnerError() {
        return getCause();
    }

    public String getStatement() {
        return statement;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getHttpResponseCode() {
        return httpResponseCode;
    }

    public boolean wasNotDispatched() {
        return wasNotDispatched;
    }

    public List<ColumnarErrorDesc> getErrors() {
        return errors;
    }
}
