/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

/**
 * The cause tag carried by every {@link ColumnarException}. Failures
 * raised by the service or the transport are classified into one of
 * {@link #INVALID_CREDENTIAL}, {@link #TIMEOUT}, {@link #CANCELED},
 * {@link #DEADLINE_EXCEEDED}, {@link #QUERY_ERROR} or {@link #UNKNOWN}.
 * The remaining values tag failures detected locally by the driver.
 */
public enum ErrorCause {

    /**
     * A query option or configuration value is malformed. Never sent to
     * the service.
     */
    INVALID_ARGUMENT,

    /**
     * The service rejected the credentials used by the transport.
     */
    INVALID_CREDENTIAL,

    /**
     * The request timed out in the transport or on the server.
     */
    TIMEOUT,

    /**
     * The caller cancelled the {@link RequestContext} of the request.
     */
    CANCELED,

    /**
     * The deadline of the {@link RequestContext} of the request expired.
     */
    DEADLINE_EXCEEDED,

    /**
     * The service rejected the statement.
     */
    QUERY_ERROR,

    /**
     * The metadata returned with a result could not be decoded.
     */
    METADATA_PARSE,

    /**
     * A transport failure that does not match any known cause.
     */
    UNKNOWN
}
