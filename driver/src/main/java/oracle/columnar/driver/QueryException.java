/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import java.util.List;

/**
 * Thrown when the service rejects a statement. The code and message
 * identify the error chosen from the errors reported by the service: the
 * first error not flagged retriable, or the first error if all of them are.
 * All reported errors are available from {@link #getErrors}.
 * <p>
 * {@link #getErrorCause} normally returns {@link ErrorCause#QUERY_ERROR}.
 * If the request also hit a transport timeout, or its
 * {@link RequestContext} was cancelled or expired, it returns
 * {@link ErrorCause#TIMEOUT}, {@link ErrorCause#CANCELED} or
 * {@link ErrorCause#DEADLINE_EXCEEDED} instead, while the code and message
 * still describe the service error.
 */
public class QueryException extends ColumnarException {

    private static final long serialVersionUID = 1L;

    private final int code;
    private final String serverMessage;

    /**
     * @hidden
     * Internal use only.
     *
     * @param errorCause the cause tag
     * @param code the code of the chosen service error
     * @param serverMessage the message of the chosen service error
     * @param statement the statement of the failed request, or null
     * @param endpoint the endpoint the request was sent to, or null
     * @param httpStatusCode the HTTP status code, 0 if unknown
     * @param errors all the errors reported by the service
     * @param cause the underlying failure, or null
     */
    public QueryException(ErrorCause errorCause,
                          int code,
                          String serverMessage,
                          String statement,
                          String endpoint,
                          int httpStatusCode,
                          List<ColumnarErrorDesc> errors,
                          Throwable cause) {
        super(errorCause, "Query error " + code + ": " + serverMessage,
              statement, endpoint, httpStatusCode, errors, cause);
        this.code = code;
        this.serverMessage = serverMessage;
    }

    /**
     * Returns the code of the service error that identifies this failure.
     *
     * @return the code
     */
    public int getCode() {
        return code;
    }

    /**
     * Returns the message of the service error that identifies this
     * failure.
     *
     * @return the message
     */
    public String getServerMessage() {
        return serverMessage;
    }
}
