/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import java.util.Collections;
import java.util.List;

/**
 * A base exception for the exceptions thrown by the driver. Failures raised
 * by the transport or reported by the service are translated into exactly
 * one subclass of this exception, tagged with an {@link ErrorCause}. The
 * statement, endpoint, HTTP status code and service error list of the
 * failed request are kept so the exception can be logged and triaged as
 * is.
 * <p>
 * A plain ColumnarException, tagged {@link ErrorCause#UNKNOWN}, is thrown
 * for transport failures that do not match any known cause. The driver
 * throws Java exceptions such as {@link IllegalArgumentException} directly
 * for null arguments.
 */
public class ColumnarException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCause errorCause;
    private final String statement;
    private final String endpoint;
    private final int httpStatusCode;
    private final List<ColumnarErrorDesc> errors;

    /**
     * @hidden
     * @param msg the message
     */
    public ColumnarException(String msg) {
        this(ErrorCause.UNKNOWN, msg, null, null, 0, null, null);
    }

    /**
     * @hidden
     * @param msg the message
     * @param cause the cause
     */
    public ColumnarException(String msg, Throwable cause) {
        this(ErrorCause.UNKNOWN, msg, null, null, 0, null, cause);
    }

    /**
     * @hidden
     *
     * @param errorCause the cause tag
     * @param msg the message
     * @param statement the statement of the failed request, or null
     * @param endpoint the endpoint the request was sent to, or null
     * @param httpStatusCode the HTTP status code, 0 if unknown
     * @param errors the errors reported by the service, or null
     * @param cause the underlying failure, or null
     */
    public ColumnarException(ErrorCause errorCause,
                             String msg,
                             String statement,
                             String endpoint,
                             int httpStatusCode,
                             List<ColumnarErrorDesc> errors,
                             Throwable cause) {
        super(msg, cause);
        this.errorCause = errorCause;
        this.statement = statement;
        this.endpoint = endpoint;
        this.httpStatusCode = httpStatusCode;
        this.errors = (errors == null ? Collections.emptyList() :
                       Collections.unmodifiableList(errors));
    }

    /**
     * Returns the cause tag of this exception.
     *
     * @return the cause tag
     */
    public ErrorCause getErrorCause() {
        return errorCause;
    }

    /**
     * Returns the statement of the failed request, if known.
     *
     * @return the statement or null
     */
    public String getStatement() {
        return statement;
    }

    /**
     * Returns the endpoint the failed request was sent to, if known.
     *
     * @return the endpoint or null
     */
    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Returns the HTTP status code of the failed request.
     *
     * @return the status code, or 0 if not known
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    /**
     * Returns the errors reported by the service for the failed request.
     *
     * @return the errors, empty if there are none
     */
    public List<ColumnarErrorDesc> getErrors() {
        return errors;
    }

    /**
     * Returns whether this exception can be retried with a reasonable
     * expectation that it may succeed.
     *
     * @return true if this exception can be retried
     */
    public boolean okToRetry() {
        return false;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        String msg = super.getMessage();
        sb.append(msg == null ? errorCause.toString() : msg);

        boolean hasContext = statement != null || endpoint != null ||
            httpStatusCode != 0 || !errors.isEmpty();
        if (!hasContext) {
            return sb.toString();
        }

        sb.append(" [cause=").append(errorCause);
        if (statement != null) {
            sb.append(", statement=").append(statement);
        }
        if (endpoint != null) {
            sb.append(", endpoint=").append(endpoint);
        }
        if (httpStatusCode != 0) {
            sb.append(", httpStatus=").append(httpStatusCode);
        }
        if (!errors.isEmpty()) {
            sb.append(", errors=").append(errors);
        }
        return sb.append(']').toString();
    }
}
