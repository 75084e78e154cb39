/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import java.util.List;

/**
 * Thrown when the {@link RequestContext} of a request is cancelled before
 * the request or its result stream completes.
 */
public class RequestCanceledException extends ColumnarException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * Internal use only.
     *
     * @param msg the message
     * @param statement the statement of the failed request, or null
     * @param endpoint the endpoint the request was sent to, or null
     * @param httpStatusCode the HTTP status code, 0 if unknown
     * @param errors the errors reported by the service, or null
     * @param cause the underlying failure, or null
     */
    public RequestCanceledException(String msg,
                                    String statement,
                                    String endpoint,
                                    int httpStatusCode,
                                    List<ColumnarErrorDesc> errors,
                                    Throwable cause) {
        super(ErrorCause.CANCELED, msg, statement, endpoint, httpStatusCode,
              errors, cause);
    }
}
