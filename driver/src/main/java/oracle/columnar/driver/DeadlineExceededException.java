/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

/**
 * Raised by {@link RequestContext#checkActive} when the deadline of the
 * context has passed. Transports raise it, wrapped in their own exception,
 * when a request cannot complete in time for the caller. The driver
 * reports it to applications as {@link RequestDeadlineExceededException}.
 */
public class DeadlineExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @param msg the message
     */
    public DeadlineExceededException(String msg) {
        super(msg);
    }
}
