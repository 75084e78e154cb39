/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.transport;

/**
 * The inner error of a {@link TransportException} when the request timed
 * out in the transport, as opposed to the caller's context expiring.
 */
public class TransportTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TransportTimeoutException(String msg) {
        super(msg);
    }
}
