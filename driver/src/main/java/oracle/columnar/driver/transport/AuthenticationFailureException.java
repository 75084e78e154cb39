/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver.transport;

/**
 * The inner error of a {@link TransportException} when the transport could
 * not authenticate with the service.
 */
public class AuthenticationFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AuthenticationFailureException(String msg) {
        super(msg);
    }

    public AuthenticationFailureException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
