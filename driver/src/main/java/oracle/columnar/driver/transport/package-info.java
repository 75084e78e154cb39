/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * The interface between the driver and the connection to the service. A
 * {@link oracle.columnar.driver.transport.ColumnarTransport} sends query
 * payloads and returns a
 * {@link oracle.columnar.driver.transport.RowStream} of raw rows and
 * metadata. Transport failures are reported as
 * {@link oracle.columnar.driver.transport.TransportException}.
 */
package oracle.columnar.driver.transport;
