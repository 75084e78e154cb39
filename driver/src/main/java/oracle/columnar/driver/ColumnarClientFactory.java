/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import oracle.columnar.driver.client.ColumnarClientImpl;
import oracle.columnar.driver.transport.ColumnarTransport;
import oracle.columnar.driver.util.CheckNull;

/**
 * Factory class used to produce {@link ColumnarClient} instances.
 */
public class ColumnarClientFactory {

    /**
     * Creates a client that runs queries on the given transport. The
     * application must invoke {@link ColumnarClient#close} when it is done
     * with the client; this also closes the transport.
     *
     * @param config the configuration
     * @param transport the transport connected to the service
     *
     * @return a client, ready for use
     *
     * @throws IllegalArgumentException if an argument is null
     */
    public static ColumnarClient createClient(ColumnarConfig config,
                                              ColumnarTransport transport) {
        CheckNull.requireNonNullIAE(
            config, "ColumnarClientFactory.createClient: config cannot be null");
        CheckNull.requireNonNullIAE(
            transport,
            "ColumnarClientFactory.createClient: transport cannot be null");
        ColumnarConfig configCopy = config.clone();
        if (configCopy.getUnmarshaler() == null) {
            configCopy.setUnmarshaler(new JsonUnmarshaler());
        }
        return new ColumnarClientImpl(configCopy, transport);
    }
}
