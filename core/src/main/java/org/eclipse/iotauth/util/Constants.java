/*******************************************************************************
 * Copyright (c) 2016, 2026 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/
package org.eclipse.iotauth.util;

import java.time.Duration;

/**
 * Constants used throughout the IoT hub authentication components.
 *
 */
public final class Constants {

    /**
     * The URI scheme for secure AMQP connections.
     */
    public static final String SCHEME_AMQPS = "amqps";
    /**
     * The URI scheme for HTTPS connections.
     */
    public static final String SCHEME_HTTPS = "https";

    /**
     * Default value for a port that is not explicitly configured.
     */
    public static final int PORT_UNCONFIGURED = -1;
    /**
     * The default port for secure AMQP connections.
     */
    public static final int PORT_AMQPS = 5671;

    /**
     * The period of time that freshly computed shared access signatures are valid for.
     */
    public static final Duration DEFAULT_TOKEN_TIME_TO_LIVE = Duration.ofHours(1);

    /**
     * The separator between a key name and the hub name in a user name.
     */
    public static final String USER_SEPARATOR = "@";

    private Constants() {
        // prevent instantiation
    }
}
