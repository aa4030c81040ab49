/*******************************************************************************
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
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

package org.eclipse.iotauth.client;

/**
 * Constants used in the <em>Claims-Based Security</em> negotiation.
 *
 */
public final class CbsConstants {

    /**
     * The type of token representing an IoT hub shared access signature.
     */
    public static final String IOT_HUB_SAS_TOKEN_TYPE = "servicebus.windows.net:sastoken";
    /**
     * The address of the node that tokens are put to.
     */
    public static final String CBS_ADDRESS = "$cbs";

    private CbsConstants() {
        // prevent instantiation
    }
}
