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

package org.eclipse.iotauth.client.sas;

import java.time.Duration;
import java.util.Objects;

/**
 * A shared access signature along with the period of time it has been created for.
 *
 */
public final class SharedAccessSignature {

    private final String value;
    private final Duration timeToLive;

    /**
     * Creates a new signature.
     *
     * @param value The signature string.
     * @param timeToLive The period of time that the signature is valid for.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public SharedAccessSignature(final String value, final Duration timeToLive) {
        this.value = Objects.requireNonNull(value);
        this.timeToLive = Objects.requireNonNull(timeToLive);
    }

    /**
     * Gets the signature string.
     *
     * @return The signature.
     */
    public String getValue() {
        return value;
    }

    /**
     * Gets the period of time that the signature has been created for.
     *
     * @return The time to live.
     */
    public Duration getTimeToLive() {
        return timeToLive;
    }

    @Override
    public String toString() {
        return "SharedAccessSignature [ttl: " + timeToLive + "]";
    }
}
