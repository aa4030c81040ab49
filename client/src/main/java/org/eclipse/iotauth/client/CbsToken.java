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

import java.time.Instant;
import java.util.Objects;

/**
 * A security token to be used in the <em>Claims-Based Security</em> negotiation.
 */
public final class CbsToken {

    private final String tokenValue;
    private final String tokenType;
    private final Instant expiresAtUtc;

    /**
     * Creates a new token.
     *
     * @param tokenValue The token's (opaque) value.
     * @param tokenType The type of token.
     * @param expiresAtUtc The point in time after which the token should be considered expired.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public CbsToken(final String tokenValue, final String tokenType, final Instant expiresAtUtc) {
        this.tokenValue = Objects.requireNonNull(tokenValue);
        this.tokenType = Objects.requireNonNull(tokenType);
        this.expiresAtUtc = Objects.requireNonNull(expiresAtUtc);
    }

    /**
     * Gets the token's value.
     *
     * @return The value.
     */
    public String getTokenValue() {
        return tokenValue;
    }

    /**
     * Gets the token's type.
     *
     * @return The type.
     */
    public String getTokenType() {
        return tokenType;
    }

    /**
     * Gets the point in time after which this token should be considered expired.
     *
     * @return The expiration time. {@link Instant#MAX} indicates that the token never expires.
     */
    public Instant getExpiresAtUtc() {
        return expiresAtUtc;
    }

    /**
     * Checks if this token is expired.
     *
     * @param now The point in time to check against.
     * @return {@code true} if the given instant is after this token's expiration time.
     * @throws NullPointerException if now is {@code null}.
     */
    public boolean isExpired(final Instant now) {
        return Objects.requireNonNull(now).isAfter(expiresAtUtc);
    }

    /**
     * {@inheritDoc}
     * <p>
     * The token's value is not included.
     */
    @Override
    public String toString() {
        return new StringBuilder("CbsToken [")
                .append("type: ").append(tokenType)
                .append(", expires: ").append(expiresAtUtc)
                .append("]")
                .toString();
    }
}
