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

import static org.junit.jupiter.api.Assertions.assertThrows;

import static com.google.common.truth.Truth.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.Test;

/**
 * Tests verifying behavior of {@link CbsToken}.
 *
 */
public class CbsTokenTest {

    /**
     * Verifies that a token expires after its expiration time only.
     */
    @Test
    public void testIsExpired() {
        final Instant expiry = Instant.parse("2026-01-01T01:00:00Z");
        final CbsToken token = new CbsToken("value", CbsConstants.IOT_HUB_SAS_TOKEN_TYPE, expiry);
        assertThat(token.isExpired(expiry)).isFalse();
        assertThat(token.isExpired(expiry.plusMillis(1))).isTrue();
        assertThat(new CbsToken("value", CbsConstants.IOT_HUB_SAS_TOKEN_TYPE, Instant.MAX)
                .isExpired(Instant.now())).isFalse();
    }

    /**
     * Verifies that the string representation does not contain the token's value.
     */
    @Test
    public void testToStringOmitsValue() {
        final CbsToken token = new CbsToken("secret", CbsConstants.IOT_HUB_SAS_TOKEN_TYPE, Instant.MAX);
        assertThat(token.toString()).doesNotContain("secret");
    }

    /**
     * Verifies that all properties are required.
     */
    @Test
    public void testConstructorRejectsNull() {
        assertThrows(NullPointerException.class, () -> new CbsToken(null, "type", Instant.MAX));
        assertThrows(NullPointerException.class, () -> new CbsToken("value", null, Instant.MAX));
        assertThrows(NullPointerException.class, () -> new CbsToken("value", "type", null));
    }
}
