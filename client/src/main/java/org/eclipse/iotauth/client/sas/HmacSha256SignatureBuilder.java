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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.eclipse.iotauth.util.Strings;

/**
 * A builder for shared access signatures based on HmacSHA256.
 * <p>
 * Signatures have the form
 * <pre>
 * SharedAccessSignature sr={resource}&amp;sig={signature}&amp;se={expiry}&amp;skn={key name}
 * </pre>
 * where <em>expiry</em> is the number of seconds since the epoch at which the signature expires
 * and <em>signature</em> is the Base64 encoded HMAC of the URL encoded resource and the expiry,
 * separated by a line feed.
 */
public final class HmacSha256SignatureBuilder implements SharedAccessSignatureBuilder {

    /**
     * The prefix of all signatures created by this builder.
     */
    public static final String SIGNATURE_PREFIX = "SharedAccessSignature ";

    private static final String ALGORITHM = "HmacSHA256";

    private final Clock clock;

    /**
     * Creates a builder that uses the system clock for computing expiration times.
     */
    public HmacSha256SignatureBuilder() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a builder for a clock.
     *
     * @param clock The clock to use for computing expiration times.
     * @throws NullPointerException if clock is {@code null}.
     */
    public HmacSha256SignatureBuilder(final Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the key is {@code null}, blank or not Base64 encoded, if the target
     *                               is {@code null} or if the time to live is {@code null} or not positive.
     */
    @Override
    public SharedAccessSignature build(
            final String keyName,
            final String key,
            final Duration timeToLive,
            final String target) {

        if (Strings.isNullOrBlank(key)) {
            throw new IllegalStateException("shared access key must not be empty");
        } else if (target == null) {
            throw new IllegalStateException("target must be set");
        } else if (timeToLive == null || timeToLive.isNegative() || timeToLive.isZero()) {
            throw new IllegalStateException("time to live must be positive");
        }

        final byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(key);
        } catch (final IllegalArgumentException e) {
            throw new IllegalStateException("shared access key is not Base64 encoded", e);
        }

        final String resource = encode(target);
        final String expiry = String.valueOf(clock.instant().plus(timeToLive).getEpochSecond());
        final String signature = sign(keyBytes, resource + "\n" + expiry);

        final StringBuilder result = new StringBuilder(SIGNATURE_PREFIX)
                .append("sr=").append(resource)
                .append("&sig=").append(encode(signature))
                .append("&se=").append(expiry);
        if (!Strings.isNullOrEmpty(keyName)) {
            result.append("&skn=").append(encode(keyName));
        }
        return new SharedAccessSignature(result.toString(), timeToLive);
    }

    private static String sign(final byte[] key, final String data) {
        try {
            final Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (final GeneralSecurityException | IllegalArgumentException e) {
            // empty keys are rejected by SecretKeySpec
            throw new IllegalStateException("cannot create signature", e);
        }
    }

    private static String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
