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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

import org.eclipse.iotauth.client.sas.SharedAccessSignature;
import org.eclipse.iotauth.client.sas.SharedAccessSignatureBuilder;
import org.eclipse.iotauth.util.Constants;
import org.eclipse.iotauth.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the resource that a shared access signature is computed for and
 * delegates creation of the signature to a {@link SharedAccessSignatureBuilder}.
 * <p>
 * The resource is
 * <ul>
 * <li><em>{audience}/devices/{device ID}/modules/{module ID}</em> if both device and module ID are set,</li>
 * <li><em>{audience}/devices/{device ID}</em> if only a device ID is set,</li>
 * <li><em>{audience}</em> otherwise.</li>
 * </ul>
 * The identifiers are URL encoded.
 */
final class TokenTargetResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TokenTargetResolver.class);

    private static final String PATH_DEVICES = "/devices/";
    private static final String PATH_MODULES = "/modules/";

    private final String audience;
    private final String deviceId;
    private final String moduleId;
    private final Duration timeToLive;
    private final SharedAccessSignatureBuilder signatureBuilder;

    /**
     * Creates a resolver using the default time to live.
     *
     * @param audience The IoT hub host name.
     * @param deviceId The device identifier or {@code null}.
     * @param moduleId The module identifier or {@code null}.
     * @param signatureBuilder The builder to delegate to.
     * @throws NullPointerException if audience or builder are {@code null}.
     */
    TokenTargetResolver(
            final String audience,
            final String deviceId,
            final String moduleId,
            final SharedAccessSignatureBuilder signatureBuilder) {
        this(audience, deviceId, moduleId, Constants.DEFAULT_TOKEN_TIME_TO_LIVE, signatureBuilder);
    }

    TokenTargetResolver(
            final String audience,
            final String deviceId,
            final String moduleId,
            final Duration timeToLive,
            final SharedAccessSignatureBuilder signatureBuilder) {
        this.audience = Objects.requireNonNull(audience);
        this.deviceId = deviceId;
        this.moduleId = moduleId;
        this.timeToLive = Objects.requireNonNull(timeToLive);
        this.signatureBuilder = Objects.requireNonNull(signatureBuilder);
    }

    /**
     * Gets the resource that signatures are computed for.
     *
     * @return The resource.
     */
    String getTarget() {
        if (Strings.isNullOrEmpty(deviceId)) {
            // a module ID without a device ID is meaningless
            return audience;
        }
        final StringBuilder target = new StringBuilder(audience)
                .append(PATH_DEVICES).append(encode(deviceId));
        if (!Strings.isNullOrEmpty(moduleId)) {
            target.append(PATH_MODULES).append(encode(moduleId));
        }
        return target.toString();
    }

    /**
     * Creates a signature for the resolved resource.
     * <p>
     * Failures of the signature builder are propagated unchanged.
     *
     * @param keyName The name of the policy that the key belongs to.
     * @param key The key to sign with.
     * @return The signature along with the time to live reported by the builder.
     * @throws IllegalStateException if the builder cannot create a signature from the key material.
     */
    SharedAccessSignature resolve(final String keyName, final String key) {
        final String target = getTarget();
        LOG.trace("creating signature [target: {}, key name: {}, ttl: {}]", target, keyName, timeToLive);
        return signatureBuilder.build(keyName, key, timeToLive, target);
    }

    private static String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
