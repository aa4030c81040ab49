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

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.eclipse.iotauth.config.IotHubConnectionProperties;

/**
 * The credentials used for authenticating to an IoT hub.
 * <p>
 * The credentials are either a pre-issued shared access signature or a shared access key
 * (along with the name of the policy it belongs to) that signatures are computed from.
 * Callers distinguish the two variants by means of {@link #map(Function, BiFunction)}.
 */
abstract class SigningCredentials {

    private SigningCredentials() {
    }

    /**
     * Determines the credentials contained in connection properties.
     * <p>
     * A non-blank shared access signature takes precedence over a shared access key.
     *
     * @param props The connection properties.
     * @return The credentials.
     * @throws NullPointerException if props is {@code null}.
     */
    static SigningCredentials from(final IotHubConnectionProperties props) {
        Objects.requireNonNull(props);
        if (props.hasSharedAccessSignature()) {
            return signature(props.getSharedAccessSignature());
        }
        return sharedAccessKey(props.getSharedAccessKeyName(), props.getSharedAccessKey());
    }

    /**
     * Creates credentials for a pre-issued signature.
     *
     * @param signature The signature.
     * @return The credentials.
     * @throws NullPointerException if signature is {@code null}.
     */
    static SigningCredentials signature(final String signature) {
        return new Signature(signature);
    }

    /**
     * Creates credentials for a shared access key.
     * <p>
     * The key material is not validated.
     *
     * @param keyName The name of the policy, may be {@code null}.
     * @param key The key, may be {@code null}.
     * @return The credentials.
     */
    static SigningCredentials sharedAccessKey(final String keyName, final String key) {
        return new SharedAccessKey(keyName, key);
    }

    /**
     * Applies the function matching the type of these credentials.
     *
     * @param <T> The type of result.
     * @param onSignature The function to apply to a pre-issued signature.
     * @param onSharedAccessKey The function to apply to a key name and key.
     * @return The result of the applied function.
     */
    abstract <T> T map(
            Function<String, T> onSignature,
            BiFunction<String, String, T> onSharedAccessKey);

    private static final class Signature extends SigningCredentials {

        private final String value;

        Signature(final String value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        <T> T map(
                final Function<String, T> onSignature,
                final BiFunction<String, String, T> onSharedAccessKey) {
            return onSignature.apply(value);
        }

        @Override
        public String toString() {
            return "Signature";
        }
    }

    private static final class SharedAccessKey extends SigningCredentials {

        private final String keyName;
        private final String key;

        SharedAccessKey(final String keyName, final String key) {
            this.keyName = keyName;
            this.key = key;
        }

        @Override
        <T> T map(
                final Function<String, T> onSignature,
                final BiFunction<String, String, T> onSharedAccessKey) {
            return onSharedAccessKey.apply(keyName, key);
        }

        @Override
        public String toString() {
            return "SharedAccessKey [name: " + keyName + "]";
        }
    }
}
