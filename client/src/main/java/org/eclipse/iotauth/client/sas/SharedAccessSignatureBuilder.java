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

/**
 * A factory for shared access signatures.
 *
 */
@FunctionalInterface
public interface SharedAccessSignatureBuilder {

    /**
     * Creates a signature granting access to a resource.
     * <p>
     * Implementations may normalize the requested time to live. The returned signature
     * reports the time to live that has actually been used.
     *
     * @param keyName The name of the shared access policy that the key belongs to.
     * @param key The Base64 encoded key to sign with.
     * @param timeToLive The requested period of time that the signature should be valid for.
     * @param target The resource that the signature grants access to.
     * @return The signature.
     * @throws IllegalStateException if the signature cannot be created from the given key material.
     */
    SharedAccessSignature build(String keyName, String key, Duration timeToLive, String target);
}
