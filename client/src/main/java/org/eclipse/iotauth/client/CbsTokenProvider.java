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

import java.net.URI;
import java.util.List;

import io.vertx.core.Future;

/**
 * A provider of tokens for the AMQP 1.0 <em>Claims-Based Security</em> negotiation.
 *
 */
public interface CbsTokenProvider {

    /**
     * Gets a token to put to the peer's <em>$cbs</em> node.
     *
     * @param namespaceAddress The address of the peer that the token is for.
     * @param appliesTo The resource that the token should grant access to.
     * @param requiredClaims The claims that the token should assert.
     * @return A future indicating the outcome of the operation.
     *         <p>
     *         The future will be completed with the token or will be failed with an
     *         {@link IllegalStateException} if no token can be created from the available
     *         credentials.
     */
    Future<CbsToken> getToken(URI namespaceAddress, String appliesTo, List<String> requiredClaims);
}
