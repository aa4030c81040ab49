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
 * A provider of credentials for HTTP <em>Authorization</em> headers and
 * SASL PLAIN style user name/password authentication.
 *
 */
public interface AuthorizationHeaderProvider {

    /**
     * Gets the value to put into an <em>Authorization</em> header.
     *
     * @return The header value.
     * @throws IllegalStateException if no signature can be created from the available credentials.
     */
    String getAuthorizationHeader();

    /**
     * Gets the user name to authenticate with.
     *
     * @return The user name.
     */
    String getUser();

    /**
     * Gets the password to authenticate with.
     *
     * @return The password.
     * @throws IllegalStateException if no signature can be created from the available credentials.
     */
    String getPassword();
}
