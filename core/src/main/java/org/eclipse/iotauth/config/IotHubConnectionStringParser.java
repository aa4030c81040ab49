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

package org.eclipse.iotauth.config;

import java.util.Locale;
import java.util.Objects;

import org.eclipse.iotauth.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parser for IoT hub connection strings.
 * <p>
 * A connection string consists of <em>Name=Value</em> pairs separated by semicolons, e.g.
 * <pre>
 * HostName=myhub.example.com;SharedAccessKeyName=iothubowner;SharedAccessKey=c2VjcmV0
 * </pre>
 * Property names are matched case insensitively. A value extends from the first {@code =}
 * to the end of its segment, so Base64 encoded keys and signatures may contain {@code =}
 * characters.
 */
public final class IotHubConnectionStringParser {

    /**
     * The name of the property holding the IoT hub's host name.
     */
    public static final String PROPERTY_HOST_NAME = "HostName";
    /**
     * The name of the property holding the gateway's host name.
     */
    public static final String PROPERTY_GATEWAY_HOST_NAME = "GatewayHostName";
    /**
     * The name of the property holding the shared access policy name.
     */
    public static final String PROPERTY_SHARED_ACCESS_KEY_NAME = "SharedAccessKeyName";
    /**
     * The name of the property holding the shared access key.
     */
    public static final String PROPERTY_SHARED_ACCESS_KEY = "SharedAccessKey";
    /**
     * The name of the property holding a pre-issued shared access signature.
     */
    public static final String PROPERTY_SHARED_ACCESS_SIGNATURE = "SharedAccessSignature";
    /**
     * The name of the property holding the device identifier.
     */
    public static final String PROPERTY_DEVICE_ID = "DeviceId";
    /**
     * The name of the property holding the module identifier.
     */
    public static final String PROPERTY_MODULE_ID = "ModuleId";

    private static final Logger LOG = LoggerFactory.getLogger(IotHubConnectionStringParser.class);

    private static final char PROPERTY_SEPARATOR = ';';
    private static final char VALUE_SEPARATOR = '=';

    private IotHubConnectionStringParser() {
        // prevent instantiation
    }

    /**
     * Parses a connection string into connection properties.
     *
     * @param connectionString The connection string to parse.
     * @return The properties contained in the connection string.
     * @throws NullPointerException if connection string is {@code null}.
     * @throws IllegalArgumentException if the connection string contains a segment that is not
     *                                  a <em>Name=Value</em> pair or if it does not contain a host name.
     */
    public static IotHubConnectionProperties parse(final String connectionString) {
        Objects.requireNonNull(connectionString);

        final IotHubConnectionProperties result = new IotHubConnectionProperties();
        for (final String segment : connectionString.split(String.valueOf(PROPERTY_SEPARATOR))) {
            if (Strings.isNullOrBlank(segment)) {
                continue;
            }
            final int idx = segment.indexOf(VALUE_SEPARATOR);
            if (idx <= 0) {
                throw new IllegalArgumentException("connection string contains malformed property");
            }
            final String name = segment.substring(0, idx).trim();
            final String value = segment.substring(idx + 1).trim();
            setProperty(result, name, value);
        }

        if (Strings.isNullOrEmpty(result.getHostName())) {
            throw new IllegalArgumentException("connection string does not contain " + PROPERTY_HOST_NAME);
        }
        LOG.debug("parsed connection string {}", result);
        return result;
    }

    private static void setProperty(
            final IotHubConnectionProperties props,
            final String name,
            final String value) {

        switch (name.toLowerCase(Locale.ROOT)) {
        case "hostname":
            props.setHostName(value);
            break;
        case "gatewayhostname":
            props.setGatewayHostName(value);
            break;
        case "sharedaccesskeyname":
            props.setSharedAccessKeyName(value);
            break;
        case "sharedaccesskey":
            props.setSharedAccessKey(value);
            break;
        case "sharedaccesssignature":
            props.setSharedAccessSignature(value);
            break;
        case "deviceid":
            props.setDeviceId(value);
            break;
        case "moduleid":
            props.setModuleId(value);
            break;
        default:
            LOG.debug("ignoring unsupported connection string property [{}]", name);
        }
    }
}
