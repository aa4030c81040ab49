/*******************************************************************************
 * Copyright (c) 2016, 2026 Contributors to the Eclipse Foundation
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

import java.util.Objects;

import org.eclipse.iotauth.util.Strings;

/**
 * Configuration properties identifying an IoT hub and the credentials to use for accessing it.
 * <p>
 * Instances are usually created by means of {@link IotHubConnectionStringParser} but may also
 * be populated directly, e.g. by binding to application configuration.
 * <p>
 * Apart from requiring a host name, the values are not validated.
 */
public class IotHubConnectionProperties {

    private String hostName;
    private String gatewayHostName;
    private String iotHubName;
    private String sharedAccessKeyName;
    private String sharedAccessKey;
    private String sharedAccessSignature;
    private String deviceId;
    private String moduleId;

    /**
     * Creates new properties with default values.
     */
    public IotHubConnectionProperties() {
        super();
    }

    /**
     * Creates properties based on other properties.
     *
     * @param otherProperties The properties to copy.
     * @throws NullPointerException if other properties is {@code null}.
     */
    public IotHubConnectionProperties(final IotHubConnectionProperties otherProperties) {
        Objects.requireNonNull(otherProperties);
        this.hostName = otherProperties.hostName;
        this.gatewayHostName = otherProperties.gatewayHostName;
        this.iotHubName = otherProperties.iotHubName;
        this.sharedAccessKeyName = otherProperties.sharedAccessKeyName;
        this.sharedAccessKey = otherProperties.sharedAccessKey;
        this.sharedAccessSignature = otherProperties.sharedAccessSignature;
        this.deviceId = otherProperties.deviceId;
        this.moduleId = otherProperties.moduleId;
    }

    /**
     * Gets the fully qualified host name of the IoT hub.
     *
     * @return The host name or {@code null} if not set.
     */
    public final String getHostName() {
        return hostName;
    }

    /**
     * Sets the fully qualified host name of the IoT hub.
     *
     * @param hostName The host name.
     * @throws NullPointerException if host name is {@code null}.
     */
    public final void setHostName(final String hostName) {
        this.hostName = Objects.requireNonNull(hostName);
    }

    /**
     * Gets the host name of the gateway that clients connect to instead of the IoT hub.
     *
     * @return The host name or {@code null} if not set.
     */
    public final String getGatewayHostName() {
        return gatewayHostName;
    }

    /**
     * Sets the host name of a gateway that clients should connect to instead of the IoT hub.
     *
     * @param gatewayHostName The host name or {@code null} to connect to the hub directly.
     */
    public final void setGatewayHostName(final String gatewayHostName) {
        this.gatewayHostName = gatewayHostName;
    }

    /**
     * Gets the name of the IoT hub.
     * <p>
     * If no name has been set explicitly, the name is derived from the host name by
     * means of taking the host name's first label, e.g. <em>myhub</em> for host
     * <em>myhub.example.com</em>.
     *
     * @return The name or {@code null} if neither a name nor a host name has been set.
     */
    public final String getIotHubName() {
        if (iotHubName != null) {
            return iotHubName;
        }
        if (hostName == null) {
            return null;
        }
        final int idx = hostName.indexOf('.');
        return idx < 0 ? hostName : hostName.substring(0, idx);
    }

    /**
     * Sets the name of the IoT hub.
     *
     * @param iotHubName The name or {@code null} to derive the name from the host name.
     */
    public final void setIotHubName(final String iotHubName) {
        this.iotHubName = iotHubName;
    }

    /**
     * Gets the name of the shared access policy that the key belongs to.
     *
     * @return The key name or {@code null} if not set.
     */
    public final String getSharedAccessKeyName() {
        return sharedAccessKeyName;
    }

    /**
     * Sets the name of the shared access policy that the key belongs to.
     *
     * @param sharedAccessKeyName The key name.
     */
    public final void setSharedAccessKeyName(final String sharedAccessKeyName) {
        this.sharedAccessKeyName = sharedAccessKeyName;
    }

    /**
     * Gets the Base64 encoded key to use for computing signatures.
     *
     * @return The key or {@code null} if not set.
     */
    public final String getSharedAccessKey() {
        return sharedAccessKey;
    }

    /**
     * Sets the Base64 encoded key to use for computing signatures.
     *
     * @param sharedAccessKey The key.
     */
    public final void setSharedAccessKey(final String sharedAccessKey) {
        this.sharedAccessKey = sharedAccessKey;
    }

    /**
     * Gets the pre-issued shared access signature.
     *
     * @return The signature or {@code null} if not set.
     */
    public final String getSharedAccessSignature() {
        return sharedAccessSignature;
    }

    /**
     * Sets a pre-issued shared access signature to use instead of computing signatures
     * from the shared access key.
     *
     * @param sharedAccessSignature The signature.
     */
    public final void setSharedAccessSignature(final String sharedAccessSignature) {
        this.sharedAccessSignature = sharedAccessSignature;
    }

    /**
     * Gets the identifier of the device that signatures are scoped to.
     *
     * @return The identifier or {@code null} if not set.
     */
    public final String getDeviceId() {
        return deviceId;
    }

    /**
     * Sets the identifier of the device that signatures should be scoped to.
     *
     * @param deviceId The identifier.
     */
    public final void setDeviceId(final String deviceId) {
        this.deviceId = deviceId;
    }

    /**
     * Gets the identifier of the device's module that signatures are scoped to.
     *
     * @return The identifier or {@code null} if not set.
     */
    public final String getModuleId() {
        return moduleId;
    }

    /**
     * Sets the identifier of the module that signatures should be scoped to.
     * <p>
     * The module identifier is only taken into account if a device identifier is set as well.
     *
     * @param moduleId The identifier.
     */
    public final void setModuleId(final String moduleId) {
        this.moduleId = moduleId;
    }

    /**
     * Checks if these properties contain a (non-blank) pre-issued shared access signature.
     *
     * @return {@code true} if a signature is set.
     */
    public final boolean hasSharedAccessSignature() {
        return !Strings.isNullOrBlank(sharedAccessSignature);
    }

    @Override
    public String toString() {
        return new StringBuilder("IotHubConnectionProperties [")
                .append("host: ").append(hostName)
                .append(", gateway: ").append(gatewayHostName)
                .append(", hub: ").append(getIotHubName())
                .append(", key-name: ").append(sharedAccessKeyName)
                .append(", device-id: ").append(deviceId)
                .append(", module-id: ").append(moduleId)
                .append("]")
                .toString();
    }
}
