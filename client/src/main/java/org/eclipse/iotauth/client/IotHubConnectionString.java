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
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.eclipse.iotauth.client.sas.HmacSha256SignatureBuilder;
import org.eclipse.iotauth.client.sas.SharedAccessSignatureBuilder;
import org.eclipse.iotauth.config.IotHubConnectionProperties;
import org.eclipse.iotauth.config.IotHubConnectionStringParser;
import org.eclipse.iotauth.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;

/**
 * The credentials and endpoints for connecting to an IoT hub.
 * <p>
 * Instances are immutable. All values are determined at construction time from the
 * given connection properties, however, signatures are computed anew on each invocation of
 * {@link #getPassword()}, {@link #getAuthorizationHeader()} and
 * {@link #getToken(URI, String, List)}, unless a pre-issued signature has been configured.
 * <p>
 * If a gateway host name is configured, the gateway is used as the {@linkplain #getHostName() host name}
 * to connect to. Signatures are always computed for the IoT hub's host name, though.
 * <p>
 * Instances are safe to be used concurrently by multiple threads.
 */
public final class IotHubConnectionString implements AuthorizationHeaderProvider, CbsTokenProvider {

    private static final Logger LOG = LoggerFactory.getLogger(IotHubConnectionString.class);

    private final String iotHubName;
    private final String hostName;
    private final String audience;
    private final String sharedAccessKeyName;
    private final String sharedAccessKey;
    private final String sharedAccessSignature;
    private final String deviceId;
    private final String moduleId;
    private final String gatewayHostName;
    private final URI httpsEndpoint;
    private final URI amqpEndpoint;
    private final SigningCredentials credentials;
    private final TokenTargetResolver targetResolver;
    private final Clock clock;

    /**
     * Creates connection credentials which compute signatures using HmacSHA256.
     *
     * @param props The properties to create the credentials from.
     * @throws NullPointerException if props is {@code null}.
     * @throws IllegalArgumentException if the properties do not contain a valid host name.
     */
    public IotHubConnectionString(final IotHubConnectionProperties props) {
        this(props, new HmacSha256SignatureBuilder(), Clock.systemUTC());
    }

    /**
     * Creates connection credentials.
     *
     * @param props The properties to create the credentials from.
     * @param signatureBuilder The builder to use for computing signatures.
     * @param clock The clock to use for determining the expiration time of tokens.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the properties do not contain a valid host name.
     */
    public IotHubConnectionString(
            final IotHubConnectionProperties props,
            final SharedAccessSignatureBuilder signatureBuilder,
            final Clock clock) {

        Objects.requireNonNull(props);
        Objects.requireNonNull(signatureBuilder);
        Objects.requireNonNull(clock);

        if (props.getHostName() == null) {
            throw new IllegalArgumentException("host name must be set");
        }

        this.audience = props.getHostName();
        this.gatewayHostName = props.getGatewayHostName();
        this.hostName = gatewayHostName == null || gatewayHostName.isEmpty() ? audience : gatewayHostName;
        this.iotHubName = props.getIotHubName();
        this.sharedAccessKeyName = props.getSharedAccessKeyName();
        this.sharedAccessKey = props.getSharedAccessKey();
        this.sharedAccessSignature = props.getSharedAccessSignature();
        this.deviceId = props.getDeviceId();
        this.moduleId = props.getModuleId();
        this.httpsEndpoint = createUri(Constants.SCHEME_HTTPS, hostName, Constants.PORT_UNCONFIGURED, null);
        // links are addressed at the hub itself, not the gateway
        this.amqpEndpoint = createUri(Constants.SCHEME_AMQPS, audience, Constants.PORT_AMQPS, null);
        this.credentials = SigningCredentials.from(props);
        this.targetResolver = new TokenTargetResolver(audience, deviceId, moduleId, signatureBuilder);
        this.clock = clock;

        LOG.debug("created IoT hub credentials [host: {}, audience: {}, HTTPS endpoint: {}, AMQP endpoint: {}, credentials: {}]",
                hostName, audience, httpsEndpoint, amqpEndpoint, credentials);
    }

    /**
     * Creates connection credentials from a connection string.
     *
     * @param connectionString The connection string.
     * @return The credentials.
     * @throws NullPointerException if connection string is {@code null}.
     * @throws IllegalArgumentException if the connection string cannot be parsed.
     */
    public static IotHubConnectionString parse(final String connectionString) {
        return new IotHubConnectionString(IotHubConnectionStringParser.parse(connectionString));
    }

    /**
     * Creates connection credentials from a connection string.
     *
     * @param connectionString The connection string.
     * @param signatureBuilder The builder to use for computing signatures.
     * @param clock The clock to use for determining the expiration time of tokens.
     * @return The credentials.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the connection string cannot be parsed.
     */
    public static IotHubConnectionString parse(
            final String connectionString,
            final SharedAccessSignatureBuilder signatureBuilder,
            final Clock clock) {
        return new IotHubConnectionString(
                IotHubConnectionStringParser.parse(connectionString),
                signatureBuilder,
                clock);
    }

    private static URI createUri(final String scheme, final String host, final int port, final String path) {
        try {
            return new URI(scheme, null, host, port, path, null, null);
        } catch (final URISyntaxException e) {
            throw new IllegalArgumentException("cannot create URI for host " + host, e);
        }
    }

    /**
     * Gets the name of the IoT hub.
     *
     * @return The name.
     */
    public String getIotHubName() {
        return iotHubName;
    }

    /**
     * Gets the name of the host to connect to.
     *
     * @return The gateway host name if set, otherwise the IoT hub's host name.
     */
    public String getHostName() {
        return hostName;
    }

    /**
     * Gets the resource that signatures are computed for.
     *
     * @return The IoT hub's host name.
     */
    public String getAudience() {
        return audience;
    }

    /**
     * Gets the HTTPS endpoint to connect to.
     *
     * @return The endpoint on the {@linkplain #getHostName() host}, using the default port.
     */
    public URI getHttpsEndpoint() {
        return httpsEndpoint;
    }

    /**
     * Gets the AMQP endpoint of the IoT hub.
     *
     * @return The endpoint on the {@linkplain #getAudience() IoT hub's host}, using the default AMQPS port.
     */
    public URI getAmqpEndpoint() {
        return amqpEndpoint;
    }

    /**
     * Gets the name of the shared access policy.
     *
     * @return The name or {@code null} if not set.
     */
    public String getSharedAccessKeyName() {
        return sharedAccessKeyName;
    }

    /**
     * Gets the shared access key.
     *
     * @return The key or {@code null} if not set.
     */
    public String getSharedAccessKey() {
        return sharedAccessKey;
    }

    /**
     * Gets the pre-issued shared access signature.
     *
     * @return The signature or {@code null} if not set.
     */
    public String getSharedAccessSignature() {
        return sharedAccessSignature;
    }

    /**
     * Gets the identifier of the device that signatures are scoped to.
     *
     * @return The identifier or {@code null} if not set.
     */
    public String getDeviceId() {
        return deviceId;
    }

    /**
     * Gets the identifier of the module that signatures are scoped to.
     *
     * @return The identifier or {@code null} if not set.
     */
    public String getModuleId() {
        return moduleId;
    }

    /**
     * Gets the configured gateway host name.
     *
     * @return The host name or {@code null} if not set.
     */
    public String getGatewayHostName() {
        return gatewayHostName;
    }

    /**
     * {@inheritDoc}
     *
     * @return <em>{shared access key name}@sas.root.{IoT hub name}</em>
     */
    @Override
    public String getUser() {
        return new StringBuilder()
                .append(sharedAccessKeyName)
                .append(Constants.USER_SEPARATOR)
                .append("sas.root.")
                .append(iotHubName)
                .toString();
    }

    /**
     * {@inheritDoc}
     *
     * @return The pre-issued signature or a signature that has been computed from the shared access key.
     */
    @Override
    public String getPassword() {
        return credentials.map(
                signature -> signature,
                (keyName, key) -> targetResolver.resolve(keyName, key).getValue());
    }

    /**
     * {@inheritDoc}
     * <p>
     * The header value is the same as the {@linkplain #getPassword() password}.
     */
    @Override
    public String getAuthorizationHeader() {
        return getPassword();
    }

    /**
     * {@inheritDoc}
     * <p>
     * The token is always scoped to the resource determined from this object's properties.
     * The given parameters are not taken into account. The returned future is already completed.
     * <p>
     * A token containing a pre-issued signature never expires, i.e. its expiration time is
     * {@link Instant#MAX}.
     */
    @Override
    public Future<CbsToken> getToken(
            final URI namespaceAddress,
            final String appliesTo,
            final List<String> requiredClaims) {

        final CbsToken token;
        try {
            token = credentials.map(
                    signature -> new CbsToken(signature, CbsConstants.IOT_HUB_SAS_TOKEN_TYPE, Instant.MAX),
                    (keyName, key) -> {
                        final var sas = targetResolver.resolve(keyName, key);
                        return new CbsToken(
                                sas.getValue(),
                                CbsConstants.IOT_HUB_SAS_TOKEN_TYPE,
                                clock.instant().plus(sas.getTimeToLive()));
                    });
        } catch (final RuntimeException e) {
            return Future.failedFuture(e);
        }
        return Future.succeededFuture(token);
    }

    /**
     * Creates the address of a link on the IoT hub's AMQP endpoint.
     *
     * @param path The path of the link's target or source.
     * @return The {@linkplain #getAmqpEndpoint() AMQP endpoint} with its path replaced by the given path.
     * @throws IllegalArgumentException if the path cannot be used in a URI.
     */
    public URI buildLinkAddress(final String path) {
        final String effectivePath;
        if (path == null || path.isEmpty()) {
            effectivePath = "/";
        } else if (path.charAt(0) != '/') {
            effectivePath = "/" + path;
        } else {
            effectivePath = path;
        }
        return createUri(amqpEndpoint.getScheme(), amqpEndpoint.getHost(), amqpEndpoint.getPort(), effectivePath);
    }

    @Override
    public String toString() {
        return new StringBuilder("IotHubConnectionString [")
                .append("host: ").append(hostName)
                .append(", audience: ").append(audience)
                .append(", hub: ").append(iotHubName)
                .append(", device-id: ").append(deviceId)
                .append(", module-id: ").append(moduleId)
                .append("]")
                .toString();
    }
}
