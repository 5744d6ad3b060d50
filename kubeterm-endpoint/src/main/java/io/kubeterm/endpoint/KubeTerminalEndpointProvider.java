/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.endpoint;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.net.HostAndPort;
import io.kubeterm.commons.exception.BufferTooSmallException;
import io.kubeterm.endpoint.config.KubeTerminalConfiguration;
import jakarta.inject.Singleton;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the configured terminal target into the endpoint the transport layer connects to.
 */
@Slf4j
@Singleton
public class KubeTerminalEndpointProvider {

  public static final String DEFAULT_NAMESPACE = "default";

  private static final String WEBSOCKET_SCHEME = "ws";
  private static final String SECURE_WEBSOCKET_SCHEME = "wss";

  private final KubeTerminalConfiguration configuration;
  private final EndpointUriBuilder endpointUriBuilder;

  public KubeTerminalEndpointProvider(final KubeTerminalConfiguration configuration, final EndpointUriBuilder endpointUriBuilder) {
    this.configuration = configuration;
    this.endpointUriBuilder = endpointUriBuilder;
  }

  /**
   * Get the configured target.
   *
   * @return target container
   * @throws IllegalStateException if no pod is configured
   */
  public KubeTerminalTarget getTarget() {
    final String pod = Strings.emptyToNull(configuration.pod());
    Preconditions.checkState(pod != null, "No Kubernetes pod configured.");
    final String namespace = Strings.isNullOrEmpty(configuration.namespace()) ? DEFAULT_NAMESPACE : configuration.namespace();
    return new KubeTerminalTarget(namespace, pod,
        Strings.emptyToNull(configuration.container()),
        Strings.emptyToNull(configuration.execCommand()));
  }

  /**
   * Get the endpoint path and query for the configured target.
   *
   * @return endpoint, relative to the API server
   * @throws BufferTooSmallException if the endpoint exceeds the configured maximum length
   */
  public String getEndpointPath() throws BufferTooSmallException {
    return buildEndpointPath(getTarget());
  }

  /**
   * Get the absolute websocket URI of the endpoint, using {@code wss} when TLS is enabled.
   *
   * @return connection URI
   * @throws BufferTooSmallException if the endpoint exceeds the configured maximum length
   */
  public URI getConnectionUri() throws BufferTooSmallException {
    Preconditions.checkState(!Strings.isNullOrEmpty(configuration.hostname()), "No Kubernetes API server hostname configured.");
    final String scheme = configuration.useSsl() ? SECURE_WEBSOCKET_SCHEME : WEBSOCKET_SCHEME;
    final HostAndPort server = HostAndPort.fromParts(configuration.hostname(), configuration.port());
    final KubeTerminalTarget target = getTarget();
    final String endpointPath = buildEndpointPath(target);

    log.info("Connecting terminal to pod {} in namespace {} through {}://{}", target.pod(), target.namespace(), scheme, server);
    return URI.create(scheme + "://" + server + endpointPath);
  }

  private String buildEndpointPath(final KubeTerminalTarget target) throws BufferTooSmallException {
    try {
      return endpointUriBuilder.build(target);
    } catch (final BufferTooSmallException e) {
      log.warn("Unable to build the {} endpoint for pod {} in namespace {}: {}",
          target.verb().getPathSegment(), target.pod(), target.namespace(), e.getMessage());
      throw e;
    }
  }

}
