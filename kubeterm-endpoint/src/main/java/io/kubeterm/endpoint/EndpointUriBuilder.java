/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.endpoint;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.kubeterm.commons.exception.BufferTooSmallException;
import io.kubeterm.commons.text.EndpointBuffer;
import io.kubeterm.commons.text.UrlComponentEscaper;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the path and query of the Kubernetes API server endpoint used to attach to, or execute a
 * command in, a container of a pod:
 *
 * <pre>
 * /api/v1/namespaces/{namespace}/pods/{pod}/{attach|exec}?[command=...][&amp;container=...]stdin=true&amp;stdout=true&amp;tty=true
 * </pre>
 *
 * Every identifier is percent-encoded, so none of them can add path segments or query parameters.
 * <p>
 * The terminal flags follow the last dynamic parameter without a separator, e.g.
 * {@code ...&container=mainstdin=true&stdout=true&tty=true}. Consumers of this endpoint rely on
 * that exact form.
 */
@Slf4j
public class EndpointUriBuilder {

  public static final int DEFAULT_MAX_ENDPOINT_LENGTH = 2048;

  static final String PATH_FORMAT = "/api/v1/namespaces/%s/pods/%s/%s";
  static final String COMMAND_PARAM = "command";
  static final String CONTAINER_PARAM = "container";
  static final String TERMINAL_FLAGS = "stdin=true&stdout=true&tty=true";

  private final int maxEndpointLength;
  private final EndpointParamAppender paramAppender;

  public EndpointUriBuilder() {
    this(DEFAULT_MAX_ENDPOINT_LENGTH);
  }

  /**
   * Create a builder.
   *
   * @param maxEndpointLength maximum length of the endpoint and of each of its intermediate parts
   */
  public EndpointUriBuilder(final int maxEndpointLength) {
    this(maxEndpointLength, new EndpointParamAppender(maxEndpointLength));
  }

  @VisibleForTesting
  EndpointUriBuilder(final int maxEndpointLength, final EndpointParamAppender paramAppender) {
    Preconditions.checkArgument(maxEndpointLength > 0, "max endpoint length must be positive: %s", maxEndpointLength);
    this.maxEndpointLength = maxEndpointLength;
    this.paramAppender = paramAppender;
  }

  public int getMaxEndpointLength() {
    return maxEndpointLength;
  }

  /**
   * Build the endpoint into {@code out}. Nothing is written to {@code out} if it fails.
   *
   * @param out destination buffer
   * @param namespace namespace of the pod
   * @param pod pod name
   * @param container container name, or null for the pod's default container
   * @param command command to execute, or null to attach
   * @throws BufferTooSmallException if any part of the endpoint does not fit
   */
  public void build(final EndpointBuffer out,
                    final String namespace,
                    final String pod,
                    @Nullable final String container,
                    @Nullable final String command)
      throws BufferTooSmallException {
    Preconditions.checkNotNull(namespace, "namespace cannot be null");
    Preconditions.checkNotNull(pod, "pod cannot be null");

    final String escapedNamespace = UrlComponentEscaper.escape(namespace, maxEndpointLength);
    final String escapedPod = UrlComponentEscaper.escape(pod, maxEndpointLength);
    final KubeVerb verb = KubeVerb.forCommand(command);

    final EndpointBuffer path = EndpointBuffer.withCapacity(maxEndpointLength);
    path.append(String.format(PATH_FORMAT, escapedNamespace, escapedPod, verb.getPathSegment()));

    final EndpointBuffer params = EndpointBuffer.withCapacity(maxEndpointLength);
    if (command != null) {
      paramAppender.append(params, COMMAND_PARAM, command);
    }
    if (container != null) {
      paramAppender.append(params, CONTAINER_PARAM, container);
    }

    // the first parameter carries the query delimiter itself
    if (params.isEmpty()) {
      out.append(path.toString(), EndpointParamAppender.QUERY_DELIMITER, TERMINAL_FLAGS);
    } else {
      out.append(path.toString(), params.toString(), TERMINAL_FLAGS);
    }

    log.debug("Built {} endpoint for pod {} in namespace {}", verb.getPathSegment(), pod, namespace);
  }

  /**
   * Build the endpoint.
   *
   * @param namespace namespace of the pod
   * @param pod pod name
   * @param container container name, or null for the pod's default container
   * @param command command to execute, or null to attach
   * @return endpoint path and query
   * @throws BufferTooSmallException if the endpoint is longer than the maximum endpoint length
   */
  public String build(final String namespace, final String pod, @Nullable final String container, @Nullable final String command)
      throws BufferTooSmallException {
    final EndpointBuffer out = EndpointBuffer.withCapacity(maxEndpointLength);
    build(out, namespace, pod, container, command);
    return out.toString();
  }

  public String build(final KubeTerminalTarget target) throws BufferTooSmallException {
    return build(target.namespace(), target.pod(), target.container(), target.command());
  }

}
