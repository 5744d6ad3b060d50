/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.endpoint.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.annotation.Nullable;

/**
 * Kubernetes API server and target container of a terminal session, as defined in
 * application.yml. Blank optional values mean "not set".
 *
 * @param hostname API server hostname
 * @param port API server port
 * @param useSsl whether to connect over TLS
 * @param namespace namespace of the pod
 * @param pod pod name
 * @param container container name
 * @param execCommand command to execute instead of attaching
 */
@ConfigurationProperties("kubeterm.kubernetes")
public record KubeTerminalConfiguration(
                                        String hostname,
                                        int port,
                                        boolean useSsl,
                                        @Nullable String namespace,
                                        @Nullable String pod,
                                        @Nullable String container,
                                        @Nullable String execCommand) {}
