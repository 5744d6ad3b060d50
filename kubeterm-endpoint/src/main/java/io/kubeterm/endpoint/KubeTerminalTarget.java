/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.endpoint;

import com.google.common.base.Preconditions;
import jakarta.annotation.Nullable;

/**
 * Container a terminal session connects to.
 *
 * @param namespace namespace of the pod
 * @param pod pod name
 * @param container container name, or null for the pod's default container
 * @param command command to execute, or null to attach to the running process
 */
public record KubeTerminalTarget(String namespace,
                                 String pod,
                                 @Nullable String container,
                                 @Nullable String command) {

  public KubeTerminalTarget {
    Preconditions.checkNotNull(namespace, "namespace cannot be null");
    Preconditions.checkNotNull(pod, "pod cannot be null");
  }

  public KubeVerb verb() {
    return KubeVerb.forCommand(command);
  }

}
