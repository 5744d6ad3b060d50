/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.endpoint;

import jakarta.annotation.Nullable;

/**
 * Pod subresource a terminal connects to.
 */
public enum KubeVerb {

  /**
   * Attach to the main process of the container.
   */
  ATTACH("attach"),

  /**
   * Run a new command inside the container.
   */
  EXEC("exec");

  private final String pathSegment;

  KubeVerb(final String pathSegment) {
    this.pathSegment = pathSegment;
  }

  public String getPathSegment() {
    return pathSegment;
  }

  /**
   * Select the verb for an optional command: {@link #EXEC} if a command is given, {@link #ATTACH}
   * otherwise.
   *
   * @param command command to run, or null to attach
   * @return verb
   */
  public static KubeVerb forCommand(@Nullable final String command) {
    return command == null ? ATTACH : EXEC;
  }

}
