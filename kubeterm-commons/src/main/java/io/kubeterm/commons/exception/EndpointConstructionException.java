/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.commons.exception;

/**
 * Exception raised when an endpoint URI, or one of its components, cannot be constructed.
 */
public class EndpointConstructionException extends Exception {

  public EndpointConstructionException(final String message) {
    super(message);
  }

}
