/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.commons.exception;

/**
 * Exception when an existing endpoint handed over by a caller contradicts its declared capacity.
 */
public class MalformedEndpointException extends EndpointConstructionException {

  public MalformedEndpointException(final String message) {
    super(message);
  }

}
