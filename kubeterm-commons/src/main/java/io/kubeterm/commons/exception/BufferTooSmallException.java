/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.commons.exception;

/**
 * Exception when a write would not fit in the remaining capacity of its target buffer. It is raised
 * before anything is written.
 */
public class BufferTooSmallException extends EndpointConstructionException {

  private static final long serialVersionUID = 4419186213304581722L;
  private final int required;
  private final int available;

  public BufferTooSmallException(final int required, final int available) {
    super(String.format("buffer too small: required %d characters, %d available", required, available));
    this.required = required;
    this.available = available;
  }

  public int getRequired() {
    return required;
  }

  public int getAvailable() {
    return available;
  }

}
