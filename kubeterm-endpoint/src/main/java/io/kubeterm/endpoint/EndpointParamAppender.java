/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.endpoint;

import com.google.common.base.Preconditions;
import io.kubeterm.commons.exception.BufferTooSmallException;
import io.kubeterm.commons.exception.MalformedEndpointException;
import io.kubeterm.commons.text.EndpointBuffer;
import io.kubeterm.commons.text.UrlComponentEscaper;

/**
 * Appends {@code name=value} query parameters to an endpoint. The first parameter opens the query
 * string with {@code ?}, later ones are joined with {@code &}. Values are percent-encoded, names
 * are written as given.
 */
public class EndpointParamAppender {

  static final String QUERY_DELIMITER = "?";
  static final String PARAM_DELIMITER = "&";
  static final String KEY_VALUE_SEPARATOR = "=";

  private final int maxComponentLength;

  /**
   * Create an appender.
   *
   * @param maxComponentLength maximum length of an escaped parameter value
   */
  public EndpointParamAppender(final int maxComponentLength) {
    Preconditions.checkArgument(maxComponentLength > 0, "max component length must be positive: %s", maxComponentLength);
    this.maxComponentLength = maxComponentLength;
  }

  /**
   * Append one parameter to {@code buffer}. Nothing is written if it fails.
   *
   * @param buffer endpoint built so far
   * @param name parameter name
   * @param value raw parameter value
   * @throws BufferTooSmallException if the escaped value exceeds the maximum component length, or
   *         the parameter does not fit in {@code buffer}
   */
  public void append(final EndpointBuffer buffer, final String name, final String value) throws BufferTooSmallException {
    Preconditions.checkNotNull(name, "parameter name cannot be null");
    final String escapedValue = UrlComponentEscaper.escape(value, maxComponentLength);
    final String delimiter = buffer.hasQuery() ? PARAM_DELIMITER : QUERY_DELIMITER;
    buffer.append(delimiter, name, KEY_VALUE_SEPARATOR, escapedValue);
  }

  /**
   * Append one parameter to an existing endpoint string.
   *
   * @param existing endpoint built so far
   * @param capacity maximum length of the resulting endpoint
   * @param name parameter name
   * @param value raw parameter value
   * @return endpoint with the parameter appended
   * @throws BufferTooSmallException if the parameter does not fit
   * @throws MalformedEndpointException if {@code existing} is already longer than {@code capacity}
   */
  public String append(final String existing, final int capacity, final String name, final String value)
      throws BufferTooSmallException, MalformedEndpointException {
    final EndpointBuffer buffer = EndpointBuffer.wrap(existing, capacity);
    append(buffer, name, value);
    return buffer.toString();
  }

}
