/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.commons.text;

import com.google.common.base.Preconditions;
import io.kubeterm.commons.exception.BufferTooSmallException;
import io.kubeterm.commons.exception.MalformedEndpointException;

/**
 * Bounded, length-carrying character buffer used to accumulate an endpoint URI. Every append is
 * checked against the remaining capacity before anything is written, so a failed append leaves the
 * buffer exactly as it was.
 * <p>
 * The capacity counts content characters. An output that needs {@code n} characters fits a buffer
 * of capacity {@code n} and does not fit one of capacity {@code n - 1}.
 * <p>
 * Not thread safe. A buffer is meant to be owned by the single call that builds into it.
 */
public final class EndpointBuffer {

  private static final char QUERY_DELIMITER = '?';

  private final StringBuilder content;
  private final int capacity;
  private boolean hasQuery;

  private EndpointBuffer(final int capacity) {
    this.content = new StringBuilder(Math.min(capacity, 256));
    this.capacity = capacity;
  }

  /**
   * Create an empty buffer.
   *
   * @param capacity maximum number of characters the buffer may hold
   * @return empty buffer
   */
  public static EndpointBuffer withCapacity(final int capacity) {
    Preconditions.checkArgument(capacity >= 0, "capacity must not be negative: %s", capacity);
    return new EndpointBuffer(capacity);
  }

  /**
   * Create a buffer that starts with the content of an existing endpoint.
   *
   * @param existing endpoint built so far
   * @param capacity capacity the existing endpoint was declared with
   * @return buffer holding {@code existing}
   * @throws MalformedEndpointException if {@code existing} does not fit its declared capacity
   */
  public static EndpointBuffer wrap(final CharSequence existing, final int capacity) throws MalformedEndpointException {
    Preconditions.checkNotNull(existing, "existing endpoint cannot be null");
    Preconditions.checkArgument(capacity >= 0, "capacity must not be negative: %s", capacity);
    if (existing.length() > capacity) {
      throw new MalformedEndpointException(
          String.format("existing endpoint holds %d characters but declares a capacity of %d", existing.length(), capacity));
    }
    final EndpointBuffer buffer = new EndpointBuffer(capacity);
    buffer.write(existing);
    return buffer;
  }

  /**
   * Append all parts, or nothing if together they do not fit.
   *
   * @param parts parts to append in order
   * @return this buffer
   * @throws BufferTooSmallException if the parts do not fit in the remaining capacity
   */
  public EndpointBuffer append(final CharSequence... parts) throws BufferTooSmallException {
    long required = 0;
    for (final CharSequence part : parts) {
      required += part.length();
    }
    ensureFits(required);
    for (final CharSequence part : parts) {
      write(part);
    }
    return this;
  }

  /**
   * Append the content of another buffer.
   *
   * @param other buffer to copy from
   * @return this buffer
   * @throws BufferTooSmallException if {@code other} does not fit in the remaining capacity
   */
  public EndpointBuffer append(final EndpointBuffer other) throws BufferTooSmallException {
    return append(other.content);
  }

  /**
   * Check that {@code required} more characters fit in this buffer.
   *
   * @param required number of characters about to be written
   * @throws BufferTooSmallException if they do not fit
   */
  public void ensureFits(final long required) throws BufferTooSmallException {
    if (!fits(required)) {
      throw new BufferTooSmallException((int) Math.min(Integer.MAX_VALUE, content.length() + required), capacity);
    }
  }

  public boolean fits(final long required) {
    return required <= remaining();
  }

  public int length() {
    return content.length();
  }

  public int capacity() {
    return capacity;
  }

  public int remaining() {
    return capacity - content.length();
  }

  public boolean isEmpty() {
    return content.length() == 0;
  }

  /**
   * Whether the buffer already holds a query delimiter, i.e. whether a query string has been
   * opened.
   *
   * @return true if a {@code ?} has been written
   */
  public boolean hasQuery() {
    return hasQuery;
  }

  private void write(final CharSequence part) {
    if (!hasQuery) {
      for (int i = 0; i < part.length(); i++) {
        if (part.charAt(i) == QUERY_DELIMITER) {
          hasQuery = true;
          break;
        }
      }
    }
    content.append(part);
  }

  @Override
  public String toString() {
    return content.toString();
  }

}
