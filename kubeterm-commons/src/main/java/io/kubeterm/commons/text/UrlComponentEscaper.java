/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.commons.text;

import com.google.common.base.Preconditions;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import io.kubeterm.commons.exception.BufferTooSmallException;

/**
 * Percent-encodes a single string so it can be used as one path segment or one query value of a
 * URL.
 * <p>
 * Letters, digits and {@code -_.!~*'()} are kept verbatim. Every other character is encoded as
 * UTF-8 and each resulting byte is written as {@code %XX} with uppercase hex digits. A space
 * becomes {@code %20}, never {@code +}.
 */
public final class UrlComponentEscaper {

  // non-alphanumeric characters that are never escaped
  private static final String SAFE_CHARS = "-_.!~*'()";

  private static final Escaper ESCAPER = new PercentEscaper(SAFE_CHARS, false);

  private UrlComponentEscaper() {}

  /**
   * Escape {@code input} into {@code out}. Nothing is written if the escaped form does not fit.
   *
   * @param out buffer to append to
   * @param input raw component
   * @throws BufferTooSmallException if the escaped form does not fit in {@code out}
   * @throws IllegalArgumentException if {@code input} holds an unpaired surrogate
   */
  public static void escape(final EndpointBuffer out, final String input) throws BufferTooSmallException {
    Preconditions.checkNotNull(input, "component cannot be null");
    out.append(ESCAPER.escape(input));
  }

  /**
   * Escape {@code input}.
   *
   * @param input raw component
   * @param capacity maximum length of the escaped form
   * @return escaped component
   * @throws BufferTooSmallException if the escaped form is longer than {@code capacity}
   */
  public static String escape(final String input, final int capacity) throws BufferTooSmallException {
    final EndpointBuffer out = EndpointBuffer.withCapacity(capacity);
    escape(out, input);
    return out.toString();
  }

}
