/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.endpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.spy;

import io.kubeterm.commons.exception.BufferTooSmallException;
import io.kubeterm.commons.text.EndpointBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.InOrder;

class EndpointUriBuilderTest {

  private static final String ATTACH_ENDPOINT = "/api/v1/namespaces/ns1/pods/pod1/attach?stdin=true&stdout=true&tty=true";
  private static final String EXEC_ENDPOINT =
      "/api/v1/namespaces/ns1/pods/pod1/exec?command=%2Fbin%2Fbash&container=mainstdin=true&stdout=true&tty=true";

  private EndpointUriBuilder builder;

  @BeforeEach
  void setup() {
    builder = new EndpointUriBuilder();
  }

  @Test
  void testAttach() throws Exception {
    assertEquals(ATTACH_ENDPOINT, builder.build("ns1", "pod1", null, null));
  }

  @Test
  void testExecInContainer() throws Exception {
    assertEquals(EXEC_ENDPOINT, builder.build("ns1", "pod1", "main", "/bin/bash"));
  }

  @ParameterizedTest
  @MethodSource("targets")
  void testEndpointForTarget(final KubeTerminalTarget target, final String expected) throws Exception {
    assertEquals(expected, builder.build(target));
  }

  private static Stream<Arguments> targets() {
    return Stream.of(
        Arguments.of(new KubeTerminalTarget("ns1", "pod1", null, null), ATTACH_ENDPOINT),
        Arguments.of(new KubeTerminalTarget("ns1", "pod1", "main", "/bin/bash"), EXEC_ENDPOINT),
        Arguments.of(new KubeTerminalTarget("ns1", "pod1", "main", null),
            "/api/v1/namespaces/ns1/pods/pod1/attach?container=mainstdin=true&stdout=true&tty=true"),
        Arguments.of(new KubeTerminalTarget("ns1", "pod1", null, "ls -la"),
            "/api/v1/namespaces/ns1/pods/pod1/exec?command=ls%20-lastdin=true&stdout=true&tty=true"),
        Arguments.of(new KubeTerminalTarget("ns1", "pod1", null, ""),
            "/api/v1/namespaces/ns1/pods/pod1/exec?command=stdin=true&stdout=true&tty=true"));
  }

  @Test
  void testInjectedCharactersAreEscaped() throws Exception {
    final String endpoint = builder.build("a/b", "p?x=1&y", "c d", "sh -c 'echo hi'");

    assertEquals("/api/v1/namespaces/a%2Fb/pods/p%3Fx%3D1%26y/exec?command=sh%20-c%20'echo%20hi'&container=c%20d"
        + "stdin=true&stdout=true&tty=true", endpoint);

    final String path = endpoint.substring(0, endpoint.indexOf('?'));
    assertThat(path.split("/")).containsExactly("", "api", "v1", "namespaces", "a%2Fb", "pods", "p%3Fx%3D1%26y", "exec");
    assertThat(endpoint.chars().filter(c -> c == '?').count()).isEqualTo(1);
  }

  @Test
  void testNonAsciiIdentifiers() throws Exception {
    assertEquals("/api/v1/namespaces/%C3%A9quipe/pods/pod1/attach?container=%E6%97%A5stdin=true&stdout=true&tty=true",
        builder.build("équipe", "pod1", "日", null));
  }

  @Test
  void testExactDestinationCapacity() throws Exception {
    final EndpointBuffer exact = EndpointBuffer.withCapacity(EXEC_ENDPOINT.length());
    builder.build(exact, "ns1", "pod1", "main", "/bin/bash");
    assertEquals(EXEC_ENDPOINT, exact.toString());

    final EndpointBuffer tooSmall = EndpointBuffer.withCapacity(EXEC_ENDPOINT.length() - 1);
    final BufferTooSmallException e =
        assertThrows(BufferTooSmallException.class, () -> builder.build(tooSmall, "ns1", "pod1", "main", "/bin/bash"));
    assertEquals(EXEC_ENDPOINT.length(), e.getRequired());
    assertTrue(tooSmall.isEmpty());
  }

  @Test
  void testMaxEndpointLength() throws Exception {
    final EndpointUriBuilder smallBuilder = new EndpointUriBuilder(ATTACH_ENDPOINT.length());
    assertEquals(ATTACH_ENDPOINT, smallBuilder.build("ns1", "pod1", null, null));
    assertThrows(BufferTooSmallException.class, () -> smallBuilder.build("ns12", "pod1", null, null));
  }

  @Test
  void testComponentLongerThanMaxEndpointLength() {
    final EndpointUriBuilder smallBuilder = new EndpointUriBuilder(16);
    assertThrows(BufferTooSmallException.class, () -> smallBuilder.build("n".repeat(17), "pod1", null, null));
    assertThrows(BufferTooSmallException.class, () -> smallBuilder.build("ns1", "/".repeat(6), null, null));
  }

  @Test
  void testCommandIsAppendedBeforeContainer() throws Exception {
    final EndpointParamAppender appender = spy(new EndpointParamAppender(EndpointUriBuilder.DEFAULT_MAX_ENDPOINT_LENGTH));
    final EndpointUriBuilder spiedBuilder = new EndpointUriBuilder(EndpointUriBuilder.DEFAULT_MAX_ENDPOINT_LENGTH, appender);

    assertEquals(EXEC_ENDPOINT, spiedBuilder.build("ns1", "pod1", "main", "/bin/bash"));

    final InOrder order = inOrder(appender);
    order.verify(appender).append(any(EndpointBuffer.class), eq(EndpointUriBuilder.COMMAND_PARAM), eq("/bin/bash"));
    order.verify(appender).append(any(EndpointBuffer.class), eq(EndpointUriBuilder.CONTAINER_PARAM), eq("main"));
  }

  @Test
  void testSharedBuilderAcrossThreads() throws Exception {
    final int builds = 2000;
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      final List<Callable<String>> tasks = new ArrayList<>();
      for (int i = 0; i < builds; i++) {
        final String pod = "pod-" + i;
        final String command = i % 2 == 0 ? "/bin/sh" : null;
        tasks.add(() -> builder.build("ns1", pod, null, command));
      }

      final List<Future<String>> results = executor.invokeAll(tasks);
      for (int i = 0; i < builds; i++) {
        final String expected = i % 2 == 0
            ? "/api/v1/namespaces/ns1/pods/pod-" + i + "/exec?command=%2Fbin%2Fshstdin=true&stdout=true&tty=true"
            : "/api/v1/namespaces/ns1/pods/pod-" + i + "/attach?stdin=true&stdout=true&tty=true";
        assertEquals(expected, results.get(i).get());
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testMissingIdentifiers() {
    assertThrows(NullPointerException.class, () -> builder.build(null, "pod1", null, null));
    assertThrows(NullPointerException.class, () -> builder.build("ns1", null, null, null));
    assertThrows(NullPointerException.class, () -> new KubeTerminalTarget("ns1", null, null, null));
  }

  @Test
  void testVerbSelection() {
    assertEquals(KubeVerb.ATTACH, KubeVerb.forCommand(null));
    assertEquals(KubeVerb.EXEC, KubeVerb.forCommand(""));
    assertEquals("exec", new KubeTerminalTarget("ns1", "pod1", null, "top").verb().getPathSegment());
  }

}
