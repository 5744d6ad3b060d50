/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.kubeterm.endpoint.config;

import io.kubeterm.endpoint.EndpointUriBuilder;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Micronaut bean factory for endpoint construction singletons.
 */
@Factory
@Slf4j
public class EndpointBeanFactory {

  @Singleton
  public EndpointUriBuilder endpointUriBuilder(@Value("${kubeterm.endpoint.max-length:2048}") final int maxEndpointLength) {
    log.debug("Using a maximum endpoint length of {}", maxEndpointLength);
    return new EndpointUriBuilder(maxEndpointLength);
  }

}
