package com.flamingo.ai.dealflow.service.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.dealflow.config.DealflowConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Loads reference data once at startup; a bad file stops the application from starting. */
@Configuration
public class ReferenceDataConfig {

  @Bean
  public SponsorSeedList sponsorSeedList(
      DealflowConfig config, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    return new SponsorSeedListLoader(objectMapper)
        .load(resourceLoader.getResource(config.getReference().getSponsorSeeds()));
  }

  @Bean
  public RateTable rateTable(
      DealflowConfig config, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    return new RateTableLoader(objectMapper)
        .load(resourceLoader.getResource(config.getReference().getRateTable()));
  }
}
