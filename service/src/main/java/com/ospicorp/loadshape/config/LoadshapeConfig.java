package com.ospicorp.loadshape.config;

import com.ospicorp.loadshape.series.service.ExclusionCalendars;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LoadshapeConfig {
  private static final Logger log = LoggerFactory.getLogger(LoadshapeConfig.class);

  @Bean
  ExclusionCalendars exclusionCalendars(
      @Value("${loadshape.exclusions.first-year:2005}") int firstYear,
      @Value("${loadshape.exclusions.last-year:2035}") int lastYear) {
    log.info("Loading built-in exclusion calendars for {}-{}", firstYear, lastYear);
    return ExclusionCalendars.withBuiltIns(firstYear, lastYear);
  }
}
