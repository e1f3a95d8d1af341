package com.ospicorp.loadshape.config;

import com.ospicorp.loadshape.api.CsvHttpMessageConverter;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter());
  }

  // used by the rest baseline adapter
  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${loadshape.baseline.rest.timeout-seconds:300}") long timeoutSeconds) {
    return builder
        .setConnectTimeout(Duration.ofSeconds(10))
        .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
        .build();
  }
}
