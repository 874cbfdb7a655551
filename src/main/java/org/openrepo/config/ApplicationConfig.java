package org.openrepo.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

@Configuration
@ComponentScan(basePackages = {
  "org.openrepo.oaipmh.helpers",
  "org.openrepo.oaipmh.helpers.configuration",
  "org.openrepo.oaipmh.helpers.response",
  "org.openrepo.oaipmh.validator",
  "org.openrepo.oaipmh.processors"})
@PropertySource("classpath:oai-pmh.properties")
public class ApplicationConfig {

  @Bean
  public static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
    return new PropertySourcesPlaceholderConfigurer();
  }
}
