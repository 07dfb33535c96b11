package io.intellixity.discover.server.config;

import io.intellixity.discover.governance.AccessContextResolver;
import io.intellixity.discover.governance.AccessValidator;
import io.intellixity.discover.governance.OrganizationDirectory;
import io.intellixity.discover.spi.exec.QueryEngine;
import io.intellixity.discover.spi.exec.QueryExecutor;
import io.intellixity.discover.validate.QuerySpecValidator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(DiscoverProperties.class)
public class DiscoverConfig {

  @Bean
  public PropertiesOrganizationDirectory organizationDirectory(DiscoverProperties props) {
    return new PropertiesOrganizationDirectory(props);
  }

  @Bean
  public AccessContextResolver accessContextResolver(OrganizationDirectory directory, DiscoverProperties props) {
    // LRU+TTL: role and team changes become visible within ttl-millis
    DiscoverProperties.AccessCache cache = props.getAccessCache();
    return new AccessContextResolver(directory, cache.getMaxEntries(), cache.getTtlMillis());
  }

  @Bean
  public AccessValidator accessValidator() {
    return new AccessValidator();
  }

  @Bean
  public Clock discoverClock() {
    return Clock.systemUTC();
  }

  @Bean
  public QuerySpecValidator querySpecValidator(Clock discoverClock) {
    return new QuerySpecValidator(discoverClock);
  }

  @Bean(destroyMethod = "close")
  public PooledQueryEngine queryEngine(DiscoverProperties props) {
    return new PooledQueryEngine(props.getEngine());
  }

  @Bean
  public QueryExecutor queryExecutor(QueryEngine queryEngine) {
    return new QueryExecutor(queryEngine);
  }
}
