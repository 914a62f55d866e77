package dev.fathom.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * UTC clock shared by the registry and the structural indexer.
 *
 * <p>Registration and last-indexed timestamps are read from this bean, so tests can replace it
 * with {@link Clock#fixed} and assert exact instants.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock utcClock() {
    return Clock.systemUTC();
  }
}
