package io.stockflow.backend.config;

import io.stockflow.backend.integration.payment.WompiProperties;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({WompiProperties.class, BillingConfig.BillingProperties.class})
public class BillingConfig {

  /**
   * Scheduler and checkout settings.
   *
   * @param frontendUrl base URL of the web client, used for checkout redirects and email links
   * @param renewalWindow how far ahead of {@code endDate} the recurring job charges
   * @param recurringLookback lookback relative to {@code endDate} for an existing recurring attempt
   */
  @ConfigurationProperties("stockflow.billing")
  public record BillingProperties(
      @DefaultValue("http://localhost:5173") String frontendUrl,
      @DefaultValue("3d") Duration renewalWindow,
      @DefaultValue("7d") Duration recurringLookback) {}

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
