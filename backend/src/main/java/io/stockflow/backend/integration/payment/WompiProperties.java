package io.stockflow.backend.integration.payment;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Wompi credentials and client settings. Blank keys are allowed at startup; operations that need a
 * missing key fail with {@link PaymentGatewayConfigurationException}.
 *
 * @param baseUrl explicit API base URL; when blank it is derived from the key prefixes
 */
@ConfigurationProperties("stockflow.wompi")
public record WompiProperties(
    String publicKey,
    String privateKey,
    String eventSecret,
    String integritySecret,
    String baseUrl,
    @DefaultValue("15s") Duration timeout,
    @DefaultValue("5m") Duration merchantCacheTtl) {

  static final String PRODUCTION_URL = "https://production.wompi.co/v1";
  static final String SANDBOX_URL = "https://sandbox.wompi.co/v1";

  public String resolveBaseUrl() {
    if (hasText(baseUrl)) {
      return baseUrl;
    }
    boolean production =
        (publicKey != null && publicKey.startsWith("pub_prod_"))
            || (privateKey != null && privateKey.startsWith("prv_prod_"));
    return production ? PRODUCTION_URL : SANDBOX_URL;
  }

  public boolean isEnabled() {
    return hasText(privateKey);
  }

  static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
