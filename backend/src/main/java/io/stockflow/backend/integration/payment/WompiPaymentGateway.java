package io.stockflow.backend.integration.payment;

import java.net.SocketTimeoutException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Wompi adapter. Talks to the REST API with the private key (merchant lookups use the public key),
 * unwraps the {@code {"data": ...}} envelope and maps failures onto the gateway exception types.
 */
@Component
public class WompiPaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(WompiPaymentGateway.class);

  private final WompiProperties properties;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private volatile CachedMerchant cachedMerchant;

  @Autowired
  public WompiPaymentGateway(WompiProperties properties, ObjectMapper objectMapper, Clock clock) {
    this(
        properties,
        RestClient.builder().requestFactory(timeoutRequestFactory(properties)),
        objectMapper,
        clock);
  }

  /** Uses the builder as given, so tests can bind a mock server to it. Package-private. */
  WompiPaymentGateway(
      WompiProperties properties,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper,
      Clock clock) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
    String baseUrl = properties.resolveBaseUrl();
    this.restClient = restClientBuilder.baseUrl(baseUrl).build();
    log.info("Wompi gateway initialised: baseUrl={}, enabled={}", baseUrl, properties.isEnabled());
  }

  @Override
  public String providerId() {
    return "wompi";
  }

  @Override
  public String publicKey() {
    return require(properties.publicKey(), "WOMPI_PUBLIC_KEY");
  }

  @Override
  public MerchantAcceptance getMerchantAcceptance() {
    Instant now = clock.instant();
    CachedMerchant cached = cachedMerchant;
    if (cached != null && cached.isFreshAt(now)) {
      return cached.value();
    }

    String publicKey = publicKey();
    JsonNode data =
        execute(
            "merchant lookup",
            () ->
                restClient
                    .get()
                    .uri("/merchants/{publicKey}", publicKey)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + publicKey)
                    .retrieve()
                    .body(String.class));

    var acceptance =
        new MerchantAcceptance(
            textOrNull(data.path("presigned_acceptance").path("acceptance_token")),
            textOrNull(data.path("presigned_personal_data_auth").path("acceptance_token")));
    cachedMerchant = new CachedMerchant(acceptance, now.plus(properties.merchantCacheTtl()));
    log.debug("Refreshed Wompi merchant acceptance tokens");
    return acceptance;
  }

  @Override
  public PaymentSource createPaymentSource(CreatePaymentSourceRequest request) {
    var body = new LinkedHashMap<String, Object>();
    body.put("type", "CARD");
    body.put("token", request.cardToken());
    body.put("customer_email", request.customerEmail());
    body.put("acceptance_token", request.acceptanceToken());
    if (request.personalAuthToken() != null) {
      body.put("accept_personal_auth", request.personalAuthToken());
    }

    JsonNode data = post("payment source creation", "/payment_sources", body);
    var source =
        new PaymentSource(
            textOrNull(data.path("id")),
            textOrNull(data.path("type")),
            textOrNull(data.path("status")));
    log.info("Created Wompi payment source {} with status {}", source.id(), source.status());
    return source;
  }

  @Override
  public GatewayTransaction createTransaction(CreateTransactionRequest request) {
    var body = new LinkedHashMap<String, Object>();
    body.put("amount_in_cents", request.amountInCents());
    body.put("currency", request.currency());
    body.put("customer_email", request.customerEmail());
    body.put("reference", request.reference());
    body.put("acceptance_token", request.acceptanceToken());
    if (request.personalAuthToken() != null) {
      body.put("accept_personal_auth", request.personalAuthToken());
    }
    if (request.paymentSourceId() != null) {
      body.put("payment_source_id", parseSourceId(request.paymentSourceId()));
    }
    if (request.recurrent()) {
      body.put("recurrent", true);
    }
    if (request.redirectUrl() != null) {
      body.put("redirect_url", request.redirectUrl());
    }

    var transaction =
        GatewayTransaction.fromJson(post("transaction creation", "/transactions", body));
    log.info(
        "Created Wompi transaction {} for reference {} with status {}",
        transaction.id(),
        transaction.reference(),
        transaction.rawStatus());
    return transaction;
  }

  @Override
  public GatewayTransaction getTransaction(String transactionId) {
    String privateKey = privateKey();
    JsonNode data =
        execute(
            "transaction lookup",
            () ->
                restClient
                    .get()
                    .uri("/transactions/{id}", transactionId)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + privateKey)
                    .retrieve()
                    .body(String.class));
    return GatewayTransaction.fromJson(data);
  }

  @Override
  public void voidPaymentSource(String paymentSourceId) {
    String privateKey = privateKey();
    execute(
        "payment source void",
        () ->
            restClient
                .put()
                .uri("/payment_sources/{id}/void", paymentSourceId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + privateKey)
                .retrieve()
                .body(String.class));
    log.info("Voided Wompi payment source {}", paymentSourceId);
  }

  @Override
  public String integrityHash(
      String reference, long amountInCents, String currency, String expirationTime) {
    String secret = require(properties.integritySecret(), "WOMPI_INTEGRITY_SECRET");
    return WompiSignatures.integrityHash(
        reference, amountInCents, currency, expirationTime, secret);
  }

  @Override
  public boolean verifyEventSignature(JsonNode event) {
    if (!WompiProperties.hasText(properties.eventSecret())) {
      log.warn("WOMPI_EVENT_SECRET not configured, rejecting webhook");
      return false;
    }
    return WompiSignatures.verifyEventChecksum(event, properties.eventSecret());
  }

  private JsonNode post(String operation, String path, Object body) {
    String privateKey = privateKey();
    String json = objectMapper.writeValueAsString(body);
    return execute(
        operation,
        () ->
            restClient
                .post()
                .uri(path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + privateKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(json)
                .retrieve()
                .body(String.class));
  }

  /** Runs the call, unwraps {@code data} and translates client failures. */
  private JsonNode execute(String operation, Supplier<String> call) {
    String response;
    try {
      response = call.get();
    } catch (RestClientResponseException e) {
      log.warn("Wompi {} failed: {} {}", operation, e.getStatusCode().value(), e.getStatusText());
      throw new PaymentGatewayException(
          operation, e.getStatusCode().value(), e.getStatusText(), e.getResponseBodyAsString());
    } catch (ResourceAccessException e) {
      if (isTimeout(e)) {
        log.warn("Wompi {} timed out after {}", operation, properties.timeout());
        throw new PaymentGatewayTimeoutException(operation, properties.timeout(), e);
      }
      log.warn("Wompi {} transport failure: {}", operation, e.getMessage());
      throw new PaymentGatewayTransportException(operation, e);
    }

    try {
      JsonNode root = objectMapper.readTree(response == null ? "{}" : response);
      return root.path("data");
    } catch (JacksonException e) {
      throw new PaymentGatewayTransportException(operation, e);
    }
  }

  private String privateKey() {
    return require(properties.privateKey(), "WOMPI_PRIVATE_KEY");
  }

  private static String require(String value, String name) {
    if (!WompiProperties.hasText(value)) {
      throw new PaymentGatewayConfigurationException(name);
    }
    return value;
  }

  private static boolean isTimeout(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
        return true;
      }
    }
    return false;
  }

  /** Wompi payment source ids are numeric; anything else is sent verbatim. */
  private static Object parseSourceId(String paymentSourceId) {
    try {
      return Long.parseLong(paymentSourceId);
    } catch (NumberFormatException e) {
      return paymentSourceId;
    }
  }

  private static String textOrNull(JsonNode node) {
    return node.isMissingNode() || node.isNull() ? null : node.asText();
  }

  private static JdkClientHttpRequestFactory timeoutRequestFactory(WompiProperties properties) {
    var httpClient = HttpClient.newBuilder().connectTimeout(properties.timeout()).build();
    var factory = new JdkClientHttpRequestFactory(httpClient);
    factory.setReadTimeout(properties.timeout());
    return factory;
  }

  /** Merchant tokens with their expiry; replaced as a whole, never mutated. */
  private record CachedMerchant(MerchantAcceptance value, Instant expiresAt) {

    boolean isFreshAt(Instant now) {
      return now.isBefore(expiresAt);
    }
  }
}
