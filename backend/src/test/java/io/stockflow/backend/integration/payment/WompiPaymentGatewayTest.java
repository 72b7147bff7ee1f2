package io.stockflow.backend.integration.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

class WompiPaymentGatewayTest {

  private static final String BASE_URL = "https://sandbox.wompi.co/v1";
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();

  private MockRestServiceServer server;

  private WompiPaymentGateway gateway(WompiProperties properties, Clock clock) {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    return new WompiPaymentGateway(properties, builder, objectMapper, clock);
  }

  private WompiPaymentGateway gateway() {
    return gateway(configured(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static WompiProperties configured() {
    return new WompiProperties(
        "pub_test_123",
        "prv_test_456",
        "test_events_789",
        "test_integrity_abc",
        null,
        Duration.ofSeconds(15),
        Duration.ofMinutes(5));
  }

  // --- Merchant acceptance ---

  @Test
  void getMerchantAcceptance_readsBothTokens() {
    var gateway = gateway();
    server
        .expect(requestTo(BASE_URL + "/merchants/pub_test_123"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "Bearer pub_test_123"))
        .andRespond(withSuccess(merchantJson("acc-1", "pda-1"), MediaType.APPLICATION_JSON));

    var acceptance = gateway.getMerchantAcceptance();

    assertThat(acceptance.acceptanceToken()).isEqualTo("acc-1");
    assertThat(acceptance.personalDataAuthToken()).isEqualTo("pda-1");
    server.verify();
  }

  @Test
  void getMerchantAcceptance_isCachedWithinTtl() {
    var gateway = gateway();
    server
        .expect(ExpectedCount.once(), requestTo(BASE_URL + "/merchants/pub_test_123"))
        .andRespond(withSuccess(merchantJson("acc-1", "pda-1"), MediaType.APPLICATION_JSON));

    gateway.getMerchantAcceptance();
    var second = gateway.getMerchantAcceptance();

    assertThat(second.acceptanceToken()).isEqualTo("acc-1");
    server.verify();
  }

  @Test
  void getMerchantAcceptance_refreshesAfterTtl() {
    var clock = new MutableClock(NOW);
    var gateway = gateway(configured(), clock);
    server
        .expect(requestTo(BASE_URL + "/merchants/pub_test_123"))
        .andRespond(withSuccess(merchantJson("acc-1", "pda-1"), MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(BASE_URL + "/merchants/pub_test_123"))
        .andRespond(withSuccess(merchantJson("acc-2", "pda-2"), MediaType.APPLICATION_JSON));

    gateway.getMerchantAcceptance();
    clock.advance(Duration.ofMinutes(6));
    var refreshed = gateway.getMerchantAcceptance();

    assertThat(refreshed.acceptanceToken()).isEqualTo("acc-2");
    server.verify();
  }

  // --- Transactions ---

  @Test
  void createTransaction_recurring_sendsSourceAndRecurrentFlag() {
    var gateway = gateway();
    server
        .expect(requestTo(BASE_URL + "/transactions"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer prv_test_456"))
        .andExpect(jsonPath("$.amount_in_cents").value(14990000))
        .andExpect(jsonPath("$.currency").value("COP"))
        .andExpect(jsonPath("$.reference").value("SF-abcdef12-1"))
        .andExpect(jsonPath("$.payment_source_id").value(3891))
        .andExpect(jsonPath("$.recurrent").value(true))
        .andRespond(withSuccess(transactionJson("PENDING"), MediaType.APPLICATION_JSON));

    var transaction =
        gateway.createTransaction(
            CreateTransactionRequest.recurring(
                14_990_000L, "COP", "billing@acme.co", "SF-abcdef12-1", "acc-1", "3891"));

    assertThat(transaction.id()).isEqualTo("1234-1700000000-12345");
    assertThat(transaction.status()).isEqualTo(PaymentStatus.PENDING);
    assertThat(transaction.reference()).isEqualTo("SF-abcdef12-1");
    server.verify();
  }

  @Test
  void getTransaction_mapsStatusAndCustomerEmail() {
    var gateway = gateway();
    server
        .expect(requestTo(BASE_URL + "/transactions/1234-1700000000-12345"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess(transactionJson("APPROVED"), MediaType.APPLICATION_JSON));

    var transaction = gateway.getTransaction("1234-1700000000-12345");

    assertThat(transaction.status()).isEqualTo(PaymentStatus.APPROVED);
    assertThat(transaction.amountInCents()).isEqualTo(14_990_000L);
    assertThat(transaction.customerEmail()).isEqualTo("billing@acme.co");
    assertThat(transaction.paymentSourceId()).isEqualTo("3891");
  }

  @Test
  void createPaymentSource_returnsSourceId() {
    var gateway = gateway();
    server
        .expect(requestTo(BASE_URL + "/payment_sources"))
        .andExpect(jsonPath("$.type").value("CARD"))
        .andExpect(jsonPath("$.token").value("tok_test_1"))
        .andRespond(
            withSuccess(
                """
                {"data": {"id": 3891, "type": "CARD", "status": "AVAILABLE"}}
                """,
                MediaType.APPLICATION_JSON));

    var source =
        gateway.createPaymentSource(
            new CreatePaymentSourceRequest("tok_test_1", "billing@acme.co", "acc-1", null));

    assertThat(source.id()).isEqualTo("3891");
    assertThat(source.status()).isEqualTo("AVAILABLE");
  }

  // --- Failures ---

  @Test
  void non2xxResponse_throwsGatewayExceptionWithUpstreamStatus() {
    var gateway = gateway();
    server
        .expect(requestTo(BASE_URL + "/transactions/missing"))
        .andRespond(
            withStatus(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\": {\"type\": \"NOT_FOUND_ERROR\"}}"));

    assertThatThrownBy(() -> gateway.getTransaction("missing"))
        .isInstanceOf(PaymentGatewayException.class)
        .satisfies(
            e -> {
              var ex = (PaymentGatewayException) e;
              assertThat(ex.getUpstreamStatus()).isEqualTo(404);
              assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
            });
  }

  @Test
  void timeout_throwsTimeoutException() {
    var gateway = gateway();
    server
        .expect(requestTo(BASE_URL + "/transactions/slow"))
        .andRespond(withException(new HttpTimeoutException("request timed out")));

    assertThatThrownBy(() -> gateway.getTransaction("slow"))
        .isInstanceOf(PaymentGatewayTimeoutException.class)
        .hasMessageContaining("15000 ms");
  }

  @Test
  void connectionFailure_throwsTransportException() {
    var gateway = gateway();
    server
        .expect(requestTo(BASE_URL + "/transactions/down"))
        .andRespond(withException(new ConnectException("Connection refused")));

    assertThatThrownBy(() -> gateway.getTransaction("down"))
        .isInstanceOf(PaymentGatewayTransportException.class);
  }

  @Test
  void missingPrivateKey_failsBeforeCallingGateway() {
    var properties =
        new WompiProperties(
            "pub_test_123", "", "", "", null, Duration.ofSeconds(15), Duration.ofMinutes(5));
    var gateway = gateway(properties, Clock.fixed(NOW, ZoneOffset.UTC));

    assertThatThrownBy(() -> gateway.getTransaction("any"))
        .isInstanceOf(PaymentGatewayConfigurationException.class)
        .hasMessage("WOMPI_PRIVATE_KEY not configured");
    assertThatThrownBy(() -> gateway.integrityHash("ref", 1L, "COP", null))
        .isInstanceOf(PaymentGatewayConfigurationException.class);
    server.verify();
  }

  @Test
  void verifyEventSignature_withoutEventSecret_rejects() throws Exception {
    var properties =
        new WompiProperties(
            "pub_test_123",
            "prv_test_456",
            null,
            "x",
            null,
            Duration.ofSeconds(15),
            Duration.ofMinutes(5));
    var gateway = gateway(properties, Clock.fixed(NOW, ZoneOffset.UTC));

    assertThat(gateway.verifyEventSignature(objectMapper.readTree("{}"))).isFalse();
  }

  @Test
  void integrityHash_usesConfiguredSecret() {
    var gateway = gateway();

    assertThat(gateway.integrityHash("SF-abc-1", 100L, "COP", null))
        .isEqualTo(
            WompiSignatures.integrityHash("SF-abc-1", 100L, "COP", null, "test_integrity_abc"));
  }

  // --- Base URL ---

  @Test
  void resolveBaseUrl_followsKeyPrefixUnlessOverridden() {
    var production =
        new WompiProperties("pub_prod_1", "prv_prod_1", null, null, null, null, null);
    var sandbox = new WompiProperties("pub_test_1", "prv_test_1", null, null, null, null, null);
    var explicit =
        new WompiProperties("pub_prod_1", null, null, null, "http://localhost:9999", null, null);

    assertThat(production.resolveBaseUrl()).isEqualTo("https://production.wompi.co/v1");
    assertThat(sandbox.resolveBaseUrl()).isEqualTo("https://sandbox.wompi.co/v1");
    assertThat(explicit.resolveBaseUrl()).isEqualTo("http://localhost:9999");
    assertThat(explicit.isEnabled()).isFalse();
  }

  // --- Helpers ---

  private static String merchantJson(String acceptance, String personalData) {
    return """
        {"data": {
          "id": 1,
          "presigned_acceptance": {"acceptance_token": "%s", "type": "END_USER_POLICY"},
          "presigned_personal_data_auth": {"acceptance_token": "%s"}
        }}
        """
        .formatted(acceptance, personalData);
  }

  private static String transactionJson(String status) {
    return """
        {"data": {
          "id": "1234-1700000000-12345",
          "status": "%s",
          "reference": "SF-abcdef12-1",
          "amount_in_cents": 14990000,
          "currency": "COP",
          "customer_email": "billing@acme.co",
          "payment_method_type": "CARD",
          "payment_source_id": 3891
        }}
        """
        .formatted(status);
  }

  private static final class MutableClock extends Clock {

    private Instant instant;

    MutableClock(Instant instant) {
      this.instant = instant;
    }

    void advance(Duration duration) {
      instant = instant.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return instant;
    }
  }
}
