package io.stockflow.backend.integration.payment;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;

/**
 * SHA-256 primitives used by the Wompi integration: the checkout integrity hash and the event
 * checksum carried by webhooks.
 */
public final class WompiSignatures {

  private static final Logger log = LoggerFactory.getLogger(WompiSignatures.class);

  /**
   * Hex-encoded {@code SHA256(reference + amountInCents + currency [+ expirationTime] + secret)}.
   * The checkout widget refuses a payment whose amount or reference does not match this value.
   *
   * @param expirationTime optional ISO-8601 expiration, skipped when null or blank
   */
  public static String integrityHash(
      String reference,
      long amountInCents,
      String currency,
      String expirationTime,
      String integritySecret) {
    var payload = new StringBuilder().append(reference).append(amountInCents).append(currency);
    if (expirationTime != null && !expirationTime.isBlank()) {
      payload.append(expirationTime);
    }
    payload.append(integritySecret);
    return sha256Hex(payload.toString());
  }

  /**
   * Verifies an event of the form {@code {event, data, timestamp, signature: {properties,
   * checksum}}}. Each property path is resolved against {@code data}, the values are concatenated
   * in order, then the timestamp and the secret are appended and hashed. Returns false for any
   * malformed input; never throws.
   */
  public static boolean verifyEventChecksum(JsonNode event, String eventSecret) {
    try {
      if (event == null || eventSecret == null || eventSecret.isEmpty()) {
        return false;
      }
      JsonNode signature = event.path("signature");
      JsonNode properties = signature.path("properties");
      JsonNode checksum = signature.path("checksum");
      JsonNode data = event.path("data");
      JsonNode timestamp = event.path("timestamp");

      if (!properties.isArray()
          || !checksum.isValueNode()
          || checksum.asText().isEmpty()
          || !data.isObject()
          || !timestamp.isValueNode()) {
        log.warn("Webhook event missing required signature fields");
        return false;
      }

      var payload = new StringBuilder();
      for (int i = 0; i < properties.size(); i++) {
        payload.append(resolvePath(data, properties.get(i).asText()));
      }
      payload.append(timestamp.asText()).append(eventSecret);

      // Byte-exact: a checksum differing only in letter case is a different checksum
      byte[] computed = sha256Hex(payload.toString()).getBytes(StandardCharsets.UTF_8);
      byte[] supplied = checksum.asText().getBytes(StandardCharsets.UTF_8);
      if (computed.length != supplied.length) {
        log.warn("Webhook checksum length mismatch");
        return false;
      }
      boolean valid = MessageDigest.isEqual(computed, supplied);
      if (!valid) {
        log.warn("Webhook signature verification failed: checksum mismatch");
      }
      return valid;
    } catch (RuntimeException e) {
      log.error("Error verifying webhook signature: {}", e.getMessage());
      return false;
    }
  }

  /**
   * Resolves a dot-separated path such as {@code transaction.amount_in_cents}. A missing or null
   * node anywhere along the path, or a non-scalar result, yields the empty string.
   */
  static String resolvePath(JsonNode root, String path) {
    if (path == null || path.isEmpty()) {
      return "";
    }
    JsonNode current = root;
    for (String segment : path.split("\\.", -1)) {
      if (current == null || current.isMissingNode() || current.isNull()) {
        return "";
      }
      current = current.path(segment);
    }
    if (current == null || current.isMissingNode() || current.isNull() || !current.isValueNode()) {
      return "";
    }
    return current.asText();
  }

  static String sha256Hex(String input) {
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private WompiSignatures() {}
}
