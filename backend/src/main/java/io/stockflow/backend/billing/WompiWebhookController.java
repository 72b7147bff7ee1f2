package io.stockflow.backend.billing;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated endpoint for gateway events; authenticity comes from the event checksum. */
@RestController
@RequestMapping("/api/webhooks/wompi")
public class WompiWebhookController {

  private final WompiWebhookService webhookService;

  public WompiWebhookController(WompiWebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @PostMapping
  public ResponseEntity<Void> handleWebhook(@RequestBody(required = false) String payload) {
    webhookService.processWebhook(payload);
    return ResponseEntity.ok().build();
  }
}
