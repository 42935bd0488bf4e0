package com.chatrelay.backend.billing.controller;

import com.chatrelay.backend.billing.model.RateCard;
import com.chatrelay.backend.billing.service.BillingCalculator;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/model-rates")
public class ModelRateAdminController {

  private final BillingCalculator billingCalculator;

  public ModelRateAdminController(BillingCalculator billingCalculator) {
    this.billingCalculator = billingCalculator;
  }

  @GetMapping("/{modelId}")
  @Operation(summary = "Effective rate card for a model id")
  public RateCard rateCard(@PathVariable String modelId) {
    return billingCalculator.rateCard(modelId);
  }

  @PostMapping("/cache/invalidate")
  @Operation(summary = "Drop cached rate cards after model rates were edited")
  public ResponseEntity<Void> invalidate() {
    billingCalculator.invalidateCache();
    return ResponseEntity.noContent().build();
  }
}
