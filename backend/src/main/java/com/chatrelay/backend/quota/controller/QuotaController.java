package com.chatrelay.backend.quota.controller;

import com.chatrelay.backend.common.web.TenantHeaders;
import com.chatrelay.backend.quota.model.QuotaSnapshot;
import com.chatrelay.backend.quota.service.QuotaEngine;
import io.swagger.v3.oas.annotations.Operation;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/quota")
public class QuotaController {

  private final QuotaEngine quotaEngine;

  public QuotaController(QuotaEngine quotaEngine) {
    this.quotaEngine = quotaEngine;
  }

  @GetMapping
  @Operation(summary = "Current window, cycle, bonus and lifetime budgets of the caller")
  public QuotaSnapshot quota(@RequestHeader(TenantHeaders.TENANT_ID) UUID tenantId) {
    QuotaSnapshot snapshot = quotaEngine.getQuotaSnapshot(tenantId);
    if (snapshot == null) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tenant not found");
    }
    return snapshot;
  }
}
