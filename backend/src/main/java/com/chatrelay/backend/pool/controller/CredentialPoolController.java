package com.chatrelay.backend.pool.controller;

import com.chatrelay.backend.pool.model.CredentialStatus;
import com.chatrelay.backend.pool.service.CredentialPool;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/pool")
@Tag(name = "Credential pool", description = "Operational view of upstream credentials")
public class CredentialPoolController {

  private final CredentialPool credentialPool;

  public CredentialPoolController(CredentialPool credentialPool) {
    this.credentialPool = credentialPool;
  }

  @GetMapping("/status")
  @Operation(summary = "Per-credential health and concurrency")
  public List<CredentialStatus> status() {
    return credentialPool.getStatus();
  }

  @PostMapping("/reload")
  @Operation(summary = "Rebuild the working set after credentials were edited")
  public List<CredentialStatus> reload() {
    credentialPool.reload();
    return credentialPool.getStatus();
  }
}
