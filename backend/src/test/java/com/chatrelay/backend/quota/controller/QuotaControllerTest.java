package com.chatrelay.backend.quota.controller;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.chatrelay.backend.common.web.TenantHeaders;
import com.chatrelay.backend.quota.model.QuotaSnapshot;
import com.chatrelay.backend.quota.service.QuotaEngine;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(QuotaController.class)
class QuotaControllerTest {

  private static final UUID TENANT = UUID.fromString("8d0f4c3e-1f7a-4d52-9a55-0f3a4cf1b001");

  @Autowired private MockMvc mockMvc;

  @MockBean private QuotaEngine quotaEngine;

  @Test
  void returnsTheCallersBudgets() throws Exception {
    given(quotaEngine.getQuotaSnapshot(TENANT))
        .willReturn(
            new QuotaSnapshot(
                "Pro",
                null,
                new QuotaSnapshot.Bucket(new BigDecimal("1.2500"), new BigDecimal("100"), null),
                null,
                null,
                null));

    mockMvc
        .perform(get("/api/quota").header(TenantHeaders.TENANT_ID, TENANT.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.planName").value("Pro"))
        .andExpect(jsonPath("$.lifetime.used").value(1.25));
  }

  @Test
  void unknownTenantIsNotFound() throws Exception {
    mockMvc
        .perform(get("/api/quota").header(TenantHeaders.TENANT_ID, TENANT.toString()))
        .andExpect(status().isNotFound());
  }

  @Test
  void malformedTenantIdIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/quota").header(TenantHeaders.TENANT_ID, "not-a-uuid"))
        .andExpect(status().isBadRequest());
  }
}
