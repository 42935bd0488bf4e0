package com.chatrelay.backend.common.web;

/** Headers set by the authenticating gateway in front of this service. */
public final class TenantHeaders {

  public static final String TENANT_ID = "X-Tenant-Id";

  private TenantHeaders() {}
}
