package com.chatrelay.backend.relay.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** No upstream credential could take the request. Clients may retry later. */
public class PoolExhaustedException extends ResponseStatusException {

  public PoolExhaustedException() {
    super(HttpStatus.SERVICE_UNAVAILABLE, "All upstream credentials are busy, try again shortly");
    getBody().setTitle("Upstream busy");
  }
}
