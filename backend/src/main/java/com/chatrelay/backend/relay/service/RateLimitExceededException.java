package com.chatrelay.backend.relay.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** The tenant sent more chat requests than its window allows. */
public class RateLimitExceededException extends ResponseStatusException {

  public RateLimitExceededException() {
    super(HttpStatus.TOO_MANY_REQUESTS, "Too many requests, please try again later");
    getBody().setTitle("Rate limit exceeded");
  }
}
