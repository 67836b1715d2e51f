package com.example.auth.model;

/** Principal placed in the security context once a bearer token verifies. */
public record AuthenticatedUser(long identityId) {

  @Override
  public String toString() {
    return Long.toString(identityId);
  }
}
