package com.example.dcim.access.model;

import java.util.List;

public record LoginResult(
    String principalId, List<String> roles, TokenPair tokens, CapabilityFlags capabilities) {

  public LoginResult {
    roles = roles == null ? List.of() : List.copyOf(roles);
  }
}
