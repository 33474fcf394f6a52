package com.example.dcim.access.model;

public enum AccessDecision {
  ALLOWED,
  FORBIDDEN;

  public boolean isAllowed() {
    return this == ALLOWED;
  }
}
