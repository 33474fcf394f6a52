package com.example.dcim.access.service;

public class AccessDeniedException extends RuntimeException {

  public AccessDeniedException(String message) {
    super(message);
  }

  public AccessErrorCode code() {
    return AccessErrorCode.FORBIDDEN;
  }
}
