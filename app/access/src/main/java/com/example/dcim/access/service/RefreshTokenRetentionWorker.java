package com.example.dcim.access.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "access.refresh-token.retention.enabled", havingValue = "true")
public class RefreshTokenRetentionWorker {

  private final RefreshTokenRetentionService retentionService;

  @Scheduled(fixedDelayString = "${access.refresh-token.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
