/*
 * Where: Access service layer
 * What: Deletes refresh token ledger rows past their expiry
 * Why: Keep the ledger bounded; expired rows can never be exchanged again
 */
package com.example.dcim.access.service;

import com.example.dcim.access.repository.RefreshTokenRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RefreshTokenRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(RefreshTokenRetentionService.class);

  private final RefreshTokenRepository refreshTokenRepository;
  private final Clock clock;

  public int cleanup() {
    final Instant now = Instant.now(clock);
    final int deleted = refreshTokenRepository.deleteExpired(now);
    logger.info("refresh token retention cleanup deleted={} threshold={}", deleted, now);
    return deleted;
  }
}
