/*
 * どこで: Access サービス層
 * 何を: ログイン結果/トークン拒否/認可判定/監査書き込み失敗のメトリクスを記録する
 * なぜ: 認証基盤の異常(総当たり、鍵不一致、監査欠落)を Prometheus から観測できるようにするため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.model.AccessDecision;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AccessMetrics {

  private static final String METRIC_LOGIN_TOTAL = "access.login.total";
  private static final String METRIC_TOKEN_REJECTED_TOTAL = "access.token.rejected.total";
  private static final String METRIC_AUTHORIZATION_TOTAL = "access.authorization.total";
  private static final String METRIC_AUDIT_WRITE_FAILURE_TOTAL = "access.audit.write.failure.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<AccessErrorCode, Counter> rejectedCounters =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<AccessDecision, Counter> decisionCounters =
      new ConcurrentHashMap<>();
  private final Counter auditWriteFailureCounter;

  public AccessMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.auditWriteFailureCounter =
        Counter.builder(METRIC_AUDIT_WRITE_FAILURE_TOTAL)
            .description("Total number of audit entries that failed to persist")
            .register(meterRegistry);
  }

  /** result は success / invalid_credentials / account_disabled。 */
  public void recordLogin(String result) {
    loginCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Login attempts by outcome")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTokenRejected(AccessErrorCode code) {
    rejectedCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_TOKEN_REJECTED_TOTAL)
                    .description("Tokens rejected during decode")
                    .tags(Tags.of("code", code.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDecision(AccessDecision decision) {
    decisionCounters
        .computeIfAbsent(
            decision,
            ignored ->
                Counter.builder(METRIC_AUTHORIZATION_TOTAL)
                    .description("Authorization decisions")
                    .tags(Tags.of("decision", decision.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAuditWriteFailure() {
    auditWriteFailureCounter.increment();
  }
}
