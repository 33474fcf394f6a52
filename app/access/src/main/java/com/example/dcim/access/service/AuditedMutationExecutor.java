/*
 * どこで: Access サービス層
 * 何を: 業務上の変更と監査ログ書き込みを 1 トランザクションで実行する
 * なぜ: 監査が残らない変更、変更のない監査のどちらもコミットさせないため
 */
package com.example.dcim.access.service;

import com.example.dcim.access.model.AuditAction;
import com.example.dcim.access.model.AuditEntry;
import com.example.dcim.access.model.AuditedChange;
import com.example.dcim.access.model.MutationOutcome;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class AuditedMutationExecutor {

  private static final Logger logger = LoggerFactory.getLogger(AuditedMutationExecutor.class);

  private final AuditRecorder auditRecorder;
  private final TransactionTemplate transactionTemplate;

  public AuditedMutationExecutor(
      AuditRecorder auditRecorder, PlatformTransactionManager transactionManager) {
    this.auditRecorder = auditRecorder;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * mutation の戻り値を変更後の状態として監査に残す。delete の場合は戻り値を after に使わない。
   * どちらかが失敗した場合はロールバックし、失敗の MutationOutcome を返す。
   */
  public <T> MutationOutcome<T> execute(AuditedChange change, Supplier<T> mutation) {
    if (change == null) {
      throw new IllegalArgumentException("change is required");
    }
    if (mutation == null) {
      throw new IllegalArgumentException("mutation is required");
    }
    final MutationOutcome<T> outcome;
    try {
      outcome =
          transactionTemplate.execute(
              status -> {
                final T newState = mutation.get();
                final Object after = change.action() == AuditAction.DELETE ? null : newState;
                final AuditEntry entry =
                    auditRecorder.record(
                        change.actorUserId(),
                        change.action(),
                        change.entityType(),
                        change.targetId(),
                        change.before(),
                        after,
                        change.context());
                return MutationOutcome.success(newState, entry);
              });
    } catch (AuditStorageException e) {
      logger.warn(
          "mutation rolled back because audit write failed entityType={} targetId={}",
          change.entityType(),
          change.targetId());
      return MutationOutcome.failure(e.getMessage(), e);
    } catch (RuntimeException e) {
      logger.warn(
          "mutation rolled back entityType={} targetId={} reason={}",
          change.entityType(),
          change.targetId(),
          e.getMessage());
      return MutationOutcome.failure(e.getMessage(), e);
    }
    if (outcome == null) {
      return MutationOutcome.failure("transaction returned no result", null);
    }
    return outcome;
  }
}
