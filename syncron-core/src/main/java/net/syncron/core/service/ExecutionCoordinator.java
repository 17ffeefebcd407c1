package net.syncron.core.service;

import net.syncron.core.error.DuplicateOccurrenceException;
import net.syncron.core.log.SchedulerLog;
import net.syncron.core.model.ExecutionResult;
import net.syncron.core.model.ExecutionResult.Outcome;
import net.syncron.core.model.JobDefinition;
import net.syncron.core.model.RunRecord;
import net.syncron.core.spi.Clock;
import net.syncron.core.spi.RunLedger;
import net.syncron.core.spi.TxRunner;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.Callable;

/**
 * 발생 1건 처리: 초 절삭 → 원장 선점 → 실행 → 결과 기록.
 * 프로세스 간 동기화는 원장의 (intendedAt, name) 유니크 제약 하나로 끝난다.
 */
public final class ExecutionCoordinator {
    private final RunLedger ledger;
    private final TxRunner tx;
    private final Clock clock;
    private final SchedulerLog log;

    public ExecutionCoordinator(RunLedger ledger, TxRunner tx, Clock clock, SchedulerLog log) {
        this.ledger = ledger;
        this.tx = tx;
        this.clock = clock;
        this.log = log;
    }

    public ExecutionResult execute(JobDefinition job, Instant intendedAt) {
        Instant occurrence = intendedAt.truncatedTo(ChronoUnit.SECONDS);
        String name = job.name();

        if (!job.persist()) {
            return runUnrecorded(job, occurrence);
        }

        long recordId;
        try {
            recordId = tx.requiresNew(() -> ledger.claim(occurrence, name, clock.now()));
        } catch (DuplicateOccurrenceException e) {
            log.info("Not running \"" + name + "\" again.");
            return new ExecutionResult(name, occurrence, Outcome.SKIPPED_DUPLICATE, existingRecordId(occurrence, name));
        } catch (Exception e) {
            // 선점 여부를 모르면 실행하지 않는다 (이중 실행보다 누락이 낫다)
            log.error("Could not claim \"" + name + "\" @ " + occurrence + ", skipping this occurrence.", e);
            return new ExecutionResult(name, occurrence, Outcome.SKIPPED_STORE_ERROR, null);
        }

        try {
            log.info("Starting \"" + name + "\".");
            Object output = job.job().run(occurrence, name);
            log.info("Finished \"" + name + "\".");
            record(name, () -> {
                ledger.complete(recordId, clock.now(), stringify(output));
                return null;
            });
            return new ExecutionResult(name, occurrence, Outcome.COMPLETED, recordId);
        } catch (Throwable t) {
            String detail = SchedulerLog.stackTrace(t);
            log.error("Exception \"" + name + "\" " + detail);
            record(name, () -> {
                ledger.fail(recordId, clock.now(), detail);
                return null;
            });
            rethrowIfError(t);
            return new ExecutionResult(name, occurrence, Outcome.FAILED, recordId);
        }
    }

    private ExecutionResult runUnrecorded(JobDefinition job, Instant occurrence) {
        String name = job.name();
        try {
            log.info("Starting \"" + name + "\".");
            job.job().run(occurrence, name);
            log.info("Finished \"" + name + "\".");
            return new ExecutionResult(name, occurrence, Outcome.UNRECORDED_COMPLETED, null);
        } catch (Throwable t) {
            log.error("Exception \"" + name + "\" " + SchedulerLog.stackTrace(t));
            rethrowIfError(t);
            return new ExecutionResult(name, occurrence, Outcome.UNRECORDED_FAILED, null);
        }
    }

    /** Error 는 실패로 기록한 뒤 호출자(타이머)까지 올려 보낸다 */
    private static void rethrowIfError(Throwable t) {
        if (t instanceof Error) throw (Error) t;
    }

    /** 완료/실패 기록 오류는 이미 실행된 사실을 되돌리지 않는다 */
    private void record(String name, Callable<Void> write) {
        try {
            tx.requiresNew(write);
        } catch (Exception e) {
            log.error("Could not record outcome of \"" + name + "\".", e);
        }
    }

    private Long existingRecordId(Instant occurrence, String name) {
        try {
            return tx.required(() -> ledger.findByOccurrence(occurrence, name))
                    .map(RunRecord::id)
                    .orElse(null);
        } catch (Exception e) {
            log.debug("Could not look up existing record for \"" + name + "\": " + e.getMessage());
            return null;
        }
    }

    private static String stringify(Object output) {
        return output == null ? null : String.valueOf(output);
    }
}
