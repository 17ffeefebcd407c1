package net.syncron.core.spi;

import net.syncron.core.error.DuplicateOccurrenceException;
import net.syncron.core.model.RunRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 공유 저장소 위의 실행 원장. (intendedAt, name) 유니크 제약이 곧 분산 선점 수단이다.
 * 구현체는 TxRunner 가 열어준 트랜잭션 안에서 호출된다고 가정한다.
 */
public interface RunLedger {
    /** 스키마/유니크 인덱스 준비. 여러 번 호출해도 안전해야 한다. */
    void prepare() throws Exception;

    /**
     * 발생 1건을 선점(INSERT). 이미 행이 있으면 {@link DuplicateOccurrenceException}.
     * @return 생성된 레코드 id
     */
    long claim(Instant intendedAt, String name, Instant startedAt) throws DuplicateOccurrenceException, Exception;

    void complete(long recordId, Instant finishedAt, String result) throws Exception;

    void fail(long recordId, Instant finishedAt, String error) throws Exception;

    Optional<RunRecord> findById(long recordId) throws Exception;

    Optional<RunRecord> findByOccurrence(Instant intendedAt, String name) throws Exception;

    /** 최근 것부터 */
    List<RunRecord> findByName(String name, int limit) throws Exception;

    /** 보존 기간 정리: startedAt < threshold 인 행 삭제 */
    int expireStartedBefore(Instant threshold) throws Exception;

    /** 테스트 reset 용 */
    int deleteAll() throws Exception;
}
