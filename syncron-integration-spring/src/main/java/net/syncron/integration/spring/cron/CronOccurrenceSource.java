package net.syncron.integration.spring.cron;

import com.cronutils.model.time.ExecutionTime;
import net.syncron.core.spi.OccurrenceSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** cron 발생 시각. 스케줄러의 시간대(LOCAL/UTC)에서 평가한다 */
public final class CronOccurrenceSource implements OccurrenceSource {
    private final String expression;
    private final ExecutionTime executionTime;
    private final ZoneId zone;

    public CronOccurrenceSource(String expression, ZoneId zone) {
        this.expression = expression;
        this.executionTime = CronExpressions.parse(expression);
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public List<Instant> next(int count, Instant after) {
        List<Instant> out = new ArrayList<>(Math.max(count, 0));
        ZonedDateTime base = after.atZone(zone);
        while (out.size() < count) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(base);
            if (next.isEmpty()) break;
            ZonedDateTime at = next.get();
            if (!at.isAfter(base)) {
                // 경계 값에서 같은 시각을 돌려주는 경우 1초 밀어서 재시도
                base = base.plusSeconds(1);
                continue;
            }
            out.add(at.toInstant());
            base = at;
        }
        return out;
    }

    @Override
    public String toString() { return "cron(" + expression + " @ " + zone + ")"; }
}
