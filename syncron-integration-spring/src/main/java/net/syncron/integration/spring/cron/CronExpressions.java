package net.syncron.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * cron 문자열 → cron-utils ExecutionTime. 필드 수로 문법을 고른다.
 * <ul>
 *   <li>5필드: Unix (분 단위)</li>
 *   <li>6~7필드: Quartz (초 포함, 연도 선택)</li>
 * </ul>
 * 파싱 결과는 간단 LRU 로 캐시한다.
 */
public final class CronExpressions {
    private static final CronParser QUARTZ =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));
    private static final CronParser UNIX =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronExpressions() {}

    /** @throws IllegalArgumentException 문법 오류 */
    public static ExecutionTime parse(String expression) {
        Objects.requireNonNull(expression, "cron expression");
        String expr = expression.trim().replaceAll("\\s+", " ");
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(expr);
            if (cached != null) return cached;
        }
        ExecutionTime et = ExecutionTime.forCron(parserFor(expr).parse(expr));
        synchronized (CACHE) {
            CACHE.put(expr, et);
        }
        return et;
    }

    static CronParser parserFor(String expr) {
        int fields = expr.isEmpty() ? 0 : expr.split(" ").length;
        return switch (fields) {
            case 5 -> UNIX;
            case 6, 7 -> QUARTZ;
            default -> throw new IllegalArgumentException(
                    "cron expression needs 5 (unix) or 6-7 (quartz) fields, got " + fields + ": [" + expr + "]");
        };
    }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
