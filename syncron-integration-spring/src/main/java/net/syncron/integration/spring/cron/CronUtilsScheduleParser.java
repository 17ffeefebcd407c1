package net.syncron.integration.spring.cron;

import net.syncron.core.schedule.BasicScheduleParser;
import net.syncron.core.spi.OccurrenceSource;

import java.time.ZoneId;
import java.util.Objects;

/** at/every 는 코어 구현 그대로, cron 만 cron-utils 로 */
public final class CronUtilsScheduleParser extends BasicScheduleParser {
    private final ZoneId zone;

    public CronUtilsScheduleParser(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public OccurrenceSource cron(String expression) {
        return new CronOccurrenceSource(expression, zone);
    }

    public ZoneId zone() { return zone; }
}
