package net.syncron.core.model;

import java.time.ZoneId;
import java.time.ZoneOffset;

/** 스케줄 평가 기준 시간대. 스케줄러 생성 시 한 번 정해지고 바뀌지 않는다. */
public enum TimeMode {
    LOCAL, UTC;

    public ZoneId zone() {
        return this == UTC ? ZoneOffset.UTC : ZoneId.systemDefault();
    }

    public static TimeMode from(String s) {
        if (s == null || s.isBlank()) return LOCAL;
        return TimeMode.valueOf(s.trim().toUpperCase());
    }
}
