package net.syncron.adapter.jdbc;

import java.io.StringReader;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * 시각은 UTC 벽시계(LocalDateTime)로 저장한다. JVM/세션 시간대가 달라도
 * 같은 발생 시각이 같은 값으로 들어가야 유니크 제약이 프로세스 간에 먹힌다.
 */
public final class JdbcUtil {
    private JdbcUtil() {}

    public static LocalDateTime utc(Instant i) {
        return i == null ? null : LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    }

    public static Instant toInstant(LocalDateTime t) {
        return t == null ? null : t.toInstant(ZoneOffset.UTC);
    }

    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP);
        else ps.setObject(idx, utc(i));
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        return toInstant(rs.getObject(column, LocalDateTime.class));
    }

    /** CLOB 컬럼용. 길이 제한 없는 스택 트레이스도 그대로 넣는다 */
    public static void setText(PreparedStatement ps, int idx, String s) throws SQLException {
        if (s == null) ps.setNull(idx, Types.CLOB);
        else ps.setCharacterStream(idx, new StringReader(s), s.length());
    }
}
