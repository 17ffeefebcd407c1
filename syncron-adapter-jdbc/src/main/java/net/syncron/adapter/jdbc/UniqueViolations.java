package net.syncron.adapter.jdbc;

import java.sql.SQLException;
import java.util.Set;

/**
 * 벤더별 유니크 제약 위반 판별. 코어는 이 결과를 DuplicateOccurrenceException 으로만 본다.
 */
public final class UniqueViolations {
    /** SQL 표준 unique_violation (H2, PostgreSQL, HSQLDB ...) */
    static final String SQLSTATE_UNIQUE = "23505";
    static final int ORACLE_UNIQUE = 1;            // ORA-00001
    static final Set<Integer> MYSQL_DUP = Set.of(1062);
    static final Set<Integer> SQLSERVER_DUP = Set.of(2601, 2627);

    private UniqueViolations() {}

    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (matches(cur)) return true;
            Throwable cause = cur.getCause();
            while (cause != null) {
                if (cause instanceof SQLException s && matches(s)) return true;
                cause = cause.getCause();
            }
        }
        return false;
    }

    private static boolean matches(SQLException e) {
        String state = e.getSQLState();
        int code = e.getErrorCode();
        if (SQLSTATE_UNIQUE.equals(state)) return true;
        // 나머지는 무결성 위반 클래스(23xxx) 안에서만 벤더 코드를 믿는다
        if (state == null || !state.startsWith("23")) return false;
        return code == ORACLE_UNIQUE || MYSQL_DUP.contains(code) || SQLSERVER_DUP.contains(code);
    }
}
