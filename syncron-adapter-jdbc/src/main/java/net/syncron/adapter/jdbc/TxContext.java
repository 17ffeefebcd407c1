package net.syncron.adapter.jdbc;

import java.sql.Connection;

/**
 * 현재 스레드에 묶인 트랜잭션 커넥션. {@link JdbcTxRunner} 가 열고 닫는다.
 */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();

    private TxContext() {}

    public static void set(Connection c) { LOCAL.set(c); }

    public static Connection get() { return LOCAL.get(); }

    public static void clear() { LOCAL.remove(); }

    /** 원장 구현이 쓰는 커넥션. 트랜잭션 밖에서 부르면 프로그래밍 오류다 */
    public static Connection require() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}
