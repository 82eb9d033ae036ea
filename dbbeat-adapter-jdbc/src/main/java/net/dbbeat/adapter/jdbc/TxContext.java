package net.dbbeat.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드에 바인딩된 트랜잭션 커넥션. 저장소 구현은 모두 여기서 커넥션을 얻는다. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }
}
