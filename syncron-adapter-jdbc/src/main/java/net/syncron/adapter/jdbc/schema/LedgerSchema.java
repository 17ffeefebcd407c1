package net.syncron.adapter.jdbc.schema;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 원장 테이블 + (INTENDED_AT, JOB_NAME) 유니크 인덱스 + STARTED_AT 인덱스를 Flyway 로 준비한다.
 * 저장소 이름마다 테이블과 Flyway 이력 테이블이 따로 생겨 한 스키마에 여러 원장이 공존할 수 있다.
 */
public final class LedgerSchema {
    private static final Logger log = LoggerFactory.getLogger(LedgerSchema.class);

    public static final String LOCATION = "classpath:syncron/ledger-migration";
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Z][A-Z0-9_]{0,19}");

    private final DataSource ds;
    private final String table;

    public LedgerSchema(DataSource ds, String storeName) {
        this.ds = ds;
        this.table = tableName(storeName);
    }

    /** SQL 에 그대로 들어가는 이름이라 식별자 규칙을 다시 확인한다 */
    public static String tableName(String storeName) {
        String t = storeName == null ? "" : storeName.trim().toUpperCase(Locale.ROOT);
        if (!IDENTIFIER.matcher(t).matches()) {
            throw new IllegalArgumentException("store name must be a SQL identifier of at most 20 chars: " + storeName);
        }
        return t;
    }

    public String table() { return table; }

    public String historyTable() { return table + "_HIST"; }

    /** 여러 번, 여러 프로세스에서 호출해도 안전 (이미 적용된 버전은 건너뜀) */
    public MigrateResult migrate() {
        MigrateResult result = Flyway.configure()
                .dataSource(ds)
                .locations(LOCATION)
                .table(historyTable())
                .placeholders(Map.of("ledgerTable", table))
                // 다른 테이블이 있는 스키마에서도 V1 부터 적용
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load()
                .migrate();
        if (result.migrationsExecuted > 0) {
            log.info("Run ledger {} migrated to version {}", table, result.targetSchemaVersion);
        }
        return result;
    }
}
