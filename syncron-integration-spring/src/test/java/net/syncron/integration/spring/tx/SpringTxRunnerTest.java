package net.syncron.integration.spring.tx;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.syncron.adapter.jdbc.TxContext;
import net.syncron.adapter.jdbc.repo.JdbcRunLedger;
import net.syncron.core.error.DuplicateOccurrenceException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.io.IOException;
import java.sql.Connection;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    static final Instant AT = Instant.parse("2030-01-01T00:00:00Z");

    HikariDataSource ds;
    SpringTxRunner tx;
    JdbcRunLedger ledger;

    @BeforeAll
    void setUp() throws Exception {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:spring_" + UUID.randomUUID().toString().replace("-", "") + ";MODE=Oracle;DB_CLOSE_DELAY=-1");
        cfg.setUsername("sa");
        cfg.setPassword("");
        ds = new HikariDataSource(cfg);
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
        ledger = new JdbcRunLedger(ds, "CRON_HISTORY");
        ledger.prepare();
    }

    @BeforeEach
    void clean() throws Exception {
        tx.required(ledger::deleteAll);
    }

    @AfterAll
    void tearDown() {
        ds.close();
    }

    @Test
    void duplicate_claim_surfaces_as_checked_exception() throws Exception {
        tx.requiresNew(() -> ledger.claim(AT, "job", AT));

        assertThatThrownBy(() -> tx.requiresNew(() -> ledger.claim(AT, "job", AT)))
                .isExactlyInstanceOf(DuplicateOccurrenceException.class);
    }

    @Test
    void checked_exception_rolls_back() throws Exception {
        assertThatThrownBy(() -> tx.required(() -> {
            ledger.claim(AT, "rolled", AT);
            throw new IOException("io");
        })).isExactlyInstanceOf(IOException.class).hasMessage("io");

        assertThat(tx.required(() -> ledger.findByOccurrence(AT, "rolled"))).isEmpty();
        assertThat(TxContext.get()).isNull();
    }

    @Test
    void requires_new_inside_required_uses_its_own_connection() throws Exception {
        assertThatThrownBy(() -> tx.required(() -> {
            Connection outer = TxContext.get();
            ledger.claim(AT, "outer", AT);
            tx.requiresNew(() -> {
                assertThat(TxContext.get()).isNotSameAs(outer);
                return ledger.claim(AT, "inner", AT);
            });
            assertThat(TxContext.get()).isSameAs(outer);
            throw new IllegalStateException("rollback outer");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(tx.required(() -> ledger.findByOccurrence(AT, "outer"))).isEmpty();
        assertThat(tx.required(() -> ledger.findByOccurrence(AT, "inner"))).isPresent();
    }

    @Test
    void nested_required_joins() throws Exception {
        tx.required(() -> {
            Connection outer = TxContext.get();
            return tx.required(() -> {
                assertThat(TxContext.get()).isSameAs(outer);
                return null;
            });
        });
    }
}
