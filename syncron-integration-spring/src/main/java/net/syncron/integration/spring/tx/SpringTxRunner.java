package net.syncron.integration.spring.tx;

import net.syncron.adapter.jdbc.TxContext;
import net.syncron.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 도는 TxRunner. 트랜잭션의 물리 커넥션을 TxContext 에 꽂아
 * JDBC 원장이 그대로 쓰게 한다.
 * 본문이 던진 검사 예외는 롤백 후 원래 타입 그대로 다시 던진다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        try {
            return tpl.execute(status -> bindAndCall(propagation, body));
        } catch (CheckedCarrier c) {
            throw c.checked;
        }
    }

    private <T> T bindAndCall(int propagation, Callable<T> body) {
        Connection outer = TxContext.get();
        if (outer != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
            // 진행 중인 트랜잭션 참여
            return call(body);
        }
        // REQUIRES_NEW 면 스프링이 바깥 트랜잭션을 정지시키고 새 커넥션을 묶어둔 상태
        Connection con = DataSourceUtils.getConnection(ds);
        try {
            TxContext.set(con);
            return call(body);
        } finally {
            TxContext.clear();
            if (outer != null) TxContext.set(outer);
            DataSourceUtils.releaseConnection(con, ds);
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedCarrier(e);
        }
    }

    /** TransactionCallback 을 통과시키기 위한 운반용. 롤백은 RuntimeException 규칙을 따른다 */
    private static final class CheckedCarrier extends RuntimeException {
        final Exception checked;

        CheckedCarrier(Exception checked) {
            super(checked.getMessage(), checked, false, false);
            this.checked = checked;
        }
    }
}
