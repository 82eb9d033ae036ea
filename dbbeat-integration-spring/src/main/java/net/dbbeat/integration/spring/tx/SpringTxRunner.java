package net.dbbeat.integration.spring.tx;

import net.dbbeat.adapter.jdbc.TxContext;
import net.dbbeat.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * Spring 트랜잭션 위에서 JDBC 저장소를 돌린다.
 * 스프링이 잡은 물리 커넥션을 TxContext 에 꽂아주는 다리 역할.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    @Override
    public <T> T required(Callable<T> body) {
        return required.execute(status -> bound(body, false));
    }

    @Override
    public <T> T requiresNew(Callable<T> body) {
        return requiresNew.execute(status -> bound(body, true));
    }

    private <T> T bound(Callable<T> body, boolean newTx) {
        Connection outer = TxContext.get();
        // REQUIRED 중첩 호출이면 바깥 커넥션 그대로 사용
        if (outer != null && !newTx) {
            return call(body);
        }

        // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
        Connection con = DataSourceUtils.getConnection(ds);
        try {
            TxContext.set(con);
            return call(body);
        } finally {
            TxContext.clear();
            if (outer != null) TxContext.set(outer);   // REQUIRES_NEW 종료 시 바깥 복원
            DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new TxBodyException(e);
        }
    }

    /** 검사 예외를 TransactionTemplate 밖으로 옮기기 위한 래퍼 (롤백 유발) */
    public static final class TxBodyException extends RuntimeException {
        TxBodyException(Exception cause) { super(cause.getMessage(), cause); }
    }
}
