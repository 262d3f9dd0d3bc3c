package io.pricelake.financial.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientException;

final class Transactions {
    private static final Logger log = LoggerFactory.getLogger(Transactions.class);

    private Transactions() {}

    @FunctionalInterface
    interface SqlWork<T> {
        T apply(Connection c) throws SQLException;
    }

    /**
     * Runs {@code work} on {@code c} as one transaction: committed when it returns, rolled back when it throws or
     * when the calling thread was interrupted meanwhile.
     */
    static <T> T inTransaction(Connection c, SqlWork<T> work) throws SQLException {
        boolean autoCommit = c.getAutoCommit();
        c.setAutoCommit(false);
        try {
            T result = work.apply(c);
            if (Thread.currentThread().isInterrupted()) throw new SQLTransientException("interrupted before commit");
            c.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            try {
                c.rollback();
            } catch (SQLException rollbackError) {
                log.warn("Rollback failed: {}", rollbackError.getMessage());
                e.addSuppressed(rollbackError);
            }
            throw e;
        } finally {
            c.setAutoCommit(autoCommit);
        }
    }
}
