package com.expensetracker.common.tx;

import com.expensetracker.common.exception.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.function.Supplier;

@Slf4j
@Component
public class TransactionExecutor {

    private final PlatformTransactionManager transactionManager;

    public TransactionExecutor(PlatformTransactionManager transactionManager) {
        this.transactionManager = transactionManager;
    }

    /**
     * Runs {@code action} in its own REQUIRED transaction. Storage failures, including failing to
     * obtain a connection, surface as {@link StorageUnavailableException}; other exceptions roll
     * back and propagate unchanged.
     */
    public <T> T execute(String operation, Supplier<T> action) {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setName(operation);
        definition.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);

        TransactionStatus status;
        try {
            status = transactionManager.getTransaction(definition);
        } catch (TransactionException ex) {
            throw storageFailure(operation, ex);
        }

        try {
            T result = action.get();
            transactionManager.commit(status);
            return result;
        } catch (RuntimeException ex) {
            rollback(status, ex);
            if (ex instanceof DataAccessException || ex instanceof TransactionException) {
                throw storageFailure(operation, ex);
            }
            throw ex;
        } catch (Error err) {
            rollback(status, err);
            throw err;
        }
    }

    public void executeWithoutResult(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    private void rollback(TransactionStatus status, Throwable failure) {
        if (status.isCompleted()) {
            return;
        }
        try {
            transactionManager.rollback(status);
        } catch (TransactionException rollbackEx) {
            failure.addSuppressed(rollbackEx);
        }
    }

    private StorageUnavailableException storageFailure(String operation, RuntimeException cause) {
        log.error("Storage operation {} failed / 存储操作 {} 失败", operation, operation, cause);
        return new StorageUnavailableException(operation, cause);
    }
}
