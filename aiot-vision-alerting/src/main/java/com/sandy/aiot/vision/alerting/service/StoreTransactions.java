package com.sandy.aiot.vision.alerting.service;

import com.sandy.aiot.vision.alerting.exception.AlertingException;
import com.sandy.aiot.vision.alerting.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Store boundary: every externally visible change runs through one of these short transactions.
 * A transient store failure is retried once before surfacing as STORE_UNAVAILABLE; lock contention
 * surfaces as CONFLICT. Business errors pass through untouched and roll the transaction back.
 */
@Component
@Slf4j
public class StoreTransactions {

    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final TransactionTemplate readOnly;

    public StoreTransactions(PlatformTransactionManager transactionManager,
                             @Value("${alerting.store.timeout-seconds:10}") int timeoutSeconds) {
        this.required = new TransactionTemplate(transactionManager);
        this.required.setTimeout(timeoutSeconds);

        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.requiresNew.setTimeout(timeoutSeconds);

        this.readOnly = new TransactionTemplate(transactionManager);
        this.readOnly.setReadOnly(true);
        this.readOnly.setTimeout(timeoutSeconds);
    }

    public <T> T write(String operation, Supplier<T> work) {
        return execute(required, operation, work);
    }

    /** Independent transaction, committed or rolled back regardless of any caller transaction. */
    public <T> T writeIsolated(String operation, Supplier<T> work) {
        return execute(requiresNew, operation, work);
    }

    public <T> T read(String operation, Supplier<T> work) {
        return execute(readOnly, operation, work);
    }

    private <T> T execute(TransactionTemplate template, String operation, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (TransientDataAccessException | DataAccessResourceFailureException first) {
            if (first instanceof PessimisticLockingFailureException) {
                throw conflict(operation, first);
            }
            log.warn("Transient store failure during {}, retrying once: {}", operation, first.getMessage());
            try {
                return template.execute(status -> work.get());
            } catch (PessimisticLockingFailureException e) {
                throw conflict(operation, e);
            } catch (TransientDataAccessException | DataAccessResourceFailureException second) {
                log.error("Store unavailable during {}", operation, second);
                throw new AlertingException(ErrorKind.STORE_UNAVAILABLE, "Store unavailable during " + operation,
                        Map.of("operation", operation), second);
            }
        } catch (TransactionTimedOutException e) {
            throw new AlertingException(ErrorKind.STORE_UNAVAILABLE, "Store operation timed out: " + operation,
                    Map.of("operation", operation), e);
        }
    }

    /**
     * Runs a write and, if it lost a uniqueness race (e.g. two ingests opening the same active group),
     * runs it once more so the second attempt observes the winner's row.
     */
    public <T> T writeRetryingOnConflict(String operation, Supplier<T> work) {
        try {
            return write(operation, work);
        } catch (DataIntegrityViolationException race) {
            log.info("Uniqueness race during {}, retrying: {}", operation, race.getMostSpecificCause().getMessage());
            try {
                return write(operation, work);
            } catch (DataIntegrityViolationException again) {
                throw new AlertingException(ErrorKind.CONFLICT, "Concurrent update conflict during " + operation,
                        Map.of("operation", operation), again);
            }
        }
    }

    private AlertingException conflict(String operation, RuntimeException cause) {
        log.warn("Lock contention during {}: {}", operation, cause.getMessage());
        return new AlertingException(ErrorKind.CONFLICT, "Lock contention during " + operation,
                Map.of("operation", operation), cause);
    }
}
