package io.github.shiftlog.workforce.application.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.Executor;

/**
 * Fire-and-forget channel for "company data changed" signals.
 * <p>
 * Inside a transaction the signal is held until commit, so a rolled back write never evicts
 * anything and a reader cannot re-cache pre-commit data. Dispatch runs on the notification
 * executor; every failure is logged and never reaches the caller.
 */
@Component
@Slf4j
public class CompanyChangeNotifier {

    private final CompanyCacheInvalidator invalidator;
    private final Executor executor;

    public CompanyChangeNotifier(CompanyCacheInvalidator invalidator,
                                 @Qualifier("notificationExecutor") Executor executor) {
        this.invalidator = invalidator;
        this.executor = executor;
    }

    public void companyChanged(Long companyId) {
        if (companyId == null) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(companyId);
                }
            });
        } else {
            dispatch(companyId);
        }
    }

    private void dispatch(Long companyId) {
        try {
            executor.execute(() -> invalidate(companyId));
        } catch (RuntimeException e) {
            log.warn("Could not schedule cache invalidation for company {}", companyId, e);
        }
    }

    private void invalidate(Long companyId) {
        try {
            invalidator.invalidate(companyId);
            log.debug("Invalidated cached stats for company {}", companyId);
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed for company {}", companyId, e);
        }
    }
}
