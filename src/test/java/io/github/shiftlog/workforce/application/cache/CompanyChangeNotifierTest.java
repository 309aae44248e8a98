package io.github.shiftlog.workforce.application.cache;

import io.github.shiftlog.workforce.support.RecordingCacheInvalidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class CompanyChangeNotifierTest {

    private final RecordingCacheInvalidator invalidator = new RecordingCacheInvalidator();

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void outsideTransaction_invalidatesImmediately() {
        CompanyChangeNotifier notifier = new CompanyChangeNotifier(invalidator, Runnable::run);

        notifier.companyChanged(42L);
        notifier.companyChanged(null);

        assertThat(invalidator.invalidated()).containsExactly(42L);
    }

    @Test
    void insideTransaction_waitsForCommit() {
        CompanyChangeNotifier notifier = new CompanyChangeNotifier(invalidator, Runnable::run);
        TransactionSynchronizationManager.initSynchronization();

        notifier.companyChanged(42L);
        assertThat(invalidator.invalidated()).isEmpty();

        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        synchronizations.forEach(TransactionSynchronization::afterCommit);
        assertThat(invalidator.invalidated()).containsExactly(42L);
    }

    @Test
    void rolledBackTransaction_neverInvalidates() {
        CompanyChangeNotifier notifier = new CompanyChangeNotifier(invalidator, Runnable::run);
        TransactionSynchronizationManager.initSynchronization();

        notifier.companyChanged(42L);
        TransactionSynchronizationManager.getSynchronizations()
                .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

        assertThat(invalidator.invalidated()).isEmpty();
    }

    @Test
    void invalidatorFailure_isSwallowedAndLogged() {
        CompanyCacheInvalidator broken = companyId -> {
            throw new IllegalStateException("cache down");
        };
        CompanyChangeNotifier notifier = new CompanyChangeNotifier(broken, Runnable::run);

        assertThatCode(() -> notifier.companyChanged(1L)).doesNotThrowAnyException();
    }

    @Test
    void rejectedDispatch_isSwallowedAndLogged() {
        CompanyChangeNotifier notifier = new CompanyChangeNotifier(invalidator, task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThatCode(() -> notifier.companyChanged(1L)).doesNotThrowAnyException();
        assertThat(invalidator.invalidated()).isEmpty();
    }
}
