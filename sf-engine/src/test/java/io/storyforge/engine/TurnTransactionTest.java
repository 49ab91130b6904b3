package io.storyforge.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TurnTransactionTest {

    private PlatformTransactionManager manager;
    private SimpleTransactionStatus status;

    @BeforeEach
    void setUp() {
        manager = mock(PlatformTransactionManager.class);
        status = new SimpleTransactionStatus();
        when(manager.getTransaction(any(TransactionDefinition.class))).thenReturn(status);
    }

    @Test
    void closeWithoutCommit_rollsBack() {
        try (var tx = TurnTransaction.begin(manager)) {
            assertThat(tx.isCommitted()).isFalse();
        }

        verify(manager).rollback(status);
        verify(manager, never()).commit(any());
    }

    @Test
    void commit_thenCloseDoesNotRollBack() {
        try (var tx = TurnTransaction.begin(manager)) {
            tx.commit();
            assertThat(tx.isCommitted()).isTrue();
        }

        verify(manager).commit(status);
        verify(manager, never()).rollback(any());
    }

    @Test
    void exceptionInsideBlock_rollsBack() {
        assertThatThrownBy(() -> {
            try (var tx = TurnTransaction.begin(manager)) {
                throw new IllegalStateException("boom");
            }
        }).hasMessage("boom");

        verify(manager).rollback(status);
    }

    @Test
    void secondCommit_isRejected() {
        try (var tx = TurnTransaction.begin(manager)) {
            tx.commit();
            assertThatThrownBy(tx::commit).isInstanceOf(IllegalStateException.class);
        }
        verify(manager, times(1)).commit(status);
    }
}
