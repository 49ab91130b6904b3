package io.storyforge.engine;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Scope guard over a Spring transaction: leaving the block without {@link #commit()} rolls back.
 * <pre>{@code
 * try (var tx = TurnTransaction.begin(txManager)) {
 *     ...writes...
 *     tx.commit();
 * }
 * }</pre>
 */
public final class TurnTransaction implements AutoCloseable {
    private final PlatformTransactionManager manager;
    private final TransactionStatus status;
    private boolean committed;

    private TurnTransaction(PlatformTransactionManager manager, TransactionStatus status) {
        this.manager = manager;
        this.status = status;
    }

    public static TurnTransaction begin(PlatformTransactionManager manager) {
        var definition = new DefaultTransactionDefinition();
        definition.setName("storyforge-turn");
        return new TurnTransaction(manager, manager.getTransaction(definition));
    }

    public void commit() {
        if (committed || status.isCompleted()) throw new IllegalStateException("Transaction already finished");
        manager.commit(status);
        committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (committed || status.isCompleted()) return;
        manager.rollback(status);
    }
}
