package com.companya.scd.engine;

import com.companya.scd.exception.InvariantViolationException;
import com.companya.scd.exception.TransactionConflictException;
import com.companya.scd.model.Classification;
import com.companya.scd.model.Delta;
import com.companya.scd.model.MergeResult;
import com.companya.scd.model.Outcome;
import com.companya.scd.model.RunContext;
import com.companya.scd.model.TableConfiguration;
import com.companya.scd.model.Versioning;
import com.companya.scd.storage.StorageConnector;
import com.companya.scd.storage.StorageExceptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Applies a classified delta to the history table.
 *
 * All mutations of a pass run inside one transaction: the close-out of a prior
 * version and the insert of its replacement commit together or not at all, and any
 * exception rolls back everything written so far. The only in-place change ever
 * made to an existing row is its {@code valid_to}/{@code is_current} pair.
 */
@Slf4j
@Component
public class VersionMerger {

    private final StorageConnector storage;
    private final TransactionTemplate transactionTemplate;

    public VersionMerger(StorageConnector storage, PlatformTransactionManager transactionManager) {
        this.storage = storage;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Applies the whole delta in a single transaction.
     */
    public MergeResult apply(Delta delta, RunContext context) {
        checkBoundaries(delta.items(), context);
        if (!delta.hasMutations()) {
            log.debug("Nothing to merge into {} for run {}", context.table().historyTable(), context.runId());
            return MergeResult.EMPTY;
        }
        return inTransaction("merge run " + context.runId() + " into " + context.table().historyTable(), () -> {
            int inserted = 0;
            int closed = 0;
            for (Classification item : delta.items()) {
                MergeResult result = applyItem(item, context);
                inserted += result.inserted();
                closed += result.closed();
            }
            return new MergeResult(inserted, closed);
        });
    }

    /**
     * Applies one classified key in its own transaction, or in the caller's if one is open.
     */
    public MergeResult apply(Classification item, RunContext context) {
        checkBoundaries(List.of(item), context);
        if (item.outcome() == Outcome.UNCHANGED) {
            return MergeResult.EMPTY;
        }
        return inTransaction("merge key " + item.key() + " into " + context.table().historyTable(),
                () -> applyItem(item, context));
    }

    private MergeResult applyItem(Classification item, RunContext context) {
        TableConfiguration table = context.table();
        return switch (item.outcome()) {
            case NEW -> {
                insert(item, context);
                log.debug("NEW: {}={}", table.businessKey(), item.key());
                yield new MergeResult(1, 0);
            }
            case CHANGED -> {
                closeOut(item, context);
                insert(item, context);
                log.debug("CHANGED: {}={}", table.businessKey(), item.key());
                yield new MergeResult(1, 1);
            }
            case REMOVED -> {
                closeOut(item, context);
                log.debug("REMOVED: {}={}", table.businessKey(), item.key());
                yield new MergeResult(0, 1);
            }
            case UNCHANGED -> MergeResult.EMPTY;
        };
    }

    private void insert(Classification item, RunContext context) {
        storage.insertVersion(context.table().historyTable(), item.source(), item.fingerprint(),
                context.asOf(), Versioning.OPEN_END);
    }

    private void closeOut(Classification item, RunContext context) {
        TableConfiguration table = context.table();
        int updated = storage.closeOut(table.historyTable(), table.businessKey(), item.key(), context.asOf());
        if (updated != 1) {
            throw new TransactionConflictException("Expected to close exactly one current version of key "
                    + item.key() + " in " + table.historyTable() + " but closed " + updated);
        }
    }

    /**
     * Every interval closed in this pass must end strictly after it started, otherwise
     * two passes collided on the same as-of and the later one would corrupt history.
     */
    private void checkBoundaries(List<Classification> items, RunContext context) {
        for (Classification item : items) {
            boolean closesPrior = item.outcome() == Outcome.CHANGED || item.outcome() == Outcome.REMOVED;
            if (closesPrior && !item.prior().validFrom().isBefore(context.asOf())) {
                throw new InvariantViolationException("As-of " + context.asOf() + " is not after the start ("
                        + item.prior().validFrom() + ") of the current version of key " + item.key());
            }
        }
    }

    private MergeResult inTransaction(String operation, Supplier<MergeResult> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (RuntimeException ex) {
            throw StorageExceptions.translateMerge(operation, ex);
        }
    }
}
