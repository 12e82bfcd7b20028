package com.grouptab.expense.support;

import com.grouptab.expense.exception.OptimisticUpdateException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Snapshot, speculative apply, then commit or roll back.
 *
 * <p>The change is computed and installed synchronously, so readers see it at once, and the
 * remote write runs without blocking the caller. If the write fails the snapshot is restored,
 * unless another update has replaced the speculative state in the meantime, and the returned
 * future fails with {@link OptimisticUpdateException}. Exceptions thrown by {@code change} itself
 * are validation failures: they reach the caller directly and nothing is applied or written.</p>
 */
@Slf4j
public final class OptimisticUpdate {

    private OptimisticUpdate() {
    }

    public static <S> CompletableFuture<S> apply(AtomicReference<S> state,
                                                 UnaryOperator<S> change,
                                                 Function<? super S, ? extends CompletionStage<?>> remoteWrite) {
        S snapshot;
        S speculative;
        do {
            snapshot = state.get();
            speculative = change.apply(snapshot);
        } while (!state.compareAndSet(snapshot, speculative));

        final S before = snapshot;
        final S applied = speculative;

        CompletionStage<?> write;
        try {
            write = remoteWrite.apply(applied);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(rollback(state, applied, before, e));
        }
        if (write == null) {
            return CompletableFuture.completedFuture(applied);
        }

        CompletableFuture<S> result = new CompletableFuture<>();
        write.whenComplete((ignored, error) -> {
            if (error == null) {
                result.complete(applied);
            } else {
                result.completeExceptionally(rollback(state, applied, before, unwrap(error)));
            }
        });
        return result;
    }

    private static <S> OptimisticUpdateException rollback(AtomicReference<S> state, S applied, S before, Throwable cause) {
        boolean restored = state.compareAndSet(applied, before);
        if (restored) {
            log.warn("Remote write failed, local change rolled back: {}", cause.getMessage());
        } else {
            log.warn("Remote write failed after a newer local change; keeping the newer state: {}", cause.getMessage());
        }
        return new OptimisticUpdateException("Remote write failed; local change rolled back", cause);
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
