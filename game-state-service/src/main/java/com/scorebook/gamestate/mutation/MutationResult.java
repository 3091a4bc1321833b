package com.scorebook.gamestate.mutation;

/**
 * Outcome of one {@link MutationEngine#mutate} call.
 *
 * <ul>
 *   <li>{@link Status#SUCCEEDED}: the remote call returned {@code value}; the collection
 *       was reconciled.</li>
 *   <li>{@link Status#FAILED}: the remote call failed with {@code error}; the optimistic
 *       edit was rolled back and {@code message} was surfaced.</li>
 *   <li>{@link Status#SKIPPED}: the collection was not loaded; nothing happened.</li>
 * </ul>
 */
public record MutationResult<R>(Status status, R value, Throwable error, String message) {

    public enum Status { SUCCEEDED, FAILED, SKIPPED }

    public static <R> MutationResult<R> succeeded(R value) {
        return new MutationResult<>(Status.SUCCEEDED, value, null, null);
    }

    public static <R> MutationResult<R> failed(Throwable error, String message) {
        return new MutationResult<>(Status.FAILED, null, error, message);
    }

    public static <R> MutationResult<R> skipped() {
        return new MutationResult<>(Status.SKIPPED, null, null, "Collection not loaded");
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
