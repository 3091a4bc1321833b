package com.scorebook.gamestate.mutation;

import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * One optimistic mutation, as four named steps over the collection type {@code C}.
 *
 * <p>Every transform receives the collection value that is live at the moment it runs,
 * never a snapshot captured when the mutation started. That is what keeps concurrent
 * mutations from erasing each other.
 *
 * @param optimisticUpdate applied immediately, before the remote call
 * @param apiCall          the remote call; subscribed once
 * @param applyResult      reconciles the live value with the remote result on success
 * @param rollback         undoes this mutation's optimistic edit on the live value on failure
 * @param successMessage   optional notice surfaced on success
 * @param errorMessage     builds the user-facing message on failure
 * @param <C> collection type
 * @param <R> remote result type
 */
public record MutationDescriptor<C, R>(
    UnaryOperator<C> optimisticUpdate,
    Supplier<Mono<R>> apiCall,
    BiFunction<C, R, C> applyResult,
    UnaryOperator<C> rollback,
    String successMessage,
    Function<Throwable, String> errorMessage
) {

    public static final String DEFAULT_ERROR_MESSAGE = "Operation failed";

    public MutationDescriptor {
        Objects.requireNonNull(optimisticUpdate, "optimisticUpdate");
        Objects.requireNonNull(apiCall, "apiCall");
        Objects.requireNonNull(applyResult, "applyResult");
        Objects.requireNonNull(rollback, "rollback");
        if (errorMessage == null) {
            errorMessage = e -> DEFAULT_ERROR_MESSAGE;
        }
    }

    public static <C, R> MutationDescriptor<C, R> of(UnaryOperator<C> optimisticUpdate,
                                                     Supplier<Mono<R>> apiCall,
                                                     BiFunction<C, R, C> applyResult,
                                                     UnaryOperator<C> rollback) {
        return new MutationDescriptor<>(optimisticUpdate, apiCall, applyResult, rollback, null, null);
    }

    public MutationDescriptor<C, R> withSuccessMessage(String message) {
        return new MutationDescriptor<>(optimisticUpdate, apiCall, applyResult, rollback, message, errorMessage);
    }

    public MutationDescriptor<C, R> withErrorMessage(Function<Throwable, String> message) {
        return new MutationDescriptor<>(optimisticUpdate, apiCall, applyResult, rollback, successMessage, message);
    }
}
