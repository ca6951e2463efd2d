package io.github.goodees.es.core;

/*-
 * #%L
 * es-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a decision or a command. It either holds a value, or a {@link Fault} with a message describing why the
 * request could not be fulfilled.
 *
 * <p>Domain rejections are not thrown, they are returned, so that a caller cannot mistake a business rule violation for
 * an infrastructure failure. Use {@link #handle(Cases)} to be forced by the compiler to deal with every fault.</p>
 *
 * @param <T> type of successful value
 */
public final class Result<T> {

    /**
     * Why a request failed.
     */
    public enum Fault {
        /**
         * Business rule rejected the request. Caller needs to change its intent, retrying will not help.
         */
        VALIDATION,
        /**
         * Stream or read model that was expected to exist is absent.
         */
        NOT_FOUND,
        /**
         * Stream was changed since the caller read it. Caller may reload, re-decide and resubmit.
         */
        CONCURRENCY_CONFLICT,
        /**
         * History or read models are corrupted, or a projection is buggy. Not recoverable by the caller.
         */
        INCONSISTENCY
    }

    private final T value;
    private final Fault fault;
    private final String message;

    private Result(T value, Fault fault, String message) {
        this.value = value;
        this.fault = fault;
        this.message = message;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null, null);
    }

    public static <T> Result<T> failure(Fault fault, String message) {
        return new Result<>(null, Objects.requireNonNull(fault, "Fault cannot be null"), message);
    }

    public static <T> Result<T> validation(String message) {
        return failure(Fault.VALIDATION, message);
    }

    public static <T> Result<T> notFound(String message) {
        return failure(Fault.NOT_FOUND, message);
    }

    public static <T> Result<T> conflict(String message) {
        return failure(Fault.CONCURRENCY_CONFLICT, message);
    }

    public static <T> Result<T> inconsistency(String message) {
        return failure(Fault.INCONSISTENCY, message);
    }

    public boolean isSuccess() {
        return fault == null;
    }

    public boolean isFailure() {
        return fault != null;
    }

    /**
     * Return the value of successful result.
     * @return the value
     * @throws IllegalStateException when the result is a failure
     */
    public T get() {
        if (isFailure()) {
            throw new IllegalStateException("Result is a failure: " + fault + " " + message);
        }
        return value;
    }

    /**
     * @return the fault, or null for successful result
     */
    public Fault getFault() {
        return fault;
    }

    /**
     * @return failure message, or null for successful result
     */
    public String getMessage() {
        return message;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (isFailure()) {
            return propagate();
        }
        return success(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (isFailure()) {
            return propagate();
        }
        return mapper.apply(value);
    }

    /**
     * Re-type a failure, so it can be passed up the call chain.
     * @param <U> new value type
     * @return failure with same fault and message
     * @throws IllegalStateException when called on successful result
     */
    public <U> Result<U> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Only failures can be propagated");
        }
        return failure(fault, message);
    }

    /**
     * Exhaustive handling of the result.
     * @param cases the branch for success and for every fault
     * @param <R> type of outcome
     * @return the value returned by matching branch
     */
    public <R> R handle(Cases<? super T, R> cases) {
        if (isSuccess()) {
            return cases.success(value);
        }
        switch (fault) {
            case VALIDATION:
                return cases.validation(message);
            case NOT_FOUND:
                return cases.notFound(message);
            case CONCURRENCY_CONFLICT:
                return cases.conflict(message);
            case INCONSISTENCY:
                return cases.inconsistency(message);
            default:
                throw new IllegalStateException("Unhandled fault " + fault);
        }
    }

    /**
     * Branches of {@link #handle(Cases)}.
     */
    public interface Cases<T, R> {
        R success(T value);

        R validation(String message);

        R notFound(String message);

        R conflict(String message);

        R inconsistency(String message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Result<?> that = (Result<?>) o;
        return Objects.equals(value, that.value) && fault == that.fault && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, fault, message);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Result{success=" + value + '}' : "Result{" + fault + ": " + message + '}';
    }
}
