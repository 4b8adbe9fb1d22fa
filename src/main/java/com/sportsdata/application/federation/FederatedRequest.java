package com.sportsdata.application.federation;

import com.sportsdata.domain.ports.Operation;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Everything {@link ProviderFederator} needs to resolve one read operation.
 *
 * <pre>
 * FederatedRequest.of(Operation.EVENTS, p -&gt; p.getEvents(league, date), List.&lt;Event&gt;of(), List::isEmpty)
 *     .league(league)
 *     .arguments(league, date)
 *     .date(date)
 *     .build();
 * </pre>
 */
public final class FederatedRequest<T> {

    private final Operation operation;
    private final String league;
    private final List<Object> arguments;
    private final ProviderCall<T> call;
    private final T emptyValue;
    private final Predicate<T> isEmpty;
    private final UnaryOperator<T> sanitizer;
    private final BinaryOperator<T> merger;
    private final LocalDate date;

    private FederatedRequest(Builder<T> builder) {
        this.operation = builder.operation;
        this.league = builder.league;
        this.arguments = builder.arguments;
        this.call = builder.call;
        this.emptyValue = builder.emptyValue;
        this.isEmpty = builder.isEmpty;
        this.sanitizer = builder.sanitizer;
        this.merger = builder.merger;
        this.date = builder.date;
    }

    /**
     * @param emptyValue value returned when no provider has anything
     * @param isEmpty    tells an empty provider answer from a useful one
     */
    public static <T> Builder<T> of(Operation operation, ProviderCall<T> call, T emptyValue, Predicate<T> isEmpty) {
        return new Builder<>(operation, call, emptyValue, isEmpty);
    }

    public Operation operation() {
        return operation;
    }

    /**
     * League the request is scoped to, or null when any provider may answer.
     */
    public String league() {
        return league;
    }

    public ProviderCall<T> call() {
        return call;
    }

    public T emptyValue() {
        return emptyValue;
    }

    public boolean isEmpty(T value) {
        return value == null || isEmpty.test(value);
    }

    public T sanitize(T value) {
        return value == null ? null : sanitizer.apply(value);
    }

    /**
     * Combines a higher-priority value with a lower-priority one, or null when
     * the operation cannot be merged.
     */
    public BinaryOperator<T> merger() {
        return merger;
    }

    public LocalDate date() {
        return date;
    }

    public String cacheKey() {
        return operation.key() + ":" + arguments.stream()
            .map(String::valueOf)
            .collect(Collectors.joining(":"));
    }

    @Override
    public String toString() {
        return cacheKey();
    }

    public static final class Builder<T> {

        private final Operation operation;
        private final ProviderCall<T> call;
        private final T emptyValue;
        private final Predicate<T> isEmpty;
        private String league;
        private List<Object> arguments = List.of();
        private UnaryOperator<T> sanitizer = UnaryOperator.identity();
        private BinaryOperator<T> merger;
        private LocalDate date;

        private Builder(Operation operation, ProviderCall<T> call, T emptyValue, Predicate<T> isEmpty) {
            this.operation = Objects.requireNonNull(operation, "operation");
            this.call = Objects.requireNonNull(call, "call");
            this.emptyValue = Objects.requireNonNull(emptyValue, "emptyValue");
            this.isEmpty = Objects.requireNonNull(isEmpty, "isEmpty");
        }

        public Builder<T> league(String league) {
            this.league = league;
            return this;
        }

        /**
         * Values identifying the call; null values are keyed as {@code *}.
         */
        public Builder<T> arguments(Object... arguments) {
            this.arguments = Arrays.stream(arguments)
                .map(a -> a == null ? "*" : a)
                .toList();
            return this;
        }

        /**
         * Applied to every provider answer before it is judged empty or cached.
         */
        public Builder<T> sanitizer(UnaryOperator<T> sanitizer) {
            this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
            return this;
        }

        public Builder<T> merger(BinaryOperator<T> merger) {
            this.merger = merger;
            return this;
        }

        public Builder<T> date(LocalDate date) {
            this.date = date;
            return this;
        }

        public FederatedRequest<T> build() {
            return new FederatedRequest<>(this);
        }
    }
}
