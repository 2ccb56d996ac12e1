package de.schliweb.idverify.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a pipeline operation: either a value or one or more {@link ValidationError} tags.
 * <p>
 * Operations that can fail on bad input (degenerate corners, missing card) return an
 * {@code Outcome} instead of throwing, so callers can keep collecting frames.
 *
 * @param <T> the type of the successful value
 */
public final class Outcome<T> {

    private final T value;
    private final List<ValidationError> errors;

    private Outcome(T value, List<ValidationError> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> Outcome<T> success(T value) {
        Objects.requireNonNull(value, "value");
        return new Outcome<>(value, Collections.emptyList());
    }

    public static <T> Outcome<T> failure(ValidationError error, ValidationError... more) {
        Objects.requireNonNull(error, "error");
        List<ValidationError> list = new ArrayList<>(1 + more.length);
        list.add(error);
        Collections.addAll(list, more);
        return new Outcome<>(null, Collections.unmodifiableList(list));
    }

    /**
     * @param errors at least one error
     * @throws IllegalArgumentException if {@code errors} is empty
     */
    public static <T> Outcome<T> failure(List<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("A failure needs at least one error");
        }
        return new Outcome<>(null, List.copyOf(errors));
    }

    public boolean isSuccess() {
        return value != null;
    }

    /**
     * @return the value
     * @throws IllegalStateException if this outcome is a failure
     */
    public T get() {
        if (value == null) {
            throw new IllegalStateException("Outcome is a failure: " + errors);
        }
        return value;
    }

    public T orElse(T other) {
        return value != null ? value : other;
    }

    public List<ValidationError> errors() {
        return errors;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (value == null) {
            return new Outcome<>(null, errors);
        }
        return Outcome.success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return value != null ? "Success[" + value + "]" : "Failure" + errors;
    }
}
