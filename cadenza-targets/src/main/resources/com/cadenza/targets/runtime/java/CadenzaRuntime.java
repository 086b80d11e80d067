// Generated by the Cadenza compiler: runtime support
package ${package};

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

public final class CadenzaRuntime {
    private static final List<String> TRACKED_EFFECTS = Collections.synchronizedList(new ArrayList<String>());

    private CadenzaRuntime() {
    }

    public static void trackEffects(String function, String... effects) {
        for (String effect : effects) {
            TRACKED_EFFECTS.add(function + ":" + effect);
        }
    }

    public static List<String> trackedEffects() {
        synchronized (TRACKED_EFFECTS) {
            return new ArrayList<String>(TRACKED_EFFECTS);
        }
    }

    public static <T> T panic(String message) {
        throw new IllegalStateException(message);
    }

    /** Evaluates an expression statement whose value is unused. */
    public static void discard(Object value) {
        Objects.hashCode(value);
    }

    public static final class Unit {
        public static final Unit VALUE = new Unit();

        private Unit() {
        }

        @Override
        public String toString() {
            return "()";
        }
    }

    public static final class Result<T, E> {
        private final boolean ok;
        private final T value;
        private final E error;

        private Result(boolean ok, T value, E error) {
            this.ok = ok;
            this.value = value;
            this.error = error;
        }

        public static <T, E> Result<T, E> ok(T value) {
            return new Result<T, E>(true, value, null);
        }

        public static <T, E> Result<T, E> error(E error) {
            return new Result<T, E>(false, null, error);
        }

        public boolean isOk() {
            return ok;
        }

        public boolean isError() {
            return !ok;
        }

        public T getValue() {
            if (!ok) {
                throw new IllegalStateException("Value accessed on an Error result: " + error);
            }
            return value;
        }

        public E getError() {
            if (ok) {
                throw new IllegalStateException("Error accessed on an Ok result");
            }
            return error;
        }

        public <R> R match(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onError) {
            return ok ? onOk.apply(value) : onError.apply(error);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Result)) return false;
            Result<?, ?> other = (Result<?, ?>) o;
            return ok == other.ok && Objects.equals(value, other.value) && Objects.equals(error, other.error);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ok, value, error);
        }

        @Override
        public String toString() {
            return ok ? "Ok(" + value + ")" : "Error(" + error + ")";
        }
    }

    public static final class Option<T> {
        private static final Option<Object> NONE = new Option<Object>(false, null);

        private final boolean present;
        private final T value;

        private Option(boolean present, T value) {
            this.present = present;
            this.value = value;
        }

        public static <T> Option<T> some(T value) {
            return new Option<T>(true, value);
        }

        @SuppressWarnings("unchecked")
        public static <T> Option<T> none() {
            return (Option<T>) NONE;
        }

        public boolean isSome() {
            return present;
        }

        public boolean isNone() {
            return !present;
        }

        public T getValue() {
            if (!present) {
                throw new IllegalStateException("Value accessed on None");
            }
            return value;
        }

        public <R> R match(Function<? super T, ? extends R> onSome, Supplier<? extends R> onNone) {
            return present ? onSome.apply(value) : onNone.get();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Option)) return false;
            Option<?> other = (Option<?>) o;
            return present == other.present && Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(present, value);
        }

        @Override
        public String toString() {
            return present ? "Some(" + value + ")" : "None";
        }
    }
}
