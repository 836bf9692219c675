package com.surveillance.baseline.session;

import java.util.Objects;

/**
 * Who owns the transaction boundary of an engine call.
 *
 * <ul>
 *   <li>{@link SelfManaged}: the engine opens a session, commits writes and closes it.</li>
 *   <li>{@link CallerManaged}: the engine works inside the caller's session and never
 *       commits or rolls back; the caller groups several calls and commits once.</li>
 * </ul>
 */
public sealed interface TransactionMode permits TransactionMode.SelfManaged, TransactionMode.CallerManaged {

    static TransactionMode selfManaged() {
        return SelfManaged.INSTANCE;
    }

    static TransactionMode within(BaselineSession session) {
        return new CallerManaged(session);
    }

    final class SelfManaged implements TransactionMode {

        private static final SelfManaged INSTANCE = new SelfManaged();

        private SelfManaged() {
        }

        @Override
        public String toString() {
            return "SelfManaged";
        }
    }

    record CallerManaged(BaselineSession session) implements TransactionMode {

        public CallerManaged {
            Objects.requireNonNull(session, "session");
        }
    }
}
