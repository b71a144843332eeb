package ru.draen.ssa.equiv;

import java.util.Objects;

public sealed interface Verdict {
    Verdict EQUIVALENT = new Equivalent();

    boolean isEquivalent();

    String describe();

    record Equivalent() implements Verdict {
        @Override
        public boolean isEquivalent() {
            return true;
        }

        @Override
        public String describe() {
            return "Programs are equivalent";
        }
    }

    record NotEquivalent(Reason reason) implements Verdict {
        public NotEquivalent {
            Objects.requireNonNull(reason);
        }

        @Override
        public boolean isEquivalent() {
            return false;
        }

        @Override
        public String describe() {
            return "Programs are not equivalent: " + reason.getMessage();
        }
    }

    enum Reason {
        DIFFERENT_VARIABLES("different variables used"),
        DIFFERENT_CONTROL_FLOW("different control flow"),
        DIFFERENT_ASSERTIONS("different assertions");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
