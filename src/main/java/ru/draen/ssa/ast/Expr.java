package ru.draen.ssa.ast;

import java.util.Objects;

public sealed interface Expr {
    record Number(int value) implements Expr {}

    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name);
        }
    }

    record BinaryOp(ArithOp op, Expr left, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(op);
            Objects.requireNonNull(left);
            Objects.requireNonNull(right);
        }
    }

    record Condition(CompareOp op, Expr left, Expr right) implements Expr {
        public Condition {
            Objects.requireNonNull(op);
            Objects.requireNonNull(left);
            Objects.requireNonNull(right);
        }
    }
}
