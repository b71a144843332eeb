package ru.draen.ssa.ir;

import ru.draen.ssa.ast.Expr;

import java.util.Objects;

public sealed interface SsaStmt {
    record Def(String ssaName, Expr value) implements SsaStmt {
        public Def {
            Objects.requireNonNull(ssaName);
            Objects.requireNonNull(value);
        }
    }

    record Branch(BranchKind kind, Expr condition) implements SsaStmt {
        public Branch {
            Objects.requireNonNull(kind);
            Objects.requireNonNull(condition);
        }
    }

    record Assert(Expr condition) implements SsaStmt {
        public Assert {
            Objects.requireNonNull(condition);
        }
    }
}
