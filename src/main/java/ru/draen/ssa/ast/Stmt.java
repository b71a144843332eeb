package ru.draen.ssa.ast;

import java.util.List;
import java.util.Objects;

public sealed interface Stmt {
    record Assign(String name, Expr value) implements Stmt {
        public Assign {
            Objects.requireNonNull(name);
            Objects.requireNonNull(value);
        }
    }

    record If(Expr condition, List<Stmt> thenBlock, List<Stmt> elseBlock) implements Stmt {
        public If {
            Objects.requireNonNull(condition);
            thenBlock = List.copyOf(thenBlock);
            elseBlock = List.copyOf(elseBlock);
        }
    }

    record While(Expr condition, List<Stmt> body) implements Stmt {
        public While {
            Objects.requireNonNull(condition);
            body = List.copyOf(body);
        }
    }

    record For(Assign init, Expr condition, Assign update, List<Stmt> body) implements Stmt {
        public For {
            Objects.requireNonNull(init);
            Objects.requireNonNull(condition);
            Objects.requireNonNull(update);
            body = List.copyOf(body);
        }
    }

    record Assert(Expr condition) implements Stmt {
        public Assert {
            Objects.requireNonNull(condition);
        }
    }
}
