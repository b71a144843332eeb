package ru.draen.ssa.ir;

import ru.draen.ssa.ast.Expr;

public class ExprRewriter {

    public Expr rewrite(Expr expr, SsaContext ctx) {
        if (expr instanceof Expr.Number) {
            return expr;
        }
        if (expr instanceof Expr.Var var) {
            return new Expr.Var(ctx.current(var.name()));
        }
        if (expr instanceof Expr.BinaryOp binary) {
            return new Expr.BinaryOp(binary.op(),
                    rewrite(binary.left(), ctx),
                    rewrite(binary.right(), ctx));
        }
        if (expr instanceof Expr.Condition condition) {
            return new Expr.Condition(condition.op(),
                    rewrite(condition.left(), ctx),
                    rewrite(condition.right(), ctx));
        }
        // pass-through for anything the rewriter does not know
        return expr;
    }
}
