package ru.draen.ssa.ir;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.draen.ssa.ast.ArithOp;
import ru.draen.ssa.ast.CompareOp;
import ru.draen.ssa.ast.Expr;

import static org.junit.jupiter.api.Assertions.*;

class ExprRewriterTest {

    private final ExprRewriter rewriter = new ExprRewriter();
    private SsaContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new SsaContext();
        ctx.newVersion("x");
        ctx.newVersion("x");
    }

    @Test
    void testNumberUnchanged() {
        var number = new Expr.Number(42);
        assertSame(number, rewriter.rewrite(number, ctx));
    }

    @Test
    void testVarResolvesToLatestVersion() {
        assertEquals(new Expr.Var("x_2"), rewriter.rewrite(new Expr.Var("x"), ctx));
        assertEquals(new Expr.Var("free"), rewriter.rewrite(new Expr.Var("free"), ctx));
    }

    @Test
    void testOperatorsPreserved() {
        var expr = new Expr.Condition(CompareOp.LESS_EQUALS,
                new Expr.BinaryOp(ArithOp.DIV, new Expr.Var("x"), new Expr.Number(2)),
                new Expr.BinaryOp(ArithOp.MUL, new Expr.Var("y"), new Expr.Var("x")));

        assertEquals(new Expr.Condition(CompareOp.LESS_EQUALS,
                new Expr.BinaryOp(ArithOp.DIV, new Expr.Var("x_2"), new Expr.Number(2)),
                new Expr.BinaryOp(ArithOp.MUL, new Expr.Var("y"), new Expr.Var("x_2"))),
                rewriter.rewrite(expr, ctx));
    }
}
