package ru.draen.ssa.ir;

import org.junit.jupiter.api.Test;
import ru.draen.ssa.ast.ArithOp;
import ru.draen.ssa.ast.CompareOp;
import ru.draen.ssa.ast.Expr;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SsaFormatterTest {

    private final SsaFormatter formatter = new SsaFormatter();

    @Test
    void testDefinitions() {
        var ssa = List.<SsaStmt>of(
                new SsaStmt.Def("x_1", new Expr.Number(10)),
                new SsaStmt.Def("y_1", new Expr.BinaryOp(ArithOp.ADD, new Expr.Var("x_1"), new Expr.Number(5))));

        assertEquals("x_1 := 10\ny_1 := x_1 + 5", formatter.format(ssa));
    }

    @Test
    void testBranchesAndAssertions() {
        var cond = new Expr.Condition(CompareOp.NOT_EQUALS, new Expr.Var("i_1"), new Expr.Number(-3));
        var ssa = List.<SsaStmt>of(
                new SsaStmt.Branch(BranchKind.IF, cond),
                new SsaStmt.Branch(BranchKind.WHILE, cond),
                new SsaStmt.Branch(BranchKind.FOR, cond),
                new SsaStmt.Assert(cond));

        assertEquals("""
                if i_1 != -3
                while i_1 != -3
                for i_1 != -3
                assert(i_1 != -3)""", formatter.format(ssa));
    }

    @Test
    void testNoParentheses() {
        var expr = new Expr.BinaryOp(ArithOp.MUL,
                new Expr.BinaryOp(ArithOp.SUB, new Expr.Var("a"), new Expr.Var("b")),
                new Expr.Number(2));

        assertEquals("a - b * 2", formatter.formatExpr(expr));
    }

    @Test
    void testEmpty() {
        assertEquals("", formatter.format(List.of()));
    }
}
