package ru.draen.ssa;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.visitor.GenericVisitorWithDefaults;
import ru.draen.ssa.ast.ArithOp;
import ru.draen.ssa.ast.CompareOp;
import ru.draen.ssa.ast.Expr;

public class ExpressionReader extends GenericVisitorWithDefaults<Expr, Void> {

    public Expr read(Expression expression) {
        return expression.accept(this, null);
    }

    @Override
    public Expr defaultAction(Node n, Void arg) {
        throw new ProgramSyntaxException("unsupported expression", n);
    }

    //region operations
    @Override
    public Expr visit(BinaryExpr n, Void arg) {
        var symbol = n.getOperator().asString();
        var left = n.getLeft().accept(this, arg);
        var right = n.getRight().accept(this, arg);
        return ArithOp.bySymbol(symbol)
                .<Expr>map(op -> new Expr.BinaryOp(op, left, right))
                .or(() -> CompareOp.bySymbol(symbol).map(op -> new Expr.Condition(op, left, right)))
                .orElseThrow(() -> new ProgramSyntaxException("unsupported operator '" + symbol + "'", n));
    }

    @Override
    public Expr visit(UnaryExpr n, Void arg) {
        var operand = n.getExpression().accept(this, arg);
        switch (n.getOperator()) {
            case PLUS -> {
                return operand;
            }
            case MINUS -> {
                if (operand instanceof Expr.Number number) {
                    return new Expr.Number(-number.value());
                }
                return new Expr.BinaryOp(ArithOp.SUB, new Expr.Number(0), operand);
            }
            default -> throw new ProgramSyntaxException("unsupported operator '" + n.getOperator().asString() + "'", n);
        }
    }

    @Override
    public Expr visit(EnclosedExpr n, Void arg) {
        return n.getInner().accept(this, arg);
    }
    //endregion

    @Override
    public Expr visit(NameExpr n, Void arg) {
        return new Expr.Var(n.getNameAsString());
    }

    @Override
    public Expr visit(IntegerLiteralExpr n, Void arg) {
        try {
            return new Expr.Number(n.asNumber().intValue());
        } catch (NumberFormatException e) {
            throw new ProgramSyntaxException("integer literal out of range", n);
        }
    }
}
