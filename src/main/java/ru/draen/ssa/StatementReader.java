package ru.draen.ssa;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.visitor.GenericVisitorWithDefaults;
import org.apache.log4j.Logger;
import ru.draen.ssa.ast.ArithOp;
import ru.draen.ssa.ast.Expr;
import ru.draen.ssa.ast.Stmt;

import java.util.ArrayList;
import java.util.List;

public class StatementReader extends GenericVisitorWithDefaults<List<Stmt>, Void> {
    private static final Logger logger = Logger.getLogger(StatementReader.class);

    private final ExpressionReader expressions;

    public StatementReader(ExpressionReader expressions) {
        this.expressions = expressions;
    }

    @Override
    public List<Stmt> defaultAction(Node n, Void arg) {
        logger.warn("Skipping unsupported statement" + ProgramReader.location(n) + ": " + n);
        return List.of();
    }

    private List<Stmt> readBody(Statement body) {
        return body.accept(this, null);
    }

    @Override
    public List<Stmt> visit(BlockStmt n, Void arg) {
        var result = new ArrayList<Stmt>();
        n.getStatements().forEach(stmt -> result.addAll(stmt.accept(this, arg)));
        return result;
    }

    @Override
    public List<Stmt> visit(EmptyStmt n, Void arg) {
        return List.of();
    }

    @Override
    public List<Stmt> visit(ExpressionStmt n, Void arg) {
        return n.getExpression().accept(this, arg);
    }

    //region assignments
    private String targetName(Expression target) {
        if (target instanceof NameExpr name) {
            return name.getNameAsString();
        }
        throw new ProgramSyntaxException("unsupported assignment target", target);
    }

    @Override
    public List<Stmt> visit(AssignExpr n, Void arg) {
        var name = targetName(n.getTarget());
        var value = expressions.read(n.getValue());
        Expr result = n.getOperator().toBinaryOperator()
                .map(bop -> ArithOp.bySymbol(bop.asString())
                        .orElseThrow(() -> new ProgramSyntaxException(
                                "unsupported operator '" + n.getOperator().asString() + "'", n)))
                .<Expr>map(op -> new Expr.BinaryOp(op, new Expr.Var(name), value))
                .orElse(value);
        return List.of(new Stmt.Assign(name, result));
    }

    @Override
    public List<Stmt> visit(UnaryExpr n, Void arg) {
        var op = switch (n.getOperator()) {
            case PREFIX_INCREMENT, POSTFIX_INCREMENT -> ArithOp.ADD;
            case PREFIX_DECREMENT, POSTFIX_DECREMENT -> ArithOp.SUB;
            default -> null;
        };
        if (op == null) {
            return defaultAction(n, arg);
        }
        var name = targetName(n.getExpression());
        return List.of(new Stmt.Assign(name,
                new Expr.BinaryOp(op, new Expr.Var(name), new Expr.Number(1))));
    }

    @Override
    public List<Stmt> visit(VariableDeclarationExpr n, Void arg) {
        var result = new ArrayList<Stmt>();
        n.getVariables().forEach(declarator -> result.addAll(declarator.accept(this, arg)));
        return result;
    }

    @Override
    public List<Stmt> visit(VariableDeclarator n, Void arg) {
        return n.getInitializer()
                .<List<Stmt>>map(init -> List.of(new Stmt.Assign(n.getNameAsString(), expressions.read(init))))
                .orElse(List.of());
    }
    //endregion

    //region flow statements
    @Override
    public List<Stmt> visit(IfStmt n, Void arg) {
        var condition = expressions.read(n.getCondition());
        var thenBlock = readBody(n.getThenStmt());
        var elseBlock = n.getElseStmt().map(this::readBody).orElse(List.of());
        return List.of(new Stmt.If(condition, thenBlock, elseBlock));
    }

    @Override
    public List<Stmt> visit(WhileStmt n, Void arg) {
        var condition = expressions.read(n.getCondition());
        return List.of(new Stmt.While(condition, readBody(n.getBody())));
    }

    private Stmt.Assign singleAssign(NodeList<Expression> expressionList, String role, ForStmt loop) {
        if (expressionList.size() != 1) {
            throw new ProgramSyntaxException("for loop needs exactly one " + role, loop);
        }
        var produced = expressionList.get(0).accept(this, null);
        if (produced.size() != 1 || !(produced.get(0) instanceof Stmt.Assign assign)) {
            throw new ProgramSyntaxException("for loop " + role + " must be an assignment", loop);
        }
        return assign;
    }

    @Override
    public List<Stmt> visit(ForStmt n, Void arg) {
        var init = singleAssign(n.getInitialization(), "initializer", n);
        var condition = n.getCompare()
                .map(expressions::read)
                .orElseThrow(() -> new ProgramSyntaxException("for loop needs a condition", n));
        var update = singleAssign(n.getUpdate(), "update", n);
        return List.of(new Stmt.For(init, condition, update, readBody(n.getBody())));
    }

    @Override
    public List<Stmt> visit(AssertStmt n, Void arg) {
        return List.of(new Stmt.Assert(expressions.read(n.getCheck())));
    }
    //endregion
}
