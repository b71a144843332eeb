package ru.draen.ssa.ir;

import org.apache.log4j.Logger;
import ru.draen.ssa.ast.Stmt;

import java.util.List;

/**
 * Bodies are walked once and only their direct assignments are converted. Both arms of an
 * {@code if} are emitted in sequence without a merge, so the else arm wins for later reads.
 */
public class SsaBuilder {
    private static final Logger logger = Logger.getLogger(SsaBuilder.class);

    private final ExprRewriter rewriter;

    public SsaBuilder() {
        this(new ExprRewriter());
    }

    public SsaBuilder(ExprRewriter rewriter) {
        this.rewriter = rewriter;
    }

    public List<SsaStmt> convert(List<Stmt> program) {
        return convert(program, new SsaContext()).statements();
    }

    public SsaContext convert(List<Stmt> program, SsaContext ctx) {
        program.forEach(stmt -> handle(stmt, ctx));
        if (logger.isDebugEnabled()) {
            logger.debug("Converted " + program.size() + " statements into "
                    + ctx.statements().size() + " SSA statements");
        }
        return ctx;
    }

    private void handle(Stmt stmt, SsaContext ctx) {
        if (stmt instanceof Stmt.Assign assign) {
            handleAssign(assign, ctx);
        } else if (stmt instanceof Stmt.If ifStmt) {
            ctx.emit(new SsaStmt.Branch(BranchKind.IF, rewriter.rewrite(ifStmt.condition(), ctx)));
            handleBody(ifStmt.thenBlock(), ctx);
            handleBody(ifStmt.elseBlock(), ctx);
        } else if (stmt instanceof Stmt.While whileStmt) {
            ctx.emit(new SsaStmt.Branch(BranchKind.WHILE, rewriter.rewrite(whileStmt.condition(), ctx)));
            handleBody(whileStmt.body(), ctx);
        } else if (stmt instanceof Stmt.For forStmt) {
            handleAssign(forStmt.init(), ctx);
            ctx.emit(new SsaStmt.Branch(BranchKind.FOR, rewriter.rewrite(forStmt.condition(), ctx)));
            handleBody(forStmt.body(), ctx);
            handleAssign(forStmt.update(), ctx);
        } else if (stmt instanceof Stmt.Assert assertStmt) {
            ctx.emit(new SsaStmt.Assert(rewriter.rewrite(assertStmt.condition(), ctx)));
        } else {
            // kept for compatibility: unknown statements contribute nothing
            logger.debug("Skipping unsupported statement " + stmt);
        }
    }

    private void handleAssign(Stmt.Assign assign, SsaContext ctx) {
        var value = rewriter.rewrite(assign.value(), ctx);
        ctx.emit(new SsaStmt.Def(ctx.newVersion(assign.name()), value));
    }

    private void handleBody(List<Stmt> body, SsaContext ctx) {
        for (var stmt : body) {
            if (stmt instanceof Stmt.Assign assign) {
                handleAssign(assign, ctx);
            } else {
                logger.debug("Dropping nested statement " + stmt);
            }
        }
    }
}
