package ru.draen.ssa.ir;

import ru.draen.ssa.ast.Expr;

import java.util.List;

public class SsaFormatter {

    public String format(List<SsaStmt> ssa) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ssa.size(); i++) {
            if (i > 0) {
                sb.append("\n");
            }
            SsaStmt stmt = ssa.get(i);
            if (stmt instanceof SsaStmt.Def def) {
                sb
                        .append(def.ssaName())
                        .append(" := ")
                        .append(formatExpr(def.value()));
            } else if (stmt instanceof SsaStmt.Branch branch) {
                sb
                        .append(branch.kind().getKeyword())
                        .append(" ")
                        .append(formatExpr(branch.condition()));
            } else if (stmt instanceof SsaStmt.Assert assertStmt) {
                sb
                        .append("assert(")
                        .append(formatExpr(assertStmt.condition()))
                        .append(")");
            }
        }
        return sb.toString();
    }

    public String formatExpr(Expr expr) {
        if (expr instanceof Expr.Var var) {
            return var.name();
        }
        if (expr instanceof Expr.Number number) {
            return Integer.toString(number.value());
        }
        if (expr instanceof Expr.BinaryOp binary) {
            return formatExpr(binary.left()) + " " + binary.op().getSymbol() + " " + formatExpr(binary.right());
        }
        if (expr instanceof Expr.Condition condition) {
            return formatExpr(condition.left()) + " " + condition.op().getSymbol() + " " + formatExpr(condition.right());
        }
        return String.valueOf(expr);
    }
}
