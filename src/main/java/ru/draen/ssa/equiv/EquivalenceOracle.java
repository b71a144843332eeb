package ru.draen.ssa.equiv;

import org.apache.log4j.Logger;
import ru.draen.ssa.ir.BranchKind;
import ru.draen.ssa.ir.SsaStmt;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Right-hand sides are never compared, so programs that differ only in arithmetic are equivalent.
 */
public class EquivalenceOracle {
    private static final Logger logger = Logger.getLogger(EquivalenceOracle.class);

    public Verdict compare(List<SsaStmt> first, List<SsaStmt> second) {
        var firstVars = definedVars(first);
        var secondVars = definedVars(second);
        if (!firstVars.equals(secondVars)) {
            logger.debug("Defined variables differ: " + firstVars + " vs " + secondVars);
            return new Verdict.NotEquivalent(Verdict.Reason.DIFFERENT_VARIABLES);
        }

        long firstIfs = count(first, EquivalenceOracle::isIfBranch);
        long secondIfs = count(second, EquivalenceOracle::isIfBranch);
        if (firstIfs != secondIfs) {
            logger.debug("If branch count differs: " + firstIfs + " vs " + secondIfs);
            return new Verdict.NotEquivalent(Verdict.Reason.DIFFERENT_CONTROL_FLOW);
        }

        long firstAsserts = count(first, SsaStmt.Assert.class::isInstance);
        long secondAsserts = count(second, SsaStmt.Assert.class::isInstance);
        if (firstAsserts != secondAsserts) {
            logger.debug("Assertion count differs: " + firstAsserts + " vs " + secondAsserts);
            return new Verdict.NotEquivalent(Verdict.Reason.DIFFERENT_ASSERTIONS);
        }

        return Verdict.EQUIVALENT;
    }

    public Set<String> definedVars(List<SsaStmt> ssa) {
        return ssa.stream()
                .filter(SsaStmt.Def.class::isInstance)
                .map(stmt -> ((SsaStmt.Def) stmt).ssaName())
                .collect(Collectors.toSet());
    }

    private static boolean isIfBranch(SsaStmt stmt) {
        return stmt instanceof SsaStmt.Branch branch && branch.kind() == BranchKind.IF;
    }

    private static long count(List<SsaStmt> ssa, Predicate<SsaStmt> filter) {
        return ssa.stream().filter(filter).count();
    }
}
