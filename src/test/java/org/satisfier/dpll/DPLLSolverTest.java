package org.satisfier.dpll;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.satisfier.TruthTable;
import org.satisfier.support.AssignedLiteral;
import org.satisfier.support.Assignment;
import org.satisfier.support.CNFFormula;

final class DPLLSolverTest {

    /** Tutte le 8 clausole su tre variabili: insoddisfacibile, senza unitarie né letterali puri */
    private static CNFFormula fullThreeVariableFormula() {
        List<int[]> clauses = new ArrayList<>();
        for (int mask = 0; mask < 8; mask++) {
            clauses.add(new int[]{
                    (mask & 1) == 0 ? 1 : -1,
                    (mask & 2) == 0 ? 2 : -2,
                    (mask & 4) == 0 ? 3 : -3});
        }
        return CNFFormula.of(clauses.toArray(new int[0][]));
    }

    @Test
    void disjunctionOfTwoVariablesIsSatisfiable() {
        SearchOutcome outcome = new DPLLSolver().solve(CNFFormula.of(new int[]{1, 2}), new Assignment(), 2);

        assertTrue(outcome.satisfiable());
        Assignment model = outcome.assignment();
        assertTrue(Boolean.TRUE.equals(model.valueOf(1)) || Boolean.TRUE.equals(model.valueOf(2)));
    }

    @Test
    void variableAndItsNegationIsUnsatisfiable() {
        SearchOutcome outcome = new DPLLSolver().solve(CNFFormula.of(new int[]{1}, new int[]{-1}), new Assignment(), 1);

        assertFalse(outcome.satisfiable());
        assertEquals(Boolean.TRUE, outcome.assignment().valueOf(1),
                "The partial assignment of the conflicting branch is returned");
    }

    @Test
    void modelCoversEveryRegisteredVariable() {
        SearchOutcome outcome = new DPLLSolver().solve(CNFFormula.of(new int[]{1, 2}), new Assignment(), 3);

        assertTrue(outcome.satisfiable());
        assertEquals(3, outcome.assignment().size());
        AssignedLiteral completed = outcome.assignment().getLiterals().get(2);
        assertEquals(3, completed.getVariable());
        assertFalse(completed.getValue());
        assertEquals(AssignedLiteral.Reason.DEFAULT, completed.getReason());
    }

    @Test
    void verdictMatchesTruthTableOnRandomFormulas() {
        Random random = new Random(42);
        for (int i = 0; i < 400; i++) {
            int variables = 1 + random.nextInt(10);
            CNFFormula formula = TruthTable.randomFormula(random, variables, 1 + random.nextInt(30), 3);

            SearchOutcome outcome = new DPLLSolver().solve(formula, new Assignment(), variables);

            assertEquals(TruthTable.isSatisfiable(formula, variables), outcome.satisfiable(), formula::toString);
            if (outcome.satisfiable()) {
                assertTrue(formula.isSatisfiedBy(outcome.assignment()), "Returned model must satisfy " + formula);
                assertEquals(variables, outcome.assignment().size());
            }
        }
    }

    @Test
    void strategiesProduceIdenticalOutcomes() {
        Random random = new Random(1234);
        for (int i = 0; i < 200; i++) {
            int variables = 2 + random.nextInt(9);
            CNFFormula formula = TruthTable.randomFormula(random, variables, 3 + random.nextInt(25), 3);

            SearchOutcome stack = new DPLLSolver(SearchStrategy.STACK, DPLLSolver.UNLIMITED)
                    .solve(formula, new Assignment(), variables);
            SearchOutcome recursive = new DPLLSolver(SearchStrategy.RECURSIVE, DPLLSolver.UNLIMITED)
                    .solve(formula, new Assignment(), variables);

            assertEquals(stack.satisfiable(), recursive.satisfiable());
            assertEquals(stack.assignment().getLiterals(), recursive.assignment().getLiterals());
            assertEquals(stack.statistics().getDecisions(), recursive.statistics().getDecisions());
            assertEquals(stack.statistics().getPropagations(), recursive.statistics().getPropagations());
            assertEquals(stack.statistics().getPureLiterals(), recursive.statistics().getPureLiterals());
            assertEquals(stack.statistics().getConflicts(), recursive.statistics().getConflicts());
            assertEquals(stack.statistics().getMaxDepth(), recursive.statistics().getMaxDepth());
        }
    }

    @Test
    void repeatedRunsReturnTheSameAssignment() {
        CNFFormula formula = CNFFormula.of(
                new int[]{1, 2, -3}, new int[]{-1, 3}, new int[]{-2, -3, 4}, new int[]{-4, 1}, new int[]{2, 4});

        SearchOutcome first = new DPLLSolver().solve(formula, new Assignment(), 4);
        SearchOutcome second = new DPLLSolver().solve(formula, new Assignment(), 4);

        assertEquals(first.assignment().getLiterals(), second.assignment().getLiterals());
        assertEquals(first.assignment().toString(), second.assignment().toString());
    }

    @Test
    void branchesTrueBeforeFalseOnTheFirstLiteralOfTheFirstClause() {
        // Nessuna unitaria e nessun puro: la prima decisione è 1 := true
        SearchOutcome outcome = new DPLLSolver().solve(
                CNFFormula.of(new int[]{1, 2}, new int[]{-1, -2}, new int[]{1, -2}, new int[]{-1, 2, 3}, new int[]{-3, 1}),
                new Assignment(), 3);

        assertTrue(outcome.satisfiable());
        AssignedLiteral first = outcome.assignment().getLiterals().get(0);
        assertEquals(new AssignedLiteral(1, true, AssignedLiteral.Reason.DECISION), first);
        assertEquals(AssignedLiteral.Reason.DECISION, first.getReason());
        assertEquals(Boolean.FALSE, outcome.assignment().valueOf(2));
        assertEquals(Boolean.TRUE, outcome.assignment().valueOf(3));
    }

    @Test
    void exploresTheWholeTreeBeforeReportingUnsat() {
        SearchOutcome outcome = new DPLLSolver().solve(fullThreeVariableFormula(), new Assignment(), 3);

        assertFalse(outcome.satisfiable());
        assertTrue(outcome.statistics().getConflicts() > 0);
        assertTrue(outcome.statistics().getMaxDepth() >= 2);
        assertTrue(outcome.statistics().isTimerStopped());
    }

    @Test
    void preAssignmentsSeedTheModelWithoutBeingModified() {
        Assignment initial = new Assignment();
        initial.record(1, false, AssignedLiteral.Reason.PRE_ASSIGNED);
        CNFFormula formula = Simplifier.assign(CNFFormula.of(new int[]{1, 2}, new int[]{-2, 3}), 1, false);

        SearchOutcome outcome = new DPLLSolver().solve(formula, initial, 3);

        assertTrue(outcome.satisfiable());
        assertEquals(1, initial.size());
        assertEquals(AssignedLiteral.Reason.PRE_ASSIGNED, outcome.assignment().getLiterals().get(0).getReason());
        assertEquals(Boolean.TRUE, outcome.assignment().valueOf(2));
        assertEquals(Boolean.TRUE, outcome.assignment().valueOf(3));
    }

    @Test
    void decisionBudgetStopsTheSearch() {
        DPLLSolver limited = new DPLLSolver(SearchStrategy.STACK, 1);
        SearchLimitExceededException error = assertThrows(SearchLimitExceededException.class,
                () -> limited.solve(fullThreeVariableFormula(), new Assignment(), 3));
        assertEquals(1, error.getLimit());
        assertEquals(2, limited.getStatistics().getDecisions(), "The decision over budget is counted");
        assertTrue(limited.getStatistics().isTimerStopped());

        assertThrows(SearchLimitExceededException.class,
                () -> new DPLLSolver(SearchStrategy.RECURSIVE, 1).solve(fullThreeVariableFormula(), new Assignment(), 3));
    }

    @Test
    void interruptedThreadStopsTheSearch() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(SearchInterruptedException.class,
                    () -> new DPLLSolver().solve(fullThreeVariableFormula(), new Assignment(), 3));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new DPLLSolver(null, 0));
        assertThrows(IllegalArgumentException.class, () -> new DPLLSolver(SearchStrategy.STACK, -1));
    }
}
