package org.satisfier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.satisfier.cnf.CyclicReferenceException;
import org.satisfier.cnf.FormulaSyntaxException;
import org.satisfier.dpll.SATResult;
import org.satisfier.dpll.SearchStrategy;
import org.satisfier.optionalfeatures.NegationPolicy;
import org.satisfier.repository.FormulaRecord;
import org.satisfier.repository.FormulaRepository;
import org.satisfier.repository.InMemoryFormulaRepository;
import org.satisfier.repository.RepositoryException;

final class SatisfierTest {

    @Test
    void satisfiableNamedFormulaIsStoredWithItsModel() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository()
                .define("R", "(NOT \"j\" OR NOT \"y\")");
        String text = "(\"R\" OR \"j\") AND (\"j\" OR \"y\")";

        SATResult result = new Satisfier(repository)
                .solve(new SolveRequest("F", text, Map.of(), "usa R"));

        assertTrue(result.isSatisfiable());
        assertEquals(2, result.getClauseCount());
        assertEquals(2, result.getVariableCount());
        Map<String, Boolean> model = result.getAssignment();
        assertTrue(model.get("j") || model.get("y"));

        FormulaRecord stored = repository.enumerate().get(1);
        assertEquals("F", stored.name());
        assertEquals(text, stored.rawText());
        assertEquals(model, stored.assignment());
        assertEquals("usa R", stored.comment());
    }

    @Test
    void unsatisfiableFormulaIsNeverStored() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository();

        SATResult result = new Satisfier(repository).solve(SolveRequest.of("G", "(\"a\") AND (NOT \"a\")"));

        assertTrue(result.isUnsatisfiable());
        assertEquals(Optional.empty(), repository.lookup("G"));
        assertEquals("UNSAT\n", result.toString());
    }

    @Test
    void anonymousFormulaIsNotStored() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository();

        SATResult result = new Satisfier(repository).solve(SolveRequest.anonymous("(\"a\" OR \"b\")"));

        assertTrue(result.isSatisfiable());
        assertTrue(repository.enumerate().isEmpty());
    }

    @Test
    void preAssignmentsAreAppliedBeforeTheSearch() {
        SATResult result = new Satisfier(new InMemoryFormulaRepository())
                .solve(new SolveRequest(null, "(\"a\" OR \"b\")", Map.of("a", false), null));

        assertTrue(result.isSatisfiable());
        assertEquals(Boolean.FALSE, result.getAssignment().get("a"));
        assertEquals(Boolean.TRUE, result.getAssignment().get("b"));
    }

    @Test
    void preAssignmentsCanMakeTheFormulaUnsatisfiable() {
        SATResult result = new Satisfier(new InMemoryFormulaRepository())
                .solve(new SolveRequest(null, "(\"a\")", Map.of("a", false), null));

        assertTrue(result.isUnsatisfiable());
    }

    @Test
    void preAssignmentsReachVariablesIntroducedByExpansion() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository().define("R", "(\"j\")");

        SATResult result = new Satisfier(repository)
                .solve(new SolveRequest(null, "(\"R\" OR \"k\")", Map.of("j", false), null));

        assertTrue(result.isSatisfiable());
        assertFalse(result.hasWarnings());
        assertEquals(Boolean.FALSE, result.getAssignment().get("j"));
        assertEquals(Boolean.TRUE, result.getAssignment().get("k"));
    }

    @Test
    void unknownPreAssignmentIsAWarningNotAnError() {
        Map<String, Boolean> preAssignments = new LinkedHashMap<>();
        preAssignments.put("zz", true);
        preAssignments.put("a", true);

        SATResult result = new Satisfier(new InMemoryFormulaRepository())
                .solve(new SolveRequest(null, "(\"a\" OR NOT \"b\")", preAssignments, null));

        assertTrue(result.isSatisfiable());
        assertEquals(List.of("Variabile zz non trovata nella formula"), result.getWarnings());
        assertFalse(result.getAssignment().containsKey("zz"));
        assertEquals(Boolean.TRUE, result.getAssignment().get("a"));
    }

    @Test
    void tseitinPolicyNegatesStoredConjunctionsCorrectly() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository().define("R", "(\"a\") AND (\"b\")");
        SolveRequest request = SolveRequest.anonymous("(NOT \"R\") AND (\"a\")");

        SATResult flipped = new Satisfier(repository).solve(request);
        SATResult tseitin = new Satisfier(repository, NegationPolicy.TSEITIN, SearchStrategy.STACK).solve(request);

        assertTrue(flipped.isUnsatisfiable(), "Literal flip reads NOT R as NOT a AND NOT b");
        assertTrue(tseitin.isSatisfiable());
        assertEquals(Boolean.TRUE, tseitin.getAssignment().get("a"));
        assertEquals(Boolean.FALSE, tseitin.getAssignment().get("b"));
    }

    @Test
    void bothSearchStrategiesGiveTheSameResult() {
        String text = "(\"p\" OR \"q\" OR NOT \"r\") AND (NOT \"p\" OR \"r\") AND (NOT \"q\" OR NOT \"r\") AND (\"r\" OR \"s\")";

        SATResult stack = new Satisfier(new InMemoryFormulaRepository(), NegationPolicy.LITERAL_FLIP, SearchStrategy.STACK)
                .solve(SolveRequest.anonymous(text));
        SATResult recursive = new Satisfier(new InMemoryFormulaRepository(), NegationPolicy.LITERAL_FLIP, SearchStrategy.RECURSIVE)
                .solve(SolveRequest.anonymous(text));

        assertEquals(stack, recursive);
        assertEquals(List.copyOf(stack.getAssignment().entrySet()), List.copyOf(recursive.getAssignment().entrySet()));
    }

    @Test
    void cyclicReferenceFailsWithoutStoring() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository().define("X", "(\"X\" OR \"a\")");

        assertThrows(CyclicReferenceException.class,
                () -> new Satisfier(repository).solve(SolveRequest.of("Y", "(\"X\")")));
        assertEquals(1, repository.enumerate().size());
    }

    @Test
    void selfReferenceToAFormulaBeingRedefinedIsACycle() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository().define("X", "(\"a\")");

        CyclicReferenceException error = assertThrows(CyclicReferenceException.class,
                () -> new Satisfier(repository).solve(SolveRequest.of("X", "(\"X\" OR \"b\")")));
        assertEquals(List.of("X", "X"), error.getChain());
    }

    @Test
    void formulaUsingItsOwnNameIsRejectedAndNotStored() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository();
        Satisfier satisfier = new Satisfier(repository);

        CyclicReferenceException e = assertThrows(CyclicReferenceException.class,
                () -> satisfier.solve(SolveRequest.of("X", "(\"X\" OR \"b\")")));

        assertEquals(List.of("X", "X"), e.getChain());
        assertEquals(Optional.empty(), repository.lookup("X"));
        assertTrue(satisfier.solve(SolveRequest.anonymous("(\"X\") AND (\"c\")")).isSatisfiable());
    }

    @Test
    void formulaReachingItsOwnNameThroughAReferenceIsRejected() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository()
                .define("Y", "(\"X\" OR \"y\")");

        CyclicReferenceException e = assertThrows(CyclicReferenceException.class,
                () -> new Satisfier(repository).solve(SolveRequest.of("X", "(\"Y\") AND (\"a\")")));

        assertEquals(List.of("X", "X"), e.getChain());
        assertEquals(Optional.empty(), repository.lookup("X"));
    }

    @Test
    void anonymousFormulaMayUseAnyName() {
        SATResult result = new Satisfier(new InMemoryFormulaRepository())
                .solve(SolveRequest.anonymous("(\"Z\" OR \"b\")"));

        assertTrue(result.isSatisfiable());
        assertTrue(result.getAssignment().containsKey("Z"));
    }

    @Test
    void syntaxErrorsPropagate() {
        InMemoryFormulaRepository repository = new InMemoryFormulaRepository();

        assertThrows(FormulaSyntaxException.class,
                () -> new Satisfier(repository).solve(SolveRequest.of("F", "(\"a\" OR")));
        assertTrue(repository.enumerate().isEmpty());
    }

    @Test
    void repositoryFailuresPropagate() {
        FormulaRepository failing = new FormulaRepository() {
            @Override
            public Optional<String> lookup(String name) {
                return Optional.empty();
            }

            @Override
            public void store(String name, String rawText, Map<String, Boolean> namedAssignment, String comment) {
                throw new RepositoryException("disco pieno");
            }

            @Override
            public List<FormulaRecord> enumerate() {
                return List.of();
            }
        };

        RepositoryException error = assertThrows(RepositoryException.class,
                () -> new Satisfier(failing).solve(SolveRequest.of("F", "(\"a\")")));
        assertEquals("disco pieno", error.getMessage());
    }
}
