package org.satisfier.dpll;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class SATResultTest {

    @Test
    void printsTheModelSortedByName() {
        Map<String, Boolean> model = new LinkedHashMap<>();
        model.put("y", false);
        model.put("j", true);

        SATResult result = SATResult.satisfiable(model, List.of(), 2, 2, new SATStatistics());

        assertEquals("SAT\nModello:\nj → true\ny → false\n", result.toString());
        assertEquals(2, result.getModelSize());
        assertTrue(result.getExecutionSummary().startsWith("Esito: SAT | Decisioni: 0"));
    }

    @Test
    void unsatisfiableResultKeepsThePartialAssignmentButNoModel() {
        SATResult result = SATResult.unsatisfiable(Map.of("a", true), List.of("avviso"), 2, 1, null);

        assertTrue(result.isUnsatisfiable());
        assertEquals(Map.of("a", true), result.getAssignment());
        assertEquals(0, result.getModelSize());
        assertTrue(result.hasWarnings());
        assertTrue(result.toCompactString().startsWith("SATResult{UNSAT, vars=1, clauses=2"));
    }

    @Test
    void isImmutable() {
        SATResult result = SATResult.satisfiable(new LinkedHashMap<>(Map.of("a", true)), List.of(), 1, 1, null);

        assertThrows(UnsupportedOperationException.class, () -> result.getAssignment().put("b", false));
        assertThrows(UnsupportedOperationException.class, () -> result.getWarnings().add("x"));
        assertThrows(IllegalArgumentException.class, () -> SATResult.satisfiable(null, List.of(), 0, 0, null));
    }
}
