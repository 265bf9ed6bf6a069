package org.satisfier.optionalfeatures;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.satisfier.cnf.ExpansionContext;
import org.satisfier.repository.InMemoryFormulaRepository;

final class TseitinNegationTest {

    @Test
    void introducesOneAuxiliaryVariablePerClause() {
        ExpansionContext context = new ExpansionContext(new InMemoryFormulaRepository(), NegationPolicy.TSEITIN);
        int a = context.getRegistry().intern("a");
        int b = context.getRegistry().intern("b");

        List<List<Integer>> alternatives = new TseitinNegation()
                .negate("R", List.of(List.of(a, b), List.of(-a)), context);

        assertEquals(List.of(List.of(3, 4)), alternatives);
        assertEquals("¬\"R\"#1", context.getRegistry().nameOf(3));
        assertEquals("¬\"R\"#2", context.getRegistry().nameOf(4));
    }

    @Test
    void negationOfTheEmptyFormulaContributesNoLiteral() {
        ExpansionContext context = new ExpansionContext(new InMemoryFormulaRepository(), NegationPolicy.TSEITIN);

        List<List<Integer>> alternatives = new TseitinNegation().negate("T", List.of(), context);

        assertEquals(1, alternatives.size());
        assertTrue(alternatives.get(0).isEmpty());
        assertEquals(0, context.getRegistry().size());
    }
}
