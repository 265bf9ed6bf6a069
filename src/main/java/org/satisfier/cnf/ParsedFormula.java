package org.satisfier.cnf;

import org.satisfier.support.CNFFormula;
import org.satisfier.support.VariableRegistry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Risultato dell'espansione: clausole, registro delle variabili e formule referenziate.
 */
public record ParsedFormula(CNFFormula formula, VariableRegistry registry, Set<String> referencedFormulas) {

    /**
     * Le formule referenziate mantengono l'ordine di primo ingresso in espansione.
     */
    public ParsedFormula {
        referencedFormulas = Collections.unmodifiableSet(new LinkedHashSet<>(referencedFormulas));
    }

    /**
     * @return mapping inverso ID → nome originale
     */
    public Map<Integer, String> reverseMapping() {
        return registry.reverseMapping();
    }

    public int getVariableCount() {
        return registry.size();
    }
}
