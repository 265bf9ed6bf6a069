package org.satisfier.optionalfeatures;

import org.satisfier.cnf.ExpansionContext;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * NEGAZIONE DI TSEITIN - Negazione equisoddisfacibile di una formula referenziata
 *
 * La negazione di una congiunzione di clausole C1 ∧ ... ∧ Ck è la disgiunzione ¬C1 ∨ ... ∨ ¬Ck,
 * che non è in forma normale congiuntiva. Per ogni clausola Ci si introduce una variabile
 * ausiliaria ti con la definizione completa ti ↔ ¬Ci:
 *
 * • ti → ¬Ci : una clausola (¬ti ∨ ¬l) per ogni letterale l di Ci
 * • ¬Ci → ti : la clausola (ti ∨ l1 ∨ ... ∨ lm)
 *
 * Il riferimento negato viene sostituito, dentro la clausola che lo contiene, dai letterali
 * t1 ... tk. Le clausole di definizione vengono accodate alla formula di primo livello dal
 * contesto di espansione. Essendo definizioni complete, le variabili ausiliarie sono
 * funzionalmente determinate e la trasformazione resta corretta anche quando il riferimento
 * negato è annidato in altre espansioni.
 *
 * ESEMPIO:
 * R = ("a") AND ("b"), formula (NOT "R" OR "c")
 * → (t1 ∨ t2 ∨ c) ∧ (¬t1 ∨ ¬a) ∧ (t1 ∨ a) ∧ (¬t2 ∨ ¬b) ∧ (t2 ∨ b)
 */
public class TseitinNegation {

    private static final Logger LOGGER = Logger.getLogger(TseitinNegation.class.getName());

    /**
     * Nega le clausole della formula referenziata.
     *
     * @param referenceName nome della formula negata, usato per i nomi ausiliari
     * @param clauses clausole espanse della formula referenziata
     * @param context contesto che riceve variabili e definizioni ausiliarie
     * @return alternative da distribuire nella clausola corrente: una sola alternativa [t1..tk]
     */
    public List<List<Integer>> negate(String referenceName, List<List<Integer>> clauses, ExpansionContext context) {
        List<Integer> auxiliaryLiterals = new ArrayList<>(clauses.size());

        for (List<Integer> clause : clauses) {
            int auxiliary = context.newAuxiliaryVariable(referenceName);
            auxiliaryLiterals.add(auxiliary);

            // ti → ¬l per ogni letterale della clausola
            for (Integer literal : clause) {
                context.addDefinition(List.of(-auxiliary, -literal));
            }

            // ¬Ci → ti
            List<Integer> backward = new ArrayList<>(clause.size() + 1);
            backward.add(auxiliary);
            backward.addAll(clause);
            context.addDefinition(backward);
        }

        LOGGER.fine("Negazione Tseitin di " + referenceName + ": " + clauses.size()
                + " variabili ausiliarie introdotte");

        // Formula vuota (vera): la negazione è falsa e non contribuisce letterali
        List<List<Integer>> alternatives = new ArrayList<>(1);
        alternatives.add(auxiliaryLiterals);
        return alternatives;
    }
}
