package org.satisfier.dpll;

import org.satisfier.SatisfierException;

/**
 * La ricerca è stata interrotta dall'esterno (flag di interruzione del thread),
 * tipicamente per un timeout imposto dal chiamante.
 */
public class SearchInterruptedException extends SatisfierException {

    public SearchInterruptedException(String message) {
        super(message);
    }
}
