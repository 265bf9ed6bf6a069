package org.satisfier.dpll;

/**
 * Strategia di controllo della ricerca DPLL. Entrambe producono lo stesso esito,
 * lo stesso assegnamento e le stesse statistiche.
 */
public enum SearchStrategy {

    /** Pila esplicita di frame indipendenti, profondità limitata solo dalla memoria */
    STACK,

    /** Visita ricorsiva in profondità, ritorna al primo successo */
    RECURSIVE
}
