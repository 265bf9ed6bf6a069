package org.satisfier.cnf;

import org.satisfier.SatisfierException;

import java.util.ArrayList;
import java.util.List;

/**
 * Una formula memorizzata riferisce, direttamente o tramite altre formule, sé stessa.
 * La catena contiene i nomi in espansione fino alla ripetizione inclusa.
 */
public class CyclicReferenceException extends SatisfierException {

    private final List<String> chain;

    public CyclicReferenceException(List<String> chain) {
        super("Riferimento ciclico tra formule memorizzate: " + String.join(" -> ", chain));
        this.chain = List.copyOf(new ArrayList<>(chain));
    }

    /**
     * @return catena di espansione, es. [X, Y, X]
     */
    public List<String> getChain() {
        return chain;
    }
}
