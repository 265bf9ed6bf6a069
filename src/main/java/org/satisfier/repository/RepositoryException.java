package org.satisfier.repository;

import org.satisfier.SatisfierException;

/**
 * Fallimento di lettura o scrittura del repository delle formule. Interrompe la risoluzione.
 */
public class RepositoryException extends SatisfierException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
