package org.satisfier;

/**
 * Radice delle eccezioni del solutore. Non controllata: gli errori di sintassi, i riferimenti
 * ciclici e i fallimenti del repository interrompono la risoluzione e arrivano al chiamante.
 */
public class SatisfierException extends RuntimeException {

    public SatisfierException(String message) {
        super(message);
    }

    public SatisfierException(String message, Throwable cause) {
        super(message, cause);
    }
}
