package org.satisfier.support;

import java.util.*;

/**
 * ASSEGNAMENTO PARZIALE - Funzione parziale da ID variabile a valore booleano
 *
 * Cresce in modo monotono durante semplificazione e ricerca, preservando l'ordine
 * cronologico degli assegnamenti. All'interno di un ramo una variabile non può
 * ricevere due valori diversi: il tentativo viene trattato come violazione di invariante.
 *
 * Ogni ramo della ricerca lavora su un proprio {@link #snapshot()}, mai sull'istanza
 * del ramo fratello.
 */
public class Assignment {

    private final LinkedHashMap<Integer, AssignedLiteral> literals;

    public Assignment() {
        this.literals = new LinkedHashMap<>();
    }

    private Assignment(LinkedHashMap<Integer, AssignedLiteral> literals) {
        this.literals = literals;
    }

    //region REGISTRAZIONE

    /**
     * Registra il valore di una variabile.
     *
     * @param variable ID variabile (> 0)
     * @param value valore da assegnare
     * @param reason origine dell'assegnamento
     * @throws IllegalStateException se la variabile ha già il valore opposto
     */
    public void record(int variable, boolean value, AssignedLiteral.Reason reason) {
        AssignedLiteral existing = literals.get(variable);
        if (existing != null) {
            if (existing.getValue() != value) {
                throw new IllegalStateException("Variabile " + variable + " già assegnata a " + existing.getValue()
                        + ", impossibile assegnare " + value);
            }
            return;
        }
        literals.put(variable, new AssignedLiteral(variable, value, reason));
    }

    /**
     * @return copia indipendente, le registrazioni successive non si propagano all'originale
     */
    public Assignment snapshot() {
        return new Assignment(new LinkedHashMap<>(literals));
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @return valore assegnato oppure null se la variabile è libera
     */
    public Boolean valueOf(int variable) {
        AssignedLiteral literal = literals.get(variable);
        return literal != null ? literal.getValue() : null;
    }

    public boolean contains(int variable) {
        return literals.containsKey(variable);
    }

    public int size() {
        return literals.size();
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    /**
     * @return letterali assegnati in ordine cronologico
     */
    public List<AssignedLiteral> getLiterals() {
        return List.copyOf(literals.values());
    }

    /**
     * Converte l'assegnamento nel formato nominale usato dal repository.
     *
     * @param registry registro che ha prodotto gli ID
     * @return mappa nome → valore in ordine cronologico
     */
    public Map<String, Boolean> toNamedMap(VariableRegistry registry) {
        Map<String, Boolean> named = new LinkedHashMap<>();
        for (AssignedLiteral literal : literals.values()) {
            named.put(registry.nameOf(literal.getVariable()), literal.getValue());
        }
        return named;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder description = new StringBuilder("Assignment{");
        Iterator<AssignedLiteral> iterator = literals.values().iterator();
        while (iterator.hasNext()) {
            description.append(iterator.next().toDIMACSLiteral());
            if (iterator.hasNext()) {
                description.append(", ");
            }
        }
        return description.append('}').toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return literals.equals(((Assignment) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }
}
