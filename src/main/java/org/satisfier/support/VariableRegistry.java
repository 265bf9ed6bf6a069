package org.satisfier.support;

import java.util.*;
import java.util.logging.Logger;

/**
 * REGISTRO DELLE VARIABILI - Biiezione tra nomi simbolici e ID numerici densi
 *
 * Assegna a ogni nome di variabile un identificatore intero positivo, nell'ordine
 * in cui il nome viene incontrato per la prima volta. Un'istanza nasce per ogni
 * risoluzione e viene condivisa, senza mai essere ricreata, da tutte le espansioni
 * ricorsive delle formule referenziate: lo stesso nome produce sempre lo stesso ID,
 * a qualunque livello dell'albero di espansione compaia.
 *
 * INVARIANTI MANTENUTE:
 * - Gli ID partono da 1 e sono densi (1..size())
 * - Ogni nome ha un solo ID e ogni ID un solo nome
 * - Il letterale negativo di una variabile è l'esatto opposto aritmetico del positivo
 */
public class VariableRegistry {

    private static final Logger LOGGER = Logger.getLogger(VariableRegistry.class.getName());

    //region STRUTTURE DATI

    /** Mapping nome simbolico → ID numerico, preserva l'ordine di primo utilizzo */
    private final Map<String, Integer> idsByName;

    /** Mapping inverso: posizione i contiene il nome dell'ID i+1 */
    private final List<String> namesById;

    //endregion

    public VariableRegistry() {
        this.idsByName = new LinkedHashMap<>();
        this.namesById = new ArrayList<>();
    }

    //region INTERNAMENTO

    /**
     * Restituisce l'ID della variabile, allocandone uno nuovo se il nome non è mai stato visto.
     *
     * @param name nome simbolico della variabile (non null, non vuoto)
     * @return ID numerico univoco (sempre > 0)
     * @throws IllegalArgumentException se il nome è null o vuoto
     */
    public int intern(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile null o vuoto");
        }

        Integer existing = idsByName.get(name);
        if (existing != null) {
            return existing;
        }

        namesById.add(name);
        int newId = namesById.size();
        idsByName.put(name, newId);

        LOGGER.finest("Nuova variabile mappata: " + name + " → ID " + newId);
        return newId;
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @return ID della variabile oppure vuoto se il nome non è registrato
     */
    public Optional<Integer> idOf(String name) {
        return Optional.ofNullable(idsByName.get(name));
    }

    /**
     * @param id ID numerico (1..size())
     * @return nome simbolico originale
     * @throws IllegalArgumentException se l'ID è fuori range
     */
    public String nameOf(int id) {
        if (id <= 0 || id > namesById.size()) {
            throw new IllegalArgumentException("ID variabile fuori range: " + id + " (variabili: " + namesById.size() + ")");
        }
        return namesById.get(id - 1);
    }

    public boolean contains(String name) {
        return idsByName.containsKey(name);
    }

    /**
     * @return numero di variabili registrate, coincide con l'ID più alto assegnato
     */
    public int size() {
        return namesById.size();
    }

    /**
     * @return copia del mapping inverso ID → nome, in ordine di ID
     */
    public Map<Integer, String> reverseMapping() {
        Map<Integer, String> reverse = new LinkedHashMap<>();
        for (int i = 0; i < namesById.size(); i++) {
            reverse.put(i + 1, namesById.get(i));
        }
        return reverse;
    }

    //endregion

    @Override
    public String toString() {
        return "VariableRegistry" + idsByName;
    }
}
