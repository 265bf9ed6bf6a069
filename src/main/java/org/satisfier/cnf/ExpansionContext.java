package org.satisfier.cnf;

import org.satisfier.optionalfeatures.NegationPolicy;
import org.satisfier.repository.FormulaRepository;
import org.satisfier.support.VariableRegistry;

import java.util.*;
import java.util.logging.Logger;

/**
 * CONTESTO DI ESPANSIONE - Stato condiviso da tutte le espansioni ricorsive di una risoluzione
 *
 * Viene creato una volta per ogni risoluzione di primo livello e passato per riferimento
 * a ogni livello di espansione, senza mai essere ricreato.
 *
 * CONTENUTO:
 * - Registro delle variabili (stessi nomi → stessi ID in tutto l'albero di espansione)
 * - Repository consultato per risolvere i riferimenti
 * - Catena dei nomi di formula attualmente in espansione, per il rilevamento dei cicli
 * - Clausole di definizione prodotte dalla negazione Tseitin, in attesa di essere accodate
 */
public class ExpansionContext {

    private static final Logger LOGGER = Logger.getLogger(ExpansionContext.class.getName());

    private final VariableRegistry registry;
    private final FormulaRepository repository;
    private final NegationPolicy negationPolicy;

    /** Nomi sulla catena di espansione attiva, nell'ordine di ingresso */
    private final LinkedHashSet<String> activeChain;

    /** Tutti i nomi di formula espansi almeno una volta */
    private final LinkedHashSet<String> referencedFormulas;

    /** Clausole di definizione delle variabili ausiliarie non ancora accodate alla formula */
    private final List<List<Integer>> pendingDefinitions;

    /** Contatore per nomi univoci delle variabili ausiliarie */
    private int auxiliaryCounter;

    /**
     * @param repository repository delle formule memorizzate (non null)
     * @param negationPolicy trattamento dei riferimenti negati (non null)
     * @param rootName nome della formula in risoluzione, inserito in testa alla catena (può essere null)
     */
    public ExpansionContext(FormulaRepository repository, NegationPolicy negationPolicy, String rootName) {
        if (repository == null) {
            throw new IllegalArgumentException("Repository null");
        }
        if (negationPolicy == null) {
            throw new IllegalArgumentException("NegationPolicy null");
        }
        this.registry = new VariableRegistry();
        this.repository = repository;
        this.negationPolicy = negationPolicy;
        this.activeChain = new LinkedHashSet<>();
        this.referencedFormulas = new LinkedHashSet<>();
        this.pendingDefinitions = new ArrayList<>();
        this.auxiliaryCounter = 0;

        if (rootName != null && !rootName.isBlank()) {
            activeChain.add(rootName);
        }
    }

    public ExpansionContext(FormulaRepository repository, NegationPolicy negationPolicy) {
        this(repository, negationPolicy, null);
    }

    //region CATENA DI ESPANSIONE

    /**
     * Segna l'ingresso nell'espansione di una formula referenziata.
     *
     * @param name nome della formula
     * @throws CyclicReferenceException se il nome è già sulla catena attiva
     */
    void enter(String name) {
        if (activeChain.contains(name)) {
            List<String> chain = new ArrayList<>(activeChain);
            chain.add(name);
            LOGGER.warning("Riferimento ciclico rilevato: " + String.join(" -> ", chain));
            throw new CyclicReferenceException(chain);
        }
        activeChain.add(name);
        referencedFormulas.add(name);
        LOGGER.finest("Ingresso espansione: " + name + " (profondità " + activeChain.size() + ")");
    }

    /**
     * Segna l'uscita dall'espansione della formula.
     */
    void exit(String name) {
        activeChain.remove(name);
    }

    //endregion

    //region VARIABILI AUSILIARIE

    /**
     * Interna una variabile ausiliaria per la negazione della formula indicata. Il nome
     * contiene le virgolette, quindi non può coincidere con un nome scritto dall'utente.
     *
     * @return ID della nuova variabile
     */
    public int newAuxiliaryVariable(String referenceName) {
        auxiliaryCounter++;
        return registry.intern("¬\"" + referenceName + "\"#" + auxiliaryCounter);
    }

    public void addDefinition(List<Integer> clause) {
        pendingDefinitions.add(List.copyOf(clause));
    }

    /**
     * @return clausole di definizione accumulate, svuotando la coda
     */
    List<List<Integer>> drainDefinitions() {
        List<List<Integer>> drained = new ArrayList<>(pendingDefinitions);
        pendingDefinitions.clear();
        return drained;
    }

    //endregion

    public VariableRegistry getRegistry() {
        return registry;
    }

    public FormulaRepository getRepository() {
        return repository;
    }

    public NegationPolicy getNegationPolicy() {
        return negationPolicy;
    }

    public Set<String> getReferencedFormulas() {
        return Collections.unmodifiableSet(referencedFormulas);
    }
}
