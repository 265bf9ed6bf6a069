package org.satisfier;

import org.satisfier.cnf.CyclicReferenceException;
import org.satisfier.cnf.ExpansionContext;
import org.satisfier.cnf.FormulaExpander;
import org.satisfier.cnf.FormulaSyntaxException;
import org.satisfier.cnf.ParsedFormula;
import org.satisfier.dpll.DPLLSolver;
import org.satisfier.dpll.Simplifier;
import org.satisfier.dpll.SATResult;
import org.satisfier.dpll.SearchOutcome;
import org.satisfier.dpll.SearchStrategy;
import org.satisfier.optionalfeatures.NegationPolicy;
import org.satisfier.repository.FormulaRepository;
import org.satisfier.repository.RepositoryException;
import org.satisfier.support.AssignedLiteral;
import org.satisfier.support.Assignment;
import org.satisfier.support.CNFFormula;
import org.satisfier.support.VariableRegistry;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SATISFIER - Punto di ingresso della risoluzione
 *
 * PIPELINE:
 * 1. Espansione del testo con risoluzione dei riferimenti a formule memorizzate
 * 2. Validazione e applicazione dei pre-assegnamenti
 * 3. Ricerca DPLL
 * 4. Memorizzazione nel repository delle sole formule soddisfacibili e con nome
 *
 * Ogni chiamata a {@link #solve(SolveRequest)} usa un registro delle variabili nuovo.
 * Il repository è l'unico stato condiviso tra chiamate successive.
 */
public class Satisfier {

    private static final Logger LOGGER = Logger.getLogger(Satisfier.class.getName());

    private final FormulaRepository repository;
    private final NegationPolicy negationPolicy;
    private final SearchStrategy searchStrategy;
    private final int maxDecisions;

    public Satisfier(FormulaRepository repository) {
        this(repository, NegationPolicy.LITERAL_FLIP, SearchStrategy.STACK);
    }

    public Satisfier(FormulaRepository repository, NegationPolicy negationPolicy, SearchStrategy searchStrategy) {
        this(repository, negationPolicy, searchStrategy, DPLLSolver.UNLIMITED);
    }

    /**
     * @param repository repository consultato per i riferimenti e aggiornato per le formule SAT
     * @param negationPolicy trattamento dei riferimenti negati
     * @param searchStrategy strategia di controllo della ricerca
     * @param maxDecisions budget di decisioni, {@link DPLLSolver#UNLIMITED} per nessun limite
     */
    public Satisfier(FormulaRepository repository, NegationPolicy negationPolicy,
                     SearchStrategy searchStrategy, int maxDecisions) {
        if (repository == null || negationPolicy == null || searchStrategy == null) {
            throw new IllegalArgumentException("Repository, politica di negazione e strategia sono obbligatori");
        }
        this.repository = repository;
        this.negationPolicy = negationPolicy;
        this.searchStrategy = searchStrategy;
        this.maxDecisions = maxDecisions;
    }

    /**
     * Risolve la formula della richiesta.
     *
     * @return esito con modello (SAT) o assegnamento parziale (UNSAT) e avvisi
     * @throws FormulaSyntaxException se il testo o una formula referenziata è malformata
     * @throws CyclicReferenceException se i riferimenti formano un ciclo
     * @throws RepositoryException se il repository non è accessibile
     */
    public SATResult solve(SolveRequest request) {
        LOGGER.info(() -> "Risoluzione formula " + describe(request));

        ParsedFormula parsed;
        try {
            ExpansionContext context = new ExpansionContext(repository, negationPolicy, request.name());
            parsed = FormulaExpander.expand(request.formulaText(), context);
        } catch (FormulaSyntaxException | CyclicReferenceException e) {
            LOGGER.log(Level.SEVERE, "Espansione fallita per " + describe(request), e);
            throw e;
        }

        VariableRegistry registry = parsed.registry();
        rejectSelfReference(request, registry);
        List<String> warnings = new ArrayList<>();
        Assignment initial = new Assignment();
        CNFFormula formula = applyPreAssignments(parsed.formula(), request.preAssignments(), registry, initial, warnings);

        DPLLSolver solver = new DPLLSolver(searchStrategy, maxDecisions);
        SearchOutcome outcome = solver.solve(formula, initial, registry.size());
        Map<String, Boolean> named = outcome.assignment().toNamedMap(registry);

        SATResult result;
        if (outcome.satisfiable()) {
            result = SATResult.satisfiable(named, warnings, parsed.formula().getClausesCount(),
                    registry.size(), outcome.statistics());
            if (request.isNamed()) {
                repository.store(request.name(), request.formulaText(), named, request.comment());
                LOGGER.info("Formula " + request.name() + " memorizzata");
            }
        } else {
            result = SATResult.unsatisfiable(named, warnings, parsed.formula().getClausesCount(),
                    registry.size(), outcome.statistics());
        }

        LOGGER.info(() -> result.getExecutionSummary());
        return result;
    }

    /**
     * Applica i pre-assegnamenti noti al registro nell'ordine della richiesta.
     * I nomi sconosciuti producono un avviso e vengono ignorati.
     */
    private static CNFFormula applyPreAssignments(CNFFormula formula, Map<String, Boolean> preAssignments,
                                                  VariableRegistry registry, Assignment initial,
                                                  List<String> warnings) {
        CNFFormula current = formula;
        for (Map.Entry<String, Boolean> entry : preAssignments.entrySet()) {
            Optional<Integer> variable = registry.idOf(entry.getKey());
            if (variable.isEmpty()) {
                String warning = "Variabile " + entry.getKey() + " non trovata nella formula";
                LOGGER.warning(warning);
                warnings.add(warning);
                continue;
            }
            initial.record(variable.get(), entry.getValue(), AssignedLiteral.Reason.PRE_ASSIGNED);
            current = Simplifier.assign(current, variable.get(), entry.getValue());
        }
        return current;
    }

    /**
     * Una formula con nome che usa il proprio nome come variabile, direttamente o tramite
     * le formule che riferisce, diventerebbe ciclica una volta memorizzata.
     */
    private static void rejectSelfReference(SolveRequest request, VariableRegistry registry) {
        if (request.isNamed() && registry.idOf(request.name()).isPresent()) {
            CyclicReferenceException e = new CyclicReferenceException(List.of(request.name(), request.name()));
            LOGGER.log(Level.SEVERE, "Espansione fallita per " + describe(request), e);
            throw e;
        }
    }

    private static String describe(SolveRequest request) {
        return request.isNamed() ? request.name() : "(anonima)";
    }

    public FormulaRepository getRepository() {
        return repository;
    }
}
