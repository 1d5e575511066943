package org.logic.rules;

import org.logic.formula.Formula;
import org.logic.formula.FormulaService;
import org.logic.formula.FormulaSource;
import org.logic.formula.FormulaSyntaxException;

import java.util.List;
import java.util.logging.Logger;

/**
 * REGOLE DI INFERENZA - Deduzione naturale per la logica proposizionale
 *
 * Per ogni regola espone due operazioni:
 * - applicazione (es. {@link #modusPonens}): deriva l'unica conclusione ammessa
 *   dalla regola, oppure solleva {@link RuleNotApplicableException}
 * - verifica (es. {@link #isModusPonens}): stabilisce se la conclusione proposta
 *   è proprio quella che la regola produrrebbe
 *
 * REGOLE SUPPORTATE:
 * - Modus ponens: A->B, A ⊢ B
 * - Modus tollens: A->B, ~B ⊢ ~A
 * - Implicazione a catena: A->B, B->C ⊢ A->C
 * - Dilemma costruttivo: A|B, A->P, B->Q ⊢ P|Q
 * - Eliminazione della disgiunzione: A|B, ~A ⊢ B
 * - Introduzione della disgiunzione: A ⊢ A|B
 * - Eliminazione della congiunzione: A&B ⊢ A (oppure B)
 * - Introduzione della congiunzione: A, B ⊢ A&B
 *
 * ASSEGNAZIONE DEI RUOLI:
 * Modus ponens, modus tollens ed eliminazione della disgiunzione ricevono due
 * premesse che potrebbero ricoprire entrambi i ruoli. La premessa con il testo
 * canonico più lungo è considerata quella composta (implicazione o disgiunzione);
 * a parità di lunghezza lo è la seconda. È un'euristica testuale, non
 * strutturale. Quando la regola si applica davvero la premessa composta contiene
 * l'altra (o il suo operando negato) ed è quindi sempre più lunga; l'euristica
 * decide soltanto quale forma viene cercata nelle premesse che non si adattano.
 *
 * ERRORI:
 * - {@link FormulaSyntaxException}: premessa o conclusione malformata, sempre propagata
 * - {@link RuleNotApplicableException}: premesse ben formate ma di forma errata;
 *   le verifiche la traducono in false
 * - {@link IllegalArgumentException}: parametro non formula non valido (lato),
 *   sollevata prima di ogni parsing e sempre propagata
 *
 * La classe non ha stato mutabile: tutte le operazioni sono funzioni pure sugli
 * alberi e possono essere invocate in concorrenza.
 */
public class InferenceRules {

    private static final Logger LOGGER = Logger.getLogger(InferenceRules.class.getName());

    private final FormulaService formulas;

    public InferenceRules() {
        this(new FormulaService());
    }

    public InferenceRules(FormulaService formulas) {
        if (formulas == null) {
            throw new IllegalArgumentException("Servizio formule non può essere null");
        }
        this.formulas = formulas;
    }

    //region MODUS PONENS

    /**
     * Applica il modus ponens.
     *
     * <pre>
     *   modusPonens("(a&amp;c)->~d", "a&amp;c")   ->  ~d
     *   modusPonens("a", "a->b")             ->  b
     * </pre>
     *
     * @param premise1 una delle due premesse (implicazione o antecedente)
     * @param premise2 l'altra premessa
     * @return il conseguente dell'implicazione
     * @throws RuleNotApplicableException se nessuna premessa è un'implicazione
     *         il cui antecedente coincide con l'altra
     */
    public Formula modusPonens(FormulaSource premise1, FormulaSource premise2) {
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return deriveModusPonens(trees.get(0), trees.get(1), premise1, premise2).orElseThrow();
    }

    public Formula modusPonens(String premise1, String premise2) {
        return modusPonens(text(premise1), text(premise2));
    }

    /**
     * Verifica se {@code conclusion} segue dalle premesse per modus ponens.
     */
    public boolean isModusPonens(FormulaSource premise1, FormulaSource premise2, FormulaSource conclusion) {
        Formula candidate = formulas.parse(conclusion);
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return deriveModusPonens(trees.get(0), trees.get(1), premise1, premise2).matches(candidate);
    }

    public boolean isModusPonens(String premise1, String premise2, String conclusion) {
        return isModusPonens(text(premise1), text(premise2), text(conclusion));
    }

    private Derivation deriveModusPonens(Formula first, Formula second, Object premise1, Object premise2) {
        Roles roles = Roles.byLength(first, second);
        Formula conditional = roles.primary();
        Formula antecedent = roles.other();

        Derivation derivation;
        if (conditional.is(Formula.Type.IMPLIES) && conditional.left().equals(antecedent)) {
            derivation = Derivation.of(conditional.right());
        } else {
            derivation = Derivation.notApplicable(
                    "modus ponens non si applica a " + premise1 + " e " + premise2);
        }
        return logged("modus ponens", derivation);
    }

    //endregion

    //region MODUS TOLLENS

    /**
     * Applica il modus tollens.
     *
     * <pre>
     *   modusTollens("(a&amp;c)->d", "~d")   ->  ~(a&amp;c)
     *   modusTollens("~a", "a->b")          ->  non applicabile (serve ~b)
     * </pre>
     *
     * @return la negazione dell'antecedente
     * @throws RuleNotApplicableException se manca l'implicazione o la negazione del conseguente
     */
    public Formula modusTollens(FormulaSource premise1, FormulaSource premise2) {
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return deriveModusTollens(trees.get(0), trees.get(1), premise1, premise2).orElseThrow();
    }

    public Formula modusTollens(String premise1, String premise2) {
        return modusTollens(text(premise1), text(premise2));
    }

    public boolean isModusTollens(FormulaSource premise1, FormulaSource premise2, FormulaSource conclusion) {
        Formula candidate = formulas.parse(conclusion);
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return deriveModusTollens(trees.get(0), trees.get(1), premise1, premise2).matches(candidate);
    }

    public boolean isModusTollens(String premise1, String premise2, String conclusion) {
        return isModusTollens(text(premise1), text(premise2), text(conclusion));
    }

    private Derivation deriveModusTollens(Formula first, Formula second, Object premise1, Object premise2) {
        Roles roles = Roles.byLength(first, second);
        Formula conditional = roles.primary();
        Formula negatedConsequent = roles.other();

        Derivation derivation;
        if (conditional.is(Formula.Type.IMPLIES) && negatedConsequent.isNegationOf(conditional.right())) {
            derivation = Derivation.of(Formula.not(conditional.left()));
        } else {
            derivation = Derivation.notApplicable(
                    "modus tollens non si applica a " + premise1 + " e " + premise2);
        }
        return logged("modus tollens", derivation);
    }

    //endregion

    //region IMPLICAZIONE A CATENA

    /**
     * Applica l'implicazione a catena (sillogismo ipotetico).
     *
     * Non usa l'euristica sulla lunghezza: entrambi gli ordini vengono provati,
     * prima premise1 seguita da premise2 e poi il contrario.
     *
     * <pre>
     *   chainImplication("a->b", "b->c")   ->  a->c
     *   chainImplication("b->c", "a->b")   ->  a->c
     * </pre>
     *
     * @throws RuleNotApplicableException se le premesse non sono due implicazioni concatenate
     */
    public Formula chainImplication(FormulaSource premise1, FormulaSource premise2) {
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return deriveChainImplication(trees.get(0), trees.get(1), premise1, premise2).orElseThrow();
    }

    public Formula chainImplication(String premise1, String premise2) {
        return chainImplication(text(premise1), text(premise2));
    }

    public boolean isChainImplication(FormulaSource premise1, FormulaSource premise2, FormulaSource conclusion) {
        Formula candidate = formulas.parse(conclusion);
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return deriveChainImplication(trees.get(0), trees.get(1), premise1, premise2).matches(candidate);
    }

    public boolean isChainImplication(String premise1, String premise2, String conclusion) {
        return isChainImplication(text(premise1), text(premise2), text(conclusion));
    }

    private Derivation deriveChainImplication(Formula first, Formula second, Object premise1, Object premise2) {
        Derivation derivation;
        if (!first.is(Formula.Type.IMPLIES) || !second.is(Formula.Type.IMPLIES)) {
            derivation = Derivation.notApplicable(
                    "l'implicazione a catena non si applica a " + premise1 + " e " + premise2);
        } else if (first.right().equals(second.left())) {
            derivation = Derivation.of(Formula.implies(first.left(), second.right()));
        } else if (second.right().equals(first.left())) {
            derivation = Derivation.of(Formula.implies(second.left(), first.right()));
        } else {
            derivation = Derivation.notApplicable(
                    "l'implicazione a catena non si applica a " + premise1 + " e " + premise2);
        }
        return logged("implicazione a catena", derivation);
    }

    //endregion

    //region DILEMMA COSTRUTTIVO

    /**
     * Applica il dilemma costruttivo.
     *
     * I ruoli sono assegnati per forma e non per posizione, quindi l'ordine
     * degli argomenti è indifferente.
     *
     * SCANSIONE:
     * 1. Esattamente una premessa deve essere una disgiunzione A|B; con zero o
     *    più disgiunzioni la regola non si applica
     * 2. Le implicazioni vengono esaminate nell'ordine degli argomenti: quella con
     *    antecedente A occupa il primo posto, altrimenti quella con antecedente B
     *    il secondo; una corrispondenza successiva sostituisce la precedente
     * 3. Ogni implicazione occupa al massimo un posto, quindi servono due
     *    implicazioni distinte
     *
     * <pre>
     *   dilemma("a|b", "a->p", "b->q")   ->  p|q
     *   dilemma("b->q", "a|b", "a->p")   ->  p|q
     * </pre>
     *
     * @return la disgiunzione dei due conseguenti
     * @throws RuleNotApplicableException se la disgiunzione o una delle implicazioni manca
     */
    public Formula dilemma(FormulaSource premise1, FormulaSource premise2, FormulaSource premise3) {
        List<Formula> trees = formulas.parseAll(premise1, premise2, premise3);
        return deriveDilemma(trees, premise1, premise2, premise3).orElseThrow();
    }

    public Formula dilemma(String premise1, String premise2, String premise3) {
        return dilemma(text(premise1), text(premise2), text(premise3));
    }

    public boolean isDilemma(FormulaSource premise1, FormulaSource premise2, FormulaSource premise3,
                             FormulaSource conclusion) {
        Formula candidate = formulas.parse(conclusion);
        List<Formula> trees = formulas.parseAll(premise1, premise2, premise3);
        return deriveDilemma(trees, premise1, premise2, premise3).matches(candidate);
    }

    public boolean isDilemma(String premise1, String premise2, String premise3, String conclusion) {
        return isDilemma(text(premise1), text(premise2), text(premise3), text(conclusion));
    }

    private Derivation deriveDilemma(List<Formula> trees, Object premise1, Object premise2, Object premise3) {
        String failure = "il dilemma non si applica a " + premise1 + ", " + premise2 + " e " + premise3;

        // Fase 1: individuazione dell'unica disgiunzione
        Formula disjunction = null;
        for (Formula tree : trees) {
            if (tree.is(Formula.Type.OR)) {
                if (disjunction != null) {
                    LOGGER.fine("Dilemma: più di una disgiunzione tra le premesse");
                    return logged("dilemma", Derivation.notApplicable(failure));
                }
                disjunction = tree;
            }
        }
        if (disjunction == null) {
            return logged("dilemma", Derivation.notApplicable(failure));
        }

        // Fase 2: implicazioni che partono dai due disgiunti
        Formula leftConditional = null;
        Formula rightConditional = null;
        for (Formula tree : trees) {
            if (!tree.is(Formula.Type.IMPLIES)) {
                continue;
            }
            if (tree.left().equals(disjunction.left())) {
                leftConditional = tree;
            } else if (tree.left().equals(disjunction.right())) {
                rightConditional = tree;
            }
        }

        if (leftConditional == null || rightConditional == null) {
            return logged("dilemma", Derivation.notApplicable(failure));
        }
        return logged("dilemma", Derivation.of(Formula.or(leftConditional.right(), rightConditional.right())));
    }

    //endregion

    //region ELIMINAZIONE DELLA DISGIUNZIONE

    /**
     * Applica l'eliminazione della disgiunzione (sillogismo disgiuntivo).
     *
     * La negazione del disgiunto sinistro viene cercata per prima.
     *
     * <pre>
     *   disjunctionElim("a|b", "~a")         ->  b
     *   disjunctionElim("(a&amp;c)|b", "~b")    ->  a&amp;c
     * </pre>
     *
     * @return il disgiunto non negato
     * @throws RuleNotApplicableException se manca la disgiunzione o la negazione di un suo disgiunto
     */
    public Formula disjunctionElim(FormulaSource premise1, FormulaSource premise2) {
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return deriveDisjunctionElim(trees.get(0), trees.get(1), premise1, premise2).orElseThrow();
    }

    public Formula disjunctionElim(String premise1, String premise2) {
        return disjunctionElim(text(premise1), text(premise2));
    }

    public boolean isDisjunctionElim(FormulaSource premise1, FormulaSource premise2, FormulaSource conclusion) {
        Formula candidate = formulas.parse(conclusion);
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return deriveDisjunctionElim(trees.get(0), trees.get(1), premise1, premise2).matches(candidate);
    }

    public boolean isDisjunctionElim(String premise1, String premise2, String conclusion) {
        return isDisjunctionElim(text(premise1), text(premise2), text(conclusion));
    }

    private Derivation deriveDisjunctionElim(Formula first, Formula second, Object premise1, Object premise2) {
        Roles roles = Roles.byLength(first, second);
        Formula disjunction = roles.primary();
        Formula negatedDisjunct = roles.other();

        Derivation derivation;
        if (!disjunction.is(Formula.Type.OR)) {
            derivation = Derivation.notApplicable(
                    "l'eliminazione della disgiunzione non si applica a " + premise1 + " e " + premise2);
        } else if (negatedDisjunct.isNegationOf(disjunction.left())) {
            derivation = Derivation.of(disjunction.right());
        } else if (negatedDisjunct.isNegationOf(disjunction.right())) {
            derivation = Derivation.of(disjunction.left());
        } else {
            derivation = Derivation.notApplicable(
                    "l'eliminazione della disgiunzione non si applica a " + premise1 + " e " + premise2);
        }
        return logged("eliminazione della disgiunzione", derivation);
    }

    //endregion

    //region INTRODUZIONE DELLA DISGIUNZIONE

    /**
     * Aggiunge {@code statement} alla destra di {@code premise1}.
     *
     * @see #disjunctionIntro(FormulaSource, FormulaSource, Side)
     */
    public Formula disjunctionIntro(FormulaSource premise1, FormulaSource statement) {
        return disjunctionIntro(premise1, statement, Side.RIGHT);
    }

    /**
     * Applica l'introduzione della disgiunzione. La regola si applica sempre a
     * formule ben formate.
     *
     * Gli operandi composti (nodi binari) compaiono tra parentesi nel testo del
     * risultato, atomi e negazioni no; è esattamente la forma canonica della
     * disgiunzione costruita.
     *
     * <pre>
     *   disjunctionIntro("a->b", "~c", RIGHT)   ->  (a->b)|~c
     *   disjunctionIntro("a->b", "~c", LEFT)    ->  ~c|(a->b)
     * </pre>
     *
     * @param premise1 formula a cui si aggiunge il disgiunto
     * @param statement disgiunto aggiunto
     * @param side lato su cui aggiungere {@code statement}
     * @return la disgiunzione risultante
     */
    public Formula disjunctionIntro(FormulaSource premise1, FormulaSource statement, Side side) {
        requireSide(side);
        List<Formula> trees = formulas.parseAll(premise1, statement);
        Formula premise = trees.get(0);
        Formula added = trees.get(1);

        Formula conclusion = side == Side.LEFT ? Formula.or(added, premise) : Formula.or(premise, added);
        return logged("introduzione della disgiunzione", Derivation.of(conclusion)).conclusion();
    }

    public Formula disjunctionIntro(String premise1, String statement) {
        return disjunctionIntro(text(premise1), text(statement), Side.RIGHT);
    }

    /**
     * @param side "right" oppure "left"
     * @throws IllegalArgumentException per qualsiasi altro valore di {@code side},
     *         prima di analizzare le formule
     */
    public Formula disjunctionIntro(String premise1, String statement, String side) {
        Side parsedSide = Side.parse(side);
        return disjunctionIntro(text(premise1), text(statement), parsedSide);
    }

    /**
     * Verifica se {@code conclusion} segue da {@code premise1} per introduzione
     * della disgiunzione: la conclusione deve essere una disgiunzione con
     * {@code premise1} (strutturalmente) su uno dei due lati.
     */
    public boolean isDisjunctionIntro(FormulaSource premise1, FormulaSource conclusion) {
        List<Formula> trees = formulas.parseAll(premise1, conclusion);
        Formula premise = trees.get(0);
        Formula candidate = trees.get(1);

        boolean valid = candidate.is(Formula.Type.OR)
                && (candidate.left().equals(premise) || candidate.right().equals(premise));
        LOGGER.fine("Verifica introduzione della disgiunzione: " + premise + " ⊢ " + candidate + " = " + valid);
        return valid;
    }

    public boolean isDisjunctionIntro(String premise1, String conclusion) {
        return isDisjunctionIntro(text(premise1), text(conclusion));
    }

    //endregion

    //region ELIMINAZIONE DELLA CONGIUNZIONE

    /**
     * Applica l'eliminazione della congiunzione.
     *
     * <pre>
     *   conjunctionElim("a&amp;b", RIGHT)        ->  b
     *   conjunctionElim("~(d|c)&amp;e", LEFT)    ->  ~(d|c)
     * </pre>
     *
     * @param premise congiunzione da cui estrarre
     * @param side congiunto da restituire
     * @throws RuleNotApplicableException se la premessa non è una congiunzione
     */
    public Formula conjunctionElim(FormulaSource premise, Side side) {
        requireSide(side);
        Formula conjunction = formulas.parse(premise);
        return deriveConjunctionElim(conjunction, side, premise).orElseThrow();
    }

    /**
     * @param side "right" oppure "left"
     * @throws IllegalArgumentException per qualsiasi altro valore di {@code side},
     *         prima di analizzare la premessa
     */
    public Formula conjunctionElim(String premise, String side) {
        Side parsedSide = Side.parse(side);
        return conjunctionElim(text(premise), parsedSide);
    }

    /**
     * Verifica se {@code conclusion} è uno dei due congiunti di {@code premise}.
     */
    public boolean isConjunctionElim(FormulaSource premise, FormulaSource conclusion) {
        Formula candidate = formulas.parse(conclusion);
        Formula conjunction = formulas.parse(premise);
        return deriveConjunctionElim(conjunction, Side.RIGHT, premise).matches(candidate)
                || deriveConjunctionElim(conjunction, Side.LEFT, premise).matches(candidate);
    }

    public boolean isConjunctionElim(String premise, String conclusion) {
        return isConjunctionElim(text(premise), text(conclusion));
    }

    /**
     * Verifica limitata a un solo lato: {@code conclusion} deve essere il congiunto
     * indicato da {@code side}.
     *
     * @throws IllegalArgumentException se {@code side} non è "right" o "left",
     *         prima di analizzare le formule
     */
    public boolean isConjunctionElim(String premise, String conclusion, String side) {
        Side parsedSide = Side.parse(side);
        Formula candidate = formulas.parse(text(conclusion));
        Formula conjunction = formulas.parse(text(premise));
        return deriveConjunctionElim(conjunction, parsedSide, premise).matches(candidate);
    }

    private Derivation deriveConjunctionElim(Formula conjunction, Side side, Object premise) {
        Derivation derivation;
        if (!conjunction.is(Formula.Type.AND)) {
            derivation = Derivation.notApplicable("l'eliminazione della congiunzione non si applica a " + premise);
        } else {
            derivation = Derivation.of(side == Side.LEFT ? conjunction.left() : conjunction.right());
        }
        return logged("eliminazione della congiunzione", derivation);
    }

    //endregion

    //region INTRODUZIONE DELLA CONGIUNZIONE

    /**
     * Applica l'introduzione della congiunzione, rispettando l'ordine degli argomenti.
     *
     * <pre>
     *   conjunctionIntro("a->b", "~c")           ->  (a->b)&amp;~c
     *   conjunctionIntro("p&amp;r", "p<->~q")       ->  (p&amp;r)&amp;(p<->~q)
     * </pre>
     */
    public Formula conjunctionIntro(FormulaSource premise1, FormulaSource premise2) {
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        Formula conclusion = Formula.and(trees.get(0), trees.get(1));
        return logged("introduzione della congiunzione", Derivation.of(conclusion)).conclusion();
    }

    public Formula conjunctionIntro(String premise1, String premise2) {
        return conjunctionIntro(text(premise1), text(premise2));
    }

    /**
     * Verifica indipendente dall'ordine: sono accettate sia premise1&amp;premise2
     * sia premise2&amp;premise1.
     */
    public boolean isConjunctionIntro(FormulaSource premise1, FormulaSource premise2, FormulaSource conclusion) {
        Formula candidate = formulas.parse(conclusion);
        List<Formula> trees = formulas.parseAll(premise1, premise2);
        return Derivation.of(Formula.and(trees.get(0), trees.get(1))).matches(candidate)
                || Derivation.of(Formula.and(trees.get(1), trees.get(0))).matches(candidate);
    }

    public boolean isConjunctionIntro(String premise1, String premise2, String conclusion) {
        return isConjunctionIntro(text(premise1), text(premise2), text(conclusion));
    }

    //endregion

    //region UTILITY

    private static FormulaSource text(String formula) {
        return FormulaSource.text(formula);
    }

    private static void requireSide(Side side) {
        if (side == null) {
            throw new IllegalArgumentException("Il lato può valere soltanto 'right' o 'left', ricevuto: null");
        }
    }

    private static Derivation logged(String rule, Derivation derivation) {
        if (derivation.isApplicable()) {
            LOGGER.fine(rule + " -> " + derivation.conclusion());
        } else {
            LOGGER.fine(derivation.reason());
        }
        return derivation;
    }

    /**
     * Coppia di premesse con i ruoli assegnati: {@code primary} è la candidata a
     * implicazione o disgiunzione, {@code other} la premessa semplice.
     */
    private record Roles(Formula primary, Formula other) {

        /**
         * La premessa con il testo canonico strettamente più lungo è la primaria;
         * a parità di lunghezza la seconda.
         */
        static Roles byLength(Formula first, Formula second) {
            if (first.toString().length() > second.toString().length()) {
                return new Roles(first, second);
            }
            return new Roles(second, first);
        }
    }

    //endregion
}
