package org.logic.rules;

import org.logic.formula.Formula;

import java.util.List;

/**
 * Catalogo delle regole di inferenza, con il codice breve usato dalla linea di
 * comando e il numero di premesse richiesto da applicazione e verifica.
 *
 * L'introduzione della disgiunzione è l'unica regola in cui le due arità
 * differiscono: si applica a premessa e disgiunto aggiunto, ma si verifica a
 * partire dalla sola premessa.
 */
public enum Rule {
    MODUS_PONENS("mp", "modus ponens", 2, 2, false),
    MODUS_TOLLENS("mt", "modus tollens", 2, 2, false),
    CHAIN_IMPLICATION("ci", "implicazione a catena", 2, 2, false),
    DILEMMA("dil", "dilemma costruttivo", 3, 3, false),
    DISJUNCTION_ELIM("de", "eliminazione della disgiunzione", 2, 2, false),
    DISJUNCTION_INTRO("di", "introduzione della disgiunzione", 2, 1, true),
    CONJUNCTION_ELIM("ce", "eliminazione della congiunzione", 1, 1, true),
    CONJUNCTION_INTRO("cj", "introduzione della congiunzione", 2, 2, false);

    private final String code;
    private final String displayName;
    private final int applyArity;
    private final int checkArity;
    private final boolean sided;

    Rule(String code, String displayName, int applyArity, int checkArity, boolean sided) {
        this.code = code;
        this.displayName = displayName;
        this.applyArity = applyArity;
        this.checkArity = checkArity;
        this.sided = sided;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public int applyArity() {
        return applyArity;
    }

    public int checkArity() {
        return checkArity;
    }

    /** true se la regola accetta il parametro lato */
    public boolean isSided() {
        return sided;
    }

    /**
     * Cerca una regola per codice breve ("mp") o per nome ("modus_ponens"),
     * senza distinzione tra maiuscole e minuscole.
     *
     * @throws IllegalArgumentException se nessuna regola corrisponde
     */
    public static Rule fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Codice regola non può essere null");
        }
        String normalized = value.trim();
        for (Rule rule : values()) {
            if (rule.code.equalsIgnoreCase(normalized) || rule.name().equalsIgnoreCase(normalized)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Regola sconosciuta: " + value);
    }

    //region DISPATCH

    /**
     * Applica la regola alle premesse testuali.
     *
     * @param rules motore delle regole
     * @param premises premesse, nel numero indicato da {@link #applyArity()}
     * @param side lato (solo per le regole con lato; null equivale a "right"
     *             per l'introduzione della disgiunzione)
     * @return la conclusione derivata
     * @throws IllegalArgumentException se il numero di premesse o il lato non sono validi
     * @throws RuleNotApplicableException se le premesse non hanno la forma richiesta
     */
    public Formula apply(InferenceRules rules, List<String> premises, Side side) {
        requireArity(premises, applyArity);
        requireSideUsage(side);

        return switch (this) {
            case MODUS_PONENS -> rules.modusPonens(premises.get(0), premises.get(1));
            case MODUS_TOLLENS -> rules.modusTollens(premises.get(0), premises.get(1));
            case CHAIN_IMPLICATION -> rules.chainImplication(premises.get(0), premises.get(1));
            case DILEMMA -> rules.dilemma(premises.get(0), premises.get(1), premises.get(2));
            case DISJUNCTION_ELIM -> rules.disjunctionElim(premises.get(0), premises.get(1));
            case DISJUNCTION_INTRO -> rules.disjunctionIntro(premises.get(0), premises.get(1),
                    side == null ? Side.RIGHT.label() : side.label());
            case CONJUNCTION_ELIM -> {
                if (side == null) {
                    throw new IllegalArgumentException("L'eliminazione della congiunzione richiede il lato");
                }
                yield rules.conjunctionElim(premises.get(0), side.label());
            }
            case CONJUNCTION_INTRO -> rules.conjunctionIntro(premises.get(0), premises.get(1));
        };
    }

    /**
     * Verifica se {@code conclusion} segue dalle premesse per questa regola.
     *
     * @param side per l'eliminazione della congiunzione limita la verifica a un
     *             solo congiunto; null li prova entrambi
     * @throws IllegalArgumentException se il numero di premesse o il lato non sono validi
     */
    public boolean check(InferenceRules rules, List<String> premises, Side side, String conclusion) {
        requireArity(premises, checkArity);
        if (side != null && this != CONJUNCTION_ELIM) {
            throw new IllegalArgumentException("La verifica di " + displayName + " non prevede il lato");
        }

        return switch (this) {
            case MODUS_PONENS -> rules.isModusPonens(premises.get(0), premises.get(1), conclusion);
            case MODUS_TOLLENS -> rules.isModusTollens(premises.get(0), premises.get(1), conclusion);
            case CHAIN_IMPLICATION -> rules.isChainImplication(premises.get(0), premises.get(1), conclusion);
            case DILEMMA -> rules.isDilemma(premises.get(0), premises.get(1), premises.get(2), conclusion);
            case DISJUNCTION_ELIM -> rules.isDisjunctionElim(premises.get(0), premises.get(1), conclusion);
            case DISJUNCTION_INTRO -> rules.isDisjunctionIntro(premises.get(0), conclusion);
            case CONJUNCTION_ELIM -> side == null
                    ? rules.isConjunctionElim(premises.get(0), conclusion)
                    : rules.isConjunctionElim(premises.get(0), conclusion, side.label());
            case CONJUNCTION_INTRO -> rules.isConjunctionIntro(premises.get(0), premises.get(1), conclusion);
        };
    }

    private void requireArity(List<String> premises, int expected) {
        if (premises == null || premises.size() != expected) {
            int received = premises == null ? 0 : premises.size();
            throw new IllegalArgumentException(displayName + " richiede " + expected
                    + " premesse, ricevute: " + received);
        }
    }

    private void requireSideUsage(Side side) {
        if (side != null && !sided) {
            throw new IllegalArgumentException(displayName + " non prevede il lato");
        }
    }

    //endregion
}
