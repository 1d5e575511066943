package org.logic.rules;

import org.logic.formula.Formula;

import java.util.Objects;

/**
 * ESITO DI UNA DERIVAZIONE - Contenitore immutabile
 *
 * Rappresenta esplicitamente i due esiti possibili dell'applicazione di una
 * regola a premesse ben formate:
 * - Derivata: la regola si applica e produce la conclusione
 * - Non applicabile: le premesse non hanno la forma richiesta, con il motivo
 *
 * Gli errori di sintassi e di argomento non sono esiti: vengono sollevati prima
 * che una derivazione esista.
 *
 * UTILIZZO:
 * - Le operazioni di applicazione chiamano {@link #orElseThrow()}
 * - Le operazioni di verifica chiamano {@link #matches(Formula)}, che restituisce
 *   false per una derivazione non applicabile invece di sollevare eccezioni
 */
public final class Derivation {

    /** Conclusione derivata, null se la regola non si applica */
    private final Formula conclusion;

    /** Motivo della mancata applicazione, null se la regola si applica */
    private final String reason;

    private Derivation(Formula conclusion, String reason) {
        this.conclusion = conclusion;
        this.reason = reason;
    }

    //region FACTORY METHODS

    /**
     * Esito positivo.
     *
     * @param conclusion conclusione derivata (non null)
     */
    public static Derivation of(Formula conclusion) {
        if (conclusion == null) {
            throw new IllegalArgumentException("Conclusione derivata non può essere null");
        }
        return new Derivation(conclusion, null);
    }

    /**
     * Esito negativo.
     *
     * @param reason descrizione della regola e delle premesse coinvolte
     */
    public static Derivation notApplicable(String reason) {
        if (reason == null || reason.trim().isEmpty()) {
            throw new IllegalArgumentException("Motivo della mancata applicazione non può essere vuoto");
        }
        return new Derivation(null, reason);
    }

    //endregion

    //region ACCESSO

    public boolean isApplicable() {
        return conclusion != null;
    }

    /**
     * @throws IllegalStateException se la regola non si applica
     */
    public Formula conclusion() {
        if (conclusion == null) {
            throw new IllegalStateException("Nessuna conclusione: " + reason);
        }
        return conclusion;
    }

    /**
     * @throws IllegalStateException se la regola si applica
     */
    public String reason() {
        if (reason == null) {
            throw new IllegalStateException("La regola si applica, nessun motivo di rifiuto");
        }
        return reason;
    }

    /**
     * Restituisce la conclusione o solleva l'errore di regola non applicabile.
     *
     * @throws RuleNotApplicableException se la regola non si applica
     */
    public Formula orElseThrow() {
        if (conclusion == null) {
            throw new RuleNotApplicableException(reason);
        }
        return conclusion;
    }

    /**
     * Confronta la conclusione derivata con quella proposta, tramite il testo canonico.
     * Una derivazione non applicabile non corrisponde a nessuna formula.
     *
     * @param candidate conclusione proposta dal chiamante
     * @return true se la regola si applica e produce esattamente {@code candidate}
     */
    public boolean matches(Formula candidate) {
        return conclusion != null && conclusion.toString().equals(candidate.toString());
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Derivation other = (Derivation) obj;
        return Objects.equals(conclusion, other.conclusion) && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conclusion, reason);
    }

    @Override
    public String toString() {
        return isApplicable() ? "Derivation[" + conclusion + "]" : "Derivation[non applicabile: " + reason + "]";
    }
}
