package org.logic.rules;

/**
 * Le premesse sono formule ben formate ma non hanno la forma richiesta dalla regola.
 *
 * Sollevata dalle operazioni di applicazione; le operazioni di verifica la
 * traducono in un esito negativo tramite {@link Derivation}.
 */
public class RuleNotApplicableException extends RuntimeException {

    public RuleNotApplicableException(String message) {
        super(message);
    }
}
