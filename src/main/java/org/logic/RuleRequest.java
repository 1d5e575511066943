package org.logic;

import org.logic.rules.InferenceRules;
import org.logic.rules.Rule;
import org.logic.rules.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Richiesta di applicazione o verifica di una regola, come compare in una riga
 * di un file batch.
 *
 * FORMATO RIGA:
 * <pre>
 *   regola[lato] ; premessa ; premessa ... [=> conclusione]
 * </pre>
 * Esempi:
 * <pre>
 *   mp ; a->b ; a
 *   dil ; a|b ; a->p ; b->q => p|q
 *   ce[left] ; a&amp;b
 * </pre>
 * Con la conclusione la riga è una verifica, senza è un'applicazione.
 *
 * @param rule regola richiesta
 * @param side lato, null se non indicato
 * @param premises premesse testuali
 * @param conclusion conclusione da verificare, null per un'applicazione
 */
public record RuleRequest(Rule rule, Side side, List<String> premises, String conclusion) {

    private static final String CONCLUSION_SEPARATOR = "=>";
    private static final String PREMISE_SEPARATOR = ";";

    public RuleRequest {
        if (rule == null) {
            throw new IllegalArgumentException("Regola non può essere null");
        }
        if (premises == null || premises.isEmpty()) {
            throw new IllegalArgumentException("Almeno una premessa è richiesta per " + rule.displayName());
        }
        premises = List.copyOf(premises);
    }

    /**
     * Analizza una riga nel formato batch.
     *
     * @throws IllegalArgumentException se la riga non rispetta il formato
     */
    public static RuleRequest parse(String line) {
        if (line == null || line.trim().isEmpty()) {
            throw new IllegalArgumentException("Riga vuota");
        }

        String body = line;
        String conclusion = null;
        int arrow = line.indexOf(CONCLUSION_SEPARATOR);
        if (arrow >= 0) {
            body = line.substring(0, arrow);
            conclusion = line.substring(arrow + CONCLUSION_SEPARATOR.length()).trim();
            if (conclusion.isEmpty()) {
                throw new IllegalArgumentException("Conclusione vuota dopo '" + CONCLUSION_SEPARATOR + "'");
            }
        }

        String[] parts = body.split(PREMISE_SEPARATOR, -1);
        List<String> premises = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            String premise = parts[i].trim();
            if (premise.isEmpty()) {
                throw new IllegalArgumentException("Premessa vuota in posizione " + i);
            }
            premises.add(premise);
        }

        String ruleSpec = parts[0].trim();
        Side side = null;
        int bracket = ruleSpec.indexOf('[');
        if (bracket >= 0) {
            if (!ruleSpec.endsWith("]")) {
                throw new IllegalArgumentException("Lato non chiuso in: " + ruleSpec);
            }
            side = Side.parse(ruleSpec.substring(bracket + 1, ruleSpec.length() - 1).trim());
            ruleSpec = ruleSpec.substring(0, bracket).trim();
        }

        return new RuleRequest(Rule.fromCode(ruleSpec), side, premises, conclusion);
    }

    public boolean isCheck() {
        return conclusion != null;
    }

    /**
     * Esegue la richiesta.
     *
     * @return il testo canonico della conclusione, oppure "true"/"false" per una verifica
     */
    public String execute(InferenceRules rules) {
        if (isCheck()) {
            return String.valueOf(rule.check(rules, premises, side, conclusion));
        }
        return rule.apply(rules, premises, side).toString();
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder(rule.code());
        if (side != null) {
            out.append('[').append(side.label()).append(']');
        }
        for (String premise : premises) {
            out.append(" ; ").append(premise);
        }
        if (conclusion != null) {
            out.append(' ').append(CONCLUSION_SEPARATOR).append(' ').append(conclusion);
        }
        return out.toString();
    }
}
