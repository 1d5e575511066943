package org.logic.formula;

/**
 * STAMPA CANONICA - Da albero a testo con parentesizzazione minima
 *
 * REGOLE DI FORMATO:
 * - Nessuno spazio: a&b, (a&c)->~d
 * - Un nodo binario usato come operando è sempre tra parentesi,
 *   indipendentemente dalla precedenza: (a&b)&c, ~(d|c)
 * - Il nodo radice non è mai tra parentesi
 * - Atomi e negazioni non sono mai racchiusi: ~~a|b
 *
 * Il formato è deterministico e totale sugli alberi ben formati: due formule
 * strutturalmente uguali producono lo stesso testo e viceversa.
 */
public final class FormulaPrinter {

    private FormulaPrinter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Produce la forma canonica della formula.
     *
     * @param formula albero da stampare (non null)
     * @return testo canonico
     */
    public static String render(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da stampare non può essere null");
        }
        StringBuilder out = new StringBuilder();
        append(out, formula);
        return out.toString();
    }

    private static void append(StringBuilder out, Formula formula) {
        switch (formula.type()) {
            case ATOM -> out.append(formula.atom());
            case NOT -> {
                out.append(Formula.Type.NOT.symbol());
                appendOperand(out, formula.operand());
            }
            case AND, OR, IMPLIES, IFF -> {
                appendOperand(out, formula.left());
                out.append(formula.type().symbol());
                appendOperand(out, formula.right());
            }
        }
    }

    private static void appendOperand(StringBuilder out, Formula operand) {
        if (operand.isBinary()) {
            out.append('(');
            append(out, operand);
            out.append(')');
        } else {
            append(out, operand);
        }
    }
}
