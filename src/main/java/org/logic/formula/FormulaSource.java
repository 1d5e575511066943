package org.logic.formula;

/**
 * Sorgente di una formula: testo ancora da analizzare oppure albero già costruito.
 *
 * Le regole di inferenza accettano premesse in entrambe le forme e le trattano
 * in modo uniforme dopo la normalizzazione operata da {@link FormulaService}.
 */
public interface FormulaSource {

    /**
     * Restituisce l'albero della formula, analizzando il testo se necessario.
     *
     * @param service servizio usato per il parsing
     * @return albero della formula
     * @throws FormulaSyntaxException se il testo non è una formula ben formata
     */
    Formula resolve(FormulaService service);

    /**
     * Crea una sorgente testuale.
     *
     * @param text formula in notazione infissa, ad esempio {@code "(a&c)->~d"}
     * @return sorgente che verrà analizzata al momento dell'uso
     */
    static FormulaSource text(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }
        return new Text(text);
    }

    /**
     * Formula in forma testuale. Il toString restituisce il testo originale,
     * così i messaggi d'errore riportano la premessa come l'ha scritta l'utente.
     */
    record Text(String value) implements FormulaSource {

        @Override
        public Formula resolve(FormulaService service) {
            return service.parse(value);
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
