package org.logic.formula;

/**
 * Segnala un testo che non è una formula ben formata (errore lessicale o sintattico).
 *
 * Non viene mai convertito in un risultato negativo: le verifiche delle regole
 * lo propagano sempre al chiamante.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final String input;
    private final int line;
    private final int column;

    public FormulaSyntaxException(String input, int line, int column, String detail) {
        super("Formula non valida '" + input + "' (riga " + line + ", colonna " + column + "): " + detail);
        this.input = input;
        this.line = line;
        this.column = column;
    }

    /** Testo che ha causato l'errore */
    public String getInput() {
        return input;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
