package org.logic.formula;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero con un insieme
 * chiuso di varianti, identificate da {@link Type}. Ogni regola di inferenza lavora
 * per confronto strutturale su questi alberi e costruisce sempre nodi nuovi:
 * nessuna istanza viene mai modificata dopo la costruzione.
 *
 * VARIANTI:
 * - ATOM: variabile proposizionale (foglia)
 * - NOT: negazione, un solo operando
 * - AND, OR, IMPLIES, IFF: operatori binari con figlio sinistro e destro
 *
 * UGUAGLIANZA:
 * - Strutturale e sensibile all'ordine: a&b e b&a sono formule diverse
 * - Coerente con hashCode per l'uso in collezioni
 *
 * La rappresentazione testuale restituita da {@link #toString()} è la forma
 * canonica prodotta da {@link FormulaPrinter}.
 */
public final class Formula implements FormulaSource {

    //region TIPI E STRUTTURA DATI

    /** Nomi ammessi per le variabili, come IDENTIFIER nella grammatica */
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Tipi di nodo supportati, con il simbolo usato nella forma canonica.
     */
    public enum Type {
        ATOM(""),        // Variabile atomica: p, q, r, ...
        NOT("~"),        // Negazione: ~A
        AND("&"),        // Congiunzione: A & B
        OR("|"),         // Disgiunzione: A | B
        IMPLIES("->"),   // Implicazione: A -> B
        IFF("<->");      // Biimplicazione: A <-> B

        private final String symbol;

        Type(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isBinary() {
            return this != ATOM && this != NOT;
        }
    }

    /** Tipo del nodo corrente */
    private final Type type;

    /** Nome della variabile (solo per ATOM) */
    private final String atom;

    /** Operando sinistro per i binari, unico operando per NOT */
    private final Formula left;

    /** Operando destro (solo per i binari) */
    private final Formula right;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String atom, Formula left, Formula right) {
        this.type = type;
        this.atom = atom;
        this.left = left;
        this.right = right;
    }

    /**
     * Costruisce una foglia per la variabile proposizionale indicata.
     *
     * Il nome deve essere un identificatore della grammatica: un nome come
     * "a&b" verrebbe stampato come una congiunzione e romperebbe la
     * corrispondenza tra testo canonico e albero.
     *
     * @param name nome della variabile, nella forma [A-Za-z_][A-Za-z0-9_]*
     * @return nodo ATOM
     * @throws IllegalArgumentException se il nome è null o non è un identificatore
     */
    public static Formula atom(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome variabile atomica non può essere null");
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Nome variabile atomica non valido: '" + name + "'");
        }
        return new Formula(Type.ATOM, name, null, null);
    }

    /**
     * Costruisce la negazione dell'operando.
     *
     * @param operand formula da negare (non null)
     * @return nodo NOT
     */
    public static Formula not(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new Formula(Type.NOT, null, operand, null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula antecedent, Formula consequent) {
        return binary(Type.IMPLIES, antecedent, consequent);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    /**
     * Costruisce un nodo binario generico.
     *
     * @param type operatore binario (AND, OR, IMPLIES, IFF)
     * @param left operando sinistro (non null)
     * @param right operando destro (non null)
     * @return nuovo nodo binario
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public static Formula binary(Type type, Formula left, Formula right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo deve essere un operatore binario, ricevuto: " + type);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi per " + type + " non possono essere null");
        }
        return new Formula(type, null, left, right);
    }

    //endregion

    //region ACCESSO ALLA STRUTTURA

    public Type type() {
        return type;
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean isBinary() {
        return type.isBinary();
    }

    /**
     * Nome della variabile atomica.
     *
     * @throws IllegalStateException se il nodo non è un ATOM
     */
    public String atom() {
        requireType(type == Type.ATOM, "atom");
        return atom;
    }

    /**
     * Operando di una negazione.
     *
     * @throws IllegalStateException se il nodo non è un NOT
     */
    public Formula operand() {
        requireType(type == Type.NOT, "operand");
        return left;
    }

    /**
     * Figlio sinistro di un nodo binario (l'antecedente per IMPLIES).
     *
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula left() {
        requireType(isBinary(), "left");
        return left;
    }

    /**
     * Figlio destro di un nodo binario (il conseguente per IMPLIES).
     *
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula right() {
        requireType(isBinary(), "right");
        return right;
    }

    /**
     * Verifica se questa formula è esattamente la negazione di {@code other},
     * cioè un NOT il cui operando è strutturalmente uguale a {@code other}.
     */
    public boolean isNegationOf(Formula other) {
        return type == Type.NOT && left.equals(other);
    }

    private void requireType(boolean condition, String accessor) {
        if (!condition) {
            throw new IllegalStateException("Accesso " + accessor + "() non valido per nodo " + type);
        }
    }

    //endregion

    //region FormulaSource

    @Override
    public Formula resolve(FormulaService service) {
        return this;
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    /**
     * Uguaglianza strutturale ricorsiva: stessa forma, stessi operatori,
     * stessi atomi, nello stesso ordine.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.type != other.type) return false;

        return switch (this.type) {
            case ATOM -> this.atom.equals(other.atom);
            case NOT -> this.left.equals(other.left);
            case AND, OR, IMPLIES, IFF -> this.left.equals(other.left) && this.right.equals(other.right);
        };
    }

    @Override
    public int hashCode() {
        return switch (this.type) {
            case ATOM -> Objects.hash(type, atom);
            case NOT -> Objects.hash(type, left);
            case AND, OR, IMPLIES, IFF -> Objects.hash(type, left, right);
        };
    }

    /**
     * Forma canonica della formula, con parentesizzazione minima.
     */
    @Override
    public String toString() {
        return FormulaPrinter.render(this);
    }

    //endregion
}
