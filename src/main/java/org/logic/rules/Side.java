package org.logic.rules;

/**
 * Lato di una formula binaria su cui opera una regola: il disgiunto da
 * aggiungere nell'introduzione della disgiunzione, il congiunto da estrarre
 * nell'eliminazione della congiunzione.
 */
public enum Side {
    LEFT("left"),
    RIGHT("right");

    private final String label;

    Side(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Converte il valore testuale accettato dalle regole.
     *
     * Sono ammessi soltanto {@code "right"} e {@code "left"}, esattamente in
     * questa forma: qualsiasi altro valore è un errore del chiamante, non una
     * mancata applicazione della regola.
     *
     * @param value valore testuale del lato
     * @return lato corrispondente
     * @throws IllegalArgumentException se il valore non è "right" o "left"
     */
    public static Side parse(String value) {
        for (Side side : values()) {
            if (side.label.equals(value)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Il lato può valere soltanto 'right' o 'left', ricevuto: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
