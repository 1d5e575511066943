package org.logic.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.logic.formula.parser.LogicFormulaLexer;
import org.logic.formula.parser.LogicFormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * SERVIZIO FORMULE - Parsing e stampa canonica
 *
 * Unico punto di contatto tra le regole di inferenza e la sintassi testuale.
 * Espone due sole operazioni:
 * - parseAll: da testo (o formula già costruita) ad albero
 * - render: da albero a testo canonico
 *
 * PIPELINE DI PARSING:
 * Lexing -> Parsing ANTLR -> Visitor {@link FormulaParser} -> {@link Formula}
 *
 * Il listener di errori predefinito di ANTLR (che stampa su console e tenta un
 * recupero) è sostituito da uno che interrompe subito l'analisi con una
 * {@link FormulaSyntaxException}: una formula malformata non produce mai un
 * albero parziale.
 *
 * Il servizio è privo di stato: ogni chiamata crea il proprio lexer e parser,
 * quindi può essere condiviso tra thread.
 */
public class FormulaService {

    private static final Logger LOGGER = Logger.getLogger(FormulaService.class.getName());

    //region PARSING

    /**
     * Analizza una sequenza di sorgenti, nell'ordine dato.
     *
     * @param sources testi o formule già costruite
     * @return alberi corrispondenti, nello stesso ordine
     * @throws FormulaSyntaxException alla prima sorgente malformata
     */
    public List<Formula> parseAll(FormulaSource... sources) {
        if (sources == null) {
            throw new IllegalArgumentException("Lista sorgenti non può essere null");
        }

        List<Formula> trees = new ArrayList<>(sources.length);
        for (FormulaSource source : sources) {
            trees.add(parse(source));
        }
        return trees;
    }

    /**
     * Analizza una singola sorgente.
     *
     * @param source testo o formula già costruita
     * @return albero della formula
     * @throws FormulaSyntaxException se il testo è malformato
     */
    public Formula parse(FormulaSource source) {
        if (source == null) {
            throw new IllegalArgumentException("Sorgente della formula non può essere null");
        }
        return source.resolve(this);
    }

    /**
     * Analizza una formula in notazione infissa.
     *
     * @param text formula testuale, ad esempio {@code "~(d|c)->(p&~q)"}
     * @return albero della formula
     * @throws FormulaSyntaxException se il testo non è ben formato (incluso il testo vuoto)
     */
    public Formula parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }

        // Setup pipeline ANTLR
        CharStream input = CharStreams.fromString(text);
        LogicFormulaLexer lexer = new LogicFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new FailFastErrorListener(text));

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new FailFastErrorListener(text));

        // Parsing e conversione
        ParseTree tree = parser.formula();
        Formula formula = new FormulaParser().visit(tree);

        LOGGER.finest("Formula analizzata: " + text + " -> " + formula);
        return formula;
    }

    //endregion

    //region STAMPA

    /**
     * Produce il testo canonico della formula.
     *
     * @param formula albero ben formato
     * @return testo canonico, senza spazi e con gli operandi binari tra parentesi
     */
    public String render(Formula formula) {
        return FormulaPrinter.render(formula);
    }

    //endregion

    //region GESTIONE ERRORI ANTLR

    /**
     * Listener che trasforma il primo errore lessicale o sintattico in eccezione.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        private final String input;

        FailFastErrorListener(String input) {
            this.input = input;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new FormulaSyntaxException(input, line, charPositionInLine, msg);
        }
    }

    //endregion
}
