package org.logic;

import org.logic.formula.FormulaSyntaxException;
import org.logic.rules.InferenceRules;
import org.logic.rules.Rule;
import org.logic.rules.RuleNotApplicableException;
import org.logic.rules.Side;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * REGOLE DI INFERENZA - Interfaccia a linea di comando
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Regola singola (-r): applica una regola alle premesse indicate, oppure la
 *   verifica contro una conclusione proposta (-c)
 * - File batch (-f): elabora ogni riga di un file di testo nel formato
 *   {@code regola[lato] ; premessa ; ... [=> conclusione]}, con errori isolati riga per riga
 *
 * PARAMETRI:
 * - -h: help
 * - -r &lt;regola&gt; &lt;premessa&gt;...: codice regola (mp, mt, ci, dil, de, di, ce, cj) e premesse
 * - -s &lt;lato&gt;: right o left, per di e ce
 * - -c &lt;conclusione&gt;: verifica invece di applicare
 * - -f &lt;file&gt;: modalità batch
 * - -v: logging dettagliato
 *
 * CODICI DI USCITA:
 * - 0: esecuzione completata (nel batch, nessuna riga in errore)
 * - 1: parametri non validi, errore di sintassi, regola non applicabile o righe batch in errore
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String RULE_PARAM = "-r";
    private static final String SIDE_PARAM = "-s";
    private static final String CHECK_PARAM = "-c";
    private static final String FILE_PARAM = "-f";
    private static final String VERBOSE_PARAM = "-v";

    /**
     * Righe del file batch ignorate
     * */
    private static final String COMMENT_PREFIX = "#";

    private static final int EXIT_OK = 0;
    private static final int EXIT_ERROR = 1;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Coordina l'esecuzione dall'analisi dei parametri alla stampa dei risultati.
     *
     * @param args parametri linea di comando
     * @param out destinazione dell'output
     * @return codice di uscita
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_ERROR;
        }

        CliConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            out.println("Usa -h per visualizzare l'help completo.");
            return EXIT_ERROR;
        }

        if (config == null) {
            printApplicationHelp(out);
            return EXIT_OK;
        }

        if (config.verbose()) {
            enableVerboseLogging();
        }

        InferenceRules rules = new InferenceRules();
        try {
            return config.isBatchMode()
                    ? processBatchFile(config.filePath(), rules, out)
                    : processSingleRequest(config.request(), rules, out);
        } catch (Exception e) {
            return handleGlobalError(e, out);
        }
    }

    /**
     * Gestisce errori critici con logging completo e messaggio per l'utente.
     */
    private static int handleGlobalError(Exception e, PrintStream out) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        return EXIT_ERROR;
    }

    //endregion

    //region REGOLA SINGOLA

    private static int processSingleRequest(RuleRequest request, InferenceRules rules, PrintStream out) {
        try {
            String result = request.execute(rules);
            LOGGER.info(request + " -> " + result);
            out.println(result);
            return EXIT_OK;
        } catch (FormulaSyntaxException | RuleNotApplicableException | IllegalArgumentException e) {
            out.println("[E] " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    //endregion

    //region ELABORAZIONE FILE BATCH

    /**
     * Elabora sequenzialmente ogni riga del file. Un errore su una riga viene
     * riportato e conteggiato senza interrompere le successive.
     *
     * @param filePath file con una richiesta per riga
     * @return EXIT_OK se tutte le righe sono state elaborate senza errori
     * @throws IOException se il file non è leggibile
     */
    private static int processBatchFile(String filePath, InferenceRules rules, PrintStream out) throws IOException {
        out.println("[I] Elaborazione file: " + filePath);
        List<String> lines = Files.readAllLines(Path.of(filePath));

        BatchResult batchResult = new BatchResult();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }

            int lineNumber = i + 1;
            try {
                RuleRequest request = RuleRequest.parse(line);
                String result = request.execute(rules);
                out.println("[" + lineNumber + "] " + request + "  ->  " + result);
                batchResult.incrementSuccess();
            } catch (FormulaSyntaxException | RuleNotApplicableException | IllegalArgumentException e) {
                LOGGER.warning("Riga " + lineNumber + " scartata: " + e.getMessage());
                out.println("[E] Riga " + lineNumber + ": " + e.getMessage());
                batchResult.incrementError();
            }
        }

        out.println("[I] Righe elaborate: " + batchResult.total()
                + " (successi: " + batchResult.successCount + ", errori: " + batchResult.errorCount + ")");
        return batchResult.errorCount == 0 ? EXIT_OK : EXIT_ERROR;
    }

    //endregion

    //region UTILITY

    /**
     * Abbassa il livello del logger radice e dei suoi handler a FINE.
     */
    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    private static void printApplicationHelp(PrintStream out) {
        out.println("""
                Utilizzo:
                  -r <regola> <premessa>... [-s right|left] [-c <conclusione>]
                  -f <file>
                  -v    logging dettagliato
                  -h    questo help

                Regole:""");
        for (Rule rule : Rule.values()) {
            out.printf("  %-4s %s (%d premesse%s)%n", rule.code(), rule.displayName(), rule.applyArity(),
                    rule.isSided() ? ", lato" : "");
        }
        out.println("""

                Formato file batch, una richiesta per riga ('#' per i commenti):
                  regola[lato] ; premessa ; premessa ... [=> conclusione]""");
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * Parser degli argomenti: gli argomenti che non sono parametri vengono
     * raccolti come premesse della regola indicata con -r.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, oppure null se è stato richiesto l'help
         */
        public CliConfiguration parse(String[] args) {
            Rule rule = null;
            Side side = null;
            String conclusion = null;
            String filePath = null;
            boolean verbose = false;
            List<String> premises = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case RULE_PARAM -> rule = Rule.fromCode(getNextArgument(args, ++i, "codice regola"));
                    case SIDE_PARAM -> side = Side.parse(getNextArgument(args, ++i, "lato"));
                    case CHECK_PARAM -> conclusion = getNextArgument(args, ++i, "conclusione");
                    case FILE_PARAM -> {
                        filePath = getNextArgument(args, ++i, "file");
                        validateFileExists(filePath);
                    }
                    case VERBOSE_PARAM -> verbose = true;
                    default -> premises.add(args[i]);
                }
            }

            if (filePath != null) {
                if (rule != null || side != null || conclusion != null || !premises.isEmpty()) {
                    throw new IllegalArgumentException("Modalità file (-f) non può essere combinata con -r, -s, -c o premesse");
                }
                return new CliConfiguration(null, filePath, verbose);
            }

            if (rule == null) {
                throw new IllegalArgumentException("Specificare una regola con -r oppure un file con -f");
            }
            if (premises.isEmpty()) {
                throw new IllegalArgumentException("Nessuna premessa fornita per " + rule.displayName());
            }
            return new CliConfiguration(new RuleRequest(rule, side, premises, conclusion), null, verbose);
        }

        /**
         * Verifica che esista un argomento successivo prima di restituirlo.
         */
        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }
    }

    /**
     * Configurazione validata: una richiesta singola oppure un file batch.
     */
    private record CliConfiguration(RuleRequest request, String filePath, boolean verbose) {

        boolean isBatchMode() {
            return filePath != null;
        }
    }

    /**
     * Contatori dell'elaborazione batch.
     */
    private static class BatchResult {
        int successCount = 0;
        int errorCount = 0;

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }

        int total() { return successCount + errorCount; }
    }

    //endregion
}
