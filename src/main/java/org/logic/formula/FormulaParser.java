package org.logic.formula;

import org.antlr.v4.runtime.tree.ParseTree;
import org.logic.formula.parser.LogicFormulaBaseVisitor;
import org.logic.formula.parser.LogicFormulaParser.AndContext;
import org.logic.formula.parser.LogicFormulaParser.FormulaContext;
import org.logic.formula.parser.LogicFormulaParser.IdContext;
import org.logic.formula.parser.LogicFormulaParser.IffContext;
import org.logic.formula.parser.LogicFormulaParser.ImpliesContext;
import org.logic.formula.parser.LogicFormulaParser.NotContext;
import org.logic.formula.parser.LogicFormulaParser.OrContext;
import org.logic.formula.parser.LogicFormulaParser.ParContext;
import org.logic.formula.parser.LogicFormulaParser.VarContext;

import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa un visitor sull'albero di parsing generato dalla grammatica
 * LogicFormula e costruisce l'albero immutabile usato dalle regole di inferenza.
 * A differenza di una conversione in forma normale, qui la struttura viene
 * preservata esattamente: nessun operatore viene eliminato o riscritto.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Biimplicazione (<->): associativa a sinistra
 * - Implicazione (->): associativa a destra
 * - Disgiunzione (|): associativa a sinistra
 * - Congiunzione (&): associativa a sinistra
 * - Negazione (~ oppure !): prefissa
 * - Variabili atomiche ed espressioni tra parentesi
 *
 * Le catene n-arie prodotte dalla grammatica (a & b & c) vengono ripiegate in
 * nodi binari annidati a sinistra: (a&b)&c.
 */
public class FormulaParser extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Punto di ingresso per la formula completa.
     *
     * @param ctx contesto della formula completa dalla grammatica ANTLR
     * @return albero della formula
     */
    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.biconditional());
        LOGGER.finest("Formula costruita: " + formula);
        return formula;
    }

    //endregion

    //region OPERATORI BINARI

    /**
     * Gestisce biimplicazioni (<->), anche in catena: a <-> b <-> c diventa (a<->b)<->c.
     *
     * @param ctx contesto biimplicazione dalla grammatica
     * @return formula risultante
     */
    @Override
    public Formula visitIff(IffContext ctx) {
        // Caso base: nessun operatore IFF presente
        if (ctx.IFF().isEmpty()) {
            return visit(ctx.implication(0));
        }

        LOGGER.finest("Elaborazione catena biimplicazioni: " + ctx.IFF().size() + " operatori");
        return foldLeft(Formula.Type.IFF, ctx.implication());
    }

    /**
     * Gestisce implicazioni (->) con associatività a destra:
     * a -> b -> c equivale a a -> (b -> c).
     *
     * @param ctx contesto implicazione dalla grammatica
     * @return formula risultante
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        // Caso base: nessun operatore IMPLIES presente
        if (ctx.IMPLIES() == null) {
            return visit(ctx.disjunction());
        }

        Formula antecedent = visit(ctx.disjunction());
        Formula consequent = visit(ctx.implication());   // ricorsivo per associatività destra
        return Formula.implies(antecedent, consequent);
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }

        LOGGER.finest("Elaborazione disgiunzione con " + ctx.conjunction().size() + " operandi");
        return foldLeft(Formula.Type.OR, ctx.conjunction());
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        if (ctx.negation().size() == 1) {
            return visit(ctx.negation(0));
        }

        LOGGER.finest("Elaborazione congiunzione con " + ctx.negation().size() + " operandi");
        return foldLeft(Formula.Type.AND, ctx.negation());
    }

    //endregion

    //region NEGAZIONI, PARENTESI E ATOMI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    /**
     * Le parentesi non lasciano traccia nell'albero: la struttura le rende implicite.
     */
    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public Formula visitId(IdContext ctx) {
        return Formula.atom(ctx.IDENTIFIER().getText());
    }

    //endregion

    //region UTILITY

    /**
     * Ripiega una lista di operandi in nodi binari annidati a sinistra.
     */
    private Formula foldLeft(Formula.Type type, List<? extends ParseTree> operands) {
        Formula result = visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = Formula.binary(type, result, visit(operands.get(i)));
        }
        return result;
    }

    //endregion
}
