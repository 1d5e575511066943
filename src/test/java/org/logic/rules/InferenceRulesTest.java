package org.logic.rules;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.formula.Formula;
import org.logic.formula.FormulaService;
import org.logic.formula.FormulaSource;
import org.logic.formula.FormulaSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class InferenceRulesTest {

    private final InferenceRules rules = new InferenceRules();
    private final FormulaService service = new FormulaService();

    @Nested
    class ModusPonens {

        @ParameterizedTest
        @CsvSource({
                "(a&c)->~d,        a&c,     ~d",
                "~(d|c)->(p&~q),   ~(d|c),  p&~q",
                "a,                a->b,    b",
                "(a|b)->(c->d),    a|b,     c->d"
        })
        void derivesConsequent(String premise1, String premise2, String expected) {
            assertEquals(expected, rules.modusPonens(premise1, premise2).toString());
        }

        @Test void acceptsParsedFormulas() {
            Formula conditional = service.parse("(~a&b)->c");
            Formula antecedent = service.parse("~a&b");
            assertEquals(Formula.atom("c"), rules.modusPonens(conditional, antecedent));
        }

        @Test void checkMatchesCanonicalText() {
            assertTrue(rules.isModusPonens("(~a&b)->c", "~a&b", "c"));
            assertTrue(rules.isModusPonens("~(p|q)->(c<->d)", "~(p|q)", "c <-> d"));
            assertFalse(rules.isModusPonens("a->b", "a", "a"));
        }

        @Test void mismatchedAntecedentIsNotApplicable() {
            RuleNotApplicableException e = assertThrows(RuleNotApplicableException.class,
                    () -> rules.modusPonens("a->b", "~a"));
            assertTrue(e.getMessage().contains("a->b"));
            assertTrue(e.getMessage().contains("~a"));
            assertFalse(rules.isModusPonens("a->b", "~a", "b"));
        }

        @Test void noConditionalIsNotApplicable() {
            assertThrows(RuleNotApplicableException.class, () -> rules.modusPonens("a&b", "a"));
            assertFalse(rules.isModusPonens("a&b", "a", "b"));
        }

        @Test void longerPremiseIsTakenAsConditional() {
            // la premessa più lunga è l'atomo: non viene cercata alcuna implicazione nell'altra
            assertThrows(RuleNotApplicableException.class, () -> rules.modusPonens("verylongname", "a->b"));
            assertEquals("b", rules.modusPonens("c->b", "c").toString());
        }
    }

    @Nested
    class ModusTollens {

        @ParameterizedTest
        @CsvSource({
                "(a&c)->~d,        ~~d,      ~(a&c)",
                "~(d|c)->(p&~q),   ~(p&~q),  ~~(d|c)",
                "~b,               a->b,     ~a"
        })
        void derivesNegatedAntecedent(String premise1, String premise2, String expected) {
            assertEquals(expected, rules.modusTollens(premise1, premise2).toString());
        }

        @Test void check() {
            assertTrue(rules.isModusTollens("(~a&b)->c", "~c", "~(~a&b)"));
            assertTrue(rules.isModusTollens("~(p|q)->(c<->d)", "~(c<->d)", "~~(p|q)"));
            assertFalse(rules.isModusTollens("a->b", "b", "a"));
        }

        @Test void requiresNegationOfConsequent() {
            assertThrows(RuleNotApplicableException.class, () -> rules.modusTollens("a->b", "b"));
            assertThrows(RuleNotApplicableException.class, () -> rules.modusTollens("a->b", "~a"));
            assertThrows(RuleNotApplicableException.class, () -> rules.modusTollens("a|b", "~b"));
        }
    }

    @Nested
    class ChainImplication {

        @ParameterizedTest
        @CsvSource({
                "(a&c)->~d,        ~d->(b|d),   (a&c)->(b|d)",
                "~(d|c)->(p&~q),   (p&~q)->a,   ~(d|c)->a",
                "b->c,             a->b,        a->c",
                "a->b,             b->c,        a->c"
        })
        void chainsImplications(String premise1, String premise2, String expected) {
            assertEquals(expected, rules.chainImplication(premise1, premise2).toString());
        }

        @Test void check() {
            assertTrue(rules.isChainImplication("(~a&b)->c", "c->~(d|a)", "(~a&b)->~(d|a)"));
            assertTrue(rules.isChainImplication("~(p|q)->(c<->d)", "(c<->d)->~(~a->~b)", "~(p|q)->~(~a->~b)"));
            assertFalse(rules.isChainImplication("a->b", "b->c", "c"));
        }

        @Test void unrelatedImplicationsAreNotApplicable() {
            assertThrows(RuleNotApplicableException.class, () -> rules.chainImplication("a->b", "c->d"));
            assertThrows(RuleNotApplicableException.class, () -> rules.chainImplication("a->b", "b"));
            assertFalse(rules.isChainImplication("a->b", "c->d", "a->d"));
        }
    }

    @Nested
    class Dilemma {

        @ParameterizedTest
        @CsvSource({
                "(a&c)|~d,       ~d->(b|d),   (a&c)->(p&q),   (p&q)|(b|d)",
                "~(d|c)|(p&~q),  (p&~q)->a,   ~(d|c)->c,      c|a",
                "b|c,            b->p,        c->q,           p|q"
        })
        void derivesDisjunctionOfConsequents(String p1, String p2, String p3, String expected) {
            assertEquals(expected, rules.dilemma(p1, p2, p3).toString());
        }

        @Test void roleAssignmentIsIndependentOfArgumentOrder() {
            String[][] permutations = {
                    {"a|b", "a->p", "b->q"}, {"a|b", "b->q", "a->p"},
                    {"a->p", "a|b", "b->q"}, {"a->p", "b->q", "a|b"},
                    {"b->q", "a|b", "a->p"}, {"b->q", "a->p", "a|b"}
            };
            for (String[] premises : permutations) {
                assertEquals("p|q", rules.dilemma(premises[0], premises[1], premises[2]).toString());
            }
        }

        @Test void check() {
            assertTrue(rules.isDilemma("(~a&b)|c", "c->~(d|a)", "(~a&b)->~p", "~p|~(d|a)"));
            assertTrue(rules.isDilemma("~(p|q)|(c<->d)", "(c<->d)->~(~a->~b)", "~(p|q)->(p<->q)",
                    "(p<->q)|~(~a->~b)"));
            assertFalse(rules.isDilemma("a|b", "b->c", "a->d", "c|d"));
        }

        @Test void checkAcceptsParsedPremises() {
            Formula a = Formula.atom("a");
            Formula b = Formula.atom("b");
            Formula p = Formula.atom("p");
            Formula q = Formula.not(Formula.atom("q"));
            Formula disjunction = Formula.or(a, b);

            assertTrue(rules.isDilemma(Formula.implies(b, q), disjunction, Formula.implies(a, p), Formula.or(p, q)));
            assertTrue(rules.isDilemma(disjunction, Formula.implies(a, p), Formula.implies(b, q),
                    FormulaSource.text("p|~q")));
            assertFalse(rules.isDilemma(disjunction, Formula.implies(a, p), Formula.implies(b, q), Formula.or(q, p)));
        }

        @Test void missingConditionalIsNotApplicable() {
            assertThrows(RuleNotApplicableException.class, () -> rules.dilemma("a|b", "a->p", "c->q"));
            assertThrows(RuleNotApplicableException.class, () -> rules.dilemma("a|b", "a->p", "a->q"));
        }

        @Test void missingDisjunctionIsNotApplicable() {
            assertThrows(RuleNotApplicableException.class, () -> rules.dilemma("a&b", "a->p", "b->q"));
        }

        @Test void moreThanOneDisjunctionIsNotApplicable() {
            assertThrows(RuleNotApplicableException.class, () -> rules.dilemma("a|b", "c|a", "a->p"));
            assertFalse(rules.isDilemma("a|b", "c|a", "a->p", "p|p"));
        }

        @Test void singleConditionalCannotFillBothSlots() {
            assertThrows(RuleNotApplicableException.class, () -> rules.dilemma("a|a", "a->p", "a->q"));
        }
    }

    @Nested
    class DisjunctionElim {

        @ParameterizedTest
        @CsvSource({
                "(a&c)|~d,       ~~d,      a&c",
                "~(d|c)|(p&~q),  ~(p&~q),  ~(d|c)",
                "~a,             a|b,      b"
        })
        void derivesRemainingDisjunct(String premise1, String premise2, String expected) {
            assertEquals(expected, rules.disjunctionElim(premise1, premise2).toString());
        }

        @Test void check() {
            assertTrue(rules.isDisjunctionElim("(~a&b)|c", "~c", "~a&b"));
            assertTrue(rules.isDisjunctionElim("~(p|q)|(c<->d)", "~(c<->d)", "~(p|q)"));
            assertFalse(rules.isDisjunctionElim("a|b", "b", "a"));
        }

        @Test void requiresNegatedDisjunct() {
            assertThrows(RuleNotApplicableException.class, () -> rules.disjunctionElim("a|b", "~c"));
            assertThrows(RuleNotApplicableException.class, () -> rules.disjunctionElim("a&b", "~a"));
        }
    }

    @Nested
    class DisjunctionIntro {

        @Test void addsOnTheRightByDefault() {
            assertEquals("(a->b)|~c", rules.disjunctionIntro("a->b", "~c").toString());
            assertEquals("(p<->~q)|(p&r)", rules.disjunctionIntro("p<->~q", "p&r").toString());
        }

        @Test void addsOnTheLeft() {
            assertEquals("~c|(a->b)", rules.disjunctionIntro("a->b", "~c", "left").toString());
            assertEquals("(p&r)|(p<->~q)", rules.disjunctionIntro("p<->~q", "p&r", "left").toString());
        }

        @Test void atomsAndNegationsAreNotParenthesized() {
            assertEquals("a|~(b&c)", rules.disjunctionIntro("a", "~(b&c)").toString());
            assertEquals("~~a|b", rules.disjunctionIntro("b", "~~a", Side.LEFT.label()).toString());
        }

        @Test void producesDisjunctionTree() {
            Formula result = rules.disjunctionIntro(FormulaSource.text("a"), FormulaSource.text("b"), Side.LEFT);
            assertEquals(Formula.or(Formula.atom("b"), Formula.atom("a")), result);
        }

        @ParameterizedTest
        @ValueSource(strings = {"middle", "Right", "LEFT", ""})
        void invalidSideIsArgumentError(String side) {
            assertThrows(IllegalArgumentException.class, () -> rules.disjunctionIntro("a", "b", side));
        }

        @Test void sideIsValidatedBeforeParsing() {
            assertThrows(IllegalArgumentException.class, () -> rules.disjunctionIntro("a&", "b", "middle"));
        }

        @Test void checkIsStructural() {
            assertTrue(rules.isDisjunctionIntro("~a->b", "(~a->b)|c"));
            assertTrue(rules.isDisjunctionIntro("a", "b|a"));
            assertTrue(rules.isDisjunctionIntro("p&q", "(p&q)|(p&q)"));
            assertFalse(rules.isDisjunctionIntro("a", "(a|b)|c"));
            assertFalse(rules.isDisjunctionIntro("a", "a&b"));
            assertFalse(rules.isDisjunctionIntro("a&b", "(b&a)|c"));
        }
    }

    @Nested
    class ConjunctionElim {

        @ParameterizedTest
        @CsvSource({
                "(a&c)&~d,      right,  ~d",
                "~(d|c)&(p&~q), left,   ~(d|c)",
                "a&b,           right,  b",
                "a&b,           left,   a"
        })
        void extractsConjunct(String premise, String side, String expected) {
            assertEquals(expected, rules.conjunctionElim(premise, side).toString());
        }

        @Test void checkTriesBothSides() {
            assertTrue(rules.isConjunctionElim("(~a&b)&c", "~a&b"));
            assertTrue(rules.isConjunctionElim("(~a&b)&c", "c"));
            assertFalse(rules.isConjunctionElim("a&b", "a&b"));
            assertFalse(rules.isConjunctionElim("a|b", "a"));
        }

        @Test void checkOnOneSide() {
            assertTrue(rules.isConjunctionElim("a&b", "a", "left"));
            assertFalse(rules.isConjunctionElim("a&b", "a", "right"));
        }

        @Test void nonConjunctionIsNotApplicable() {
            assertThrows(RuleNotApplicableException.class, () -> rules.conjunctionElim("a|b", "left"));
        }

        @Test void invalidSideIsArgumentErrorFromApplyAndCheck() {
            assertThrows(IllegalArgumentException.class, () -> rules.conjunctionElim("a&b", "middle"));
            assertThrows(IllegalArgumentException.class, () -> rules.isConjunctionElim("a&b", "a", "middle"));
            assertThrows(IllegalArgumentException.class, () -> rules.conjunctionElim("a&", "middle"));
            assertThrows(IllegalArgumentException.class,
                    () -> rules.conjunctionElim(FormulaSource.text("a&b"), (Side) null));
        }
    }

    @Nested
    class ConjunctionIntro {

        @Test void preservesArgumentOrder() {
            assertEquals("a&b", rules.conjunctionIntro("a", "b").toString());
            assertEquals("b&a", rules.conjunctionIntro("b", "a").toString());
        }

        @Test void parenthesizesCompoundOperands() {
            assertEquals("(a->b)&~c", rules.conjunctionIntro("a->b", "~c").toString());
            assertEquals("(p<->~q)&(p&r)", rules.conjunctionIntro("p<->~q", "p&r").toString());
            assertEquals("(p&r)&(p<->~q)", rules.conjunctionIntro("p&r", "p<->~q").toString());
        }

        @Test void checkIsOrderInsensitive() {
            assertTrue(rules.isConjunctionIntro("a", "b", "b&a"));
            assertTrue(rules.isConjunctionIntro("a", "b", "a&b"));
            assertTrue(rules.isConjunctionIntro("(a->b)", "~c", "~c & (a->b)"));
            assertFalse(rules.isConjunctionIntro("a", "b", "a|b"));
            assertFalse(rules.isConjunctionIntro("a", "b", "a&c"));
        }
    }

    @Nested
    class SyntaxErrors {

        @Test void propagateFromEveryApplication() {
            String bad = "(a&b";
            assertThrows(FormulaSyntaxException.class, () -> rules.modusPonens(bad, "a"));
            assertThrows(FormulaSyntaxException.class, () -> rules.modusTollens("a->b", bad));
            assertThrows(FormulaSyntaxException.class, () -> rules.chainImplication(bad, "a->b"));
            assertThrows(FormulaSyntaxException.class, () -> rules.dilemma("a|b", "a->p", bad));
            assertThrows(FormulaSyntaxException.class, () -> rules.disjunctionElim(bad, "~a"));
            assertThrows(FormulaSyntaxException.class, () -> rules.disjunctionIntro("a", bad));
            assertThrows(FormulaSyntaxException.class, () -> rules.conjunctionElim(bad, "left"));
            assertThrows(FormulaSyntaxException.class, () -> rules.conjunctionIntro("a", bad));
        }

        @Test void propagateFromEveryCheckInsteadOfFalse() {
            String bad = "a&&b";
            assertThrows(FormulaSyntaxException.class, () -> rules.isModusPonens("a->b", "a", bad));
            assertThrows(FormulaSyntaxException.class, () -> rules.isModusPonens(bad, "a", "b"));
            assertThrows(FormulaSyntaxException.class, () -> rules.isModusTollens("a->b", bad, "~a"));
            assertThrows(FormulaSyntaxException.class, () -> rules.isChainImplication("a->b", "b->c", bad));
            assertThrows(FormulaSyntaxException.class, () -> rules.isDilemma("a|b", "a->p", "b->q", bad));
            assertThrows(FormulaSyntaxException.class, () -> rules.isDisjunctionElim(bad, "~a", "b"));
            assertThrows(FormulaSyntaxException.class, () -> rules.isDisjunctionIntro("a", bad));
            assertThrows(FormulaSyntaxException.class, () -> rules.isConjunctionElim(bad, "a"));
            assertThrows(FormulaSyntaxException.class, () -> rules.isConjunctionIntro("a", "b", bad));
        }

        @Test void malformedConclusionIsReportedEvenWhenRuleDoesNotApply() {
            assertThrows(FormulaSyntaxException.class, () -> rules.isModusPonens("a&b", "c", "(b"));
        }
    }

    @Test void nullPremiseIsArgumentError() {
        assertThrows(IllegalArgumentException.class, () -> rules.modusPonens("a->b", (String) null));
        assertThrows(IllegalArgumentException.class, () -> new InferenceRules(null));
    }
}
