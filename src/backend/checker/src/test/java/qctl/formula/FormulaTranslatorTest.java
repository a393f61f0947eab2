package qctl.formula;

import org.junit.Test;
import qctl.exception.UnsupportedFormulaException;
import qctl.formula.parse.CtlParser;
import qctl.formula.parse.ParseNode;

import static org.junit.Assert.*;

public class FormulaTranslatorTest {
    private final CtlParser parser = new CtlParser();
    private final FormulaTranslator translator = new FormulaTranslator();

    @Test
    public void translatesEveryFragmentOperator() throws Exception {
        FormulaTree tree = translator.translate(parser.parse(
                "AG (A >= 1 | !(B == 0)) & E (A == 1) U (EX B == 1) & A (AX A <= 0) U (EG B < 1)"));
        assertEquals(FormulaKind.AND, tree.getRoot().getKind());
        boolean[] seen = new boolean[FormulaKind.values().length];
        for (FormulaNode n : tree.getNodes()) seen[n.getKind().ordinal()] = true;
        for (FormulaKind kind : FormulaKind.values()) {
            assertTrue("missing " + kind, seen[kind.ordinal()]);
        }
    }

    @Test
    public void repeatedSubformulaIsShared() throws Exception {
        FormulaTree tree = translator.translate(parser.parse("EX (A == 1) & AX (A == 1)"));
        assertEquals(4, tree.size());
    }

    @Test
    public void renderedFormulaTranslatesBack() throws Exception {
        FormulaTree tree = translator.translate(parser.parse("A (!(A == 1)) U (B >= 1 & EG A <= 0)"));
        FormulaTree again = translator.translate(parser.parse(tree.render()));
        assertEquals(tree.render(), again.render());
        assertEquals(tree.size(), again.size());
    }

    @Test
    public void rejectsOperatorsOutsideFragment() throws Exception {
        String[][] cases = {
                {"AF (A == 1)", "AF"},
                {"EF (A == 1)", "EF"},
                {"A (A == 1) W (B == 1)", "AW"},
                {"E (A == 1) W (B == 1)", "EW"},
                {"EX EF (A == 1)", "EF"}};
        for (String[] c : cases) {
            try {
                translator.translate(parser.parse(c[0]));
                fail("Expected UnsupportedFormulaException for " + c[0]);
            } catch (UnsupportedFormulaException e) {
                assertEquals(c[1], e.getSubject());
            }
        }
    }

    @Test
    public void acceptsParserLabelSynonyms() throws Exception {
        ParseNode a = ParseNode.atom("A", "==", "1");
        ParseNode b = ParseNode.atom("B", "<=", "0");
        FormulaTree tree = translator.translate(ParseNode.rule("parenthesis",
                ParseNode.rule("union", a, ParseNode.rule("intersection", a, b))));
        assertEquals(FormulaKind.OR, tree.getRoot().getKind());
        assertEquals("(A == 1 | (A == 1 & B <= 0))", tree.render());
    }

    @Test(expected = UnsupportedFormulaException.class)
    public void rejectsUnknownComparison() throws Exception {
        translator.translate(ParseNode.atom("A", "!=", "1"));
    }

    @Test(expected = UnsupportedFormulaException.class)
    public void rejectsNegativeThreshold() throws Exception {
        translator.translate(ParseNode.atom("A", ">=", "-1"));
    }

    @Test(expected = UnsupportedFormulaException.class)
    public void rejectsWrongOperandCount() throws Exception {
        translator.translate(ParseNode.rule("eu", ParseNode.atom("A", "==", "1")));
    }

    @Test(expected = UnsupportedFormulaException.class)
    public void rejectsMissingTree() throws Exception {
        translator.translate(null);
    }
}
