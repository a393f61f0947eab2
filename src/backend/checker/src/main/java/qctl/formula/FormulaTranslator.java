package qctl.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qctl.exception.UnsupportedFormulaException;
import qctl.formula.parse.ParseNode;
import qctl.graph.ComparisonOperator;

import java.util.List;
import java.util.Locale;

/**
 * Turns a parser's untyped tree into a {@link FormulaTree}, rejecting every
 * construct outside the fragment: propositions, negation, conjunction,
 * disjunction, and Next, Globally and Until under either path quantifier.
 */
public class FormulaTranslator {
    private static final Logger logger = LoggerFactory.getLogger(FormulaTranslator.class);

    public FormulaTree translate(ParseNode parseTree) throws UnsupportedFormulaException {
        if (parseTree == null) {
            throw new UnsupportedFormulaException(null, "Empty formula");
        }
        FormulaTree.Builder builder = FormulaTree.builder();
        int root = visit(parseTree, builder);
        FormulaTree tree = builder.build(root);
        logger.debug("Translated {} into {} distinct nodes", tree.render(), tree.size());
        return tree;
    }

    private int visit(ParseNode node, FormulaTree.Builder b) throws UnsupportedFormulaException {
        String label = node.getLabel();
        switch (label) {
            case "ap":
                return atom(node, b);
            case "parenthesis":
                return visit(only(node), b);
            case "negation":
                return b.not(visit(only(node), b));
            case "conjunction":
            case "intersection":
                return b.and(visit(first(node), b), visit(second(node), b));
            case "disjunction":
            case "union":
                return b.or(visit(first(node), b), visit(second(node), b));
            case "ex":
                return b.existsNext(visit(only(node), b));
            case "ax":
                return b.forallNext(visit(only(node), b));
            case "eg":
                return b.existsGlobally(visit(only(node), b));
            case "ag":
                return b.forallGlobally(visit(only(node), b));
            case "eu":
                return b.existsUntil(visit(first(node), b), visit(second(node), b));
            case "au":
                return b.forallUntil(visit(first(node), b), visit(second(node), b));
            default:
                throw new UnsupportedFormulaException(label.toUpperCase(Locale.ROOT),
                        "Operator '" + label.toUpperCase(Locale.ROOT) + "' is outside the supported CTL fragment");
        }
    }

    private int atom(ParseNode node, FormulaTree.Builder b) throws UnsupportedFormulaException {
        List<String> tokens = node.getTokens();
        if (tokens.size() != 3) {
            throw new UnsupportedFormulaException("ap", "Atomic proposition needs gene, operator and value, got " + tokens);
        }
        String gene = tokens.get(0);
        ComparisonOperator op;
        try {
            op = ComparisonOperator.fromSymbol(tokens.get(1));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedFormulaException(tokens.get(1), "Comparison '" + tokens.get(1) + "' is not supported");
        }
        int value;
        try {
            value = Integer.parseInt(tokens.get(2));
        } catch (NumberFormatException e) {
            throw new UnsupportedFormulaException(tokens.get(2), "Threshold '" + tokens.get(2) + "' is not an integer level");
        }
        if (value < 0) {
            throw new UnsupportedFormulaException(tokens.get(2), "Threshold " + value + " is negative");
        }
        return b.atom(gene, op, value);
    }

    private static ParseNode only(ParseNode node) throws UnsupportedFormulaException {
        expectChildren(node, 1);
        return node.child(0);
    }

    private static ParseNode first(ParseNode node) throws UnsupportedFormulaException {
        expectChildren(node, 2);
        return node.child(0);
    }

    private static ParseNode second(ParseNode node) throws UnsupportedFormulaException {
        expectChildren(node, 2);
        return node.child(1);
    }

    private static void expectChildren(ParseNode node, int count) throws UnsupportedFormulaException {
        if (node.getChildren().size() != count) {
            throw new UnsupportedFormulaException(node.getLabel(), "'" + node.getLabel() + "' expects "
                    + count + " operand(s), got " + node.getChildren().size());
        }
    }
}
