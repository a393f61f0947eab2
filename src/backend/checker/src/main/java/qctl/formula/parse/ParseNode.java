package qctl.formula.parse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Untyped parse tree as produced by a grammar-based formula parser: a rule label,
 * child subtrees and, for leaf rules, the raw token texts.
 *
 * <p>Labels used by {@link CtlParser}: {@code ap} (tokens: gene, operator, value),
 * {@code negation}, {@code conjunction}, {@code disjunction}, {@code parenthesis},
 * {@code ex ax ef af eg ag} (one child) and {@code eu au ew aw} (two children).
 */
public final class ParseNode {
    private final String label;
    private final List<ParseNode> children;
    private final List<String> tokens;

    public ParseNode(String label, List<ParseNode> children, List<String> tokens) {
        this.label = label;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public static ParseNode rule(String label, ParseNode... children) {
        return new ParseNode(label, Arrays.asList(children), Collections.emptyList());
    }

    public static ParseNode atom(String gene, String operator, String value) {
        return new ParseNode("ap", Collections.emptyList(), Arrays.asList(gene, operator, value));
    }

    public String getLabel() { return label; }
    public List<ParseNode> getChildren() { return children; }
    public List<String> getTokens() { return tokens; }

    public ParseNode child(int i) {
        return children.get(i);
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return label + tokens;
        }
        StringBuilder sb = new StringBuilder(label).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
