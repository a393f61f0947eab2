package qctl.formula.parse;

import qctl.exception.FormulaSyntaxException;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for CTL formula text.
 *
 * <pre>
 * formula     := conjunction ("|" conjunction)*
 * conjunction := unary ("&amp;" unary)*
 * unary       := ("AG"|"AF"|"AX"|"EG"|"EF"|"EX") unary
 *              | ("A"|"E") unary ("U"|"W") unary
 *              | "!" unary
 *              | "(" formula ")"
 *              | IDENT ("&lt;="|"&gt;="|"&lt;"|"&gt;"|"==") INT
 * </pre>
 *
 * "&amp;&amp;" and "||" are accepted as synonyms. Operator keywords are only
 * keywords where a formula may start; an identifier followed by a comparison is
 * always a proposition, so genes may be called A or E.
 *
 * <p>The parser knows all CTL operators, including ones the evaluator does not
 * support. Rejecting those is left to {@link qctl.formula.FormulaTranslator}.
 */
public class CtlParser {
    private static final Pattern TOKEN = Pattern.compile(
            "\\s*(<=|>=|==|<|>|&&|\\|\\||[()!&|]|[A-Za-z_][A-Za-z0-9_]*|\\d+)");
    private static final Set<String> UNARY = new HashSet<>(Arrays.asList("AG", "AF", "AX", "EG", "EF", "EX"));
    private static final Set<String> COMPARISONS = new HashSet<>(Arrays.asList("<=", ">=", "<", ">", "=="));

    private String text;
    private List<String> tokens;
    private List<Integer> columns;
    private int pos;

    public synchronized ParseNode parse(String formula) throws FormulaSyntaxException {
        if (formula == null || formula.trim().isEmpty()) {
            throw new FormulaSyntaxException("Formula is empty", formula == null ? "" : formula, 0);
        }
        text = formula;
        tokenize();
        pos = 0;
        ParseNode result = parseDisjunction();
        if (pos < tokens.size()) {
            throw error("Unexpected '" + current() + "'");
        }
        return result;
    }

    private void tokenize() throws FormulaSyntaxException {
        tokens = new ArrayList<>();
        columns = new ArrayList<>();
        Matcher m = TOKEN.matcher(text);
        int at = 0;
        while (at < text.length()) {
            if (text.substring(at).trim().isEmpty()) break;
            m.region(at, text.length());
            if (!m.lookingAt()) {
                int col = at;
                while (col < text.length() && Character.isWhitespace(text.charAt(col))) col++;
                throw new FormulaSyntaxException("Unexpected character '" + text.charAt(col) + "'", text, col);
            }
            String token = m.group(1);
            tokens.add(token.equals("&&") ? "&" : token.equals("||") ? "|" : token);
            columns.add(m.start(1));
            at = m.end();
        }
    }

    private ParseNode parseDisjunction() throws FormulaSyntaxException {
        ParseNode left = parseConjunction();
        while (consume("|")) {
            left = ParseNode.rule("disjunction", left, parseConjunction());
        }
        return left;
    }

    private ParseNode parseConjunction() throws FormulaSyntaxException {
        ParseNode left = parseUnary();
        while (consume("&")) {
            left = ParseNode.rule("conjunction", left, parseUnary());
        }
        return left;
    }

    private ParseNode parseUnary() throws FormulaSyntaxException {
        String token = current();
        if (token == null) {
            throw error("Formula ends unexpectedly");
        }
        if (isIdentifier(token) && COMPARISONS.contains(next())) {
            return parseProposition();
        }
        if (UNARY.contains(token)) {
            pos++;
            return ParseNode.rule(token.toLowerCase(Locale.ROOT), parseUnary());
        }
        if (token.equals("A") || token.equals("E")) {
            pos++;
            ParseNode left = parseUnary();
            String op = expect("U", "W");
            ParseNode right = parseUnary();
            return ParseNode.rule((token + op).toLowerCase(Locale.ROOT), left, right);
        }
        if (consume("!")) {
            return ParseNode.rule("negation", parseUnary());
        }
        if (consume("(")) {
            ParseNode inner = parseDisjunction();
            expect(")");
            return inner;
        }
        throw error("Expected a formula, found '" + token + "'");
    }

    private ParseNode parseProposition() throws FormulaSyntaxException {
        String gene = tokens.get(pos);
        String op = tokens.get(pos + 1);
        pos += 2;
        String value = current();
        if (value == null || !value.chars().allMatch(Character::isDigit)) {
            throw error("Expected an integer level after '" + gene + " " + op + "'");
        }
        pos++;
        return ParseNode.atom(gene, op, value);
    }

    private String expect(String... expected) throws FormulaSyntaxException {
        String token = current();
        for (String e : expected) {
            if (e.equals(token)) {
                pos++;
                return token;
            }
        }
        throw error("Expected " + String.join(" or ", expected) + ", found " + (token == null ? "end of formula" : "'" + token + "'"));
    }

    private boolean consume(String token) {
        if (token.equals(current())) {
            pos++;
            return true;
        }
        return false;
    }

    private String current() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private String next() {
        return pos + 1 < tokens.size() ? tokens.get(pos + 1) : null;
    }

    private static boolean isIdentifier(String token) {
        return Character.isLetter(token.charAt(0)) || token.charAt(0) == '_';
    }

    private FormulaSyntaxException error(String message) {
        int column = pos < columns.size() ? columns.get(pos) : text.length();
        return new FormulaSyntaxException(message + " at column " + column, text, column);
    }
}
