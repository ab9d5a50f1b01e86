package dumb.clarity;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses symbolic propositional logic: {@code ¬ ∧ ∨ → ↔}, their ASCII spellings
 * ({@code ~ ! & | -> => <-> <=>} and {@code NOT AND OR}), parentheses, {@code ⊤ ⊥ true false},
 * predicates such as {@code loves(user, cow_milk)} and comparisons such as {@code runway < 6}.
 * <p>
 * Atoms are identified by their text after whitespace normalization; nothing else is unified.
 */
public class ExprParser {
    private static final int CONTEXT_RADIUS = 12;
    static final int MAX_DEPTH = 256;
    private static final String[] IFF_OPS = {"↔", "<->", "<=>"};
    private static final String[] IMPLIES_OPS = {"→", "->", "=>"};
    private static final String[] OR_OPS = {"∨", "||", "|", "OR"};
    private static final String[] AND_OPS = {"∧", "&&", "&", "AND"};
    private static final String[] NOT_OPS = {"¬", "~", "!", "NOT"};
    private static final String[] COMPARISONS = {">=", "<=", "!=", "≥", "≤", "≠", "∈", "=", ">", "<"};

    private final String src;
    private int pos;
    private int depth;

    private ExprParser(String src) {
        this.src = src;
    }

    public static Expr parse(String formula) throws ParseException {
        if (formula == null || formula.isBlank()) throw new ParseException("Empty formula", "", 0);
        var parser = new ExprParser(formula);
        var e = parser.parseIff();
        parser.skipWhitespace();
        if (parser.pos < formula.length()) throw parser.createParseException("Unexpected trailing input");
        return e;
    }

    private Expr parseIff() throws ParseException {
        var left = parseImplies();
        var chained = 0;
        // each link of a chain nests the tree one level deeper
        while (accept(IFF_OPS)) {
            descend();
            chained++;
            left = new Expr.Iff(left, parseImplies());
        }
        depth -= chained;
        return left;
    }

    private Expr parseImplies() throws ParseException {
        var left = parseOr();
        if (!accept(IMPLIES_OPS)) return left;
        descend();
        var right = parseImplies();
        depth--;
        return new Expr.Implies(left, right);
    }

    private Expr parseOr() throws ParseException {
        var args = new ArrayList<Expr>();
        args.add(parseAnd());
        while (accept(OR_OPS)) args.add(parseAnd());
        return Expr.or(args);
    }

    private Expr parseAnd() throws ParseException {
        var args = new ArrayList<Expr>();
        args.add(parseUnary());
        while (accept(AND_OPS)) args.add(parseUnary());
        return Expr.and(args);
    }

    private Expr parseUnary() throws ParseException {
        if (!accept(NOT_OPS)) return parsePrimary();
        descend();
        var inner = parseUnary();
        depth--;
        return new Expr.Not(inner);
    }

    private Expr parsePrimary() throws ParseException {
        skipWhitespace();
        if (pos >= src.length()) throw createParseException("Unexpected end of formula");
        var c = src.charAt(pos);
        if (c == '(') {
            pos++;
            descend();
            var inner = parseIff();
            expect(')');
            depth--;
            return inner;
        }
        if (c == '∀' || c == '∃')
            throw createParseException("Quantifiers are not supported in propositional formulas");
        if (c == '⊤') {
            pos++;
            return Expr.Const.TRUE;
        }
        if (c == '⊥') {
            pos++;
            return Expr.Const.FALSE;
        }
        var left = parseTerm();
        if (left.equals("true")) return Expr.Const.TRUE;
        if (left.equals("false")) return Expr.Const.FALSE;
        var cmp = comparison();
        if (cmp == null) return new Expr.Atom(left);
        return new Expr.Atom(left + " " + cmp + " " + parseTerm());
    }

    private String parseTerm() throws ParseException {
        skipWhitespace();
        var start = pos;
        while (pos < src.length() && isIdentChar(pos)) pos++;
        if (pos == start) throw createParseException("Expected a predicate or variable name");
        var name = src.substring(start, pos);
        if (isKeyword(name)) {
            pos = start;
            throw createParseException("Unexpected operator '" + name + "'");
        }
        if (pos < src.length() && src.charAt(pos) == '(') {
            pos++;
            var args = new ArrayList<String>();
            var depth = 0;
            var arg = new StringBuilder();
            while (true) {
                if (pos >= src.length()) throw createParseException("Unclosed argument list of '" + name + "'");
                var c = src.charAt(pos++);
                if (c == '(') depth++;
                else if (c == ')') {
                    if (depth == 0) break;
                    depth--;
                } else if (c == ',' && depth == 0) {
                    args.add(normalize(arg));
                    arg.setLength(0);
                    continue;
                }
                arg.append(c);
            }
            args.add(normalize(arg));
            if (args.stream().anyMatch(String::isEmpty))
                throw createParseException("Empty argument in '" + name + "'");
            return name + "(" + String.join(", ", args) + ")";
        }
        return name;
    }

    private static String normalize(CharSequence s) {
        return s.toString().trim().replaceAll("\\s+", " ").replaceAll("\\s*,\\s*", ", ");
    }

    private String comparison() {
        skipWhitespace();
        if (startsWithAny(IFF_OPS) != null || startsWithAny(IMPLIES_OPS) != null) return null;
        var op = startsWithAny(COMPARISONS);
        if (op == null) return null;
        pos += op.length();
        return switch (op) {
            case "≥" -> ">=";
            case "≤" -> "<=";
            case "≠" -> "!=";
            default -> op;
        };
    }

    private boolean isIdentChar(int i) {
        var c = src.charAt(i);
        if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '\'' || c == '$') return true;
        return c == '-' && (i + 1 >= src.length() || src.charAt(i + 1) != '>');
    }

    private static boolean isKeyword(String word) {
        return word.equals("AND") || word.equals("OR") || word.equals("NOT");
    }

    private boolean accept(String[] ops) {
        skipWhitespace();
        var op = startsWithAny(ops);
        if (op == null) return false;
        if (Character.isLetter(op.charAt(0))) {
            var end = pos + op.length();
            if (end < src.length() && isIdentChar(end)) return false;
        }
        pos += op.length();
        return true;
    }

    private String startsWithAny(String[] ops) {
        for (var op : ops)
            if (src.startsWith(op, pos)) return op;
        return null;
    }

    private void descend() throws ParseException {
        if (++depth > MAX_DEPTH) throw createParseException("Formula nested deeper than " + MAX_DEPTH + " levels");
    }

    private void expect(char expected) throws ParseException {
        skipWhitespace();
        if (pos >= src.length() || src.charAt(pos) != expected)
            throw createParseException("Expected '" + expected + "'");
        pos++;
    }

    private void skipWhitespace() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;
    }

    private ParseException createParseException(String message) {
        var from = Math.max(0, pos - CONTEXT_RADIUS);
        var to = Math.min(src.length(), pos + CONTEXT_RADIUS);
        return new ParseException(message, src.substring(from, to), pos);
    }

    public static class ParseException extends Exception {
        private final String context;
        private final int position;

        public ParseException(String message, String context, int position) {
            super(message);
            this.context = context;
            this.position = position;
        }

        public String offending() {
            return context;
        }

        public int position() {
            return position;
        }

        @Override
        public String getMessage() {
            var snippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + " at " + position + snippet;
        }
    }
}
