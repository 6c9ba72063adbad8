package WFST.Regex;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import WFST.Regex.AST.Node;

/**
 * Recursive-descent parser for the pattern language.
 * <pre>
 * compose   := union ('@' union)*
 * union     := intersect ('|' intersect)*
 * intersect := concat (('&amp;' | '-') concat)*
 * concat    := postfix+
 * postfix   := cross ('*' | '+' | '?' | '{m}' | '{m,}' | '{,n}' | '{m,n}')*
 * cross     := atom (':' atom)?
 * atom      := symbol | '\' char | quoted | '[' class ']' | '(' compose? ')' | '&lt;' weight '&gt;'
 * </pre>
 * Reserved characters are escaped with a backslash or written inside quotes. Whitespace between
 * tokens is ignored. A parser instance is not reusable across threads.
 */
public class RegexParser {
    static final String RESERVED = "|&-@()[]*+?{}:<>'\\";
    private static final int EOX = -1; // end of expression

    private final Consumer<String> weightValidator;

    private String pattern;
    private int pos;

    public RegexParser() {
        this(text -> Double.parseDouble(text.trim()));
    }

    /**
     * @param weightValidator - throws NumberFormatException for weight text the target semiring cannot parse
     */
    public RegexParser(Consumer<String> weightValidator) {
        this.weightValidator = weightValidator;
    }

    public static boolean isReserved(int c) {
        return RESERVED.indexOf(c) >= 0 || Character.isWhitespace(c);
    }

    /**
     * Quote a symbol so that it parses back as itself.
     */
    public static String quote(String symbol) {
        if (symbol.isEmpty()) {
            return "''";
        }
        return "'" + symbol.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * @param pattern - pattern text
     * @return root of the syntax tree
     * @throws ParseException with the offset of the offending character
     */
    public Node parse(String pattern) {
        this.pattern = pattern;
        this.pos = 0;
        skipSpace();
        if (peek() == EOX) {
            return new AST.Empty();
        }
        Node root = parseCompose();
        skipSpace();
        if (peek() != EOX) {
            if (peek() == ')') {
                throw error("Unbalanced ')'");
            }
            throw error("Unexpected '" + (char) peek() + "'");
        }
        return root;
    }

    private Node parseCompose() {
        Node left = parseUnion();
        while (accept('@')) {
            left = new AST.Compose(left, parseUnion());
        }
        return left;
    }

    private Node parseUnion() {
        Node left = parseIntersect();
        while (accept('|')) {
            left = new AST.Union(left, parseIntersect());
        }
        return left;
    }

    private Node parseIntersect() {
        Node left = parseConcat();
        while (true) {
            if (accept('&')) {
                left = new AST.Intersect(left, parseConcat());
            } else if (accept('-')) {
                left = new AST.Difference(left, parseConcat());
            } else {
                return left;
            }
        }
    }

    private Node parseConcat() {
        skipSpace();
        if (!startsAtom(peek())) {
            throw emptyOperand();
        }
        Node left = parsePostfix();
        skipSpace();
        while (startsAtom(peek())) {
            left = new AST.Concat(left, parsePostfix());
            skipSpace();
        }
        return left;
    }

    private Node parsePostfix() {
        Node body = parseCross();
        while (true) {
            skipSpace();
            int c = peek();
            if (c == '*') {
                pos++;
                body = AST.star(body);
            } else if (c == '+') {
                pos++;
                body = AST.plus(body);
            } else if (c == '?') {
                pos++;
                body = AST.question(body);
            } else if (c == '{') {
                body = parseBounds(body);
            } else {
                return body;
            }
        }
    }

    private Node parseBounds(Node body) {
        int open = pos;
        pos++; // '{'
        skipSpace();
        int min = 0;
        int max;
        boolean hasMin = Character.isDigit(peek());
        if (hasMin) {
            min = parseInt();
        }
        skipSpace();
        if (accept(',')) {
            skipSpace();
            max = Character.isDigit(peek()) ? parseInt() : AST.UNBOUNDED;
            if (!hasMin && max == AST.UNBOUNDED) {
                throw new ParseException("Empty repetition bounds", open);
            }
        } else if (hasMin) {
            max = min;
        } else {
            throw error("Expected repetition count");
        }
        skipSpace();
        if (peek() != '}') {
            throw error(peek() == EOX ? "Unterminated repetition bounds" : "Expected '}'");
        }
        pos++;
        if (max != AST.UNBOUNDED && max < min) {
            throw new ParseException("Repetition bounds out of order {" + min + "," + max + "}", open);
        }
        return new AST.Repeat(body, min, max);
    }

    private int parseInt() {
        int begin = pos;
        while (Character.isDigit(peek())) {
            pos++;
        }
        try {
            return Integer.parseInt(pattern.substring(begin, pos));
        } catch (NumberFormatException e) {
            throw new ParseException("Repetition count too large", begin);
        }
    }

    private Node parseCross() {
        Node upper = parseAtom();
        skipSpace();
        if (accept(':')) {
            skipSpace();
            if (!startsAtom(peek())) {
                throw emptyOperand();
            }
            return new AST.Cross(upper, parseAtom());
        }
        return upper;
    }

    private Node parseAtom() {
        skipSpace();
        int c = peek();
        switch (c) {
            case '(' -> {
                int open = pos;
                pos++;
                skipSpace();
                if (accept(')')) {
                    return new AST.Empty();
                }
                Node inner = parseCompose();
                skipSpace();
                if (peek() != ')') {
                    throw peek() == EOX ? new ParseException("Unbalanced '('", open) : error("Expected ')'");
                }
                pos++;
                return inner;
            }
            case '[' -> {
                return parseClass();
            }
            case '\'' -> {
                return parseQuoted();
            }
            case '<' -> {
                return parseWeight();
            }
            case '\\' -> {
                pos++;
                if (peek() == EOX) {
                    throw error("Trailing backslash");
                }
                return new AST.Symbol(takeCodePoint());
            }
            case EOX -> throw error("Unexpected end of pattern");
            default -> {
                if (isReserved(c)) {
                    throw error("Unexpected '" + (char) c + "'");
                }
                return new AST.Symbol(takeCodePoint());
            }
        }
    }

    private Node parseClass() {
        int open = pos;
        pos++; // '['
        if (peek() == '^') {
            throw error("Negated symbol classes are not supported");
        }
        Set<String> members = new LinkedHashSet<>();
        while (peek() != ']') {
            if (peek() == EOX) {
                throw new ParseException("Unterminated symbol class", open);
            }
            int fromPos = pos;
            int from = classChar();
            if (peek() == '-' && pos + 1 < pattern.length() && pattern.charAt(pos + 1) != ']') {
                pos++; // '-'
                int to = classChar();
                if (to < from) {
                    throw new ParseException("Reversed range in symbol class", fromPos);
                }
                for (int cp = from; cp <= to; cp++) {
                    members.add(new String(Character.toChars(cp)));
                }
            } else {
                members.add(new String(Character.toChars(from)));
            }
        }
        if (members.isEmpty()) {
            throw error("Empty symbol class");
        }
        pos++; // ']'
        return new AST.SymbolClass(new ArrayList<>(members));
    }

    private int classChar() {
        if (peek() == '\\') {
            pos++;
            if (peek() == EOX) {
                throw error("Trailing backslash");
            }
        }
        int cp = pattern.codePointAt(pos);
        pos += Character.charCount(cp);
        return cp;
    }

    private Node parseQuoted() {
        int open = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (peek() != '\'') {
            if (peek() == EOX) {
                throw new ParseException("Unterminated quoted symbol", open);
            }
            if (peek() == '\\') {
                pos++;
                if (peek() == EOX) {
                    throw new ParseException("Unterminated quoted symbol", open);
                }
            }
            sb.append(pattern.charAt(pos++));
        }
        pos++; // closing quote
        return sb.length() == 0 ? new AST.Empty() : new AST.Symbol(sb.toString());
    }

    private Node parseWeight() {
        int open = pos;
        pos++; // '<'
        int end = pattern.indexOf('>', pos);
        if (end < 0) {
            throw new ParseException("Unterminated weight", open);
        }
        String text = pattern.substring(pos, end);
        try {
            weightValidator.accept(text);
        } catch (NumberFormatException e) {
            throw new ParseException("Malformed weight '" + text + "'", pos);
        }
        pos = end + 1;
        return new AST.Weight(text.trim());
    }

    private boolean startsAtom(int c) {
        if (c == EOX) {
            return false;
        }
        return c == '(' || c == '[' || c == '\'' || c == '<' || c == '\\' || !isReserved(c);
    }

    private ParseException emptyOperand() {
        int c = peek();
        if (c == EOX) {
            return error("Missing operand at end of pattern");
        }
        if (c == '*' || c == '+' || c == '?' || c == '{') {
            return error("Nothing to repeat before '" + (char) c + "'");
        }
        return error("Missing operand before '" + (char) c + "'");
    }

    private String takeCodePoint() {
        int cp = pattern.codePointAt(pos);
        pos += Character.charCount(cp);
        return new String(Character.toChars(cp));
    }

    private boolean accept(int c) {
        skipSpace();
        if (peek() == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipSpace() {
        while (pos < pattern.length() && Character.isWhitespace(pattern.charAt(pos))) {
            pos++;
        }
    }

    private int peek() {
        return pos < pattern.length() ? pattern.charAt(pos) : EOX;
    }

    private ParseException error(String message) {
        return new ParseException(message, pos);
    }
}
