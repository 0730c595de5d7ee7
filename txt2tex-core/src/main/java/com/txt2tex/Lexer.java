package com.txt2tex;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns txt2tex source text into a token list terminated by {@link TokenType#EOF}.
 *
 * <p>Several characters are ambiguous on their own ({@code <}, {@code >}, {@code ^},
 * {@code \}, {@code (}) and are resolved by looking at the neighbouring characters
 * and at which brackets are currently open. The first character that cannot be
 * tokenized raises a {@link LexerException}.
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("land", TokenType.LAND),
            Map.entry("and", TokenType.LAND),
            Map.entry("lor", TokenType.LOR),
            Map.entry("or", TokenType.LOR),
            Map.entry("lnot", TokenType.LNOT),
            Map.entry("not", TokenType.LNOT),
            Map.entry("shows", TokenType.SHOWS),
            Map.entry("forall", TokenType.FORALL),
            Map.entry("exists", TokenType.EXISTS),
            Map.entry("exists1", TokenType.EXISTS1),
            Map.entry("mu", TokenType.MU),
            Map.entry("lambda", TokenType.LAMBDA),
            Map.entry("if", TokenType.IF),
            Map.entry("then", TokenType.THEN),
            Map.entry("else", TokenType.ELSE),
            Map.entry("elem", TokenType.ELEM),
            Map.entry("in", TokenType.ELEM),
            Map.entry("notin", TokenType.NOTIN),
            Map.entry("subset", TokenType.SUBSET),
            Map.entry("subseteq", TokenType.SUBSET),
            Map.entry("psubset", TokenType.PSUBSET),
            Map.entry("union", TokenType.UNION),
            Map.entry("intersect", TokenType.INTERSECT),
            Map.entry("cross", TokenType.CROSS),
            Map.entry("filter", TokenType.FILTER),
            Map.entry("bag_union", TokenType.BAG_UNION),
            Map.entry("div", TokenType.DIV),
            Map.entry("mod", TokenType.MOD),
            Map.entry("o9", TokenType.CIRC),
            Map.entry("comp", TokenType.COMP),
            Map.entry("dom", TokenType.DOM),
            Map.entry("ran", TokenType.RAN),
            Map.entry("inv", TokenType.INV),
            Map.entry("id", TokenType.ID),
            Map.entry("bigcup", TokenType.BIGCUP),
            Map.entry("bigcap", TokenType.BIGCAP),
            Map.entry("given", TokenType.GIVEN),
            Map.entry("axdef", TokenType.AXDEF),
            Map.entry("gendef", TokenType.GENDEF),
            Map.entry("schema", TokenType.SCHEMA),
            Map.entry("zed", TokenType.ZED),
            Map.entry("syntax", TokenType.SYNTAX),
            Map.entry("where", TokenType.WHERE),
            Map.entry("end", TokenType.END),
            Map.entry("also", TokenType.ALSO));

    // Keywords written as WORD: at the start of a block.
    private static final Map<String, TokenType> COLON_KEYWORDS = Map.ofEntries(
            Map.entry("ARGUE", TokenType.ARGUE),
            Map.entry("EQUIV", TokenType.ARGUE),
            Map.entry("INFRULE", TokenType.INFRULE),
            Map.entry("PROOF", TokenType.PROOF),
            Map.entry("PAGEBREAK", TokenType.PAGEBREAK),
            Map.entry("TEXT", TokenType.TEXT),
            Map.entry("PURETEXT", TokenType.PURETEXT),
            Map.entry("LATEX", TokenType.LATEX),
            Map.entry("TITLE", TokenType.TITLE),
            Map.entry("SUBTITLE", TokenType.SUBTITLE),
            Map.entry("AUTHOR", TokenType.AUTHOR),
            Map.entry("DATE", TokenType.DATE),
            Map.entry("INSTITUTION", TokenType.INSTITUTION),
            Map.entry("CONTENTS", TokenType.CONTENTS),
            Map.entry("PARTS", TokenType.PARTS),
            Map.entry("BIBLIOGRAPHY", TokenType.BIBLIOGRAPHY),
            Map.entry("BIBLIOGRAPHY_STYLE", TokenType.BIBLIOGRAPHY_STYLE));

    // Colon keywords whose remaining line becomes the token text.
    private static final Set<TokenType> RAW_CAPTURE = Set.of(
            TokenType.TEXT, TokenType.PURETEXT, TokenType.LATEX,
            TokenType.TITLE, TokenType.SUBTITLE, TokenType.AUTHOR, TokenType.DATE, TokenType.INSTITUTION,
            TokenType.CONTENTS, TokenType.PARTS, TokenType.BIBLIOGRAPHY, TokenType.BIBLIOGRAPHY_STYLE);

    // Longest spellings first.
    private static final Map<String, TokenType> OPERATORS = new LinkedHashMap<>();

    static {
        OPERATORS.put("77->", TokenType.FINFUN);
        OPERATORS.put(">->>", TokenType.BIJECTION);
        OPERATORS.put("+->>", TokenType.PSURJ);
        OPERATORS.put("-->>", TokenType.TSURJ);
        OPERATORS.put(">7->", TokenType.FINJ);
        OPERATORS.put("<=>", TokenType.IFF);
        OPERATORS.put("<->", TokenType.RELATION);
        OPERATORS.put("<<|", TokenType.NDRES);
        OPERATORS.put("|->", TokenType.MAPLET);
        OPERATORS.put("|>>", TokenType.NRRES);
        OPERATORS.put("+->", TokenType.PFUN);
        OPERATORS.put(">->", TokenType.TINJ);
        OPERATORS.put(">+>", TokenType.PINJ);
        OPERATORS.put("::=", TokenType.FREE_TYPE);
        OPERATORS.put("===", TokenType.SECTION_MARKER);
        OPERATORS.put("<=", TokenType.LESS_EQUAL);
        OPERATORS.put(">=", TokenType.GREATER_EQUAL);
        OPERATORS.put("<|", TokenType.DRES);
        OPERATORS.put("|>", TokenType.RRES);
        OPERATORS.put("->", TokenType.TFUN);
        OPERATORS.put("=>", TokenType.IMPLIES);
        OPERATORS.put("==", TokenType.ABBREV);
        OPERATORS.put("!=", TokenType.NOT_EQUAL);
        OPERATORS.put("/=", TokenType.NOT_EQUAL);
        OPERATORS.put("::", TokenType.DOUBLE_COLON);
        OPERATORS.put("..", TokenType.RANGE);
        OPERATORS.put("++", TokenType.OVERRIDE);
        OPERATORS.put("**", TokenType.SOLUTION_MARKER);
        OPERATORS.put("(|", TokenType.LIMG);
        OPERATORS.put("|)", TokenType.RIMG);
        OPERATORS.put("[[", TokenType.LBAG);
        OPERATORS.put("]]", TokenType.RBAG);
    }

    private static final Map<Character, TokenType> SINGLE_CHARS = Map.ofEntries(
            Map.entry('(', TokenType.LPAREN),
            Map.entry(')', TokenType.RPAREN),
            Map.entry('{', TokenType.LBRACE),
            Map.entry('}', TokenType.RBRACE),
            Map.entry('[', TokenType.LBRACKET),
            Map.entry(']', TokenType.RBRACKET),
            Map.entry(',', TokenType.COMMA),
            Map.entry(';', TokenType.SEMICOLON),
            Map.entry(':', TokenType.COLON),
            Map.entry('.', TokenType.PERIOD),
            Map.entry('|', TokenType.PIPE),
            Map.entry('=', TokenType.EQUALS),
            Map.entry('+', TokenType.PLUS),
            Map.entry('-', TokenType.MINUS),
            Map.entry('*', TokenType.STAR),
            Map.entry('~', TokenType.TILDE),
            Map.entry('#', TokenType.HASH),
            Map.entry('_', TokenType.UNDERSCORE));

    private static final Map<Character, TokenType> UNICODE_ALIASES = Map.ofEntries(
            Map.entry('⟨', TokenType.LANGLE),
            Map.entry('⟩', TokenType.RANGLE),
            Map.entry('⌢', TokenType.CAT),
            Map.entry('↾', TokenType.FILTER),
            Map.entry('⊎', TokenType.BAG_UNION),
            Map.entry('×', TokenType.CROSS),
            Map.entry('⊆', TokenType.SUBSET),
            Map.entry('⊊', TokenType.PSUBSET),
            Map.entry('⊂', TokenType.PSUBSET),
            Map.entry('∪', TokenType.UNION),
            Map.entry('∩', TokenType.INTERSECT),
            Map.entry('∈', TokenType.ELEM),
            Map.entry('∉', TokenType.NOTIN),
            Map.entry('∧', TokenType.LAND),
            Map.entry('∨', TokenType.LOR),
            Map.entry('¬', TokenType.LNOT),
            Map.entry('⇒', TokenType.IMPLIES),
            Map.entry('⇔', TokenType.IFF),
            Map.entry('∀', TokenType.FORALL),
            Map.entry('∃', TokenType.EXISTS),
            Map.entry('≠', TokenType.NOT_EQUAL),
            Map.entry('≤', TokenType.LESS_EQUAL),
            Map.entry('≥', TokenType.GREATER_EQUAL),
            Map.entry('↦', TokenType.MAPLET),
            Map.entry('→', TokenType.TFUN),
            Map.entry('⇸', TokenType.PFUN),
            Map.entry('↣', TokenType.TINJ),
            Map.entry('↠', TokenType.TSURJ),
            Map.entry('⤖', TokenType.BIJECTION),
            Map.entry('↔', TokenType.RELATION),
            Map.entry('⊕', TokenType.OVERRIDE),
            Map.entry('λ', TokenType.LAMBDA),
            Map.entry('μ', TokenType.MU));

    private static final Set<String> SENTENCE_STARTERS = Set.of(
            "The", "This", "That", "These", "Those", "We", "Let", "Since", "Therefore", "Thus",
            "Hence", "Note", "Suppose", "Consider", "Recall", "Assume", "Here", "There", "It",
            "In", "For", "By", "If", "When", "Because", "However", "Finally", "First", "Next",
            "Now", "So", "Each", "Every", "All", "Some", "A", "An", "Show", "Prove", "Using",
            "Observe", "Clearly", "Similarly", "Otherwise", "Define", "Notice", "Which", "What",
            "Why", "How", "Is", "Are", "Does", "Do", "One", "Both", "Either", "Neither");

    private static final Pattern PART_LABEL = Pattern.compile("\\(([a-j]|[a-z]{2,})\\)(?=[ \\t\\r\\n])");
    private static final Pattern SUBSCRIPT_SPLIT = Pattern.compile("[A-Za-z]_([A-Za-z0-9]|[0-9]+)");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos = 0;
    private int line = 1;
    private int column = 1;
    private int bracketDepth = 0;
    private int bagDepth = 0;
    private int angleDepth = 0;
    private boolean inSolutionMarker = false;
    private boolean atLineStart = true;

    public Lexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        if (!tokens.isEmpty()) {
            return List.copyOf(tokens);
        }
        while (!isAtEnd()) {
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", line, column));
        LOG.fine(() -> "Tokenized " + source.length() + " characters into " + tokens.size() + " tokens");
        return List.copyOf(tokens);
    }

    private void scanToken() {
        char c = peek();
        if (c == ' ' || c == '\t' || c == '\r') {
            advance();
            return;
        }
        if (c == '\n') {
            if (bracketDepth == 0) {
                tokens.add(new Token(TokenType.NEWLINE, "\n", line, column));
            }
            advance();
            atLineStart = true;
            return;
        }
        if (atLineStart) {
            atLineStart = false;
            if (scanProseLine()) {
                return;
            }
        }
        if (c == '\\') {
            scanBackslash();
        } else if (Character.isDigit(c) && !source.startsWith("77->", pos)) {
            scanNumber();
        } else if (Character.isLetter(c) && !UNICODE_ALIASES.containsKey(c)) {
            scanWord();
        } else {
            scanOperator();
        }
    }

    private boolean scanProseLine() {
        if (bracketDepth > 0 || inSolutionMarker || currentLine().contains("===")) {
            return false;
        }
        int end = pos;
        while (end < source.length() && Character.isLetter(source.charAt(end))) {
            end++;
        }
        String starter = source.substring(pos, end);
        if (!SENTENCE_STARTERS.contains(starter) || !looksLikeProse(end)) {
            return false;
        }
        int startColumn = column;
        int lineEnd = source.indexOf('\n', pos);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        String text = source.substring(pos, lineEnd).strip();
        while (pos < lineEnd) {
            advance();
        }
        tokens.add(new Token(TokenType.TEXT, text, line, startColumn));
        return true;
    }

    private boolean looksLikeProse(int afterStarter) {
        if (afterStarter < source.length()) {
            char next = source.charAt(afterStarter);
            if (next == ':' || next == ',') {
                return true;
            }
            if (next != ' ' && next != '\t') {
                return false;
            }
        }
        int start = afterStarter;
        while (start < source.length() && (source.charAt(start) == ' ' || source.charAt(start) == '\t')) {
            start++;
        }
        if (start >= source.length() || !Character.isLetter(source.charAt(start))) {
            return false;
        }
        int end = start;
        while (end < source.length() && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            end++;
        }
        String word = source.substring(start, end);
        return !KEYWORDS.containsKey(word.toLowerCase(Locale.ROOT));
    }

    private void scanBackslash() {
        int p = pos + 1;
        while (p < source.length() && (source.charAt(p) == ' ' || source.charAt(p) == '\t' || source.charAt(p) == '\r')) {
            p++;
        }
        if (p < source.length() && source.charAt(p) == '\n') {
            Token token = new Token(TokenType.CONTINUATION, "\\", line, column);
            while (pos <= p) {
                advance();
            }
            tokens.add(token);
            return;
        }
        addAndAdvance(TokenType.SETMINUS, "\\");
    }

    private void scanNumber() {
        int start = pos;
        int startColumn = column;
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        if (peek() == '_' && Character.isLetterOrDigit(peekNext())) {
            scanIdentifierTail();
            scanDecorations();
            tokens.add(new Token(TokenType.IDENTIFIER, source.substring(start, pos), line, startColumn));
            return;
        }
        tokens.add(new Token(TokenType.NUMBER, source.substring(start, pos), line, startColumn));
    }

    private void scanWord() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        scanIdentifierTail();
        String word = source.substring(start, pos);

        if (SUBSCRIPT_SPLIT.matcher(word).matches()) {
            pos = start + 1;
            column = startColumn + 1;
            tokens.add(new Token(TokenType.IDENTIFIER, word.substring(0, 1), startLine, startColumn));
            return;
        }

        if (word.equals("TRUTH")) {
            try (Checkpoint checkpoint = new Checkpoint()) {
                while (peek() == ' ' || peek() == '\t') {
                    advance();
                }
                if (source.startsWith("TABLE:", pos)) {
                    for (int i = 0; i < "TABLE:".length(); i++) {
                        advance();
                    }
                    checkpoint.commit();
                    tokens.add(new Token(TokenType.TRUTH_TABLE, "TRUTH TABLE:", startLine, startColumn));
                    return;
                }
            }
        }

        TokenType colonKeyword = COLON_KEYWORDS.get(word);
        if (colonKeyword != null && peek() == ':') {
            advance();
            if (RAW_CAPTURE.contains(colonKeyword)) {
                tokens.add(new Token(colonKeyword, captureRestOfLine(), startLine, startColumn));
            } else {
                tokens.add(new Token(colonKeyword, word + ":", startLine, startColumn));
            }
            return;
        }

        boolean decorated = scanDecorations();
        String lexeme = source.substring(start, pos);
        TokenType keyword = decorated ? null : KEYWORDS.get(word);
        tokens.add(new Token(keyword != null ? keyword : TokenType.IDENTIFIER, lexeme, startLine, startColumn));
    }

    private void scanIdentifierTail() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isLetterOrDigit(c) && !UNICODE_ALIASES.containsKey(c)) {
                advance();
            } else if (c == '_' && Character.isLetterOrDigit(peekNext())) {
                advance();
            } else {
                break;
            }
        }
    }

    private boolean scanDecorations() {
        boolean decorated = false;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\'' || c == '?' || (c == '!' && peekNext() != '=')) {
                advance();
                decorated = true;
            } else {
                break;
            }
        }
        return decorated;
    }

    private String captureRestOfLine() {
        int lineEnd = source.indexOf('\n', pos);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        String text = source.substring(pos, lineEnd).strip();
        while (pos < lineEnd) {
            advance();
        }
        return text;
    }

    private void scanOperator() {
        char c = peek();
        int startLine = line;
        int startColumn = column;

        if (c == '(' && column == 1) {
            Matcher matcher = PART_LABEL.matcher(source).region(pos, source.length());
            if (matcher.lookingAt()) {
                String label = matcher.group();
                for (int i = 0; i < label.length(); i++) {
                    advance();
                }
                tokens.add(new Token(TokenType.PART_LABEL, label, startLine, startColumn));
                return;
            }
        }

        if (source.startsWith("---", pos)) {
            int start = pos;
            while (peek() == '-') {
                advance();
            }
            tokens.add(new Token(TokenType.RULE_LINE, source.substring(start, pos), startLine, startColumn));
            return;
        }

        for (Map.Entry<String, TokenType> entry : OPERATORS.entrySet()) {
            String spelling = entry.getKey();
            if (!source.startsWith(spelling, pos)) {
                continue;
            }
            TokenType type = entry.getValue();
            if (type == TokenType.RBAG && bagDepth == 0) {
                continue;
            }
            addAndAdvance(type, spelling);
            return;
        }

        switch (c) {
            case '^' -> scanCaret();
            case '<' -> {
                char next = peekNext();
                if (next == '>' || next == '(' || next == '<' || Character.isLetterOrDigit(next)) {
                    addAndAdvance(TokenType.LANGLE, "<");
                } else {
                    addAndAdvance(TokenType.LESS_THAN, "<");
                }
            }
            case '>' -> {
                char previous = pos > 0 ? source.charAt(pos - 1) : ' ';
                boolean closesSequence = angleDepth > 0
                        && (Character.isLetterOrDigit(previous) || "<>),}]'?!⟩".indexOf(previous) >= 0);
                addAndAdvance(closesSequence ? TokenType.RANGLE : TokenType.GREATER_THAN, ">");
            }
            default -> {
                TokenType type = SINGLE_CHARS.get(c);
                if (type == null) {
                    type = UNICODE_ALIASES.get(c);
                }
                if (type == null) {
                    throw new LexerException("Unexpected character '" + c + "'", line, column);
                }
                addAndAdvance(type, String.valueOf(c));
            }
        }
    }

    private void scanCaret() {
        char previous = pos > 0 ? source.charAt(pos - 1) : '\n';
        if (previous == ' ' || previous == '\t' || previous == '\n') {
            addAndAdvance(TokenType.CAT, "^");
            return;
        }
        char next = peekNext();
        if ((previous == '>' && next == '<') || (previous == '⟩' && next == '⟨')) {
            throw new LexerException(
                    "Sequence concatenation needs spaces around '^' (write '" + previous + " ^ " + next + "')",
                    line, column);
        }
        addAndAdvance(TokenType.CARET, "^");
    }

    private void addAndAdvance(TokenType type, String lexeme) {
        tokens.add(new Token(type, lexeme, line, column));
        for (int i = 0; i < lexeme.length(); i++) {
            advance();
        }
        trackNesting(type);
    }

    private void trackNesting(TokenType type) {
        switch (type) {
            case LPAREN, LBRACE, LBRACKET, LIMG -> bracketDepth++;
            case RPAREN, RBRACE, RBRACKET, RIMG -> bracketDepth = Math.max(0, bracketDepth - 1);
            case LBAG -> {
                bracketDepth++;
                bagDepth++;
            }
            case RBAG -> {
                bracketDepth = Math.max(0, bracketDepth - 1);
                bagDepth--;
            }
            case LANGLE -> angleDepth++;
            case RANGLE -> angleDepth = Math.max(0, angleDepth - 1);
            case SOLUTION_MARKER -> inSolutionMarker = !inSolutionMarker;
            default -> {
            }
        }
    }

    private String currentLine() {
        int start = source.lastIndexOf('\n', pos - 1) + 1;
        int end = source.indexOf('\n', pos);
        return source.substring(start, end < 0 ? source.length() : end);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private void advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    /**
     * Saves the cursor and restores it on close unless committed.
     */
    private final class Checkpoint implements AutoCloseable {
        private final int savedPos = pos;
        private final int savedLine = line;
        private final int savedColumn = column;
        private boolean committed;

        void commit() {
            committed = true;
        }

        @Override
        public void close() {
            if (!committed) {
                pos = savedPos;
                line = savedLine;
                column = savedColumn;
            }
        }
    }
}
