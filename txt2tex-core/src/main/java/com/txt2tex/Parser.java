package com.txt2tex;

import com.txt2tex.ast.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

public class Parser {
    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    public static final int DEFAULT_MAX_DEPTH = 500;

    // ========================================================================
    // Binding Power Constants for Pratt Parser
    // ========================================================================
    // Higher binding power = tighter binding. The full table lives in Precedence
    // so that renderers can share it.
    private static final int BP_NONE = Precedence.NONE;
    private static final int BP_RELATION = Precedence.RELATION;     // binder domains stop below membership
    private static final int BP_COMPARISON = Precedence.COMPARISON;
    private static final int BP_UNARY = Precedence.UNARY;

    private static final Set<TokenType> STRUCTURAL = EnumSet.of(
            TokenType.SECTION_MARKER, TokenType.SOLUTION_MARKER, TokenType.PART_LABEL,
            TokenType.TRUTH_TABLE, TokenType.ARGUE, TokenType.INFRULE, TokenType.PROOF,
            TokenType.TEXT, TokenType.PURETEXT, TokenType.LATEX, TokenType.PAGEBREAK,
            TokenType.CONTENTS, TokenType.PARTS,
            TokenType.TITLE, TokenType.SUBTITLE, TokenType.AUTHOR, TokenType.DATE, TokenType.INSTITUTION,
            TokenType.BIBLIOGRAPHY, TokenType.BIBLIOGRAPHY_STYLE,
            TokenType.AXDEF, TokenType.GENDEF, TokenType.SCHEMA, TokenType.ZED, TokenType.SYNTAX);

    private static final Set<TokenType> OPERAND_START = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.LPAREN, TokenType.LBRACE,
            TokenType.LANGLE, TokenType.LBAG,
            TokenType.FORALL, TokenType.EXISTS, TokenType.EXISTS1, TokenType.MU, TokenType.LAMBDA,
            TokenType.IF, TokenType.LNOT, TokenType.MINUS, TokenType.HASH,
            TokenType.DOM, TokenType.RAN, TokenType.INV, TokenType.ID, TokenType.BIGCUP, TokenType.BIGCAP);

    private static final Set<TokenType> FUNCTION_ARROWS = EnumSet.of(
            TokenType.TFUN, TokenType.PFUN, TokenType.TINJ, TokenType.PINJ, TokenType.TSURJ,
            TokenType.PSURJ, TokenType.BIJECTION, TokenType.FINFUN, TokenType.FINJ);

    private static final Set<TokenType> CLOSERS = EnumSet.of(
            TokenType.COMMA, TokenType.RPAREN, TokenType.RBRACE, TokenType.RBRACKET, TokenType.RANGLE,
            TokenType.RBAG, TokenType.RIMG, TokenType.EOF, TokenType.NEWLINE, TokenType.PERIOD,
            TokenType.THEN, TokenType.ELSE);

    // Words that stop juxtaposed application so that prose is not read as nested calls.
    private static final Set<String> PROSE_WORDS = Set.of(
            "a", "an", "the", "be", "been", "is", "are", "was", "were", "can", "could", "do", "does",
            "did", "had", "has", "have", "may", "might", "must", "should", "will", "would", "that",
            "these", "this", "those", "it", "its", "them", "they", "whatever", "whoever", "as", "at",
            "by", "for", "from", "of", "on", "to", "with", "here", "syntax", "there", "valid",
            "true", "false");

    /**
     * Flags that change how {@code .} and {@code ;} are read, and whether
     * juxtaposed arguments may follow a primary.
     */
    private record Context(boolean schemaText, boolean comprehensionBody, boolean juxtaposition) {
        static final Context DEFAULT = new Context(false, false, true);
        static final Context SCHEMA_TEXT = new Context(true, false, true);

        Context withComprehensionBody() {
            return new Context(schemaText, true, juxtaposition);
        }

        Context withoutJuxtaposition() {
            return new Context(schemaText, comprehensionBody, false);
        }

        boolean contextual() {
            return schemaText || comprehensionBody;
        }
    }

    private record Binding(Token start, List<String> variables, Tuple tuplePattern, Expr domain) {
    }

    private record BlockBody(List<Declaration> declarations, List<List<Expr>> predicates) {
    }

    private final List<Token> tokens;
    private final int maxDepth;
    private final MetadataBuilder metadata = new MetadataBuilder();
    private int current = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens, int maxDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    public static ParseResult parse(String source) {
        return new Parser(Lexer.tokenize(source)).parse();
    }

    public static ParseResult parse(String source, int maxDepth) {
        return new Parser(Lexer.tokenize(source), maxDepth).parse();
    }

    public static Document parseDocument(String source) {
        return new Parser(Lexer.tokenize(source)).parseDocument();
    }

    public static Expr parseExpression(String source) {
        return new Parser(Lexer.tokenize(source)).parseExpression();
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    /**
     * Parses the whole token list. Input that starts with a block keyword or a
     * definition, or that holds several lines, becomes a {@link Document}; a
     * single bare expression is returned on its own.
     */
    public ParseResult parse() {
        skipNewlines();
        if (isAtEnd()) {
            return emptyDocument();
        }
        if (startsDocument()) {
            LOG.fine(() -> "Parsing document starting with " + peek());
            return documentOf(parseItemsUntil(EnumSet.noneOf(TokenType.class)));
        }
        Expr first = parseExpr(BP_NONE, Context.DEFAULT);
        if (check(TokenType.NEWLINE)) {
            skipNewlines();
        }
        if (isAtEnd()) {
            return first;
        }
        if (previous().type() != TokenType.NEWLINE) {
            throw afterExpression(peek());
        }
        List<DocumentItem> items = new ArrayList<>();
        items.add(first);
        items.addAll(parseItemsUntil(EnumSet.noneOf(TokenType.class)));
        return documentOf(items);
    }

    /**
     * Parses the token list as a document, wrapping a lone expression if needed.
     */
    public Document parseDocument() {
        ParseResult result = parse();
        if (result instanceof Document document) {
            return document;
        }
        Expr expr = (Expr) result;
        return new Document(1, 1, new ArrayList<>(List.of(expr)), null, null);
    }

    public Expr parseExpression() {
        skipNewlines();
        Expr expr = parseExpr(BP_NONE, Context.DEFAULT);
        skipNewlines();
        if (!isAtEnd()) {
            throw afterExpression(peek());
        }
        return expr;
    }

    private Document emptyDocument() {
        return new Document(1, 1, new ArrayList<>(), metadata.title(), metadata.bibliography());
    }

    private Document documentOf(List<DocumentItem> items) {
        return new Document(1, 1, items, metadata.title(), metadata.bibliography());
    }

    private boolean startsDocument() {
        TokenType type = peek().type();
        return STRUCTURAL.contains(type) || type == TokenType.GIVEN || startsAbbreviation() || startsFreeType();
    }

    // ========================================================================
    // Document structure
    // ========================================================================

    private List<DocumentItem> parseItemsUntil(Set<TokenType> stops) {
        List<DocumentItem> items = new ArrayList<>();
        skipNewlines();
        while (!isAtEnd() && !stops.contains(peek().type())) {
            if (metadata.take(peek())) {
                advance();
            } else {
                items.add(parseDocumentItem());
            }
            skipNewlines();
        }
        return items;
    }

    private DocumentItem parseDocumentItem() {
        enter();
        try {
            Token token = peek();
            return switch (token.type()) {
                case SECTION_MARKER -> parseSection();
                case SOLUTION_MARKER -> parseSolution();
                case PART_LABEL -> parsePart();
                case TRUTH_TABLE -> parseTruthTable();
                case ARGUE -> parseArgueChain();
                case INFRULE -> parseInfruleBlock();
                case PROOF -> parseProofTree();
                case GIVEN -> requireLineEnd(parseGivenType());
                case AXDEF -> requireLineEnd(parseAxDef());
                case GENDEF -> requireLineEnd(parseGenDef());
                case SCHEMA -> requireLineEnd(parseSchema());
                case ZED -> requireLineEnd(parseZed());
                case SYNTAX -> requireLineEnd(parseSyntaxBlock());
                case TEXT -> new Paragraph(token.line(), token.column(), advance().lexeme());
                case PURETEXT -> new PureParagraph(token.line(), token.column(), advance().lexeme());
                case LATEX -> new LatexBlock(token.line(), token.column(), advance().lexeme());
                case PAGEBREAK -> requireLineEnd(new PageBreak(advance().line(), token.column()));
                case CONTENTS -> parseContents();
                case PARTS -> parsePartsFormat();
                default -> parseDefinitionOrExpression();
            };
        } finally {
            exit();
        }
    }

    private DocumentItem parseDefinitionOrExpression() {
        if (startsAbbreviation()) {
            return requireLineEnd(parseAbbreviation());
        }
        if (startsFreeType()) {
            return requireLineEnd(parseFreeType());
        }
        return requireLineEnd(parseExpr(BP_NONE, Context.DEFAULT));
    }

    private Section parseSection() {
        Token marker = advance();
        List<Token> titleTokens = new ArrayList<>();
        while (!check(TokenType.SECTION_MARKER) && !check(TokenType.NEWLINE) && !isAtEnd()) {
            titleTokens.add(advance());
        }
        consume(TokenType.SECTION_MARKER, "Expected closing '===' after section title");
        List<DocumentItem> items = parseItemsUntil(EnumSet.of(TokenType.SECTION_MARKER));
        return new Section(marker.line(), marker.column(), joinTokens(titleTokens), items);
    }

    private Solution parseSolution() {
        Token marker = advance();
        List<Token> numberTokens = new ArrayList<>();
        while (!check(TokenType.SOLUTION_MARKER) && !check(TokenType.NEWLINE) && !isAtEnd()) {
            numberTokens.add(advance());
        }
        consume(TokenType.SOLUTION_MARKER, "Expected closing '**' after solution title");
        List<DocumentItem> items = parseItemsUntil(
                EnumSet.of(TokenType.SOLUTION_MARKER, TokenType.SECTION_MARKER));
        return new Solution(marker.line(), marker.column(), joinTokens(numberTokens), items);
    }

    private Part parsePart() {
        Token label = advance();
        String name = label.lexeme().substring(1, label.lexeme().length() - 1);
        List<DocumentItem> items = parseItemsUntil(
                EnumSet.of(TokenType.PART_LABEL, TokenType.SOLUTION_MARKER, TokenType.SECTION_MARKER));
        return new Part(label.line(), label.column(), name, items);
    }

    private Contents parseContents() {
        Token token = advance();
        String depth = token.lexeme();
        if (!depth.isEmpty() && !depth.equals("full") && !depth.chars().allMatch(Character::isDigit)) {
            throw new ParseException("Invalid CONTENTS depth '" + depth + "': expected nothing, 'full' or a number", token);
        }
        return new Contents(token.line(), token.column(), depth);
    }

    private PartsFormat parsePartsFormat() {
        Token token = advance();
        String style = token.lexeme();
        if (!style.equals("inline") && !style.equals("subsection")) {
            throw new ParseException("Invalid PARTS style '" + style + "': expected 'inline' or 'subsection'", token);
        }
        return new PartsFormat(token.line(), token.column(), style);
    }

    // ========================================================================
    // Presentation blocks
    // ========================================================================

    private TruthTable parseTruthTable() {
        Token keyword = advance();
        skipNewlines();
        List<String> headers = new ArrayList<>();
        List<Token> cell = new ArrayList<>();
        while (!check(TokenType.NEWLINE) && !isAtEnd()) {
            if (match(TokenType.PIPE)) {
                if (!cell.isEmpty()) {
                    headers.add(joinTokens(cell));
                    cell = new ArrayList<>();
                }
            } else {
                cell.add(advance());
            }
        }
        if (!cell.isEmpty()) {
            headers.add(joinTokens(cell));
        }
        if (headers.isEmpty()) {
            throw new ExpectedTokenException("Expected a header row after 'TRUTH TABLE:'", peek());
        }

        List<List<String>> rows = new ArrayList<>();
        while (check(TokenType.NEWLINE) && isTruthRow(current + 1)) {
            advance();
            List<String> row = new ArrayList<>();
            while (!check(TokenType.NEWLINE) && !isAtEnd()) {
                Token value = advance();
                if (value.type() == TokenType.IDENTIFIER) {
                    row.add(value.lexeme().toUpperCase(Locale.ROOT));
                }
            }
            rows.add(row);
        }
        return new TruthTable(keyword.line(), keyword.column(), headers, rows);
    }

    private boolean isTruthRow(int index) {
        boolean sawValue = false;
        for (int i = index; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.NEWLINE || token.type() == TokenType.EOF) {
                return sawValue;
            }
            if (token.type() == TokenType.PIPE) {
                continue;
            }
            if (token.type() != TokenType.IDENTIFIER
                    || !(token.lexeme().equalsIgnoreCase("T") || token.lexeme().equalsIgnoreCase("F"))) {
                return false;
            }
            sawValue = true;
        }
        return sawValue;
    }

    private ArgueChain parseArgueChain() {
        Token keyword = advance();
        String name = keyword.lexeme().substring(0, keyword.lexeme().length() - 1);
        List<ArgueStep> steps = new ArrayList<>();
        skipNewlines();
        while (!isAtEnd() && !STRUCTURAL.contains(peek().type())) {
            Token start = peek();
            String connective = null;
            if (startsArgueConnective()) {
                connective = advance().type().symbol();
                skipNewlines();
            }
            Expr expression = parseExpr(BP_NONE, Context.DEFAULT);
            String justification = parseJustification(true);
            requireLineEnd(expression);
            steps.add(new ArgueStep(start.line(), start.column(), connective, expression, justification));
            int newlines = skipNewlines();
            if (newlines >= 2 && !startsArgueConnective()) {
                break;
            }
        }
        if (steps.isEmpty()) {
            throw new ExpectedTokenException("Expected at least one step after '" + keyword.lexeme() + "'", peek());
        }
        return new ArgueChain(keyword.line(), keyword.column(), name, steps);
    }

    private boolean startsArgueConnective() {
        return check(TokenType.IFF) || check(TokenType.IMPLIES) || check(TokenType.EQUALS);
    }

    private InfruleBlock parseInfruleBlock() {
        Token keyword = advance();
        skipNewlines();
        List<InfruleLine> premises = new ArrayList<>();
        while (!check(TokenType.RULE_LINE)) {
            if (isAtEnd() || STRUCTURAL.contains(peek().type())) {
                throw new ExpectedTokenException("Expected '---' between premises and conclusion", peek());
            }
            premises.add(parseInfruleLine());
            skipNewlines();
        }
        advance();
        skipNewlines();
        InfruleLine conclusion = parseInfruleLine();
        return new InfruleBlock(keyword.line(), keyword.column(), premises, conclusion);
    }

    private InfruleLine parseInfruleLine() {
        Token start = peek();
        Expr expression = parseExpr(BP_NONE, Context.DEFAULT);
        String label = parseJustification(false);
        requireLineEnd(expression);
        return new InfruleLine(start.line(), start.column(), expression, label);
    }

    /**
     * Reads an optional {@code [text]}. When {@code nextLine} is set the bracket
     * may also open the following line.
     */
    private String parseJustification(boolean nextLine) {
        if (nextLine && check(TokenType.NEWLINE) && checkAhead(1, TokenType.LBRACKET)) {
            advance();
        }
        if (!check(TokenType.LBRACKET)) {
            return null;
        }
        advance();
        List<Token> text = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            if (isAtEnd()) {
                throw new ExpectedTokenException("Expected ']' to close justification", peek());
            }
            text.add(advance());
        }
        advance();
        return joinTokens(text);
    }

    // ========================================================================
    // Proof trees
    // ========================================================================

    private ProofTree parseProofTree() {
        Token keyword = advance();
        skipNewlines();
        if (isAtEnd() || STRUCTURAL.contains(peek().type())) {
            throw new ExpectedTokenException("Expected a conclusion after 'PROOF:'", peek());
        }
        int baseIndent = peek().column();
        ProofNode conclusion = parseProofNode(baseIndent, 0);
        if (!isAtEnd() && !STRUCTURAL.contains(peek().type()) && newlinesBefore() < 2) {
            throw new ParseException("Unexpected dedent in proof tree: a proof has a single conclusion at column "
                    + conclusion.column(), peek());
        }
        return new ProofTree(keyword.line(), keyword.column(), conclusion);
    }

    /**
     * Parses one proof line and every following line indented past it.
     *
     * @param baseIndent column of the first proof line, for {@code indentLevel}
     * @param parentIndent column of the enclosing line; this line must be right of it
     */
    private ProofNode parseProofNode(int baseIndent, int parentIndent) {
        enter();
        try {
            Token start = peek();
            if (start.column() <= parentIndent) {
                throw new ParseException("Unexpected dedent in proof tree", start);
            }
            Integer label = null;
            if (check(TokenType.LBRACKET) && checkAhead(1, TokenType.NUMBER) && checkAhead(2, TokenType.RBRACKET)) {
                advance();
                label = parseIndex(advance());
                advance();
            }
            boolean sibling = match(TokenType.DOUBLE_COLON);
            Expr expression = parseExpr(BP_NONE, Context.DEFAULT);
            String justification = parseJustification(false);
            requireLineEnd(expression);
            List<ProofStep> children = parseProofChildren(baseIndent, start.column());
            return new ProofNode(start.line(), start.column(), expression, justification, label,
                    "assumption".equals(justification), sibling, children, start.column() - baseIndent);
        } finally {
            exit();
        }
    }

    private List<ProofStep> parseProofChildren(int baseIndent, int parentIndent) {
        List<ProofStep> children = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (isAtEnd() || STRUCTURAL.contains(peek().type()) || peek().column() <= parentIndent) {
                return children;
            }
            if (startsCaseAnalysis()) {
                children.add(parseCaseAnalysis(baseIndent));
            } else {
                children.add(parseProofNode(baseIndent, parentIndent));
            }
        }
    }

    private boolean startsCaseAnalysis() {
        if (!check(TokenType.IDENTIFIER) || !peek().lexeme().equals("case")) {
            return false;
        }
        for (int i = current + 1; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.COLON) {
                return i > current + 1;
            }
            if (type == TokenType.NEWLINE || type == TokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    private CaseAnalysis parseCaseAnalysis(int baseIndent) {
        Token caseToken = advance();
        List<Token> name = new ArrayList<>();
        while (!check(TokenType.COLON)) {
            name.add(advance());
        }
        advance();
        List<ProofNode> steps = new ArrayList<>();
        if (!check(TokenType.NEWLINE) && !isAtEnd()) {
            steps.add(parseProofNode(baseIndent, caseToken.column()));
        }
        while (true) {
            skipNewlines();
            if (isAtEnd() || STRUCTURAL.contains(peek().type()) || peek().column() <= caseToken.column()) {
                break;
            }
            steps.add(parseProofNode(baseIndent, caseToken.column()));
        }
        return new CaseAnalysis(caseToken.line(), caseToken.column(), joinTokens(name), steps);
    }

    // ========================================================================
    // Z notation blocks
    // ========================================================================

    private GivenType parseGivenType() {
        Token keyword = advance();
        List<String> names = new ArrayList<>();
        names.add(consumeIdentifier("Expected identifier after 'given'").lexeme());
        while (match(TokenType.COMMA) || check(TokenType.IDENTIFIER)) {
            names.add(consumeIdentifier("Expected identifier after ','").lexeme());
        }
        return new GivenType(keyword.line(), keyword.column(), names);
    }

    private boolean startsFreeType() {
        return check(TokenType.IDENTIFIER) && checkAhead(1, TokenType.FREE_TYPE);
    }

    private FreeType parseFreeType() {
        Token name = advance();
        advance();
        return new FreeType(name.line(), name.column(), name.lexeme(), parseBranches("free type definition"));
    }

    private List<FreeBranch> parseBranches(String construct) {
        if (check(TokenType.NEWLINE) && checkAhead(1, TokenType.PIPE)) {
            advance();
        }
        match(TokenType.PIPE);
        if (check(TokenType.NEWLINE) || isAtEnd() || check(TokenType.END)) {
            throw new ExpectedTokenException("Expected at least one branch in " + construct, peek());
        }
        List<FreeBranch> branches = new ArrayList<>();
        do {
            Token branch = consumeIdentifier("Expected branch name in " + construct);
            Expr parameters = null;
            if (match(TokenType.LANGLE)) {
                parameters = parseExpr(BP_NONE, Context.DEFAULT);
                consume(TokenType.RANGLE, "Expected '>' to close branch parameters");
            }
            branches.add(new FreeBranch(branch.line(), branch.column(), branch.lexeme(), parameters));
            if (check(TokenType.NEWLINE) && checkAhead(1, TokenType.PIPE)) {
                advance();
            }
        } while (match(TokenType.PIPE));
        return branches;
    }

    private boolean startsAbbreviation() {
        int i = current;
        if (typeAt(i) == TokenType.LBRACKET) {
            i = skipGenericParams(i);
            if (i < 0) {
                return false;
            }
        }
        if (typeAt(i) != TokenType.IDENTIFIER) {
            return false;
        }
        i++;
        TokenType next = typeAt(i);
        if (next == TokenType.PLUS || next == TokenType.STAR || next == TokenType.TILDE) {
            i++;
        } else if (next == TokenType.LBRACKET) {
            i = skipGenericParams(i);
            if (i < 0) {
                return false;
            }
        }
        return typeAt(i) == TokenType.ABBREV;
    }

    // Index just past a [X, Y] list starting at i, or -1.
    private int skipGenericParams(int i) {
        i++;
        while (typeAt(i) == TokenType.IDENTIFIER || typeAt(i) == TokenType.COMMA) {
            i++;
        }
        return typeAt(i) == TokenType.RBRACKET ? i + 1 : -1;
    }

    private Abbreviation parseAbbreviation() {
        Token start = peek();
        List<String> genericParams = check(TokenType.LBRACKET) ? parseGenericParams() : null;
        String name = consumeIdentifier("Expected abbreviation name").lexeme();
        if (check(TokenType.PLUS) || check(TokenType.STAR) || check(TokenType.TILDE)) {
            name += advance().lexeme();
        } else if (check(TokenType.LBRACKET) && genericParams == null) {
            genericParams = parseGenericParams();
        }
        consume(TokenType.ABBREV, "Expected '==' in abbreviation");
        skipNewlines();
        Expr expression = parseExpr(BP_NONE, Context.DEFAULT);
        return new Abbreviation(start.line(), start.column(), name, genericParams, expression);
    }

    private List<String> parseGenericParams() {
        consume(TokenType.LBRACKET, "Expected '[' before generic parameters");
        List<String> params = new ArrayList<>();
        do {
            params.add(consumeIdentifier("Expected identifier in generic parameters").lexeme());
        } while (match(TokenType.COMMA));
        consume(TokenType.RBRACKET, "Expected ']' after generic parameters");
        return params;
    }

    private Schema parseSchema() {
        Token keyword = advance();
        String name = null;
        if (check(TokenType.IDENTIFIER)) {
            Token nameToken = advance();
            name = nameToken.lexeme();
            if ((check(TokenType.PLUS) || check(TokenType.STAR) || check(TokenType.TILDE))
                    && nameToken.isAdjacentTo(peek())) {
                name += advance().lexeme();
            }
        }
        List<String> genericParams = check(TokenType.LBRACKET) ? parseGenericParams() : null;
        BlockBody body = parseBlockBody("schema");
        return new Schema(keyword.line(), keyword.column(), name, genericParams, body.declarations(), body.predicates());
    }

    private AxDef parseAxDef() {
        Token keyword = advance();
        List<String> genericParams = check(TokenType.LBRACKET) ? parseGenericParams() : null;
        BlockBody body = parseBlockBody("axdef");
        return new AxDef(keyword.line(), keyword.column(), genericParams, body.declarations(), body.predicates());
    }

    private GenDef parseGenDef() {
        Token keyword = advance();
        if (!check(TokenType.LBRACKET)) {
            throw new ExpectedTokenException("Expected generic parameters after 'gendef'", peek());
        }
        List<String> genericParams = parseGenericParams();
        BlockBody body = parseBlockBody("gendef");
        return new GenDef(keyword.line(), keyword.column(), genericParams, body.declarations(), body.predicates());
    }

    /**
     * Declarations, then optional {@code where} predicates, then {@code end}.
     * Predicate groups are split by blank lines and by {@code also}.
     */
    private BlockBody parseBlockBody(String block) {
        List<Declaration> declarations = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.WHERE) && !check(TokenType.END)) {
            requireOpenBlock(block);
            declarations.add(parseDeclaration());
            if (!match(TokenType.SEMICOLON) && !check(TokenType.NEWLINE)
                    && !check(TokenType.WHERE) && !check(TokenType.END)) {
                throw new ExpectedTokenException("Expected ';' or a new line after declaration", peek());
            }
            skipNewlines();
        }

        List<List<Expr>> predicates = new ArrayList<>();
        if (match(TokenType.WHERE)) {
            List<Expr> group = new ArrayList<>();
            skipNewlines();
            while (!check(TokenType.END)) {
                requireOpenBlock(block);
                if (match(TokenType.ALSO)) {
                    group = closeGroup(predicates, group);
                    skipNewlines();
                    continue;
                }
                group.add(parseExpr(BP_NONE, Context.DEFAULT));
                if (!check(TokenType.NEWLINE) && !check(TokenType.END)) {
                    throw afterExpression(peek());
                }
                if (skipNewlines() >= 2) {
                    group = closeGroup(predicates, group);
                }
            }
            closeGroup(predicates, group);
        }
        consume(TokenType.END, "Expected 'end' to close " + block);
        return new BlockBody(declarations, predicates);
    }

    private static List<Expr> closeGroup(List<List<Expr>> groups, List<Expr> group) {
        if (group.isEmpty()) {
            return group;
        }
        groups.add(group);
        return new ArrayList<>();
    }

    private void requireOpenBlock(String block) {
        if (isAtEnd() || STRUCTURAL.contains(peek().type())) {
            throw new ExpectedTokenException("Expected 'end' to close " + block, peek());
        }
    }

    private Declaration parseDeclaration() {
        Token start = peek();
        List<String> names = new ArrayList<>();
        do {
            names.add(consumeIdentifier("Expected identifier in declaration").lexeme());
        } while (match(TokenType.COMMA));
        consume(TokenType.COLON, "Expected ':' between declared names and their type");
        Expr type = parseExpr(BP_NONE, Context.SCHEMA_TEXT);
        return new Declaration(start.line(), start.column(), names, type);
    }

    private Zed parseZed() {
        Token keyword = advance();
        List<DocumentItem> items = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.END)) {
            requireOpenBlock("zed block");
            DocumentItem item;
            if (check(TokenType.GIVEN)) {
                item = parseGivenType();
            } else if (startsAbbreviation()) {
                item = parseAbbreviation();
            } else if (startsFreeType()) {
                item = parseFreeType();
            } else {
                item = parseExpr(BP_NONE, Context.DEFAULT);
            }
            items.add(item);
            if (!check(TokenType.NEWLINE) && !check(TokenType.END)) {
                throw afterExpression(peek());
            }
            skipNewlines();
        }
        advance();
        return new Zed(keyword.line(), keyword.column(), items);
    }

    private SyntaxBlock parseSyntaxBlock() {
        Token keyword = advance();
        List<List<SyntaxDefinition>> groups = new ArrayList<>();
        List<SyntaxDefinition> group = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.END)) {
            requireOpenBlock("syntax block");
            Token name = consumeIdentifier("Expected a name to define in syntax block");
            consume(TokenType.FREE_TYPE, "Expected '::=' after '" + name.lexeme() + "'");
            group.add(new SyntaxDefinition(name.line(), name.column(), name.lexeme(), parseBranches("syntax definition")));
            if (!check(TokenType.NEWLINE) && !check(TokenType.END)) {
                throw afterExpression(peek());
            }
            if (skipNewlines() >= 2 && !group.isEmpty()) {
                groups.add(group);
                group = new ArrayList<>();
            }
        }
        advance();
        if (!group.isEmpty()) {
            groups.add(group);
        }
        return new SyntaxBlock(keyword.line(), keyword.column(), groups);
    }

    // ========================================================================
    // Unified Pratt Parser - parseExpr(int minBp, Context ctx)
    // ========================================================================
    // 1. Parse a prefix expression (binders, prefix operators, postfix chain)
    // 2. While the next token is an infix operator with binding power >= minBp,
    //    parse its right operand at lbp + 1 (left-assoc) or lbp (right-assoc)

    private Expr parseExpr(int minBp, Context ctx) {
        enter();
        try {
            Expr left = parsePrefix(ctx);
            while (true) {
                boolean breakBefore = false;
                if (check(TokenType.CONTINUATION)) {
                    int bp = infixBindingPower(peekAhead(1), ctx);
                    if (bp < 0 || bp < minBp) {
                        break;
                    }
                    advance();
                    breakBefore = true;
                }
                Token operator = peek();
                int lbp = infixBindingPower(operator, ctx);
                if (lbp < 0 || lbp < minBp) {
                    break;
                }
                advance();
                left = parseInfix(left, operator, lbp, breakBefore, ctx);
            }
            return left;
        } finally {
            exit();
        }
    }

    private int infixBindingPower(Token token, Context ctx) {
        if (token.type() == TokenType.SEMICOLON && ctx.schemaText()) {
            return -1;
        }
        return Precedence.binary(token.type());
    }

    private Expr parseInfix(Expr left, Token operator, int lbp, boolean breakBefore, Context ctx) {
        String symbol = operator.type().symbol();
        int rbp = Precedence.isRightAssociative(symbol) ? lbp : lbp + 1;
        boolean breakAfter = match(TokenType.CONTINUATION);
        skipNewlines();
        Expr right = parseExpr(rbp, ctx);

        if (operator.type() == TokenType.RANGE) {
            return new Range(left.line(), left.column(), left, right);
        }
        if (FUNCTION_ARROWS.contains(operator.type())) {
            return new FunctionType(left.line(), left.column(), symbol, left, right);
        }
        if (operator.type() == TokenType.EQUALS && check(TokenType.IF)) {
            right = parseGuardedCases(right, ctx);
        }
        return new BinaryOp(left.line(), left.column(), symbol, left, right, false, breakBefore || breakAfter);
    }

    private GuardedCases parseGuardedCases(Expr first, Context ctx) {
        List<GuardedBranch> branches = new ArrayList<>();
        Expr expression = first;
        while (true) {
            consume(TokenType.IF, "Expected 'if' after guarded case value");
            Expr guard = parseExpr(BP_NONE, ctx);
            branches.add(new GuardedBranch(expression.line(), expression.column(), expression, guard));
            if (!nextLineIsGuardedBranch()) {
                break;
            }
            advance();
            expression = parseExpr(BP_COMPARISON + 1, ctx);
        }
        return new GuardedCases(first.line(), first.column(), branches);
    }

    // A following line of the form "expr if guard", with no 'then'.
    private boolean nextLineIsGuardedBranch() {
        if (!check(TokenType.NEWLINE)) {
            return false;
        }
        int start = current + 1;
        TokenType first = typeAt(start);
        if (first == TokenType.NEWLINE || first == TokenType.EOF || first == TokenType.IF
                || first == TokenType.END || first == TokenType.WHERE || STRUCTURAL.contains(first)) {
            return false;
        }
        boolean sawIf = false;
        for (int i = start; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.NEWLINE || type == TokenType.EOF) {
                break;
            }
            if (type == TokenType.THEN) {
                return false;
            }
            if (type == TokenType.IF) {
                sawIf = true;
            }
        }
        return sawIf;
    }

    private Expr parsePrefix(Context ctx) {
        Token token = peek();
        return switch (token.type()) {
            case FORALL, EXISTS, EXISTS1, MU -> parseQuantifier(ctx);
            case LAMBDA -> parseLambda(ctx);
            case IF -> parseConditional(ctx);
            case LNOT, MINUS, HASH -> prefixUnary(ctx);
            case DOM, RAN, INV, ID, BIGCUP, BIGCAP ->
                    OPERAND_START.contains(peekAhead(1).type()) ? prefixUnary(ctx) : parsePostfix(ctx);
            default -> parsePostfix(ctx);
        };
    }

    private Expr prefixUnary(Context ctx) {
        Token operator = advance();
        Expr operand = parseExpr(BP_UNARY, ctx);
        return new UnaryOp(operator.line(), operator.column(), operator.type().symbol(), operand);
    }

    private Expr parseQuantifier(Context ctx) {
        Token keyword = advance();
        String kind = keyword.type().symbol();
        String missingVariable = "Expected variable name after '" + keyword.lexeme() + "'";
        List<Binding> groups = new ArrayList<>();
        groups.add(parseBinding(missingVariable));
        while (match(TokenType.SEMICOLON)) {
            groups.add(parseBinding(missingVariable));
        }

        Expr body;
        Expr expression = null;
        boolean lineBreakAfterPipe = false;
        Context bodyContext = ctx.withComprehensionBody();
        if (match(TokenType.PIPE)) {
            lineBreakAfterPipe = match(TokenType.CONTINUATION);
            skipNewlines();
            body = parseExpr(BP_NONE, bodyContext);
            if (match(TokenType.PIPE)) {
                skipLineBreaks();
                Expr constrained = parseExpr(BP_NONE, bodyContext);
                body = new BinaryOp(body.line(), body.column(), TokenType.LAND.symbol(), body, constrained, false, false);
            }
            if (match(TokenType.PERIOD)) {
                skipLineBreaks();
                expression = parseExpr(BP_NONE, ctx);
            }
        } else if (match(TokenType.PERIOD)) {
            skipLineBreaks();
            body = parseExpr(BP_NONE, ctx);
        } else {
            throw new ExpectedTokenException("Expected '|' or '.' after " + kind + " bindings", peek());
        }

        Binding last = groups.get(groups.size() - 1);
        Token innerStart = groups.size() == 1 ? keyword : last.start();
        Expr result = new Quantifier(innerStart.line(), innerStart.column(), kind, last.variables(),
                last.tuplePattern(), last.domain(), body, expression, lineBreakAfterPipe);
        for (int i = groups.size() - 2; i >= 0; i--) {
            Binding group = groups.get(i);
            Token start = i == 0 ? keyword : group.start();
            result = new Quantifier(start.line(), start.column(), kind, group.variables(),
                    group.tuplePattern(), group.domain(), result, null, false);
        }
        return result;
    }

    private Binding parseBinding(String missingVariable) {
        Token start = peek();
        List<String> variables = new ArrayList<>();
        Tuple tuplePattern = null;
        if (check(TokenType.LPAREN)) {
            Token open = advance();
            List<Expr> elements = new ArrayList<>();
            do {
                Token variable = consumeIdentifier(missingVariable);
                variables.add(variable.lexeme());
                elements.add(new Identifier(variable.line(), variable.column(), variable.lexeme()));
            } while (match(TokenType.COMMA));
            consume(TokenType.RPAREN, "Expected ')' after tuple pattern");
            tuplePattern = new Tuple(open.line(), open.column(), elements);
        } else {
            do {
                variables.add(consumeIdentifier(missingVariable).lexeme());
            } while (match(TokenType.COMMA));
        }
        Expr domain = null;
        if (match(TokenType.COLON)) {
            domain = parseExpr(BP_RELATION, Context.SCHEMA_TEXT);
        }
        return new Binding(start, variables, tuplePattern, domain);
    }

    private Expr parseLambda(Context ctx) {
        Token keyword = advance();
        List<Binding> groups = new ArrayList<>();
        do {
            Binding binding = parseBinding("Expected variable name after 'lambda'");
            if (binding.domain() == null) {
                throw new ExpectedTokenException("Expected ':' and a domain after lambda variables", peek());
            }
            groups.add(binding);
        } while (match(TokenType.SEMICOLON));
        consume(TokenType.PERIOD, "Expected '.' before lambda body");
        skipLineBreaks();
        Expr body = parseExpr(BP_NONE, ctx);
        for (int i = groups.size() - 1; i >= 0; i--) {
            Binding group = groups.get(i);
            Token start = i == 0 ? keyword : group.start();
            body = new Lambda(start.line(), start.column(), group.variables(), group.domain(), body);
        }
        return body;
    }

    private Conditional parseConditional(Context ctx) {
        Token keyword = advance();
        Expr condition = parseExpr(BP_NONE, ctx);
        skipLineBreaksBefore(TokenType.THEN);
        consume(TokenType.THEN, "Expected 'then' after if condition");
        skipLineBreaks();
        Expr thenExpr = parseExpr(BP_NONE, ctx);
        skipLineBreaksBefore(TokenType.ELSE);
        consume(TokenType.ELSE, "Expected 'else' in conditional expression");
        skipLineBreaks();
        Expr elseExpr = parseExpr(BP_NONE, ctx);
        return new Conditional(keyword.line(), keyword.column(), condition, thenExpr, elseExpr);
    }

    // ========================================================================
    // Postfix chain and juxtaposition
    // ========================================================================

    private Expr parsePostfix(Context ctx) {
        Expr expr = parsePrimary();
        while (true) {
            Token token = peek();
            TokenType type = token.type();
            if (type == TokenType.LPAREN && previous().isAdjacentTo(token)) {
                advance();
                expr = new FunctionApp(expr.line(), expr.column(), expr,
                        parseExprList(TokenType.RPAREN, "Expected ')' after arguments"));
            } else if (type == TokenType.LBRACKET && previous().isAdjacentTo(token)) {
                advance();
                expr = new GenericInstantiation(expr.line(), expr.column(), expr,
                        parseExprList(TokenType.RBRACKET, "Expected ']' after type parameters"));
            } else if (type == TokenType.LIMG) {
                advance();
                Expr set = parseExpr(BP_NONE, Context.DEFAULT);
                consume(TokenType.RIMG, "Expected '|)' to close relational image");
                expr = new RelationalImage(expr.line(), expr.column(), expr, set);
            } else if (type == TokenType.PERIOD) {
                Expr projected = tryProjection(expr, ctx);
                if (projected == null) {
                    break;
                }
                expr = projected;
            } else if (type == TokenType.CARET) {
                advance();
                expr = new Superscript(expr.line(), expr.column(), expr, parseScriptOperand());
            } else if (type == TokenType.UNDERSCORE) {
                advance();
                expr = new Subscript(expr.line(), expr.column(), expr, parseScriptOperand());
            } else if (type == TokenType.TILDE) {
                advance();
                expr = new UnaryOp(expr.line(), expr.column(), "~", expr);
            } else if ((type == TokenType.PLUS || type == TokenType.STAR) && !startsOperandAfter(current + 1)) {
                advance();
                expr = new UnaryOp(expr.line(), expr.column(), type.symbol(), expr);
            } else {
                break;
            }
        }

        if (ctx.juxtaposition() && isApplicable(expr)) {
            Context argumentContext = ctx.withoutJuxtaposition();
            while (startsJuxtaposedArgument(peek())) {
                Expr argument = parsePostfix(argumentContext);
                List<Expr> args = new ArrayList<>();
                args.add(argument);
                expr = new FunctionApp(expr.line(), expr.column(), expr, args);
            }
        }
        return expr;
    }

    // Whether the token at index, looking past a line continuation, could begin an operand.
    private boolean startsOperandAfter(int index) {
        TokenType type = typeAt(index);
        if (type == TokenType.CONTINUATION) {
            type = typeAt(index + 1);
        }
        return OPERAND_START.contains(type);
    }

    private static boolean isApplicable(Expr expr) {
        return expr instanceof Identifier || expr instanceof FunctionApp
                || expr instanceof GenericInstantiation || expr instanceof Subscript;
    }

    private static boolean startsJuxtaposedArgument(Token token) {
        return switch (token.type()) {
            case IDENTIFIER -> !PROSE_WORDS.contains(token.lexeme().toLowerCase(Locale.ROOT));
            case NUMBER, LPAREN, LBRACE, LANGLE, LBAG -> true;
            default -> false;
        };
    }

    private Expr parseScriptOperand() {
        if (check(TokenType.MINUS)) {
            Token minus = advance();
            return new UnaryOp(minus.line(), minus.column(), "-", parsePrimary());
        }
        return parsePrimary();
    }

    /**
     * Reads {@code .1} or {@code .name} after {@code base}, or returns null when the
     * dot separates a binder from its body. Inside schema text or a comprehension
     * body a projection must be written without spaces around the dot.
     */
    private Expr tryProjection(Expr base, Context ctx) {
        Token dot = peek();
        Token next = peekAhead(1);
        if (ctx.contextual() && !(previous().isAdjacentTo(dot) && dot.isAdjacentTo(next))) {
            return null;
        }
        if (next.type() == TokenType.NUMBER) {
            if (ctx.schemaText() && isArithmetic(peekAhead(2))) {
                return null;
            }
            advance();
            advance();
            return new TupleProjection(base.line(), base.column(), base, parseIndex(next), null);
        }
        if (isWord(next)) {
            if (ctx.contextual() && !isSafeFollower(peekAhead(2))) {
                return null;
            }
            advance();
            advance();
            return new TupleProjection(base.line(), base.column(), base, null, next.lexeme());
        }
        return null;
    }

    private static boolean isWord(Token token) {
        if (token.type() == TokenType.IDENTIFIER) {
            return true;
        }
        String symbol = token.type().symbol();
        return symbol != null && Character.isLetter(symbol.charAt(0));
    }

    private static boolean isArithmetic(Token token) {
        return switch (token.type()) {
            case PLUS, MINUS, STAR, DIV, MOD -> true;
            default -> false;
        };
    }

    private static boolean isSafeFollower(Token token) {
        return CLOSERS.contains(token.type()) || Precedence.binary(token.type()) >= 0;
    }

    private Expr parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case IDENTIFIER, DOM, RAN, INV, ID, BIGCUP, BIGCAP -> {
                advance();
                return new Identifier(token.line(), token.column(), token.lexeme());
            }
            case NUMBER -> {
                advance();
                return new NumberLiteral(token.line(), token.column(), token.lexeme());
            }
            case LPAREN -> {
                return parseParenthesized();
            }
            case LBRACE -> {
                return parseSetExpression();
            }
            case LANGLE -> {
                advance();
                return new SequenceLiteral(token.line(), token.column(),
                        parseExprList(TokenType.RANGLE, "Expected '>' to close sequence"));
            }
            case LBAG -> {
                advance();
                return new BagLiteral(token.line(), token.column(),
                        parseExprList(TokenType.RBAG, "Expected ']]' to close bag"));
            }
            default -> throw new UnexpectedTokenException(token, "expression");
        }
    }

    private Expr parseParenthesized() {
        Token open = advance();
        if (check(TokenType.RPAREN)) {
            throw new ParseException("Empty parentheses", peek());
        }
        Expr first = parseExpr(BP_NONE, Context.DEFAULT);
        if (match(TokenType.COMMA)) {
            List<Expr> elements = new ArrayList<>();
            elements.add(first);
            do {
                if (check(TokenType.RPAREN)) {
                    throw new ParseException("Trailing comma in tuple", peek());
                }
                elements.add(parseExpr(BP_NONE, Context.DEFAULT));
            } while (match(TokenType.COMMA));
            consume(TokenType.RPAREN, "Expected ')' to close tuple");
            return new Tuple(open.line(), open.column(), elements);
        }
        consume(TokenType.RPAREN, "Expected ')' after expression");
        if (first instanceof BinaryOp binary) {
            return binary.withExplicitParens();
        }
        return first;
    }

    private Expr parseSetExpression() {
        Token open = advance();
        if (startsComprehension()) {
            return parseSetComprehension(open);
        }
        return new SetLiteral(open.line(), open.column(),
                parseExprList(TokenType.RBRACE, "Expected '}' to close set"));
    }

    private boolean startsComprehension() {
        int i = current;
        boolean tuple = typeAt(i) == TokenType.LPAREN;
        if (tuple) {
            i++;
        }
        if (typeAt(i) != TokenType.IDENTIFIER) {
            return false;
        }
        i++;
        while (typeAt(i) == TokenType.COMMA && typeAt(i + 1) == TokenType.IDENTIFIER) {
            i += 2;
        }
        if (tuple) {
            return typeAt(i) == TokenType.RPAREN && typeAt(i + 1) == TokenType.COLON;
        }
        return typeAt(i) == TokenType.COLON || typeAt(i) == TokenType.PIPE;
    }

    private SetComprehension parseSetComprehension(Token open) {
        Binding binding = parseBinding("Expected variable name in set comprehension");
        if (check(TokenType.SEMICOLON)) {
            throw new ParseException(
                    "Set comprehension takes one declaration group; separate variables of one type with ','",
                    peek());
        }
        Expr predicate = null;
        Expr expression = null;
        if (match(TokenType.PIPE)) {
            predicate = parseExpr(BP_NONE, Context.DEFAULT.withComprehensionBody());
        }
        if (match(TokenType.PERIOD)) {
            expression = parseExpr(BP_NONE, Context.DEFAULT);
        }
        consume(TokenType.RBRACE, "Expected '}' to close set comprehension");
        return new SetComprehension(open.line(), open.column(), binding.variables(), binding.tuplePattern(),
                binding.domain(), predicate, expression);
    }

    // Opening delimiter already consumed; consumes the closing one.
    private List<Expr> parseExprList(TokenType close, String message) {
        List<Expr> items = new ArrayList<>();
        if (match(close)) {
            return items;
        }
        do {
            if (check(close)) {
                throw new ParseException("Trailing comma before " + ExpectedTokenException.describe(peek()), peek());
            }
            items.add(parseExpr(BP_NONE, Context.DEFAULT));
        } while (match(TokenType.COMMA));
        consume(close, message);
        return items;
    }

    // ========================================================================
    // Helper methods
    // ========================================================================

    private void enter() {
        if (depth >= maxDepth) {
            throw new NestingDepthException(maxDepth, peek());
        }
        depth++;
    }

    private void exit() {
        depth--;
    }

    private <T extends DocumentItem> T requireLineEnd(T item) {
        if (!check(TokenType.NEWLINE) && !isAtEnd()) {
            throw afterExpression(peek());
        }
        return item;
    }

    private static ParseException afterExpression(Token token) {
        return new ParseException("Unexpected " + ExpectedTokenException.describe(token) + " after expression", token);
    }

    private static String joinTokens(List<Token> parts) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : parts) {
            if (previous != null && !previous.isAdjacentTo(token)) {
                sb.append(' ');
            }
            sb.append(token.lexeme());
            previous = token;
        }
        return sb.toString();
    }

    private int skipNewlines() {
        int count = 0;
        while (match(TokenType.NEWLINE)) {
            count++;
        }
        return count;
    }

    private void skipLineBreaks() {
        while (match(TokenType.NEWLINE, TokenType.CONTINUATION)) {
            // skip
        }
    }

    private void skipLineBreaksBefore(TokenType expected) {
        int i = current;
        while (typeAt(i) == TokenType.NEWLINE || typeAt(i) == TokenType.CONTINUATION) {
            i++;
        }
        if (typeAt(i) == expected) {
            current = i;
        }
    }

    private static int parseIndex(Token token) {
        try {
            return Integer.parseInt(token.lexeme());
        } catch (NumberFormatException e) {
            throw new ParseException("Number too large: " + token.lexeme(), token);
        }
    }

    private int newlinesBefore() {
        int count = 0;
        for (int i = current - 1; i >= 0 && tokens.get(i).type() == TokenType.NEWLINE; i--) {
            count++;
        }
        return count;
    }

    private Token consumeIdentifier(String message) {
        if (check(TokenType.IDENTIFIER)) {
            return advance();
        }
        throw new ExpectedTokenException(message, peek());
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        return typeAt(current + offset) == type;
    }

    private TokenType typeAt(int index) {
        return index < tokens.size() ? tokens.get(index).type() : TokenType.EOF;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(current + offset, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(message, peek());
    }

    /**
     * Collects TITLE:/AUTHOR:/... and BIBLIOGRAPHY: lines wherever they appear.
     */
    private static final class MetadataBuilder {
        private Token titleStart;
        private String title;
        private String subtitle;
        private String author;
        private String date;
        private String institution;
        private Token bibliographyStart;
        private String file;
        private String style;

        boolean take(Token token) {
            switch (token.type()) {
                case TITLE -> title = token.lexeme();
                case SUBTITLE -> subtitle = token.lexeme();
                case AUTHOR -> author = token.lexeme();
                case DATE -> date = token.lexeme();
                case INSTITUTION -> institution = token.lexeme();
                case BIBLIOGRAPHY -> file = token.lexeme();
                case BIBLIOGRAPHY_STYLE -> style = token.lexeme();
                default -> {
                    return false;
                }
            }
            if (token.type() == TokenType.BIBLIOGRAPHY || token.type() == TokenType.BIBLIOGRAPHY_STYLE) {
                if (bibliographyStart == null) {
                    bibliographyStart = token;
                }
            } else if (titleStart == null) {
                titleStart = token;
            }
            return true;
        }

        TitleMetadata title() {
            if (titleStart == null) {
                return null;
            }
            return new TitleMetadata(titleStart.line(), titleStart.column(), title, subtitle, author, date, institution);
        }

        BibliographyMetadata bibliography() {
            if (bibliographyStart == null) {
                return null;
            }
            return new BibliographyMetadata(bibliographyStart.line(), bibliographyStart.column(), file, style);
        }
    }
}
