package com.txt2tex;

public enum TokenType {
    // Layout
    NEWLINE,
    CONTINUATION,
    EOF,

    // Structure
    SECTION_MARKER,
    SOLUTION_MARKER,
    PART_LABEL,
    RULE_LINE,
    TRUTH_TABLE,
    ARGUE,
    INFRULE,
    PROOF,
    GIVEN,
    AXDEF,
    GENDEF,
    SCHEMA,
    ZED,
    SYNTAX,
    WHERE,
    END,
    ALSO,

    // Raw line captures
    TEXT,
    PURETEXT,
    LATEX,
    PAGEBREAK,
    CONTENTS,
    PARTS,
    TITLE,
    SUBTITLE,
    AUTHOR,
    DATE,
    INSTITUTION,
    BIBLIOGRAPHY,
    BIBLIOGRAPHY_STYLE,

    // Literals
    IDENTIFIER,
    NUMBER,

    // Binders and conditionals
    FORALL("forall"),
    EXISTS("exists"),
    EXISTS1("exists1"),
    MU("mu"),
    LAMBDA("lambda"),
    IF,
    THEN,
    ELSE,

    // Logic
    SHOWS("shows"),
    IFF("<=>"),
    IMPLIES("=>"),
    LOR("lor"),
    LAND("land"),
    LNOT("lnot"),

    // Comparison
    EQUALS("="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),

    // Relations
    RELATION("<->"),
    MAPLET("|->"),
    DRES("<|"),
    RRES("|>"),
    NDRES("<<|"),
    NRRES("|>>"),
    CIRC("o9"),
    COMP("comp"),
    SEMICOLON(";"),

    // Function arrows
    TFUN("->"),
    PFUN("+->"),
    TINJ(">->"),
    PINJ(">+>"),
    TSURJ("-->>"),
    PSURJ("+->>"),
    BIJECTION(">->>"),
    FINFUN("77->"),
    FINJ(">7->"),

    // Sets and bags
    ELEM("elem"),
    NOTIN("notin"),
    SUBSET("subset"),
    PSUBSET("psubset"),
    UNION("union"),
    INTERSECT("intersect"),
    SETMINUS("\\"),
    CROSS("cross"),
    OVERRIDE("++"),
    BAG_UNION("bag_union"),
    FILTER("filter"),
    RANGE(".."),

    // Arithmetic and sequences
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    DIV("div"),
    MOD("mod"),
    CAT("^"),
    CARET("^"),
    UNDERSCORE("_"),
    TILDE("~"),
    HASH("#"),

    // Prefix relation and set operators
    DOM("dom"),
    RAN("ran"),
    INV("inv"),
    ID("id"),
    BIGCUP("bigcup"),
    BIGCAP("bigcap"),

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    LANGLE,
    RANGLE,
    LBAG,
    RBAG,
    LIMG,
    RIMG,
    COMMA,
    COLON,
    DOUBLE_COLON,
    FREE_TYPE,
    ABBREV,
    PERIOD,
    PIPE;

    private final String symbol;

    TokenType() {
        this(null);
    }

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Canonical ASCII spelling used as the operator name in the AST, or null
     * for kinds that are not operators.
     */
    public String symbol() {
        return symbol;
    }
}
