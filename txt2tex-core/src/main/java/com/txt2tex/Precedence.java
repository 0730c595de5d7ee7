package com.txt2tex;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Binding powers for every binary operator, keyed by the canonical operator
 * spelling stored in the AST. Renderers use the same table to decide where
 * parentheses are required.
 */
public final class Precedence {
    public static final int NONE = 0;
    public static final int SEQUENT = 1;        // shows
    public static final int IFF = 2;            // <=> (right)
    public static final int IMPLIES = 3;        // => (right)
    public static final int OR = 4;             // lor
    public static final int AND = 5;            // land
    public static final int COMPARISON = 6;     // = != < > <= >=
    public static final int RELATION = 7;       // <-> |-> <| |> o9 ; and function arrows (left)
    public static final int MEMBERSHIP = 8;     // elem notin subset psubset
    public static final int RANGE = 9;          // ..
    public static final int UNION = 10;         // union cross ++ bag_union
    public static final int INTERSECT = 11;     // intersect \ filter
    public static final int ADDITIVE = 12;      // + - ^
    public static final int MULTIPLICATIVE = 13; // * div mod
    public static final int UNARY = 14;         // lnot - # dom ran ...
    public static final int POSTFIX = 15;       // ~ + * application projection

    private static final Map<String, Integer> BINARY = new HashMap<>();

    private static final Set<String> FUNCTION_ARROWS = Set.of(
            "->", "+->", ">->", ">+>", "-->>", "+->>", ">->>", "77->", ">7->");

    private static final Set<String> RIGHT_ASSOCIATIVE = Set.of("<=>", "=>");

    static {
        register(SEQUENT, TokenType.SHOWS);
        register(IFF, TokenType.IFF);
        register(IMPLIES, TokenType.IMPLIES);
        register(OR, TokenType.LOR);
        register(AND, TokenType.LAND);
        register(COMPARISON, TokenType.EQUALS, TokenType.NOT_EQUAL, TokenType.LESS_THAN,
                TokenType.GREATER_THAN, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL);
        register(RELATION, TokenType.RELATION, TokenType.MAPLET, TokenType.DRES, TokenType.RRES,
                TokenType.NDRES, TokenType.NRRES, TokenType.CIRC, TokenType.COMP, TokenType.SEMICOLON,
                TokenType.TFUN, TokenType.PFUN, TokenType.TINJ, TokenType.PINJ, TokenType.TSURJ,
                TokenType.PSURJ, TokenType.BIJECTION, TokenType.FINFUN, TokenType.FINJ);
        register(MEMBERSHIP, TokenType.ELEM, TokenType.NOTIN, TokenType.SUBSET, TokenType.PSUBSET);
        register(RANGE, TokenType.RANGE);
        register(UNION, TokenType.UNION, TokenType.CROSS, TokenType.OVERRIDE, TokenType.BAG_UNION);
        register(INTERSECT, TokenType.INTERSECT, TokenType.SETMINUS, TokenType.FILTER);
        register(ADDITIVE, TokenType.PLUS, TokenType.MINUS, TokenType.CAT);
        register(MULTIPLICATIVE, TokenType.STAR, TokenType.DIV, TokenType.MOD);
    }

    private Precedence() {
    }

    private static void register(int precedence, TokenType... types) {
        for (TokenType type : types) {
            BINARY.put(type.symbol(), precedence);
        }
    }

    /**
     * Binding power of a binary operator, or -1 if {@code operator} is not one.
     */
    public static int binary(String operator) {
        return BINARY.getOrDefault(operator, -1);
    }

    public static int binary(TokenType type) {
        // CARET shares the "^" spelling with CAT but is a superscript, never infix.
        if (type.symbol() == null || type == TokenType.CARET) {
            return -1;
        }
        return binary(type.symbol());
    }

    public static boolean isRightAssociative(String operator) {
        return RIGHT_ASSOCIATIVE.contains(operator);
    }

    public static boolean isFunctionArrow(String operator) {
        return FUNCTION_ARROWS.contains(operator);
    }
}
