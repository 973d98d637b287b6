package io.github.superyaml.constraints;

import io.github.superyaml.expr.Expr;

import java.util.EnumSet;
import java.util.Set;

/// Possible orderings of two values. A comparison operator allows a subset.
enum Relation {
    LESS,
    EQUAL,
    GREATER;

    /// {@return the orderings under which `left op right` holds}
    static EnumSet<Relation> allowedBy(Expr.BinaryOp op) {
        return switch (op) {
            case LT -> EnumSet.of(LESS);
            case LTE -> EnumSet.of(LESS, EQUAL);
            case GT -> EnumSet.of(GREATER);
            case GTE -> EnumSet.of(GREATER, EQUAL);
            case EQ -> EnumSet.of(EQUAL);
            case NOT_EQ -> EnumSet.of(LESS, GREATER);
            default -> throw new IllegalArgumentException("not a comparison: " + op);
        };
    }

    /// {@return the same relations seen with the operands swapped}
    static EnumSet<Relation> inverted(Set<Relation> relations) {
        final var out = EnumSet.noneOf(Relation.class);
        for (final var r : relations) {
            out.add(switch (r) {
                case LESS -> GREATER;
                case GREATER -> LESS;
                case EQUAL -> EQUAL;
            });
        }
        return out;
    }
}
