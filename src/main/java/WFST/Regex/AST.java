package WFST.Regex;

import java.util.List;

/**
 * Container for the node types of a parsed pattern.
 */
public final class AST {
    public static final int UNBOUNDED = -1;

    private AST() {}

    public interface Node {
        <R> R accept(Visitor<R> visitor);
    }

    public interface Visitor<R> {
        R visitSymbol(Symbol node);

        R visitEmpty(Empty node);

        R visitSymbolClass(SymbolClass node);

        R visitWeight(Weight node);

        R visitCross(Cross node);

        R visitConcat(Concat node);

        R visitUnion(Union node);

        R visitIntersect(Intersect node);

        R visitDifference(Difference node);

        R visitCompose(Compose node);

        R visitRepeat(Repeat node);
    }

    /** One symbol, possibly multi-character. */
    public record Symbol(String symbol) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSymbol(this);
        }
    }

    /** The empty string. */
    public record Empty() implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEmpty(this);
        }
    }

    /** Any one of the listed symbols. */
    public record SymbolClass(List<String> symbols) implements Node {
        public SymbolClass {
            symbols = List.copyOf(symbols);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSymbolClass(this);
        }
    }

    /** The empty string carrying a weight; text already validated by the parser. */
    public record Weight(String text) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWeight(this);
        }
    }

    /** upper:lower, the cross product of two languages. */
    public record Cross(Node upper, Node lower) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCross(this);
        }
    }

    public record Concat(Node left, Node right) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConcat(this);
        }
    }

    public record Union(Node left, Node right) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnion(this);
        }
    }

    public record Intersect(Node left, Node right) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIntersect(this);
        }
    }

    public record Difference(Node left, Node right) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDifference(this);
        }
    }

    public record Compose(Node left, Node right) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompose(this);
        }
    }

    /**
     * body{min,max}; max is UNBOUNDED for * and +.
     */
    public record Repeat(Node body, int min, int max) implements Node {
        public Repeat {
            if (min < 0 || (max != UNBOUNDED && max < min)) {
                throw new IllegalArgumentException("Bad bounds {" + min + "," + max + "}");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeat(this);
        }
    }

    public static Repeat star(Node body) {
        return new Repeat(body, 0, UNBOUNDED);
    }

    public static Repeat plus(Node body) {
        return new Repeat(body, 1, UNBOUNDED);
    }

    public static Repeat question(Node body) {
        return new Repeat(body, 0, 1);
    }
}
