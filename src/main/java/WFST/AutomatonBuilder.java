package WFST;

import WFST.Model.Automaton;
import WFST.Model.Cancellation;
import WFST.Model.SymbolTable;
import WFST.Regex.AST;
import WFST.Semiring.Semiring;

/**
 * Thompson-style construction of an automaton from a syntax tree, bottom-up.
 * Operands of intersection and difference are determinized first; composition and determinization
 * share one cancellation for the whole pattern.
 */
public class AutomatonBuilder<W> implements AST.Visitor<Automaton<W>> {
    private final Semiring<W> semiring;
    private final SymbolTable symbols;
    private final Cancellation cancellation;

    public AutomatonBuilder(Semiring<W> semiring, SymbolTable symbols, Cancellation cancellation) {
        this.semiring = semiring;
        this.symbols = symbols;
        this.cancellation = cancellation;
    }

    public Automaton<W> build(AST.Node root) {
        return root.accept(this);
    }

    @Override
    public Automaton<W> visitSymbol(AST.Symbol node) {
        return Operations.symbol(semiring, symbols, node.symbol());
    }

    @Override
    public Automaton<W> visitEmpty(AST.Empty node) {
        return Operations.emptyString(semiring, symbols);
    }

    @Override
    public Automaton<W> visitSymbolClass(AST.SymbolClass node) {
        return Operations.symbolClass(semiring, symbols, node.symbols());
    }

    @Override
    public Automaton<W> visitWeight(AST.Weight node) {
        return Operations.emptyString(semiring, symbols, semiring.parseWeight(node.text()));
    }

    @Override
    public Automaton<W> visitCross(AST.Cross node) {
        String upper = singleSymbol(node.upper());
        String lower = singleSymbol(node.lower());
        if (upper != null && lower != null) {
            return Operations.pair(semiring, symbols, upper, lower);
        }
        return Operations.crossProduct(
            Operations.projectInput(build(node.upper())),
            Operations.projectOutput(build(node.lower())));
    }

    /**
     * @return the symbol of a one-symbol operand, "" for the empty string, null otherwise
     */
    private static String singleSymbol(AST.Node node) {
        if (node instanceof AST.Symbol symbol) {
            return symbol.symbol();
        }
        if (node instanceof AST.Empty) {
            return "";
        }
        return null;
    }

    @Override
    public Automaton<W> visitConcat(AST.Concat node) {
        return Operations.concatenate(build(node.left()), build(node.right()));
    }

    @Override
    public Automaton<W> visitUnion(AST.Union node) {
        return Operations.union(build(node.left()), build(node.right()));
    }

    @Override
    public Automaton<W> visitIntersect(AST.Intersect node) {
        return ProductConstruction.intersect(determinized(node.left()), determinized(node.right()), cancellation);
    }

    @Override
    public Automaton<W> visitDifference(AST.Difference node) {
        return ProductConstruction.difference(determinized(node.left()), determinized(node.right()), cancellation);
    }

    @Override
    public Automaton<W> visitCompose(AST.Compose node) {
        return Composer.compose(build(node.left()), build(node.right()), cancellation);
    }

    @Override
    public Automaton<W> visitRepeat(AST.Repeat node) {
        Automaton<W> body = build(node.body());
        if (node.min() == 0 && node.max() == AST.UNBOUNDED) {
            return Operations.star(body);
        }
        if (node.min() == 1 && node.max() == AST.UNBOUNDED) {
            return Operations.plus(body);
        }
        if (node.min() == 0 && node.max() == 1) {
            return Operations.optional(body);
        }
        return Operations.repeat(body, node.min(), node.max());
    }

    private Automaton<W> determinized(AST.Node node) {
        return Determinizer.determinize(build(node), cancellation);
    }
}
