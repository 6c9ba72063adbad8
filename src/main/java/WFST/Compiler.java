package WFST;

import java.util.logging.Logger;

import WFST.Model.Automaton;
import WFST.Model.Cancellation;
import WFST.Model.SymbolTable;
import WFST.Regex.AST;
import WFST.Regex.ParseException;
import WFST.Regex.RegexParser;
import WFST.Semiring.Semiring;

/**
 * Pattern text to automaton. Weight annotations are checked against the semiring while parsing,
 * so a malformed weight is reported with its offset.
 */
public class Compiler<W> {
    private static final Logger LOGGER = Logger.getLogger("WFST");

    private final Semiring<W> semiring;
    private final SymbolTable symbols;
    private final Cancellation cancellation;

    public Compiler(Semiring<W> semiring, SymbolTable symbols) {
        this(semiring, symbols, new Cancellation());
    }

    public Compiler(Semiring<W> semiring, SymbolTable symbols, Cancellation cancellation) {
        this.semiring = semiring;
        this.symbols = symbols;
        this.cancellation = cancellation;
    }

    public static <W> Automaton<W> compile(String pattern, Semiring<W> semiring, SymbolTable symbols) {
        return new Compiler<>(semiring, symbols).compile(pattern);
    }

    /**
     * @param pattern - pattern text
     * @return automaton for the pattern, not necessarily deterministic
     * @throws ParseException on malformed patterns
     * @throws ExplorationLimitException if an intersection, difference or composition is cancelled
     */
    public Automaton<W> compile(String pattern) {
        AST.Node root = new RegexParser(semiring::parseWeight).parse(pattern);
        Automaton<W> result = new AutomatonBuilder<>(semiring, symbols, cancellation).build(root);
        LOGGER.fine(() -> "Compiled '" + pattern + "' into " + result.size() + " states, "
            + result.numTransitions() + " transitions");
        return result;
    }

    /**
     * Compile, determinize and minimize.
     */
    public Automaton<W> compileMinimal(String pattern) {
        return Minimizer.minimize(Determinizer.determinize(compile(pattern), cancellation));
    }

    public Semiring<W> getSemiring() {
        return semiring;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }
}
