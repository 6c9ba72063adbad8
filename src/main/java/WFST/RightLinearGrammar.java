package WFST;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import WFST.Model.Automaton;
import WFST.Model.MutableAutomaton;
import WFST.Semiring.Semiring;

/**
 * Lexicon-style grammar: named classes whose rules read a pattern and continue in another class.
 * The class named {@link #END} accepts. Typical use is a morphological lexicon, e.g.
 * <pre>
 * Root  -&gt; cat  Noun
 * Noun  -&gt; '+Pl':s #
 * Noun  -&gt; '+Sg':'' #
 * </pre>
 */
public class RightLinearGrammar<W> {
    public static final String END = "#";

    private final Compiler<W> compiler;
    private final Map<String, List<Rule>> rules = new LinkedHashMap<>();

    private record Rule(String pattern, String target) { }

    public RightLinearGrammar(Compiler<W> compiler) {
        this.compiler = compiler;
    }

    /**
     * @param fromClass - class this rule belongs to
     * @param pattern - pattern read by the rule; weight annotations are allowed
     * @param toClass - continuation class, or {@link #END}
     */
    public RightLinearGrammar<W> addRule(String fromClass, String pattern, String toClass) {
        if (END.equals(fromClass)) {
            throw new IllegalArgumentException("The end class cannot have rules");
        }
        rules.computeIfAbsent(fromClass, k -> new ArrayList<>()).add(new Rule(pattern, toClass));
        return this;
    }

    /**
     * @param startClass - class the compiled automaton starts in
     * @throws IllegalArgumentException if a rule continues in a class that has no rules
     */
    public Automaton<W> compile(String startClass) {
        final Semiring<W> sr = compiler.getSemiring();
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, compiler.getSymbols());
        final Map<String, Integer> classStates = new LinkedHashMap<>();
        for (String name : rules.keySet()) {
            classStates.put(name, out.addState());
        }
        classStates.put(END, out.addState(sr.one()));
        Integer start = classStates.get(startClass);
        if (start == null) {
            throw new IllegalArgumentException("Unknown start class: " + startClass);
        }
        out.setStart(start);

        for (Map.Entry<String, List<Rule>> e : rules.entrySet()) {
            int from = classStates.get(e.getKey());
            for (Rule rule : e.getValue()) {
                Integer to = classStates.get(rule.target());
                if (to == null) {
                    throw new IllegalArgumentException("Class " + e.getKey() + " continues in unknown class "
                        + rule.target());
                }
                Automaton<W> body = compiler.compile(rule.pattern());
                int off = out.embed(body);
                out.addEpsilon(from, sr.one(), body.getStart() + off);
                for (int q = 0; q < body.size(); q++) {
                    if (body.isFinal(q)) {
                        out.addEpsilon(q + off, body.getFinalWeight(q), to);
                        out.setFinal(q + off, sr.zero());
                    }
                }
            }
        }
        return FSTTrim.trim(out.freeze());
    }
}
