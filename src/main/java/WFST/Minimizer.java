package WFST;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import WFST.Model.Automaton;
import WFST.Model.MutableAutomaton;
import WFST.Model.Transition;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.util.partitionrefinement.Block;
import net.automatalib.util.partitionrefinement.Hopcroft;

/**
 * Hopcroft partition refinement on trimmed, deterministic automata.
 * <p>
 * Transitions are compared by (label, quantized weight), states by whether they are final and by their
 * quantized final weight, so the result preserves every path weight exactly as given; weights are not
 * pushed. Missing transitions lead to an artificial sink that is dropped again on extraction.
 */
public class Minimizer {
    private static final Logger LOGGER = Logger.getLogger("WFST");

    private Minimizer() {}

    /**
     * @param automaton - deterministic, epsilon-free automaton
     * @return minimal equivalent, without unreachable or dead states
     * @throws NonDeterministicPreconditionException if automaton is not deterministic
     */
    public static <W> Automaton<W> minimize(Automaton<W> automaton) {
        if (!automaton.isDeterministic()) {
            throw new NonDeterministicPreconditionException(
                "minimize requires a deterministic, epsilon-free automaton; determinize it first");
        }
        final Automaton<W> dfa = FSTTrim.trim(automaton);
        final Semiring<W> sr = dfa.getSemiring();
        final int n = dfa.size();
        final List<Transition<W>> arcs = dfa.getTransitions();
        if (arcs.isEmpty()) {
            // only the start state survives trimming
            final MutableAutomaton<W> single = new MutableAutomaton<>(sr, dfa.getSymbols());
            single.setStart(single.addState(dfa.getFinalWeight(dfa.getStart())));
            return single.freeze(true);
        }

        // Arc symbols: (label, quantized weight) pairs
        final Object2IntMap<ArcSymbol> symbolIds = new Object2IntOpenHashMap<>();
        symbolIds.defaultReturnValue(-1);
        final int[] arcSymbol = new int[arcs.size()];
        for (int i = 0; i < arcs.size(); i++) {
            Transition<W> t = arcs.get(i);
            ArcSymbol key = new ArcSymbol(t.label(), sr.quantize(t.weight()));
            int id = symbolIds.getInt(key);
            if (id < 0) {
                id = symbolIds.size();
                symbolIds.put(key, id);
            }
            arcSymbol[i] = id;
        }
        final int numInputs = symbolIds.size();
        final int[] successors = new int[n * numInputs];
        Arrays.fill(successors, -1);
        for (int i = 0; i < arcs.size(); i++) {
            Transition<W> t = arcs.get(i);
            successors[t.source() * numInputs + arcSymbol[i]] = t.target();
        }

        // Initial partition: non-final states, then one class per quantized final weight
        final Object2IntMap<Object> finalClasses = new Object2IntOpenHashMap<>();
        finalClasses.defaultReturnValue(-1);
        final int[] classOf = new int[n];
        for (int q = 0; q < n; q++) {
            if (!dfa.isFinal(q)) {
                continue;
            }
            Object key = sr.quantize(dfa.getFinalWeight(q));
            int c = finalClasses.getInt(key);
            if (c < 0) {
                c = finalClasses.size() + 1;
                finalClasses.put(key, c);
            }
            classOf[q] = c;
        }

        final Hopcroft pt = new Hopcroft();
        initDeterministic(pt, dfa.getStart(), n, numInputs, successors, classOf, finalClasses.size() + 1);
        pt.computeCoarsestStablePartition();

        final Automaton<W> result = extract(dfa, pt);
        LOGGER.fine(() -> "Minimized " + automaton.size() + " states into " + result.size());
        return result;
    }

    /**
     * Fill the refinement arrays for a partial DFA given as a successor table (-1 for no transition).
     * Block data, positions and predecessor offsets share one array; predecessors get their own.
     * @param classOf - initial class of each state, in [0, numClasses)
     */
    static void initDeterministic(Hopcroft pt, int start, int numStates, int numInputs,
                                  int[] successors, int[] classOf, int numClasses) {
        final int sinkId = numStates;
        final int numStatesWithSink = numStates + 1;
        final int posDataLow = numStatesWithSink;
        final int predOfsDataLow = posDataLow + numStatesWithSink;
        final int numTransitionsFull = numStatesWithSink * numInputs;
        final int predDataLow = predOfsDataLow + numTransitionsFull + 1;

        final int[] data = new int[predDataLow];
        final int[] predData = new int[numTransitionsFull];
        final Block[] blockForState = new Block[numStatesWithSink];
        final Block[] blockForClass = new Block[numClasses + 1]; // last class is the sink

        final int[] statesBuff = new int[numStatesWithSink];
        blockForState[start] = getOrCreateBlock(blockForClass, classOf[start], pt);
        statesBuff[0] = start;
        int reachableStates = 1;
        boolean partial = false;
        for (int ptr = 0; ptr < reachableStates; ptr++) {
            int curr = statesBuff[ptr];
            if (curr == sinkId) {
                continue;
            }
            int predCountBase = predOfsDataLow;
            for (int j = 0; j < numInputs; j++) {
                int succ = successors[curr * numInputs + j];
                int succId = succ < 0 ? sinkId : succ;
                if (succ < 0) {
                    partial = true;
                }
                if (blockForState[succId] == null) {
                    blockForState[succId] = getOrCreateBlock(blockForClass, succ < 0 ? numClasses : classOf[succ], pt);
                    statesBuff[reachableStates++] = succId;
                }
                data[predCountBase + succId]++;
                predCountBase += numStatesWithSink;
            }
        }
        if (partial) {
            int predCountIdx = predOfsDataLow + sinkId;
            for (int j = 0; j < numInputs; j++) {
                data[predCountIdx]++; // sink loops on every symbol
                predCountIdx += numStatesWithSink;
            }
        }

        pt.canonizeBlocks();
        for (int i = predOfsDataLow + 1; i < predDataLow; i++) {
            data[i] += data[i - 1];
        }

        for (int i = 0; i < reachableStates; i++) {
            final int stateId = statesBuff[i];
            final Block b = blockForState[stateId];
            final int pos = --b.low;
            data[pos] = stateId;
            data[posDataLow + stateId] = pos;
            int predOfsBase = predOfsDataLow;
            for (int j = 0; j < numInputs; j++) {
                final int succId;
                if (stateId == sinkId) {
                    succId = sinkId;
                } else {
                    int succ = successors[stateId * numInputs + j];
                    succId = succ < 0 ? sinkId : succ;
                }
                predData[--data[predOfsBase + succId]] = stateId;
                predOfsBase += numStatesWithSink;
            }
        }

        pt.setBlockData(data);
        pt.setPosData(data, posDataLow);
        pt.setPredOfsData(data, predOfsDataLow);
        pt.setPredData(predData);
        pt.setBlockForState(blockForState);
        pt.setSize(numStatesWithSink, numInputs);
        pt.removeEmptyBlocks();
    }

    private static Block getOrCreateBlock(Block[] blockForClass, int classification, Hopcroft pt) {
        Block block = blockForClass[classification];
        if (block == null) {
            block = pt.createBlock();
            block.high = 1;
            blockForClass[classification] = block;
        } else {
            block.high++;
        }
        return block;
    }

    /**
     * One output state per block, numbered in breadth-first order from the start block.
     */
    private static <W> Automaton<W> extract(Automaton<W> dfa, Hopcroft pt) {
        final int n = dfa.size();
        final int[] blockOf = new int[n];
        final IntArrayList representatives = new IntArrayList();
        for (Block block : pt.blockList()) {
            int rep = pt.blockData[block.low];
            if (rep >= n) {
                continue; // artificial sink
            }
            for (int b = block.low; b < block.high; b++) {
                blockOf[pt.blockData[b]] = representatives.size();
            }
            representatives.add(rep);
        }

        final int[] blockToState = new int[representatives.size()];
        Arrays.fill(blockToState, -1);
        final MutableAutomaton<W> out = new MutableAutomaton<>(dfa.getSemiring(), dfa.getSymbols());
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        int startBlock = blockOf[dfa.getStart()];
        blockToState[startBlock] = out.addState(dfa.getFinalWeight(dfa.getStart()));
        out.setStart(blockToState[startBlock]);
        queue.enqueue(startBlock);
        while (!queue.isEmpty()) {
            int block = queue.dequeueInt();
            int rep = representatives.getInt(block);
            for (Transition<W> t : dfa.getTransitions(rep)) {
                int targetBlock = blockOf[t.target()];
                if (blockToState[targetBlock] < 0) {
                    int rt = representatives.getInt(targetBlock);
                    blockToState[targetBlock] = out.addState(dfa.getFinalWeight(rt));
                    queue.enqueue(targetBlock);
                }
                out.addTransition(blockToState[block], t.input(), t.output(), t.weight(), blockToState[targetBlock]);
            }
        }
        return out.freeze(true);
    }

    private record ArcSymbol(long label, Object weight) { }
}
