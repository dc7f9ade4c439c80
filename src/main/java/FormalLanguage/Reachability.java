package FormalLanguage;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

import FormalLanguage.Model.State;
import FormalLanguage.Model.Symbol;
import FormalLanguage.Model.TransitionTable;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Reachability {
    private static final Logger LOG = LoggerFactory.getLogger(Reachability.class);

    private Reachability() {}

    public static Set<State> findReachableStates(FiniteAutomaton fa) {
        return toStates(fa, accessible(fa));
    }

    /**
     * States from which some accepting state can be reached (including the accepting states).
     */
    public static Set<State> findCoReachableStates(FiniteAutomaton fa) {
        return toStates(fa, coaccessible(fa));
    }

    /**
     * Returns an automaton with the same language, restricted to the states reachable from the
     * initial state.
     */
    public static FiniteAutomaton removeUnreachableStates(FiniteAutomaton fa) {
        final Set<State> reachable = findReachableStates(fa);
        if (reachable.size() == fa.getNumberOfStates()) {
            return fa;
        }

        final Set<State> accept = new HashSet<>(fa.getAcceptStates());
        accept.retainAll(reachable);

        final TransitionTable.Builder table = TransitionTable.builder();
        for (State q : reachable) {
            for (Symbol c : fa.getAlphabet()) {
                table.put(q, c, fa.delta(q, c));
            }
        }
        LOG.debug("Pruned {} unreachable states, {} left", fa.getNumberOfStates() - reachable.size(), reachable.size());
        return AutomatonValidator.validate(reachable, fa.symbols(), fa.getInitialState(), accept, table.build());
    }

    public static boolean isEmpty(FiniteAutomaton fa) {
        final BitSet reachable = accessible(fa);
        final CompactDFA<Symbol> dfa = fa.compiled();
        for (int q = reachable.nextSetBit(0); q >= 0; q = reachable.nextSetBit(q + 1)) {
            if (dfa.isAccepting(q)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Forward reachability from the initial state over the compiled table.
     */
    static BitSet accessible(FiniteAutomaton fa) {
        final CompactDFA<Symbol> dfa = fa.compiled();
        final int numInputs = fa.getAlphabet().size();
        final BitSet visited = new BitSet(dfa.size());
        final Deque<Integer> stack = new ArrayDeque<>();

        final int init = dfa.getIntInitialState();
        visited.set(init);
        stack.push(init);

        while (!stack.isEmpty()) {
            int q = stack.pop();
            for (int c = 0; c < numInputs; c++) {
                int succ = dfa.getSuccessor(q, c);
                if (!visited.get(succ)) {
                    visited.set(succ);
                    stack.push(succ);
                }
            }
        }
        return visited;
    }

    /**
     * Backward reachability from the accepting states, over the reversed table.
     */
    static BitSet coaccessible(FiniteAutomaton fa) {
        final CompactDFA<Symbol> dfa = fa.compiled();
        final int numStates = dfa.size();
        final int numInputs = fa.getAlphabet().size();

        // predecessor lists in CSR layout: preds of q are predData[predOfs[q] .. predOfs[q + 1])
        final int[] predOfs = new int[numStates + 1];
        for (int q = 0; q < numStates; q++) {
            for (int c = 0; c < numInputs; c++) {
                predOfs[dfa.getSuccessor(q, c) + 1]++;
            }
        }
        for (int q = 1; q <= numStates; q++) {
            predOfs[q] += predOfs[q - 1];
        }
        final int[] fill = predOfs.clone();
        final int[] predData = new int[numStates * numInputs];
        for (int q = 0; q < numStates; q++) {
            for (int c = 0; c < numInputs; c++) {
                predData[fill[dfa.getSuccessor(q, c)]++] = q;
            }
        }

        final BitSet visited = new BitSet(numStates);
        final Deque<Integer> stack = new ArrayDeque<>();
        for (int q = 0; q < numStates; q++) {
            if (dfa.isAccepting(q)) {
                visited.set(q);
                stack.push(q);
            }
        }
        while (!stack.isEmpty()) {
            int q = stack.pop();
            for (int idx = predOfs[q]; idx < predOfs[q + 1]; idx++) {
                int pred = predData[idx];
                if (!visited.get(pred)) {
                    visited.set(pred);
                    stack.push(pred);
                }
            }
        }
        return visited;
    }

    private static Set<State> toStates(FiniteAutomaton fa, BitSet ids) {
        final Set<State> result = new TreeSet<>();
        for (int q = ids.nextSetBit(0); q >= 0; q = ids.nextSetBit(q + 1)) {
            result.add(fa.stateAt(q));
        }
        return result;
    }
}
