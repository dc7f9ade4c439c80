package FormalLanguage;

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;

import FormalLanguage.Model.Cancellation;
import FormalLanguage.Model.State;
import FormalLanguage.Model.Symbol;
import FormalLanguage.Model.TransitionTable;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table-filling (Myhill-Nerode) minimization.
 * <p>
 * Unreachable states are pruned first. Two states are distinguishable if exactly one accepts, or
 * if some symbol leads them to a distinguishable pair; passes over all pairs repeat until one adds
 * no mark. Each class of indistinguishable states is represented by its least state.
 */
public class Minimizer {
    private static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);

    private Minimizer() {}

    public static FiniteAutomaton minimize(FiniteAutomaton fa) {
        return minimize(fa, new Cancellation());
    }

    /**
     * @param cancellation - stops the minimization once interrupted, or up front if the automaton
     *        has more reachable states than its threshold
     * @throws java.util.concurrent.CancellationException if cancelled
     */
    public static FiniteAutomaton minimize(FiniteAutomaton fa, Cancellation cancellation) {
        final FiniteAutomaton pruned = Reachability.removeUnreachableStates(fa);
        final int[] representative = equivalenceClasses(pruned, cancellation);
        final int numStates = pruned.getNumberOfStates();

        final Set<State> states = new HashSet<>();
        final Set<State> accept = new HashSet<>();
        final TransitionTable.Builder table = TransitionTable.builder();
        for (int q = 0; q < numStates; q++) {
            if (representative[q] != q) {
                continue;
            }
            final State rep = pruned.stateAt(q);
            states.add(rep);
            if (pruned.isAccepting(rep)) {
                accept.add(rep);
            }
            for (Symbol c : pruned.getAlphabet()) {
                final int succ = pruned.stateId(pruned.delta(rep, c));
                table.put(rep, c, pruned.stateAt(representative[succ]));
            }
        }
        final State initial = pruned.stateAt(representative[pruned.stateId(pruned.getInitialState())]);

        LOG.debug("Minimized {} states ({} reachable) to {}", fa.getNumberOfStates(), numStates, states.size());
        return AutomatonValidator.validate(states, pruned.symbols(), initial, accept, table.build());
    }

    /**
     * Computes, for every state id, the least state id of its equivalence class.
     * @param fa - automaton whose states are all reachable
     * @param cancellation - its threshold bounds the number of states refined; checked before the
     *        table is allocated and again on every pass
     * @return - representative state id, indexed by state id
     */
    static int[] equivalenceClasses(FiniteAutomaton fa, Cancellation cancellation) {
        final CompactDFA<Symbol> dfa = fa.compiled();
        final int numStates = dfa.size();
        final int numInputs = fa.getAlphabet().size();
        cancellation.check(numStates);

        // upper triangle: pair {p, q} with p < q is bit q - p - 1 of marked[p]
        final BitSet[] marked = new BitSet[numStates];
        for (int p = 0; p < numStates; p++) {
            marked[p] = new BitSet(numStates - p - 1);
            for (int q = p + 1; q < numStates; q++) {
                if (dfa.isAccepting(p) != dfa.isAccepting(q)) {
                    marked[p].set(q - p - 1);
                }
            }
        }

        int passes = 0;
        boolean changed = true;
        while (changed) {
            cancellation.check(numStates);
            changed = false;
            passes++;
            for (int p = 0; p < numStates; p++) {
                final BitSet row = marked[p];
                for (int q = p + 1; q < numStates; q++) {
                    if (row.get(q - p - 1)) {
                        continue;
                    }
                    for (int c = 0; c < numInputs; c++) {
                        final int sp = dfa.getSuccessor(p, c);
                        final int sq = dfa.getSuccessor(q, c);
                        if (sp != sq && isMarked(marked, sp, sq)) {
                            row.set(q - p - 1);
                            changed = true;
                            break;
                        }
                    }
                }
            }
        }

        final int[] representative = new int[numStates];
        Arrays.fill(representative, -1);
        for (int p = 0; p < numStates; p++) {
            if (representative[p] >= 0) {
                continue;
            }
            representative[p] = p;
            for (int q = p + 1; q < numStates; q++) {
                if (representative[q] < 0 && !marked[p].get(q - p - 1)) {
                    representative[q] = p;
                }
            }
        }
        LOG.debug("Distinguishability fixpoint after {} passes", passes);
        return representative;
    }

    private static boolean isMarked(BitSet[] marked, int p, int q) {
        return p < q ? marked[p].get(q - p - 1) : marked[q].get(p - q - 1);
    }
}
