package FormalLanguage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;

import FormalLanguage.Model.Cancellation;
import FormalLanguage.Model.State;
import FormalLanguage.Model.Symbol;
import FormalLanguage.Model.TransitionTable;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boolean combinations of two automata over the same alphabet via the cross product of their
 * state sets. The product state of (q, r) is {@link State#pair(State, State)}.
 * <p>
 * The result always has |Q1| * |Q2| states; use {@link Reachability#removeUnreachableStates} or
 * {@link Minimizer} for a compact automaton.
 */
public class ProductConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(ProductConstruction.class);

    private ProductConstruction() {}

    public static FiniteAutomaton intersection(FiniteAutomaton fa1, FiniteAutomaton fa2) {
        return merge(fa1, fa2, (q, r) -> fa1.isAccepting(q) && fa2.isAccepting(r));
    }

    public static FiniteAutomaton union(FiniteAutomaton fa1, FiniteAutomaton fa2) {
        return merge(fa1, fa2, (q, r) -> fa1.isAccepting(q) || fa2.isAccepting(r));
    }

    /**
     * Language of {@code fa1} minus the language of {@code fa2}.
     */
    public static FiniteAutomaton difference(FiniteAutomaton fa1, FiniteAutomaton fa2) {
        return merge(fa1, fa2, (q, r) -> fa1.isAccepting(q) && !fa2.isAccepting(r));
    }

    public static FiniteAutomaton symmetricDifference(FiniteAutomaton fa1, FiniteAutomaton fa2) {
        return merge(fa1, fa2, (q, r) -> fa1.isAccepting(q) != fa2.isAccepting(r));
    }

    public static FiniteAutomaton merge(FiniteAutomaton fa1, FiniteAutomaton fa2,
                                        BiPredicate<State, State> acceptPredicate) {
        return merge(fa1, fa2, acceptPredicate, new Cancellation());
    }

    /**
     * Product automaton whose accepting states are the pairs satisfying {@code acceptPredicate}.
     * @param fa1 - left operand
     * @param fa2 - right operand
     * @param acceptPredicate - decides acceptance of pair (q, r) from q in fa1 and r in fa2
     * @param cancellation - checked once per product state
     * @return - the (unpruned) product automaton
     * @throws IllegalArgumentException if the alphabets differ, or the product has more than
     *         {@link Integer#MAX_VALUE} states
     * @throws java.util.concurrent.CancellationException if cancelled or above the state threshold
     */
    public static FiniteAutomaton merge(FiniteAutomaton fa1, FiniteAutomaton fa2,
                                        BiPredicate<State, State> acceptPredicate, Cancellation cancellation) {
        final Set<Symbol> symbols = fa1.symbols();
        if (!symbols.equals(fa2.symbols())) {
            throw new IllegalArgumentException("Alphabets differ: " + symbols + " vs. " + fa2.symbols());
        }

        final CompactDFA<Symbol> dfa1 = fa1.compiled();
        final CompactDFA<Symbol> dfa2 = fa2.compiled();
        final Alphabet<Symbol> alphabet = fa1.getAlphabet();
        final int n1 = fa1.getNumberOfStates();
        final int n2 = fa2.getNumberOfStates();
        final int size = productSize(n1, n2);

        // pair (i, j) lives at index i * n2 + j
        final List<State> pairs = new ArrayList<>(size);
        for (int i = 0; i < n1; i++) {
            for (int j = 0; j < n2; j++) {
                pairs.add(State.pair(fa1.stateAt(i), fa2.stateAt(j)));
            }
        }

        final Set<State> accept = new HashSet<>();
        final TransitionTable.Builder table = TransitionTable.builder();
        for (int i = 0; i < n1; i++) {
            for (int j = 0; j < n2; j++) {
                final int idx = i * n2 + j;
                cancellation.check(idx + 1);
                final State pair = pairs.get(idx);
                if (acceptPredicate.test(fa1.stateAt(i), fa2.stateAt(j))) {
                    accept.add(pair);
                }
                for (int c = 0; c < alphabet.size(); c++) {
                    final Symbol sym = alphabet.getSymbol(c);
                    final int succ = dfa1.getSuccessor(i, fa1.symbolIndex(sym)) * n2 + dfa2.getSuccessor(j, fa2.symbolIndex(sym));
                    table.put(pair, sym, pairs.get(succ));
                }
            }
        }

        final State initial = State.pair(fa1.getInitialState(), fa2.getInitialState());
        LOG.debug("Product of {} x {} states, {} accepting", n1, n2, accept.size());
        return AutomatonValidator.validate(new HashSet<>(pairs), symbols, initial, accept, table.build());
    }

    private static int productSize(int n1, int n2) {
        try {
            return Math.multiplyExact(n1, n2);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Product of " + n1 + " x " + n2 + " states is too large", e);
        }
    }
}
