package FormalLanguage;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.Optional;

import FormalLanguage.Model.Symbol;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Decision procedures on the languages of automata.
 */
public class LanguageQueries {
    private static final int UNVISITED = 0;
    private static final int ON_STACK = 1;
    private static final int DONE = 2;

    private LanguageQueries() {}

    public static boolean isEmpty(FiniteAutomaton fa) {
        return Reachability.isEmpty(fa);
    }

    /**
     * L(fa1) &sube; L(fa2), decided as emptiness of L(fa1) - L(fa2).
     */
    public static boolean subsetOf(FiniteAutomaton fa1, FiniteAutomaton fa2) {
        return isEmpty(ProductConstruction.difference(fa1, fa2));
    }

    public static boolean equivalent(FiniteAutomaton fa1, FiniteAutomaton fa2) {
        return subsetOf(fa1, fa2) && subsetOf(fa2, fa1);
    }

    /**
     * The language is finite iff no cycle runs through a state that is both reachable and
     * co-reachable.
     */
    public static boolean isFinite(FiniteAutomaton fa) {
        final CompactDFA<Symbol> dfa = fa.compiled();
        final int numInputs = fa.getAlphabet().size();
        final BitSet useful = Reachability.accessible(fa);
        useful.and(Reachability.coaccessible(fa));

        final int[] color = new int[dfa.size()];
        // iterative DFS; a frame is (state, next input to try)
        final Deque<int[]> stack = new ArrayDeque<>();
        for (int root = useful.nextSetBit(0); root >= 0; root = useful.nextSetBit(root + 1)) {
            if (color[root] != UNVISITED) {
                continue;
            }
            color[root] = ON_STACK;
            stack.push(new int[] {root, 0});
            while (!stack.isEmpty()) {
                final int[] frame = stack.peek();
                if (frame[1] == numInputs) {
                    color[frame[0]] = DONE;
                    stack.pop();
                    continue;
                }
                final int succ = dfa.getSuccessor(frame[0], frame[1]++);
                if (!useful.get(succ)) {
                    continue;
                }
                if (color[succ] == ON_STACK) {
                    return false;
                }
                if (color[succ] == UNVISITED) {
                    color[succ] = ON_STACK;
                    stack.push(new int[] {succ, 0});
                }
            }
        }
        return true;
    }

    /**
     * Breadth-first search for an accepted word. Inputs are tried in alphabet order, so the result
     * is the least of the shortest accepted words.
     * @return the word, or empty if the language is empty
     */
    public static Optional<String> getShortestString(FiniteAutomaton fa) {
        final CompactDFA<Symbol> dfa = fa.compiled();
        final Alphabet<Symbol> alphabet = fa.getAlphabet();
        final int numStates = dfa.size();

        final int[] parent = new int[numStates];
        final int[] via = new int[numStates];
        Arrays.fill(parent, -1);
        final BitSet visited = new BitSet(numStates);
        final Deque<Integer> queue = new ArrayDeque<>();

        final int init = dfa.getIntInitialState();
        visited.set(init);
        queue.add(init);
        while (!queue.isEmpty()) {
            final int q = queue.poll();
            if (dfa.isAccepting(q)) {
                final StringBuilder word = new StringBuilder();
                for (int s = q; s != init; s = parent[s]) {
                    word.append(alphabet.getSymbol(via[s]).getText());
                }
                return Optional.of(word.reverse().toString());
            }
            for (int c = 0; c < alphabet.size(); c++) {
                final int succ = dfa.getSuccessor(q, c);
                if (!visited.get(succ)) {
                    visited.set(succ);
                    parent[succ] = q;
                    via[succ] = c;
                    queue.add(succ);
                }
            }
        }
        return Optional.empty();
    }
}
