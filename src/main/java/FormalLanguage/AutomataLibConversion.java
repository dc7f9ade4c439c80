package FormalLanguage;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import FormalLanguage.Model.State;
import FormalLanguage.Model.Symbol;
import FormalLanguage.Model.TransitionTable;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Conversion between {@link FiniteAutomaton} and AutomataLib's DFA types.
 */
public class AutomataLibConversion {
    static final String SINK = "sink";

    private AutomataLibConversion() {}

    /**
     * Copies the automaton into a fresh {@link CompactDFA}. State {@code i} of the result is the
     * {@code i}-th state of {@link FiniteAutomaton#getStates()}.
     */
    public static CompactDFA<Symbol> toCompactDFA(FiniteAutomaton fa) {
        final Alphabet<Symbol> alphabet = fa.getAlphabet();
        final CompactDFA<Symbol> out = new CompactDFA<>(alphabet, fa.getNumberOfStates());
        for (State q : fa.getStates()) {
            out.addState(fa.isAccepting(q));
        }
        out.setInitialState(fa.stateId(fa.getInitialState()));
        for (State q : fa.getStates()) {
            for (Symbol c : alphabet) {
                out.setTransition(fa.stateId(q), alphabet.getSymbolIndex(c), fa.stateId(fa.delta(q, c)));
            }
        }
        return out;
    }

    /**
     * Copies an AutomataLib DFA. States are named {@code q0, q1, ...} in the DFA's iteration order.
     * Undefined transitions of a partial DFA go to an extra rejecting state {@code sink}.
     * @throws IllegalArgumentException if the DFA has no initial state
     */
    public static <S> FiniteAutomaton fromDFA(DFA<S, Symbol> dfa, Alphabet<Symbol> alphabet) {
        final S init = dfa.getInitialState();
        if (init == null) {
            throw new IllegalArgumentException("DFA has no initial state");
        }

        final Map<S, State> names = new HashMap<>();
        for (S s : dfa.getStates()) {
            names.put(s, State.of("q" + names.size()));
        }

        final Set<State> accept = new HashSet<>();
        final TransitionTable.Builder table = TransitionTable.builder();
        final State sink = State.of(SINK);
        boolean partial = false;
        for (S s : dfa.getStates()) {
            final State q = names.get(s);
            if (dfa.isAccepting(s)) {
                accept.add(q);
            }
            for (Symbol c : alphabet) {
                final S succ = dfa.getSuccessor(s, c);
                if (succ == null) {
                    partial = true;
                    table.put(q, c, sink);
                } else {
                    table.put(q, c, names.get(succ));
                }
            }
        }

        final Set<State> states = new HashSet<>(names.values());
        if (partial) {
            states.add(sink);
            for (Symbol c : alphabet) {
                table.put(sink, c, sink);
            }
        }
        return AutomatonValidator.validate(states, new HashSet<>(alphabet), names.get(init), accept, table.build());
    }

    /**
     * Shortcut for {@link #fromDFA(DFA, Alphabet)} with the DFA's own alphabet.
     */
    public static FiniteAutomaton fromCompactDFA(CompactDFA<Symbol> dfa) {
        return fromDFA(dfa, dfa.getInputAlphabet());
    }
}
