package FormalLanguage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import FormalLanguage.Model.IllegalCharacterException;
import FormalLanguage.Model.State;
import FormalLanguage.Model.Symbol;
import FormalLanguage.Model.TransitionTable;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * A validated deterministic finite automaton (Q, &Sigma;, q0, A, &delta;).
 * <p>
 * Instances are immutable and can only be obtained through {@link AutomatonValidator}, either via
 * {@link #of}, a {@link Builder}, or as the result of an operation on another automaton. The
 * transition function is therefore total, and {@link #delta} only fails on symbols outside the
 * alphabet or unknown states.
 * <p>
 * States are numbered by their position in {@link State} order; the numbering is the state id of
 * the backing {@link CompactDFA}.
 */
public final class FiniteAutomaton {
    private final SortedSet<State> states;
    private final Alphabet<Symbol> alphabet;
    private final State initial;
    private final SortedSet<State> accept;
    private final TransitionTable transitions;

    private final List<State> stateList;
    private final Object2IntMap<State> stateIds;
    private final CompactDFA<Symbol> compiled;

    FiniteAutomaton(Set<State> states, Set<Symbol> alphabet, State initial, Set<State> accept,
                    TransitionTable transitions) {
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        this.alphabet = Alphabets.fromCollection(new TreeSet<>(alphabet));
        this.initial = initial;
        this.accept = Collections.unmodifiableSortedSet(new TreeSet<>(accept));
        this.transitions = transitions;

        this.stateList = List.copyOf(this.states);
        this.stateIds = new Object2IntOpenHashMap<>(stateList.size());
        this.stateIds.defaultReturnValue(-1);
        for (int i = 0; i < stateList.size(); i++) {
            stateIds.put(stateList.get(i), i);
        }
        this.compiled = compile();
    }

    private CompactDFA<Symbol> compile() {
        final CompactDFA<Symbol> out = new CompactDFA<>(alphabet, stateList.size());
        for (State q : stateList) {
            out.addState(accept.contains(q));
        }
        out.setInitialState(stateIds.getInt(initial));
        for (int q = 0; q < stateList.size(); q++) {
            for (int c = 0; c < alphabet.size(); c++) {
                State target = transitions.get(stateList.get(q), alphabet.getSymbol(c));
                out.setTransition(q, c, stateIds.getInt(target));
            }
        }
        return out;
    }

    public static FiniteAutomaton of(Set<State> states, Set<Symbol> alphabet, State initial, Set<State> accept,
                                     TransitionTable transitions) {
        return AutomatonValidator.validate(states, alphabet, initial, accept, transitions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<State> getStates() {
        return states;
    }

    public Alphabet<Symbol> getAlphabet() {
        return alphabet;
    }

    public State getInitialState() {
        return initial;
    }

    public Set<State> getAcceptStates() {
        return accept;
    }

    public TransitionTable getTransitions() {
        return transitions;
    }

    public int getNumberOfStates() {
        return states.size();
    }

    public boolean isAccepting(State q) {
        return accept.contains(q);
    }

    /**
     * Single-step transition.
     * @throws IllegalCharacterException if {@code c} is not in the alphabet
     * @throws IllegalArgumentException if {@code q} is not a state of this automaton
     */
    public State delta(State q, Symbol c) {
        final int input = symbolIndex(c);
        return stateList.get(compiled.getSuccessor(stateId(q), input));
    }

    public State delta(String q, String c) {
        return delta(State.of(q), Symbol.of(c));
    }

    /**
     * Runs {@code word} from {@code q}.
     * @throws IllegalCharacterException on the first symbol outside the alphabet
     */
    public State deltaStar(State q, List<Symbol> word) {
        int current = stateId(q);
        for (Symbol c : word) {
            current = compiled.getSuccessor(current, symbolIndex(c));
        }
        return stateList.get(current);
    }

    /**
     * Runs {@code word} from {@code q}, reading one symbol per character.
     */
    public State deltaStar(State q, String word) {
        return deltaStar(q, toSymbols(word));
    }

    public boolean accepts(List<Symbol> word) {
        return accept.contains(deltaStar(initial, word));
    }

    public boolean accepts(String word) {
        return accepts(toSymbols(word));
    }

    /**
     * Returns a copy of this automaton with the transition (q, c) set to p.
     * @throws IllegalCharacterException if {@code c} is not in the alphabet
     * @throws FormalLanguage.Model.AutomatonNotWellDefinedException if {@code q} or {@code p} is
     *         not a state
     */
    public FiniteAutomaton withTransition(State q, Symbol c, State p) {
        if (!alphabet.containsSymbol(c)) {
            throw new IllegalCharacterException(c);
        }
        TransitionTable table = transitions.toBuilder().put(q, c, p).build();
        return AutomatonValidator.validate(states, symbols(), initial, accept, table);
    }

    public FiniteAutomaton withTransition(String q, String c, String p) {
        return withTransition(State.of(q), Symbol.of(c), State.of(p));
    }

    /**
     * Same automaton with accepting and rejecting states swapped.
     */
    public FiniteAutomaton complement() {
        Set<State> newAccept = new TreeSet<>(states);
        newAccept.removeAll(accept);
        return AutomatonValidator.validate(states, symbols(), initial, newAccept, transitions);
    }

    public FiniteAutomaton intersection(FiniteAutomaton fa) {
        return ProductConstruction.intersection(this, fa);
    }

    public FiniteAutomaton union(FiniteAutomaton fa) {
        return ProductConstruction.union(this, fa);
    }

    public FiniteAutomaton minus(FiniteAutomaton fa) {
        return ProductConstruction.difference(this, fa);
    }

    public Set<State> findReachableStates() {
        return Reachability.findReachableStates(this);
    }

    public FiniteAutomaton removeUnreachableStates() {
        return Reachability.removeUnreachableStates(this);
    }

    public FiniteAutomaton minimize() {
        return Minimizer.minimize(this);
    }

    public boolean isEmpty() {
        return Reachability.isEmpty(this);
    }

    public boolean isFinite() {
        return LanguageQueries.isFinite(this);
    }

    public boolean subsetOf(FiniteAutomaton fa) {
        return LanguageQueries.subsetOf(this, fa);
    }

    /**
     * Language equality. {@link #equals(Object)} compares the 5-tuples instead.
     */
    public boolean equivalentTo(FiniteAutomaton fa) {
        return LanguageQueries.equivalent(this, fa);
    }

    public Optional<String> getShortestString() {
        return LanguageQueries.getShortestString(this);
    }

    /**
     * @return the alphabet as a plain sorted set, for rebuilding automata
     */
    Set<Symbol> symbols() {
        return new TreeSet<>((Collection<Symbol>) alphabet);
    }

    /**
     * @return the state with id {@code id} in the compiled table
     */
    State stateAt(int id) {
        return stateList.get(id);
    }

    int stateId(State q) {
        int id = stateIds.getInt(q);
        if (id < 0) {
            throw new IllegalArgumentException("Unknown state: " + q);
        }
        return id;
    }

    int symbolIndex(Symbol c) {
        if (c == null || !alphabet.containsSymbol(c)) {
            throw new IllegalCharacterException(c);
        }
        return alphabet.getSymbolIndex(c);
    }

    CompactDFA<Symbol> compiled() {
        return compiled;
    }

    private static List<Symbol> toSymbols(String word) {
        List<Symbol> symbols = new ArrayList<>(word.length());
        for (int i = 0; i < word.length(); i++) {
            symbols.add(Symbol.of(word.charAt(i)));
        }
        return symbols;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FiniteAutomaton)) {
            return false;
        }
        FiniteAutomaton other = (FiniteAutomaton) o;
        return states.equals(other.states)
            && symbols().equals(other.symbols())
            && initial.equals(other.initial)
            && accept.equals(other.accept)
            && transitions.asMap().equals(other.transitions.asMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, symbols(), initial, accept, transitions.asMap());
    }

    @Override
    public String toString() {
        return "FiniteAutomaton(Q=" + states + ", Sigma=" + symbols() + ", q0=" + initial + ", A=" + accept
            + ", delta=" + transitions + ")";
    }

    /**
     * Collects the five components; nothing is checked until {@link #build()}.
     */
    public static final class Builder {
        private final Set<State> states = new LinkedHashSet<>();
        private final Set<Symbol> alphabet = new LinkedHashSet<>();
        private final Set<State> accept = new LinkedHashSet<>();
        private final TransitionTable.Builder transitions = TransitionTable.builder();
        private State initial;

        private Builder() {}

        public Builder states(Collection<State> states) {
            this.states.addAll(states);
            return this;
        }

        public Builder states(String... names) {
            for (String name : names) {
                addState(State.of(name));
            }
            return this;
        }

        public Builder addState(State q) {
            states.add(q);
            return this;
        }

        public Builder alphabet(Collection<Symbol> symbols) {
            alphabet.addAll(symbols);
            return this;
        }

        public Builder alphabet(String... symbols) {
            for (String s : symbols) {
                addSymbol(Symbol.of(s));
            }
            return this;
        }

        public Builder addSymbol(Symbol c) {
            alphabet.add(c);
            return this;
        }

        public Builder initial(State q) {
            this.initial = q;
            return this;
        }

        public Builder initial(String name) {
            return initial(State.of(name));
        }

        public Builder accept(Collection<State> states) {
            accept.addAll(states);
            return this;
        }

        public Builder accept(String... names) {
            for (String name : names) {
                addAcceptState(State.of(name));
            }
            return this;
        }

        public Builder addAcceptState(State q) {
            accept.add(q);
            return this;
        }

        public Builder addTransition(State q, Symbol c, State p) {
            transitions.put(q, c, p);
            return this;
        }

        public Builder addTransition(String q, String c, String p) {
            transitions.put(q, c, p);
            return this;
        }

        public FiniteAutomaton build() {
            return AutomatonValidator.validate(new HashSet<>(states), new HashSet<>(alphabet), initial,
                new HashSet<>(accept), transitions.build());
        }
    }
}
