package FormalLanguage;

import FormalLanguage.Model.Symbol;

public class Fixtures {
    /**
     * Accepts all words over {0,1} ending in 11.
     */
    public static FiniteAutomaton endsIn11() {
        return endsIn11Builder().build();
    }

    public static FiniteAutomaton.Builder endsIn11Builder() {
        return FiniteAutomaton.builder()
            .states("a", "b", "c")
            .alphabet("0", "1")
            .initial("a")
            .accept("c")
            .addTransition("a", "0", "a").addTransition("a", "1", "b")
            .addTransition("b", "0", "a").addTransition("b", "1", "c")
            .addTransition("c", "0", "a").addTransition("c", "1", "c");
    }

    /**
     * Accepts words over {0,1} ending in 01.
     */
    public static FiniteAutomaton endsIn01() {
        return FiniteAutomaton.builder()
            .states("a", "b", "c")
            .alphabet("0", "1")
            .initial("a")
            .accept("c")
            .addTransition("a", "0", "b").addTransition("a", "1", "a")
            .addTransition("b", "0", "b").addTransition("b", "1", "c")
            .addTransition("c", "0", "b").addTransition("c", "1", "a")
            .build();
    }

    /**
     * Accepts words over {0,1} of odd length.
     */
    public static FiniteAutomaton oddLength() {
        return FiniteAutomaton.builder()
            .states("r", "s")
            .alphabet("0", "1")
            .initial("r")
            .accept("s")
            .addTransition("r", "0", "s").addTransition("r", "1", "s")
            .addTransition("s", "0", "r").addTransition("s", "1", "r")
            .build();
    }

    /**
     * Ten reachable states over {a,b} with a five state minimal equivalent.
     */
    public static FiniteAutomaton tenStates() {
        return FiniteAutomaton.builder()
            .states("0", "1", "2", "3", "4", "5", "6", "7", "8", "9")
            .alphabet("a", "b")
            .initial("0")
            .accept("3", "4", "8", "9")
            .addTransition("0", "a", "1").addTransition("0", "b", "9")
            .addTransition("1", "a", "8").addTransition("1", "b", "2")
            .addTransition("2", "a", "3").addTransition("2", "b", "2")
            .addTransition("3", "a", "2").addTransition("3", "b", "4")
            .addTransition("4", "a", "5").addTransition("4", "b", "8")
            .addTransition("5", "a", "4").addTransition("5", "b", "5")
            .addTransition("6", "a", "7").addTransition("6", "b", "5")
            .addTransition("7", "a", "6").addTransition("7", "b", "5")
            .addTransition("8", "a", "1").addTransition("8", "b", "3")
            .addTransition("9", "a", "7").addTransition("9", "b", "8")
            .build();
    }

    public static FiniteAutomaton tenStatesMinimal() {
        return FiniteAutomaton.builder()
            .states("0", "9", "7", "1", "3")
            .alphabet("a", "b")
            .initial("0")
            .accept("3", "9")
            .addTransition("0", "a", "1").addTransition("0", "b", "9")
            .addTransition("9", "a", "7").addTransition("9", "b", "3")
            .addTransition("7", "a", "7").addTransition("7", "b", "1")
            .addTransition("1", "a", "3").addTransition("1", "b", "1")
            .addTransition("3", "a", "1").addTransition("3", "b", "3")
            .build();
    }

    /**
     * A single-symbol cycle s0 -> s1 -> ... -> s(size-1) -> s0 where every state accepts.
     */
    public static FiniteAutomaton acceptingCycle(int size) {
        FiniteAutomaton.Builder builder = FiniteAutomaton.builder().alphabet("0").initial(RandomAutomata.state(0));
        for (int q = 0; q < size; q++) {
            builder.addState(RandomAutomata.state(q))
                .addAcceptState(RandomAutomata.state(q))
                .addTransition(RandomAutomata.state(q), Symbol.of('0'), RandomAutomata.state((q + 1) % size));
        }
        return builder.build();
    }
}
