package FormalLanguage;

import java.util.Random;

import FormalLanguage.Model.State;
import FormalLanguage.Model.Symbol;

public class RandomAutomata {
    /**
     * Generate a random complete DFA. Every (state, symbol) pair gets a uniformly chosen target,
     * so the result is usually not connected; state {@code s0} is initial.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param ad
     *      acceptance density, in [0,1]. 0.5 is the usual value
     * @param symbols
     *      alphabet, one character per symbol
     * @return
     *      a random DFA with states s0 .. s(size-1)
     */
    public static FiniteAutomaton generateDFA(Random r, int size, float ad, String symbols) {
        assert size > 0;
        FiniteAutomaton.Builder builder = FiniteAutomaton.builder().initial(state(0));
        for (int i = 0; i < symbols.length(); i++) {
            builder.addSymbol(Symbol.of(symbols.charAt(i)));
        }
        for (int q = 0; q < size; q++) {
            builder.addState(state(q));
            if (r.nextFloat() < ad) {
                builder.addAcceptState(state(q));
            }
            for (int i = 0; i < symbols.length(); i++) {
                builder.addTransition(state(q), Symbol.of(symbols.charAt(i)), state(r.nextInt(size)));
            }
        }
        return builder.build();
    }

    public static FiniteAutomaton getRandomAutomaton(int randomSeed, int size) {
        return generateDFA(new Random(randomSeed), size, 0.5f, "01");
    }

    static State state(int i) {
        return State.of("s" + i);
    }
}
