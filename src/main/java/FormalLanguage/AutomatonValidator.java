package FormalLanguage;

import java.util.Map;
import java.util.Set;

import FormalLanguage.Model.AutomatonNotWellDefinedException;
import FormalLanguage.Model.IllegalCharacterException;
import FormalLanguage.Model.State;
import FormalLanguage.Model.Symbol;
import FormalLanguage.Model.TransitionTable;

import static FormalLanguage.Model.AutomatonNotWellDefinedException.ACCEPT_NOT_IN_STATES;
import static FormalLanguage.Model.AutomatonNotWellDefinedException.INITIAL_NOT_IN_STATES;
import static FormalLanguage.Model.AutomatonNotWellDefinedException.NOT_TOTAL;
import static FormalLanguage.Model.AutomatonNotWellDefinedException.NULL_ARGUMENT;
import static FormalLanguage.Model.AutomatonNotWellDefinedException.STRAY_TRANSITION;
import static FormalLanguage.Model.AutomatonNotWellDefinedException.TARGET_NOT_IN_STATES;

/**
 * The only way into {@link FiniteAutomaton}. Checks run in a fixed order and the first failure
 * is thrown:
 * <ol>
 *     <li>reserved meta-character in the alphabet ({@link IllegalCharacterException})</li>
 *     <li>empty alphabet, or a symbol not exactly one character wide ({@link IllegalArgumentException})</li>
 *     <li>missing component</li>
 *     <li>initial state not in states</li>
 *     <li>accept states not in states</li>
 *     <li>transition function not total, or a target outside the states</li>
 *     <li>transition from an unknown state or on an unknown symbol</li>
 * </ol>
 * Checks 3 to 7 throw {@link AutomatonNotWellDefinedException}.
 */
public final class AutomatonValidator {

    private AutomatonValidator() {}

    public static FiniteAutomaton validate(Set<State> states,
                                           Set<Symbol> alphabet,
                                           State initial,
                                           Set<State> accept,
                                           TransitionTable transitions) {
        checkAlphabet(alphabet);
        checkPresent(states, alphabet, initial, accept, transitions);

        if (!states.contains(initial)) {
            throw new AutomatonNotWellDefinedException(INITIAL_NOT_IN_STATES, initial);
        }
        for (State a : accept) {
            if (!states.contains(a)) {
                throw new AutomatonNotWellDefinedException(ACCEPT_NOT_IN_STATES, a);
            }
        }

        for (State q : states) {
            for (Symbol c : alphabet) {
                State target = transitions.get(q, c);
                if (target == null) {
                    throw new AutomatonNotWellDefinedException(NOT_TOTAL, new TransitionTable.Key(q, c));
                }
                if (!states.contains(target)) {
                    throw new AutomatonNotWellDefinedException(TARGET_NOT_IN_STATES, target);
                }
            }
        }

        // Totality holds, so any extra key has an unknown source or symbol
        for (TransitionTable.Key key : transitions.keys()) {
            if (!states.contains(key.source()) || !alphabet.contains(key.symbol())) {
                throw new AutomatonNotWellDefinedException(STRAY_TRANSITION, key);
            }
        }

        return new FiniteAutomaton(states, alphabet, initial, accept, transitions);
    }

    private static void checkAlphabet(Set<Symbol> alphabet) {
        if (alphabet == null) {
            return; // reported as a missing component
        }
        for (Symbol c : alphabet) {
            if (c != null && c.isReserved()) {
                throw new IllegalCharacterException(c);
            }
        }
        if (alphabet.isEmpty()) {
            throw new IllegalArgumentException("Alphabet must not be empty");
        }
        for (Symbol c : alphabet) {
            if (c != null && c.width() != 1) {
                throw new IllegalArgumentException("Alphabet symbol must be one character wide: '" + c + "'");
            }
        }
    }

    private static void checkPresent(Set<State> states,
                                     Set<Symbol> alphabet,
                                     State initial,
                                     Set<State> accept,
                                     TransitionTable transitions) {
        if (states == null || alphabet == null || initial == null || accept == null || transitions == null) {
            throw new AutomatonNotWellDefinedException(NULL_ARGUMENT);
        }
        // iterate rather than contains(null): immutable sets reject null queries
        for (State q : states) {
            if (q == null) {
                throw new AutomatonNotWellDefinedException(NULL_ARGUMENT, "states");
            }
        }
        for (Symbol c : alphabet) {
            if (c == null) {
                throw new AutomatonNotWellDefinedException(NULL_ARGUMENT, "alphabet");
            }
        }
        for (State a : accept) {
            if (a == null) {
                throw new AutomatonNotWellDefinedException(NULL_ARGUMENT, "accept");
            }
        }
        for (Map.Entry<TransitionTable.Key, State> e : transitions.asMap().entrySet()) {
            if (e.getKey().source() == null || e.getKey().symbol() == null || e.getValue() == null) {
                throw new AutomatonNotWellDefinedException(NULL_ARGUMENT, "transitions");
            }
        }
    }
}
