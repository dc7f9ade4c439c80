package FormalLanguage;

import FormalLanguage.Model.AutomatonNotWellDefinedException;
import FormalLanguage.Model.IllegalCharacterException;
import FormalLanguage.Model.State;
import FormalLanguage.Model.Symbol;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertThrowsExactly;

public class FiniteAutomatonTest {
  @Test
  void testNumberOfStates() {
    FiniteAutomaton fa = Fixtures.endsIn11();
    Assertions.assertEquals(3, fa.getNumberOfStates());
    Assertions.assertEquals(State.of("a"), fa.getInitialState());
    Assertions.assertEquals(2, fa.getAlphabet().size());
    Assertions.assertEquals(6, fa.getTransitions().size());
  }

  @Test
  void testDelta() {
    FiniteAutomaton fa = Fixtures.endsIn11();
    Assertions.assertEquals(State.of("c"), fa.delta("b", "1"));
    Assertions.assertEquals(State.of("a"), fa.delta(State.of("c"), Symbol.of('0')));

    // symbol is checked before the state
    IllegalCharacterException e = assertThrowsExactly(IllegalCharacterException.class, () -> fa.delta("d", "2"));
    Assertions.assertEquals(Symbol.of("2"), e.getCharacter());
    assertThrowsExactly(IllegalArgumentException.class, () -> fa.delta("d", "0"));
  }

  @Test
  void testDeltaStar() {
    FiniteAutomaton fa = Fixtures.endsIn11();
    Assertions.assertEquals(State.of("c"), fa.deltaStar(State.of("a"), "10111"));
    Assertions.assertEquals(State.of("b"), fa.deltaStar(State.of("c"), "01"));
    Assertions.assertEquals(State.of("b"), fa.deltaStar(State.of("b"), ""));
    assertThrowsExactly(IllegalCharacterException.class, () -> fa.deltaStar(State.of("a"), "1012"));
  }

  @Test
  void testAccepts() {
    FiniteAutomaton fa = Fixtures.endsIn11();
    Assertions.assertTrue(fa.accepts("10111"));
    Assertions.assertFalse(fa.accepts("10110"));
    Assertions.assertFalse(fa.accepts(""));
    Assertions.assertTrue(fa.accepts(List.of(Symbol.of('1'), Symbol.of('1'))));
    assertThrowsExactly(IllegalCharacterException.class, () -> fa.accepts("11a"));

    // pure: same answer every time
    for (int i = 0; i < 3; i++) {
      Assertions.assertTrue(fa.accepts("0011"));
    }
  }

  @Test
  void testComplement() {
    FiniteAutomaton fa = Fixtures.endsIn11();
    FiniteAutomaton comp = fa.complement();
    Assertions.assertTrue(comp.accepts("10110"));
    Assertions.assertFalse(comp.accepts("10111"));
    Assertions.assertEquals(fa.getStates(), comp.getStates());
    Assertions.assertEquals(fa.getTransitions(), comp.getTransitions());
    Assertions.assertEquals(fa, comp.complement());

    for (String w : Words.upTo("01", 6)) {
      Assertions.assertNotEquals(fa.accepts(w), comp.accepts(w), w);
    }
  }

  @Test
  void testWithTransition() {
    FiniteAutomaton fa = Fixtures.endsIn11();
    FiniteAutomaton changed = fa.withTransition("a", "0", "b");
    Assertions.assertTrue(changed.accepts("01"));
    Assertions.assertFalse(fa.accepts("01")); // fa itself is unchanged

    assertThrowsExactly(IllegalCharacterException.class, () -> fa.withTransition("d", "2", "d"));
    AutomatonNotWellDefinedException e =
        assertThrowsExactly(AutomatonNotWellDefinedException.class, () -> fa.withTransition("d", "0", "d"));
    Assertions.assertEquals(AutomatonNotWellDefinedException.STRAY_TRANSITION, e.getReason());
    e = assertThrowsExactly(AutomatonNotWellDefinedException.class, () -> fa.withTransition("a", "0", "d"));
    Assertions.assertEquals(AutomatonNotWellDefinedException.TARGET_NOT_IN_STATES, e.getReason());
  }

  @Test
  void testTotality() {
    for (int seed = 0; seed < 20; seed++) {
      FiniteAutomaton fa = RandomAutomata.generateDFA(new Random(seed), 6, 0.5f, "abc");
      for (State q : fa.getStates()) {
        for (Symbol c : fa.getAlphabet()) {
          Assertions.assertTrue(fa.getStates().contains(fa.delta(q, c)));
        }
      }
    }
  }

  @Test
  void testStructuralEquality() {
    FiniteAutomaton fa1 = Fixtures.endsIn11();
    FiniteAutomaton fa2 = Fixtures.endsIn11();
    Assertions.assertEquals(fa1, fa2);
    Assertions.assertEquals(fa1.hashCode(), fa2.hashCode());
    Assertions.assertNotEquals(fa1, fa1.complement());

    // same language, different tuple
    FiniteAutomaton padded = Fixtures.endsIn11Builder()
        .states("d").addTransition("d", "0", "d").addTransition("d", "1", "d").build();
    Assertions.assertNotEquals(fa1, padded);
    Assertions.assertTrue(fa1.equivalentTo(padded));
  }

  @Test
  void testConvenienceMethods() {
    FiniteAutomaton fa = Fixtures.endsIn11();
    Assertions.assertFalse(fa.isEmpty());
    Assertions.assertFalse(fa.isFinite());
    Assertions.assertEquals("11", fa.getShortestString().orElseThrow());
    Assertions.assertEquals(3, fa.minimize().getNumberOfStates());
    Assertions.assertEquals(fa, fa.removeUnreachableStates());
    Assertions.assertTrue(fa.subsetOf(fa.union(Fixtures.oddLength())));
    Assertions.assertTrue(fa.toString().startsWith("FiniteAutomaton(Q=[a, b, c]"));
  }
}
