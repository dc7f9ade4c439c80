package FormalLanguage.Model;

import java.util.Objects;
import java.util.Set;

/**
 * One element of an input alphabet.
 * <p>
 * A symbol is only a value: {@link #of(String)} accepts any text, and it is up to
 * {@link FormalLanguage.AutomatonValidator} to reject reserved or multi-character symbols
 * when an automaton is built.
 */
public final class Symbol implements Comparable<Symbol> {
    /**
     * Meta-characters kept free for a regular expression representation.
     */
    public static final Set<Character> RESERVED = Set.of('#', '%', '+', '*', '(', ')');

    private final String text;

    private Symbol(String text) {
        this.text = text;
    }

    public static Symbol of(String text) {
        return new Symbol(Objects.requireNonNull(text, "symbol text"));
    }

    public static Symbol of(char c) {
        return new Symbol(String.valueOf(c));
    }

    public String getText() {
        return text;
    }

    public int width() {
        return text.length();
    }

    /**
     * True for a single reserved meta-character. Longer texts are never reserved, they fail the
     * width check instead.
     */
    public boolean isReserved() {
        return text.length() == 1 && RESERVED.contains(text.charAt(0));
    }

    @Override
    public int compareTo(Symbol o) {
        return text.compareTo(o.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Symbol)) {
            return false;
        }
        return text.equals(((Symbol) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
