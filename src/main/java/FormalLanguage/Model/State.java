package FormalLanguage.Model;

import java.util.Objects;

/**
 * Opaque state identifier. A state is either named, or a pair of two states created by
 * product construction. Pairs compare structurally, so {@code pair(a, bc)} and
 * {@code pair(ab, c)} stay distinct.
 */
public final class State implements Comparable<State> {
    private final String name;
    private final State left;
    private final State right;
    private final int hashCode;

    private State(String name, State left, State right) {
        this.name = name;
        this.left = left;
        this.right = right;
        this.hashCode = name != null ? name.hashCode() : 31 * left.hashCode() + right.hashCode() + 17;
    }

    public static State of(String name) {
        return new State(Objects.requireNonNull(name, "state name"), null, null);
    }

    public static State pair(State left, State right) {
        return new State(null, Objects.requireNonNull(left, "left state"), Objects.requireNonNull(right, "right state"));
    }

    public boolean isPair() {
        return name == null;
    }

    /**
     * @return the name of a named state; {@code null} for a pair
     */
    public String getName() {
        return name;
    }

    public State getLeft() {
        return left;
    }

    public State getRight() {
        return right;
    }

    /**
     * Named states sort before pairs; pairs sort by left, then right component.
     */
    @Override
    public int compareTo(State o) {
        if (this == o) {
            return 0;
        }
        if (isPair() != o.isPair()) {
            return isPair() ? 1 : -1;
        }
        if (!isPair()) {
            return name.compareTo(o.name);
        }
        int c = left.compareTo(o.left);
        return c != 0 ? c : right.compareTo(o.right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof State)) {
            return false;
        }
        State other = (State) o;
        if (hashCode != other.hashCode) {
            return false;
        }
        return Objects.equals(name, other.name)
            && Objects.equals(left, other.left)
            && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return isPair() ? "(" + left + "," + right + ")" : name;
    }
}
