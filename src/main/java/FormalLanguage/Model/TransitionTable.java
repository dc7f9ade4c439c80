package FormalLanguage.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping from (state, symbol) to the successor state. Nothing here checks that the
 * table is total or consistent with a state set; that is the validator's job.
 */
public final class TransitionTable {
    private final Map<Key, State> entries;

    private TransitionTable(Map<Key, State> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TransitionTable copyOf(Map<Key, State> entries) {
        return new TransitionTable(new LinkedHashMap<>(entries));
    }

    /**
     * @return the successor, or {@code null} if there is no entry
     */
    public State get(State source, Symbol symbol) {
        return entries.get(new Key(source, symbol));
    }

    public boolean contains(State source, Symbol symbol) {
        return entries.containsKey(new Key(source, symbol));
    }

    public Set<Key> keys() {
        return entries.keySet();
    }

    public Map<Key, State> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return a builder pre-filled with this table's entries
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.entries.putAll(entries);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TransitionTable && entries.equals(((TransitionTable) o).entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        String sep = "";
        for (Map.Entry<Key, State> e : entries.entrySet()) {
            sb.append(sep).append(e.getKey()).append("->").append(e.getValue());
            sep = ", ";
        }
        return sb.append('}').toString();
    }

    public record Key(State source, Symbol symbol) {

        @Override
        public String toString() {
            return source + "-" + symbol;
        }
    }

    public static final class Builder {
        private final Map<Key, State> entries = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Inserts or overwrites the entry for (source, symbol).
         */
        public Builder put(State source, Symbol symbol, State target) {
            entries.put(new Key(source, symbol), target);
            return this;
        }

        public Builder put(String source, String symbol, String target) {
            return put(State.of(source), Symbol.of(symbol), State.of(target));
        }

        public Builder remove(State source, Symbol symbol) {
            entries.remove(new Key(source, symbol));
            return this;
        }

        public TransitionTable build() {
            return new TransitionTable(new LinkedHashMap<>(entries));
        }

        @Override
        public String toString() {
            return Objects.toString(entries);
        }
    }
}
