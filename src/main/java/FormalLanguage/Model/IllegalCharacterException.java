package FormalLanguage.Model;

/**
 * Thrown when a symbol outside an automaton's alphabet is used, or when an alphabet contains a
 * reserved meta-character.
 */
public class IllegalCharacterException extends IllegalArgumentException {
    private final transient Symbol character;

    public IllegalCharacterException(Symbol character) {
        super("Illegal character: " + character);
        this.character = character;
    }

    public Symbol getCharacter() {
        return character;
    }
}
