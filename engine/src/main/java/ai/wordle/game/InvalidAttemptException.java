package ai.wordle.game;

/**
 * Thrown when a guess/feedback pair is malformed: mismatched lengths, an unknown feedback
 * marker, or a guess character outside the supported alphabet.
 */
public class InvalidAttemptException extends IllegalArgumentException {

    public InvalidAttemptException(String message) {
        super(message);
    }
}
