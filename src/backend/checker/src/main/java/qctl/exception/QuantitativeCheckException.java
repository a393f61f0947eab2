package qctl.exception;

/**
 * Base of every failure surfaced to the caller of the checker.
 * The subject names the offending gene or operator, if there is one.
 */
@SuppressWarnings("serial")
public class QuantitativeCheckException extends Exception {
    private final String subject;

    public QuantitativeCheckException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    public QuantitativeCheckException(String subject, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }
}
