package qctl.exception;

/**
 * The network description references an undeclared gene or produces a level
 * outside the declared bounds. Graph construction does not complete.
 */
@SuppressWarnings("serial")
public class MalformedModelException extends QuantitativeCheckException {
    public MalformedModelException(String gene, String message) {
        super(gene, gene == null ? message : "[" + gene + "] " + message);
    }

    public MalformedModelException(String gene, String message, Throwable cause) {
        super(gene, gene == null ? message : "[" + gene + "] " + message, cause);
    }
}
