package qctl.exception;

/**
 * The formula uses a connective or operator outside the supported CTL fragment,
 * or an atomic proposition over a gene the network does not declare.
 */
@SuppressWarnings("serial")
public class UnsupportedFormulaException extends QuantitativeCheckException {
    public UnsupportedFormulaException(String operator, String message) {
        super(operator, message);
    }
}
