package qctl.exception;

import java.io.PrintStream;

/**
 * Formula text that could not be tokenized or parsed. Keeps the offending text
 * and the column so a driver can point at the error.
 */
@SuppressWarnings("serial")
public class FormulaSyntaxException extends QuantitativeCheckException {
    private final String line;
    private final int column;

    public FormulaSyntaxException(String message, String line, int column) {
        super(null, message);
        this.line = line;
        this.column = column;
    }

    public String getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public void print(PrintStream ps) {
        ps.println(getMessage());
        ps.println(line);
        for (int i = 0; i < column; i++) ps.print(" ");
        ps.println("^");
    }
}
