package com.finplan.mgraph.error;

/** Formula text that cannot be tokenized or parsed. */
public final class FormulaSyntaxException extends ModelException {
    private final String expression;
    private final int position;

    public FormulaSyntaxException(String expression, int position, String detail) {
        super(ErrorKind.FORMULA_SYNTAX,
                "Invalid formula '" + expression + "' at position " + position + ": " + detail);
        this.expression = expression;
        this.position = position;
    }

    public String expression() {
        return expression;
    }

    public int position() {
        return position;
    }
}
