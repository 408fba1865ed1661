package com.finplan.mgraph.formula;

record Token(TokenType type, String text, double number, int position) {
}
