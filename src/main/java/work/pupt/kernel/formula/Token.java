package work.pupt.kernel.formula;

record Token(Kind kind, String text, int position) {
    enum Kind {
        NUMBER,
        STRING,
        IDENT,
        LPAREN,
        RPAREN,
        COMMA,
        OPERATOR,
        EOF
    }

    boolean is(Kind expected) {
        return kind == expected;
    }

    boolean isKeyword(String keyword) {
        return kind == Kind.IDENT && text.equalsIgnoreCase(keyword);
    }
}
