package ai.iacgraph.parse.hcl;

enum HclTokenType {
    IDENT,
    STRING,
    NUMBER,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    LPAREN,
    RPAREN,
    EQUALS,
    COLON,
    COMMA,
    DOT,
    OPERATOR,
    NEWLINE,
    EOF
}
