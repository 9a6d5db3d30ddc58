package com.scanforge.infrastructure.parsing;

public enum PythonTokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
