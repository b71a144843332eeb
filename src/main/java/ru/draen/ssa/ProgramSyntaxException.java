package ru.draen.ssa;

import com.github.javaparser.ast.Node;

public class ProgramSyntaxException extends RuntimeException {
    public ProgramSyntaxException(String message) {
        super(message);
    }

    public ProgramSyntaxException(String message, Node node) {
        super(message + ": " + node + ProgramReader.location(node));
    }
}
