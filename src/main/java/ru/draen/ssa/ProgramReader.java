package ru.draen.ssa;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.Node;
import ru.draen.ssa.ast.Stmt;

import java.util.List;
import java.util.stream.Collectors;

public class ProgramReader {
    // the opening brace of the wrapping block sits on its own line
    private static final int WRAPPER_LINES = 1;

    private final JavaParser parser;
    private final StatementReader statements;

    public ProgramReader() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public ProgramReader(ParserConfiguration configuration) {
        this.parser = new JavaParser(configuration);
        this.statements = new StatementReader(new ExpressionReader());
    }

    public List<Stmt> read(String source) {
        var result = parser.parseBlock("{\n" + source + "\n}");
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            var problems = result.getProblems().stream()
                    .map(ProgramReader::describe)
                    .collect(Collectors.joining("\n"));
            throw new ProgramSyntaxException("cannot parse program:\n" + problems);
        }
        return List.copyOf(result.getResult().get().accept(statements, null));
    }

    static String position(Position pos) {
        return "line " + (pos.line - WRAPPER_LINES) + ", column " + pos.column;
    }

    static String location(Node node) {
        return node.getBegin().map(pos -> " at " + position(pos)).orElse("");
    }

    private static String describe(Problem problem) {
        return problem.getLocation()
                .flatMap(tokens -> tokens.getBegin().getRange())
                .map(range -> position(range.begin) + ": ")
                .orElse("") + problem.getMessage();
    }
}
