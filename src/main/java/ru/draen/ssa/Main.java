package ru.draen.ssa;

import org.apache.log4j.Logger;
import ru.draen.ssa.equiv.EquivalenceOracle;
import ru.draen.ssa.ir.SsaBuilder;
import ru.draen.ssa.ir.SsaFormatter;
import ru.draen.ssa.ir.SsaStmt;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class Main {
    private static final Logger logger = Logger.getLogger(Main.class);

    static final String EXAMPLE_PROGRAM = """
            x = 10;
            y = x + 5;
            if (x > y) {
                z = x + y;
            } else {
                z = x - y;
            }
            assert z > 0;
            """;

    static final String EXAMPLE_PROGRAM_2 = """
            a = 10;
            b = a + 5;
            if (a > b) {
                c = a + b;
            } else {
                c = a - b;
            }
            assert c > 0;
            """;

    private final ProgramReader reader = new ProgramReader();
    private final SsaBuilder builder = new SsaBuilder();
    private final SsaFormatter formatter = new SsaFormatter();
    private final EquivalenceOracle oracle = new EquivalenceOracle();

    public static void main(String[] args) {
        try {
            System.out.println(new Main().run(args));
        } catch (IOException | ProgramSyntaxException | IllegalArgumentException e) {
            logger.error(e.getMessage(), e);
            System.exit(1);
        }
    }

    String run(String[] args) throws IOException {
        return switch (args.length) {
            case 0 -> compare(EXAMPLE_PROGRAM, EXAMPLE_PROGRAM_2);
            case 1 -> formatter.format(toSsa(Files.readString(Path.of(args[0]))));
            case 2 -> compare(Files.readString(Path.of(args[0])), Files.readString(Path.of(args[1])));
            default -> throw new IllegalArgumentException("usage: Main [program [other-program]], got "
                    + args.length + " arguments");
        };
    }

    List<SsaStmt> toSsa(String source) {
        return builder.convert(reader.read(source));
    }

    String compare(String first, String second) {
        var firstSsa = toSsa(first);
        var secondSsa = toSsa(second);
        logger.info("Comparing programs with " + firstSsa.size() + " and " + secondSsa.size() + " SSA statements");
        return "Program 1 SSA:\n" + formatter.format(firstSsa)
                + "\n\nProgram 2 SSA:\n" + formatter.format(secondSsa)
                + "\n\nEquivalence Result:\n" + oracle.compare(firstSsa, secondSsa).describe();
    }
}
