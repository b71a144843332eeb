package ru.draen.ssa;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.draen.ssa.ir.SsaFormatter;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testExampleProgramSsa() {
        var ssa = new Main().toSsa(Main.EXAMPLE_PROGRAM);

        assertEquals("""
                x_1 := 10
                y_1 := x_1 + 5
                if x_1 > y_1
                z_1 := x_1 + y_1
                z_2 := x_1 - y_1
                assert(z_2 > 0)""", new SsaFormatter().format(ssa));
    }

    @Test
    void testExamplesAreNotEquivalent() throws Exception {
        var output = new Main().run(new String[0]);

        assertTrue(output.contains("Program 2 SSA:\na_1 := 10"));
        assertTrue(output.endsWith("Programs are not equivalent: different variables used"));
    }

    @Test
    void testFilesWithSameShape(@TempDir Path dir) throws Exception {
        var first = dir.resolve("first.txt");
        var second = dir.resolve("second.txt");
        Files.writeString(first, "x = 1; if (x > 0) { y = x + 1; } assert y > 0;");
        Files.writeString(second, "x = 2; if (x < 5) { y = x * 3; } assert y != 0;");

        assertTrue(new Main().run(new String[]{first.toString(), second.toString()})
                .endsWith("Programs are equivalent"));
        assertEquals("x_1 := 1\nif x_1 > 0\ny_1 := x_1 + 1\nassert(y_1 > 0)",
                new Main().run(new String[]{first.toString()}));
    }

    @Test
    void testLiteralOutOfRangeInFile(@TempDir Path dir) throws Exception {
        var file = dir.resolve("big.txt");
        Files.writeString(file, "x = 99999999999;");

        assertThrows(ProgramSyntaxException.class, () -> new Main().run(new String[]{file.toString()}));
    }

    @Test
    void testTooManyArguments() {
        var e = assertThrows(IllegalArgumentException.class, () -> new Main().run(new String[]{"a", "b", "c"}));
        assertTrue(e.getMessage().startsWith("usage:"));
    }
}
