package org.prover;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testReadClausesSkipsCommentsAndBlankLines() throws Exception {
        File file = folder.newFile("sillogismo.txt");
        Files.write(file.toPath(), Arrays.asList(
                "# Tutti gli uomini sono mortali",
                "¬Human(x) ∨ Mortal(x)",
                "",
                "   Human(socrates)  ",
                "¬Mortal(socrates)"), StandardCharsets.UTF_8);

        List<String> clauses = Main.readClausesFromFile(file.toPath());

        assertEquals(Arrays.asList("¬Human(x) ∨ Mortal(x)", "Human(socrates)", "¬Mortal(socrates)"), clauses);
    }
}
