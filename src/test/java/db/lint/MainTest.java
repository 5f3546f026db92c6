package db.lint;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {
    private static final String SCHEMA = "table,column,not_null,unique,primary_key,type,references_table,references_column\n"
        + "users,id,true,false,true,int,,\n"
        + "users,name,false,false,false,string,,\n";

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args, new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void successIsSilent(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("schema.csv"), SCHEMA);
        Files.writeString(dir.resolve("users.csv"), "id,name\n1,Alice\n2,Bob\n");
        assertEquals(Main.EXIT_OK, run(dir.toString()));
        assertEquals("", stderr());
    }

    @Test
    void violationPrintsOneLine(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("schema.csv"), SCHEMA);
        Files.writeString(dir.resolve("users.csv"), "id,name\n1,Alice\n1,Bob\n");
        assertEquals(Main.EXIT_VIOLATION, run(dir.toString()));
        String out = stderr().trim();
        assertTrue(out.startsWith("error: "), out);
        assertEquals(1, out.lines().count(), out);
        assertTrue(out.contains("row 3"), out);
    }

    @Test
    void missingDataFileIsAViolation(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("schema.csv"), SCHEMA);
        assertEquals(Main.EXIT_VIOLATION, run(dir.toString()));
        assertTrue(stderr().contains("'users' not found"), stderr());
    }

    @Test
    void usageError() {
        assertEquals(Main.EXIT_USAGE, run());
        assertTrue(stderr().contains("usage:"));
    }
}
