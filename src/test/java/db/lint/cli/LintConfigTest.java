package db.lint.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

public class LintConfigTest {
    @Test
    void parsesOptionsInAnyOrder() {
        LintConfig c = LintConfig.parse(new String[] {"--verbose", "data", "--schema", "s.json"});
        assertEquals(Paths.get("data"), c.dataDir());
        assertEquals(Paths.get("s.json"), c.schemaFile());
        assertTrue(c.verbose());
        assertFalse(c.usesControlFile());
    }

    @Test
    void controlFileIsDefault() {
        LintConfig c = LintConfig.parse(new String[] {"data"});
        assertTrue(c.usesControlFile());
        assertFalse(c.verbose());
    }

    @Test
    void usageErrors() {
        assertThrows(IllegalArgumentException.class, () -> LintConfig.parse(new String[] {}));
        assertThrows(IllegalArgumentException.class, () -> LintConfig.parse(new String[] {"data", "--schema"}));
        assertThrows(IllegalArgumentException.class, () -> LintConfig.parse(new String[] {"data", "--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> LintConfig.parse(new String[] {"a", "b"}));
    }
}
