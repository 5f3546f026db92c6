package db.lint.validate;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class CompositeKeySetTest {
    @Test
    void existsOnlyAfterInsert() {
        CompositeKeySet set = new CompositeKeySet();
        List<String> t = List.of("1", "a");
        assertFalse(set.exists(t));
        set.insert(t);
        assertTrue(set.exists(t));
        set.insert(t);
        assertTrue(set.exists(t));
        assertEquals(1, set.size());
    }

    @Test
    void tuplesSharingPrefixAreDistinct() {
        CompositeKeySet set = new CompositeKeySet();
        set.insert(List.of("1", "a"));
        assertFalse(set.exists(List.of("1", "b")));
        assertFalse(set.exists(List.of("2", "a")));
        set.insert(List.of("1", "b"));
        assertTrue(set.exists(List.of("1", "b")));
        assertEquals(2, set.size());
    }

    @Test
    void separatorsInsideValuesDoNotCollide() {
        CompositeKeySet set = new CompositeKeySet();
        set.insert(List.of("a,b", "c"));
        assertFalse(set.exists(List.of("a", "b,c")));
        set.insert(List.of("a|", "b"));
        assertFalse(set.exists(List.of("a", "|b")));
    }

    @Test
    void emptyTupleNeverPresent() {
        CompositeKeySet set = new CompositeKeySet();
        assertFalse(set.exists(List.of()));
        set.insert(List.of());
        assertFalse(set.exists(List.of()));
        assertEquals(0, set.size());
    }

    @Test
    void emptyStringIsAValue() {
        CompositeKeySet set = new CompositeKeySet();
        set.insert(List.of(""));
        assertTrue(set.exists(List.of("")));
        assertFalse(set.exists(List.of("x")));
    }
}
