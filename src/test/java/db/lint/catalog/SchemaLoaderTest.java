package db.lint.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.lint.error.SchemaException;

public class SchemaLoaderTest {
    private final SchemaLoader loader = new SchemaLoader();

    private static final String DOC = """
        {
          "tables": [
            {
              "name": "users",
              "primary_key": ["id"],
              "columns": [
                {"name": "id", "type": "int", "not_null": true},
                {"name": "name", "type": "string"}
              ]
            },
            {
              "name": "orders",
              "primary_key": ["id"],
              "unique_columns": [["user_id", "placed"]],
              "foreign_keys": [
                {"local_column": ["user_id"], "foreign_table": "users", "foreign_column": ["id"]}
              ],
              "columns": [
                {"name": "id", "type": "int", "not_null": true},
                {"name": "user_id", "type": "int"},
                {"name": "placed", "type": "date(yyyy-MM-dd)"}
              ]
            }
          ]
        }
        """;

    @Test
    void readsTablesKeysAndTypes() {
        Schema schema = loader.read(new StringReader(DOC));
        assertEquals(2, schema.tables().size());

        TableSpec users = schema.tables().get(0);
        assertEquals("users", users.name());
        assertEquals(Column.of("id"), users.primaryKey());
        assertEquals(List.of(new ColumnSpec("id", DataType.INT, true), new ColumnSpec("name", DataType.STRING, false)),
            users.columns());
        assertTrue(users.foreignKeys().isEmpty());
        assertTrue(users.uniqueColumns().isEmpty());

        TableSpec orders = schema.tables().get(1);
        assertEquals(List.of(Column.of("user_id", "placed")), orders.uniqueColumns());
        assertEquals(new ForeignKeyMapping(Column.of("user_id"), "users", Column.of("id")), orders.foreignKeys().get(0));
        assertEquals(DataType.date("yyyy-MM-dd"), orders.columns().get(2).type());
    }

    @Test
    void acceptsBareArrayAndMissingPrimaryKey() {
        Schema schema = loader.read(new StringReader("[{\"name\": \"logs\", \"columns\": [{\"name\": \"line\", \"type\": \"string\"}]}]"));
        assertFalse(schema.tables().get(0).hasPrimaryKey());
    }

    @Test
    void unknownTypeIsReportedNotThrownRaw() {
        SchemaException e = assertThrows(SchemaException.class, () -> loader.read(new StringReader(
            "[{\"name\": \"t\", \"columns\": [{\"name\": \"x\", \"type\": \"decimal\"}]}]")));
        assertEquals(SchemaException.Kind.INVALID_TYPE, e.kind());
    }

    @Test
    void emptyCompositeColumnRejected() {
        SchemaException e = assertThrows(SchemaException.class, () -> loader.read(new StringReader(
            "[{\"name\": \"t\", \"primary_key\": [], \"columns\": [{\"name\": \"x\", \"type\": \"int\"}]}]")));
        assertEquals(SchemaException.Kind.MALFORMED_SCHEMA, e.kind());
    }

    @Test
    void malformedJson() {
        assertEquals(SchemaException.Kind.MALFORMED_SCHEMA,
            assertThrows(SchemaException.class, () -> loader.read(new StringReader("{\"tables\": [ {"))).kind());
        assertEquals(SchemaException.Kind.MALFORMED_SCHEMA,
            assertThrows(SchemaException.class, () -> loader.read(new StringReader("{\"other\": 1}"))).kind());
    }

    @Test
    void nullEntriesAreMalformed() {
        String[] docs = {
            "[null]",
            "{\"tables\": [null]}",
            "[{\"name\": \"t\", \"columns\": [null]}]",
            "[{\"name\": \"t\", \"unique_columns\": [null], \"columns\": [{\"name\": \"x\", \"type\": \"int\"}]}]",
            "[{\"name\": \"t\", \"primary_key\": [\"x\", null], \"columns\": [{\"name\": \"x\", \"type\": \"int\"}]}]",
            "[{\"name\": \"t\", \"foreign_keys\": [null], \"columns\": [{\"name\": \"x\", \"type\": \"int\"}]}]"
        };
        for (String doc : docs) {
            SchemaException e = assertThrows(SchemaException.class, () -> loader.read(new StringReader(doc)), doc);
            assertEquals(SchemaException.Kind.MALFORMED_SCHEMA, e.kind(), doc);
            assertTrue(e.getMessage().contains("null entry"), e.getMessage());
        }
    }

    @Test
    void nullFieldValuesAreLeftToTheChecker() {
        Schema schema = loader.read(new StringReader(
            "[{\"name\": \"t\", \"primary_key\": null, \"columns\": [{\"name\": null, \"type\": \"int\"}]}]"));
        assertFalse(schema.tables().get(0).hasPrimaryKey());
        assertNull(schema.tables().get(0).columns().get(0).name());
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("schema.json");
        Files.writeString(file, DOC);
        assertEquals(2, loader.load(file).tables().size());
        assertEquals(SchemaException.Kind.MALFORMED_SCHEMA,
            assertThrows(SchemaException.class, () -> loader.load(dir.resolve("missing.json"))).kind());
    }
}
