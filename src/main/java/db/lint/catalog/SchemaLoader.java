package db.lint.catalog;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.lint.error.SchemaException;

/**
 * Reads a schema from a JSON document. The root is either an array of tables or an
 * object holding that array under "tables". Composite columns are arrays of names and
 * types use the textual form accepted by {@link DataType#parse(String)}.
 */
public class SchemaLoader {
    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);
    private static final Type TABLE_LIST = new TypeToken<List<TableSpec>>(){}.getType();

    private final Gson gson = new GsonBuilder()
        .registerTypeAdapter(Column.class, new ColumnAdapter().nullSafe())
        .registerTypeAdapter(DataType.class, new DataTypeAdapter().nullSafe())
        .create();

    public Schema load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Schema schema = read(reader);
            log.debug("Loaded {} table(s) from {}", schema.tables().size(), file);
            return schema;
        } catch (IOException e) {
            throw new SchemaException(SchemaException.Kind.MALFORMED_SCHEMA,
                "Failed reading schema file: " + file + " (" + e.getMessage() + ")", e);
        }
    }

    public Schema read(Reader reader) {
        try {
            JsonElement root = JsonParser.parseReader(reader);
            JsonElement tables;
            if (root.isJsonArray()) {
                tables = root;
            } else if (root.isJsonObject() && root.getAsJsonObject().has("tables")) {
                tables = root.getAsJsonObject().get("tables");
            } else {
                throw new SchemaException(SchemaException.Kind.MALFORMED_SCHEMA,
                    "Schema document must be an array of tables or an object with a 'tables' array");
            }
            rejectNullElements(tables, "$");
            List<TableSpec> parsed = gson.fromJson(tables, TABLE_LIST);
            if (parsed == null) parsed = new ArrayList<>();
            return new Schema(parsed);
        } catch (JsonParseException | IllegalStateException e) {
            throw new SchemaException(SchemaException.Kind.MALFORMED_SCHEMA,
                "Malformed schema document: " + e.getMessage(), e);
        }
    }

    // Null array entries would otherwise reach List.copyOf in the record constructors.
    private static void rejectNullElements(JsonElement element, String path) {
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            for (int i = 0; i < array.size(); i++) {
                String at = path + "[" + i + "]";
                if (array.get(i).isJsonNull()) {
                    throw new SchemaException(SchemaException.Kind.MALFORMED_SCHEMA,
                        "Malformed schema document: null entry at " + at);
                }
                rejectNullElements(array.get(i), at);
            }
        } else if (element.isJsonObject()) {
            for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
                rejectNullElements(e.getValue(), path + "." + e.getKey());
            }
        }
    }

    // Composite columns travel as JSON arrays of names.
    private static final class ColumnAdapter extends TypeAdapter<Column> {
        @Override
        public void write(JsonWriter out, Column value) throws IOException {
            out.beginArray();
            for (String name : value.names()) out.value(name);
            out.endArray();
        }

        @Override
        public Column read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.BEGIN_ARRAY) {
                throw new JsonParseException("Expected an array of column names at " + in.getPath());
            }
            List<String> names = new ArrayList<>();
            in.beginArray();
            while (in.hasNext()) names.add(in.nextString());
            in.endArray();
            if (names.isEmpty()) {
                throw new JsonParseException("Composite columns must be at least one column long (at " + in.getPath() + ")");
            }
            return new Column(names);
        }
    }

    private static final class DataTypeAdapter extends TypeAdapter<DataType> {
        @Override
        public void write(JsonWriter out, DataType value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public DataType read(JsonReader in) throws IOException {
            return DataType.parse(in.nextString());
        }
    }
}
