package db.lint.source;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.lint.error.SourceException;

/**
 * Row source reading comma separated files from a root directory.
 * A table named "users" is read from users.csv; a name that already has an
 * extension is used as the file name unchanged.
 */
public class FileSystemRowSource implements RowSource {
    private static final Logger log = LoggerFactory.getLogger(FileSystemRowSource.class);
    private static final String DEFAULT_EXTENSION = ".csv";

    private final Path root;
    private final CsvMapper mapper;

    public FileSystemRowSource(Path root) {
        this.root = root;
        this.mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public Path root() { return root; }

    /** File backing the given table; rejects names that could escape the root directory. */
    public Path resolve(String table) {
        if (table.contains("..")) {
            throw new SourceException(SourceException.Kind.ILLEGAL_TABLE_NAME, table,
                "Illegal character in table identifier '" + table + "': '..'");
        }
        String fileName = table.indexOf('.') >= 0 ? table : table + DEFAULT_EXTENSION;
        return root.resolve(fileName);
    }

    @Override
    public void withTable(String table, TableBody body) {
        Path file = resolve(table);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            log.debug("Opened table '{}' at {}", table, file);
            CsvRows rows = new CsvRows(table, it);
            body.accept(rows);
            log.debug("Closed table '{}' after {} data row(s)", table, rows.consumed);
        } catch (NoSuchFileException e) {
            throw new SourceException(SourceException.Kind.TABLE_NOT_FOUND, table,
                "Table '" + table + "' not found: " + file, e);
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.READ_FAILED, table,
                "Failed reading table '" + table + "': " + e.getMessage(), e);
        }
    }

    private static final class CsvRows implements Rows {
        private final String table;
        private final MappingIterator<String[]> it;
        private final List<String> header;
        private int consumed;

        CsvRows(String table, MappingIterator<String[]> it) throws IOException {
            this.table = table;
            this.it = it;
            if (!it.hasNextValue()) {
                throw new SourceException(SourceException.Kind.MISSING_HEADER, table,
                    "Table '" + table + "' is empty; expected a header line");
            }
            this.header = wrap(it.nextValue());
        }

        @Override
        public List<String> header() { return header; }

        @Override
        public List<String> next() {
            try {
                if (!it.hasNextValue()) return null;
                consumed++;
                return wrap(it.nextValue());
            } catch (IOException e) {
                throw new SourceException(SourceException.Kind.READ_FAILED, table,
                    "Failed reading table '" + table + "' after line " + (consumed + 1) + ": " + e.getMessage(), e);
            }
        }

        private static List<String> wrap(String[] values) {
            return Collections.unmodifiableList(Arrays.asList(values));
        }
    }
}
