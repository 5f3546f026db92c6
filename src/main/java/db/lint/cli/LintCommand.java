package db.lint.cli;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.lint.catalog.AnnotatedTableSpec;
import db.lint.catalog.ControlFileSchemaLoader;
import db.lint.catalog.Schema;
import db.lint.catalog.SchemaLoader;
import db.lint.source.FileSystemRowSource;
import db.lint.validate.DataValidator;
import db.lint.validate.SchemaChecker;

/**
 * Loads the schema, checks it, then validates every table it names.
 * Any violation surfaces as a {@link db.lint.error.LintException}.
 */
public class LintCommand {
    private static final Logger log = LoggerFactory.getLogger(LintCommand.class);

    private final SchemaChecker checker = new SchemaChecker();
    private final DataValidator validator = new DataValidator();

    public void run(LintConfig config) {
        FileSystemRowSource source = new FileSystemRowSource(config.dataDir());
        Schema schema = config.usesControlFile()
            ? new ControlFileSchemaLoader().load(source)
            : new SchemaLoader().load(config.schemaFile());
        log.info("Checking {} table(s) in {}", schema.tables().size(), config.dataDir());

        Map<String, AnnotatedTableSpec> tables = checker.check(schema);
        validator.validate(tables, source);
        log.info("All tables valid");
    }
}
