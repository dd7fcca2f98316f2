package me.bechberger.logveil.commands;

import me.bechberger.logveil.Version;
import me.bechberger.logveil.config.SchemaGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Prints the JSON schema of profile files, derived from the config classes.
 */
@Command(
    name = "generate-schema",
    description = "Generate the JSON Schema of profile files, for editor completion and validation",
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Generate schema to stdout:",
        "    logveil generate-schema",
        "",
        "  Generate schema to a file:",
        "    logveil generate-schema profile-schema.json",
        ""
    }
)
public class GenerateSchemaCommand extends BaseCommand {

    private static final Logger logger = LoggerFactory.getLogger(GenerateSchemaCommand.class);

    @Parameters(
        index = "0",
        description = "Output file for the JSON schema (default: stdout)",
        paramLabel = "<output.json>",
        arity = "0..1"
    )
    private Path outputFile;

    @Override
    protected Logger getLogger() {
        return logger;
    }

    @Override
    protected int run() throws IOException {
        String schemaJson = SchemaGenerator.generateSchema().toPrettyString();
        if (outputFile == null) {
            out().println(schemaJson);
            return 0;
        }
        Path outputPath = outputFile.toAbsolutePath();
        Files.createDirectories(outputPath.getParent());
        Files.writeString(outputPath, schemaJson);
        logger.debug("Wrote {} characters of schema", schemaJson.length());
        err().println("Schema written to: " + outputPath);
        return 0;
    }
}
