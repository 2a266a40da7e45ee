package com.schemaidentity.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemaidentity.cli.exception.OptionsValidationException;
import com.schemaidentity.cli.model.HashOptions;
import com.schemaidentity.cli.model.ValidatedHashOptions;
import com.schemaidentity.cli.output.HashResultsPrinter;
import com.schemaidentity.cli.validation.HashOptionsValidator;
import com.schemaidentity.identity.IdentityReport;
import com.schemaidentity.identity.SchemaIdentityRegistry;
import com.schemaidentity.identity.exception.SchemaIdentityException;
import com.schemaidentity.model.Aliasing;
import com.schemaidentity.model.SchemaMode;
import com.schemaidentity.model.SchemaType;
import com.schemaidentity.provider.DocumentSchemaProvider;
import com.schemaidentity.provider.JsonSchemaFileLoader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command computing the identity hash of one type from its schema documents.
 */
@Command(
        name = "hash",
        mixinStandardHelpOptions = true,
        version = "schema-identity-hasher 1.0.0",
        description = "Computes the identity hash and report of a type from its JSON schema documents."
)
public class HashCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HashCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private HashOptions options = new HashOptions();

    private final HashOptionsValidator validator = new HashOptionsValidator();
    private final HashResultsPrinter printer;
    private final JsonSchemaFileLoader loader = new JsonSchemaFileLoader();

    public HashCommand() {
        this(new HashResultsPrinter());
    }

    HashCommand(HashResultsPrinter printer) {
        this.printer = printer;
    }

    @Override
    public Integer call() {
        ValidatedHashOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        try {
            SchemaType type = defineType(validated);
            SchemaIdentityRegistry registry = new SchemaIdentityRegistry(loadSchemas(type, validated));

            IdentityReport report = registry.report(type);
            if (options.isShowInput()) {
                printer.printHashInput(new String(registry.hashInput(type), StandardCharsets.UTF_8));
            }
            printer.printReport(report, options.getFormat());
            return EXIT_OK;

        } catch (SchemaIdentityException e) {
            printer.printFailure(e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            log.error("Could not read schema input", e);
            return EXIT_FAILED;
        }
    }

    private SchemaType defineType(ValidatedHashOptions v) throws IOException {
        Object extraData = options.getExtraData() != null ? loader.loadValue(options.getExtraData()) : null;
        return SchemaType.define(options.getName())
                .location(options.getLocation() != null ? options.getLocation().toString() : null)
                .schemaModeOverride(options.getSchemaModeOverride())
                .configure(c -> c
                        .trackDescriptions(options.isTrackDescriptions())
                        .trackFieldOrder(options.isTrackFieldOrder())
                        .trackTypeOrder(options.isTrackTypeOrder())
                        .trackValidationMode(!options.isNoTrackValidationMode())
                        .trackedExtraData(extraData)
                        .hashLimit(v.getHashLimit())
                        .trackedFilepathParts(options.getFilepathParts())
                        .hashFunction(v.getHashFunction()))
                .register();
    }

    private DocumentSchemaProvider loadSchemas(SchemaType type, ValidatedHashOptions v) throws IOException {
        DocumentSchemaProvider provider = new DocumentSchemaProvider()
                .register(type, SchemaMode.SERIALIZATION, Aliasing.BY_ALIAS, loader.loadSchema(v.getSerByAlias()))
                .register(type, SchemaMode.SERIALIZATION, Aliasing.BY_NAME, loader.loadSchema(v.getSerByName()));
        if (v.getValByAlias() != null) {
            provider.register(type, SchemaMode.VALIDATION, Aliasing.BY_ALIAS, loader.loadSchema(v.getValByAlias()));
        }
        return provider;
    }
}
