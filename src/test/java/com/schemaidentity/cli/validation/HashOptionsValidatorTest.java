package com.schemaidentity.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.schemaidentity.cli.exception.OptionsValidationException;
import com.schemaidentity.cli.model.HashOptions;
import com.schemaidentity.cli.model.ValidatedHashOptions;
import com.schemaidentity.identity.hash.HashFunctions;
import com.schemaidentity.model.config.HashLimit;

import picocli.CommandLine;

/**
 * Unit tests for HashOptionsValidator.
 */
class HashOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path schema;
    private Path other;

    private final HashOptionsValidator validator = new HashOptionsValidator();

    @BeforeEach
    void writeSchemas() throws IOException {
        schema = Files.writeString(tempDir.resolve("order.json"), "{\"title\":\"Order\"}");
        other = Files.writeString(tempDir.resolve("order-by-name.json"), "{\"title\":\"Order\"}");
    }

    private static HashOptions parse(String... args) {
        HashOptions options = new HashOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Test
    void testSchemaFillsEveryDocument() {
        ValidatedHashOptions v = validator.validate(parse("-n", "Order", "-s", schema.toString()));

        assertThat(v.getSerByAlias()).isEqualTo(schema);
        assertThat(v.getSerByName()).isEqualTo(schema);
        assertThat(v.getValByAlias()).isEqualTo(schema);
        assertThat(v.getHashLimit()).isEqualTo(HashLimit.of(12));
        assertThat(v.getHashFunction()).isSameAs(HashFunctions.md5Hex());
    }

    @Test
    void testExplicitDocumentsWin() {
        ValidatedHashOptions v = validator.validate(parse("-n", "Order", "-s", schema.toString(),
                "--ser-by-name", other.toString()));

        assertThat(v.getSerByAlias()).isEqualTo(schema);
        assertThat(v.getSerByName()).isEqualTo(other);
    }

    @Test
    void testSchemaFillsByNameWhenOnlyByAliasIsExplicit() {
        ValidatedHashOptions v = validator.validate(parse("-n", "Order", "-s", schema.toString(),
                "--ser-by-alias", other.toString()));

        assertThat(v.getSerByAlias()).isEqualTo(other);
        assertThat(v.getSerByName()).isEqualTo(schema);
        assertThat(v.getValByAlias()).isEqualTo(schema);
    }

    @Test
    void testSerByNameFallsBackToSerByAlias() {
        ValidatedHashOptions v = validator.validate(parse("-n", "Order", "--ser-by-alias", other.toString(),
                "--no-track-validation-mode"));

        assertThat(v.getSerByName()).isEqualTo(other);
        assertThat(v.getValByAlias()).isNull();
    }

    @Test
    void testValidationDocumentRequiredWhenTracked() {
        HashOptions options = parse("-n", "Order", "--ser-by-alias", schema.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--val-by-alias");
    }

    @Test
    void testAllErrorsReportedTogether() {
        HashOptions options = parse("-n", " ", "-s", tempDir.resolve("missing.json").toString(),
                "--hash-length", "long", "--hash-function", "crc32", "--filepath-parts=-1");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(5)
                        .anyMatch(err -> err.contains("Type name"))
                        .anyMatch(err -> err.contains("missing.json"))
                        .anyMatch(err -> err.contains("long"))
                        .anyMatch(err -> err.contains("crc32"))
                        .anyMatch(err -> err.contains("-1")))
                .hasMessageStartingWith("5 invalid option(s):");
    }

    @Test
    void testUnboundedSha256() {
        ValidatedHashOptions v = validator.validate(parse("-n", "Order", "-s", schema.toString(),
                "--hash-length", "unbounded", "--hash-function", "sha256"));

        assertThat(v.getHashLimit().isUnbounded()).isTrue();
        assertThat(v.getHashFunction()).isSameAs(HashFunctions.sha256Hex());
    }
}
