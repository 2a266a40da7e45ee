package com.schemaidentity.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemaidentity.cli.model.HashOptions;
import com.schemaidentity.cli.model.OutputFormat;
import com.schemaidentity.cli.model.ValidatedHashOptions;
import com.schemaidentity.identity.IdentityReport;

/**
 * Responsible only for printing CLI output for the "hash" command.
 * No validation, no execution, no prompting.
 */
public class HashResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(HashResultsPrinter.class);

    private final ReportRenderer renderer;

    public HashResultsPrinter() {
        this(new ReportRenderer());
    }

    public HashResultsPrinter(ReportRenderer renderer) {
        this.renderer = renderer;
    }

    public void printBanner(HashOptions o, ValidatedHashOptions v) {
        // JSON output must stay machine-readable
        if (o.getFormat() == OutputFormat.JSON) {
            return;
        }
        log.info("=================================================");
        log.info("Schema Identity Hasher");
        log.info("=================================================");
        log.info("Type Name: {}", o.getName());
        log.info("Location: {}", o.getLocation() != null ? o.getLocation() : "None");
        log.info("Serialization (by alias): {}", v.getSerByAlias().toAbsolutePath());
        log.info("Serialization (by name): {}", v.getSerByName().toAbsolutePath());
        log.info("Validation (by alias): {}", v.getValByAlias() != null ? v.getValByAlias().toAbsolutePath() : "Not tracked");
        log.info("Extra Data: {}", o.getExtraData() != null ? o.getExtraData().toAbsolutePath() : "None");
        log.info("Hash Length: {}", v.getHashLimit());
        log.info("Hash Function: {}", o.getHashFunction());
        log.info("=================================================");
    }

    public void printHashInput(String hashInput) {
        log.info("Hash input: {}", hashInput);
    }

    public void printReport(IdentityReport report, OutputFormat format) {
        log.info(render(report, format));
    }

    public String render(IdentityReport report, OutputFormat format) {
        return format == OutputFormat.JSON ? renderer.renderJson(report) : renderer.renderText(report);
    }

    public void printFailure(String message) {
        log.error("Identity hash failed: {}", message);
    }
}
