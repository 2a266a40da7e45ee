package com.schemaidentity;

import com.schemaidentity.cli.HashCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Schema Identity Hasher.
 * Computes short, deterministic fingerprints of type schemas so that stored records
 * can later be checked against the schema currently in use.
 */
public class SchemaIdentityApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HashCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
