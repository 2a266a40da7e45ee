package com.schemaidentity.cli.model;

public enum OutputFormat {
    TEXT,
    JSON
}
