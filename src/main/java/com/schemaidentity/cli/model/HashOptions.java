package com.schemaidentity.cli.model;

import java.nio.file.Path;

import com.schemaidentity.model.SchemaMode;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "hash" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class HashOptions {

	@Option(names = { "--name", "-n" }, required = true, description = "Bare name of the type")
	private String name;

	@Option(names = { "--location",
			"-l" }, description = "Declaring location of the type (e.g. src/models/orders.py)")
	private Path location;

	@Option(names = { "--schema",
			"-s" }, description = "Schema document used for every mode/aliasing combination not given explicitly")
	private Path schema;

	@Option(names = { "--ser-by-alias" }, description = "Serialization-mode schema with aliased field names")
	private Path serByAlias;

	@Option(names = { "--ser-by-name" }, description = "Serialization-mode schema with declared field names")
	private Path serByName;

	@Option(names = { "--val-by-alias" }, description = "Validation-mode schema with aliased field names")
	private Path valByAlias;

	@Option(names = { "--extra-data" }, description = "JSON file with extra data folded into the hash")
	private Path extraData;

	@Option(names = { "--track-descriptions" }, description = "Include descriptions in the hash")
	private boolean trackDescriptions;

	@Option(names = { "--track-field-order" }, description = "Field declaration order affects the hash")
	private boolean trackFieldOrder;

	@Option(names = {
			"--track-type-order" }, description = "Order of unions, enums and other lists in types affects the hash")
	private boolean trackTypeOrder;

	@Option(names = {
			"--no-track-validation-mode" }, description = "Hash only the serialization-mode schemas")
	private boolean noTrackValidationMode;

	@Option(names = { "--hash-length" }, defaultValue = "12", description = "Characters kept from the digest, or 'unbounded' (default: 12)")
	private String hashLength;

	@Option(names = {
			"--filepath-parts" }, defaultValue = "2", description = "Trailing location segments in the qualified name (default: 2)")
	private int filepathParts;

	@Option(names = { "--hash-function" }, defaultValue = "md5", description = "md5 or sha256 (default: md5)")
	private String hashFunction;

	@Option(names = {
			"--schema-mode-override" }, description = "Pin the type to one schema mode: SERIALIZATION or VALIDATION")
	private SchemaMode schemaModeOverride;

	@Option(names = { "--format" }, defaultValue = "TEXT", description = "Report format: TEXT or JSON (default: TEXT)")
	private OutputFormat format;

	@Option(names = { "--show-input" }, description = "Also print the exact hash input")
	private boolean showInput;
}
