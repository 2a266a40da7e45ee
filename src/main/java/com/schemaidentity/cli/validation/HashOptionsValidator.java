package com.schemaidentity.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.schemaidentity.cli.exception.OptionsValidationException;
import com.schemaidentity.cli.model.HashOptions;
import com.schemaidentity.cli.model.ValidatedHashOptions;
import com.schemaidentity.identity.hash.HashFunction;
import com.schemaidentity.identity.hash.HashFunctions;
import com.schemaidentity.model.config.HashLimit;

public class HashOptionsValidator {

	public ValidatedHashOptions validate(HashOptions o) {
		List<String> errors = new ArrayList<>();

		if (isBlank(o.getName())) {
			errors.add("Type name is required (--name / -n).");
		}

		// Explicit documents win; --schema fills the gaps
		Path serByAlias = firstNonNull(o.getSerByAlias(), o.getSchema());
		Path serByName = firstNonNull(o.getSerByName(), firstNonNull(o.getSchema(), serByAlias));
		boolean trackValidationMode = !o.isNoTrackValidationMode();
		Path valByAlias = trackValidationMode ? firstNonNull(o.getValByAlias(), o.getSchema()) : null;

		if (serByAlias == null) {
			errors.add("Either --schema or --ser-by-alias must be provided.");
		}
		if (trackValidationMode && valByAlias == null) {
			errors.add("Validation-mode tracking needs --val-by-alias or --schema "
					+ "(or pass --no-track-validation-mode).");
		}

		requireFile(errors, "Schema", o.getSchema());
		requireFile(errors, "Serialization by-alias schema", o.getSerByAlias());
		requireFile(errors, "Serialization by-name schema", o.getSerByName());
		if (trackValidationMode) {
			requireFile(errors, "Validation by-alias schema", o.getValByAlias());
		}
		requireFile(errors, "Extra data", o.getExtraData());

		if (o.getFilepathParts() < 0) {
			errors.add("Filepath parts must be >= 0. Got: " + o.getFilepathParts());
		}

		HashLimit hashLimit = null;
		try {
			hashLimit = HashLimit.parse(o.getHashLength());
		} catch (IllegalArgumentException e) {
			errors.add(e.getMessage());
		}

		HashFunction hashFunction = null;
		try {
			hashFunction = HashFunctions.byName(o.getHashFunction());
		} catch (IllegalArgumentException e) {
			errors.add(e.getMessage());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedHashOptions(hashLimit, hashFunction, serByAlias, serByName, valByAlias);
	}

	private static void requireFile(List<String> errors, String label, Path p) {
		if (p != null && !Files.isRegularFile(p)) {
			errors.add(label + " file does not exist or is not a file: " + p);
		}
	}

	private static Path firstNonNull(Path first, Path second) {
		return first != null ? first : second;
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
