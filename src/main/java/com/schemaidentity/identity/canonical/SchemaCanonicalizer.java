package com.schemaidentity.identity.canonical;

import java.util.Comparator;
import java.util.List;

import com.schemaidentity.model.SchemaArray;
import com.schemaidentity.model.SchemaBoolean;
import com.schemaidentity.model.SchemaNull;
import com.schemaidentity.model.SchemaNumber;
import com.schemaidentity.model.SchemaObject;
import com.schemaidentity.model.SchemaString;
import com.schemaidentity.model.SchemaValue;
import com.schemaidentity.model.SchemaValueVisitor;

import lombok.NonNull;

/**
 * Removes from a schema document the variation a {@link CanonicalizationPolicy} says
 * to ignore. Returns a new tree; the input is left untouched.
 *
 * <p>Rules, applied at every object entry:
 * <ul>
 * <li>{@code description} with a string value is dropped when descriptions are not tracked.</li>
 * <li>A non-empty {@code required} list whose first element is a string is sorted.</li>
 * <li>Any other non-empty list is, when lists are not tracked, normalized element-wise and
 * collapsed into the sorted list of its elements' text forms. Two structurally different
 * nested lists can collapse to the same strings; hashes are defined against this exact
 * behavior.</li>
 * <li>Whatever sits under {@code default} is kept verbatim, at any depth.</li>
 * </ul>
 */
public class SchemaCanonicalizer {

    static final String DESCRIPTION = "description";
    static final String REQUIRED = "required";
    static final String DEFAULT = "default";

    public SchemaValue normalize(@NonNull SchemaValue document, @NonNull CanonicalizationPolicy policy) {
        return document.accept(new Normalizer(policy));
    }

    public SchemaObject normalize(@NonNull SchemaObject document, @NonNull CanonicalizationPolicy policy) {
        return (SchemaObject) document.accept(new Normalizer(policy));
    }

    private static final class Normalizer implements SchemaValueVisitor<SchemaValue> {

        private final CanonicalizationPolicy policy;

        private Normalizer(CanonicalizationPolicy policy) {
            this.policy = policy;
        }

        @Override
        public SchemaValue visit(SchemaObject object) {
            SchemaObject.Builder out = SchemaObject.builder();
            object.getEntries().forEach((key, value) -> {
                if (policy.isDropDescriptions() && DESCRIPTION.equals(key) && value instanceof SchemaString) {
                    return;
                }
                if (DEFAULT.equals(key)) {
                    out.put(key, value);
                    return;
                }

                SchemaValue current = value;
                if (value instanceof SchemaArray array && !array.isEmpty()) {
                    if (policy.isSortRequired() && REQUIRED.equals(key) && array.get(0) instanceof SchemaString) {
                        current = sortByText(array);
                    } else if (policy.isSortLists()) {
                        current = collapse(array);
                    }
                }
                out.put(key, current.accept(this));
            });
            return out.build();
        }

        @Override
        public SchemaValue visit(SchemaArray array) {
            return SchemaValue.array(array.getElements().stream()
                    .map(element -> element.accept(this))
                    .toList());
        }

        @Override
        public SchemaValue visit(SchemaString string) {
            return string;
        }

        @Override
        public SchemaValue visit(SchemaNumber number) {
            return number;
        }

        @Override
        public SchemaValue visit(SchemaBoolean bool) {
            return bool;
        }

        @Override
        public SchemaValue visit(SchemaNull nul) {
            return nul;
        }

        private static SchemaArray sortByText(SchemaArray array) {
            return SchemaValue.array(array.getElements().stream()
                    .sorted(Comparator.comparing(SchemaValue::asText))
                    .toList());
        }

        // required-sorting is not reapplied inside the collapsed elements
        private SchemaArray collapse(SchemaArray array) {
            Normalizer nested = new Normalizer(policy.withSortRequired(false));
            List<SchemaString> texts = array.getElements().stream()
                    .map(element -> element.accept(nested).asText())
                    .sorted()
                    .map(SchemaValue::string)
                    .toList();
            return SchemaValue.array(texts);
        }
    }
}
