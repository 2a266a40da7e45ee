package com.schemaidentity.provider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.schemaidentity.model.SchemaType;

/**
 * Resolves qualified names from {@link SchemaType#getLocation()}. With two parts,
 * {@code /a/b/c/d.py} + {@code Order} gives {@code c.d.Order}.
 */
public class PathFullnameResolver implements FullnameResolver {

    @Override
    public String resolve(SchemaType type, int keepPathParts) {
        List<String> parts = new ArrayList<>(truncate(type.getLocation().orElse(""), keepPathParts));
        parts.add(type.getName());
        return String.join(".", parts);
    }

    /**
     * Last {@code keep} segments of a path, the final one without its file extension.
     */
    static List<String> truncate(String location, int keep) {
        if (keep <= 0 || location.isBlank()) {
            return List.of();
        }
        List<String> segments = Arrays.stream(location.split("[/\\\\]+"))
                .filter(s -> !s.isEmpty())
                .toList();
        if (segments.isEmpty()) {
            return List.of();
        }
        List<String> kept = new ArrayList<>(segments.subList(Math.max(0, segments.size() - keep), segments.size()));
        int last = kept.size() - 1;
        kept.set(last, stripExtension(kept.get(last)));
        return kept;
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
