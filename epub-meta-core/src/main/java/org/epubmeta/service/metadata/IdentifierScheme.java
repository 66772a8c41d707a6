package org.epubmeta.service.metadata;

import lombok.Getter;

import java.util.List;

/**
 * Well known values of the {@code opf:scheme} attribute of {@code dc:identifier}. The first spelling is the one
 * written to new identifiers, all of them are accepted when reading.
 */
@Getter
public enum IdentifierScheme {
    UUID("UUID", "URN"),
    URI("URI"),
    ISBN("ISBN"),
    GOOGLE("GOOGLE"),
    AMAZON("AMAZON");

    private final List<String> spellings;

    IdentifierScheme(String... spellings) {
        this.spellings = List.of(spellings);
    }
}
