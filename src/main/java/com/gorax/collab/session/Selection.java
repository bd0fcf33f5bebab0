package com.gorax.collab.session;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

public record Selection(
    String type,            // "node" or "edge"
    @JsonAlias("element_ids") List<String> elementIds
) {
    public Selection {
        elementIds = elementIds == null ? List.of() : List.copyOf(elementIds);
    }
}
