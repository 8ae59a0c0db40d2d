package com.policywatch.ingest.model;

import lombok.Builder;
import lombok.Value;

/**
 * A catalog source. Created lazily on first reference and looked up by its unique name;
 * the id never changes for the life of the catalog.
 */
@Value
@Builder
public class Source {

    long id;
    String name;
    String kind;
    String baseUrl;
}
