package com.policywatch.ingest.polish;

/**
 * An external model that rewrites an extractive draft. Implementations throw on any failure;
 * the gate turns failures into "keep the draft".
 */
public interface PolishProvider {

    String name();

    String rewrite(String draft, String title, String url);
}
