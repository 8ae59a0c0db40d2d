package com.policywatch.ingest.resolve;

import java.io.IOException;

/**
 * Turns a fetched non-markup body (PDF, plain text) into text.
 */
public interface DocumentTextExtractor {

    boolean supports(String contentType, String url);

    ExtractedDocument extract(byte[] body, String contentType) throws IOException;
}
