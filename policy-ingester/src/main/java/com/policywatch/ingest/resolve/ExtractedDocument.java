package com.policywatch.ingest.resolve;

import java.time.OffsetDateTime;

/**
 * Text pulled out of a non-markup document.
 *
 * @param text      body text, paragraphs separated by newlines
 * @param title     title from the document's own metadata, may be null
 * @param timestamp creation timestamp from the document's own metadata, may be null
 */
public record ExtractedDocument(String text, String title, OffsetDateTime timestamp) {
}
