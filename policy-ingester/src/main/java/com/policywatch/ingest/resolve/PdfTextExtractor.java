package com.policywatch.ingest.resolve;

import com.itextpdf.kernel.pdf.PdfDate;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfDocumentInfo;
import com.itextpdf.kernel.pdf.PdfReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Calendar;
import java.util.Locale;

/**
 * Page text plus Info-dictionary title and creation date, via iText.
 */
@Component
@Order(0)
@Slf4j
public class PdfTextExtractor implements DocumentTextExtractor {

    @Override
    public boolean supports(String contentType, String url) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("pdf")) {
            return true;
        }
        return url != null && url.toLowerCase(Locale.ROOT).matches(".*\\.pdf(?:[?#].*)?$");
    }

    @Override
    public ExtractedDocument extract(byte[] body, String contentType) throws IOException {
        try (PdfDocument pdf = new PdfDocument(new PdfReader(new ByteArrayInputStream(body)))) {
            StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pdf.getNumberOfPages(); page++) {
                text.append(com.itextpdf.kernel.pdf.canvas.parser.PdfTextExtractor
                        .getTextFromPage(pdf.getPage(page))).append('\n');
            }
            PdfDocumentInfo info = pdf.getDocumentInfo();
            return new ExtractedDocument(
                    HtmlText.normalizeLines(text.toString()),
                    blankToNull(info.getTitle()),
                    creationDate(info.getMoreInfo("CreationDate")));
        } catch (RuntimeException e) {
            // iText signals malformed files with unchecked exceptions
            throw new IOException("Unreadable PDF: " + e.getMessage(), e);
        }
    }

    private static OffsetDateTime creationDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            Calendar calendar = PdfDate.decode(raw);
            return calendar.toInstant().atOffset(ZoneOffset.UTC);
        } catch (RuntimeException e) {
            log.debug("Unparseable PDF CreationDate '{}'", raw);
            return null;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
