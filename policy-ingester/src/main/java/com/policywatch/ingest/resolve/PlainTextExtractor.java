package com.policywatch.ingest.resolve;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class PlainTextExtractor implements DocumentTextExtractor {

    @Override
    public boolean supports(String contentType, String url) {
        if (contentType != null) {
            String ct = contentType.toLowerCase(Locale.ROOT);
            return ct.startsWith("text/") && !ct.contains("html");
        }
        return url != null && url.toLowerCase(Locale.ROOT).endsWith(".txt");
    }

    @Override
    public ExtractedDocument extract(byte[] body, String contentType) {
        String text = new String(body, StandardCharsets.UTF_8);
        return new ExtractedDocument(HtmlText.normalizeLines(text), null, null);
    }
}
