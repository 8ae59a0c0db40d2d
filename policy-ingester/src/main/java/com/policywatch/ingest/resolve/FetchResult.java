package com.policywatch.ingest.resolve;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Outcome of one logical GET (all retry attempts included). Failures are values, not exceptions.
 */
public record FetchResult(
        String requestedUrl,
        String finalUrl,
        FetchOutcome outcome,
        int status,
        String contentType,
        byte[] body,
        OffsetDateTime lastModified,
        String error) {

    private static final Pattern CHARSET = Pattern.compile("charset=\"?([\\w.:-]+)", Pattern.CASE_INSENSITIVE);

    public static FetchResult ok(String requestedUrl, String finalUrl, int status, String contentType,
                                 byte[] body, OffsetDateTime lastModified) {
        return new FetchResult(requestedUrl, finalUrl, FetchOutcome.OK, status, contentType, body, lastModified, null);
    }

    public static FetchResult transientFailure(String url, int status, String error) {
        return new FetchResult(url, url, FetchOutcome.TRANSIENT_FAILURE, status, null, new byte[0], null, error);
    }

    public static FetchResult permanentFailure(String url, int status, String error) {
        return new FetchResult(url, url, FetchOutcome.PERMANENT_FAILURE, status, null, new byte[0], null, error);
    }

    public boolean isOk() {
        return outcome == FetchOutcome.OK;
    }

    public boolean isHtml() {
        if (contentType == null || contentType.isBlank()) {
            return true; // servers that omit the header are almost always serving pages
        }
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("html") || ct.contains("xhtml");
    }

    public String bodyAsString() {
        return new String(body == null ? new byte[0] : body, charset());
    }

    private Charset charset() {
        if (contentType != null) {
            Matcher m = CHARSET.matcher(contentType);
            if (m.find()) {
                try {
                    return Charset.forName(m.group(1));
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
