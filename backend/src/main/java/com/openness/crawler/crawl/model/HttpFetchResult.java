package com.openness.crawler.crawl.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Raw HTTP outcome. {@code body} is always decoded as UTF-8; HTML callers should parse {@code bodyBytes}
 * with {@link #declaredCharset()} instead.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /**
     * Charset named in the Content-Type header, or null when absent or not supported by this JVM.
     */
    public String declaredCharset() {
        if (contentType == null) {
            return null;
        }
        for (String part : contentType.split(";")) {
            String param = part.trim();
            if (!param.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                continue;
            }
            String name = param.substring("charset=".length()).trim().replace("\"", "").replace("'", "");
            try {
                return !name.isEmpty() && Charset.isSupported(name) ? name : null;
            } catch (IllegalCharsetNameException e) {
                return null;
            }
        }
        return null;
    }

    public String errorKey() {
        if (errorCode != null) {
            return errorCode;
        }
        if (statusCode > 0) {
            return "http_" + statusCode;
        }
        return "unknown_error";
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorMessage == null || errorMessage.isBlank()
                ? errorCode
                : errorCode + ": " + errorMessage;
        }
        return "HTTP " + statusCode;
    }
}
