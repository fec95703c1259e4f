package com.chemfetch.sds.classify;

import org.apache.commons.lang3.StringUtils;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Outcome of one HTTP exchange after redirects were followed.
 *
 * @param status      final status code
 * @param finalUrl    URL that produced the final response
 * @param contentType raw {@code Content-Type} header, or {@code null}
 * @param body        body bytes read (possibly truncated for sniffing), never {@code null}
 */
public record FetchResult(int status, String finalUrl, String contentType, byte[] body) {

    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    /** Magic bytes are searched within this many leading bytes (some servers prepend junk). */
    private static final int MAGIC_WINDOW = 1024;

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * @return the media type without parameters, lower-cased, or an empty string
     */
    public String mediaType() {
        if (StringUtils.isBlank(contentType)) {
            return "";
        }
        return StringUtils.substringBefore(contentType, ";").trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @return whether the body starts (within the first KiB) with the {@code %PDF-} marker
     */
    public boolean hasPdfMagic() {
        int limit = Math.min(body.length, MAGIC_WINDOW) - PDF_MAGIC.length;
        for (int i = 0; i <= limit; i++) {
            if (magicAt(i)) {
                return true;
            }
        }
        return false;
    }

    private boolean magicAt(final int offset) {
        for (int j = 0; j < PDF_MAGIC.length; j++) {
            if (body[offset + j] != PDF_MAGIC[j]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decodes the body using the declared charset, UTF-8 otherwise.
     *
     * @return the body as text
     */
    public String text() {
        Charset charset = StandardCharsets.UTF_8;
        String declared = StringUtils.substringAfter(StringUtils.defaultString(contentType).toLowerCase(Locale.ROOT),
                "charset=");
        if (StringUtils.isNotBlank(declared)) {
            try {
                charset = Charset.forName(declared.replace("\"", "").trim());
            } catch (IllegalArgumentException ex) {
                charset = StandardCharsets.UTF_8;
            }
        }
        return new String(body, charset);
    }
}
