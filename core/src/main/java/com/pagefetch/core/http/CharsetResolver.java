package com.pagefetch.core.http;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 본문 바이트 → 문자열 디코딩.
 * 우선순위: Content-Type charset → 앞 1024바이트의 &lt;meta charset&gt; → UTF-8
 */
public final class CharsetResolver {
    private CharsetResolver() {}

    private static final int SNIFF_BYTES = 1024;
    private static final Pattern CT_CHARSET = Pattern.compile("charset\\s*=\\s*\"?([^\";\\s]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern META_CHARSET = Pattern.compile(
            "<meta[^>]+charset\\s*=\\s*[\"']?([A-Za-z0-9_\\-:.]+)", Pattern.CASE_INSENSITIVE);

    public static String decode(byte[] body, String contentType) {
        if (body == null || body.length == 0) return "";
        return new String(body, resolve(body, contentType));
    }

    public static Charset resolve(byte[] body, String contentType) {
        Charset cs = fromContentType(contentType);
        if (cs != null) return cs;
        if (body != null) {
            int n = Math.min(body.length, SNIFF_BYTES);
            // ASCII 호환 범위만 보면 되므로 ISO-8859-1로 훑는다
            String head = new String(body, 0, n, StandardCharsets.ISO_8859_1);
            Matcher m = META_CHARSET.matcher(head);
            if (m.find()) {
                cs = forName(m.group(1));
                if (cs != null) return cs;
            }
        }
        return StandardCharsets.UTF_8;
    }

    static Charset fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) return null;
        Matcher m = CT_CHARSET.matcher(contentType);
        return m.find() ? forName(m.group(1)) : null;
    }

    private static Charset forName(String name) {
        try {
            return Charset.forName(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknown) { // IllegalCharsetName/UnsupportedCharset 모두 여기로
            return null;
        }
    }
}
