package org.netpreserve.sitescraper.util;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Filenames {
    static final int MAX_LENGTH = 140;
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]+");
    private static final Pattern DISPOSITION_FILENAME = Pattern.compile("filename\\*?=\"?([^\";]+)\"?",
            Pattern.CASE_INSENSITIVE);

    private Filenames() {
    }

    public static String sha1Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    public static String sha1Hex(String data) {
        return sha1Hex(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Replaces runs of characters that aren't safe in file names with an underscore and truncates the result.
     */
    public static String sanitize(String name) {
        String sanitized = StringUtils.truncate(UNSAFE.matcher(name).replaceAll("_"), MAX_LENGTH);
        return StringUtils.defaultIfEmpty(sanitized, "file");
    }

    /**
     * Picks a file name for a download from its Content-Disposition header, falling back to the last segment of
     * the URL's path.
     */
    public static String guess(Url url, @Nullable String contentDisposition) {
        String filename = null;
        if (contentDisposition != null) {
            Matcher matcher = DISPOSITION_FILENAME.matcher(contentDisposition);
            if (matcher.find()) {
                filename = matcher.group(1);
                // RFC 5987 form: charset'lang'value
                int quote = filename.lastIndexOf('\'');
                if (quote != -1) filename = percentDecode(filename.substring(quote + 1));
            }
        }
        if (filename == null || filename.isBlank()) {
            String path;
            try {
                path = url.toURI().getPath();
            } catch (URISyntaxException e) {
                path = null;
            }
            if (path != null) {
                filename = path.substring(path.lastIndexOf('/') + 1);
            }
        }
        if (filename == null || filename.isBlank()) filename = "index.html";
        return sanitize(filename);
    }

    private static String percentDecode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
