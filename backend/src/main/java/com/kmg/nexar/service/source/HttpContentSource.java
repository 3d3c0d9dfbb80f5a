package com.kmg.nexar.service.source;

import com.kmg.nexar.exception.SourceUnavailableException;
import com.kmg.nexar.exception.TransientTransferException;
import com.kmg.nexar.model.DownloadJob;
import com.kmg.nexar.model.SourceDescriptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.EOFException;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Serves {@code http:} and {@code https:} URIs with ranged GETs. The whole-file digest is taken
 * from the {@value #CHECKSUM_HEADER} response header when the origin sends it.
 */
@Component
public class HttpContentSource implements ContentSource {
    private static final Logger log = LoggerFactory.getLogger(HttpContentSource.class);

    public static final String CHECKSUM_HEADER = "X-Checksum-Sha256";
    private static final Pattern CONTENT_RANGE = Pattern.compile("^bytes\\s+(\\d+)-\\d+/");

    private final OkHttpClient httpClient;

    public HttpContentSource(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public boolean supports(URI uri) {
        String scheme = uri.getScheme();
        if (scheme == null) {
            return false;
        }
        String normalized = scheme.toLowerCase(Locale.ROOT);
        return ("http".equals(normalized) || "https".equals(normalized))
                && uri.getHost() != null
                && !uri.getHost().isBlank();
    }

    @Override
    public SourceDescriptor describe(URI uri) throws IOException {
        Request request = new Request.Builder()
                .url(uri.toString())
                .header("Accept-Encoding", "identity")
                .head()
                .build();
        try (Response response = execute(request)) {
            checkStatus(uri, response);
            long length = isIdentityEncoded(response)
                    ? parseLength(response.header("Content-Length"))
                    : DownloadJob.UNKNOWN_SIZE;
            String sha256 = response.header(CHECKSUM_HEADER);
            return SourceDescriptor.of(uri, length, sha256 == null ? null : sha256.trim().toLowerCase(Locale.ROOT));
        }
    }

    @Override
    public byte[] read(URI uri, long offset, int length) throws IOException {
        Request request = new Request.Builder()
                .url(uri.toString())
                .header("Range", "bytes=" + offset + "-" + (offset + length - 1))
                .header("Accept-Encoding", "identity")
                .get()
                .build();
        try (Response response = execute(request)) {
            if (response.code() == 416) {
                return new byte[0];
            }
            checkStatus(uri, response);
            ResponseBody body = response.body();
            if (body == null) {
                return new byte[0];
            }
            BufferedSource source = body.source();
            if (response.code() == 206) {
                checkRangeStart(uri, response.header("Content-Range"), offset);
            } else if (offset > 0) {
                log.debug("Origin ignored range request for {}; skipping {} bytes", uri, offset);
                try {
                    source.skip(offset);
                } catch (EOFException e) {
                    return new byte[0];
                }
            }
            return readUpTo(source, length);
        }
    }

    private Response execute(Request request) throws IOException {
        try {
            return httpClient.newCall(request).execute();
        } catch (IOException e) {
            throw new TransientTransferException("Request to " + request.url() + " failed: " + e.getMessage(), e);
        }
    }

    private void checkStatus(URI uri, Response response) throws IOException {
        int code = response.code();
        if (code >= 200 && code < 300) {
            return;
        }
        if (code == 408 || code == 429 || code >= 500) {
            throw new TransientTransferException("HTTP " + code + " from " + uri);
        }
        throw new SourceUnavailableException("HTTP " + code + " from " + uri);
    }

    private boolean isIdentityEncoded(Response response) {
        String encoding = response.header("Content-Encoding");
        return encoding == null || encoding.isBlank() || "identity".equalsIgnoreCase(encoding.trim());
    }

    private void checkRangeStart(URI uri, String contentRange, long offset) throws IOException {
        if (contentRange == null) {
            return;
        }
        Matcher matcher = CONTENT_RANGE.matcher(contentRange.trim());
        if (!matcher.find() || Long.parseLong(matcher.group(1)) != offset) {
            throw new TransientTransferException("Range response from " + uri + " was '" + contentRange
                    + "', expected start " + offset);
        }
    }

    private byte[] readUpTo(BufferedSource source, int length) throws IOException {
        Buffer buffer = new Buffer();
        try {
            while (buffer.size() < length) {
                long read = source.read(buffer, length - buffer.size());
                if (read < 0) {
                    break;
                }
            }
        } catch (IOException e) {
            throw new TransientTransferException("Connection dropped while reading: " + e.getMessage(), e);
        }
        return buffer.readByteArray();
    }

    private long parseLength(String header) {
        if (header == null || header.isBlank()) {
            return DownloadJob.UNKNOWN_SIZE;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return DownloadJob.UNKNOWN_SIZE;
        }
    }
}
