package com.capturequeue.app;

import com.capturequeue.core.FetchFailure;
import com.capturequeue.core.FetchedContent;
import com.capturequeue.spi.ContentFetcher;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ContentFetcher} over {@link HttpURLConnection}.
 *
 * <p>Follows redirects, rejects non-2xx responses, and refuses bodies larger
 * than the configured limit. The page title is taken from the first
 * {@code <title>} element.</p>
 */
public class HttpContentFetcher implements ContentFetcher {
    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern CHARSET = Pattern.compile("charset=([\\w-]+)", Pattern.CASE_INSENSITIVE);
    private static final String USER_AGENT = "capture-queue/1.0";

    private final int maxContentBytes;

    public HttpContentFetcher(int maxContentBytes) {
        this.maxContentBytes = maxContentBytes;
    }

    @Override
    public FetchedContent fetchContent(String url, Duration timeout) throws FetchFailure {
        int timeoutMs = (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) new URL(url).openConnection();
            conn.setRequestMethod("GET");
            conn.setInstanceFollowRedirects(true);
            conn.setConnectTimeout(timeoutMs);
            conn.setReadTimeout(timeoutMs);
            conn.setRequestProperty("User-Agent", USER_AGENT);
            conn.setRequestProperty("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8");

            int status = conn.getResponseCode();
            if (status < 200 || status >= 300) {
                throw new FetchFailure(url, "HTTP " + status);
            }

            byte[] body;
            try (InputStream in = conn.getInputStream()) {
                body = readLimited(url, in);
            }
            String html = new String(body, charsetOf(conn.getContentType()));
            return new FetchedContent(html, extractTitle(html));

        } catch (SocketTimeoutException e) {
            throw new FetchFailure(url, "Timeout after " + timeoutMs + " ms", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchFailure(url, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }
    }

    private byte[] readLimited(String url, InputStream in) throws IOException, FetchFailure {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int read;
        while ((read = in.read(buffer)) != -1) {
            if (out.size() + read > maxContentBytes) {
                throw new FetchFailure(url, "Content exceeds " + maxContentBytes + " bytes");
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    static Charset charsetOf(String contentType) {
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

    /**
     * @return the trimmed, whitespace-collapsed title, or null if the page has none
     */
    static String extractTitle(String html) {
        Matcher m = TITLE.matcher(html);
        if (!m.find()) {
            return null;
        }
        String title = BasicMarkdownExtractor.decodeEntities(m.group(1)).replaceAll("\\s+", " ").trim();
        return title.isEmpty() ? null : title;
    }
}
