package fun.fengwk.smh.core.service.fetch.impl;

import fun.fengwk.smh.core.configuration.HttpClientProxyProperties;
import fun.fengwk.smh.core.service.enrich.EnrichmentProperties;
import fun.fengwk.smh.core.service.fetch.PageFetcher;
import fun.fengwk.smh.core.service.parser.ContentExtractor;
import fun.fengwk.smh.core.utils.TextTruncation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.ByteArrayOutputStream;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * JDK HttpClient based page fetcher with a browser-like request signature.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class HttpPageFetcher implements PageFetcher {

    private final EnrichmentProperties properties;
    private final ContentExtractor contentExtractor;
    private final HttpClient httpClient;

    public HttpPageFetcher(EnrichmentProperties properties,
                           ContentExtractor contentExtractor,
                           HttpClientProxyProperties proxyProperties) {
        this.properties = properties;
        this.contentExtractor = contentExtractor;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.ALWAYS)
            .connectTimeout(Duration.ofMillis(Math.max(1, properties.getConnectTimeoutMs())));
        ProxySelector proxySelector = proxyProperties == null ? null : proxyProperties.toProxySelector();
        if (proxySelector != null) {
            builder.proxy(proxySelector);
        }
        this.httpClient = builder.build();
    }

    @Override
    public String fetch(String url, Duration timeout, int maxLength) {
        HttpRequest request;
        try {
            request = buildGetRequest(url, timeout);
        } catch (IllegalArgumentException ex) {
            log.debug("build page request failed, url={}, error={}", url, ex.getMessage());
            return null;
        }

        long timeoutMs = request.timeout().orElse(Duration.ofMillis(properties.getFetchTimeoutMs())).toMillis();
        int maxBodyBytes = Math.max(1, properties.getMaxBodyBytes());
        CompletableFuture<HttpResponse<byte[]>> future;
        try {
            future = httpClient.sendAsync(request, responseInfo -> bodySubscriber(responseInfo, maxBodyBytes));
        } catch (RuntimeException ex) {
            log.warn("page fetch failed, url={}, error={}", url, ex.toString());
            return null;
        }
        try {
            // request timeout only covers the headers, the deadline covers the body as well
            HttpResponse<byte[]> response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response.statusCode() != 200) {
                log.warn("page fetch rejected, url={}, statusCode={}", url, response.statusCode());
                return null;
            }
            String contentType = response.headers().firstValue("Content-Type").orElse("");
            if (!isTextual(contentType)) {
                log.debug("page fetch skipped non textual content, url={}, contentType={}", url, contentType);
                return null;
            }
            byte[] body = response.body();
            if (body == null || body.length == 0) {
                return null;
            }
            String html = new String(body, resolveCharset(contentType));
            String text = contentExtractor.extract(html, response.uri().toString());
            if (!StringUtils.hasText(text)) {
                log.debug("page has no main content, url={}", url);
                return null;
            }
            return TextTruncation.truncate(text, maxLength);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("page fetch timed out, url={}, timeoutMs={}", url, timeoutMs);
            return null;
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.debug("page fetch interrupted, url={}", url);
            return null;
        } catch (ExecutionException ex) {
            log.warn("page fetch failed, url={}, error={}", url, String.valueOf(ex.getCause()));
            return null;
        } catch (RuntimeException ex) {
            log.warn("page fetch failed, url={}, error={}", url, ex.toString());
            return null;
        }
    }

    HttpClient getHttpClient() {
        return httpClient;
    }

    private static HttpResponse.BodySubscriber<byte[]> bodySubscriber(HttpResponse.ResponseInfo responseInfo, int maxBodyBytes) {
        String contentType = responseInfo.headers().firstValue("Content-Type").orElse("");
        if (responseInfo.statusCode() != 200 || !isTextual(contentType)) {
            return HttpResponse.BodySubscribers.replacing(null);
        }
        return new CappedBodySubscriber(maxBodyBytes);
    }

    private HttpRequest buildGetRequest(String url, Duration timeout) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("url is blank");
        }
        URI uri = URI.create(url.trim());
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("unsupported scheme: " + scheme);
        }
        Duration requestTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
            ? Duration.ofMillis(Math.max(1, properties.getFetchTimeoutMs()))
            : timeout;
        return HttpRequest.newBuilder(uri)
            .GET()
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", properties.getAccept())
            .header("Accept-Language", properties.getAcceptLanguage())
            .timeout(requestTimeout)
            .build();
    }

    static boolean isTextual(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return true;
        }
        String mimeType = contentType.toLowerCase(Locale.ROOT);
        return mimeType.startsWith("text/") || mimeType.contains("html") || mimeType.contains("xml");
    }

    static Charset resolveCharset(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String token = part.trim();
            if (token.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = token.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException ex) {
                    log.debug("unknown charset, charset={}", name);
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    /**
     * Collects at most {@code maxBytes} of the body, then cancels the rest of the exchange.
     */
    static class CappedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {

        private final int maxBytes;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final CompletableFuture<byte[]> body = new CompletableFuture<>();
        private Flow.Subscription subscription;

        CappedBodySubscriber(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return body;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(1);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (body.isDone()) {
                return;
            }
            for (ByteBuffer item : items) {
                int length = Math.min(item.remaining(), maxBytes - buffer.size());
                byte[] chunk = new byte[length];
                item.get(chunk);
                buffer.write(chunk, 0, length);
                if (buffer.size() >= maxBytes) {
                    subscription.cancel();
                    body.complete(buffer.toByteArray());
                    return;
                }
            }
            subscription.request(1);
        }

        @Override
        public void onError(Throwable throwable) {
            body.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            body.complete(buffer.toByteArray());
        }

    }

}
