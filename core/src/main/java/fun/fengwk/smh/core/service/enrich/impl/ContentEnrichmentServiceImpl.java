package fun.fengwk.smh.core.service.enrich.impl;

import fun.fengwk.smh.core.service.enrich.ContentEnrichmentService;
import fun.fengwk.smh.core.service.enrich.EnrichmentProperties;
import fun.fengwk.smh.core.service.fetch.PageFetcher;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor based fan-out with a per call semaphore.
 *
 * @author fengwk
 */
@Slf4j
@Service
public class ContentEnrichmentServiceImpl implements ContentEnrichmentService {

    private static final long JOIN_GRACE_MS = 5000L;

    private final PageFetcher pageFetcher;
    private final EnrichmentProperties properties;
    private final ExecutorService executor;

    public ContentEnrichmentServiceImpl(PageFetcher pageFetcher, EnrichmentProperties properties) {
        this.pageFetcher = pageFetcher;
        this.properties = properties;
        this.executor = Executors.newCachedThreadPool(new EnrichThreadFactory());
    }

    @Override
    public List<Map<String, Object>> enrich(List<Map<String, Object>> results, int concurrencyLimit, int maxLength) {
        if (results == null || results.isEmpty()) {
            return new ArrayList<>();
        }
        int limit = concurrencyLimit > 0 ? concurrencyLimit : Math.max(1, properties.getConcurrencyLimit());
        int length = maxLength > 0 ? maxLength : properties.getMaxContentLength();
        Duration timeout = Duration.ofMillis(Math.max(1, properties.getFetchTimeoutMs()));
        Semaphore semaphore = new Semaphore(limit);

        List<Map<String, Object>> enriched = new ArrayList<>(results.size());
        List<Future<String>> futures = new ArrayList<>(results.size());
        boolean interrupted = false;
        for (Map<String, Object> result : results) {
            Map<String, Object> copy = result == null ? new LinkedHashMap<>() : new LinkedHashMap<>(result);
            enriched.add(copy);
            String url = resolveUrl(copy);
            if (interrupted || url == null) {
                futures.add(null);
                continue;
            }
            try {
                if (!semaphore.tryAcquire(properties.getAcquireTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.warn("enrich slot wait timed out, url={}", url);
                    futures.add(null);
                    continue;
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                interrupted = true;
                futures.add(null);
                continue;
            }
            futures.add(submit(url, timeout, length, semaphore));
        }

        for (int i = 0; i < enriched.size(); i++) {
            String content = join(futures.get(i), timeout);
            enriched.get(i).put(FULL_CONTENT_KEY, content == null ? EXTRACTION_FAILED : content);
        }
        return enriched;
    }

    private Future<String> submit(String url, Duration timeout, int maxLength, Semaphore semaphore) {
        try {
            return executor.submit(() -> {
                try {
                    return pageFetcher.fetch(url, timeout, maxLength);
                } finally {
                    semaphore.release();
                }
            });
        } catch (RejectedExecutionException ex) {
            semaphore.release();
            log.warn("enrich task rejected, url={}, error={}", url, ex.getMessage());
            return null;
        }
    }

    private String join(Future<String> future, Duration timeout) {
        if (future == null) {
            return null;
        }
        if (Thread.currentThread().isInterrupted()) {
            // take what is already there, leave the rest to finish on their own
            return future.isDone() && !future.isCancelled() ? getDone(future) : null;
        }
        try {
            return future.get(timeout.toMillis() + JOIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException ex) {
            log.warn("enrich task failed, error={}", String.valueOf(ex.getCause()));
            return null;
        } catch (TimeoutException ex) {
            log.warn("enrich task timed out, timeoutMs={}", timeout.toMillis() + JOIN_GRACE_MS);
            return null;
        }
    }

    private String getDone(Future<String> future) {
        try {
            return future.get(0, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return null;
        } catch (TimeoutException ex) {
            return null;
        } catch (ExecutionException ex) {
            log.warn("enrich task failed, error={}", String.valueOf(ex.getCause()));
            return null;
        }
    }

    private static String resolveUrl(Map<String, Object> item) {
        Object href = item.get("href");
        if (href != null && StringUtils.hasText(String.valueOf(href))) {
            return String.valueOf(href).trim();
        }
        Object url = item.get("url");
        if (url != null && StringUtils.hasText(String.valueOf(url))) {
            return String.valueOf(url).trim();
        }
        return null;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static class EnrichThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "smh-enrich-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }

    }

}
