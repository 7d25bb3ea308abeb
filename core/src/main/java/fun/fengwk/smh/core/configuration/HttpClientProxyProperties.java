package fun.fengwk.smh.core.configuration;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Proxy configuration for outbound page fetches.
 *
 * @author fengwk
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "smh.http.proxy")
public class HttpClientProxyProperties {

    /**
     * HTTP proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpProxy;

    /**
     * HTTPS proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpsProxy;

    /**
     * Build a selector routing http and https targets to their configured proxies.
     *
     * @return selector, or null when no proxy is configured
     */
    public ProxySelector toProxySelector() {
        Proxy http = parseProxy(httpProxy);
        Proxy https = parseProxy(httpsProxy);
        if (http == null && https == null) {
            return null;
        }
        log.info("http proxy configured, httpProxy={}, httpsProxy={}", nvl(httpProxy), nvl(httpsProxy));
        return new SchemeProxySelector(http, https);
    }

    static Proxy parseProxy(String proxyStr) {
        if (!StringUtils.hasText(proxyStr)) {
            return null;
        }
        String value = proxyStr.trim();
        try {
            URI uri = new URI(value.contains("://") ? value : "http://" + value);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            // java.net.http.HttpClient tunnels through HTTP proxies only
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                throw new IllegalArgumentException("unsupported proxy scheme: " + proxyStr);
            }
            String host = uri.getHost();
            if (host == null) {
                throw new IllegalArgumentException("invalid proxy: " + proxyStr);
            }
            int port = uri.getPort() == -1 ? 80 : uri.getPort();
            return new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(host, port));
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyStr, ex);
        }
    }

    private static String nvl(String value) {
        return value == null ? "" : value;
    }

    private static class SchemeProxySelector extends ProxySelector {

        private final Proxy http;
        private final Proxy https;

        SchemeProxySelector(Proxy http, Proxy https) {
            this.http = http;
            this.https = https;
        }

        @Override
        public List<Proxy> select(URI uri) {
            boolean secure = uri != null && "https".equalsIgnoreCase(uri.getScheme());
            Proxy proxy = secure ? (https != null ? https : http) : (http != null ? http : https);
            return List.of(proxy == null ? Proxy.NO_PROXY : proxy);
        }

        @Override
        public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
            log.warn("proxy connect failed, uri={}, proxy={}, error={}", uri, sa, ioe.getMessage());
        }

    }

}
