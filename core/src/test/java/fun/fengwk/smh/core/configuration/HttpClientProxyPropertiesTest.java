package fun.fengwk.smh.core.configuration;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HttpClientProxyPropertiesTest {

    @Test
    public void testNoProxyConfigured() {
        assertThat(new HttpClientProxyProperties().toProxySelector()).isNull();
    }

    @Test
    public void testParseProxyForms() {
        Proxy http = HttpClientProxyProperties.parseProxy("http://proxy.local:3128");
        assertThat(http.type()).isEqualTo(Proxy.Type.HTTP);
        assertThat(((InetSocketAddress) http.address()).getHostString()).isEqualTo("proxy.local");
        assertThat(((InetSocketAddress) http.address()).getPort()).isEqualTo(3128);

        Proxy bare = HttpClientProxyProperties.parseProxy("proxy.local:8080");
        assertThat(((InetSocketAddress) bare.address()).getPort()).isEqualTo(8080);

        assertThat(HttpClientProxyProperties.parseProxy(" ")).isNull();
        assertThatThrownBy(() -> HttpClientProxyProperties.parseProxy("http://bad host:1"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testRejectsSocksProxy() {
        assertThatThrownBy(() -> HttpClientProxyProperties.parseProxy("socks5://proxy.local:1080"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unsupported proxy scheme");

        HttpClientProxyProperties properties = new HttpClientProxyProperties();
        properties.setHttpsProxy("socks://proxy.local:1080");
        assertThatThrownBy(properties::toProxySelector).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testSelectsProxyByScheme() {
        HttpClientProxyProperties properties = new HttpClientProxyProperties();
        properties.setHttpProxy("http-proxy.local:3128");
        properties.setHttpsProxy("https-proxy.local:3129");

        ProxySelector selector = properties.toProxySelector();

        assertThat(((InetSocketAddress) selector.select(URI.create("http://example.com")).get(0).address()).getHostString())
            .isEqualTo("http-proxy.local");
        assertThat(((InetSocketAddress) selector.select(URI.create("https://example.com")).get(0).address()).getHostString())
            .isEqualTo("https-proxy.local");
    }

    @Test
    public void testFallsBackToTheOnlyConfiguredProxy() {
        HttpClientProxyProperties properties = new HttpClientProxyProperties();
        properties.setHttpProxy("proxy.local:3128");

        ProxySelector selector = properties.toProxySelector();

        assertThat(selector.select(URI.create("https://example.com")).get(0).type()).isEqualTo(Proxy.Type.HTTP);
    }

}
