package fun.fengwk.smh.core.facade.search.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.smh.core.facade.search.SearchBackendException;
import fun.fengwk.smh.core.facade.search.model.SearchCategory;
import fun.fengwk.smh.core.facade.search.model.SearchRequest;
import fun.fengwk.smh.core.facade.search.searxng.SearxngClient;
import fun.fengwk.smh.core.facade.search.searxng.SearxngClientResponse;
import fun.fengwk.smh.core.facade.search.searxng.SearxngProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SearchFacadeImpl tests.
 *
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class SearchFacadeImplTest {

    @Mock
    private SearxngClient searxngClient;

    private SearxngProperties searxngProperties;

    private SearchFacadeImpl searchFacade;

    @BeforeEach
    void setUp() {
        searxngProperties = new SearxngProperties();
        searxngProperties.setMaxPages(3);
        searchFacade = new SearchFacadeImpl(searxngClient, searxngProperties, new ObjectMapper());
    }

    @Test
    void shouldRejectBlankQuery() {
        SearchRequest request = SearchRequest.builder().query(" ").build();

        assertThatThrownBy(() -> searchFacade.search(request))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("query is blank");
        verify(searxngClient, never()).search(anyMap());
    }

    @Test
    void shouldMapTextResultsAndStopAtLimit() {
        when(searxngClient.search(anyMap()))
            .thenReturn(ok(buildJsonResults(1, 8)))
            .thenReturn(ok(buildJsonResults(9, 8)));

        List<Map<String, Object>> results = searchFacade.search(SearchRequest.builder()
            .query("spring ai")
            .maxResults(10)
            .build());

        assertThat(results).hasSize(10);
        assertThat(results.get(0))
            .containsEntry("title", "title-1")
            .containsEntry("href", "https://example.com/1")
            .containsEntry("body", "content-1");
        assertThat(results.get(0).keySet()).containsExactly("title", "href", "body");
        assertThat(results.get(9)).containsEntry("href", "https://example.com/10");
        verify(searxngClient, times(2)).search(anyMap());
    }

    @Test
    void shouldStopPagingWhenPageAddsNothingNew() {
        when(searxngClient.search(anyMap()))
            .thenReturn(ok(buildJsonResults(1, 3)))
            .thenReturn(ok(buildJsonResults(1, 3)));

        List<Map<String, Object>> results = searchFacade.search(SearchRequest.builder()
            .query("spring ai")
            .maxResults(10)
            .build());

        assertThat(results).hasSize(3);
        verify(searxngClient, times(2)).search(anyMap());
    }

    @Test
    void shouldStopPagingOnEmptyPage() {
        when(searxngClient.search(anyMap()))
            .thenReturn(ok(buildJsonResults(1, 2)))
            .thenReturn(ok("{\"results\":[]}"));

        List<Map<String, Object>> results = searchFacade.search(SearchRequest.builder().query("q").build());

        assertThat(results).hasSize(2);
        verify(searxngClient, times(2)).search(anyMap());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldTranslateRequestParameters() {
        when(searxngClient.search(anyMap())).thenReturn(ok("{\"results\":[]}"));

        searchFacade.search(SearchRequest.builder()
            .query("jdk release")
            .category(SearchCategory.NEWS)
            .region("uk-en")
            .safesearch("off")
            .timelimit("w")
            .backend("google")
            .build());

        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(searxngClient).search(captor.capture());
        Map<String, String> params = captor.getValue();
        assertThat(params)
            .containsEntry("q", "jdk release")
            .containsEntry("categories", "news")
            .containsEntry("language", "en-GB")
            .containsEntry("safesearch", "0")
            .containsEntry("time_range", "week")
            .containsEntry("engines", "google")
            .containsEntry("pageno", "1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldUseDefaultEnginesForAutoBackend() {
        when(searxngClient.search(anyMap())).thenReturn(ok("{\"results\":[]}"));

        searchFacade.search(SearchRequest.builder().query("q").backend("auto").build());

        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(searxngClient).search(captor.capture());
        assertThat(captor.getValue())
            .doesNotContainKey("engines")
            .doesNotContainKey("time_range")
            .containsEntry("language", "all")
            .containsEntry("safesearch", "1");
    }

    @Test
    void shouldMapImageResults() {
        when(searxngClient.search(anyMap())).thenReturn(ok("""
            {"results":[{"title":"logo","url":"https://example.com/page","img_src":"https://example.com/a.png",
            "thumbnail_src":"https://example.com/t.png","resolution":"640 x 480","engine":"bing images"}]}
            """), ok("{\"results\":[]}"));

        List<Map<String, Object>> results = searchFacade.search(SearchRequest.builder()
            .query("logo")
            .category(SearchCategory.IMAGES)
            .build());

        assertThat(results).hasSize(1);
        assertThat(results.get(0))
            .containsEntry("image", "https://example.com/a.png")
            .containsEntry("thumbnail", "https://example.com/t.png")
            .containsEntry("url", "https://example.com/page")
            .containsEntry("width", 640)
            .containsEntry("height", 480)
            .containsEntry("source", "bing images");
    }

    @Test
    void shouldThrowOnBackendStatus() {
        when(searxngClient.search(anyMap())).thenReturn(SearxngClientResponse.builder().statusCode(502).body("bad").build());

        assertThatThrownBy(() -> searchFacade.search(SearchRequest.builder().query("q").build()))
            .isInstanceOf(SearchBackendException.class)
            .hasMessageContaining("502");
    }

    @Test
    void shouldThrowOnTransportError() {
        when(searxngClient.search(anyMap())).thenReturn(SearxngClientResponse.builder()
            .error(new IOException("connection refused"))
            .build());

        assertThatThrownBy(() -> searchFacade.search(SearchRequest.builder().query("q").build()))
            .isInstanceOf(SearchBackendException.class)
            .hasMessageContaining("connection refused");
    }

    @Test
    void shouldThrowOnInvalidJson() {
        when(searxngClient.search(anyMap())).thenReturn(ok("<html>not json</html>"));

        assertThatThrownBy(() -> searchFacade.search(SearchRequest.builder().query("q").build()))
            .isInstanceOf(SearchBackendException.class);
    }

    @Test
    void shouldProbeCategoriesOnce() {
        when(searxngClient.fetchConfig()).thenReturn(ok("{\"categories\":[\"general\",\"news\",\"books\"]}"));

        assertThat(searchFacade.supports(SearchCategory.BOOKS)).isTrue();
        assertThat(searchFacade.supports(SearchCategory.NEWS)).isTrue();
        assertThat(searchFacade.supports(SearchCategory.VIDEOS)).isFalse();

        verify(searxngClient, times(1)).fetchConfig();
    }

    @Test
    void shouldFallBackToDefaultCategoriesWhenProbeFails() {
        when(searxngClient.fetchConfig()).thenReturn(SearxngClientResponse.builder().statusCode(500).build());

        assertThat(searchFacade.supports(SearchCategory.BOOKS)).isFalse();
        assertThat(searchFacade.supports(SearchCategory.TEXT)).isTrue();
    }

    @Test
    void shouldTranslateRegionCodes() {
        assertThat(SearchFacadeImpl.toLanguage("us-en")).isEqualTo("en-US");
        assertThat(SearchFacadeImpl.toLanguage("de-de")).isEqualTo("de-DE");
        assertThat(SearchFacadeImpl.toLanguage("wt-wt")).isEqualTo("all");
        assertThat(SearchFacadeImpl.toLanguage(null)).isEqualTo("all");
        assertThat(SearchFacadeImpl.toSafesearchLevel("on")).isEqualTo("2");
        assertThat(SearchFacadeImpl.toTimeRange("y")).isEqualTo("year");
        assertThat(SearchFacadeImpl.toTimeRange("x")).isNull();
    }

    private static SearxngClientResponse ok(String body) {
        return SearxngClientResponse.builder().statusCode(200).body(body).build();
    }

    private static String buildJsonResults(int from, int count) {
        StringBuilder builder = new StringBuilder();
        builder.append("{\"results\":[");
        for (int i = from; i < from + count; i++) {
            if (i > from) {
                builder.append(',');
            }
            builder.append("{\"title\":\"title-").append(i)
                .append("\",\"url\":\"https://example.com/").append(i)
                .append("\",\"content\":\"content-").append(i)
                .append("\"}");
        }
        builder.append("]}");
        return builder.toString();
    }

}
