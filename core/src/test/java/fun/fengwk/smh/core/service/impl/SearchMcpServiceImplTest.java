package fun.fengwk.smh.core.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.smh.core.facade.search.SearchBackendException;
import fun.fengwk.smh.core.facade.search.SearchFacade;
import fun.fengwk.smh.core.facade.search.model.SearchCategory;
import fun.fengwk.smh.core.facade.search.model.SearchRequest;
import fun.fengwk.smh.core.service.catalog.CatalogVariant;
import fun.fengwk.smh.core.service.catalog.SearchToolCatalog;
import fun.fengwk.smh.core.service.catalog.SearchToolProperties;
import fun.fengwk.smh.core.service.enrich.ContentEnrichmentService;
import fun.fengwk.smh.core.service.enrich.EnrichmentProperties;
import fun.fengwk.smh.core.service.model.SearchToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * SearchMcpServiceImpl tests.
 *
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class SearchMcpServiceImplTest {

    @Mock
    private SearchFacade searchFacade;

    @Mock
    private ContentEnrichmentService contentEnrichmentService;

    private SearchToolProperties searchToolProperties;

    private SearchMcpServiceImpl service;

    @BeforeEach
    void setUp() {
        searchToolProperties = new SearchToolProperties();
        service = newService();
    }

    @Test
    void shouldRejectUnknownTool() {
        SearchToolResult result = service.invoke("search_everything", Map.of("query", "q"));

        assertThat(result.isError()).isTrue();
        assertThat(result.getText()).isEqualTo("Unknown tool: search_everything");
        verifyNoInteractions(searchFacade, contentEnrichmentService);
    }

    @Test
    void shouldApplyDefaultArguments() {
        when(searchFacade.search(any())).thenReturn(List.of(textResult("日本語 title")));

        SearchToolResult result = service.invoke("search_text", Map.of("query", "java records"));

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchFacade).search(captor.capture());
        SearchRequest request = captor.getValue();
        assertThat(request.getQuery()).isEqualTo("java records");
        assertThat(request.getCategory()).isEqualTo(SearchCategory.TEXT);
        assertThat(request.getRegion()).isEqualTo("us-en");
        assertThat(request.getSafesearch()).isEqualTo("moderate");
        assertThat(request.getTimelimit()).isNull();
        assertThat(request.getMaxResults()).isEqualTo(10);
        assertThat(request.getBackend()).isNull();

        assertThat(result.isError()).isFalse();
        assertThat(result.getText()).startsWith("[").contains("\n").contains("日本語 title");
        verifyNoInteractions(contentEnrichmentService);
    }

    @Test
    void shouldEnrichTextResultsWhenRequested() {
        List<Map<String, Object>> raw = List.of(textResult("a"));
        Map<String, Object> enriched = new LinkedHashMap<>(textResult("a"));
        enriched.put(ContentEnrichmentService.FULL_CONTENT_KEY, "page text");
        when(searchFacade.search(any())).thenReturn(raw);
        when(contentEnrichmentService.enrich(eq(raw), eq(5), eq(2000))).thenReturn(List.of(enriched));

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("query", "q");
        arguments.put("fetch_full_content", true);
        arguments.put("max_content_length", 2000);
        SearchToolResult result = service.invoke("search_text", arguments);

        assertThat(result.isError()).isFalse();
        assertThat(result.getText()).contains("\"full_content\" : \"page text\"");
    }

    @Test
    void shouldSkipEnrichmentForEmptyResults() {
        when(searchFacade.search(any())).thenReturn(List.of());

        SearchToolResult result = service.invoke("search_text", Map.of("query", "q", "fetch_full_content", true));

        assertThat(result.isError()).isFalse();
        assertThat(result.getText()).isEqualTo("[ ]");
        verifyNoInteractions(contentEnrichmentService);
    }

    @Test
    void shouldNeverEnrichOtherTools() {
        when(searchFacade.search(any())).thenReturn(List.of(Map.of("title", "news", "url", "https://example.com")));

        SearchToolResult result = service.invoke("search_news", Map.of("query", "q", "fetch_full_content", true));

        assertThat(result.isError()).isFalse();
        verify(contentEnrichmentService, never()).enrich(anyList(), anyInt(), anyInt());
    }

    @Test
    void shouldConvertBackendFailure() {
        when(searchFacade.search(any())).thenThrow(new SearchBackendException("search backend returned status 502"));

        SearchToolResult result = service.invoke("search_news", Map.of("query", "q"));

        assertThat(result.isError()).isTrue();
        assertThat(result.getText()).isEqualTo("Error performing search: search backend returned status 502");
    }

    @Test
    void shouldReportBooksUnavailable() {
        when(searchFacade.supports(SearchCategory.BOOKS)).thenReturn(false);

        SearchToolResult result = service.invoke("search_books", Map.of("query", "effective java"));

        assertThat(result.isError()).isTrue();
        assertThat(result.getText()).isEqualTo("Error: 'books' search backend not available in this deployment.");
        verify(searchFacade, never()).search(any());
    }

    @Test
    void shouldSearchBooksWhenSupported() {
        when(searchFacade.supports(SearchCategory.BOOKS)).thenReturn(true);
        when(searchFacade.search(any())).thenReturn(List.of(Map.of("title", "Effective Java", "author", "Joshua Bloch")));

        SearchToolResult result = service.invoke("search_books", Map.of("query", "effective java"));

        assertThat(result.isError()).isFalse();
        assertThat(result.getText()).contains("Joshua Bloch");
    }

    @Test
    void shouldValidateArguments() {
        assertThat(service.invoke("search_text", Map.of("query", " ")).getText()).isEqualTo("Error: query is required");
        assertThat(service.invoke("search_text", Map.of("query", "q", "safesearch", "strict")).getText())
            .isEqualTo("Error: safesearch must be one of [on, moderate, off]");
        assertThat(service.invoke("search_text", Map.of("query", "q", "timelimit", "h")).getText())
            .isEqualTo("Error: timelimit must be one of [d, w, m, y]");
        assertThat(service.invoke("search_text", Map.of("query", "q", "max_results", 0)).getText())
            .isEqualTo("Error: max_results must be positive");
        assertThat(service.invoke("search_text", Map.of("query", "q", "max_results", "many")).isError()).isTrue();
        verifyNoInteractions(searchFacade);
    }

    @Test
    void shouldPassBackendInMetasearchVariant() {
        searchToolProperties.setVariant(CatalogVariant.METASEARCH);
        service = newService();
        when(searchFacade.search(any())).thenReturn(List.of());

        service.invoke("search_text", Map.of("query", "q", "backend", "brave", "timelimit", "d"));

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchFacade).search(captor.capture());
        assertThat(captor.getValue().getBackend()).isEqualTo("brave");
        assertThat(captor.getValue().getTimelimit()).isEqualTo("d");
    }

    @Test
    void shouldHideStandardOnlyToolsInMetasearchVariant() {
        searchToolProperties.setVariant(CatalogVariant.METASEARCH);
        service = newService();

        SearchToolResult result = service.invoke("search_images", Map.of("query", "q"));

        assertThat(result.getText()).isEqualTo("Unknown tool: search_images");
    }

    private SearchMcpServiceImpl newService() {
        return new SearchMcpServiceImpl(
            new SearchToolCatalog(searchToolProperties),
            searchToolProperties,
            searchFacade,
            contentEnrichmentService,
            new EnrichmentProperties(),
            new ObjectMapper()
        );
    }

    private static Map<String, Object> textResult(String title) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("title", title);
        item.put("href", "https://example.com/" + title.length());
        item.put("body", "body");
        return item;
    }

}
