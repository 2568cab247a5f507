package com.psl.search.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.psl.schema.document.Author;
import com.psl.schema.document.PaperDocument;
import com.psl.search.api.dto.DocumentSetResponse;
import com.psl.search.api.dto.MatchedAuthor;
import com.psl.search.api.dto.PaperHit;
import com.psl.search.opensearch.OpenSearchUnavailableException;
import com.psl.search.pagination.PageLinks;
import com.psl.search.query.CursorRequiredException;
import com.psl.search.query.PaperQuery;
import com.psl.search.query.QueryException;
import com.psl.search.query.SearchType;
import com.psl.search.query.SortOrder;
import com.psl.search.service.DocumentNotFoundException;
import com.psl.search.service.PaperSearchService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PaperController.class)
class PaperControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PaperSearchService searchService;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void searchReturnsDocumentSetEnvelope() throws Exception {
        when(searchService.search(any(), any(), any(), any(), any())).thenReturn(documentSet());

        mockMvc.perform(get("/papers")
                .param("query", "smith")
                .param("searchtype", "author")
                .param("primary_category", "cs.LG", "stat.ML")
                .param("order", "-announced_date_first")
                .param("include_older_versions", "true")
                .param("start", "50")
                .param("size", "25"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.metadata.total").value(1))
            .andExpect(jsonPath("$.metadata.query.query").value("smith"))
            .andExpect(jsonPath("$.metadata.pagination.next").value("http://localhost/papers?start=75&size=25"))
            .andExpect(jsonPath("$.metadata.pagination.previous").isEmpty())
            .andExpect(jsonPath("$.results[0].paper_id").value("1234.5678"))
            .andExpect(jsonPath("$.results[0].paper_id_v").value("1234.5678v2"))
            .andExpect(jsonPath("$.results[0].authors[0].full_name").value("John Smith"))
            .andExpect(jsonPath("$.results[0].matched_authors[0].position").value(0))
            .andExpect(jsonPath("$.results[0].matched_authors[0].full_name").value("John Smith"))
            .andExpect(jsonPath("$.results[0].document").doesNotExist());

        ArgumentCaptor<PaperQuery> query = ArgumentCaptor.forClass(PaperQuery.class);
        verify(searchService).search(query.capture(), eq(50), eq(25), isNull(), any());
        assertThat(query.getValue().searchType()).isEqualTo(SearchType.AUTHOR);
        assertThat(query.getValue().primaryCategories()).containsExactly("cs.LG", "stat.ML");
        assertThat(query.getValue().order()).isEqualTo(SortOrder.ANNOUNCED_DATE_FIRST_DESC);
        assertThat(query.getValue().includeOlderVersions()).isTrue();
    }

    @Test
    void unknownSearchTypeIsBadRequest() throws Exception {
        mockMvc.perform(get("/papers").param("query", "x").param("searchtype", "journal"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.message").value("unknown searchtype: journal"));
    }

    @Test
    void unknownCategoryIsBadRequest() throws Exception {
        when(searchService.search(any(), any(), any(), any(), any()))
            .thenThrow(new QueryException("unknown primary_category: cs.XX"));

        mockMvc.perform(get("/papers").param("primary_category", "cs.XX"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.message").value("unknown primary_category: cs.XX"));
    }

    @Test
    void deepOffsetAsksForCursor() throws Exception {
        when(searchService.search(any(), any(), any(), any(), any())).thenThrow(new CursorRequiredException(10000));

        mockMvc.perform(get("/papers").param("start", "9990").param("size", "50"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    void malformedNumericParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/papers").param("start", "ten"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    void engineOutageIsServiceUnavailable() throws Exception {
        when(searchService.search(any(), any(), any(), any(), any()))
            .thenThrow(new OpenSearchUnavailableException("OpenSearch unreachable", null));

        mockMvc.perform(get("/papers"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code").value(503));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(searchService.search(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/papers"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(500))
            .andExpect(jsonPath("$.message").value("Unexpected error"));
    }

    @Test
    void paperLookupReturnsDocument() throws Exception {
        PaperDocument document = new PaperDocument();
        document.setPaperId("1234.5678");
        document.setPaperIdV("1234.5678v1");
        document.setVersion(1);
        document.setIsCurrent(false);
        when(searchService.getPaper("1234.5678v1")).thenReturn(document);

        mockMvc.perform(get("/papers/1234.5678v1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.paper_id_v").value("1234.5678v1"))
            .andExpect(jsonPath("$.is_current").value(false));
    }

    @Test
    void missingPaperIsNotFound() throws Exception {
        when(searchService.getPaper("1234.5678")).thenThrow(new DocumentNotFoundException("1234.5678"));

        mockMvc.perform(get("/papers/1234.5678"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404))
            .andExpect(jsonPath("$.message").value("No paper with id 1234.5678"));
    }

    @Test
    void archivePrefixedIdIsLookedUpWhole() throws Exception {
        PaperDocument document = new PaperDocument();
        document.setPaperId("hep-th/9901001");
        document.setPaperIdV("hep-th/9901001v2");
        document.setVersion(2);
        document.setIsCurrent(true);
        when(searchService.getPaper("hep-th/9901001")).thenReturn(document);

        mockMvc.perform(get("/papers/hep-th/9901001"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.paper_id").value("hep-th/9901001"))
            .andExpect(jsonPath("$.paper_id_v").value("hep-th/9901001v2"));
    }

    @Test
    void versionedArchivePrefixedIdIsLookedUpWhole() throws Exception {
        when(searchService.getPaper("math.AG/0101001v3")).thenThrow(new DocumentNotFoundException("math.AG/0101001v3"));

        mockMvc.perform(get("/papers/math.AG/0101001v3"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("No paper with id math.AG/0101001v3"));
    }

    @Test
    void unmappedPathIsNotFound() throws Exception {
        mockMvc.perform(get("/papers/a/b/c"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));
    }

    private static DocumentSetResponse documentSet() {
        Author author = new Author();
        author.setFirstName("John");
        author.setLastName("Smith");
        author.setFullName("John Smith");
        PaperDocument document = new PaperDocument();
        document.setPaperId("1234.5678");
        document.setPaperIdV("1234.5678v2");
        document.setAuthors(List.of(author));

        DocumentSetResponse.Metadata metadata = new DocumentSetResponse.Metadata();
        metadata.setQuery(Map.of("query", "smith"));
        metadata.setTotal(1);
        metadata.setPagination(new PageLinks("http://localhost/papers?start=75&size=25", null));
        DocumentSetResponse response = new DocumentSetResponse();
        response.setMetadata(metadata);
        response.setResults(List.of(new PaperHit(document, List.of(new MatchedAuthor(0, "John Smith")))));
        return response;
    }
}
