package com.psl.search.api;

import com.psl.schema.document.PaperDocument;
import com.psl.search.api.dto.DocumentSetResponse;
import com.psl.search.query.PaperQuery;
import com.psl.search.query.SearchType;
import com.psl.search.query.SortOrder;
import com.psl.search.service.PaperSearchService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
public class PaperController {
    private final PaperSearchService searchService;

    public PaperController(PaperSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/papers")
    public DocumentSetResponse search(
        @RequestParam(value = "query", required = false) String query,
        @RequestParam(value = "searchtype", required = false) String searchType,
        @RequestParam(value = "primary_category", required = false) List<String> primaryCategories,
        @RequestParam(value = "order", required = false) String order,
        @RequestParam(value = "include_older_versions", defaultValue = "false") boolean includeOlderVersions,
        @RequestParam(value = "start", required = false) Integer start,
        @RequestParam(value = "size", required = false) Integer size,
        @RequestParam(value = "cursor", required = false) String cursor
    ) {
        PaperQuery paperQuery = new PaperQuery(
            query,
            SearchType.from(searchType),
            primaryCategories,
            SortOrder.from(order),
            includeOlderVersions
        );
        return searchService.search(paperQuery, start, size, cursor, ServletUriComponentsBuilder.fromCurrentRequest());
    }

    @GetMapping("/papers/{id}")
    public PaperDocument paper(@PathVariable("id") String id) {
        return searchService.getPaper(id);
    }

    /**
     * Archive-prefixed ids such as {@code hep-th/9901001} span two path segments.
     */
    @GetMapping("/papers/{archive}/{number}")
    public PaperDocument archivePaper(@PathVariable("archive") String archive, @PathVariable("number") String number) {
        return searchService.getPaper(archive + "/" + number);
    }
}
