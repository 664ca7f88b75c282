package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.citation.TableShape;
import com.williamcallahan.lawlens.service.table.PipeTableDetector;
import com.williamcallahan.lawlens.service.table.TableHtmlRenderer;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Table detection and rendering for cited excerpts.
 */
@RestController
@RequestMapping(value = "/api/tables", produces = MediaType.APPLICATION_JSON_VALUE)
public class TableController extends BaseController {

    private final TableHtmlRenderer tableRenderer;

    public TableController(TableHtmlRenderer tableRenderer, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.tableRenderer = tableRenderer;
    }

    @PostMapping(value = "/detect", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TableShape detect(@Valid @RequestBody TextRequest request) {
        return PipeTableDetector.detect(request.text());
    }

    /**
     * Renders an excerpt: server tables first, then a parsed pipe table, then raw text.
     *
     * @param request excerpt and optional structured tables
     * @return HTML and detected shape
     */
    @PostMapping(value = "/render", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TableRenderResponse render(@RequestBody TableRenderRequest request) {
        TableShape shape = PipeTableDetector.detect(request.excerpt());
        String html = tableRenderer.renderExcerpt(request.excerpt(), request.tables());
        return new TableRenderResponse(html, shape, shape.isTable() ? PipeTableDetector.summarize(shape) : null);
    }
}
