package com.williamcallahan.lawlens.service.table;

import com.williamcallahan.lawlens.domain.citation.ParsedPipeTable;
import com.williamcallahan.lawlens.domain.document.DocumentTable;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders tables as HTML fragments using jsoup element building, which escapes cell text.
 */
@Component
public class TableHtmlRenderer {
    private static final Logger logger = LoggerFactory.getLogger(TableHtmlRenderer.class);
    private static final String EMPTY_CELL = "—";

    /**
     * Renders a server-extracted table; rows listed in {@code headerRows} use {@code th} cells.
     *
     * @param table structured table
     * @return table wrapper element
     */
    public Element renderStructured(DocumentTable table) {
        Element wrapper = new Element("div").addClass("document-table");
        if (table.identifier() != null && !table.identifier().isBlank()) {
            wrapper.appendElement("div").addClass("table-identifier").text(table.identifier());
        }
        Element tableElement = wrapper.appendElement("table");
        Element body = tableElement.appendElement("tbody");
        List<List<String>> rows = table.rows();
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            String cellTag = table.isHeaderRow(rowIndex) ? "th" : "td";
            Element rowElement = body.appendElement("tr");
            for (String cell : rows.get(rowIndex)) {
                rowElement.appendElement(cellTag).text(cell);
            }
        }
        if (table.page() != null) {
            wrapper.appendElement("div").addClass("table-page").text("Page " + table.page());
        }
        return wrapper;
    }

    /**
     * Renders a client-parsed pipe table, padding short rows.
     *
     * @param parsed parsed headers and rows
     * @return table element
     */
    public Element renderParsed(ParsedPipeTable parsed) {
        Element tableElement = new Element("table").addClass("parsed-table");
        Element headerRow = tableElement.appendElement("thead").appendElement("tr");
        for (String header : parsed.headers()) {
            headerRow.appendElement("th").text(header);
        }
        Element body = tableElement.appendElement("tbody");
        for (List<String> row : parsed.rows()) {
            Element rowElement = body.appendElement("tr");
            for (String cell : row) {
                rowElement.appendElement("td").text(cell);
            }
            for (int missing = row.size(); missing < parsed.columnCount(); missing++) {
                rowElement.appendElement("td").addClass("empty-cell").text(EMPTY_CELL);
            }
        }
        return tableElement;
    }

    /**
     * Renders excerpt content with precedence: server tables, then a parsed pipe table, then
     * the raw excerpt in a {@code pre} block.
     *
     * @param excerpt excerpt text
     * @param serverTables tables from the expand-source call, may be empty
     * @return HTML fragment
     */
    public String renderExcerpt(String excerpt, List<DocumentTable> serverTables) {
        Element container = new Element("div").addClass("excerpt-content");
        if (serverTables != null && !serverTables.isEmpty()) {
            serverTables.forEach(table -> container.appendChild(renderStructured(table)));
            return container.outerHtml();
        }
        String text = excerpt == null ? "" : excerpt;
        if (PipeTableDetector.detect(text).isTable()) {
            Optional<ParsedPipeTable> parsed = PipeTableParser.parse(text);
            if (parsed.isPresent()) {
                container.appendChild(renderParsed(parsed.get()));
                return container.outerHtml();
            }
            logger.debug("Pipe table detected but not decomposable; rendering raw excerpt");
        }
        container.appendElement("pre").addClass("raw-excerpt").text(text);
        return container.outerHtml();
    }
}
