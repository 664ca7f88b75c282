package com.williamcallahan.lawlens.web;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.lawlens.config.AppProperties;
import com.williamcallahan.lawlens.service.document.HierarchyRenderer;
import com.williamcallahan.lawlens.service.document.SnippetExportFactory;
import com.williamcallahan.lawlens.service.document.TableOfContentsExtractor;
import com.williamcallahan.lawlens.service.table.TableHtmlRenderer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = DocumentRenderController.class)
@Import({
    AppProperties.class,
    ExceptionResponseBuilder.class,
    HierarchyRenderer.class,
    TableHtmlRenderer.class,
    TableOfContentsExtractor.class,
    SnippetExportFactory.class
})
class DocumentRenderControllerTest {

    private static final String DOCUMENT = """
            {
              "document_id": "EA-2007-11",
              "header": {"title": "The Employment Act", "short_title": "Employment Act", "jurisdiction": "UG"},
              "root": {
                "type": "act",
                "children": [
                  {"type": "part", "identifier": "II", "title": "Contracts", "children": [
                    {"type": "section", "identifier": "3", "title": "Written contracts",
                     "styled_text": [{"fragments": [
                       {"text": "repealed words", "amendment": "repealed"},
                       {"text": "current words", "styles": ["bold"]}
                     ]}]}
                  ]}
                ]
              }
            }
            """;

    @Autowired
    MockMvc mvc;

    @Test
    void rendersDocumentWithHighlight() throws Exception {
        mvc.perform(post("/api/documents/render")
                        .param("highlighted_node_id", "section-3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DOCUMENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.html", containsString("id=\"section-3\"")))
                .andExpect(jsonPath("$.html", containsString("section-highlighted")))
                .andExpect(jsonPath("$.html", containsString("line-through")))
                .andExpect(jsonPath("$.toc[0].label").value("Part II – Contracts"))
                .andExpect(jsonPath("$.toc[0].children[0].id").value("section-3"))
                .andExpect(jsonPath("$.snippets[1].label").value("Employment Act - Part II Section 3. Written contracts"));
    }

    @Test
    void extractsTableOfContents() throws Exception {
        mvc.perform(post("/api/documents/toc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DOCUMENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("part-II"))
                .andExpect(jsonPath("$[0].depth").value(0))
                .andExpect(jsonPath("$[0].children[0].label").value("3. Written contracts"));
    }

    @Test
    void missingRootIsRejected() throws Exception {
        mvc.perform(post("/api/documents/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"document_id\": \"EA-2007-11\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Invalid request"))
                .andExpect(jsonPath("$.details", containsString("root")));
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mvc.perform(post("/api/documents/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request"));
    }
}
