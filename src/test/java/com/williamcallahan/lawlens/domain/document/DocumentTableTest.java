package com.williamcallahan.lawlens.domain.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Verifies that back-end payloads with gaps still produce usable tables and nodes.
 */
class DocumentTableTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    @Test
    void nullCellsDeserializeAsEmptyText() throws Exception {
        DocumentTable table = objectMapper.readValue(
                "{\"rows\": [[\"Offence\", \"Penalty\"], [\"Theft\", null]]}", DocumentTable.class);

        assertEquals(List.of("Theft", ""), table.rows().get(1));
        assertTrue(table.isHeaderRow(0));
    }

    @Test
    void explicitEmptyHeaderRowsAreKept() throws Exception {
        DocumentTable table = objectMapper.readValue(
                "{\"rows\": [[\"Theft\", \"7 years\"]], \"header_rows\": []}", DocumentTable.class);

        assertTrue(table.headerRows().isEmpty());
        assertFalse(table.isHeaderRow(0));
    }

    @Test
    void missingHeaderRowsDefaultToFirstRow() throws Exception {
        DocumentTable table = objectMapper.readValue("{\"rows\": [[\"Item\", \"Fee\"]]}", DocumentTable.class);

        assertEquals(Set.of(0), table.headerRows());
    }

    @Test
    void nullParagraphsAreDropped() throws Exception {
        DocumentNode node = objectMapper.readValue(
                "{\"type\": \"section\", \"identifier\": \"3\", \"text\": [\"First\", null, \"Second\"]}",
                DocumentNode.class);

        assertEquals(List.of("First", "Second"), node.text());
    }
}
