package uk.ac.ntu.loopserve.server.db;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TableRendererTest {

    @Test
    void rendersIndexAndColumns() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 1);
        row.put("name", "a");

        String table = TableRenderer.render(List.of(row));

        assertThat(table.lines()).containsExactly(
                "┌─────────┬────┬──────┐",
                "│ (index) │ id │ name │",
                "├─────────┼────┼──────┤",
                "│    0    │ 1  │ 'a'  │",
                "└─────────┴────┴──────┘");
    }

    @Test
    void emptyResultStillHasHeader() {
        assertThat(TableRenderer.render(List.of()).lines()).hasSize(4);
    }
}
