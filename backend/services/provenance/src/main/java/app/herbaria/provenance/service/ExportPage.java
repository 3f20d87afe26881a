package app.herbaria.provenance.service;

import java.util.List;

public record ExportPage(
        List<ExportItem> items,
        String nextCursor
) {
    public ExportPage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
