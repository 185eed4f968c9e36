package com.binday.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls the collection results table out of a council results page.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Finds the first {@code <table>} and maps its header cells to next/last/type column indices.</li>
 *   <li>Reads each {@code <tbody>} row into a {@link RawRow}: the optional row-header text plus the data cell texts.</li>
 *   <li>Resolves a row's collection type and dates, preferring mapped columns and falling back to
 *       position and the {@link #looksLikeDate(String)} heuristic.</li>
 * </ul>
 * <p>
 * A page without a table, or with a table that has no {@code <tbody>} in the markup, is not an
 * error; it yields no rows.
 * <p>
 * Known fragility: the date heuristic is a weekday-name substring test, so a collection label that
 * contains a day name (say "Sunday Bulky Waste") is treated as a date wherever the heuristic applies.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public class TableExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TableExtractor.class);

    static final String NEXT_COLLECTION_HEADER = "Next collection";
    static final String LAST_COLLECTION_HEADER = "Last collection";
    static final String COLLECTION_HEADER = "Collection";

    private static final List<String> WEEKDAYS = List.of(
        "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday"
    );

    /** Raw next/last collection text resolved for one row; either may be null. */
    public record RowDates(String nextCollection, String lastCollection) {}

    /**
     * Parses the results page.
     * @param html full page markup (may be null)
     * @return header mapping and body rows; {@link ExtractedTable#EMPTY} when there is nothing to read
     */
    public ExtractedTable extract(String html) {
        if (html == null || html.isBlank()) {
            logger.warn("Empty results page; no collections to extract.");
            return ExtractedTable.EMPTY;
        }
        // position tracking tells a written <tbody> apart from one the parser inserted
        Document doc = Jsoup.parse(html, "", Parser.htmlParser().setTrackPosition(true));
        Element table = doc.selectFirst("table");
        if (table == null) {
            logger.warn("No results table found on page.");
            return ExtractedTable.EMPTY;
        }

        List<String> headers = new ArrayList<>();
        Element thead = table.selectFirst("thead");
        if (thead != null) {
            for (Element th : thead.select("th")) headers.add(th.text());
        }
        ColumnMapping mapping = mapColumns(headers);
        logger.debug("Table headers {} mapped to {}", headers, mapping);

        Element tbody = table.selectFirst("tbody");
        if (tbody == null || tbody.sourceRange().isImplicit()) {
            logger.warn("Results table has no body rows.");
            return new ExtractedTable(mapping, List.of());
        }

        List<RawRow> rows = new ArrayList<>();
        boolean hasRowHeaders = false;
        int dataColumns = 0;
        for (Element tr : tbody.select("tr")) {
            Element th = tr.selectFirst("th");
            String rowHeader = th == null ? null : rowHeaderText(th);
            hasRowHeaders |= th != null;
            List<String> values = new ArrayList<>();
            for (Element td : tr.getElementsByTag("td")) values.add(td.text());
            dataColumns = Math.max(dataColumns, values.size());
            rows.add(new RawRow(rowHeader, values));
        }
        // header cells above the row-header column have no <td> counterpart
        if (hasRowHeaders && headers.size() > dataColumns) {
            mapping = mapping.shift(headers.size() - dataColumns);
            logger.debug("Shifted column mapping past row headers: {}", mapping);
        }
        logger.info("Extracted {} rows from results table.", rows.size());
        return new ExtractedTable(mapping, rows);
    }

    /**
     * Maps header texts to column indices. A header containing "Next collection" or "Last collection"
     * maps that column; any other header containing "Collection" is the type column. When several
     * headers match the same role, the rightmost wins.
     * @param headers header cell texts in order
     * @return resolved mapping
     */
    public static ColumnMapping mapColumns(List<String> headers) {
        Integer next = null;
        Integer last = null;
        Integer type = null;
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header == null || header.isEmpty()) continue;
            if (header.contains(NEXT_COLLECTION_HEADER)) {
                next = i;
            } else if (header.contains(LAST_COLLECTION_HEADER)) {
                last = i;
            } else if (header.contains(COLLECTION_HEADER)) {
                type = i;
            }
        }
        return new ColumnMapping(next, last, type);
    }

    /**
     * True when the value contains an English weekday name.
     */
    public static boolean looksLikeDate(String value) {
        if (value == null || value.isEmpty()) return false;
        for (String day : WEEKDAYS) {
            if (value.contains(day)) return true;
        }
        return false;
    }

    /**
     * Resolves a row's collection type text. Exactly one source is consulted:
     * <ul>
     *   <li>a row with a {@code <th>} takes its text, and a blank header means no label;</li>
     *   <li>else, when the type column is mapped and present in the row, that cell;</li>
     *   <li>else the first cell.</li>
     * </ul>
     * A cell only counts when non-empty and not date-like; the chain never falls through to a later source.
     * @return the raw label (possibly composite), or null
     */
    public String resolveCollectionType(RawRow row, ColumnMapping mapping) {
        if (row.rowHeaderText() != null) {
            return row.rowHeaderText().isBlank() ? null : row.rowHeaderText();
        }
        Integer typeIndex = mapping.typeIndex();
        if (typeIndex != null && typeIndex >= 0 && typeIndex < row.cellValues().size()) {
            String typed = row.cell(typeIndex);
            return isLabel(typed) ? typed : null;
        }
        String first = row.cell(0);
        return isLabel(first) ? first : null;
    }

    /**
     * Resolves a row's next and last collection text. Mapped columns are used when they hold a
     * date-like value; otherwise the first date-like cell becomes next and the second becomes last.
     */
    public RowDates resolveDates(RawRow row, ColumnMapping mapping) {
        List<String> dateValues = new ArrayList<>();
        for (String value : row.cellValues()) {
            if (looksLikeDate(value)) dateValues.add(value);
        }

        String next = row.cell(mapping.nextIndex());
        if (!looksLikeDate(next)) next = null;
        String last = row.cell(mapping.lastIndex());
        if (!looksLikeDate(last)) last = null;

        if (next == null && !dateValues.isEmpty()) {
            next = dateValues.get(0);
        }
        if (last == null && dateValues.size() >= 2) {
            last = dateValues.get(1);
        }
        return new RowDates(next, last);
    }

    private static boolean isLabel(String value) {
        return value != null && !value.isEmpty() && !looksLikeDate(value);
    }

    // Joins the header's text nodes with the separator so <br>-separated bin types stay apart
    private static String rowHeaderText(Element th) {
        List<String> parts = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    String text = LabelSplitter.normalizeWhitespace(((TextNode) node).getWholeText());
                    if (!text.isEmpty()) parts.add(text);
                }
            }

            @Override
            public void tail(Node node, int depth) {
            }
        }, th);
        return String.join(LabelSplitter.SEPARATOR, parts);
    }
}
