package dev.rosterwatch.extract;

import dev.rosterwatch.model.BookingRecord;
import dev.rosterwatch.model.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Range;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the PAID search results table into booking records.
 */
@Slf4j
@Component
public class BookingTableExtractor {

    private static final String RESULTS_TABLE_SELECTOR = "table.search-results";

    /**
     * Extract records from a raw results page.
     *
     * @param html Response body as returned by the roster source
     * @return {@link ExtractionResult#noTable()} when the page has no table at all,
     *         otherwise the (possibly empty) list of records
     */
    public ExtractionResult extract(String html) {
        String source = html == null ? "" : html;
        Document document = Jsoup.parse(source, "", Parser.htmlParser().setTrackPosition(true));

        Element table = document.selectFirst(RESULTS_TABLE_SELECTOR);
        if (table == null) {
            table = document.selectFirst("table");
        }
        if (table == null) {
            log.debug("No table found on page!");
            return ExtractionResult.noTable();
        }

        log.debug("Found table with class={}", table.className());

        List<Element> rows = dataRows(table, declaresBody(table, source));
        log.debug("Found {} data rows", rows.size());

        List<BookingRecord> records = new ArrayList<>();
        for (Element row : rows) {
            BookingRecord record = parseRow(row);
            if (record != null) {
                records.add(record);
                log.debug("  Found: {} (#{}) - {}", record.displayName(), record.getBookingNumber(),
                        record.getDate());
            }
        }

        if (records.isEmpty()) {
            log.debug("No records found in table");
        }
        return ExtractionResult.of(records);
    }

    private List<Element> dataRows(Element table, boolean explicitBody) {
        Element tbody = table.selectFirst("tbody");
        if (tbody != null && explicitBody) {
            return tbody.select("tr");
        }
        Elements allRows = table.select("tr");
        return allRows.size() > 1 ? allRows.subList(1, allRows.size()) : List.of();
    }

    /**
     * jsoup wraps bare rows in an implicit tbody, so only the table's own source
     * markup tells whether the header row still has to be skipped.
     */
    private boolean declaresBody(Element table, String source) {
        Range start = table.sourceRange();
        if (!start.isTracked()) {
            return false;
        }
        int from = start.startPos();
        Range end = table.endSourceRange();
        int to = end.isTracked() && end.endPos() > from ? Math.min(end.endPos(), source.length()) : source.length();
        return source.substring(from, to).toLowerCase(Locale.ROOT).contains("<tbody");
    }

    private BookingRecord parseRow(Element row) {
        Elements cells = row.getElementsByTag("td");
        if (cells.size() < 2) {
            return null;
        }

        Element nameCell = cells.get(0);
        Element link = nameCell.selectFirst("a");

        String fullName;
        String bookingNumber;
        if (link != null) {
            fullName = link.text().trim();
            bookingNumber = lastPathSegment(link.attr("href"));
        } else {
            fullName = nameCell.text().trim();
            bookingNumber = "";
        }

        String lastName;
        String firstName;
        int comma = fullName.indexOf(',');
        if (comma >= 0) {
            lastName = fullName.substring(0, comma).trim();
            firstName = fullName.substring(comma + 1).trim();
        } else {
            lastName = fullName;
            firstName = "";
        }

        if (lastName.isEmpty()) {
            return null;
        }

        return BookingRecord.builder()
                .lastName(lastName)
                .firstName(firstName)
                .date(cells.get(1).text().trim())
                .bookingNumber(bookingNumber)
                .fullNameDisplay(fullName)
                .build();
    }

    /**
     * Booking links look like /PAID/Home/Booking/1638002.
     */
    static String lastPathSegment(String href) {
        if (href == null || href.isEmpty()) {
            return "";
        }
        return href.substring(href.lastIndexOf('/') + 1);
    }
}
