package de.bsommerfeld.students.cli;

import com.google.inject.Inject;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders uniformly-shaped rows as a GitHub-flavoured pipe table.
 *
 * <pre>
 * |   student_id | first_name   | email         |
 * |--------------|--------------|---------------|
 * |            1 | Ada          | ada@ex.com    |
 * </pre>
 *
 * Headers come from the first row's keys, in iteration order. Columns whose
 * non-null values are all numbers are right-aligned, everything else is
 * left-aligned. Every column is at least {@value #MIN_PADDING} characters
 * wider than its header. {@code null} renders as an empty cell.
 */
public class TablePrinter {

    /** Printed instead of a table when there are no rows. */
    public static final String EMPTY_PLACEHOLDER = "(no rows)";

    static final int MIN_PADDING = 2;

    private final PrintStream out;

    @Inject
    public TablePrinter(PrintStream out) {
        this.out = out;
    }

    public void print(List<? extends Map<String, ?>> rows) {
        out.println(render(rows));
    }

    /**
     * Returns the table without a trailing line separator, or
     * {@link #EMPTY_PLACEHOLDER} for an empty list.
     */
    public static String render(List<? extends Map<String, ?>> rows) {
        if (rows.isEmpty())
            return EMPTY_PLACEHOLDER;

        List<String> headers = new ArrayList<>(rows.get(0).keySet());
        int columns = headers.size();

        List<List<String>> cells = new ArrayList<>(rows.size());
        int[] widths = new int[columns];
        boolean[] numeric = new boolean[columns];
        for (int c = 0; c < columns; c++) {
            widths[c] = headers.get(c).length() + MIN_PADDING;
            numeric[c] = isNumericColumn(rows, headers.get(c));
        }

        for (Map<String, ?> row : rows) {
            List<String> line = new ArrayList<>(columns);
            for (int c = 0; c < columns; c++) {
                String text = format(row.get(headers.get(c)));
                widths[c] = Math.max(widths[c], text.length());
                line.add(text);
            }
            cells.add(line);
        }

        StringBuilder sb = new StringBuilder();
        appendRow(sb, headers, widths, numeric);
        sb.append(System.lineSeparator());
        sb.append('|');
        for (int c = 0; c < columns; c++) {
            sb.append("-".repeat(widths[c] + 2)).append('|');
        }
        for (List<String> line : cells) {
            sb.append(System.lineSeparator());
            appendRow(sb, line, widths, numeric);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> values, int[] widths, boolean[] rightAlign) {
        sb.append('|');
        for (int c = 0; c < values.size(); c++) {
            sb.append(' ').append(pad(values.get(c), widths[c], rightAlign[c])).append(" |");
        }
    }

    private static String pad(String text, int width, boolean right) {
        String fill = " ".repeat(width - text.length());
        return right ? fill + text : text + fill;
    }

    private static boolean isNumericColumn(List<? extends Map<String, ?>> rows, String header) {
        boolean sawValue = false;
        for (Map<String, ?> row : rows) {
            Object value = row.get(header);
            if (value == null)
                continue;
            if (!(value instanceof Number))
                return false;
            sawValue = true;
        }
        return sawValue;
    }

    private static String format(Object value) {
        return value == null ? "" : value.toString();
    }
}
