package io.proteus.events.cli;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints rows as left-aligned columns separated by two spaces.
 */
class TablePrinter
{
    private final PrintStream out;
    private final List<List<String>> rows = new ArrayList<>();

    TablePrinter(PrintStream out)
    {
        this.out = out;
    }

    void row(String... columns)
    {
        rows.add(ImmutableList.copyOf(columns));
    }

    void print()
    {
        int[] widths = columnWidths();
        for (List<String> row : rows) {
            List<String> padded = new ArrayList<>();
            for (int i = 0; i < row.size(); i++) {
                // last column is not padded
                padded.add(i + 1 < row.size() ? Strings.padEnd(row.get(i), widths[i], ' ') : row.get(i));
            }
            out.println(Joiner.on("  ").join(padded));
        }
    }

    private int[] columnWidths()
    {
        int columns = rows.stream().mapToInt(List::size).max().orElse(0);
        int[] widths = new int[columns];
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        return widths;
    }
}
