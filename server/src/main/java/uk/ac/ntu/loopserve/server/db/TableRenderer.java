package uk.ac.ntu.loopserve.server.db;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class TableRenderer {
    private static final String INDEX = "(index)";

    private TableRenderer() {}

    static String render(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        columns.add(INDEX);
        for (Map<String, Object> row : rows) columns.addAll(row.keySet());
        List<String> cols = new ArrayList<>(columns);

        List<List<String>> cells = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            List<String> line = new ArrayList<>();
            line.add(String.valueOf(i));
            for (int c = 1; c < cols.size(); c++) {
                Map<String, Object> row = rows.get(i);
                line.add(row.containsKey(cols.get(c)) ? cell(row.get(cols.get(c))) : "");
            }
            cells.add(line);
        }

        int[] width = new int[cols.size()];
        for (int c = 0; c < cols.size(); c++) {
            width[c] = cols.get(c).length();
            for (List<String> line : cells) width[c] = Math.max(width[c], line.get(c).length());
        }

        StringBuilder sb = new StringBuilder();
        rule(sb, width, '┌', '┬', '┐');
        line(sb, width, cols);
        rule(sb, width, '├', '┼', '┤');
        for (List<String> line : cells) line(sb, width, line);
        rule(sb, width, '└', '┴', '┘');
        return sb.toString().stripTrailing();
    }

    private static String cell(Object v) {
        if (v == null) return "null";
        if (v instanceof String s) return "'" + s + "'";
        if (v instanceof byte[] b) return "<" + b.length + " bytes>";
        return String.valueOf(v);
    }

    private static void rule(StringBuilder sb, int[] width, char left, char mid, char right) {
        sb.append(left);
        for (int c = 0; c < width.length; c++) {
            sb.append("─".repeat(width[c] + 2));
            sb.append(c == width.length - 1 ? right : mid);
        }
        sb.append('\n');
    }

    private static void line(StringBuilder sb, int[] width, List<String> values) {
        sb.append('│');
        for (int c = 0; c < width.length; c++) {
            String v = values.get(c);
            int pad = width[c] - v.length();
            int left = pad / 2;
            sb.append(' ').append(" ".repeat(left)).append(v).append(" ".repeat(pad - left)).append(" │");
        }
        sb.append('\n');
    }
}
