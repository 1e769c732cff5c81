package com.herzen.gradepipe.results;

import com.herzen.gradepipe.results.ResultModels.MethodResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class ResultsFormatter {

    public String format(List<MethodResult> ranked, int precision, int margin) {
        if (precision < 0) throw new IllegalArgumentException("precision must be >= 0");
        if (margin < 0) throw new IllegalArgumentException("margin must be >= 0");

        String number = "%." + precision + "f";
        List<List<String>> cells = new ArrayList<>();
        for (MethodResult r : ranked) {
            cells.add(List.of(
                    r.method(),
                    Integer.toString(r.dim()),
                    String.format(Locale.US, number, r.trainError()),
                    String.format(Locale.US, number, r.testError())));
        }

        List<String> header = ResultModels.LEADERBOARD_HEADER;
        int[] widths = new int[header.size()];
        for (int c = 0; c < widths.length; c++) {
            widths[c] = header.get(c).length();
            for (List<String> row : cells) widths[c] = Math.max(widths[c], row.get(c).length());
        }

        List<String> underline = new ArrayList<>();
        for (int width : widths) underline.add("-".repeat(width));

        List<String> lines = new ArrayList<>();
        lines.add(formatRow(header, widths, margin));
        lines.add(formatRow(underline, widths, margin));
        cells.forEach(row -> lines.add(formatRow(row, widths, margin)));
        return String.join("\n", lines);
    }

    private String formatRow(List<String> row, int[] widths, int margin) {
        StringBuilder sb = new StringBuilder(leftJustify(row.get(0), widths[0] + margin));
        for (int c = 1; c < row.size(); c++) {
            sb.append(rightJustify(row.get(c), widths[c] + margin));
        }
        return sb.toString();
    }

    private static String leftJustify(String value, int width) {
        return value + " ".repeat(Math.max(0, width - value.length()));
    }

    private static String rightJustify(String value, int width) {
        return " ".repeat(Math.max(0, width - value.length())) + value;
    }
}
