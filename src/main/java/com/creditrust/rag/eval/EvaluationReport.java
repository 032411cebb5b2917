package com.creditrust.rag.eval;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-question results of an evaluation run and the number of rows per
 * {@link Quality}.
 */
public record EvaluationReport(List<EvaluationRow> rows, Map<Quality, Integer> counts) {

    private static final int MAX_CELL = 160;

    public EvaluationReport {
        rows = List.copyOf(rows);
        counts = Map.copyOf(counts);
    }

    public static EvaluationReport of(List<EvaluationRow> rows) {
        Map<Quality, Integer> counts = new EnumMap<>(Quality.class);
        for (Quality quality : Quality.values()) {
            counts.put(quality, 0);
        }
        rows.forEach(row -> counts.merge(row.quality(), 1, Integer::sum));
        return new EvaluationReport(rows, counts);
    }

    public int count(Quality quality) {
        return counts.getOrDefault(quality, 0);
    }

    public String toMarkdown() {
        StringBuilder out = new StringBuilder();
        out.append("| Question | Expected topic | Quality | Answer | Sources |\n");
        out.append("| --- | --- | --- | --- | --- |\n");
        for (EvaluationRow row : rows) {
            String answer = row.quality() == Quality.FAILED ? row.error() : row.answer();
            out.append("| ").append(cell(row.question()))
                    .append(" | ").append(cell(row.expectedTopic()))
                    .append(" | ").append(row.quality())
                    .append(" | ").append(cell(answer))
                    .append(" | ").append(cell(String.join(", ", row.sources())))
                    .append(" |\n");
        }
        out.append('\n');
        for (Quality quality : Quality.values()) {
            out.append("- ").append(quality).append(": ").append(count(quality)).append('\n');
        }
        return out.toString();
    }

    private static String cell(String value) {
        if (value == null) {
            return "";
        }
        String flat = value.replace("|", "\\|").replaceAll("\\s+", " ").strip();
        return flat.length() > MAX_CELL ? flat.substring(0, MAX_CELL) + "..." : flat;
    }
}
