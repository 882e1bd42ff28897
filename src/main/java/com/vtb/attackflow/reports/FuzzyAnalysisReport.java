package com.vtb.attackflow.reports;

import com.vtb.attackflow.models.CompiledModel;
import com.vtb.attackflow.models.FuzzyState;
import com.vtb.attackflow.models.NodeFuzzyInfo;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Текстовый отчет нечеткого анализа: распределение по каждому тактическому
 * узлу и средние распределения по тактикам
 */
@Slf4j
public class FuzzyAnalysisReport implements ReportGenerator {

    private static final String SEPARATOR = "=".repeat(60);

    @Override
    public void generate(CompiledModel result, Path outputPath) throws IOException {
        if (result == null) {
            throw new IllegalArgumentException("CompiledModel не может быть null");
        }
        log.info("Генерация отчета нечеткого анализа: {}", outputPath);
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, render(result));
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    public String render(CompiledModel result) {
        StringBuilder out = new StringBuilder();
        out.append(SEPARATOR).append('\n').append("FUZZY LOGIC ANALYSIS").append('\n').append(SEPARATOR).append('\n');

        Map<String, List<double[]>> byTactic = new LinkedHashMap<>();
        for (NodeFuzzyInfo info : result.getFuzzyInfo().values()) {
            byTactic.computeIfAbsent(info.getTacticName(), k -> new ArrayList<>()).add(info.getMembership());

            out.append('\n').append("Node: ").append(info.getNodeName()).append('\n');
            out.append("  Tactic: ").append(info.getTacticName()).append('\n');
            out.append("  Fuzzy State Distribution:").append('\n');
            double[] membership = info.getMembership();
            for (int i = 0; i < membership.length; i++) {
                appendBar(out, info.getStates().get(i), membership[i], 20);
            }
            int best = info.mostLikelyState();
            out.append(String.format(Locale.ROOT, "  Most Likely State: %s (%.3f)%n",
                info.getStates().get(best), membership[best]));
        }

        out.append('\n').append(SEPARATOR).append('\n').append("TACTIC SUMMARY").append('\n').append(SEPARATOR).append('\n');
        List<String> labels = FuzzyState.labels();
        byTactic.forEach((tactic, distributions) -> {
            out.append('\n').append(tactic).append(":\n");
            out.append("  Techniques: ").append(distributions.size()).append('\n');
            out.append("  Average Distribution:").append('\n');
            double[] average = average(distributions);
            for (int i = 0; i < average.length; i++) {
                appendBar(out, labels.get(i), average[i], 15);
            }
        });
        if (byTactic.isEmpty()) {
            out.append("\nТактических узлов нет\n");
        }
        return out.toString();
    }

    static double[] average(List<double[]> distributions) {
        double[] average = new double[FuzzyState.COUNT];
        for (double[] distribution : distributions) {
            for (int i = 0; i < average.length; i++) {
                average[i] += distribution[i];
            }
        }
        for (int i = 0; i < average.length; i++) {
            average[i] /= distributions.size();
        }
        return average;
    }

    private static void appendBar(StringBuilder out, String state, double value, int width) {
        int filled = Math.max(0, Math.min(width, (int) (value * width)));
        out.append(String.format(Locale.ROOT, "    %-10s: %.3f |%s%s|%n",
            state, value, "█".repeat(filled), "░".repeat(width - filled)));
    }
}
