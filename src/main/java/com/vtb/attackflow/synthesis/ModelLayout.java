package com.vtb.attackflow.synthesis;

import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.models.LayoutPosition;
import com.vtb.attackflow.models.ProbabilisticVariable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Раскладка переменных по уровням для отображения.
 * Уровень - глубина обхода в ширину от корней (переменных без входящих дуг).
 * Строки центрируются по самой широкой, внутри строки порядок по идентификатору
 */
public final class ModelLayout {

    private ModelLayout() {}

    public static void apply(ModelRegistry registry, CompilerConfig.Layout settings) {
        CompilerConfig.Layout layout = settings;
        if (layout == null) {
            layout = new CompilerConfig.Layout();
            layout.ensureDefaults();
        }
        List<ProbabilisticVariable> all = new ArrayList<>(registry.variables());
        if (all.isEmpty()) {
            return;
        }

        Map<String, Integer> levels = levels(registry, all);
        TreeMap<Integer, List<String>> rows = new TreeMap<>();
        levels.forEach((id, level) -> rows.computeIfAbsent(level, k -> new ArrayList<>()).add(id));

        int width = layout.getNodeWidth();
        int height = layout.getNodeHeight();
        int hGap = layout.getHorizontalGap();
        int vGap = layout.getVerticalGap();

        int widest = rows.values().stream().mapToInt(List::size).max().orElse(1);
        int totalWidth = widest * (width + hGap) - hGap;

        for (Map.Entry<Integer, List<String>> entry : rows.entrySet()) {
            List<String> row = entry.getValue();
            row.sort(null);
            int rowWidth = row.size() * (width + hGap) - hGap;
            int x0 = layout.getLeftMargin() + (totalWidth - rowWidth) / 2;
            int y = layout.getTopMargin() + entry.getKey() * (height + vGap);
            for (int i = 0; i < row.size(); i++) {
                int x = x0 + i * (width + hGap);
                int level = entry.getKey();
                registry.get(row.get(i)).ifPresent(variable -> variable.setPosition(LayoutPosition.builder()
                    .left(x)
                    .top(y)
                    .right(x + width)
                    .bottom(y + height)
                    .level(level)
                    .build()));
            }
        }
    }

    static Map<String, Integer> levels(ModelRegistry registry, List<ProbabilisticVariable> all) {
        List<String> roots = new ArrayList<>();
        for (ProbabilisticVariable variable : all) {
            if (variable.getParents().isEmpty()) {
                roots.add(variable.getId());
            }
        }
        if (roots.isEmpty()) {
            roots.add(all.get(0).getId());
        }

        Map<String, Integer> levels = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        for (String root : roots) {
            queue.add(root);
            depths.add(0);
        }
        while (!queue.isEmpty()) {
            String id = queue.poll();
            int depth = depths.poll();
            if (levels.containsKey(id)) {
                continue;
            }
            levels.put(id, depth);
            for (String child : registry.childrenOf(id)) {
                queue.add(child);
                depths.add(depth + 1);
            }
        }
        // недостижимые переменные (только при отсутствии корней) ставятся в первую строку
        for (ProbabilisticVariable variable : all) {
            levels.putIfAbsent(variable.getId(), 0);
        }
        return levels;
    }
}
