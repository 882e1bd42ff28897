package com.vtb.attackflow.cli;

import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.core.AttackGraphCompiler;
import com.vtb.attackflow.core.GraphCompilationException;
import com.vtb.attackflow.models.CompiledModel;
import com.vtb.attackflow.models.SecurityPosture;
import com.vtb.attackflow.models.VariableRole;
import com.vtb.attackflow.reports.FuzzyAnalysisReport;
import com.vtb.attackflow.reports.ModelJsonExporter;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI команда компилятора графов атак в байесовские сети
 */
@Slf4j
@Command(
    name = "attack-flow-bn",
    mixinStandardHelpOptions = true,
    version = "Attack Flow BN Compiler 1.0.0",
    description = """

        Attack Flow BN Compiler

        Компиляция графа сценария атаки (attack flow, STIX 2.1) в байесовскую сеть

        Возможности:
          • Рекомендации partition / divorce по числу родителей и потомков
          • Логические вентили AND / OR для условий и операторов
          • Нечеткая оценка тактик MITRE ATT&CK (5 уровней успеха)
          • Выгрузка модели в JSON для внешнего движка вывода

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    @Parameters(
        index = "0",
        description = "Путь к JSON бандлу attack flow"
    )
    private Path bundlePath;

    @Option(
        names = {"-o", "--output"},
        description = "Файл для сохранения модели (по умолчанию: <имя бандла>-bn.json рядом с бандлом)"
    )
    private Path outputPath;

    @Option(
        names = {"--config"},
        description = "YAML файл конфигурации (по умолчанию compiler-config.yaml из classpath)"
    )
    private Path configPath;

    @Option(
        names = {"--posture"},
        description = "Уровень защиты организации: LOW, MEDIUM, HIGH"
    )
    private SecurityPosture posture;

    @Option(
        names = {"--max-group-size"},
        description = "Максимальный размер группы при разбиении родителей"
    )
    private Integer maxGroupSize;

    @Option(
        names = {"--report"},
        description = "Дополнительно сохранить текстовый отчет нечеткого анализа"
    )
    private boolean report = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            CompilerConfig config = loadConfig();
            log.info("Компиляция: {} (posture: {}, maxGroupSize: {})", bundlePath,
                config.getFuzzy().getPosture(), config.getGrouping().getMaxGroupSize());

            CompiledModel result = new AttackGraphCompiler(config).compile(bundlePath);

            Path target = outputPath != null ? outputPath : defaultOutput(bundlePath, "-bn.json");
            new ModelJsonExporter().generate(result, target);

            if (report) {
                FuzzyAnalysisReport analysis = new FuzzyAnalysisReport();
                analysis.generate(result, defaultOutput(target, "-fuzzy." + analysis.getFileExtension()));
            }

            printSummary(result, target);
            return EXIT_OK;

        } catch (GraphCompilationException | IllegalArgumentException e) {
            log.error("Некорректный входной граф: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IOException | UncheckedIOException e) {
            log.error("Ошибка ввода-вывода: {}", e.getMessage(), e);
            return EXIT_IO_ERROR;
        } catch (IllegalStateException e) {
            log.error("Ошибка конфигурации: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    private CompilerConfig loadConfig() {
        CompilerConfig config = configPath != null ? CompilerConfig.load(configPath) : CompilerConfig.load();
        if (posture != null) {
            config.getFuzzy().setPosture(posture);
        }
        if (maxGroupSize != null) {
            if (maxGroupSize < 1) {
                throw new IllegalArgumentException("--max-group-size должен быть >= 1");
            }
            config.getGrouping().setMaxGroupSize(maxGroupSize);
        }
        return config;
    }

    /**
     * Имя файла рядом с исходным: bundle.json -> bundle + suffix
     */
    static Path defaultOutput(Path source, String suffix) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path parent = source.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(base + suffix) : Path.of(base + suffix);
    }

    private void printSummary(CompiledModel result, Path target) {
        PrintWriter out = new PrintWriter(System.out, true);
        out.println();
        out.println("Граф: " + result.getGraph().getNodes().size() + " узлов, "
            + result.getGraph().getEdges().size() + " ребер");
        out.println("Рекомендаций: " + result.getRecommendations().size()
            + " (partition: " + result.getGroups().getPartitionGroups().size()
            + ", divorce: " + result.getGroups().getDivorceGroups().size()
            + ", logic: " + result.getGroups().getLogicGroups().size() + ")");
        out.println("Модель: " + result.getModel().getVariables().size() + " переменных, "
            + result.getModel().getArcs().size() + " дуг, вентилей: "
            + result.getModel().countByRole(VariableRole.PARTITION_GATE)
            + ", хабов: " + result.getModel().countByRole(VariableRole.DIVORCE_HUB));
        out.println("Тактических узлов: " + result.getFuzzyInfo().size());
        out.println("Модель сохранена: " + target);
    }
}
