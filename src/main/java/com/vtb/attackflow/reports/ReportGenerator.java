package com.vtb.attackflow.reports;

import com.vtb.attackflow.models.CompiledModel;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов и выгрузок модели
 */
public interface ReportGenerator {

    /**
     * Сгенерировать отчет
     *
     * @param result результат компиляции
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(CompiledModel result, Path outputPath) throws IOException;

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
