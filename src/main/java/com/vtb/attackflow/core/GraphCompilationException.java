package com.vtb.attackflow.core;

/**
 * Неустранимая ошибка входных данных: пустой граф или отсутствие узлов для модели.
 * Все прочие аномалии обрабатываются локально и не прерывают компиляцию
 */
public class GraphCompilationException extends RuntimeException {

    public GraphCompilationException(String message) {
        super(message);
    }

    public GraphCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
