package com.vtb.attackflow.models;

/**
 * Тип переменной в терминах внешнего движка вывода
 */
public enum VariableType {
    /** Полная таблица условных вероятностей */
    CPT,
    /** Noisy-MAX вентиль: параметры силы по каждому родителю, таблица разворачивается */
    NOISY_MAX
}
