package ru.javaboys.skillmatch.service;

/**
 * Решает, обозначают ли два имени один и тот же навык.
 * Реализации обязаны быть чистыми и потокобезопасными.
 */
public interface SkillEquivalence {
    boolean equivalent(String first, String second);
}
