package com.chicu.tradeads.engine;

import java.util.OptionalInt;

/**
 * Вычисление эффективного интервала публикации (в минутах).
 *
 * Приоритет: явный override → сохранённое ненулевое значение → «не задан».
 * Вызывается один раз при запуске цикла, дальше интервал не пересчитывается.
 */
public final class IntervalResolver {

    private IntervalResolver() {
    }

    public static OptionalInt resolve(Integer overrideMinutes, Integer storedMinutes) {
        if (overrideMinutes != null) {
            return OptionalInt.of(overrideMinutes);
        }
        if (storedMinutes != null && storedMinutes != 0) {
            return OptionalInt.of(storedMinutes);
        }
        return OptionalInt.empty();
    }
}
