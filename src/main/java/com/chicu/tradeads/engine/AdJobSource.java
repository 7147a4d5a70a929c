package com.chicu.tradeads.engine;

import java.util.Optional;

/**
 * Источник настроек объявлений для планировщика.
 */
public interface AdJobSource {

    /** Копия объявления по id, пусто если такого нет */
    Optional<AdJob> load(String id);
}
