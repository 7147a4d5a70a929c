package com.chicu.tradeads.service;

import com.chicu.tradeads.domain.TradeAd;
import com.chicu.tradeads.engine.AdJobSource;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище пресетов объявлений.
 */
public interface TradeAdService extends AdJobSource {

    List<TradeAd> list();

    Optional<TradeAd> get(String id);

    /** Создаёт (пустой id → новый UUID) или перезаписывает объявление */
    TradeAd save(TradeAd ad);

    void delete(String id);
}
