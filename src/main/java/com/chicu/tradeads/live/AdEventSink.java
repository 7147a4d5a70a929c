package com.chicu.tradeads.live;

/**
 * Приёмник статусных событий. Fire-and-forget: ошибки доставки не влияют на цикл.
 */
public interface AdEventSink {

    void emit(AdPostedEvent event);
}
