package com.chicu.tradeads.engine;

import java.util.concurrent.CompletableFuture;

/**
 * Удалённая публикация объявления. Одна попытка на вызов, без внутренних ретраев.
 *
 * Future завершается классифицированным результатом; исключительное завершение
 * планировщик трактует как сетевую ошибку.
 */
public interface TradeAdPoster {

    CompletableFuture<PostOutcome> post(AdJob job);
}
