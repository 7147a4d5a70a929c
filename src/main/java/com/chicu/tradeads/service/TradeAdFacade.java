package com.chicu.tradeads.service;

import com.chicu.tradeads.engine.AdJob;
import com.chicu.tradeads.engine.AdScheduler;
import com.chicu.tradeads.engine.PostOutcome;
import com.chicu.tradeads.engine.PostResultClassifier;
import com.chicu.tradeads.engine.StartResult;
import com.chicu.tradeads.engine.TradeAdPoster;
import com.chicu.tradeads.web.dto.ManualPostRequest;
import com.chicu.tradeads.web.dto.ManualPostResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Командный слой над хранилищем и планировщиком.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeAdFacade {

    private final TradeAdService adService;
    private final AdScheduler scheduler;
    private final TradeAdPoster poster;
    private final TradeAdValidator validator;

    // =====================================================================
    // 🚀 ЗАПУСК / ОСТАНОВКА
    // =====================================================================
    public StartResult start(String id, Integer intervalMinutes) {
        return scheduler.start(id, intervalMinutes);
    }

    public void stop(String id) {
        scheduler.stop(id);
    }

    /** Удаление сначала останавливает цикл, иначе он продолжит постить копию */
    public void delete(String id) {
        scheduler.stop(id);
        adService.delete(id);
    }

    // =====================================================================
    // 📤 РУЧНАЯ ПУБЛИКАЦИЯ
    // =====================================================================
    /** Разовая публикация из запроса: списки проверяются до сборки снимка */
    public ManualPostResponse postManual(ManualPostRequest request) {
        List<String> logs = new ArrayList<>();
        logs.add("Connecting to Rolimons API...");

        List<String> problems = validator.validate(request.getOfferItemIds(), request.getRequestItemIds(),
                request.getRequestTags(), request.getRoliVerification(), true);
        if (!problems.isEmpty()) {
            logs.addAll(problems);
            return new ManualPostResponse(false, logs);
        }

        return post(request.toJob(), logs);
    }

    private ManualPostResponse post(AdJob job, List<String> logs) {
        logs.add("Posting trade ad...");

        PostOutcome outcome;
        try {
            outcome = poster.post(job).join();
        } catch (CompletionException e) {
            outcome = PostResultClassifier.transportFailure(e.getCause() != null ? e.getCause() : e);
        }

        if (outcome.isSuccess()) {
            logs.add("trade ad post success");
            return new ManualPostResponse(true, logs);
        }

        log.warn("❌ Manual post failed [{}]: {}", outcome.kind(), outcome.reason());
        logs.add("Failed to post trade ad: " + outcome.reason());
        return new ManualPostResponse(false, logs);
    }
}
