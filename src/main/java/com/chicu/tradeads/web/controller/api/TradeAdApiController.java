package com.chicu.tradeads.web.controller.api;

import com.chicu.tradeads.domain.TradeAd;
import com.chicu.tradeads.engine.AdScheduler;
import com.chicu.tradeads.engine.RunningAd;
import com.chicu.tradeads.engine.StartResult;
import com.chicu.tradeads.live.AdLivePublisher;
import com.chicu.tradeads.live.AdPostedEvent;
import com.chicu.tradeads.service.TradeAdFacade;
import com.chicu.tradeads.service.TradeAdService;
import com.chicu.tradeads.service.TradeAdValidator;
import com.chicu.tradeads.web.dto.ManualPostRequest;
import com.chicu.tradeads.web.dto.ManualPostResponse;
import com.chicu.tradeads.web.dto.TradeAdDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping(value = "/api/ads", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class TradeAdApiController {

    private final TradeAdService adService;
    private final TradeAdFacade facade;
    private final AdScheduler scheduler;
    private final TradeAdValidator validator;
    private final AdLivePublisher publisher;

    // =====================================================
    // 💾 ПРЕСЕТЫ
    // =====================================================
    @GetMapping
    public List<TradeAdDto> list() {
        return adService.list().stream()
                .map(this::toDto)
                .toList();
    }

    @GetMapping("/{id}")
    public TradeAdDto get(@PathVariable String id) {
        return adService.get(id)
                .map(this::toDto)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Ad not found: " + id));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public TradeAdDto save(@RequestBody TradeAdDto body) {
        TradeAd saved = adService.save(body.toEntity());
        return toDto(saved);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        facade.delete(id);
        return status("deleted", id);
    }

    // =====================================================
    // ▶️ ЦИКЛЫ
    // =====================================================
    @PostMapping("/{id}/start")
    public Map<String, Object> start(@PathVariable String id,
                                     @RequestParam(required = false) Integer intervalMinutes) {
        StartResult result = facade.start(id, intervalMinutes);
        log.info("▶ Ad {} start → {}", id, result.value());
        return status(result.value(), id);
    }

    @PostMapping("/{id}/stop")
    public Map<String, Object> stop(@PathVariable String id) {
        facade.stop(id);
        return status("stopped", id);
    }

    @GetMapping("/running")
    public List<RunningAd> running() {
        return scheduler.runningAds();
    }

    @GetMapping("/events")
    public List<AdPostedEvent> events() {
        return publisher.recentEvents();
    }

    // =====================================================
    // 📤 РАЗОВАЯ ПУБЛИКАЦИЯ
    // =====================================================
    @PostMapping(value = "/post", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ManualPostResponse post(@RequestBody ManualPostRequest request) {
        return facade.postManual(request);
    }

    // =====================================================
    // 🏷 ТЕГИ
    // =====================================================
    @GetMapping("/tags")
    public List<String> tags() {
        return TradeAdValidator.AVAILABLE_TAGS;
    }

    @GetMapping("/tags/validate")
    public Map<String, Object> validateTag(@RequestParam String tag) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tag", tag);
        body.put("valid", validator.isValidTag(tag));
        return body;
    }

    // ---------- helpers ----------

    private TradeAdDto toDto(TradeAd ad) {
        return TradeAdDto.from(ad, scheduler.isRunning(ad.getId()), scheduler.postCount(ad.getId()));
    }

    private Map<String, Object> status(String status, String id) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("id", id);
        body.put("running", scheduler.isRunning(id));
        return body;
    }
}
