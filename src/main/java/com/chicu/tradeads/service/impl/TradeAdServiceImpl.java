package com.chicu.tradeads.service.impl;

import com.chicu.tradeads.config.AdsSchedulerProperties;
import com.chicu.tradeads.domain.TradeAd;
import com.chicu.tradeads.engine.AdJob;
import com.chicu.tradeads.repository.TradeAdRepository;
import com.chicu.tradeads.service.TradeAdService;
import com.chicu.tradeads.service.TradeAdValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradeAdServiceImpl implements TradeAdService {

    private final TradeAdRepository repository;
    private final AdsSchedulerProperties props;

    @Override
    @Transactional(readOnly = true)
    public List<TradeAd> list() {
        return repository.findAllByOrderByNameAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TradeAd> get(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return repository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AdJob> load(String id) {
        return get(id).map(TradeAd::toJob);
    }

    @Override
    @Transactional
    public TradeAd save(TradeAd ad) {
        Objects.requireNonNull(ad, "ad must not be null");

        int min = props.getMinIntervalMinutes();
        if (ad.getIntervalMinutes() < 0 || (ad.getIntervalMinutes() != 0 && ad.getIntervalMinutes() < min)) {
            throw new IllegalArgumentException(
                    "Interval must be at least " + min + " minutes or 0 to inherit global interval");
        }

        if (ad.getId() == null || ad.getId().isBlank()) {
            ad.setId(UUID.randomUUID().toString());
        }
        if (ad.getName() == null) ad.setName("");
        if (ad.getOfferItemIds() == null) ad.setOfferItemIds(new ArrayList<>());
        if (ad.getRequestItemIds() == null) ad.setRequestItemIds(new ArrayList<>());
        if (ad.getRequestTags() == null) ad.setRequestTags(new ArrayList<>());

        // пустой элемент H2 вернёт «дыркой» в списке, и снимок объявления уже не соберётся
        requireNoEmpty(ad.getOfferItemIds(), TradeAdValidator.EMPTY_OFFER_ID);
        requireNoEmpty(ad.getRequestItemIds(), TradeAdValidator.EMPTY_REQUEST_ID);
        requireNoEmpty(ad.getRequestTags(), TradeAdValidator.EMPTY_TAG);

        TradeAd saved = repository.save(ad);
        log.info("💾 Trade ad saved id={} name='{}'", saved.getId(), saved.getName());
        return saved;
    }

    private static void requireNoEmpty(List<?> values, String message) {
        if (values.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException(message);
        }
    }

    @Override
    @Transactional
    public void delete(String id) {
        if (repository.existsById(id)) {
            repository.deleteById(id);
            log.info("🗑 Trade ad deleted id={}", id);
        }
    }
}
