package com.chicu.tradeads.service;

import com.chicu.tradeads.engine.AdJob;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Проверка содержимого объявления перед ручной публикацией.
 * Планировщик содержимое не проверяет, это делает только командный слой.
 */
@Component
public class TradeAdValidator {

    public static final int MAX_OFFER_ITEMS = 4;
    public static final int MAX_REQUESTS = 4;

    public static final String EMPTY_OFFER_ID = "Offered item ids must not contain empty values";
    public static final String EMPTY_REQUEST_ID = "Requested item ids must not contain empty values";
    public static final String EMPTY_TAG = "Request tags must not contain empty values";

    public static final List<String> AVAILABLE_TAGS = List.of(
            "any", "demand", "rares", "robux", "upgrade",
            "downgrade", "rap", "wishlist", "projecteds", "adds"
    );

    public boolean isValidTag(String tag) {
        return tag != null && AVAILABLE_TAGS.contains(tag.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Проверка «сырых» списков из запроса, до того как из них собран {@link AdJob}:
     * снимок пустые элементы уже не примет.
     *
     * @return список проблем, пустой если объявление можно отправлять
     */
    public List<String> validate(List<Long> offerItemIds,
                                 List<Long> requestItemIds,
                                 List<String> requestTags,
                                 String roliVerification,
                                 boolean requireCredential) {
        List<Long> offers = offerItemIds != null ? offerItemIds : List.of();
        List<Long> requests = requestItemIds != null ? requestItemIds : List.of();
        List<String> tags = requestTags != null ? requestTags : List.of();

        List<String> problems = new ArrayList<>();

        if (offers.isEmpty()) {
            problems.add("You must offer at least one item");
        } else if (offers.size() > MAX_OFFER_ITEMS) {
            problems.add("You can only offer up to " + MAX_OFFER_ITEMS + " items");
        }
        if (hasEmpty(offers)) {
            problems.add(EMPTY_OFFER_ID);
        }

        int totalRequests = requests.size() + tags.size();
        if (totalRequests == 0) {
            problems.add("You must request at least one item or tag");
        } else if (totalRequests > MAX_REQUESTS) {
            problems.add("You can only request up to " + MAX_REQUESTS + " items (combined item IDs and tags)");
        }
        if (hasEmpty(requests)) {
            problems.add(EMPTY_REQUEST_ID);
        }
        if (hasEmpty(tags)) {
            problems.add(EMPTY_TAG);
        }

        for (String tag : tags) {
            if (tag != null && !isValidTag(tag)) {
                problems.add("Unknown request tag: " + tag);
            }
        }

        if (requireCredential && (roliVerification == null || roliVerification.isBlank())) {
            problems.add("Roli verification cookie is required");
        }

        return problems;
    }

    static boolean hasEmpty(List<?> values) {
        return values != null && values.stream().anyMatch(Objects::isNull);
    }
}
