package com.chicu.tradeads.live;

import com.chicu.tradeads.config.AdsLiveProperties;
import com.chicu.tradeads.config.AdsSchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * События циклов → WebSocket (STOMP, topic из ads.live.posted-topic) + короткая история для REST.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdLivePublisher implements AdEventSink {

    private final SimpMessagingTemplate ws;
    private final AdsSchedulerProperties props;
    private final AdsLiveProperties live;

    /** Последние события, новые в конце */
    private final Deque<AdPostedEvent> recent = new ArrayDeque<>();

    @Override
    public void emit(AdPostedEvent event) {

        if (event == null || event.getId() == null) {
            log.warn("🚫 ADS publish called with empty event");
            return;
        }

        if (event.getTime() <= 0) {
            event.setTime(System.currentTimeMillis());
        }

        remember(event);

        log.info("📡 WS SEND → {} id={} count={} msg='{}'",
                live.getPostedTopic(), event.getId(), event.getCount(), event.getMessage());
        ws.convertAndSend(live.getPostedTopic(), event);
    }

    public List<AdPostedEvent> recentEvents() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }

    private void remember(AdPostedEvent event) {
        int limit = Math.max(1, props.getRecentEvents());
        synchronized (recent) {
            recent.addLast(event);
            while (recent.size() > limit) {
                recent.removeFirst();
            }
        }
    }
}
