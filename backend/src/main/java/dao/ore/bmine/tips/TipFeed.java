package dao.ore.bmine.tips;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.ore.bmine.config.RelayProperties;
import dao.ore.bmine.model.TipSnapshot;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the latest landed-tip percentiles from the relay's tip stream.
 * <p>
 * A single daemon thread owns the websocket and is the only writer; each inbound batch replaces the snapshot
 * with its first (most recent) record in one atomic swap. The thread reconnects forever and never surfaces
 * errors, it only logs them.
 */
@Slf4j
@Service
public class TipFeed {

    private static final TypeReference<List<TipFloorSample>> SAMPLES = new TypeReference<>() {};

    private final WebSocketClient client;
    private final ObjectMapper objectMapper;
    private final RelayProperties relayProps;
    private final AtomicReference<TipSnapshot> snapshot = new AtomicReference<>(TipSnapshot.EMPTY);

    private volatile boolean running;
    private Thread thread;

    public TipFeed(WebSocketClient client, ObjectMapper objectMapper, RelayProperties relayProps) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.relayProps = relayProps;
    }

    public TipSnapshot current() {
        return snapshot.get();
    }

    @Order(Ordered.HIGHEST_PRECEDENCE)
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (running) return;
        running = true;
        thread = new Thread(this::subscribeLoop, "tip-feed");
        thread.setDaemon(true);
        thread.start();
        log.info("subscribed to tip stream: url={}", relayProps.getTipStreamUrl());
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
        }
    }

    private void subscribeLoop() {
        URI uri = URI.create(relayProps.getTipStreamUrl());
        while (running) {
            try {
                client.execute(uri, session -> session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .doOnNext(this::onMessage)
                                .then())
                        .block();
                log.info("tip stream disconnected, retries in {} ms", relayProps.getReconnectDelayMs());
            } catch (Exception e) {
                log.error("fail to connect to tip stream: {}", e.getMessage());
            }

            try {
                Thread.sleep(relayProps.getReconnectDelayMs());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Handles one stream payload: a JSON array whose first entry is the most recent sample.
     */
    void onMessage(String payload) {
        List<TipFloorSample> samples;
        try {
            samples = objectMapper.readValue(payload, SAMPLES);
        } catch (Exception e) {
            log.error("fail to parse tips: {}", e.getMessage());
            return;
        }
        if (samples == null || samples.isEmpty()) {
            return;
        }
        TipSnapshot next = samples.get(0).toSnapshot();
        snapshot.set(next);
        log.debug("tip snapshot updated: {}", next);
    }
}
