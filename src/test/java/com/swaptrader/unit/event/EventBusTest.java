package com.swaptrader.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.swaptrader.event.Event;
import com.swaptrader.event.EventBus;
import com.swaptrader.event.EventCategory;
import com.swaptrader.event.EventDispatchResult;
import com.swaptrader.event.EventHandler;
import com.swaptrader.event.EventType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventBusTest {

    private ExecutorService executor;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        eventBus = new EventBus(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Emit")
    class Emit {

        @Test
        @DisplayName("stamps timestamp and event type onto a copy of the payload")
        void stampsPayload() {
            Map<String, Object> payload = new HashMap<>();
            payload.put("symbol", "SOL-USDC");

            EventDispatchResult result = eventBus.emit(EventType.PRICE_UPDATE, payload);

            Map<String, Object> stamped = result.event().payload();
            assertThat(stamped).containsEntry("symbol", "SOL-USDC");
            assertThat(stamped).containsEntry("event_type", "price_update");
            assertThat(Instant.parse((String) stamped.get("timestamp"))).isEqualTo(result.event().timestamp());
            assertThat(payload).doesNotContainKey("event_type");
        }

        @Test
        @DisplayName("delivers to every subscriber of the type and only that type")
        void deliversToSubscribers() {
            List<String> received = Collections.synchronizedList(new ArrayList<>());
            eventBus.subscribe(EventType.ORDER_FILLED, e -> received.add("a:" + e.type().getValue()));
            eventBus.subscribe(EventType.ORDER_FILLED, e -> received.add("b:" + e.type().getValue()));
            eventBus.subscribe(EventType.ORDER_FAILED, e -> received.add("c:" + e.type().getValue()));

            EventDispatchResult result = eventBus.emit(EventType.ORDER_FILLED, Map.of("id", "ord_1"));

            assertThat(result.delivered()).isEqualTo(2);
            assertThat(received).containsExactlyInAnyOrder("a:order_filled", "b:order_filled");
        }

        @Test
        @DisplayName("a failing handler does not block other handlers or the caller")
        void isolatesFailingHandler() {
            List<String> received = Collections.synchronizedList(new ArrayList<>());
            eventBus.subscribe(EventType.SYSTEM_STATUS, e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe(EventType.SYSTEM_STATUS, e -> received.add("ok"));

            EventDispatchResult result = eventBus.emit(EventType.SYSTEM_STATUS, Map.of("status", "started"));

            assertThat(received).containsExactly("ok");
            assertThat(result.delivered()).isEqualTo(1);
            assertThat(result.hasFailures()).isTrue();
            assertThat(result.failures()).singleElement().isInstanceOf(IllegalStateException.class);
            assertThat(eventBus.getHandlerFailureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("checked exceptions from handlers are isolated as well")
        void isolatesCheckedException() {
            eventBus.subscribe(EventType.SYSTEM_ERROR, e -> {
                throw new Exception("checked");
            });

            EventDispatchResult result = eventBus.emit(EventType.SYSTEM_ERROR, null);

            assertThat(result.failures()).hasSize(1);
            assertThat(result.event().payload()).containsKeys("timestamp", "event_type");
        }

        @Test
        @DisplayName("emit waits for all handlers to finish")
        void waitsForHandlers() {
            List<String> received = Collections.synchronizedList(new ArrayList<>());
            for (int i = 0; i < 3; i++) {
                int index = i;
                eventBus.subscribe(EventType.TRADE_EXECUTED, e -> {
                    Thread.sleep(20);
                    received.add("h" + index);
                });
            }

            eventBus.emit(EventType.TRADE_EXECUTED, Map.of());

            assertThat(received).hasSize(3);
        }

        @Test
        @DisplayName("rejects a null event type")
        void rejectsNullType() {
            assertThatThrownBy(() -> eventBus.emit(null, Map.of())).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> eventBus.subscribe((EventType) null, e -> {}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("unsubscribed handlers receive nothing")
        void unsubscribe() {
            List<Event> received = new ArrayList<>();
            EventHandler handler = received::add;
            eventBus.subscribe(EventType.POSITION_OPENED, handler);
            eventBus.unsubscribe(EventType.POSITION_OPENED, handler);

            EventDispatchResult result = eventBus.emit(EventType.POSITION_OPENED, Map.of());

            assertThat(received).isEmpty();
            assertThat(result.delivered()).isZero();
            assertThat(eventBus.subscriberCount(EventType.POSITION_OPENED)).isZero();
        }

        @Test
        @DisplayName("category subscription covers every type in the category")
        void categorySubscription() {
            eventBus.subscribe(EventCategory.ORDER, e -> {});

            assertThat(eventBus.subscriberCount(EventType.ORDER_PLACED)).isEqualTo(1);
            assertThat(eventBus.subscriberCount(EventType.ORDER_FILLED)).isEqualTo(1);
            assertThat(eventBus.subscriberCount(EventType.ORDER_FAILED)).isEqualTo(1);
            assertThat(eventBus.subscriberCount(EventType.ORDER_CANCELLED)).isEqualTo(1);
            assertThat(eventBus.subscriberCount(EventType.TRADE_EXECUTED)).isZero();
        }

        @Test
        @DisplayName("unknown type tokens are a caller error")
        void unknownToken() {
            assertThatThrownBy(() -> EventType.fromValue("order_teleported"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(EventType.fromValue("margin_call")).isEqualTo(EventType.MARGIN_CALL);
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("1001 emits keep exactly 1000 entries with the oldest evicted")
        void boundedHistory() {
            for (int i = 0; i < 1001; i++) {
                eventBus.emit(EventType.PRICE_UPDATE, Map.of("seq", i));
            }

            List<Event> history = eventBus.getHistory(EventType.PRICE_UPDATE, 0);

            assertThat(history).hasSize(EventBus.MAX_HISTORY);
            assertThat(history.get(0).payload()).containsEntry("seq", 1);
            assertThat(history.get(999).payload()).containsEntry("seq", 1000);
        }

        @Test
        @DisplayName("limit returns the most recent entries in insertion order")
        void limitedHistory() {
            for (int i = 0; i < 10; i++) {
                eventBus.emit(EventType.ORDER_PLACED, Map.of("seq", i));
            }

            List<Event> lastThree = eventBus.getHistory(EventType.ORDER_PLACED, 3);

            assertThat(lastThree).extracting(e -> e.payload().get("seq")).containsExactly(7, 8, 9);
        }

        @Test
        @DisplayName("default limit is 100")
        void defaultLimit() {
            for (int i = 0; i < 150; i++) {
                eventBus.emit(EventType.VOLUME_SPIKE, Map.of("seq", i));
            }

            assertThat(eventBus.getHistory(EventType.VOLUME_SPIKE)).hasSize(EventBus.DEFAULT_HISTORY_LIMIT);
        }

        @Test
        @DisplayName("history is kept per type and can be cleared")
        void perTypeAndClear() {
            eventBus.emit(EventType.ORDER_PLACED, Map.of());
            eventBus.emit(EventType.ORDER_FILLED, Map.of());

            eventBus.clearHistory(EventType.ORDER_PLACED);

            assertThat(eventBus.getHistory(EventType.ORDER_PLACED)).isEmpty();
            assertThat(eventBus.getHistory(EventType.ORDER_FILLED)).hasSize(1);

            eventBus.clearHistory();
            assertThat(eventBus.getHistory(EventType.ORDER_FILLED)).isEmpty();
        }
    }
}
