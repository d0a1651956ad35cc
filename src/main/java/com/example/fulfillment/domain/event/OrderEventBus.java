package com.example.fulfillment.domain.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process event bus with an explicit handler list per event type.
 * <p>
 * Handlers run synchronously on the publishing thread, inside the caller's
 * transaction. A handler exception propagates to the publisher so the
 * status change that emitted the event is rolled back with it.
 */
public class OrderEventBus {

    private final Map<OrderEventType, List<OrderEventHandler>> handlers = new EnumMap<>(OrderEventType.class);

    public OrderEventBus() {
        for (OrderEventType type : OrderEventType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public void subscribe(OrderEventType type, OrderEventHandler handler) {
        handlers.get(Objects.requireNonNull(type, "Type cannot be null"))
                .add(Objects.requireNonNull(handler, "Handler cannot be null"));
    }

    public void publish(OrderEvent event) {
        for (OrderEventHandler handler : handlers.get(event.type())) {
            handler.handle(event);
        }
    }

    public List<OrderEventHandler> handlersFor(OrderEventType type) {
        return Collections.unmodifiableList(new ArrayList<>(handlers.get(type)));
    }
}
