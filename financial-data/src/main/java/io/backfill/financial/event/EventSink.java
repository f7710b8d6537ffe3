package io.backfill.financial.event;

import java.util.List;

@FunctionalInterface
public interface EventSink {
    void emit(FetchEvent event);

    static EventSink noop() { return e -> {}; }

    static EventSink compose(EventSink... sinks) {
        List<EventSink> all = List.of(sinks);
        return e -> all.forEach(s -> s.emit(e));
    }
}
