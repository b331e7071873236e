package com.flagship.loyalty_ledger.notification;

import com.flagship.loyalty_ledger.notification.dto.NotificationResponse;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Delivers notifications over a server-sent events stream.
 */
public class SseDeliveryChannel implements DeliveryChannel {

    private final SseEmitter emitter;
    private volatile boolean open = true;
    private volatile Runnable closeHook = () -> { };

    public SseDeliveryChannel(SseEmitter emitter) {
        this.emitter = emitter;
        emitter.onCompletion(this::close);
        emitter.onTimeout(this::close);
        emitter.onError(error -> close());
    }

    /**
     * Runs once the client disconnects or the stream times out.
     */
    public void onClose(Runnable hook) {
        this.closeHook = hook;
    }

    @Override
    public void deliver(NotificationEvent event) throws IOException {
        try {
            emitter.send(SseEmitter.event()
                    .id(event.getDedupeKey())
                    .name(event.getType().name())
                    .data(NotificationResponse.from(event), MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            open = false;
            throw e;
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public String name() {
        return "sse";
    }

    private void close() {
        open = false;
        closeHook.run();
    }
}
