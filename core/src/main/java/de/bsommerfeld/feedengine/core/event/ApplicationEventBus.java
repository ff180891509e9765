package de.bsommerfeld.feedengine.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide event bus for the {@link FeedEvents}. Delivery is synchronous
 * on the posting thread. A listener that throws is logged and does not affect
 * the poster or other listeners.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);

    private final EventBus eventBus = new EventBus(ApplicationEventBus::onListenerFailure);

    public void post(Object event) {
        LOG.debug("Event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        eventBus.unregister(listener);
    }

    private static void onListenerFailure(Throwable failure, SubscriberExceptionContext context) {
        LOG.error("Listener {}#{} failed on {}", context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(), context.getEvent(), failure);
    }
}
