package agents.gateway.mcp.routing;

import agents.gateway.mcp.base.CallerHandle;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static agents.gateway.Driver.logLevel;

/**
 * Callers that receive pushed messages: unsolicited upstream traffic and status snapshots.
 * Subscribers found closed at push time are dropped.
 */
public class SubscriberRegistry {

    private final Vertx vertx;
    private final Map<String, CallerHandle> subscribers = new ConcurrentHashMap<>();

    public SubscriberRegistry(Vertx vertx) {
        this.vertx = vertx;
    }

    public void subscribe(CallerHandle subscriber) {
        subscribers.put(subscriber.id(), subscriber);
        if (logLevel >= 3) vertx.eventBus().publish("log", "Subscriber added: " + subscriber.id() + ",3,SubscriberRegistry,Subscribe,Routing");
    }

    public void unsubscribe(String subscriberId) {
        if (subscribers.remove(subscriberId) != null) {
            if (logLevel >= 3) vertx.eventBus().publish("log", "Subscriber removed: " + subscriberId + ",3,SubscriberRegistry,Unsubscribe,Routing");
        }
    }

    public boolean isSubscribed(String subscriberId) {
        return subscribers.containsKey(subscriberId);
    }

    public Collection<CallerHandle> all() {
        return new ArrayList<>(subscribers.values());
    }

    public int size() {
        return subscribers.size();
    }

    /**
     * Push to every open subscriber.
     *
     * @return number of subscribers reached
     */
    public int broadcast(JsonObject message) {
        int delivered = 0;
        List<String> closed = new ArrayList<>();
        for (CallerHandle subscriber : subscribers.values()) {
            if (!subscriber.isOpen()) {
                closed.add(subscriber.id());
                continue;
            }
            if (deliver(subscriber, message)) {
                delivered++;
            }
        }
        closed.forEach(this::unsubscribe);
        return delivered;
    }

    /**
     * Deliver to one caller; a failing caller is logged, never allowed to break the pusher.
     */
    public boolean deliver(CallerHandle caller, JsonObject message) {
        try {
            caller.deliver(message);
            return true;
        } catch (RuntimeException e) {
            vertx.eventBus().publish("log", "Delivery to " + caller.id() + " failed: " + e.getMessage() + ",0,SubscriberRegistry,Deliver,Routing");
            return false;
        }
    }
}
