package io.coachflow.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Dispatches incoming replies by sender address. Routes live in memory and are rebuilt by the
 * recovery coordinator on startup.
 */
public class ResponseRouter {
    private static final Logger log = LoggerFactory.getLogger(ResponseRouter.class);

    private final ConcurrentMap<String, ResponseRoute> routes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReplyHandler> handlers = new ConcurrentHashMap<>();

    public void registerHandler(ReplyHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        ReplyHandler existing = handlers.putIfAbsent(handler.flowType(), handler);
        if (existing != null && existing != handler) {
            throw new IllegalStateException("Duplicate ReplyHandler flowType: " + handler.flowType());
        }
    }

    public void register(ResponseRoute route) {
        Objects.requireNonNull(route, "route must not be null");
        Objects.requireNonNull(route.address(), "route address must not be null");
        routes.put(route.address(), route);
        log.debug("response route registered address={} participantId={} flowType={}",
                route.address(), route.participantId(), route.flowType());
    }

    public void unregister(String address) {
        if (address != null && routes.remove(address) != null) {
            log.debug("response route removed address={}", address);
        }
    }

    public Optional<ResponseRoute> find(String address) {
        return Optional.ofNullable(address).map(routes::get);
    }

    /**
     * @return false when nobody is registered for {@code address} or its flow has no handler
     */
    public boolean route(String address, String text) {
        ResponseRoute route = routes.get(address);
        if (route == null) {
            log.info("reply from unknown address dropped address={}", address);
            return false;
        }
        ReplyHandler handler = handlers.get(route.flowType());
        if (handler == null) {
            log.warn("reply dropped; no handler for flow participantId={} flowType={}", route.participantId(), route.flowType());
            return false;
        }
        handler.onReply(route.participantId(), text);
        return true;
    }

    public int size() {
        return routes.size();
    }
}
