package com.minibroker.routing;

import com.minibroker.exception.AccessRefusedException;
import com.minibroker.model.Binding;
import com.minibroker.model.Exchange;
import com.minibroker.topology.TopologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the destination queues of a publish.
 * <p>
 * The result is ordered by binding order and free of duplicates. Exchange-to-exchange
 * bindings are followed transitively; each exchange is visited at most once per publish.
 */
public class Router {
    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    private final TopologyStore topology;
    private final TopicMatcher topicMatcher = new TopicMatcher();
    private final HeadersMatcher headersMatcher = new HeadersMatcher();

    public Router(TopologyStore topology) {
        this.topology = topology;
    }

    public Set<String> route(String exchangeName, String routingKey, Map<String, Object> headers) {
        return route(exchangeName, Collections.singletonList(routingKey), headers);
    }

    /**
     * Route one message published with several routing keys (the primary key plus CC/BCC).
     *
     * @throws com.minibroker.exception.NotFoundException if the exchange does not exist
     * @throws AccessRefusedException if the exchange is internal
     */
    public Set<String> route(String exchangeName, List<String> routingKeys, Map<String, Object> headers) {
        Exchange exchange = topology.checkExchange(exchangeName);
        if (exchange.isInternal()) {
            throw new AccessRefusedException("Cannot publish to internal exchange '" + exchangeName + "'");
        }

        Set<String> result = new LinkedHashSet<>();
        for (String routingKey : routingKeys) {
            String key = routingKey != null ? routingKey : "";
            routeFrom(exchange, key, headers, result, new HashSet<>());
        }

        if (result.isEmpty()) {
            logger.debug("No route for exchange '{}' with keys {}", exchangeName, routingKeys);
        }
        return result;
    }

    private void routeFrom(Exchange exchange, String routingKey, Map<String, Object> headers,
                           Set<String> result, Set<String> visited) {
        if (!visited.add(exchange.getName())) {
            return;
        }

        if (exchange.isDefault()) {
            if (topology.getQueue(routingKey) != null) {
                result.add(routingKey);
            }
            return;
        }

        Collection<Binding> bindings = topology.bindingsFrom(exchange.getName());
        for (Binding binding : bindings) {
            if (!matches(exchange.getType(), binding, routingKey, headers)) {
                continue;
            }
            if (binding.isQueueBinding()) {
                if (topology.getQueue(binding.getDestination()) != null) {
                    result.add(binding.getDestination());
                }
            } else {
                Exchange destination = topology.getExchange(binding.getDestination());
                if (destination != null) {
                    routeFrom(destination, routingKey, headers, result, visited);
                }
            }
        }
    }

    boolean matches(Exchange.Type type, Binding binding, String routingKey, Map<String, Object> headers) {
        switch (type) {
            case DIRECT:
                return binding.getPattern().equals(routingKey);
            case FANOUT:
                return true;
            case TOPIC:
                return topicMatcher.matches(binding.getPattern(), routingKey);
            case HEADERS:
                return headersMatcher.matches(binding.getArguments(), headers);
            default:
                return false;
        }
    }
}
