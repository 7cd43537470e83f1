package com.minibroker.routing;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topic pattern matching. Words are separated by dots; {@code *} matches exactly one word
 * and {@code #} matches zero or more words.
 * <p>
 * Patterns are split once and cached, since the same binding is matched against every
 * message published through its exchange.
 */
public class TopicMatcher {
    private static final int MAX_CACHED_PATTERNS = 10_000;

    private final Map<String, String[]> compiled = new ConcurrentHashMap<>();

    public boolean matches(String pattern, String routingKey) {
        if (pattern.equals("#") || pattern.equals(routingKey)) {
            return true;
        }
        String[] bindingParts = compile(pattern);
        String[] routingParts = split(routingKey);
        return matchesParts(routingParts, bindingParts, 0, 0);
    }

    private String[] compile(String pattern) {
        String[] parts = compiled.get(pattern);
        if (parts == null) {
            parts = split(pattern);
            if (compiled.size() < MAX_CACHED_PATTERNS) {
                compiled.put(pattern, parts);
            }
        }
        return parts;
    }

    private static String[] split(String key) {
        return key.split("\\.", -1);
    }

    private boolean matchesParts(String[] routingParts, String[] bindingParts,
                                 int routingIndex, int bindingIndex) {
        if (bindingIndex >= bindingParts.length) {
            return routingIndex >= routingParts.length;
        }

        if (routingIndex >= routingParts.length) {
            // Only trailing '#' words can match nothing
            for (int i = bindingIndex; i < bindingParts.length; i++) {
                if (!bindingParts[i].equals("#")) {
                    return false;
                }
            }
            return true;
        }

        String bindingPart = bindingParts[bindingIndex];
        String routingPart = routingParts[routingIndex];

        if (bindingPart.equals("#")) {
            if (bindingIndex == bindingParts.length - 1) {
                return true;
            }
            for (int i = routingIndex; i <= routingParts.length; i++) {
                if (matchesParts(routingParts, bindingParts, i, bindingIndex + 1)) {
                    return true;
                }
            }
            return false;
        } else if (bindingPart.equals("*") || bindingPart.equals(routingPart)) {
            return matchesParts(routingParts, bindingParts, routingIndex + 1, bindingIndex + 1);
        } else {
            return false;
        }
    }
}
