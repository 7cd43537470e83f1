package com.minibroker.routing;

import com.minibroker.amqp.AmqpConstants;

import java.util.Map;

/**
 * Headers exchange matching. Binding arguments are the criteria; {@code x-match} selects
 * {@code all} (default) or {@code any}, and other {@code x-} arguments are ignored. A
 * criterion with a null value only requires the header to be present.
 */
public class HeadersMatcher {

    public boolean matches(Map<String, Object> bindingArgs, Map<String, Object> messageHeaders) {
        boolean any = bindingArgs != null &&
                      "any".equalsIgnoreCase(String.valueOf(bindingArgs.get(AmqpConstants.ARG_MATCH)));

        int criteria = 0;
        if (bindingArgs != null) {
            for (Map.Entry<String, Object> entry : bindingArgs.entrySet()) {
                if (entry.getKey().startsWith("x-")) {
                    continue;
                }
                criteria++;
                boolean matched = headerMatches(messageHeaders, entry.getKey(), entry.getValue());
                if (any && matched) {
                    return true;
                }
                if (!any && !matched) {
                    return false;
                }
            }
        }

        // No criteria means match all
        return criteria == 0 || !any;
    }

    private boolean headerMatches(Map<String, Object> headers, String key, Object expected) {
        if (headers == null || !headers.containsKey(key)) {
            return false;
        }
        if (expected == null) {
            return true;
        }
        return valuesEqual(expected, headers.get(key));
    }

    private boolean valuesEqual(Object expected, Object actual) {
        if (actual == null) {
            return false;
        }
        if (expected instanceof Number && actual instanceof Number) {
            return ((Number) expected).doubleValue() == ((Number) actual).doubleValue();
        }
        if (expected instanceof String || actual instanceof String) {
            return expected.toString().equals(actual.toString());
        }
        return expected.equals(actual);
    }
}
