package com.ybds.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outbound control frames answering subscribe and unsubscribe requests.
 */
public final class ControlReplies {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String SUBSCRIPTION_STATUS = "subscription_status";
    public static final String UNSUBSCRIBED = "unsubscribed";

    public static byte[] subscriptionStatus(String topic, boolean success) {
        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("type", SUBSCRIPTION_STATUS);
        reply.put("topic", topic);
        reply.put("success", success);
        return write(reply);
    }

    public static byte[] unsubscribed(String topic) {
        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("type", UNSUBSCRIBED);
        reply.put("topic", topic);
        return write(reply);
    }

    private static byte[] write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Control reply not serializable", e);
        }
    }

    private ControlReplies() {}
}
