package com.ybds.transport.ws;

/**
 * Decides whether a client may join a topic. Must be side-effect free; it runs on
 * the client's inbound thread.
 */
@FunctionalInterface
public interface SubscriptionPolicy {

    boolean authorize(Client client, String topic);

    static SubscriptionPolicy permitAll() {
        return (client, topic) -> true;
    }

    /**
     * Allow topics named {@code <role>.<anything>} for any role the client holds,
     * e.g. role "admin" may join "admin.alerts".
     */
    static SubscriptionPolicy rolePrefix() {
        return (client, topic) -> {
            for (String role : client.getRoles()) {
                if (topic.startsWith(role + ".")) {
                    return true;
                }
            }
            return false;
        };
    }

    default SubscriptionPolicy or(SubscriptionPolicy other) {
        return (client, topic) -> authorize(client, topic) || other.authorize(client, topic);
    }
}
