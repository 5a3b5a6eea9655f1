package com.eainde.amqpretry.model;

import java.util.List;

/**
 * The fixed sequence of delay tiers, in seconds, that a failing message climbs.
 * Tier {@code n} is used for a message whose {@code _retryNumber} is {@code n}.
 */
public final class BackoffLadder {

    public static final List<Integer> DEFAULT_TIERS = List.of(1, 5, 10, 30, 60, 300, 600);

    private final List<Integer> tiers;
    private final String queueTemplate;

    public BackoffLadder(List<Integer> tiers, String queueTemplate) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("Backoff ladder must have at least one tier");
        }
        for (Integer tier : tiers) {
            if (tier == null || tier <= 0) {
                throw new IllegalArgumentException("Backoff ladder tiers must be positive, got " + tiers);
            }
        }
        if (queueTemplate == null || queueTemplate.isBlank()) {
            throw new IllegalArgumentException("Delay queue template must not be blank");
        }
        this.tiers = List.copyOf(tiers);
        this.queueTemplate = queueTemplate;
    }

    public int size() {
        return tiers.size();
    }

    public List<Integer> tiers() {
        return tiers;
    }

    /**
     * @return true when a message that has already been attempted {@code retryNumber} times
     * has no tier left to climb.
     */
    public boolean isExhausted(int retryNumber) {
        return retryNumber >= tiers.size();
    }

    public int delaySeconds(int index) {
        return tiers.get(index);
    }

    public int ttlMillis(int index) {
        return tiers.get(index) * 1000;
    }

    /**
     * The name of the delay queue for the given tier, e.g. {@code amqp.retry.waiting-0005}.
     */
    public String queueName(int index) {
        return String.format(queueTemplate, tiers.get(index));
    }

    @Override
    public String toString() {
        return "BackoffLadder" + tiers;
    }
}
