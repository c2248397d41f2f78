package org.bigcsters.matching.score;

/**
 * How two topic sets are compared.
 *
 * <p>{@code INTERSECTION_COUNT} awards the topic weight once per shared topic.</p>
 * <p>{@code JACCARD} awards the topic weight scaled by |A ∩ B| / |A ∪ B|.</p>
 */
public enum TopicOverlapMode {
    INTERSECTION_COUNT,
    JACCARD
}
