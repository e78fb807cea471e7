package com.fleet.anomaly.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Output of one detection layer: the tags it raised per row, keyed by {@link RecordKey},
 * plus the scopes it skipped. A row is flagged by the layer exactly when it carries a tag,
 * so flag and tags cannot disagree.
 *
 * Not thread-safe. Each worker fills its own instance; instances are combined with
 * {@link #mergeFrom(LayerFindings)} after all workers finish.
 */
public class LayerFindings {

    private final DetectionLayer layer;
    private final Map<RecordKey, LinkedHashSet<AnomalyTag>> tagsByKey = new LinkedHashMap<>();
    private final Map<SkipReason, Integer> skips = new EnumMap<>(SkipReason.class);

    public LayerFindings(DetectionLayer layer) {
        this.layer = layer;
    }

    public DetectionLayer getLayer() {
        return layer;
    }

    public void addTag(RecordKey key, AnomalyTag tag) {
        if (tag.getLayer() != layer) {
            throw new IllegalArgumentException("Tag " + tag + " does not belong to layer " + layer);
        }
        tagsByKey.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(tag);
    }

    public void recordSkip(SkipReason reason) {
        skips.merge(reason, 1, Integer::sum);
    }

    public boolean isFlagged(RecordKey key) {
        return tagsByKey.containsKey(key);
    }

    public Set<AnomalyTag> tagsFor(RecordKey key) {
        Set<AnomalyTag> tags = tagsByKey.get(key);
        return tags == null ? Collections.emptySet() : Collections.unmodifiableSet(tags);
    }

    public Set<RecordKey> flaggedKeys() {
        return Collections.unmodifiableSet(tagsByKey.keySet());
    }

    public int flaggedCount() {
        return tagsByKey.size();
    }

    public int skipCount(SkipReason reason) {
        return skips.getOrDefault(reason, 0);
    }

    public void mergeFrom(LayerFindings other) {
        if (other.layer != layer) {
            throw new IllegalArgumentException("Cannot merge " + other.layer + " findings into " + layer);
        }
        other.tagsByKey.forEach((key, tags) ->
                tagsByKey.computeIfAbsent(key, k -> new LinkedHashSet<>()).addAll(tags));
        other.skips.forEach((reason, count) -> skips.merge(reason, count, Integer::sum));
    }
}
