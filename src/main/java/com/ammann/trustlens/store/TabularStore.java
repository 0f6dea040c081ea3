/* (C)2026 */
package com.ammann.trustlens.store;

import com.ammann.trustlens.model.Dataset;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jboss.logging.Logger;

/**
 * In-memory mapping from source key to the most recently ingested {@link Dataset}.
 *
 * <p>Each {@link #put} is a single atomic replacement; concurrent writers to the same key
 * race and the last write wins. Contents live only for the lifetime of the process.
 */
@ApplicationScoped
public class TabularStore {

    private static final Logger LOG = Logger.getLogger(TabularStore.class);

    private final ConcurrentMap<String, Dataset> datasets = new ConcurrentHashMap<>();

    /**
     * Stores a dataset under the given key, replacing any previous dataset.
     *
     * @param key source key
     * @param dataset dataset to store
     */
    public void put(String key, Dataset dataset) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(dataset, "dataset");

        Dataset previous = datasets.put(key, dataset);
        if (previous != null) {
            LOG.debugf("Replaced dataset for source '%s' (%s -> %s)", key, previous, dataset);
        } else {
            LOG.debugf("Stored dataset for source '%s': %s", key, dataset);
        }
    }

    /**
     * Looks up the dataset stored under a key.
     *
     * @param key source key
     * @return the dataset, or empty if the key was never ingested
     */
    public Optional<Dataset> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(datasets.get(key));
    }

    /**
     * @return loaded source keys in natural order
     */
    public List<String> sourceKeys() {
        return datasets.keySet().stream().sorted().toList();
    }

    /**
     * Removes all datasets.
     */
    public void clear() {
        datasets.clear();
    }
}
