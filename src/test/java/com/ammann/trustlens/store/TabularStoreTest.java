/* (C)2026 */
package com.ammann.trustlens.store;

import static com.ammann.trustlens.support.TestDataFactory.dataset;
import static com.ammann.trustlens.support.TestDataFactory.integers;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.trustlens.model.Dataset;
import org.junit.jupiter.api.Test;

class TabularStoreTest {

    private final TabularStore store = new TabularStore();

    @Test
    void returnsEmptyForUnknownKey() {
        assertThat(store.get("foo")).isEmpty();
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    void putReplacesPreviousDataset() {
        Dataset first = dataset(integers("a", 1L));
        Dataset second = dataset(integers("b", 2L, 3L));

        store.put("csv", first);
        store.put("csv", second);

        assertThat(store.get("csv")).containsSame(second);
        assertThat(store.sourceKeys()).containsExactly("csv");
    }

    @Test
    void sourceKeysAreSorted() {
        store.put("demo", dataset(integers("a", 1L)));
        store.put("csv", dataset(integers("a", 1L)));

        assertThat(store.sourceKeys()).containsExactly("csv", "demo");

        store.clear();
        assertThat(store.sourceKeys()).isEmpty();
    }
}
