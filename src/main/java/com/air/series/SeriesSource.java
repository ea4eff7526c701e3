package com.air.series;

import java.io.IOException;

/**
 * Source of patch series referenced by id.
 */
public interface SeriesSource {

    /**
     * Returns the whole series as one mbox, patches in series order.
     */
    String fetchMbox(long seriesId) throws IOException;
}
