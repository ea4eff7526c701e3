package com.air.pipeline;

import com.air.core.model.ReviewRecord;

/**
 * A review record plus its place in the queue while it is still queued.
 *
 * @param queuePosition requests ahead of this one, -1 once claimed
 * @param patchesAhead  estimated patches ahead of this one, 0 once claimed
 */
public record ReviewStatusView(ReviewRecord record, int queuePosition, int patchesAhead) {}
