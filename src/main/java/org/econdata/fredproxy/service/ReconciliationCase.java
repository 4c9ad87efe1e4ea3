package org.econdata.fredproxy.service;

/**
 * How a cached observation window was reconciled with the requested one.
 *
 * <ul>
 *   <li>{@link #FULL_MISS}: nothing cached in range; one upstream call for the whole window
 *   <li>{@link #EXACT_HIT}: the cache covers both requested bounds; no upstream call
 *   <li>{@link #GAP_FILL}: gaps at the edges were probed but held no new rows; cached rows answer
 *   <li>{@link #INCOMPLETE_REFETCH}: a gap held new rows; the whole window is fetched again once
 * </ul>
 */
public enum ReconciliationCase {
  FULL_MISS,
  EXACT_HIT,
  GAP_FILL,
  INCOMPLETE_REFETCH
}
