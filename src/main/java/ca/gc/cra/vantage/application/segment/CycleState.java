package ca.gc.cra.vantage.application.segment;

/**
 * Position of a {@link SegmentEngine} within a refresh cycle.
 *
 * @since 0.1.0
 */
public enum CycleState {
  /** No index has been built yet; queries return empty results. */
  EMPTY,
  /** Indices are built and no entity query has run since the last claim reset. */
  BUILT,
  /** At least one entity query has claimed interfaces. */
  QUERIED,
  /** The not-yet-claimed segment has been computed for the cycle. */
  FINALIZED
}
