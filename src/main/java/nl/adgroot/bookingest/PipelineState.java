package nl.adgroot.bookingest;

/**
 * Linear run states. {@link #FAILED} can follow any state; there is no retry inside a run.
 */
public enum PipelineState {
  STARTED,
  REGISTERED,
  COVER_EXTRACTED,
  METADATA_RESOLVED,
  PAGES_MATERIALIZED,
  CLEANED,
  DONE,
  FAILED
}
