package nl.adgroot.bookingest.pages;

public enum PageStorageStrategy {
  /** The render provider's page URL is the permanent address; nothing is transferred. */
  PASSTHROUGH_RENDER_URL,
  /** Every page is downloaded into the scratch workspace and uploaded to object storage. */
  REHOST_TO_STORAGE
}
