package nl.adgroot.bookingest.errors;

/** Pipeline stage a failure is attributed to. */
public enum Stage {
  WORKSPACE,
  UPLOAD,
  OCR,
  METADATA,
  PAGES,
  CANCELLED
}
