package nl.adgroot.bookingest.storage;

/**
 * @param publicUrl    durable, publicly resolvable URL
 * @param objectHandle the provider's own id, needed to delete the object again
 */
public record StoredObject(String publicUrl, String objectHandle) {}
