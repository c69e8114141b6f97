package nl.adgroot.bookingest.storage;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

public interface ObjectStorage {

  /**
   * Uploads a local file as {@code folder/objectId}. Never overwrites an existing object; callers
   * must supply unique object ids. Completes exceptionally with {@link StorageException}.
   */
  CompletableFuture<StoredObject> upload(Path localPath, String folder, String objectId);

  CompletableFuture<Void> delete(String objectHandle);
}
