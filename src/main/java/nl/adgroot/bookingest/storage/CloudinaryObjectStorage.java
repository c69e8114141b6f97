package nl.adgroot.bookingest.storage;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.databind.JsonNode;
import nl.adgroot.bookingest.cloudinary.CloudinaryClient;
import nl.adgroot.bookingest.errors.Failures;
import okhttp3.MediaType;

public class CloudinaryObjectStorage implements ObjectStorage {

  private static final MediaType IMAGE = MediaType.parse("image/*");

  private final CloudinaryClient client;

  public CloudinaryObjectStorage(CloudinaryClient client) {
    this.client = client;
  }

  @Override
  public CompletableFuture<StoredObject> upload(Path localPath, String folder, String objectId) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("folder", folder);
    params.put("public_id", objectId);
    params.put("overwrite", "false");

    return client.uploadAsync(localPath, IMAGE, params)
        .handle((json, ex) -> {
          if (ex != null) {
            throw new CompletionException(new StorageException(
                "Upload of " + folder + "/" + objectId + " failed", Failures.unwrap(ex)));
          }
          return toStoredObject(json, folder + "/" + objectId);
        });
  }

  @Override
  public CompletableFuture<Void> delete(String objectHandle) {
    return client.destroyAsync(objectHandle)
        .handle((json, ex) -> {
          if (ex != null) {
            throw new CompletionException(new StorageException(
                "Delete of " + objectHandle + " failed", Failures.unwrap(ex)));
          }
          String result = json.path("result").asText("");
          if (!"ok".equals(result) && !"not found".equals(result)) {
            throw new CompletionException(new StorageException(
                "Delete of " + objectHandle + " answered '" + result + "'"));
          }
          return null;
        });
  }

  private static StoredObject toStoredObject(JsonNode json, String requestedId) {
    // with overwrite=false Cloudinary answers 200 with "existing": true instead of replacing
    if (json.path("existing").asBoolean(false)) {
      throw new CompletionException(new StorageException("Object already exists: " + requestedId));
    }
    String url = json.path("secure_url").asText("");
    String publicId = json.path("public_id").asText("");
    if (url.isEmpty() || publicId.isEmpty()) {
      throw new CompletionException(new StorageException("Upload response incomplete for " + requestedId));
    }
    return new StoredObject(url, publicId);
  }
}
