package nl.adgroot.bookingest.cloudinary;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Cloudinary request signature: SHA-1 over the alphabetically sorted {@code key=value} pairs joined
 * with {@code &}, followed by the api secret.
 */
public final class CloudinarySigner {

  // never part of the signed string
  private static final Set<String> UNSIGNED = Set.of("file", "api_key", "resource_type", "cloud_name");

  private CloudinarySigner() {
    // utility class
  }

  public static String sign(Map<String, String> params, String apiSecret) {
    String toSign = new TreeMap<>(params).entrySet().stream()
        .filter(e -> !UNSIGNED.contains(e.getKey()))
        .filter(e -> e.getValue() != null && !e.getValue().isEmpty())
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining("&"));

    try {
      MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
      byte[] digest = sha1.digest((toSign + apiSecret).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 not available", e);
    }
  }
}
