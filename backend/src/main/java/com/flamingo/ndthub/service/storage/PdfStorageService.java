package com.flamingo.ndthub.service.storage;

import com.flamingo.ndthub.config.HubConfig;
import com.flamingo.ndthub.exception.StoredFileMissingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stores uploaded PDFs on the local file system.
 *
 * <p>Files live at {@code {hub.storage.root}/pdfs/{random}_{name}}; the returned storage key is the
 * path relative to the root and is the only handle callers keep.
 */
@Service
@Slf4j
public class PdfStorageService {

  static final String PDF_PREFIX = "pdfs/";

  private final Path root;

  public PdfStorageService(HubConfig hubConfig) {
    this.root = Path.of(hubConfig.getStorage().getRoot()).toAbsolutePath().normalize();
  }

  /**
   * Writes a PDF and returns its storage key.
   *
   * @param content PDF bytes
   * @param originalFilename file name as uploaded
   * @return storage key for {@link #resolve(String)}
   */
  public String store(byte[] content, String originalFilename) {
    String key = generateKey(originalFilename);
    Path target = resolvePath(key);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, content);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to store PDF " + key, e);
    }
    log.info("Stored {} ({} bytes) as {}", originalFilename, content.length, key);
    return key;
  }

  /**
   * Resolves a storage key to an existing file.
   *
   * @throws StoredFileMissingException if nothing is stored under the key
   */
  public Path resolve(String storageKey) {
    Path path = resolvePath(storageKey);
    if (!Files.isRegularFile(path)) {
      throw new StoredFileMissingException(storageKey);
    }
    return path;
  }

  /** Removes a stored file; a missing file is not an error. */
  public void delete(String storageKey) {
    try {
      if (Files.deleteIfExists(resolvePath(storageKey))) {
        log.info("Deleted stored PDF {}", storageKey);
      }
    } catch (IOException e) {
      log.warn("Failed to delete stored PDF {}: {}", storageKey, e.getMessage());
    }
  }

  String generateKey(String originalFilename) {
    String safeName = sanitize(originalFilename);
    String prefix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    return PDF_PREFIX + prefix + "_" + safeName;
  }

  private Path resolvePath(String storageKey) {
    Path path = root.resolve(storageKey).normalize();
    if (!path.startsWith(root)) {
      throw new IllegalArgumentException("Storage key escapes storage root: " + storageKey);
    }
    return path;
  }

  private static String sanitize(String filename) {
    String name = filename == null ? "document.pdf" : filename;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    name = name.replace(' ', '_');
    return name.isBlank() || name.equals("..") ? "document.pdf" : name;
  }
}
