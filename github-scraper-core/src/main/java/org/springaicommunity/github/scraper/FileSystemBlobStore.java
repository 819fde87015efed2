package org.springaicommunity.github.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File system implementation of {@link BlobStore}. Each key is a file below the root
 * directory; parent directories are created on write.
 */
public class FileSystemBlobStore implements BlobStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemBlobStore.class);

	private final Path root;

	public FileSystemBlobStore(Path root) {
		this.root = root.toAbsolutePath().normalize();
	}

	public Path getRoot() {
		return root;
	}

	@Override
	public Optional<byte[]> read(String key) {
		Path path = resolve(key);
		if (!Files.isRegularFile(path)) {
			return Optional.empty();
		}
		try {
			return Optional.of(Files.readAllBytes(path));
		}
		catch (IOException e) {
			logger.warn("Failed to read cache entry {}, treating as missing: {}", path, e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void write(String key, byte[] data) {
		Path path = resolve(key);
		Path temp = null;
		try {
			Files.createDirectories(path.getParent());
			temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
			Files.write(temp, data);
			Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
			logger.info("Saved {} bytes to {}", data.length, path);
		}
		catch (IOException e) {
			if (temp != null) {
				deleteQuietly(temp);
			}
			throw new RuntimeException("Failed to write cache entry: " + path, e);
		}
	}

	private static void deleteQuietly(Path temp) {
		try {
			Files.deleteIfExists(temp);
		}
		catch (IOException e) {
			logger.warn("Failed to remove temporary file {}: {}", temp, e.getMessage());
		}
	}

	Path resolve(String key) {
		if (key.isBlank()) {
			throw new IllegalArgumentException("Cache key must not be blank");
		}
		Path path = root.resolve(key).normalize();
		if (!path.startsWith(root) || path.equals(root)) {
			throw new IllegalArgumentException("Cache key escapes the store root: " + key);
		}
		return path;
	}

}
