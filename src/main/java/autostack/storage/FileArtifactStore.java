package autostack.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import autostack.family.ModelArtifact;
import weka.core.SerializationHelper;

/**
 * Serializes artifacts into one file per key below a directory.
 */
public class FileArtifactStore implements ArtifactStore {

	public static final String FILE_SUFFIX = ".artifact";

	private final Logger logger = LoggerFactory.getLogger(FileArtifactStore.class);

	private final Path directory;

	public FileArtifactStore(final Path directory) throws IOException {
		super();
		this.directory = Objects.requireNonNull(directory);
		Files.createDirectories(directory);
	}

	public Path getDirectory() {
		return this.directory;
	}

	private Path getFile(final String key) {
		String sanitized = key.replaceAll("[^A-Za-z0-9._-]", "_");
		return this.directory.resolve(sanitized + FILE_SUFFIX);
	}

	@Override
	public ArtifactReference put(final String key, final ModelArtifact artifact) throws IOException {
		Path file = this.getFile(key);
		try {
			SerializationHelper.write(file.toString(), artifact);
		} catch (Exception e) {
			throw new IOException("Could not write artifact " + key + " to " + file, e);
		}
		this.logger.debug("Wrote artifact {} to {}", key, file);
		return new ArtifactReference(key);
	}

	@Override
	public ModelArtifact load(final ArtifactReference reference) throws IOException {
		Path file = this.getFile(reference.getKey());
		if (!Files.exists(file)) {
			throw new IOException("No artifact stored under " + reference + " in " + this.directory);
		}
		try {
			return (ModelArtifact) SerializationHelper.read(file.toString());
		} catch (Exception e) {
			throw new IOException("Could not read artifact " + reference + " from " + file, e);
		}
	}

	@Override
	public void delete(final ArtifactReference reference) throws IOException {
		Files.deleteIfExists(this.getFile(reference.getKey()));
	}
}
