package autostack.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import autostack.family.ModelArtifact;

/**
 * Keeps artifacts in memory as long as the heap has room for them and writes them to disk once it has not. An artifact stays where it was put.
 */
public class SpillingArtifactStore implements ArtifactStore {

	private final Logger logger = LoggerFactory.getLogger(SpillingArtifactStore.class);

	private final InMemoryArtifactStore memory = new InMemoryArtifactStore();
	private final Set<String> spilledKeys = ConcurrentHashMap.newKeySet();
	private final Path spillDirectory;
	private final LongSupplier headroomBytes;
	private FileArtifactStore disk;

	/**
	 * @param spillDirectory
	 *            directory for spilled artifacts; null to create a temporary directory on the first spill
	 * @param headroomBytes
	 *            bytes the heap may still take
	 */
	public SpillingArtifactStore(final Path spillDirectory, final LongSupplier headroomBytes) {
		super();
		this.spillDirectory = spillDirectory;
		this.headroomBytes = Objects.requireNonNull(headroomBytes);
	}

	private synchronized FileArtifactStore getDisk() throws IOException {
		if (this.disk == null) {
			this.disk = new FileArtifactStore(this.spillDirectory != null ? this.spillDirectory : Files.createTempDirectory("autostack-spill"));
			this.logger.info("Spilling artifacts to {}", this.disk.getDirectory());
		}
		return this.disk;
	}

	@Override
	public ArtifactReference put(final String key, final ModelArtifact artifact) throws IOException {
		long size = ArtifactSizes.serializedSize(artifact);
		long headroom = this.headroomBytes.getAsLong();
		if (size <= headroom) {
			return this.memory.put(key, artifact);
		}
		this.logger.debug("Artifact {} needs {} bytes, but only {} bytes of heap are left. Writing it to disk.", key, size, headroom);
		ArtifactReference reference = this.getDisk().put(key, artifact);
		this.spilledKeys.add(key);
		return reference;
	}

	@Override
	public ModelArtifact load(final ArtifactReference reference) throws IOException {
		return this.isSpilled(reference) ? this.getDisk().load(reference) : this.memory.load(reference);
	}

	@Override
	public void delete(final ArtifactReference reference) throws IOException {
		if (this.spilledKeys.remove(reference.getKey())) {
			this.getDisk().delete(reference);
		} else {
			this.memory.delete(reference);
		}
	}

	public boolean isSpilled(final ArtifactReference reference) {
		return this.spilledKeys.contains(reference.getKey());
	}

	public int getNumInMemory() {
		return this.memory.size();
	}

	public int getNumSpilled() {
		return this.spilledKeys.size();
	}
}
