package autostack.storage;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import autostack.family.ModelArtifact;

public class InMemoryArtifactStore implements ArtifactStore {

	private final ConcurrentMap<String, ModelArtifact> artifacts = new ConcurrentHashMap<>();

	@Override
	public ArtifactReference put(final String key, final ModelArtifact artifact) {
		if (this.artifacts.putIfAbsent(key, artifact) != null) {
			throw new IllegalStateException("An artifact with key " + key + " is already stored.");
		}
		return new ArtifactReference(key);
	}

	@Override
	public ModelArtifact load(final ArtifactReference reference) throws IOException {
		ModelArtifact artifact = this.artifacts.get(reference.getKey());
		if (artifact == null) {
			throw new IOException("No artifact stored under " + reference);
		}
		return artifact;
	}

	@Override
	public void delete(final ArtifactReference reference) {
		this.artifacts.remove(reference.getKey());
	}

	public int size() {
		return this.artifacts.size();
	}
}
