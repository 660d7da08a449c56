package autostack.storage;

import java.io.IOException;

import autostack.family.ModelArtifact;

/**
 * Persistence of fitted model artifacts. The engine only keeps the references it gets back.
 */
public interface ArtifactStore {

	public ArtifactReference put(String key, ModelArtifact artifact) throws IOException;

	public ModelArtifact load(ArtifactReference reference) throws IOException;

	public void delete(ArtifactReference reference) throws IOException;
}
