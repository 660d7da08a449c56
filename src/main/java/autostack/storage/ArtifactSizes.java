package autostack.storage;

import java.io.IOException;
import java.io.ObjectOutputStream;
import java.util.Collection;
import java.util.Collections;

import com.google.common.io.ByteStreams;
import com.google.common.io.CountingOutputStream;

import autostack.family.ModelArtifact;

/**
 * Size estimates of artifacts, taken as the length of their Java serialization.
 */
public class ArtifactSizes {

	private ArtifactSizes() {
		/* avoid instantiation */
	}

	public static long serializedSize(final ModelArtifact artifact) throws IOException {
		return serializedSize(Collections.singletonList(artifact));
	}

	public static long serializedSize(final Collection<? extends ModelArtifact> artifacts) throws IOException {
		CountingOutputStream counter = new CountingOutputStream(ByteStreams.nullOutputStream());
		try (ObjectOutputStream out = new ObjectOutputStream(counter)) {
			for (ModelArtifact artifact : artifacts) {
				out.writeObject(artifact);
			}
		}
		return counter.getCount();
	}
}
