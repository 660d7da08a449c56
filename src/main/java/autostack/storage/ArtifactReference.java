package autostack.storage;

import java.io.Serializable;
import java.util.Objects;

/**
 * Opaque handle of an artifact held by an {@link ArtifactStore}.
 */
public class ArtifactReference implements Serializable {

	private static final long serialVersionUID = -2315486372948102437L;

	private final String key;

	public ArtifactReference(final String key) {
		super();
		this.key = Objects.requireNonNull(key);
	}

	public String getKey() {
		return this.key;
	}

	@Override
	public int hashCode() {
		return this.key.hashCode();
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || this.getClass() != obj.getClass()) {
			return false;
		}
		return this.key.equals(((ArtifactReference) obj).key);
	}

	@Override
	public String toString() {
		return this.key;
	}
}
