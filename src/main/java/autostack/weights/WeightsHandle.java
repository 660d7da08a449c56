package autostack.weights;

import java.nio.file.Path;
import java.util.Objects;

public class WeightsHandle {

	private final String modelId;
	private final Path location;

	public WeightsHandle(final String modelId, final Path location) {
		super();
		this.modelId = Objects.requireNonNull(modelId);
		this.location = Objects.requireNonNull(location);
	}

	public String getModelId() {
		return this.modelId;
	}

	public Path getLocation() {
		return this.location;
	}

	@Override
	public String toString() {
		return "WeightsHandle [modelId=" + this.modelId + ", location=" + this.location + "]";
	}
}
