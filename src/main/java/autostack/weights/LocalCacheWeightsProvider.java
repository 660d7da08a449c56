package autostack.weights;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves weights from a local cache directory as {@code <cacheDir>/<modelId>.model}. Nothing is downloaded.
 */
public class LocalCacheWeightsProvider implements WeightsProvider {

	public static final String FILE_SUFFIX = ".model";

	private final Logger logger = LoggerFactory.getLogger(LocalCacheWeightsProvider.class);

	private final Path cacheDirectory;

	public LocalCacheWeightsProvider(final Path cacheDirectory) {
		super();
		this.cacheDirectory = Objects.requireNonNull(cacheDirectory);
	}

	public Path getCacheDirectory() {
		return this.cacheDirectory;
	}

	@Override
	public WeightsHandle getWeights(final String modelId) throws WeightsUnavailableException {
		if (modelId == null || modelId.isBlank() || modelId.contains("/") || modelId.contains("\\") || modelId.contains("..")) {
			throw new WeightsUnavailableException(String.valueOf(modelId), "not a valid model id");
		}
		Path file = this.cacheDirectory.resolve(modelId + FILE_SUFFIX);
		if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
			throw new WeightsUnavailableException(modelId, "no readable file " + file + " in the local cache");
		}
		this.logger.debug("Resolved weights of {} to {}", modelId, file);
		return new WeightsHandle(modelId, file);
	}
}
