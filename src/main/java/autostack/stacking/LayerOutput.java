package autostack.stacking;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

import autostack.data.Dataset;
import autostack.data.Predictions;

/**
 * The models of one layer with their out-of-fold predictions, ordered by candidate rank. Its predictions are the engineered features of the next
 * layer.
 */
public class LayerOutput {

	private final int layer;
	private final ImmutableList<FittedModel> models;

	public LayerOutput(final int layer, final List<FittedModel> models) {
		super();
		this.layer = layer;
		this.models = ImmutableList.copyOf(models);
	}

	public int getLayer() {
		return this.layer;
	}

	public ImmutableList<FittedModel> getModels() {
		return this.models;
	}

	public List<String> getModelIds() {
		return this.models.stream().map(FittedModel::getId).collect(Collectors.toList());
	}

	public boolean isEmpty() {
		return this.models.isEmpty();
	}

	public Map<String, Predictions> getOutOfFoldPredictions() {
		Map<String, Predictions> predictions = new LinkedHashMap<>();
		this.models.forEach(m -> predictions.put(m.getId(), m.getOutOfFoldPredictions()));
		return predictions;
	}

	/**
	 * @return the original features extended by the out-of-fold predictions of this layer
	 */
	public Dataset toNextLayerFeatures(final Dataset originalFeatures, final List<String> classLabels) {
		return StackFeatures.augment(originalFeatures, this.getModelIds(), this.getOutOfFoldPredictions(), classLabels);
	}
}
