package autostack.predictor;

import java.util.List;

import autostack.AutoStackException;
import autostack.data.Dataset;
import autostack.data.Predictions;
import autostack.ensemble.EnsembleWeights;
import autostack.leaderboard.InferencePlan;
import autostack.leaderboard.Leaderboard;

/**
 * Handle of a fitted ensemble.
 */
public interface Predictor {

	/**
	 * @return one row per input row: the index of the most likely class for classification, the predicted value for regression, or one value per
	 *         requested quantile level for quantile problems
	 */
	public double[][] predict(Dataset data) throws AutoStackException;

	/**
	 * @throws UnsupportedOperationException
	 *             if the problem is not a classification problem
	 */
	public Predictions predictProba(Dataset data) throws AutoStackException;

	public List<String> predictLabels(Dataset data) throws AutoStackException;

	public Leaderboard getLeaderboard();

	public EnsembleWeights getEnsembleWeights();

	public InferencePlan getInferencePlan();

	public FitSummary getFitSummary();
}
