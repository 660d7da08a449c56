package autostack.leaderboard;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

import autostack.metrics.ScoringFunction;

/**
 * Append-only log of scored models. Ranking direction is taken from the metric.
 */
public class Leaderboard {

	private final ScoringFunction metric;
	private final List<LeaderboardEntry> entries = new ArrayList<>();
	private final Set<String> modelIds = new HashSet<>();

	public Leaderboard(final ScoringFunction metric) {
		super();
		this.metric = Objects.requireNonNull(metric);
	}

	public ScoringFunction getMetric() {
		return this.metric;
	}

	/**
	 * @return the appended entry, which carries its insertion index
	 */
	public synchronized LeaderboardEntry append(final LeaderboardEntry entry) {
		if (!this.modelIds.add(entry.getModelId())) {
			throw new IllegalArgumentException("Model " + entry.getModelId() + " is already on the leaderboard.");
		}
		LeaderboardEntry indexed = entry.withInsertionIndex(this.entries.size());
		this.entries.add(indexed);
		return indexed;
	}

	public synchronized ImmutableList<LeaderboardEntry> getEntries() {
		return ImmutableList.copyOf(this.entries);
	}

	public synchronized int size() {
		return this.entries.size();
	}

	public synchronized Optional<LeaderboardEntry> get(final String modelId) {
		return this.entries.stream().filter(e -> e.getModelId().equals(modelId)).findFirst();
	}

	/**
	 * @return all entries, best first; equal scores keep insertion order and undefined scores come last
	 */
	public synchronized List<LeaderboardEntry> getRanking() {
		return this.entries.stream().sorted(this.getComparator()).collect(Collectors.toList());
	}

	public synchronized Optional<LeaderboardEntry> getBest(final int layer) {
		return this.entries.stream().filter(e -> e.getLayer() == layer && !e.isEnsemble() && !Double.isNaN(e.getScore())).min(this.getComparator());
	}

	public Comparator<LeaderboardEntry> getComparator() {
		Comparator<LeaderboardEntry> byScore = (e1, e2) -> {
			boolean nan1 = Double.isNaN(e1.getScore());
			boolean nan2 = Double.isNaN(e2.getScore());
			if (nan1 || nan2) {
				return Boolean.compare(nan1, nan2);
			}
			int cmp = Double.compare(e1.getScore(), e2.getScore());
			return this.metric.isHigherBetter() ? -cmp : cmp;
		};
		return byScore.thenComparingInt(LeaderboardEntry::getInsertionIndex);
	}

	@Override
	public synchronized String toString() {
		StringBuilder sb = new StringBuilder("Leaderboard (" + this.metric.getName() + ", " + (this.metric.isHigherBetter() ? "higher" : "lower") + " is better)");
		for (LeaderboardEntry entry : this.getRanking()) {
			sb.append("\n\t").append(entry);
		}
		return sb.toString();
	}
}
