package autostack.portfolio;

/**
 * Expected cost of fitting a candidate once on the full training data. Estimates derived from per-cell costs can be rescaled to tables of another
 * size, such as the wider inputs of stack layers.
 */
public class ResourceEstimate {

	private final int cpus;
	private final int gpus;
	private final long memoryBytes;
	private final double fitSeconds;
	private final boolean gpuOnly;
	private final boolean gpuSharing;
	private final double baseSeconds;
	private final double secondsPerCell;
	private final double bytesPerCell;

	public ResourceEstimate(final int cpus, final int gpus, final long memoryBytes, final double fitSeconds, final boolean gpuOnly, final boolean gpuSharing) {
		this(cpus, gpus, memoryBytes, fitSeconds, gpuOnly, gpuSharing, fitSeconds, 0, 0);
	}

	private ResourceEstimate(final int cpus, final int gpus, final long memoryBytes, final double fitSeconds, final boolean gpuOnly, final boolean gpuSharing, final double baseSeconds,
			final double secondsPerCell, final double bytesPerCell) {
		super();
		if (cpus < 1 || gpus < 0 || memoryBytes < 0 || fitSeconds < 0) {
			throw new IllegalArgumentException("Invalid resource estimate: cpus=" + cpus + ", gpus=" + gpus + ", memory=" + memoryBytes + ", seconds=" + fitSeconds);
		}
		if (gpuOnly && gpus == 0) {
			throw new IllegalArgumentException("A GPU-only candidate must request at least one GPU.");
		}
		this.cpus = cpus;
		this.gpus = gpus;
		this.memoryBytes = memoryBytes;
		this.fitSeconds = fitSeconds;
		this.gpuOnly = gpuOnly;
		this.gpuSharing = gpuSharing;
		this.baseSeconds = baseSeconds;
		this.secondsPerCell = secondsPerCell;
		this.bytesPerCell = bytesPerCell;
	}

	public static ResourceEstimate cpuOnly(final double fitSeconds) {
		return new ResourceEstimate(1, 0, 0, fitSeconds, false, false);
	}

	/**
	 * Estimate that grows linearly with the number of cells (rows times features) of the training table.
	 */
	public static ResourceEstimate perCell(final int cpus, final int gpus, final double baseSeconds, final double secondsPerCell, final double bytesPerCell, final long cells, final boolean gpuOnly,
			final boolean gpuSharing) {
		return new ResourceEstimate(cpus, gpus, (long) Math.ceil(bytesPerCell * cells), baseSeconds + secondsPerCell * cells, gpuOnly, gpuSharing, baseSeconds, secondsPerCell, bytesPerCell);
	}

	/**
	 * @return the estimate for a table with the given number of cells; estimates without per-cell costs stay unchanged
	 */
	public ResourceEstimate forCells(final long cells) {
		if (this.secondsPerCell == 0 && this.bytesPerCell == 0) {
			return this;
		}
		return perCell(this.cpus, this.gpus, this.baseSeconds, this.secondsPerCell, this.bytesPerCell, cells, this.gpuOnly, this.gpuSharing);
	}

	public int getCpus() {
		return this.cpus;
	}

	public int getGpus() {
		return this.gpus;
	}

	public long getMemoryBytes() {
		return this.memoryBytes;
	}

	public double getFitSeconds() {
		return this.fitSeconds;
	}

	public boolean isGpuOnly() {
		return this.gpuOnly;
	}

	/**
	 * @return whether the candidate may share a GPU with other trainers
	 */
	public boolean isGpuSharing() {
		return this.gpuSharing;
	}

	/**
	 * Expected seconds for a bagged fit: each fold model sees (k-1)/k of the rows, plus one full fit if the candidate is refit.
	 */
	public double getBaggedFitSeconds(final int numFolds, final int numRepetitions, final boolean refitFull) {
		double perFold = this.fitSeconds * (numFolds - 1) / numFolds;
		return perFold * numFolds * numRepetitions + (refitFull ? this.fitSeconds : 0);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + this.cpus;
		long temp = Double.doubleToLongBits(this.fitSeconds);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		result = prime * result + (this.gpuOnly ? 1231 : 1237);
		result = prime * result + (this.gpuSharing ? 1231 : 1237);
		result = prime * result + this.gpus;
		result = prime * result + (int) (this.memoryBytes ^ (this.memoryBytes >>> 32));
		temp = Double.doubleToLongBits(this.secondsPerCell);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		temp = Double.doubleToLongBits(this.bytesPerCell);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		return result;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (this.getClass() != obj.getClass()) {
			return false;
		}
		ResourceEstimate other = (ResourceEstimate) obj;
		if (this.cpus != other.cpus || this.gpus != other.gpus || this.memoryBytes != other.memoryBytes) {
			return false;
		}
		if (Double.doubleToLongBits(this.fitSeconds) != Double.doubleToLongBits(other.fitSeconds)) {
			return false;
		}
		if (Double.doubleToLongBits(this.secondsPerCell) != Double.doubleToLongBits(other.secondsPerCell) || Double.doubleToLongBits(this.bytesPerCell) != Double.doubleToLongBits(other.bytesPerCell)) {
			return false;
		}
		return this.gpuOnly == other.gpuOnly && this.gpuSharing == other.gpuSharing && Double.doubleToLongBits(this.baseSeconds) == Double.doubleToLongBits(other.baseSeconds);
	}

	@Override
	public String toString() {
		return "ResourceEstimate [cpus=" + this.cpus + ", gpus=" + this.gpus + ", memoryBytes=" + this.memoryBytes + ", fitSeconds=" + this.fitSeconds + ", gpuOnly=" + this.gpuOnly + ", gpuSharing=" + this.gpuSharing + "]";
	}
}
