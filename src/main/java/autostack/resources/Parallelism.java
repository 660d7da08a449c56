package autostack.resources;

/**
 * Compute resources available to one fit.
 */
public class Parallelism {

	private final int cpus;
	private final int gpus;
	private final long gpuMemoryBytes;

	public Parallelism(final int cpus, final int gpus, final long gpuMemoryBytes) {
		super();
		if (cpus < 1) {
			throw new IllegalArgumentException("At least one CPU is required, got " + cpus);
		}
		if (gpus < 0 || gpuMemoryBytes < 0) {
			throw new IllegalArgumentException("GPU count and memory must not be negative.");
		}
		this.cpus = cpus;
		this.gpus = gpus;
		this.gpuMemoryBytes = gpus > 0 ? gpuMemoryBytes : 0;
	}

	public static Parallelism singleCore() {
		return new Parallelism(1, 0, 0);
	}

	public int getCpus() {
		return this.cpus;
	}

	public int getGpus() {
		return this.gpus;
	}

	/**
	 * @return memory of the smallest detected device
	 */
	public long getGpuMemoryBytes() {
		return this.gpuMemoryBytes;
	}

	public boolean hasGpu() {
		return this.gpus > 0;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + this.cpus;
		result = prime * result + this.gpus;
		result = prime * result + (int) (this.gpuMemoryBytes ^ (this.gpuMemoryBytes >>> 32));
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
		Parallelism other = (Parallelism) obj;
		return this.cpus == other.cpus && this.gpus == other.gpus && this.gpuMemoryBytes == other.gpuMemoryBytes;
	}

	@Override
	public String toString() {
		return "Parallelism [cpus=" + this.cpus + ", gpus=" + this.gpus + ", gpuMemoryBytes=" + this.gpuMemoryBytes + "]";
	}
}
