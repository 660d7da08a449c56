package autostack.resources;

public interface ResourceProbe {

	/**
	 * Detects the resources the current process may use. Implementations must report constrained (e.g. cgroup-limited) CPU counts rather than the
	 * physical core count of the host.
	 */
	public Parallelism probe();

	/**
	 * @return the heap the JVM may grow to, or 0 if unknown, which disables memory checks
	 */
	default long getMaxHeapBytes() {
		return Runtime.getRuntime().maxMemory();
	}

	/**
	 * @return the heap currently in use
	 */
	default long getUsedHeapBytes() {
		Runtime runtime = Runtime.getRuntime();
		return runtime.totalMemory() - runtime.freeMemory();
	}
}
