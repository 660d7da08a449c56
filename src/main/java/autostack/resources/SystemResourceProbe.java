package autostack.resources;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

import org.api4.java.algorithm.Timeout;
import org.api4.java.common.control.ILoggingCustomizable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects CPUs from the JVM and the cgroup CPU quota (v2 and v1), and GPUs through nvidia-smi.
 */
public class SystemResourceProbe implements ResourceProbe, ILoggingCustomizable {

	public static final Path DEFAULT_CGROUP_ROOT = Paths.get("/sys/fs/cgroup");
	public static final Timeout TIMEOUT_GPU_QUERY = new Timeout(5, TimeUnit.SECONDS);

	private Logger logger = LoggerFactory.getLogger(SystemResourceProbe.class);

	private final Path cgroupRoot;
	private final int jvmProcessors;

	public SystemResourceProbe() {
		this(DEFAULT_CGROUP_ROOT, Runtime.getRuntime().availableProcessors());
	}

	public SystemResourceProbe(final Path cgroupRoot, final int jvmProcessors) {
		super();
		this.cgroupRoot = cgroupRoot;
		this.jvmProcessors = jvmProcessors;
	}

	@Override
	public Parallelism probe() {
		int cpus = this.detectCpus();
		List<Long> gpuMemory = this.detectGpuMemory();
		long smallestDevice = gpuMemory.stream().mapToLong(Long::longValue).min().orElse(0);
		Parallelism parallelism = new Parallelism(cpus, gpuMemory.size(), smallestDevice);
		this.logger.info("Detected {}", parallelism);
		return parallelism;
	}

	public int detectCpus() {
		try {
			OptionalInt quota = this.readCgroupCpuLimit();
			int cpus = quota.isPresent() ? Math.min(quota.getAsInt(), this.jvmProcessors) : this.jvmProcessors;
			if (cpus < 1) {
				this.logger.warn("Detected {} CPUs, which is implausible. Assuming a single core.", cpus);
				return 1;
			}
			this.logger.debug("JVM reports {} processors, cgroup quota allows {}. Using {}.", this.jvmProcessors, quota, cpus);
			return cpus;
		} catch (IOException | RuntimeException e) {
			this.logger.warn("CPU detection was inconclusive, assuming a single core. Reason: {}", e.getMessage());
			return 1;
		}
	}

	/**
	 * @return the CPU limit imposed by the cgroup of this process, or empty if there is none
	 */
	public OptionalInt readCgroupCpuLimit() throws IOException {
		Path cpuMax = this.cgroupRoot.resolve("cpu.max");
		if (Files.isReadable(cpuMax)) {
			String[] parts = Files.readString(cpuMax, StandardCharsets.UTF_8).trim().split("\\s+");
			if (parts.length != 2) {
				throw new IOException("Unexpected content of " + cpuMax + ": " + String.join(" ", parts));
			}
			if ("max".equals(parts[0])) {
				return OptionalInt.empty();
			}
			return OptionalInt.of(quotaToCpus(Long.parseLong(parts[0]), Long.parseLong(parts[1])));
		}
		for (String controller : new String[] { "cpu", "cpu,cpuacct" }) {
			Path quotaFile = this.cgroupRoot.resolve(controller).resolve("cpu.cfs_quota_us");
			Path periodFile = this.cgroupRoot.resolve(controller).resolve("cpu.cfs_period_us");
			if (Files.isReadable(quotaFile) && Files.isReadable(periodFile)) {
				long quota = Long.parseLong(Files.readString(quotaFile, StandardCharsets.UTF_8).trim());
				if (quota <= 0) {
					return OptionalInt.empty();
				}
				return OptionalInt.of(quotaToCpus(quota, Long.parseLong(Files.readString(periodFile, StandardCharsets.UTF_8).trim())));
			}
		}
		return OptionalInt.empty();
	}

	private static int quotaToCpus(final long quota, final long period) throws IOException {
		if (quota <= 0 || period <= 0) {
			throw new IOException("Invalid cgroup CPU quota " + quota + "/" + period);
		}
		return (int) Math.max(1, Math.ceil(quota / (double) period));
	}

	/**
	 * @return the memory of each detected GPU in bytes; empty if no GPU could be detected
	 */
	public List<Long> detectGpuMemory() {
		List<Long> memory = new ArrayList<>();
		try {
			for (String line : this.queryGpuMemoryMiB()) {
				if (!line.isBlank()) {
					memory.add(Long.parseLong(line.trim()) * 1024L * 1024L);
				}
			}
		} catch (IOException e) {
			this.logger.debug("No GPU detected: {}", e.getMessage());
			return new ArrayList<>();
		} catch (NumberFormatException e) {
			this.logger.warn("Could not interpret GPU query output, assuming no GPU. Reason: {}", e.getMessage());
			return new ArrayList<>();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return new ArrayList<>();
		}
		return memory;
	}

	/**
	 * Runs nvidia-smi and returns one line per device with its total memory in MiB.
	 */
	protected List<String> queryGpuMemoryMiB() throws IOException, InterruptedException {
		Process process = new ProcessBuilder("nvidia-smi", "--query-gpu=memory.total", "--format=csv,noheader,nounits").redirectErrorStream(true).start();
		if (!process.waitFor(TIMEOUT_GPU_QUERY.milliseconds(), TimeUnit.MILLISECONDS)) {
			process.destroyForcibly();
			throw new IOException("nvidia-smi did not answer within " + TIMEOUT_GPU_QUERY);
		}
		List<String> lines = new ArrayList<>();
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				lines.add(line);
			}
		}
		if (process.exitValue() != 0) {
			throw new IOException("nvidia-smi exited with code " + process.exitValue() + ": " + lines);
		}
		return lines;
	}

	@Override
	public String getLoggerName() {
		return this.logger.getName();
	}

	@Override
	public void setLoggerName(final String name) {
		this.logger = LoggerFactory.getLogger(name);
	}
}
