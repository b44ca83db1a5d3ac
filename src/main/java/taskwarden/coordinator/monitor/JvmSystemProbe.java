package taskwarden.coordinator.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reads host measurements through the platform MXBean, the file system and the process table.
 * None of the calls block on an interval, so a sample costs a few syscalls.
 *
 * <p>Memory usage is measured against available memory (free plus reclaimable page cache).
 * On Linux that figure comes from {@code MemAvailable} in {@code /proc/meminfo}; elsewhere the
 * MXBean's free memory is the closest reading.
 */
public final class JvmSystemProbe implements SystemProbe {

    private static final Logger log = LoggerFactory.getLogger(JvmSystemProbe.class);

    static final Path PROC_MEMINFO = Path.of("/proc/meminfo");

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final File diskRoot;
    private final Path meminfo;

    public JvmSystemProbe(String diskPath) {
        this(diskPath, PROC_MEMINFO);
    }

    JvmSystemProbe(String diskPath, Path meminfo) {
        this.diskRoot = new File(diskPath);
        this.meminfo = meminfo;
        if (!(os instanceof com.sun.management.OperatingSystemMXBean)) {
            log.warn("Extended OS metrics unavailable on this JVM; CPU is estimated from load average "
                    + "and memory is read from {} only", meminfo);
        }
    }

    @Override
    public ResourceSnapshot sample() {
        double cpu;
        MemoryReading memory = readMeminfo().orElse(null);

        if (os instanceof com.sun.management.OperatingSystemMXBean ext) {
            double load = ext.getCpuLoad();
            cpu = load < 0 ? loadBasedCpu() : load * 100.0;
            if (memory == null) {
                memory = new MemoryReading(ext.getTotalMemorySize(), ext.getFreeMemorySize());
            }
        } else {
            cpu = loadBasedCpu();
        }
        if (memory == null) {
            memory = new MemoryReading(0L, 0L);
        }

        long diskTotal = diskRoot.getTotalSpace();
        long diskFree = diskRoot.getUsableSpace();
        double diskPercent = diskTotal > 0 ? (diskTotal - diskFree) * 100.0 / diskTotal : 0.0;

        return new ResourceSnapshot(
                Instant.now(),
                clampPercent(cpu),
                clampPercent(memory.usedPercent()),
                memory.available(),
                clampPercent(diskPercent),
                diskFree,
                Math.max(0.0, os.getSystemLoadAverage()),
                ProcessHandle.allProcesses().count());
    }

    @Override
    public int cpuCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    private Optional<MemoryReading> readMeminfo() {
        if (!Files.isReadable(meminfo)) {
            return Optional.empty();
        }
        try {
            return parseMeminfo(Files.readAllLines(meminfo));
        } catch (IOException | UncheckedIOException e) {
            log.debug("Could not read {}, using MXBean memory figures: {}", meminfo, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Extracts {@code MemTotal} and {@code MemAvailable} (in kB) from meminfo lines.
     * Kernels older than 3.14 have no {@code MemAvailable}; those yield empty.
     */
    static Optional<MemoryReading> parseMeminfo(List<String> lines) {
        long totalKb = -1;
        long availableKb = -1;
        for (String line : lines) {
            if (line.startsWith("MemTotal:")) {
                totalKb = kilobytes(line);
            } else if (line.startsWith("MemAvailable:")) {
                availableKb = kilobytes(line);
            }
        }
        if (totalKb <= 0 || availableKb < 0) {
            return Optional.empty();
        }
        return Optional.of(new MemoryReading(totalKb * 1024, Math.min(availableKb, totalKb) * 1024));
    }

    private static long kilobytes(String line) {
        String[] parts = line.substring(line.indexOf(':') + 1).trim().split("\\s+");
        try {
            return Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** Physical memory figures in bytes. */
    record MemoryReading(long total, long available) {

        double usedPercent() {
            return total > 0 ? (total - available) * 100.0 / total : 0.0;
        }
    }

    private double loadBasedCpu() {
        double load = os.getSystemLoadAverage();
        if (load < 0) {
            return 0.0;
        }
        return load * 100.0 / cpuCount();
    }

    private static double clampPercent(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }
}
