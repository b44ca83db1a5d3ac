package taskwarden.coordinator.monitor;

/**
 * Source of raw host measurements.
 */
public interface SystemProbe {

    ResourceSnapshot sample();

    /** Logical CPU count */
    int cpuCount();
}
