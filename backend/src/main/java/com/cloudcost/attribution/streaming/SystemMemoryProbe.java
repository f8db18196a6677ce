package com.cloudcost.attribution.streaming;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Reads available memory from the host.
 *
 * On Linux {@code MemAvailable} from {@code /proc/meminfo} is used since it counts
 * reclaimable page cache. Elsewhere the JVM's operating system bean reports free
 * physical memory.
 */
@Component
@Slf4j
public class SystemMemoryProbe implements MemoryProbe {

    private static final Path MEMINFO = Path.of("/proc/meminfo");
    private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    @Override
    public OptionalDouble availableMemoryGb() {
        OptionalDouble fromMeminfo = readMeminfo();
        if (fromMeminfo.isPresent()) {
            return fromMeminfo;
        }
        var osBean = ManagementFactory.getOperatingSystemMXBean();
        if (osBean instanceof com.sun.management.OperatingSystemMXBean) {
            long free = ((com.sun.management.OperatingSystemMXBean) osBean).getFreeMemorySize();
            if (free > 0) {
                return OptionalDouble.of(free / BYTES_PER_GB);
            }
        }
        log.debug("Available memory could not be determined");
        return OptionalDouble.empty();
    }

    private OptionalDouble readMeminfo() {
        if (!Files.isReadable(MEMINFO)) {
            return OptionalDouble.empty();
        }
        try {
            List<String> lines = Files.readAllLines(MEMINFO);
            for (String line : lines) {
                if (line.startsWith("MemAvailable:")) {
                    String[] parts = line.trim().split("\\s+");
                    long kilobytes = Long.parseLong(parts[1]);
                    return OptionalDouble.of(kilobytes * 1024.0 / BYTES_PER_GB);
                }
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to read {}: {}", MEMINFO, e.getMessage());
        }
        return OptionalDouble.empty();
    }
}
