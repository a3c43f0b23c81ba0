package com.example.snapshotcompare.infrastructure;

import com.example.snapshotcompare.application.SnapshotCollector;
import com.example.snapshotcompare.domain.SnapshotComponent;
import com.example.snapshotcompare.domain.SnapshotNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class RuntimeSnapshotCollector implements SnapshotCollector {
    private static final Logger log = LogManager.getLogger(RuntimeSnapshotCollector.class);
    private static final long MB = 1024L * 1024L;

    @Override
    public SnapshotNode.Tree collect(Set<SnapshotComponent> components) {
        Set<SnapshotComponent> wanted =
                components == null || components.isEmpty()
                        ? EnumSet.allOf(SnapshotComponent.class)
                        : EnumSet.copyOf(components);
        Map<String, SnapshotNode> snapshot = new LinkedHashMap<>();
        for (SnapshotComponent component : wanted) {
            snapshot.put(component.label(), collect(component));
        }
        log.debug("Collected live snapshot with components {}", snapshot.keySet());
        return new SnapshotNode.Tree(snapshot);
    }

    private SnapshotNode collect(SnapshotComponent component) {
        return switch (component) {
            case OS -> operatingSystem();
            case CPU -> cpu();
            case MEMORY -> memory();
            case DISK -> disks();
        };
    }

    private SnapshotNode operatingSystem() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        Map<String, SnapshotNode> info = new LinkedHashMap<>();
        info.put("system", SnapshotNode.text(os.getName()));
        info.put("version", SnapshotNode.text(os.getVersion()));
        info.put("arch", SnapshotNode.text(os.getArch()));
        return new SnapshotNode.Tree(info);
    }

    private SnapshotNode cpu() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        Map<String, SnapshotNode> info = new LinkedHashMap<>();
        info.put("logicalCores", SnapshotNode.number(os.getAvailableProcessors()));
        double load = os.getSystemLoadAverage();
        // negative when the platform does not report a load average
        info.put(
                "loadAverage",
                load < 0
                        ? SnapshotNode.nullValue()
                        : SnapshotNode.number(BigDecimal.valueOf(load).setScale(2, RoundingMode.HALF_UP)));
        return new SnapshotNode.Tree(info);
    }

    private SnapshotNode memory() {
        Runtime runtime = Runtime.getRuntime();
        Map<String, SnapshotNode> info = new LinkedHashMap<>();
        info.put("max", SnapshotNode.number(runtime.maxMemory() / MB));
        info.put("total", SnapshotNode.number(runtime.totalMemory() / MB));
        info.put("free", SnapshotNode.number(runtime.freeMemory() / MB));
        return new SnapshotNode.Tree(info);
    }

    private SnapshotNode disks() {
        List<SnapshotNode> disks = new ArrayList<>();
        File[] roots = File.listRoots();
        if (roots != null) {
            for (File root : roots) {
                Map<String, SnapshotNode> disk = new LinkedHashMap<>();
                disk.put("device", SnapshotNode.text(root.getPath()));
                disk.put("total", SnapshotNode.number(root.getTotalSpace() / MB));
                disk.put("free", SnapshotNode.number(root.getFreeSpace() / MB));
                disk.put("usable", SnapshotNode.number(root.getUsableSpace() / MB));
                disks.add(new SnapshotNode.Tree(disk));
            }
        }
        return new SnapshotNode.Sequence(disks);
    }
}
