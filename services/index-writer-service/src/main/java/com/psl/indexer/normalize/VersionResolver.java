package com.psl.indexer.normalize;

import com.psl.indexer.metadata.MetadataRecord;
import com.psl.indexer.metadata.PaperVersions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decides which sibling version is current. The highest non-withdrawn version wins; when every version is
 * withdrawn the highest version is current and stays withdrawn.
 */
public class VersionResolver {

    public Resolution resolve(PaperVersions versions) {
        TreeMap<Integer, MetadataRecord> byVersion = new TreeMap<>();
        for (MetadataRecord record : versions.getRecords()) {
            Integer version = record.version();
            if (version != null) {
                byVersion.put(version, record);
            }
        }
        if (byVersion.isEmpty()) {
            throw TransformException.missing("version");
        }

        Integer current = null;
        for (Map.Entry<Integer, MetadataRecord> entry : byVersion.descendingMap().entrySet()) {
            if (!entry.getValue().flag("is_withdrawn")) {
                current = entry.getKey();
                break;
            }
        }
        boolean allWithdrawn = current == null;
        if (allWithdrawn) {
            current = byVersion.lastKey();
        }

        Map<Integer, List<String>> anomalies = new TreeMap<>();
        int highest = byVersion.lastKey();
        if (!allWithdrawn && highest > current) {
            anomalies.computeIfAbsent(highest, key -> new ArrayList<>())
                .add("withdrawn_version_above_current version=" + highest + " current=" + current);
        }
        for (Map.Entry<Integer, MetadataRecord> entry : byVersion.entrySet()) {
            Boolean declared = entry.getValue().optionalFlag("is_current");
            boolean computed = entry.getKey().equals(current);
            if (declared != null && declared != computed) {
                anomalies.computeIfAbsent(entry.getKey(), key -> new ArrayList<>())
                    .add("is_current_overridden version=" + entry.getKey() + " declared=" + declared);
            }
        }
        return new Resolution(current, allWithdrawn, anomalies);
    }

    public record Resolution(int currentVersion, boolean allWithdrawn, Map<Integer, List<String>> anomalies) {
        public Resolution {
            anomalies = Map.copyOf(anomalies);
        }

        public boolean isCurrent(int version) {
            return version == currentVersion;
        }

        public List<String> anomaliesFor(int version) {
            return anomalies.getOrDefault(version, List.of());
        }
    }
}
