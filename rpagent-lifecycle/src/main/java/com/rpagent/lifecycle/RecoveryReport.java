package com.rpagent.lifecycle;

import com.rpagent.providerconfig.ProviderIdentity;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** What {@link RecoveryScanner#recover()} found and did. */
public final class RecoveryReport {

    private final int tempFilesPurged;
    private final int staleWorkDirsRemoved;
    private final List<ProviderIdentity> recovered;
    private final Map<ProviderIdentity, String> failed;
    private final List<Path> unreadable;

    RecoveryReport(int tempFilesPurged, int staleWorkDirsRemoved, List<ProviderIdentity> recovered,
                   Map<ProviderIdentity, String> failed, List<Path> unreadable) {
        this.tempFilesPurged = tempFilesPurged;
        this.staleWorkDirsRemoved = staleWorkDirsRemoved;
        this.recovered = List.copyOf(recovered);
        this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        this.unreadable = List.copyOf(unreadable);
    }

    public int getTempFilesPurged() {
        return tempFilesPurged;
    }

    public int getStaleWorkDirsRemoved() {
        return staleWorkDirsRemoved;
    }

    /** Providers running after recovery. */
    public List<ProviderIdentity> getRecovered() {
        return recovered;
    }

    /** Providers whose record is kept but whose plugin could not start, with the reason. */
    public Map<ProviderIdentity, String> getFailed() {
        return failed;
    }

    /** Record files that could not be parsed. */
    public List<Path> getUnreadable() {
        return unreadable;
    }

    @Override
    public String toString() {
        return "RecoveryReport{recovered=" + recovered.size() + ", failed=" + failed.keySet()
                + ", unreadable=" + unreadable.size() + ", tempFilesPurged=" + tempFilesPurged
                + ", staleWorkDirsRemoved=" + staleWorkDirsRemoved + "}";
    }
}
