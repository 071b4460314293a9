package com.raditha.flowcheck.fix;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying a batch of fixes to one file.
 */
public class FixSession {
    private final List<FixApplied> applied = new ArrayList<>();
    private final List<FixSkipped> skipped = new ArrayList<>();
    private final List<FixRejected> rejected = new ArrayList<>();
    private String diff = "";
    private boolean written;

    public void addApplied(Issue issue, String details) {
        applied.add(new FixApplied(issue, details));
    }

    public void addSkipped(Issue issue, String reason) {
        skipped.add(new FixSkipped(issue, reason));
    }

    public void addRejected(Issue issue, String reason) {
        rejected.add(new FixRejected(issue, reason));
    }

    public List<FixApplied> getApplied() {
        return applied;
    }

    public List<FixSkipped> getSkipped() {
        return skipped;
    }

    public List<FixRejected> getRejected() {
        return rejected;
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    public int getTotalProcessed() {
        return applied.size() + skipped.size() + rejected.size();
    }

    /**
     * Unified diff of all verified fixes, empty when nothing passed verification.
     */
    public String getDiff() {
        return diff;
    }

    void setDiff(String diff) {
        this.diff = diff;
    }

    /**
     * True when the file on disk was rewritten.
     */
    public boolean isWritten() {
        return written;
    }

    void setWritten(boolean written) {
        this.written = written;
    }

    public record FixApplied(Issue issue, String details) {
    }

    public record FixSkipped(Issue issue, String reason) {
    }

    public record FixRejected(Issue issue, String reason) {
    }
}
