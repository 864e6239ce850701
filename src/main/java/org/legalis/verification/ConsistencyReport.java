package org.legalis.verification;

import lombok.Getter;

import java.util.List;

/**
 * 一组法规的一致性检查结果。
 */
@Getter
public final class ConsistencyReport {

    private final List<ConsistencyIssue> issues;

    ConsistencyReport(List<ConsistencyIssue> issues) {
        this.issues = List.copyOf(issues);
    }

    /**
     * 没有致命问题（冗余条件不算）。
     */
    public boolean isConsistent() {
        return issues.stream().noneMatch(issue -> issue.getKind().isFatal());
    }

    public List<ConsistencyIssue> issuesOf(ConsistencyIssue.Kind kind) {
        return issues.stream().filter(issue -> issue.getKind() == kind).toList();
    }

    @Override
    public String toString() {
        return "ConsistencyReport{consistent=" + isConsistent() + ", issues=" + issues + "}";
    }
}
