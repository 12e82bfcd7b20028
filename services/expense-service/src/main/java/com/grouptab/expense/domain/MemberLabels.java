package com.grouptab.expense.domain;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display labels for the members of one group, falling back to {@link Member#fallbackLabel}
 * for ids the directory did not return
 */
public final class MemberLabels {

    private static final MemberLabels EMPTY = new MemberLabels(Map.of());

    private final Map<String, String> labels;

    private MemberLabels(Map<String, String> labels) {
        this.labels = labels;
    }

    public static MemberLabels of(Collection<Member> members) {
        Map<String, String> labels = new LinkedHashMap<>();
        members.forEach(member -> labels.put(member.id(), member.label()));
        return new MemberLabels(Map.copyOf(labels));
    }

    public static MemberLabels empty() {
        return EMPTY;
    }

    public boolean contains(String memberId) {
        return labels.containsKey(memberId);
    }

    public String labelFor(String memberId) {
        String label = labels.get(memberId);
        return label != null ? label : Member.fallbackLabel(memberId);
    }
}
