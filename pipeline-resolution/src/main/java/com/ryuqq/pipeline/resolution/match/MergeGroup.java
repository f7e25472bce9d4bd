package com.ryuqq.pipeline.resolution.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 같은 실세계 회사로 판정된 레코드 인덱스 묶음.
 *
 * @param members 레코드 인덱스 (오름차순, 1개 이상)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record MergeGroup(List<Integer> members) {

    public MergeGroup {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("members cannot be null or empty");
        }
        List<Integer> sorted = new ArrayList<>(members);
        Collections.sort(sorted);
        members = List.copyOf(sorted);
    }

    /**
     * 가장 먼저 입력된 구성원 인덱스.
     */
    public int earliest() {
        return members.get(0);
    }

    /**
     * 2개 이상 구성원이 병합되는 그룹인지.
     */
    public boolean merges() {
        return members.size() > 1;
    }

    public int size() {
        return members.size();
    }
}
