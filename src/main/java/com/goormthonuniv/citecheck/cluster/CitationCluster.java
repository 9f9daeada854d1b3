package com.goormthonuniv.citecheck.cluster;

import java.util.List;

/**
 * 같은 판결을 가리킨다고 본 인용 묶음. 멤버는 작업 내 인용 인덱스로만 가진다.
 *
 * @param verified canonical 값이 검증된 멤버에서 왔는지
 */
public record CitationCluster(
        String id,
        List<Integer> memberIndices,
        String canonicalName,
        String canonicalDate,
        boolean verified
) {
    public CitationCluster {
        memberIndices = List.copyOf(memberIndices);
    }

    public int size() {
        return memberIndices.size();
    }
}
