package com.goormthonuniv.citecheck.cluster;

import com.goormthonuniv.citecheck.extract.Citation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 병렬 인용 클러스터링.
 *
 * <ol>
 *   <li>{@link ClusterGates}를 모두 통과한 쌍만 간선으로 잇는다</li>
 *   <li>연결 요소(union-find)를 구한다</li>
 *   <li>요소 안의 모든 쌍이 게이트를 통과하지 않으면 문서 순으로 탐욕 분할한다 (A-B, B-C만 이어진 경우 A와 C를 묶지 않는다)</li>
 * </ol>
 * 같은 입력이면 항상 같은 분할과 같은 id가 나온다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterBuilder {

    private final ClusterGates gates;
    private final CanonicalDataSelector canonical;

    public ClusterResult build(List<Citation> citations) {
        if (citations == null || citations.isEmpty()) return ClusterResult.empty();

        List<Citation> ordered = new ArrayList<>(citations);
        ordered.sort(Comparator.comparingInt(Citation::getStart));
        int n = ordered.size();

        // ===== 1) 간선 + 2) 연결 요소 =====
        boolean[][] edge = new boolean[n][n];
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;

        int edges = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (gates.linked(ordered.get(i), ordered.get(j))) {
                    edge[i][j] = edge[j][i] = true;
                    union(parent, i, j);
                    edges++;
                }
            }
        }

        Map<Integer, List<Integer>> components = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            components.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(i);
        }

        // ===== 3) 쌍별 검증을 만족하는 그룹으로 분할 =====
        List<List<Integer>> groups = new ArrayList<>();
        for (List<Integer> comp : components.values()) {
            List<List<Integer>> local = new ArrayList<>();
            for (int i : comp) {
                List<Integer> home = null;
                for (List<Integer> g : local) {
                    boolean allLinked = true;
                    for (int m : g) {
                        if (!edge[i][m]) {
                            allLinked = false;
                            break;
                        }
                    }
                    if (allLinked) {
                        home = g;
                        break;
                    }
                }
                if (home == null) {
                    home = new ArrayList<>();
                    local.add(home);
                }
                home.add(i);
            }
            if (local.size() > 1) {
                log.debug("component of {} citations split into {} pairwise-valid groups", comp.size(), local.size());
            }
            groups.addAll(local);
        }
        groups.sort(Comparator.comparingInt(g -> g.get(0)));

        // ===== 대표값 + id =====
        List<CitationCluster> clusters = new ArrayList<>(groups.size());
        ClusterIndex index = new ClusterIndex();
        int seq = 1;
        for (List<Integer> g : groups) {
            String id = "cluster_" + seq++;
            List<Citation> members = g.stream().map(ordered::get).toList();
            CanonicalDataSelector.Canonical c = canonical.select(members);
            List<Integer> memberIndices = members.stream().map(Citation::getIndex).toList();
            clusters.add(new CitationCluster(id, memberIndices, c.name(), c.date(), c.verified()));
            for (int idx : memberIndices) {
                index.put(idx, id);
            }
        }
        log.debug("clustered {} citations into {} clusters ({} edges)", n, clusters.size(), edges);
        return new ClusterResult(List.copyOf(clusters), index);
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra == rb) return;
        // 작은 인덱스를 루트로 (결정적)
        if (ra < rb) parent[rb] = ra;
        else parent[ra] = rb;
    }
}
