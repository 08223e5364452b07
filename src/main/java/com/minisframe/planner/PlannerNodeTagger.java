package com.minisframe.planner;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 为计划图中的节点分配稳定的短标签（N0, N1, ...）
 *
 * 共享子图只会被分配一次标签，用于 EXPLAIN 输出中引用输入
 *
 * @author Mini-SFrame
 */
public class PlannerNodeTagger {

    private final Map<PlannerNode, String> tags = new IdentityHashMap<>();

    public String tag(PlannerNode node) {
        return tags.computeIfAbsent(node, n -> "N" + tags.size());
    }

    public boolean isTagged(PlannerNode node) {
        return tags.containsKey(node);
    }

    public int size() {
        return tags.size();
    }
}
