package com.minisframe.executor;

import com.minisframe.planner.PlannerNode;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 编译后的物理计划
 *
 * 节点每被一个输入槽引用一次就对应一个阶段（Stage），阶段按拓扑顺序排列，根阶段在最后。
 * 共享节点的多个阶段引用同一个模板实例，每个阶段只有一个下游。
 * 阶段持有的是模板实例，每次运行都 clone 一份，因此同一个编译结果可以多次执行。
 *
 * @author Mini-SFrame
 */
@Getter
public class CompiledPlan {

    private final PlannerNode root;

    private final List<Stage> stages;

    CompiledPlan(PlannerNode root, List<Stage> stages) {
        this.root = root;
        this.stages = Collections.unmodifiableList(stages);
    }

    public int getRootIndex() {
        return stages.size() - 1;
    }

    /**
     * 一个阶段：计划节点 + 模板实例 + 输入阶段下标
     */
    @Getter
    @AllArgsConstructor
    public static class Stage {

        private final int index;

        private final String name;

        private final PlannerNode node;

        private final QueryOperator template;

        /**
         * 按输入顺序排列的上游阶段下标
         */
        private final List<Integer> inputStages;
    }
}
