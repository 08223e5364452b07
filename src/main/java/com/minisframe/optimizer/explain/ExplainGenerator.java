package com.minisframe.optimizer.explain;

import com.minisframe.common.QueryEvalException;
import com.minisframe.executor.OperatorRegistry;
import com.minisframe.flexible.FlexTypeEnum;
import com.minisframe.planner.PlannerNode;
import com.minisframe.planner.PlannerNodeTagger;
import lombok.extern.slf4j.Slf4j;

import java.util.OptionalLong;

/**
 * EXPLAIN 生成器
 *
 * 只调用契约的静态分析函数（repr / inferType / inferLength），
 * 不构造也不执行任何算子实例。
 *
 * @author Mini-SFrame
 */
@Slf4j
public class ExplainGenerator {

    private final OperatorRegistry registry;

    public ExplainGenerator() {
        this(OperatorRegistry.getDefault());
    }

    public ExplainGenerator(OperatorRegistry registry) {
        this.registry = registry;
    }

    /**
     * 为计划图生成 EXPLAIN，根节点在第一行
     *
     * @throws QueryEvalException 任意节点的静态分析失败
     */
    public ExplainPlan explain(PlannerNode root) throws QueryEvalException {
        ExplainPlan plan = new ExplainPlan();
        visit(root, new PlannerNodeTagger(), plan);
        log.debug("Generated EXPLAIN with {} rows", plan.getRows().size());
        return plan;
    }

    private void visit(PlannerNode node, PlannerNodeTagger tagger, ExplainPlan plan) throws QueryEvalException {
        ExplainPlan.Row row = new ExplainPlan.Row();
        row.setTag(tagger.tag(node));
        row.setOperator(registry.getContract(node.getOperatorType()).getName());
        row.setRepr(registry.repr(node));
        for (FlexTypeEnum type : registry.inferType(node)) {
            row.getColumnTypes().add(type.name());
        }
        OptionalLong length = registry.inferLength(node);
        row.setLength(length.isPresent() ? length.getAsLong() : null);
        plan.addRow(row);

        for (PlannerNode input : node.getInputs()) {
            boolean seen = tagger.isTagged(input);
            row.getInputs().add(tagger.tag(input));
            if (!seen) {
                visit(input, tagger, plan);
            }
        }
    }
}
