package com.minisframe.optimizer.explain;

import com.minisframe.common.InvalidPlanException;
import com.minisframe.common.QueryEvalException;
import com.minisframe.executor.OperatorRegistry;
import com.minisframe.executor.operator.SequenceOperatorContract;
import com.minisframe.planner.PlannerNode;
import org.junit.jupiter.api.*;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EXPLAIN 生成器测试
 *
 * @author Mini-SFrame
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ExplainGeneratorTest {

    private ExplainGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new ExplainGenerator();
    }

    /**
     * 测试单个序列节点
     */
    @Test
    @Order(1)
    void testExplainSequence() throws QueryEvalException {
        ExplainPlan plan = generator.explain(SequenceOperatorContract.makePlannerNode(0, 10));

        assertEquals(1, plan.getRows().size());
        ExplainPlan.Row row = plan.getRows().get(0);
        assertEquals("N0", row.getTag());
        assertEquals("sequence", row.getOperator());
        assertEquals("Sequence(0)[0:10]", row.getRepr());
        assertEquals(Collections.singletonList("INTEGER"), row.getColumnTypes());
        assertEquals(Long.valueOf(10), row.getLength());
        assertTrue(row.getInputs().isEmpty());

        String text = plan.format();
        System.out.println("\n=== EXPLAIN Sequence(0, 10) ===");
        System.out.println(text);
        assertTrue(text.contains("Sequence(0)[0:10]"));
        assertTrue(text.contains(ExplainPlan.tableHeader()));
    }

    /**
     * 测试切片后的节点
     */
    @Test
    @Order(2)
    void testExplainSlice() throws QueryEvalException {
        PlannerNode node = OperatorRegistry.getDefault()
                .slice(SequenceOperatorContract.makePlannerNode(-5, 95), 10, 30);
        ExplainPlan.Row row = generator.explain(node).getRows().get(0);

        assertEquals("Sequence(-5)[10:30]", row.getRepr());
        assertEquals(Long.valueOf(20), row.getLength());
    }

    /**
     * 测试非法节点
     */
    @Test
    @Order(3)
    void testExplainInvalidNode() throws QueryEvalException {
        PlannerNode leaf = SequenceOperatorContract.makePlannerNode(0, 1);
        PlannerNode bad = PlannerNode.makeShared(leaf.getOperatorType(), Collections.emptyMap());

        assertThrows(InvalidPlanException.class, () -> generator.explain(bad));
    }
}
