package com.minisframe.executor;

import com.minisframe.common.InvalidPlanException;
import com.minisframe.common.QueryEvalException;
import com.minisframe.executor.operator.SequenceOperator;
import com.minisframe.executor.operator.SequenceOperatorContract;
import com.minisframe.flexible.FlexTypeEnum;
import com.minisframe.planner.PlannerNode;
import com.minisframe.planner.PlannerNodeType;
import org.junit.jupiter.api.*;

import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 契约注册表测试
 *
 * @author Mini-SFrame
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class OperatorRegistryTest {

    private final OperatorRegistry registry = OperatorRegistry.getDefault();

    /**
     * 测试每个节点类型都注册了契约
     */
    @Test
    @Order(1)
    void testAllTypesRegistered() throws InvalidPlanException {
        for (PlannerNodeType type : PlannerNodeType.values()) {
            assertEquals(type, registry.getContract(type).getType());
        }
        assertEquals(PlannerNodeType.values().length, registry.getContracts().size());
        assertSame(registry, OperatorRegistry.getDefault());
    }

    /**
     * 测试按类型分派
     */
    @Test
    @Order(2)
    void testDispatch() throws QueryEvalException {
        PlannerNode node = SequenceOperatorContract.makePlannerNode(1, 9);

        assertTrue(registry.fromPlannerNode(node) instanceof SequenceOperator);
        assertEquals(Collections.singletonList(FlexTypeEnum.INTEGER), registry.inferType(node));
        assertEquals(8L, registry.inferLength(node).getAsLong());
        assertEquals("Sequence(1)[0:8]", registry.repr(node));
        assertEquals("Sequence(1)[2:4]", registry.repr(registry.slice(node, 2, 4)));
    }

    /**
     * 测试输入数量与契约不符
     */
    @Test
    @Order(3)
    void testArityChecked() throws QueryEvalException {
        PlannerNode leaf = SequenceOperatorContract.makePlannerNode(0, 3);
        PlannerNode bad = PlannerNode.makeShared(PlannerNodeType.SEQUENCE_NODE,
                leaf.getOperatorParameters(), Collections.singletonList(leaf));

        InvalidPlanException e = assertThrows(InvalidPlanException.class, () -> registry.inferType(bad));
        assertEquals(PlannerNodeType.SEQUENCE_NODE, e.getOperatorType());
        assertThrows(InvalidPlanException.class, () -> registry.fromPlannerNode(bad));
    }

    /**
     * 测试默认 slice 实现不支持切片
     */
    @Test
    @Order(4)
    void testDefaultSliceUnsupported() throws QueryEvalException {
        OperatorContract unsliceable = new OperatorContract() {
            @Override
            public PlannerNodeType getType() {
                return PlannerNodeType.SEQUENCE_NODE;
            }

            @Override
            public String getName() {
                return "unsliceable";
            }

            @Override
            public OperatorAttributes getAttributes() {
                return OperatorAttributes.source();
            }

            @Override
            public QueryOperator fromPlannerNode(PlannerNode node) {
                throw new UnsupportedOperationException();
            }

            @Override
            public List<FlexTypeEnum> inferType(PlannerNode node) {
                return Collections.emptyList();
            }

            @Override
            public OptionalLong inferLength(PlannerNode node) {
                return OptionalLong.empty();
            }

            @Override
            public String repr(PlannerNode node) {
                return "unsliceable";
            }
        };

        PlannerNode node = SequenceOperatorContract.makePlannerNode(0, 3);
        assertThrows(InvalidPlanException.class, () -> unsliceable.slice(node, 0, 1));
    }

    /**
     * 测试属性位
     */
    @Test
    @Order(5)
    void testAttributes() {
        OperatorAttributes source = OperatorAttributes.source();
        assertTrue(source.isSource());
        assertFalse(source.isLinear());

        OperatorAttributes unary = new OperatorAttributes(OperatorAttributes.LINEAR, 1);
        assertFalse(unary.isSource());
        assertTrue(unary.isLinear());

        assertThrows(IllegalArgumentException.class, () -> new OperatorAttributes(OperatorAttributes.SOURCE, 1));
        assertThrows(IllegalArgumentException.class, () -> new OperatorAttributes(OperatorAttributes.NONE, 0));

        OperatorAttributes variable = new OperatorAttributes(OperatorAttributes.NONE, OperatorAttributes.VARIABLE_INPUTS);
        assertTrue(variable.hasVariableInputs());
        assertFalse(variable.isSource());
        assertFalse(unary.hasVariableInputs());
        assertThrows(IllegalArgumentException.class, () -> new OperatorAttributes(OperatorAttributes.NONE, -2));
    }
}
