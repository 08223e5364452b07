package com.minisframe.executor.operator;

import com.minisframe.common.InvalidPlanException;
import com.minisframe.common.QueryEvalException;
import com.minisframe.common.TypeMismatchException;
import com.minisframe.executor.OperatorAttributes;
import com.minisframe.executor.OperatorContract;
import com.minisframe.flexible.FlexTypeEnum;
import com.minisframe.flexible.FlexibleValue;
import com.minisframe.planner.PlannerNode;
import com.minisframe.planner.PlannerNodeType;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * 序列算子契约
 *
 * 计划节点参数:
 * - start: 序列起点
 * - begin_index / end_index: 在 [start, end) 原始序列上的切片，初始为 0 / end - start
 *
 * 为什么不直接存 end？
 * 优化器做 LIMIT 下推或行切片时，只需要改写 begin_index / end_index，
 * 不必从头推导 start / end。实例的实际区间是 [start + begin_index, start + end_index)。
 *
 * @author Mini-SFrame
 */
public final class SequenceOperatorContract implements OperatorContract {

    public static final String START = "start";

    public static final String BEGIN_INDEX = "begin_index";

    public static final String END_INDEX = "end_index";

    public static final SequenceOperatorContract INSTANCE = new SequenceOperatorContract();

    private static final Set<String> PARAMETERS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList(START, BEGIN_INDEX, END_INDEX)));

    private static final PlannerNodeType TYPE = PlannerNodeType.SEQUENCE_NODE;

    private SequenceOperatorContract() {
    }

    @Override
    public PlannerNodeType getType() {
        return TYPE;
    }

    @Override
    public String getName() {
        return "sequence";
    }

    @Override
    public OperatorAttributes getAttributes() {
        return OperatorAttributes.source();
    }

    /**
     * 构造 [start, end) 的序列计划节点
     *
     * @throws InvalidPlanException start > end，或区间长度超出 long 范围
     */
    public static PlannerNode makePlannerNode(long start, long end) throws InvalidPlanException {
        if (start > end) {
            throw new InvalidPlanException("Sequence start " + start + " is greater than end " + end,
                    TYPE, START);
        }
        long length;
        try {
            length = Math.subtractExact(end, start);
        } catch (ArithmeticException e) {
            throw new InvalidPlanException("Sequence range [" + start + ", " + end + ") is too long",
                    TYPE, END_INDEX, e);
        }

        Map<String, FlexibleValue> params = new LinkedHashMap<>();
        params.put(START, FlexibleValue.of(start));
        params.put(BEGIN_INDEX, FlexibleValue.of(0L));
        params.put(END_INDEX, FlexibleValue.of(length));
        return PlannerNode.makeShared(TYPE, params);
    }

    @Override
    public SequenceOperator fromPlannerNode(PlannerNode node) throws QueryEvalException {
        SliceParameters p = readParameters(node);
        try {
            return new SequenceOperator(Math.addExact(p.start, p.beginIndex),
                    Math.addExact(p.start, p.endIndex));
        } catch (ArithmeticException e) {
            throw new InvalidPlanException("Sequence range overflows: " + describe(p), TYPE, END_INDEX, e);
        }
    }

    @Override
    public List<FlexTypeEnum> inferType(PlannerNode node) throws QueryEvalException {
        checkType(node);
        return Collections.singletonList(FlexTypeEnum.INTEGER);
    }

    @Override
    public OptionalLong inferLength(PlannerNode node) throws QueryEvalException {
        SliceParameters p = readParameters(node);
        return OptionalLong.of(p.endIndex - p.beginIndex);
    }

    @Override
    public String repr(PlannerNode node) throws QueryEvalException {
        return describe(readParameters(node));
    }

    /**
     * 在当前切片基础上再取 [begin, end) 行
     */
    @Override
    public PlannerNode slice(PlannerNode node, long begin, long end) throws QueryEvalException {
        SliceParameters p = readParameters(node);
        long length = p.endIndex - p.beginIndex;
        if (begin < 0 || begin > end || end > length) {
            throw new InvalidPlanException("Invalid slice [" + begin + ":" + end + "] of "
                    + describe(p) + " with length " + length, TYPE, BEGIN_INDEX);
        }

        Map<String, FlexibleValue> replacements = new LinkedHashMap<>();
        replacements.put(BEGIN_INDEX, FlexibleValue.of(p.beginIndex + begin));
        replacements.put(END_INDEX, FlexibleValue.of(p.beginIndex + end));
        return node.withParameters(replacements);
    }

    private static void checkType(PlannerNode node) throws InvalidPlanException {
        if (node.getOperatorType() != TYPE) {
            throw new InvalidPlanException("Expected " + TYPE + " node but got " + node.getOperatorType(), TYPE);
        }
    }

    private static SliceParameters readParameters(PlannerNode node) throws QueryEvalException {
        checkType(node);
        if (!node.getInputs().isEmpty()) {
            throw new InvalidPlanException("Sequence is a source and takes no inputs, got "
                    + node.getInputs().size(), TYPE);
        }
        for (String name : node.getOperatorParameters().keySet()) {
            if (!PARAMETERS.contains(name)) {
                throw new InvalidPlanException("Unknown parameter for sequence: " + name, TYPE, name);
            }
        }

        SliceParameters p = new SliceParameters();
        p.start = integerParameter(node, START);
        p.beginIndex = integerParameter(node, BEGIN_INDEX);
        p.endIndex = integerParameter(node, END_INDEX);

        if (p.beginIndex < 0) {
            throw new InvalidPlanException("begin_index cannot be negative: " + p.beginIndex, TYPE, BEGIN_INDEX);
        }
        if (p.beginIndex > p.endIndex) {
            throw new InvalidPlanException("begin_index " + p.beginIndex + " is greater than end_index "
                    + p.endIndex, TYPE, BEGIN_INDEX);
        }
        return p;
    }

    private static long integerParameter(PlannerNode node, String name) throws QueryEvalException {
        FlexibleValue value = node.getParameter(name);
        if (value == null) {
            throw new InvalidPlanException("Missing parameter for sequence: " + name, TYPE, name);
        }
        try {
            return value.toInteger();
        } catch (TypeMismatchException e) {
            throw new TypeMismatchException("Parameter " + name + " of sequence must be an integer, got "
                    + value.getType(), TYPE, name, e);
        }
    }

    private static String describe(SliceParameters p) {
        return "Sequence(" + p.start + ")[" + p.beginIndex + ":" + p.endIndex + "]";
    }

    private static final class SliceParameters {
        private long start;
        private long beginIndex;
        private long endIndex;
    }
}
