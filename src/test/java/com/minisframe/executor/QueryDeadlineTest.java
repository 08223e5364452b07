package com.minisframe.executor;

import org.junit.jupiter.api.*;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 超时期限测试
 *
 * @author Mini-SFrame
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class QueryDeadlineTest {

    private ScheduledExecutorService timer;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    /**
     * 测试运行完成后才触发的超时不取消执行
     */
    @Test
    @Order(1)
    void testExpireAfterCompleteIsIgnored() {
        ExecutionState state = new ExecutionState();
        QueryDeadline deadline = new QueryDeadline(state, 50);

        assertTrue(deadline.complete());
        assertFalse(deadline.expire());
        assertFalse(state.isCancelled());
        assertNull(state.getFailure());
    }

    /**
     * 测试超时先生效时运行不能再标记为完成
     */
    @Test
    @Order(2)
    void testExpireBeforeComplete() {
        ExecutionState state = new ExecutionState();
        QueryDeadline deadline = new QueryDeadline(state, 50);

        assertTrue(deadline.expire());
        assertTrue(state.isCancelled());
        assertTrue(state.getFailure().getMessage().contains("timed out after 50 ms"));
        assertFalse(deadline.complete());
        assertFalse(deadline.expire());
    }

    /**
     * 测试登记的定时任务到期后取消执行
     */
    @Test
    @Order(3)
    void testArmedDeadlineFires() throws InterruptedException {
        ExecutionState state = new ExecutionState();
        QueryDeadline deadline = new QueryDeadline(state, 20);
        deadline.arm(timer);

        long waitUntil = System.currentTimeMillis() + 5000;
        while (!state.isCancelled() && System.currentTimeMillis() < waitUntil) {
            Thread.sleep(5);
        }
        assertTrue(state.isCancelled());
        assertFalse(deadline.complete());
    }

    /**
     * 测试完成并撤销后定时任务不再生效
     */
    @Test
    @Order(4)
    void testCompleteThenDisarm() throws InterruptedException {
        ExecutionState state = new ExecutionState();
        QueryDeadline deadline = new QueryDeadline(state, 30);
        deadline.arm(timer);

        assertTrue(deadline.complete());
        deadline.disarm();
        Thread.sleep(100);
        assertFalse(state.isCancelled());
    }

    /**
     * 测试超时为 0 时不登记定时任务
     */
    @Test
    @Order(5)
    void testZeroTimeoutNeverArms() throws InterruptedException {
        ExecutionState state = new ExecutionState();
        QueryDeadline deadline = new QueryDeadline(state, 0);
        deadline.arm(timer);
        deadline.disarm();

        Thread.sleep(20);
        assertFalse(state.isCancelled());
        assertTrue(deadline.complete());
    }
}
