package com.fieldops.tasks.queue;

import com.fieldops.tasks.config.TasksProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTaskQueueTest {

    private final List<String> handled = new CopyOnWriteArrayList<>();
    private final CountDownLatch latch = new CountDownLatch(2);

    private TaskDispatcher dispatcher;
    private InMemoryTaskQueue queue;

    @BeforeEach
    void setUp() {
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("recording", new TaskHandler() {
            @Override
            public String taskType() {
                return "bulk.import";
            }

            @Override
            public void handle(TaskMessage message) {
                handled.add(message.getJobId());
                latch.countDown();
            }
        });
        beans.addBean("failing", new TaskHandler() {
            @Override
            public String taskType() {
                return "bulk.export";
            }

            @Override
            public void handle(TaskMessage message) {
                throw new IllegalStateException("boom");
            }
        });
        dispatcher = new TaskDispatcher(beans.getBeanProvider(TaskHandler.class));

        TasksProperties properties = new TasksProperties();
        properties.setWorkerThreads(1);
        queue = new InMemoryTaskQueue(dispatcher, properties);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    @Test
    void enqueue_shouldRunHandlerOnWorkerThread() throws InterruptedException {
        queue.enqueue(TaskMessage.of("bulk.import", "job-1"));
        queue.enqueue(TaskMessage.of("bulk.import", "job-2"));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(handled).containsExactly("job-1", "job-2");
    }

    @Test
    void enqueue_shouldKeepWorkingAfterHandlerFailure() throws InterruptedException {
        queue.enqueue(TaskMessage.of("bulk.export", "bad"));
        queue.enqueue(TaskMessage.of("bulk.import", "job-1"));
        queue.enqueue(TaskMessage.of("bulk.import", "job-2"));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(handled).containsExactly("job-1", "job-2");
    }

    @Test
    void dispatch_shouldReportUnknownTaskType() {
        assertThat(dispatcher.dispatch(TaskMessage.of("unknown", "x"))).isFalse();
        assertThat(dispatcher.dispatch(TaskMessage.of("bulk.export", "x"))).isFalse();
    }
}
