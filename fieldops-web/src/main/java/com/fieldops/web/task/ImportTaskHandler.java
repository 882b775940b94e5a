package com.fieldops.web.task;

import com.fieldops.tasks.queue.TaskHandler;
import com.fieldops.tasks.queue.TaskMessage;
import com.fieldops.web.service.BulkImportService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 队列中 bulk.import 任务的处理器。
 */
@Component
@RequiredArgsConstructor
public class ImportTaskHandler implements TaskHandler {

    private final BulkImportService importService;

    @Override
    public String taskType() {
        return BulkImportService.TASK_TYPE;
    }

    @Override
    public void handle(TaskMessage message) {
        importService.run(message.getJobId());
    }
}
