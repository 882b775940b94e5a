package com.fieldops.web.task;

import com.fieldops.tasks.queue.TaskHandler;
import com.fieldops.tasks.queue.TaskMessage;
import com.fieldops.web.service.BulkExportService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ExportTaskHandler implements TaskHandler {

    private final BulkExportService exportService;

    @Override
    public String taskType() {
        return BulkExportService.TASK_TYPE;
    }

    @Override
    public void handle(TaskMessage message) {
        exportService.run(message.getJobId());
    }
}
