package net.dbbeat.bootstrap.dispatch;

import net.dbbeat.adapter.jdbc.JsonColumns;
import net.dbbeat.core.model.DispatchOptions;
import net.dbbeat.core.model.RunStatus;
import net.dbbeat.core.service.RunRecordService;
import net.dbbeat.core.spi.TaskDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/** 제출이 받아들여지면 PENDING run record 를 남기는 데코레이터 */
public class RunRecordingTaskDispatcher implements TaskDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RunRecordingTaskDispatcher.class);

    private final TaskDispatcher delegate;
    private final RunRecordService runRecords;
    private final JsonColumns json;

    public RunRecordingTaskDispatcher(TaskDispatcher delegate, RunRecordService runRecords, JsonColumns json) {
        this.delegate = delegate;
        this.runRecords = runRecords;
        this.json = json;
    }

    @Override
    public String submit(String target, List<Object> args, Map<String, Object> kwargs,
                         DispatchOptions options) throws Exception {
        String invocationId = delegate.submit(target, args, kwargs, options);
        if (invocationId == null) return null;
        try {
            runRecords.recordState(invocationId, target, RunStatus.PENDING,
                    json.write(args), json.write(kwargs), null, null, null);
        } catch (Exception e) {
            // 이미 큐에 들어갔으므로 기록 실패로 제출을 되돌리지 않는다
            log.warn("run record for {} ({}) could not be written: {}", target, invocationId, e.toString());
        }
        return invocationId;
    }

    public TaskDispatcher delegate() {
        return delegate;
    }
}
