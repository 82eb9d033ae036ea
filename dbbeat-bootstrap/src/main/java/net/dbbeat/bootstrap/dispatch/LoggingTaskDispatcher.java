package net.dbbeat.bootstrap.dispatch;

import net.dbbeat.core.model.DispatchOptions;
import net.dbbeat.core.spi.TaskDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 큐 연동이 없을 때 쓰는 기본 dispatcher. 로그만 남기고 invocation id 를 만들어 준다.
 * 실제 브로커 연동은 TaskDispatcher 빈을 직접 등록해서 교체.
 */
public class LoggingTaskDispatcher implements TaskDispatcher {
    private static final Logger log = LoggerFactory.getLogger(LoggingTaskDispatcher.class);

    @Override
    public String submit(String target, List<Object> args, Map<String, Object> kwargs, DispatchOptions options) {
        String id = UUID.randomUUID().toString();
        log.info("submit {} args={} kwargs={} queue={} priority={} expires={} -> {}",
                target, args, kwargs, options.queue(), options.priority(), options.expires(), id);
        return id;
    }
}
