package net.dbbeat.core.spi;

import net.dbbeat.core.model.DispatchOptions;

import java.util.List;
import java.util.Map;

/** Hands one invocation to the task queue. Fire-and-forget: never waits for the job to finish. */
public interface TaskDispatcher {
    /** @return the queue's invocation id */
    String submit(String target,
                  List<Object> args,
                  Map<String, Object> kwargs,
                  DispatchOptions options) throws Exception;
}
