package net.dbbeat.core.support;

import net.dbbeat.core.model.DispatchOptions;
import net.dbbeat.core.spi.TaskDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public final class RecordingDispatcher implements TaskDispatcher {
    public record Submission(String target, List<Object> args, Map<String, Object> kwargs, DispatchOptions options) {}

    private final List<Submission> submissions = new ArrayList<>();
    private final AtomicInteger seq = new AtomicInteger();

    @Override
    public synchronized String submit(String target, List<Object> args, Map<String, Object> kwargs, DispatchOptions options) {
        submissions.add(new Submission(target, args, kwargs, options));
        return "inv-" + seq.incrementAndGet();
    }

    public synchronized List<Submission> submissions() { return List.copyOf(submissions); }

    public synchronized long countFor(String target) {
        return submissions.stream().filter(s -> s.target().equals(target)).count();
    }
}
