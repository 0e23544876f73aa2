package io.taskrelay.testing;

import io.taskrelay.model.WorkerView;
import io.taskrelay.session.CaptureResult;
import io.taskrelay.session.DeliveryResult;
import io.taskrelay.session.SessionDriver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records what would have been typed into each worker's session.
 */
public final class FakeSessionDriver implements SessionDriver {
    private final Map<String, List<String>> injected = new ConcurrentHashMap<>();
    private final Map<String, List<String>> keys = new ConcurrentHashMap<>();
    private final Set<String> failing = new HashSet<>();

    public synchronized void failFor(String worker) {
        failing.add(worker);
    }

    public synchronized void recover(String worker) {
        failing.remove(worker);
    }

    public List<String> injected(String worker) {
        return injected.getOrDefault(worker, List.of());
    }

    public List<String> keys(String worker) {
        return keys.getOrDefault(worker, List.of());
    }

    @Override
    public synchronized DeliveryResult inject(WorkerView worker, String text) {
        if (failing.contains(worker.name())) {
            return DeliveryResult.fail("exit=1 can't find session: " + worker.session());
        }
        injected.computeIfAbsent(worker.name(), k -> new ArrayList<>()).add(text);
        return DeliveryResult.ok();
    }

    @Override
    public synchronized DeliveryResult sendKeys(WorkerView worker, List<String> sent) {
        if (failing.contains(worker.name())) {
            return DeliveryResult.fail("exit=1 can't find session: " + worker.session());
        }
        keys.computeIfAbsent(worker.name(), k -> new ArrayList<>()).addAll(sent);
        return DeliveryResult.ok();
    }

    @Override
    public synchronized CaptureResult capture(WorkerView worker, int lines) {
        if (failing.contains(worker.name())) {
            return CaptureResult.fail("exit=1 can't find session: " + worker.session());
        }
        return CaptureResult.ok("");
    }
}
