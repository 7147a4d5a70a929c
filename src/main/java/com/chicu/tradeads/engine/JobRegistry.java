package com.chicu.tradeads.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongFunction;

/**
 * Реестр запущенных объявлений: id → {@link RunnerHandle}.
 *
 * Все операции короткие и под одним локом; лок никогда не держится
 * во время сетевого вызова или ожидания таймера.
 * Инвариант: на один id не больше одной записи, и её поколение совпадает
 * с поколением живого цикла.
 */
final class JobRegistry {

    private final Object lock = new Object();
    private final Map<String, RunnerHandle> runners = new HashMap<>();
    private final GenerationCounter generations;

    JobRegistry(GenerationCounter generations) {
        this.generations = generations;
    }

    /**
     * Атомарно занять слот: поколение выдаётся и запись вставляется до запуска задачи.
     *
     * @param factory строит handle по выданному поколению
     * @return handle, либо пусто если id уже занят
     */
    Optional<RunnerHandle> reserve(String id, LongFunction<RunnerHandle> factory) {
        synchronized (lock) {
            if (runners.containsKey(id)) {
                return Optional.empty();
            }
            RunnerHandle handle = factory.apply(generations.next());
            runners.put(id, handle);
            return Optional.of(handle);
        }
    }

    /**
     * Самоудаление выходящего цикла. Удаляет только если поколение всё ещё его:
     * устаревший cleanup после stop → start не должен снести новую запись.
     */
    boolean removeIfCurrent(String id, long generation) {
        synchronized (lock) {
            RunnerHandle current = runners.get(id);
            if (current == null || current.generation() != generation) {
                return false;
            }
            runners.remove(id);
            return true;
        }
    }

    /**
     * Остановка снаружи: удаляем без проверки поколения и шлём сигнал.
     *
     * @return была ли запись
     */
    boolean cancel(String id) {
        RunnerHandle handle;
        synchronized (lock) {
            handle = runners.remove(id);
        }
        if (handle == null) {
            return false;
        }
        handle.signal().cancel();
        return true;
    }

    int cancelAll() {
        List<RunnerHandle> drained;
        synchronized (lock) {
            drained = new ArrayList<>(runners.values());
            runners.clear();
        }
        drained.forEach(h -> h.signal().cancel());
        return drained.size();
    }

    Set<String> list() {
        synchronized (lock) {
            return Set.copyOf(runners.keySet());
        }
    }

    boolean contains(String id) {
        synchronized (lock) {
            return runners.containsKey(id);
        }
    }

    Optional<RunnerHandle> get(String id) {
        synchronized (lock) {
            return Optional.ofNullable(runners.get(id));
        }
    }

    Map<String, RunnerHandle> snapshot() {
        synchronized (lock) {
            return Map.copyOf(runners);
        }
    }
}
