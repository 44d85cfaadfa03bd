package com.realtime.messaging.gateway;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 그룹별 단일 writer. 같은 그룹 키로 제출된 작업은 제출 순서대로 하나씩 실행되고,
 * 서로 다른 그룹은 공유 executor 위에서 병렬로 돈다.
 *
 * <p>작업 안에서 같은 그룹으로 다시 제출해도 된다(현재 작업 뒤에 줄 선다).
 * 큐가 비고 실행 중이 아닌 lane은 맵에서 제거된다.
 */
@Component
@Slf4j
public class GroupSequencer {

    private final Executor executor;
    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public GroupSequencer(@Qualifier("chatExecutor") Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(String groupKey, Runnable task) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (shutdown) {
            done.completeExceptionally(new RejectedExecutionException("sequencer is shut down"));
            return done;
        }
        Job job = new Job(task, done);
        // 추가와 빈 lane 제거가 같은 키 위에서 원자적으로 일어나도록 compute 안에서 넣는다
        Lane lane = lanes.compute(groupKey, (k, existing) -> {
            Lane target = existing == null ? new Lane(k) : existing;
            target.queue.add(job);
            return target;
        });
        lane.schedule();
        return done;
    }

    /** 살아있는 lane 수 (진단용) */
    public int activeLanes() {
        return lanes.size();
    }

    /** 대기 중인 작업 수 (진단용) */
    public int pending(String groupKey) {
        Lane lane = lanes.get(groupKey);
        return lane == null ? 0 : lane.queue.size();
    }

    @PreDestroy
    public void shutdown() {
        shutdown = true;
        int dropped = 0;
        for (Lane lane : lanes.values()) {
            Job job;
            while ((job = lane.queue.poll()) != null) {
                job.done.completeExceptionally(new RejectedExecutionException("sequencer is shut down"));
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("sequencer shut down with {} pending task(s)", dropped);
        }
    }

    private record Job(Runnable task, CompletableFuture<Void> done) {}

    private final class Lane {
        private final String key;
        private final Queue<Job> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean();

        private Lane(String key) {
            this.key = key;
        }

        void schedule() {
            if (!scheduled.compareAndSet(false, true)) return;
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                scheduled.set(false);
                log.error("group lane rejected by executor: group={}", key, e);
                failAll(e);
                retireIfIdle();
            }
        }

        private void drain() {
            Job job;
            while ((job = queue.poll()) != null) {
                try {
                    job.task.run();
                    job.done.complete(null);
                } catch (RuntimeException e) {
                    log.error("group task failed: group={}", key, e);
                    job.done.completeExceptionally(e);
                }
            }
            scheduled.set(false);
            // set(false)와 add 사이에 들어온 작업
            if (!queue.isEmpty()) {
                schedule();
                return;
            }
            retireIfIdle();
        }

        private void retireIfIdle() {
            lanes.computeIfPresent(key, (k, l) -> l == this && queue.isEmpty() && !scheduled.get() ? null : l);
        }

        private void failAll(Throwable cause) {
            Job job;
            while ((job = queue.poll()) != null) {
                job.done.completeExceptionally(cause);
            }
        }
    }
}
