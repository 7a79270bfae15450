package org.dbsync.cli.service;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.dbsync.model.SnapshotModel;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches the source and target snapshots concurrently and returns once both
 * are available.
 */
@Slf4j
public class SnapshotLoader {

    @Value
    public static class Snapshots {
        SnapshotModel source;
        SnapshotModel target;
    }

    /**
     * @throws IntrospectionException when either side fails; the other side is cancelled
     */
    public Snapshots load(Callable<SnapshotModel> source, Callable<SnapshotModel> target) {
        ExecutorService executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "dbsync-snapshot");
            t.setDaemon(true);
            return t;
        });
        Future<SnapshotModel> sourceFuture = executor.submit(source);
        Future<SnapshotModel> targetFuture = executor.submit(target);
        try {
            SnapshotModel s = await(sourceFuture, "source");
            SnapshotModel t = await(targetFuture, "target");
            return new Snapshots(s, t);
        } finally {
            sourceFuture.cancel(true);
            targetFuture.cancel(true);
            executor.shutdownNow();
        }
    }

    private SnapshotModel await(Future<SnapshotModel> future, String side) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntrospectionException("Interrupted while loading the " + side + " snapshot", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.debug("Loading the {} snapshot failed", side, cause);
            if (cause instanceof IntrospectionException ie) {
                throw ie;
            }
            throw new IntrospectionException("Failed to load the " + side + " snapshot: " + cause.getMessage(), cause);
        }
    }
}
