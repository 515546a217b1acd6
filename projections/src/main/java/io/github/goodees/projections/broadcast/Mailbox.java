package io.github.goodees.projections.broadcast;

/*-
 * #%L
 * projections
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue of notifications for a single listener. Runs at most one notification at a time, in the order they were
 * enqueued, on the executor of the {@link Delivery}.
 */
class Mailbox implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(Mailbox.class);

    private final String name;
    private final Executor executor;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();

    Mailbox(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    /**
     * Add a notification to the queue, and schedule the processing if the mailbox is idle.
     * @param notification the notification to run
     */
    void enqueue(Runnable notification) {
        queue.add(notification);
        if (canStartProcessing()) {
            schedule();
        }
    }

    private void schedule() {
        try {
            executor.execute(this);
        } catch (RejectedExecutionException e) {
            // mailbox is idle again, next enqueue retries with everything still queued
            enqueuesWhileBusy.set(0);
            logger.warn("Executor rejected delivery to listener of {}, {} notifications wait for next publish",
                    name, queue.size(), e);
        }
    }

    private boolean canStartProcessing() {
        int queueSize = enqueuesWhileBusy.getAndIncrement();
        if (queueSize == 0) {
            logger.trace("Will start processing mailbox of {}", name);
            return true;
        } else {
            return false;
        }
    }

    private boolean canStopProcessing(int observedEnqueues) {
        return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
    }

    /**
     * Run single notification and resubmit, so that listeners sharing an executor take turns.
     */
    @Override
    public void run() {
        Runnable notification = nextNotification();
        if (notification != null) {
            try {
                notification.run();
            } finally {
                schedule();
            }
        }
    }

    private Runnable nextNotification() {
        while (true) {
            int enqueues = enqueuesWhileBusy.get();
            Runnable notification = queue.poll();
            if (notification == null) {
                // a notification might have been enqueued after the poll; then the counter moved and we poll again
                if (canStopProcessing(enqueues)) {
                    logger.trace("Stopping processing of mailbox of {}", name);
                    return null;
                }
            } else {
                return notification;
            }
        }
    }
}
