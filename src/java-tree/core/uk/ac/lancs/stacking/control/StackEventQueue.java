/*
 * Copyright 2019, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */

package uk.ac.lancs.stacking.control;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Set;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Holds stack events until the event thread processes them, one at a
 * time in arrival order. Each event runs to completion before the next
 * starts, so the coordinator is never entered concurrently.
 * 
 * <p>
 * Periodic ticks are coalesced: while a tick of one kind is still
 * waiting, further ticks of that kind are dropped. A tick reads the
 * clock when it runs, so one late tick does the work of several.
 * 
 * @author simpsons
 */
final class StackEventQueue implements Runnable {
    /**
     * Identifies a periodic tick.
     */
    enum Tick {
        /**
         * Send keepalives and age out silent links.
         */
        PROBE,

        /**
         * Re-elect the root.
         */
        HEALTH;
    }

    private interface PrettyLogger extends FormattedLogger {
        @Format("stack event failed")
        @Detail(ShadowLevel.WARNING)
        void failed(Throwable t);

        @Format("%s event after shutdown discarded")
        @Detail(ShadowLevel.FINE)
        void discarded(String what);

        @Format("%s tick already pending")
        @Detail(ShadowLevel.FINEST)
        void coalesced(Tick tick);
    }

    private static final PrettyLogger logger = FormattedLogger
        .get(StackEventQueue.class.getName(), PrettyLogger.class);

    private final Deque<Runnable> events = new ArrayDeque<>();
    private final Set<Tick> pendingTicks = EnumSet.noneOf(Tick.class);
    private boolean running = true;
    private boolean busy;
    private long processed, failed, coalesced;

    /**
     * Queue an event.
     * 
     * @param what a short description, used if the event is discarded
     * 
     * @param event the action that delivers the event to the
     * coordinator
     * 
     * @return {@code true} if queued; {@code false} if the queue has
     * been shut down
     */
    synchronized boolean offer(String what, Runnable event) {
        if (!running) {
            logger.discarded(what);
            return false;
        }
        events.add(event);
        notifyAll();
        return true;
    }

    /**
     * Queue a tick, unless one of the same kind is already waiting.
     * 
     * @param tick the kind of tick
     * 
     * @param action the action that performs the tick
     * 
     * @return {@code true} if queued; {@code false} if coalesced with
     * a waiting tick or the queue has been shut down
     */
    synchronized boolean offerTick(Tick tick, Runnable action) {
        if (pendingTicks.contains(tick)) {
            coalesced++;
            logger.coalesced(tick);
            return false;
        }
        if (!offer(tick.name().toLowerCase(), () -> {
            synchronized (this) {
                pendingTicks.remove(tick);
            }
            action.run();
        })) return false;
        pendingTicks.add(tick);
        return true;
    }

    /**
     * Stop accepting events. Events already queued are still processed,
     * after which {@link #run()} returns.
     */
    synchronized void shutdown() {
        running = false;
        notifyAll();
    }

    /**
     * Wait until every event queued so far has been processed.
     * 
     * @throws InterruptedException if interrupted while waiting
     */
    synchronized void flush() throws InterruptedException {
        while (busy || !events.isEmpty())
            wait();
    }

    /**
     * Get the number of events processed, including failures.
     * 
     * @return the processed count
     */
    synchronized long processed() {
        return processed;
    }

    /**
     * Get the number of events that threw.
     * 
     * @return the failure count
     */
    synchronized long failed() {
        return failed;
    }

    /**
     * Get the number of ticks dropped because one of the same kind was
     * already waiting.
     * 
     * @return the coalesced count
     */
    synchronized long coalesced() {
        return coalesced;
    }

    private synchronized Runnable take(boolean ok) {
        if (busy) {
            processed++;
            if (!ok) failed++;
            busy = false;
            notifyAll();
        }
        while (running && events.isEmpty())
            try {
                wait();
            } catch (InterruptedException e) {
                /* Only shutdown ends the loop. */
            }
        if (events.isEmpty()) return null;
        busy = true;
        return events.poll();
    }

    /**
     * Process events until shut down and drained.
     */
    @Override
    public void run() {
        boolean ok = true;
        Runnable event;
        while ((event = take(ok)) != null) {
            try {
                event.run();
                ok = true;
            } catch (RuntimeException ex) {
                logger.failed(ex);
                ok = false;
            }
        }
    }
}
