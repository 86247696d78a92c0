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

import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.config.StackTiming;
import uk.ac.lancs.stacking.events.StackEventSink;
import uk.ac.lancs.stacking.link.Keepalive;
import uk.ac.lancs.stacking.metrics.StackMetrics;
import uk.ac.lancs.stacking.rules.FlowRuleSink;

/**
 * Runs a stack coordinator on its own thread, feeding it events from
 * any thread and ticking it periodically. Probes are sent every probe
 * interval, and the root is re-elected every health interval. Events
 * reported after {@link #stop()} are logged and discarded.
 * 
 * @author simpsons
 */
public final class StackControllerService {
    private interface PrettyLogger extends FormattedLogger {
        @Format("stack controller started: probe every %dms,"
            + " health check every %dms")
        @Detail(ShadowLevel.INFO)
        void started(long probeInterval, long healthInterval);

        @Format("stack controller stopped")
        @Detail(ShadowLevel.INFO)
        void stopped();
    }

    private static final PrettyLogger logger = FormattedLogger
        .get(StackControllerService.class.getName(), PrettyLogger.class);

    private final StackCoordinator coordinator;
    private final StackTiming timing;
    private final LongSupplier clock;
    private final StackEventQueue queue = new StackEventQueue();
    private final Thread thread;
    private final ScheduledExecutorService timer;

    /**
     * Prepare to run a stack.
     * 
     * @param config the stack's configuration
     * 
     * @param metrics the metrics to record in
     * 
     * @param events the recipient of notifications
     * 
     * @param sink the recipient of rule changes
     * 
     * @param clock the source of the current time in milliseconds
     */
    public StackControllerService(StackConfiguration config,
                                  StackMetrics metrics,
                                  StackEventSink events, FlowRuleSink sink,
                                  LongSupplier clock) {
        this.coordinator = new StackCoordinator(config, metrics, events, sink);
        this.timing = config.timing();
        this.clock = clock;
        this.thread = new Thread(queue, "stack-events");
        this.thread.setDaemon(true);
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stack-ticks");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start processing events and ticking.
     */
    public void start() {
        thread.start();
        timer.scheduleAtFixedRate(() -> queue
            .offerTick(StackEventQueue.Tick.PROBE,
                       () -> coordinator.probeTick(clock.getAsLong())),
                                  timing.probeInterval(),
                                  timing.probeInterval(),
                                  TimeUnit.MILLISECONDS);
        timer.scheduleAtFixedRate(() -> queue
            .offerTick(StackEventQueue.Tick.HEALTH,
                       () -> coordinator.healthTick(clock.getAsLong())),
                                  timing.healthInterval(),
                                  timing.healthInterval(),
                                  TimeUnit.MILLISECONDS);
        logger.started(timing.probeInterval(), timing.healthInterval());
    }

    /**
     * Stop ticking, and wait for queued events to be processed.
     * 
     * @throws InterruptedException if interrupted while waiting
     */
    public void stop() throws InterruptedException {
        timer.shutdownNow();
        queue.shutdown();
        thread.join();
        logger.stopped();
    }

    /**
     * Wait until all events submitted so far have been processed.
     * 
     * @throws InterruptedException if interrupted while waiting
     */
    public void flush() throws InterruptedException {
        queue.flush();
    }

    /**
     * Report that a datapath has connected.
     * 
     * @param datapath the datapath name
     * 
     * @param upPorts the datapath's ports that are physically up
     */
    public void datapathConnected(String datapath,
                                  Collection<Integer> upPorts) {
        Collection<Integer> ports = new ArrayList<>(upPorts);
        queue.offer("connect " + datapath, () -> coordinator
            .datapathConnected(datapath, ports, clock.getAsLong()));
    }

    /**
     * Report that a datapath has disconnected.
     * 
     * @param datapath the datapath name
     */
    public void datapathDisconnected(String datapath) {
        queue.offer("disconnect " + datapath, () -> coordinator
            .datapathDisconnected(datapath, clock.getAsLong()));
    }

    /**
     * Report that the controller has heard from a datapath.
     * 
     * @param datapath the datapath name
     */
    public void datapathLive(String datapath) {
        queue.offer("live " + datapath, () -> coordinator
            .datapathLive(datapath, clock.getAsLong()));
    }

    /**
     * Report a received keepalive probe.
     * 
     * @param probe the probe
     */
    public void keepalive(Keepalive probe) {
        queue.offer("keepalive", () -> coordinator.keepalive(probe));
    }

    /**
     * Report a change of physical port status.
     * 
     * @param port the port
     * 
     * @param up whether the port is now up
     */
    public void portStatus(PortRef port, boolean up) {
        queue.offer("port " + port, () -> coordinator
            .portStatus(port, up, clock.getAsLong()));
    }

    /**
     * Get the state of the stack after the last processed event.
     * 
     * @return the latest snapshot
     */
    public TopologySnapshot snapshot() {
        return coordinator.snapshot();
    }
}
