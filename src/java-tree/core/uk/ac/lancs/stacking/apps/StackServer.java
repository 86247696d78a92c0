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

package uk.ac.lancs.stacking.apps;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.http.ConnectionClosedException;
import org.apache.http.config.SocketConfig;
import org.apache.http.impl.bootstrap.HttpServer;
import org.apache.http.impl.bootstrap.ServerBootstrap;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;
import uk.ac.lancs.rest.RESTRequestHandlerMapper;
import uk.ac.lancs.stacking.config.StackConfigLoader;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.config.StackConfigurationException;
import uk.ac.lancs.stacking.control.StackControllerService;
import uk.ac.lancs.stacking.events.LoggingEventSink;
import uk.ac.lancs.stacking.metrics.StackMetrics;
import uk.ac.lancs.stacking.rest.RESTStackStatusServer;
import uk.ac.lancs.stacking.rules.FlowRuleDelta;

/**
 * Runs a stack controller from a configuration file, and serves its
 * status over HTTP.
 * 
 * @author simpsons
 */
public final class StackServer {
    private interface PrettyLogger extends FormattedLogger {
        @Format("%s: %s")
        @Detail(ShadowLevel.INFO)
        void delta(String datapath, FlowRuleDelta delta);

        @Format("status served on port %d")
        @Detail(ShadowLevel.INFO)
        void serving(int port);

        @Format("HTTP failure")
        @Detail(ShadowLevel.WARNING)
        void httpFailure(Throwable t);

        @Format("interrupted while stopping")
        @Detail(ShadowLevel.WARNING)
        void stopInterrupted(Throwable t);
    }

    private static final PrettyLogger logger =
        FormattedLogger.get(StackServer.class.getName(), PrettyLogger.class);

    private StackServer() {}

    private static void logDeltas(String datapath,
                                  List<FlowRuleDelta> deltas) {
        for (FlowRuleDelta delta : deltas)
            logger.delta(datapath, delta);
    }

    /**
     * Work out which configuration file to load.
     * 
     * @param args the command-line arguments
     * 
     * @param fallback the path to use if <samp>-f</samp> is not given,
     * or {@code null}
     * 
     * @return the path of the configuration file
     * 
     * @throws IllegalArgumentException if an argument is not
     * recognized, or if no file is named
     */
    static String configPath(String[] args, String fallback) {
        String confName = fallback;
        for (int argi = 0; argi < args.length; argi++) {
            String arg = args[argi];
            if (!"-f".equals(arg))
                throw new IllegalArgumentException("Unknown argument: "
                    + arg);
            if (argi + 1 >= args.length)
                throw new IllegalArgumentException("-f needs a file name");
            confName = args[++argi];
        }
        if (confName == null)
            throw new IllegalArgumentException("No configuration file");
        return confName;
    }

    /**
     * Runs a stack controller.
     * 
     * <p>
     * The following system properties are recognized:
     * 
     * <dl>
     * 
     * <dt><samp>stack.config.server</samp>
     * 
     * <dd>Specifies the path to the configuration file, unless
     * <samp>-f</samp> is given. Stacking configuration is taken from
     * keys prefixed by <samp>stack.</samp>, and the HTTP port from
     * <samp>rest.port</samp>, 4753 by default.
     * 
     * </dl>
     * 
     * @param args <samp>-f <var>config-file</var></samp> to name the
     * configuration file
     */
    public static void main(String[] args) {
        final String confName;
        try {
            confName = configPath(args,
                                  System.getProperty("stack.config.server"));
        } catch (IllegalArgumentException ex) {
            System.err.printf("%s%nUsage: -f <stack-config-file>"
                + " (or -Dstack.config.server=<stack-config-file>)%n",
                              ex.getMessage());
            System.exit(1);
            return;
        }
        Path conf = Paths.get(confName);
        try {
            ConfigurationContext configCtxt =
                new ConfigurationContext(System.getProperties());
            Configuration config = configCtxt.get(conf.toFile());
            StackConfiguration stack =
                StackConfigLoader.load(config.subview("stack"));
            int port = Integer.parseInt(config.get("rest.port", "4753"));

            StackMetrics metrics = new StackMetrics(new SimpleMeterRegistry());
            StackControllerService service =
                new StackControllerService(stack, metrics,
                                           new LoggingEventSink(),
                                           StackServer::logDeltas,
                                           System::currentTimeMillis);

            RESTRequestHandlerMapper mapper = new RESTRequestHandlerMapper();
            new RESTStackStatusServer(service::snapshot).bind(mapper,
                                                              "/stack");
            HttpServer webServer = ServerBootstrap.bootstrap()
                .setListenerPort(port).setServerInfo("StackStatus/1.0")
                .setSocketConfig(SocketConfig.custom().setTcpNoDelay(true)
                    .build())
                .setExceptionLogger((ex) -> {
                    if (ex instanceof ConnectionClosedException) return;
                    logger.httpFailure(ex);
                }).setHandlerMapper(mapper).create();

            service.start();
            webServer.start();
            logger.serving(port);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                webServer.shutdown(5, TimeUnit.SECONDS);
                try {
                    service.stop();
                } catch (InterruptedException ex) {
                    logger.stopInterrupted(ex);
                    Thread.currentThread().interrupt();
                }
            }, "stack-shutdown"));
        } catch (IOException | StackConfigurationException
            | NumberFormatException e) {
            e.printStackTrace();
            System.exit(1);
        }
    }
}
