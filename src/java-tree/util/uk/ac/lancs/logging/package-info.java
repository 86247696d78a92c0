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

/**
 * Provides facilities for generating formatted messages using the
 * standard logging framework.
 * 
 * <p>
 * To create a formatted logger, define an interface (usually a nested
 * private one) to extend {@link uk.ac.lancs.logging.FormattedLogger},
 * and define one method for each message format. Each method must
 * return {@code void} and throw no checked exceptions. Annotate each
 * method to indicate the format and logging level:
 * 
 * <pre>
 * public class PortWatcher {
 *   <var>...</var>
 *   
 *   private interface PrettyLogger extends FormattedLogger {
 *     &#64;Format("%s: port %d went %s")
 *     &#64;Detail(ShadowLevel.INFO)
 *     void portChanged(String dp, int port, String state);
 *
 *     &#64;Format("%s: rules not delivered")
 *     &#64;Detail(ShadowLevel.WARNING)
 *     void deliveryFailed(String dp, Throwable cause);
 *   }
 *   
 *   private static final PrettyLogger logger = FormattedLogger
 *     .get(PortWatcher.class.getName(), PrettyLogger.class);
 * }
 * </pre>
 * 
 * <p>
 * A {@link uk.ac.lancs.logging.Detail} annotation on the interface
 * itself sets the level of all messages that lack their own. If no
 * level is given, {@link java.util.logging.Level#INFO} is used. A
 * trailing {@link java.lang.Throwable} parameter is attached to the
 * record as its cause.
 * 
 * <p>
 * Now, when you write <code>logger.portChanged("s1", 3, "UP")</code>,
 * you're really writing:
 * 
 * <pre>
 * plainLogger.info(String.format("%s: port %d went %s", "s1", 3, "UP"));
 * </pre>
 * 
 * <p>
 * &hellip;where <code>plainLogger</code> is what you'd normally get
 * from {@link java.util.logging.Logger#getLogger}. The message string
 * is not constructed unless the message is to be logged.
 * 
 * @author simpsons
 */
package uk.ac.lancs.logging;
