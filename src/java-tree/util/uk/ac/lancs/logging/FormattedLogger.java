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

package uk.ac.lancs.logging;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Formats log messages.
 * 
 * @author simpsons
 */
public interface FormattedLogger {
    /**
     * Get the unformatted logger that supports this formatted logger.
     * 
     * @return the supporting unformatted logger
     */
    Logger base();

    /**
     * Get a formatted logger for a given type, basing it on the named
     * logger. It is equivalent to:
     * 
     * <pre>
     * FormattedLogger.{@linkplain #get(Logger, Class) get}({@linkplain Logger#getLogger(String) Logger.getLogger}(name), type)
     * </pre>
     * 
     * @param name the logger name, to be supplied to
     * {@link Logger#getLogger(String)}
     * 
     * @param type the formatted type
     * 
     * @return the requested formatted logger
     */
    public static <T extends FormattedLogger> T get(String name,
                                                    Class<T> type) {
        return get(Logger.getLogger(name), type);
    }

    /**
     * Get a formatted logger for a given type, basing it on the given
     * logger. If the last parameter of a message method is a
     * {@link Throwable}, a non-{@code null} argument in that position
     * is attached to the log record, as well as being available to the
     * format.
     * 
     * @param logger the base logger that the formatted logger will
     * delegate to
     * 
     * @param type the interface type annotated with the message formats
     * 
     * @return the requested formatted logger
     * 
     * @throws IllegalArgumentException if a method of the type does not
     * return {@code void}, declares checked exceptions, or has no
     * {@link Format} annotation
     */
    public static <T extends FormattedLogger> T get(Logger logger,
                                                    Class<T> type) {
        /* Map each declared message to a handle bound to this logger,
         * its level and its format. */
        Map<Method, MethodHandle> translation = new HashMap<>();
        for (Method cand : type.getMethods()) {
            if (cand.equals(Statics.baseMethod)) continue;
            if (Modifier.isStatic(cand.getModifiers())) continue;

            /* Abort if the method returns a value or throws a checked
             * exception. */
            if (cand.getReturnType() != Void.TYPE)
                throw new IllegalArgumentException("method " + cand
                    + " does not return void but " + cand.getReturnType());
            if (cand.getExceptionTypes().length > 0)
                throw new IllegalArgumentException("method " + cand
                    + " throws");

            /* Abort if the method has no format. */
            Format m = cand.getAnnotation(Format.class);
            if (m == null) throw new IllegalArgumentException("method " + cand
                + " not a log message");
            String fmt = m.value();

            /* Determine the log level for this message, using the
             * declaring interface type's setting as a default. */
            Detail detail = cand.getAnnotation(Detail.class);
            Detail typeDetail =
                cand.getDeclaringClass().getAnnotation(Detail.class);
            final Level lvl;
            if (detail != null)
                lvl = detail.value().level;
            else if (typeDetail != null)
                lvl = typeDetail.value().level;
            else
                lvl = Level.INFO;

            Class<?>[] params = cand.getParameterTypes();
            boolean thrown = params.length > 0 && Throwable.class
                .isAssignableFrom(params[params.length - 1]);

            MethodHandle act = MethodHandles
                .insertArguments(Statics.logHandle, 0, logger, lvl, fmt,
                                 thrown);
            translation.put(cand, act);
        }

        /* Create a proxy that invokes the handle corresponding to the
         * invoked method. */
        InvocationHandler actions = new InvocationHandler() {
            @Override
            public Object invoke(Object proxy, Method meth, Object[] args)
                throws Throwable {
                if (meth.equals(Statics.baseMethod)) return logger;
                MethodHandle act = translation.get(meth);
                if (act != null) {
                    act.invoke(args == null ? Statics.NO_ARGS : args);
                    return null;
                }
                switch (meth.getName()) {
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "equals":
                    return proxy == args[0];
                case "toString":
                    return type.getSimpleName() + "[" + logger.getName()
                        + "]";
                default:
                    throw new UnsupportedOperationException(meth
                        .toString());
                }
            }
        };
        return type
            .cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]
            { type }, actions));
    }
}
