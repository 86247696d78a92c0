/*
 * Copyright 2017, Regents of the University of Lancaster
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
 * Loads configuration from properties files whose entries may pull in
 * other files.
 * 
 * <p>
 * A {@link Configuration} is a view over properties. A subview
 * narrows it to the keys under a prefix, so a stack controller hands
 * <samp>stack</samp> to its loader, and the loader hands
 * <samp>dp.s1</samp> to the code reading one datapath.
 * 
 * <p>
 * A key ending in <samp>inherit</samp> names one or more files,
 * resolved against the file containing it. Their properties appear
 * under the directive's own prefix, and the directive itself is
 * hidden. A fragment selects part of a file, so
 * <samp>timing.properties#lab</samp> brings in only its keys under
 * <samp>lab.</samp>. For example, several stacks may share probe timing
 * with:
 * 
 * <pre>
 * stack.timing.inherit=timing.properties
 * </pre>
 * 
 * <p>
 * Properties given directly hide inherited ones, and earlier files
 * hide later ones. A {@link ConfigurationContext} caches what it has
 * loaded, so a file inherited twice is read once. In-memory properties
 * can be wrapped with
 * {@link ConfigurationContext#get(java.util.Properties)}, but cannot
 * inherit.
 * 
 * @author simpsons
 */
package uk.ac.lancs.config;
