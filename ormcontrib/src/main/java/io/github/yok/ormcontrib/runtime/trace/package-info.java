/**
 * Trace listeners: console, SLF4J debug output and plain log files.
 */
package io.github.yok.ormcontrib.runtime.trace;
