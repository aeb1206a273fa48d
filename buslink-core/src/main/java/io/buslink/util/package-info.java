/**
 * Small helpers shared across the client: thread naming, name syntax checks and the
 * conversions between application values and wire-safe values.
 */
package io.buslink.util;
