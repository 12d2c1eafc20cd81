/**
 * Runtime wiring package.
 *
 * <p>{@link io.rangekeeper.runtime.RangeKeeperRuntime} builds stores, credential engine,
 * lifecycle manager and reaper from one data root, and is the surface the request-handling
 * layer and the CLI call. It never lets an internal exception escape.
 */
package io.rangekeeper.runtime;
