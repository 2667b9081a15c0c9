/**
 * The per-job pipeline a worker runs: prepare, stage, convert, place, clean up.
 *
 * <p>Every job reports exactly {@value com.phillippitts.ozconverter.config.properties.EngineProperties#STAGE_COUNT}
 * stage events whatever its outcome; stages a failed job never reached are reported as {@code Failed}.
 * The workspace is released on every path.
 */
package com.phillippitts.ozconverter.service.pipeline;
