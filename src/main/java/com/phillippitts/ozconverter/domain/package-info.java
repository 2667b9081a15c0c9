/**
 * Value types shared by the coordinator and the workers.
 *
 * <p>{@link com.phillippitts.ozconverter.domain.JobDescriptor} and
 * {@link com.phillippitts.ozconverter.domain.SettingsSnapshot} are the only data that travels to a worker.
 * {@link com.phillippitts.ozconverter.domain.JobState} never leaves the coordinator.
 */
package com.phillippitts.ozconverter.domain;
