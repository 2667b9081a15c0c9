/**
 * Batch bookkeeping on the coordinator side.
 *
 * <p>{@link com.phillippitts.ozconverter.service.coordinator.BatchCoordinator} is the only writer of job
 * state. Workers communicate with it through the results channel alone.
 */
package com.phillippitts.ozconverter.service.coordinator;
