/**
 * Spring wiring: thread pools, pool gauges and the routine registry.
 */
package com.phillippitts.ozconverter.config;
