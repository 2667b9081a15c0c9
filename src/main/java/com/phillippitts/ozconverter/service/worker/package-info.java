/**
 * Worker loops. Each worker takes jobs from the shared queue until it sees a sentinel.
 */
package com.phillippitts.ozconverter.service.worker;
