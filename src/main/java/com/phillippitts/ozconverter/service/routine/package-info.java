/**
 * Conversion routines and the registry that looks them up by id.
 */
package com.phillippitts.ozconverter.service.routine;
