/**
 * Application exception hierarchy rooted at {@link com.phillippitts.ozconverter.exception.OzConverterException}.
 *
 * <p>None of these cross a job boundary. The job pipeline turns expected failures into
 * {@link com.phillippitts.ozconverter.domain.StageResult} values and the worker loop catches the rest.
 */
package com.phillippitts.ozconverter.exception;
