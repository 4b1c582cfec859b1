/**
 * Unchecked exceptions raised by the analytics engine.
 *
 * <p>
 * Only {@link com.residencyinsight.core.exception.EmptyInputException} aborts
 * a pipeline run; every other failure stays local to the analyzer that raised
 * it and is recorded in the report.
 * </p>
 */
package com.residencyinsight.core.exception;
