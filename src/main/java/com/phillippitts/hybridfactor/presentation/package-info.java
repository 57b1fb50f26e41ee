/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.hybridfactor.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.hybridfactor.presentation;
